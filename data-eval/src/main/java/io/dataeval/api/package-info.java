/**
 * Public API for evaluating literal data expressions.
 *
 * <p><b>Accepted sources</b>
 *
 * <ul>
 *   <li><b>Text</b>: any {@link java.lang.CharSequence} holding a literal expression such as
 *       {@code {'name': 'x', 'when': datetime(2024, 1, 1)}}.
 *   <li><b>Mappings</b>: a {@link io.dataeval.value.DictValue} or {@link java.util.Map} is passed
 *       through unchanged.
 * </ul>
 *
 * <p><b>Failures</b>
 *
 * <ul>
 *   <li>{@link io.dataeval.api.InvalidInputTypeException}: the source is neither text nor a
 *       mapping.
 *   <li>{@link io.dataeval.api.EvalSyntaxException}: the text is not a well-formed expression.
 *   <li>{@link io.dataeval.api.UnsafeSourceException}: the text uses identifiers, operators or
 *       callables outside the literal language. {@link io.dataeval.api.ConstructionException}
 *       narrows this to a whitelisted constructor rejecting its arguments.
 * </ul>
 *
 * <p><b>Example</b>
 *
 * <pre>{@code
 * DataEval eval = DataEval.create(EvalConfig.fromSystemProperties());
 * Value v = eval.evaluate("{'retries': 3, 'timeout': timedelta(seconds=30)}");
 * Map<Object, Object> plain = (Map<Object, Object>) Values.toJava(v);
 * }</pre>
 */
package io.dataeval.api;
