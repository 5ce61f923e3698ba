/**
 * Immutable value model produced by evaluation, with {@link io.dataeval.value.LiteralWriter} to
 * render values back to source text and {@link io.dataeval.value.Values} to convert to and from
 * plain Java objects.
 */
package io.dataeval.value;
