package io.dataeval.api;

import io.dataeval.syntax.Parser;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Evaluation settings.
 *
 * @param maxDepth maximum nesting depth of the expression; deeper input is a syntax error
 * @param callables names the standard whitelist is restricted to, or {@code null} for all of them
 */
public record EvalConfig(int maxDepth, Set<String> callables) {
  public static final String MAX_DEPTH_KEY = "dataeval.maxDepth";
  public static final String CALLABLES_KEY = "dataeval.callables";

  public EvalConfig {
    if (maxDepth < 1) {
      throw new IllegalArgumentException(MAX_DEPTH_KEY + " must be positive: " + maxDepth);
    }
    if (callables != null) {
      callables = Collections.unmodifiableSet(new LinkedHashSet<>(callables));
    }
  }

  /**
   * Creates the default configuration: depth limit 100, the full standard whitelist.
   *
   * @return default configuration
   */
  public static EvalConfig defaults() {
    return new EvalConfig(Parser.DEFAULT_MAX_DEPTH, null);
  }

  public EvalConfig withMaxDepth(int maxDepth) {
    return new EvalConfig(maxDepth, callables);
  }

  public EvalConfig withCallables(Set<String> callables) {
    return new EvalConfig(maxDepth, callables);
  }

  /**
   * Reads {@code dataeval.*} keys from system properties.
   *
   * @return configuration, with defaults for absent keys
   * @throws IllegalArgumentException if a value is malformed
   */
  public static EvalConfig fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  /**
   * Converts properties to a configuration.
   *
   * @param props properties to read
   * @return configuration, with defaults for absent keys
   * @throws IllegalArgumentException if a value is malformed
   */
  public static EvalConfig fromProperties(Properties props) {
    int maxDepth = Parser.DEFAULT_MAX_DEPTH;
    String depth = props.getProperty(MAX_DEPTH_KEY);
    if (depth != null && !depth.isBlank()) {
      try {
        maxDepth = Integer.parseInt(depth.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "Invalid value for " + MAX_DEPTH_KEY + ": '" + depth + "'", e);
      }
      if (maxDepth < 1) {
        throw new IllegalArgumentException(MAX_DEPTH_KEY + " must be positive: " + maxDepth);
      }
    }

    Set<String> callables = null;
    String list = props.getProperty(CALLABLES_KEY);
    if (list != null) {
      callables =
          Arrays.stream(list.split(","))
              .map(String::trim)
              .filter(s -> !s.isEmpty())
              .collect(Collectors.toCollection(LinkedHashSet::new));
    }
    return new EvalConfig(maxDepth, callables);
  }
}
