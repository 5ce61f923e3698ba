package io.dataeval.api;

/**
 * Base exception for all data evaluation failures.
 *
 * <p>Every failure is terminal for the call that raised it: callers should treat the source as
 * rejected and untrusted. No subclass signals a process-level condition.
 */
public class DataEvalException extends RuntimeException {
  private final String context;
  private final String errorCode;

  public DataEvalException(String message) {
    this(message, null, null);
  }

  public DataEvalException(String message, Throwable cause) {
    this(message, cause, null, null);
  }

  public DataEvalException(String message, String context, String errorCode) {
    this(message, null, context, errorCode);
  }

  public DataEvalException(String message, Throwable cause, String context, String errorCode) {
    super(formatMessage(message, context, errorCode), cause);
    this.context = context;
    this.errorCode = errorCode;
  }

  private static String formatMessage(String message, String context, String errorCode) {
    StringBuilder sb = new StringBuilder(message);
    if (context != null) {
      sb.append(" [Context: ").append(context).append("]");
    }
    if (errorCode != null) {
      sb.append(" [Error Code: ").append(errorCode).append("]");
    }
    return sb.toString();
  }

  public String getContext() {
    return context;
  }

  public String getErrorCode() {
    return errorCode;
  }
}
