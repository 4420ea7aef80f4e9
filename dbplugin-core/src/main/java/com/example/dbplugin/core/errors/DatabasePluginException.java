package com.example.dbplugin.core.errors;

import java.util.function.UnaryOperator;

/**
 * Base type for every failure a database plugin reports across its boundary.
 *
 * <p>Subclasses map one-to-one onto the failure signals of the plugin contract. Each can produce a
 * copy of itself with a rewritten message so that secret values can be stripped before the error
 * leaves the plugin, without losing the error's kind.
 */
public abstract class DatabasePluginException extends RuntimeException {

  protected DatabasePluginException(final String message) {
    super(message);
  }

  protected DatabasePluginException(final String message, final Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns a copy of this exception whose message, and the messages of its cause chain, have been
   * passed through {@code redactor}. The copy carries no cause, so nothing unredacted survives.
   *
   * @param redactor rewrites message text
   * @return redacted copy of the same kind
   */
  public final DatabasePluginException redact(final UnaryOperator<String> redactor) {
    final var copy = copyWithMessage(redactor.apply(describe(this)));
    copy.setStackTrace(getStackTrace());
    return copy;
  }

  /**
   * Creates an exception of the same concrete type carrying {@code message}.
   *
   * @param message replacement message
   * @return new instance
   */
  protected abstract DatabasePluginException copyWithMessage(String message);

  private static String describe(final Throwable t) {
    final var sb = new StringBuilder(String.valueOf(t.getMessage()));
    var cause = t.getCause();
    while (cause != null && cause != t) {
      final var msg = cause.getMessage();
      if (msg != null && !sb.toString().contains(msg)) sb.append(": ").append(msg);
      cause = cause.getCause();
    }
    return sb.toString();
  }
}
