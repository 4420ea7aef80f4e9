package com.example.dbplugin.core.errors;

/** Malformed or missing required input. Never retried; surfaced to the caller as is. */
public class ValidationException extends DatabasePluginException {

  public ValidationException(final String message) {
    super(message);
  }

  public ValidationException(final String message, final Throwable cause) {
    super(message, cause);
  }

  @Override
  protected DatabasePluginException copyWithMessage(final String message) {
    return new ValidationException(message);
  }
}
