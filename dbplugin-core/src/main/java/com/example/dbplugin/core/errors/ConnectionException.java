package com.example.dbplugin.core.errors;

/**
 * The backend could not be reached or the plugin has no usable connection. Callers may retry after
 * a backoff.
 */
public class ConnectionException extends DatabasePluginException {

  public ConnectionException(final String message) {
    super(message);
  }

  public ConnectionException(final String message, final Throwable cause) {
    super(message, cause);
  }

  @Override
  protected DatabasePluginException copyWithMessage(final String message) {
    return new ConnectionException(message);
  }
}
