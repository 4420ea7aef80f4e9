package com.example.dbplugin.core.errors;

/** The caller cancelled the operation or its deadline passed. Not a backend fault. */
public class OperationCancelledException extends DatabasePluginException {

  public OperationCancelledException(final String message) {
    super(message);
  }

  public OperationCancelledException(final String message, final Throwable cause) {
    super(message, cause);
  }

  @Override
  protected DatabasePluginException copyWithMessage(final String message) {
    return new OperationCancelledException(message);
  }
}
