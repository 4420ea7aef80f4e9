package com.example.dbplugin.core.errors;

/**
 * Beginning, committing or rolling back a transaction failed. The whole operation must be retried
 * by the caller.
 */
public class TransactionException extends DatabasePluginException {

  public TransactionException(final String message) {
    super(message);
  }

  public TransactionException(final String message, final Throwable cause) {
    super(message, cause);
  }

  @Override
  protected DatabasePluginException copyWithMessage(final String message) {
    return new TransactionException(message);
  }
}
