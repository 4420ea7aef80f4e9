package com.example.dbplugin.core.errors;

/**
 * A rendered statement failed to execute. The enclosing transaction has been rolled back by the
 * time this is thrown.
 */
public class StatementExecutionException extends DatabasePluginException {

  private final int statementIndex;

  public StatementExecutionException(final int statementIndex, final Throwable cause) {
    this(statementIndex, "failed to execute statement " + statementIndex, cause);
  }

  private StatementExecutionException(
      final int statementIndex, final String message, final Throwable cause) {
    super(message, cause);
    this.statementIndex = statementIndex;
  }

  /**
   * Zero-based position of the failing statement in the rendered sequence.
   *
   * @return statement index
   */
  public int statementIndex() {
    return statementIndex;
  }

  @Override
  protected DatabasePluginException copyWithMessage(final String message) {
    return new StatementExecutionException(statementIndex, message, null);
  }
}
