package com.example.dbplugin.core.errors;

/**
 * Signals that a backend does not implement an operation of the plugin contract. Distinct from
 * every other failure so the host never mistakes it for success or for a backend fault.
 */
public class UnimplementedOperationException extends DatabasePluginException {

  public UnimplementedOperationException(final String methodName) {
    super("method " + methodName + " not implemented");
  }

  private UnimplementedOperationException(final String message, final boolean raw) {
    super(message);
  }

  @Override
  protected DatabasePluginException copyWithMessage(final String message) {
    return new UnimplementedOperationException(message, true);
  }
}
