package com.example.dbplugin.core.contract;

import com.example.dbplugin.core.contract.DatabaseService.Method;
import com.example.dbplugin.core.errors.UnimplementedOperationException;

/**
 * Base class for backends that implement only part of the contract. Every operation not overridden
 * fails with {@link UnimplementedOperationException} instead of silently succeeding.
 */
public abstract class UnimplementedDatabase implements Database {

  @Override
  public InitializeResponse initialize(final CallContext ctx, final InitializeRequest request) {
    throw unimplemented(Method.INITIALIZE);
  }

  @Override
  public NewUserResponse newUser(final CallContext ctx, final NewUserRequest request) {
    throw unimplemented(Method.NEW_USER);
  }

  @Override
  public void updateUser(final CallContext ctx, final UpdateUserRequest request) {
    throw unimplemented(Method.UPDATE_USER);
  }

  @Override
  public void deleteUser(final CallContext ctx, final DeleteUserRequest request) {
    throw unimplemented(Method.DELETE_USER);
  }

  @Override
  public String type() {
    throw unimplemented(Method.TYPE);
  }

  @Override
  public void close() {
    throw unimplemented(Method.CLOSE);
  }

  private static UnimplementedOperationException unimplemented(final Method method) {
    return new UnimplementedOperationException(method.methodName());
  }
}
