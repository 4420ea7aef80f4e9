package com.example.dbplugin.core.contract;

/**
 * Identity of the plugin service on the wire. The host addresses every call with the full method
 * name so it can detect a plugin built against a different contract version.
 */
public final class DatabaseService {

  /** Contract version. */
  public static final int VERSION = 5;

  /** Fully qualified service name. */
  public static final String SERVICE_NAME = "dbplugin.v" + VERSION + ".Database";

  private DatabaseService() {}

  /** Unary operations of the contract. */
  public enum Method {
    INITIALIZE("Initialize"),
    NEW_USER("NewUser"),
    UPDATE_USER("UpdateUser"),
    DELETE_USER("DeleteUser"),
    TYPE("Type"),
    CLOSE("Close");

    private final String methodName;

    Method(final String methodName) {
      this.methodName = methodName;
    }

    public String methodName() {
      return methodName;
    }

    /**
     * Wire address of the method, e.g. {@code /dbplugin.v5.Database/NewUser}.
     *
     * @return full method name
     */
    public String fullName() {
      return "/" + SERVICE_NAME + "/" + methodName;
    }
  }
}
