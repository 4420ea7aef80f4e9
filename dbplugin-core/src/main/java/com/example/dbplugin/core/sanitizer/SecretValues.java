package com.example.dbplugin.core.sanitizer;

import java.util.Map;

/** Source of the secret values that must never appear in an error leaving the plugin. */
@FunctionalInterface
public interface SecretValues {

  /**
   * Current secret values mapped to the placeholder that replaces them, e.g. {@code "hunter2" ->
   * "[password]"}.
   *
   * @return secret to placeholder map, possibly empty
   */
  Map<String, String> secretValues();
}
