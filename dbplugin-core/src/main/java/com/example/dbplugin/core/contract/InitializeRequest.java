package com.example.dbplugin.core.contract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param config opaque connection parameters; values may be null
 * @param verifyConnection whether to open and ping the backend before returning
 */
public record InitializeRequest(Map<String, Object> config, boolean verifyConnection) {

  public InitializeRequest {
    config =
        config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
  }
}
