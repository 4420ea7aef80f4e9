package com.example.dbplugin.core.contract;

import java.util.Map;

/** @param config configuration the host should keep for later initialization */
public record InitializeResponse(Map<String, Object> config) {}
