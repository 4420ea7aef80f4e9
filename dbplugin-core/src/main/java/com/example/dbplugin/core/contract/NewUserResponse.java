package com.example.dbplugin.core.contract;

/** @param username the generated username */
public record NewUserResponse(String username) {}
