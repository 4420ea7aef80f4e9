package com.example.dbplugin.core.jdbc;

import com.example.dbplugin.core.errors.ValidationException;
import com.example.dbplugin.core.template.StatementRenderer;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Connection parameters bound from the configuration map the host passes to {@code Initialize}.
 *
 * <p>Keys are snake_case. Durations accept a number of seconds or a value such as {@code "90s"},
 * {@code "5m"} or {@code "1h"}. Unknown keys are rejected.
 *
 * @param connectionUrl JDBC URL, may contain {@code {{username}}} and {@code {{password}}}
 * @param username login used by the plugin itself
 * @param password password of that login
 * @param maxOpenConnections pool size, default 4
 * @param maxIdleConnections idle connections kept, default and maximum {@code maxOpenConnections}
 * @param maxConnectionLifetime maximum lifetime of a pooled connection, 0 for unlimited
 * @param connectTimeout how long to wait for a connection, default 30s
 * @param tlsCa path to a trust store holding the CA that signed the server certificate
 * @param tlsServerName expected server host name
 * @param tlsSkipVerify encrypt without verifying the server certificate
 * @param connectionProperties driver properties passed through unchanged
 */
public record ConnectionSettings(
    @JsonProperty("connection_url") String connectionUrl,
    @JsonProperty("username") String username,
    @JsonProperty("password") String password,
    @JsonProperty("max_open_connections") Integer maxOpenConnections,
    @JsonProperty("max_idle_connections") Integer maxIdleConnections,
    @JsonProperty("max_connection_lifetime") String maxConnectionLifetime,
    @JsonProperty("connect_timeout") String connectTimeout,
    @JsonProperty("tls_ca") String tlsCa,
    @JsonProperty("tls_server_name") String tlsServerName,
    @JsonProperty("tls_skip_verify") Boolean tlsSkipVerify,
    @JsonProperty("connection_properties") Map<String, String> connectionProperties) {

  static final int DEFAULT_MAX_OPEN_CONNECTIONS = 4;
  static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

  public ConnectionSettings {
    connectionProperties =
        connectionProperties == null ? Map.of() : Map.copyOf(connectionProperties);
  }

  /**
   * Binds and validates a configuration map.
   *
   * @param config raw configuration
   * @param mapper mapper used for binding
   * @return validated settings
   * @throws ValidationException if a key is unknown, a value is malformed or the URL is missing
   */
  public static ConnectionSettings fromConfig(
      final Map<String, Object> config, final ObjectMapper mapper) {
    final ConnectionSettings settings;
    try {
      settings = mapper.convertValue(config, ConnectionSettings.class);
    } catch (final IllegalArgumentException e) {
      throw new ValidationException("invalid connection configuration: " + e.getMessage(), e);
    }
    if (settings == null) throw new ValidationException("connection configuration is empty");
    settings.validate();
    return settings;
  }

  void validate() {
    if (connectionUrl == null || connectionUrl.isBlank())
      throw new ValidationException("connection_url cannot be empty");
    if (maxOpenConnections != null && maxOpenConnections < 1)
      throw new ValidationException("max_open_connections must be >= 1");
    if (maxIdleConnections != null && maxIdleConnections < 0)
      throw new ValidationException("max_idle_connections must be >= 0");
    parseDuration("max_connection_lifetime", maxConnectionLifetime);
    parseDuration("connect_timeout", connectTimeout);
  }

  /**
   * Connection URL with the username and password placeholders rendered.
   *
   * @return JDBC URL
   */
  public String renderedConnectionUrl() {
    return StatementRenderer.substitute(
        connectionUrl,
        Map.of(
            "username", Optional.ofNullable(username).orElse(""),
            "password", Optional.ofNullable(password).orElse("")));
  }

  public int effectiveMaxOpenConnections() {
    return Optional.ofNullable(maxOpenConnections).orElse(DEFAULT_MAX_OPEN_CONNECTIONS);
  }

  public int effectiveMaxIdleConnections() {
    return Math.min(
        Optional.ofNullable(maxIdleConnections).orElse(effectiveMaxOpenConnections()),
        effectiveMaxOpenConnections());
  }

  public Duration maxConnectionLifetimeDuration() {
    return parseDuration("max_connection_lifetime", maxConnectionLifetime).orElse(Duration.ZERO);
  }

  public Duration connectTimeoutDuration() {
    return parseDuration("connect_timeout", connectTimeout).orElse(DEFAULT_CONNECT_TIMEOUT);
  }

  public boolean tlsEnabled() {
    return tlsCa != null || tlsServerName != null || Boolean.TRUE.equals(tlsSkipVerify);
  }

  @Override
  public String toString() {
    return "ConnectionSettings[connectionUrl=%s, username=%s, maxOpenConnections=%d, tls=%s]"
        .formatted(connectionUrl, username, effectiveMaxOpenConnections(), tlsEnabled());
  }

  static Optional<Duration> parseDuration(final String key, final String value) {
    if (value == null || value.isBlank()) return Optional.empty();
    final var text = value.trim().toLowerCase(Locale.ROOT);
    try {
      final Duration duration;
      if (text.endsWith("ms")) {
        duration = Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2)));
      } else if (text.endsWith("s")) {
        duration = Duration.ofSeconds(Long.parseLong(text.substring(0, text.length() - 1)));
      } else if (text.endsWith("m")) {
        duration = Duration.ofMinutes(Long.parseLong(text.substring(0, text.length() - 1)));
      } else if (text.endsWith("h")) {
        duration = Duration.ofHours(Long.parseLong(text.substring(0, text.length() - 1)));
      } else {
        duration = Duration.ofSeconds(Long.parseLong(text));
      }
      if (duration.isNegative()) throw new ValidationException(key + " must be non-negative");
      return Optional.of(duration);
    } catch (final NumberFormatException e) {
      throw new ValidationException("invalid duration for " + key + ": " + value, e);
    }
  }
}
