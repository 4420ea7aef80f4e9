package com.example.dbplugin.mysql;

import com.example.dbplugin.core.jdbc.ConnectionSettings;
import com.example.dbplugin.core.jdbc.SqlConnectionProducer;
import com.zaxxer.hikari.HikariConfig;

/**
 * Connection producer for MySQL Connector/J.
 *
 * <p>Server-side prepared statements are enabled unless configured otherwise, so statements the
 * server cannot prepare are reported as such instead of being emulated by the driver. TLS settings
 * map onto Connector/J's {@code sslMode} and trust store properties.
 */
class MySqlConnectionProducer extends SqlConnectionProducer {

  MySqlConnectionProducer(final String poolName) {
    super(poolName);
  }

  @Override
  protected void customize(final HikariConfig config, final ConnectionSettings settings) {
    final var props = config.getDataSourceProperties();
    props.putIfAbsent("useServerPrepStmts", "true");

    if (!settings.tlsEnabled()) return;

    final String sslMode;
    if (Boolean.TRUE.equals(settings.tlsSkipVerify())) sslMode = "REQUIRED";
    else if (settings.tlsServerName() != null) sslMode = "VERIFY_IDENTITY";
    else sslMode = "VERIFY_CA";
    props.putIfAbsent("sslMode", sslMode);

    if (settings.tlsCa() != null)
      props.putIfAbsent("trustCertificateKeyStoreUrl", "file:" + settings.tlsCa());
  }
}
