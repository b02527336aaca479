package com.parceltrack.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.tinylog.Logger;

/** Builds the connection pool the parcel store runs on. */
public final class DataSources {

  private DataSources() {
    // Utility class
  }

  /** Translates the database settings into a HikariCP configuration. */
  public static HikariConfig toHikariConfig(DatabaseConfig databaseConfig) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(databaseConfig.jdbcUrl());
    config.setUsername(databaseConfig.username());
    config.setPassword(databaseConfig.password());
    config.setMaximumPoolSize(databaseConfig.maximumPoolSize());
    config.setMinimumIdle(Math.min(2, databaseConfig.maximumPoolSize()));
    config.setIdleTimeout(30000);
    config.setMaxLifetime(1800000);
    config.setConnectionTimeout(30000);
    config.setAutoCommit(true);
    config.setPoolName("ParcelStorePool");
    return config;
  }

  /** Opens a HikariCP pool for the given settings. The caller owns and closes it. */
  public static HikariDataSource create(DatabaseConfig databaseConfig) {
    Logger.info("Configuring database pool: {}", databaseConfig.toSecureString());
    return new HikariDataSource(toHikariConfig(databaseConfig));
  }
}
