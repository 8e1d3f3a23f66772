/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.List;
import java.util.Properties;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Database configuration for {@linkplain RiskCouncil}.
 *
 * <h2>Properties</h2>
 * <p>
 * A simple properties file is used to store configuration. Every property
 * is prefixed with {@linkplain #ROOT}. Properties under
 * {@linkplain #HIKARI_PREFIX} are passed (sans prefix) to
 * {@linkplain HikariConfig} as is; e.g. {@code council.hikari.connectionTimeout}.
 * </p>
 */
public class CouncilConfig {

  /**
   * Every property known to this configuration is prefixed with this value.
   */
  public final static String ROOT = "council.";

  /** JDBC connection URL. Required. */
  public final static String JDBC_URL = ROOT + "jdbc.url";
  /**
   * Fully-qualified classname of the JDBC driver. If not provided, then it's
   * assumed a suitable driver is already registered for the URL.
   */
  public final static String JDBC_DRIVER = ROOT + "jdbc.driver";
  public final static String JDBC_USERNAME = ROOT + "jdbc.username";
  public final static String JDBC_PASSWORD = ROOT + "jdbc.password";
  /**
   * Prefix of the system table names.
   *
   * @see CouncilConstants#DEFAULT_PREFIX
   */
  public final static String TABLE_PREFIX = ROOT + "table.prefix";
  /** Maximum connection pool size. Defaults to {@value #DEFAULT_POOL_SIZE}. */
  public final static String POOL_MAX_SIZE = ROOT + "pool.max_size";
  /** If {@code true}, no writes are allowed and no tables are created. */
  public final static String READ_ONLY = ROOT + "read_only";

  /** Pass-through {@linkplain HikariConfig} property prefix. */
  public final static String HIKARI_PREFIX = ROOT + "hikari.";

  public final static int DEFAULT_POOL_SIZE = 8;


  public final static List<String> PROP_NAMES = List.of(
      JDBC_URL,
      JDBC_DRIVER,
      JDBC_USERNAME,
      JDBC_PASSWORD,
      TABLE_PREFIX,
      POOL_MAX_SIZE,
      READ_ONLY);


  /**
   * Loads and returns the configuration in the given properties file.
   *
   * @throws IllegalArgumentException
   *         if the file doesn't exist, can't be read, or its contents are
   *         invalid
   */
  public static CouncilConfig load(File propertiesFile) throws IllegalArgumentException {
    Properties props = new Properties();
    try (var in = new FileInputStream(propertiesFile)) {
      props.load(in);
    } catch (FileNotFoundException fnfx) {
      throw new IllegalArgumentException("properties file does not exist: " + propertiesFile);
    } catch (IOException iox) {
      throw new IllegalArgumentException("failed to read properties file: " + propertiesFile, iox);
    }
    return new CouncilConfig(props);
  }



  private final String jdbcUrl;
  private final String driverClass;
  private final String username;
  private final String password;
  private final DbEnv env;
  private final int maxPoolSize;
  private final Properties hikariProps;


  /**
   * Creates an instance from the given properties.
   *
   * @throws IllegalArgumentException
   *         if a required property is missing, or a value is malformed
   */
  public CouncilConfig(Properties props) throws IllegalArgumentException {
    this.jdbcUrl = trimmed(props, JDBC_URL);
    enforceRequired(JDBC_URL, jdbcUrl);
    this.driverClass = trimmed(props, JDBC_DRIVER);
    this.username = trimmed(props, JDBC_USERNAME);
    this.password = props.getProperty(JDBC_PASSWORD);

    String prefix = trimmed(props, TABLE_PREFIX);
    boolean readOnly = getBoolean(props, READ_ONLY);
    this.env = new DbEnv(
        isSet(prefix) ? prefix : CouncilConstants.DEFAULT_PREFIX,
        readOnly);

    this.maxPoolSize = getPoolSize(props);
    this.hikariProps = getHikariProps(props);
  }


  private static String trimmed(Properties props, String name) {
    String value = props.getProperty(name);
    return value == null ? null : value.trim();
  }


  private static boolean getBoolean(Properties props, String name) {
    String value = trimmed(props, name);
    if (!isSet(value))
      return false;
    if (value.equalsIgnoreCase("true"))
      return true;
    if (value.equalsIgnoreCase("false"))
      return false;
    throw new IllegalArgumentException(name + ": " + value);
  }


  private static int getPoolSize(Properties props) {
    String value = trimmed(props, POOL_MAX_SIZE);
    if (!isSet(value))
      return DEFAULT_POOL_SIZE;
    try {
      int size = Integer.parseInt(value);
      if (size < 1)
        throw new IllegalArgumentException(POOL_MAX_SIZE + " must be positive: " + value);
      return size;
    } catch (NumberFormatException nfx) {
      throw new IllegalArgumentException(POOL_MAX_SIZE + ": " + value, nfx);
    }
  }


  private static Properties getHikariProps(Properties props) {
    final int plen = HIKARI_PREFIX.length();
    Properties hikari = new Properties();
    for (var name : props.stringPropertyNames())
      if (name.startsWith(HIKARI_PREFIX) && name.length() > plen)
        hikari.setProperty(name.substring(plen), props.getProperty(name));
    return hikari;
  }


  private static void enforceRequired(String name, String value) {
    if (!isSet(value))
      throw new IllegalArgumentException("required property not set: " + name);
  }


  private static boolean isSet(String value) {
    return value != null && !value.isEmpty();
  }


  public String jdbcUrl() {
    return jdbcUrl;
  }

  /** Returns the table prefix and read-only setting. */
  public DbEnv dbEnv() {
    return env;
  }

  public int maxPoolSize() {
    return maxPoolSize;
  }

  /** Returns a copy of the pass-through Hikari properties (sans prefix). */
  public Properties hikariProperties() {
    Properties copy = new Properties();
    copy.putAll(hikariProps);
    return copy;
  }


  /**
   * Returns a new Hikari configuration.
   *
   * @throws IllegalArgumentException
   *         if a pass-through property is unknown to Hikari, or the driver
   *         class cannot be loaded
   */
  public HikariConfig hikariConfig() throws IllegalArgumentException {
    HikariConfig config;
    try {
      config = new HikariConfig(hikariProperties());
      config.setJdbcUrl(jdbcUrl);
      if (isSet(driverClass))
        config.setDriverClassName(driverClass);
    } catch (RuntimeException rx) {
      throw new IllegalArgumentException(
          "invalid connection pool configuration: " + rx.getMessage(), rx);
    }
    if (isSet(username))
      config.setUsername(username);
    if (password != null)
      config.setPassword(password);
    config.setMaximumPoolSize(maxPoolSize);
    config.setAutoCommit(false);
    return config;
  }


  /**
   * Returns a new connection pool per this configuration. The caller (or
   * the {@linkplain RiskCouncil} it's handed to) closes it.
   */
  public HikariDataSource newDataSource() throws IllegalArgumentException {
    return new HikariDataSource(hikariConfig());
  }


  /**
   * Returns the configuration as properties (the password excluded).
   */
  public Properties getProperties() {
    Properties props = new Properties();
    for (var name : hikariProps.stringPropertyNames())
      props.setProperty(HIKARI_PREFIX + name, hikariProps.getProperty(name));
    props.setProperty(JDBC_URL, jdbcUrl);
    set(props, JDBC_DRIVER, driverClass);
    set(props, JDBC_USERNAME, username);
    props.setProperty(TABLE_PREFIX, env.tablePrefix());
    props.setProperty(POOL_MAX_SIZE, String.valueOf(maxPoolSize));
    props.setProperty(READ_ONLY, String.valueOf(env.readOnly()));
    return props;
  }


  private void set(Properties props, String name, String value) {
    if (value != null)
      props.setProperty(name, value);
  }

}
