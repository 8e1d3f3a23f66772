/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.util.Optional;
import java.util.Properties;

import org.junit.jupiter.api.Test;

/**
 * Tests {@linkplain CouncilConfig} loading.
 */
public class CouncilConfigTest extends BaseTestCase {

  private Properties minimal(Object label) {
    Properties props = new Properties();
    props.setProperty(CouncilConfig.JDBC_URL, dbUrl(label));
    return props;
  }


  @Test
  public void testRequiredUrl() {
    final Object label = new Object() { };
    try {
      new CouncilConfig(new Properties());
      fail();
    } catch (IllegalArgumentException expected) {
      printExpected(label, expected);
    }
    Properties props = new Properties();
    props.setProperty(CouncilConfig.JDBC_URL, "  ");
    try {
      new CouncilConfig(props);
      fail();
    } catch (IllegalArgumentException expected) {  }
  }


  @Test
  public void testDefaults() {
    final Object label = new Object() { };
    var config = new CouncilConfig(minimal(label));
    assertEquals(dbUrl(label), config.jdbcUrl());
    assertEquals(CouncilConstants.DEFAULT_PREFIX, config.dbEnv().tablePrefix());
    assertFalse(config.dbEnv().readOnly());
    assertEquals(CouncilConfig.DEFAULT_POOL_SIZE, config.maxPoolSize());
    assertTrue(config.hikariProperties().isEmpty());

    var hikari = config.hikariConfig();
    assertEquals(dbUrl(label), hikari.getJdbcUrl());
    assertEquals(CouncilConfig.DEFAULT_POOL_SIZE, hikari.getMaximumPoolSize());
    assertFalse(hikari.isAutoCommit());
  }


  @Test
  public void testBadValues() {
    final Object label = new Object() { };
    for (var badSize : new String[] { "0", "-1", "eight" }) {
      var props = minimal(label);
      props.setProperty(CouncilConfig.POOL_MAX_SIZE, badSize);
      try {
        new CouncilConfig(props);
        fail(badSize);
      } catch (IllegalArgumentException expected) {
        printExpected(label, expected);
      }
    }
    var props = minimal(label);
    props.setProperty(CouncilConfig.READ_ONLY, "yes");
    try {
      new CouncilConfig(props);
      fail();
    } catch (IllegalArgumentException expected) {  }

    props = minimal(label);
    props.setProperty(CouncilConfig.TABLE_PREFIX, "bad-prefix");
    try {
      new CouncilConfig(props);
      fail();
    } catch (IllegalArgumentException expected) {  }

    props = minimal(label);
    props.setProperty(CouncilConfig.HIKARI_PREFIX + "noSuchProperty", "1");
    var config = new CouncilConfig(props);
    try {
      config.hikariConfig();
      fail();
    } catch (IllegalArgumentException expected) {
      printExpected(label, expected);
    }
  }


  @Test
  public void testLoadFile() throws Exception {
    var file = new File(getClass().getResource("/council-test.properties").toURI());
    var config = CouncilConfig.load(file);

    assertEquals("cfg_", config.dbEnv().tablePrefix());
    assertEquals(4, config.maxPoolSize());
    assertEquals("5000", config.hikariProperties().getProperty("connectionTimeout"));

    var hikari = config.hikariConfig();
    assertEquals("sa", hikari.getUsername());
    assertEquals("secret", hikari.getPassword());
    assertEquals("council-test", hikari.getPoolName());
    assertEquals(5000, hikari.getConnectionTimeout());
    assertEquals(4, hikari.getMaximumPoolSize());

    var props = config.getProperties();
    assertNull(props.getProperty(CouncilConfig.JDBC_PASSWORD));
    assertEquals("sa", props.getProperty(CouncilConfig.JDBC_USERNAME));
    assertEquals("council-test", props.getProperty(CouncilConfig.HIKARI_PREFIX + "poolName"));

    // round trip, sans password
    var copy = new CouncilConfig(props);
    assertEquals(config.dbEnv(), copy.dbEnv());
    assertEquals(config.jdbcUrl(), copy.jdbcUrl());
    assertEquals(config.hikariProperties(), copy.hikariProperties());
  }


  @Test
  public void testLoadMissingFile() {
    final Object label = new Object() { };
    try {
      CouncilConfig.load(new File("no-such-council.properties"));
      fail();
    } catch (IllegalArgumentException expected) {
      printExpected(label, expected);
    }
  }


  @Test
  public void testEnsureInstance() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var readOnlyProps = minimal(label);
      readOnlyProps.setProperty(CouncilConfig.READ_ONLY, "true");
      var readOnlyConfig = new CouncilConfig(readOnlyProps);
      try {
        RiskCouncil.ensureInstance(readOnlyConfig);
        fail();
      } catch (CouncilManagementException expected) {
        printExpected(label, expected);
      }

      var riskCouncil = closer.push(RiskCouncil.ensureInstance(new CouncilConfig(minimal(label))));
      assertFalse(riskCouncil.isReadOnly());
      var council = riskCouncil.createCouncil(Council.argsInstance("configured", null, null));

      var readOnly = closer.push(RiskCouncil.ensureInstance(readOnlyConfig));
      assertTrue(readOnly.isReadOnly());
      assertEquals(
          council,
          readOnly.listCouncils(Optional.empty(), Optional.empty(), 0, 10).get(0));
    }
  }

}
