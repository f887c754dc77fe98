/**
 *    Copyright 2024-2026 the original author or authors.
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */
package org.mydbd.builder;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mydbd.exceptions.DbException;
import org.mydbd.exceptions.ErrorKind;
import org.mydbd.session.ConnectionInfo;
import org.mydbd.session.ConnectionOptions;
import org.mydbd.session.DbConnection;

class PropertiesConnectionBuilderTest {

  @Test
  void shouldReadResourceWithPlaceholders() {
    Properties variables = new Properties();
    variables.setProperty("db.user", "reporting");
    variables.setProperty("db.port", "3307");
    PropertiesConnectionBuilder builder = PropertiesConnectionBuilder.fromResource("mydbd-test.properties", variables);

    ConnectionInfo info = builder.buildConnectionInfo();
    Assertions.assertEquals("db1.internal", info.getHostname());
    Assertions.assertEquals("reporting", info.getUsername());
    Assertions.assertNull(info.getPassword());
    Assertions.assertEquals("shop", info.getDatabase());
    Assertions.assertEquals(Integer.valueOf(3307), info.getPort());
    Assertions.assertNull(info.getSocket());

    ConnectionOptions options = builder.buildOptions();
    Assertions.assertTrue(options.isReadOnly());
    Assertions.assertTrue(options.isQueryLog());
    Assertions.assertFalse(options.isQueryPrepareCache());
    Assertions.assertTrue(options.isCompression());
    Assertions.assertFalse(options.isSsl());
    Assertions.assertEquals(5, options.getConnectTimeout());
    Assertions.assertEquals(600, options.getWaitTimeout());
  }

  @Test
  void buildShouldNotConnect() {
    Properties variables = new Properties();
    variables.setProperty("db.user", "reporting");
    DbConnection dbh = PropertiesConnectionBuilder.fromResource("mydbd-test.properties", variables).build();
    Assertions.assertFalse(dbh.isConnected());
    Assertions.assertTrue(dbh.isReadOnly());
  }

  @Test
  void shouldReadStream() {
    String text = "mydbd.hostname=localhost\nmydbd.socket=/var/run/mysqld/mysqld.sock\nmydbd.ssl=on\n";
    PropertiesConnectionBuilder builder = new PropertiesConnectionBuilder(
        new ByteArrayInputStream(text.getBytes(StandardCharsets.ISO_8859_1)), null);

    Assertions.assertEquals("/var/run/mysqld/mysqld.sock", builder.buildConnectionInfo().getSocket());
    Assertions.assertNull(builder.buildConnectionInfo().getPort());
    Assertions.assertTrue(builder.buildOptions().isSsl());
    Assertions.assertFalse(builder.buildOptions().isReadOnly());
  }

  @Test
  void shouldRejectInvalidValues() {
    Properties properties = new Properties();
    properties.setProperty("mydbd.readOnly", "maybe");
    properties.setProperty("mydbd.port", "${db.port}");
    PropertiesConnectionBuilder builder = new PropertiesConnectionBuilder(properties);

    DbException e = Assertions.assertThrows(DbException.class, builder::buildOptions);
    Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
    e = Assertions.assertThrows(DbException.class, builder::buildConnectionInfo);
    Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
  }

  @Test
  void shouldReportMissingResource() {
    DbException e = Assertions.assertThrows(DbException.class,
        () -> PropertiesConnectionBuilder.fromResource("missing.properties", null));
    Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
  }

}
