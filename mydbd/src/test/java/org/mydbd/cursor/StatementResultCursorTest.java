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
package org.mydbd.cursor;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mydbd.MysqlDialectDataSource;
import org.mydbd.session.ConnectionOptions;
import org.mydbd.session.DbConnection;
import org.mydbd.session.DbStatement;

class StatementResultCursorTest {

  private static MysqlDialectDataSource dataSource;

  private DbConnection dbh;

  @BeforeAll
  static void setUpDatabase() {
    dataSource = new MysqlDialectDataSource();
    dataSource.run("CREATE TABLE products (id INT PRIMARY KEY, category VARCHAR(10), label VARCHAR(20))",
        "INSERT INTO products VALUES (1, 'tools', 'hammer'), (2, 'tools', 'saw'), (3, 'food', 'bread'),"
            + " (4, 'food', 'cheese'), (5, 'food', 'apple')");
  }

  @BeforeEach
  void connect() {
    dbh = new DbConnection(dataSource, new ConnectionOptions());
  }

  @AfterEach
  void disconnect() {
    dbh.close();
  }

  @Test
  void reExecutionShouldReuseTheCursorWithoutBleedThrough() {
    DbStatement sth = dbh.prepare("SELECT id, label FROM products WHERE category = ? ORDER BY id");

    ResultCursor tools = sth.execute("tools");
    Assertions.assertTrue(tools instanceof StatementResultCursor);
    Assertions.assertEquals(Arrays.asList(1, "hammer"), tools.next());
    Assertions.assertEquals(Arrays.asList(2, "saw"), tools.next());
    Assertions.assertNull(tools.next());

    ResultCursor food = sth.execute("food");
    Assertions.assertSame(tools, food);
    Assertions.assertEquals(3, food.getRowCount());
    Assertions.assertEquals(Arrays.asList(
        Arrays.asList(3, "bread"), Arrays.asList(4, "cheese"), Arrays.asList(5, "apple")), food.fetchAll());
  }

  @Test
  void orderedRowsShouldNotAliasTheBoundBuffer() {
    ResultCursor res = dbh.prepare("SELECT id, label FROM products WHERE id < ? ORDER BY id").execute(3);
    List<?> first = (List<?>) res.next();
    List<?> second = (List<?>) res.next();
    Assertions.assertEquals("hammer", first.get(1));
    Assertions.assertEquals("saw", second.get(1));
  }

  @Test
  void reExecutionShouldRestoreDefaultFetchMode() {
    DbStatement sth = dbh.prepare("SELECT id, label FROM products WHERE id = ?");
    ResultCursor res = sth.execute(1).setFetchMode(FetchMode.ASSOC);
    Assertions.assertEquals("hammer", ((Map<?, ?>) res.next()).get("label"));

    res = sth.execute(2);
    Assertions.assertEquals(FetchMode.ORDERED, res.getFetchMode());
    Assertions.assertEquals(Arrays.asList(2, "saw"), res.next());
  }

  @Test
  void resetShouldRewindAndRestoreDefaults() {
    StatementResultCursor res = (StatementResultCursor) dbh
        .prepare("SELECT label FROM products WHERE category = ? ORDER BY id").execute("food");
    res.setFetchMode(FetchMode.OBJECT, Map.class);
    res.next();
    res.next();

    res.reset();
    Assertions.assertEquals(0, res.key());
    Assertions.assertEquals(FetchMode.ORDERED, res.getFetchMode());
    Assertions.assertEquals(Arrays.asList("bread"), res.next());
    Assertions.assertEquals("cheese", ((RowObject) res.fetchObject()).get("label"));
  }

  @Test
  void rebindShouldNotReadMetadataAgain() throws Exception {
    StatementResultCursor res = (StatementResultCursor) dbh
        .prepare("SELECT label FROM products WHERE category = ? ORDER BY id").execute("tools");
    Assertions.assertEquals(Arrays.asList("label"), res.getFieldNames());

    try (Connection conn = dataSource.getConnection();
        Statement stmt = conn.createStatement(ResultSet.TYPE_SCROLL_INSENSITIVE, ResultSet.CONCUR_READ_ONLY);
        ResultSet food = stmt.executeQuery("SELECT label FROM products WHERE category = 'food' ORDER BY id")) {
      ResultSet noMetadata = (ResultSet) Proxy.newProxyInstance(getClass().getClassLoader(),
          new Class<?>[] { ResultSet.class }, (proxy, method, args) -> {
            if ("getMetaData".equals(method.getName())) {
              throw new SQLException("metadata requested");
            }
            try {
              return method.invoke(food, args);
            } catch (InvocationTargetException e) {
              throw e.getCause();
            }
          });
      res.reset(noMetadata);
      Assertions.assertEquals(3, res.getRowCount());
      Assertions.assertEquals(Arrays.asList("label"), res.getFieldNames());
      Assertions.assertEquals(Arrays.asList("bread"), res.next());
    }
  }

  @Test
  void peekShouldWorkOnBoundBuffer() {
    ResultCursor res = dbh.prepare("SELECT label FROM products WHERE category = ? ORDER BY id").execute("tools");
    res.setFetchMode(FetchMode.COLUMN, "label");
    Assertions.assertEquals("hammer", res.current());
    Assertions.assertEquals("hammer", res.next());
    Assertions.assertEquals("saw", res.current());
    Assertions.assertEquals(Arrays.asList("saw"), res.fetchAll());
  }

  @Test
  void emptyExecutionShouldYieldNoRows() {
    DbStatement sth = dbh.prepare("SELECT label FROM products WHERE category = ?");
    ResultCursor res = sth.execute("toys");
    Assertions.assertEquals(0, res.getRowCount());
    Assertions.assertNull(res.next());
    Assertions.assertEquals(0, sth.getAffectedRows());

    res = sth.execute("tools");
    Assertions.assertEquals(2, res.getRowCount());
  }

}
