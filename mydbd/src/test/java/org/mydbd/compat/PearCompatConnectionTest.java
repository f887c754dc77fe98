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
package org.mydbd.compat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mydbd.MysqlDialectDataSource;
import org.mydbd.cursor.FetchMode;
import org.mydbd.cursor.ResultCursor;
import org.mydbd.cursor.RowObject;
import org.mydbd.exceptions.DbException;
import org.mydbd.exceptions.ErrorKind;
import org.mydbd.session.ConnectionOptions;
import org.mydbd.session.DbConnection;
import org.mydbd.session.DbStatement;

@SuppressWarnings("deprecation")
class PearCompatConnectionTest {

  private static final String PAIRS = "SELECT k, v FROM pairs ORDER BY id";

  private MysqlDialectDataSource dataSource;
  private DbConnection dbh;

  @BeforeEach
  void setUp() {
    dataSource = new MysqlDialectDataSource();
    dataSource.run("CREATE TABLE pairs (id INT PRIMARY KEY, k VARCHAR(5), v INT, note VARCHAR(10))",
        "INSERT INTO pairs VALUES (1, 'a', 1, 'first'), (2, 'b', 2, 'second'), (3, 'a', 3, 'third')");
    dbh = new DbConnection(dataSource, new ConnectionOptions());
  }

  @AfterEach
  void tearDown() {
    dbh.close();
  }

  private static Map<Object, Object> mapOf(Object... keysAndValues) {
    Map<Object, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      map.put(keysAndValues[i], keysAndValues[i + 1]);
    }
    return map;
  }

  @Test
  void getAssocShouldKeepLastDuplicate() {
    Assertions.assertEquals(mapOf("a", 3, "b", 2), dbh.getAssoc(PAIRS));
  }

  @Test
  void getAssocShouldGroupDuplicates() {
    Map<Object, Object> grouped = dbh.getAssoc(PAIRS, false, Collections.emptyList(), LegacyFetchMode.DEFAULT, true);
    Assertions.assertEquals(mapOf("a", Arrays.asList(1, 3), "b", Arrays.asList(2)), grouped);
  }

  @Test
  void getAssocShouldRejectSingleColumn() {
    DbException e = Assertions.assertThrows(DbException.class, () -> dbh.getAssoc("SELECT k FROM pairs"));
    Assertions.assertEquals(ErrorKind.TRUNCATED_RESULT, e.getKind());
  }

  @Test
  void getAssocShouldShapeRemainingColumns() {
    String query = "SELECT k, v, note FROM pairs WHERE id < ? ORDER BY id";
    List<Integer> params = Collections.singletonList(3);

    Map<Object, Object> ordered = dbh.getAssoc(query, false, params, LegacyFetchMode.ORDERED, false);
    Assertions.assertEquals(mapOf("a", Arrays.asList(1, "first"), "b", Arrays.asList(2, "second")), ordered);

    Map<Object, Object> assoc = dbh.getAssoc(query, false, params, LegacyFetchMode.ASSOC, false);
    Map<String, Object> a = new LinkedHashMap<>();
    a.put("v", 1);
    a.put("note", "first");
    Assertions.assertEquals(a, assoc.get("a"));

    Map<Object, Object> objects = dbh.getAssoc(query, false, params, LegacyFetchMode.OBJECT, false);
    RowObject b = (RowObject) objects.get("b");
    Assertions.assertEquals(Arrays.asList("v", "note"), b.getPropertyNames());
    Assertions.assertEquals("second", b.get("note"));
  }

  @Test
  void getAssocForceArrayShouldWrapSecondColumn() {
    Map<Object, Object> forced = dbh.getAssoc(PAIRS, true);
    Assertions.assertEquals(mapOf("a", Arrays.asList(3), "b", Arrays.asList(2)), forced);

    Map<Object, Object> grouped = dbh.getAssoc("SELECT k, v, note FROM pairs ORDER BY id", false,
        Collections.emptyList(), LegacyFetchMode.ORDERED, true);
    Assertions.assertEquals(Arrays.asList(Arrays.asList(1, "first"), Arrays.asList(3, "third")), grouped.get("a"));
  }

  @Test
  void getColShouldReadOneColumn() {
    Assertions.assertEquals(Arrays.asList("a", "b", "a"), dbh.getCol(PAIRS));
    Assertions.assertEquals(Arrays.asList(1, 2, 3), dbh.getCol(PAIRS, 1));
    Assertions.assertEquals(Arrays.asList(2, 3), dbh.getCol("SELECT k, v FROM pairs WHERE id > ? ORDER BY id", "v",
        Collections.singletonList(1)));
    Assertions.assertEquals(Collections.emptyList(), dbh.getCol("SELECT k FROM pairs WHERE id > 10", "k"));
  }

  @Test
  void getColShouldRejectMissingColumn() {
    DbException e = Assertions.assertThrows(DbException.class, () -> dbh.getCol(PAIRS, "note"));
    Assertions.assertEquals(ErrorKind.NO_SUCH_FIELD, e.getKind());
    e = Assertions.assertThrows(DbException.class, () -> dbh.getCol(PAIRS, 2));
    Assertions.assertEquals(ErrorKind.NO_SUCH_FIELD, e.getKind());
  }

  @Test
  void failedHelpersShouldCloseTheirCursor() {
    List<ResultCursor> opened = new ArrayList<>();
    DbConnection tracking = new DbConnection(dataSource, new ConnectionOptions()) {
      @Override
      public ResultCursor query(String query, List<?> params) {
        ResultCursor res = super.query(query, params);
        opened.add(res);
        return res;
      }
    };
    try {
      DbException e = Assertions.assertThrows(DbException.class, () -> tracking.getCol(PAIRS, 1.5));
      Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
      e = Assertions.assertThrows(DbException.class, () -> tracking.getCol(PAIRS, "note"));
      Assertions.assertEquals(ErrorKind.NO_SUCH_FIELD, e.getKind());

      Assertions.assertEquals(2, opened.size());
      for (ResultCursor res : opened) {
        Assertions.assertTrue(res.isClosed());
      }
    } finally {
      tracking.close();
    }
  }

  @Test
  void getOneShouldReadFirstField() {
    Assertions.assertEquals("a", dbh.getOne(PAIRS));
    Assertions.assertEquals(2, dbh.getOne("SELECT v FROM pairs WHERE k = ?", Collections.singletonList("b")));
    Assertions.assertNull(dbh.getOne("SELECT v FROM pairs WHERE id > 10"));
  }

  @Test
  void getRowShouldHonorConnectionFetchMode() {
    Assertions.assertEquals(Arrays.asList("a", 1), dbh.getRow(PAIRS));

    dbh.setFetchMode(LegacyFetchMode.ASSOC);
    Assertions.assertEquals(FetchMode.ASSOC, dbh.resolveFetchMode(LegacyFetchMode.DEFAULT));
    Map<?, ?> row = (Map<?, ?>) dbh.getRow(PAIRS);
    Assertions.assertEquals("a", row.get("k"));

    Object ordered = dbh.getRow(PAIRS, Collections.emptyList(), LegacyFetchMode.ORDERED);
    Assertions.assertEquals(Arrays.asList("a", 1), ordered);
    Assertions.assertNull(dbh.getRow("SELECT k FROM pairs WHERE id > 10"));
  }

  @Test
  void getAllShouldReadEveryRow() {
    List<Object> rows = dbh.getAll(PAIRS, Collections.emptyList(), LegacyFetchMode.OBJECT);
    Assertions.assertEquals(3, rows.size());
    Assertions.assertEquals(3, ((RowObject) rows.get(2)).get("v"));

    Assertions.assertEquals(Arrays.asList(Arrays.asList("a", 1), Arrays.asList("b", 2), Arrays.asList("a", 3)),
        dbh.getAll(PAIRS));
  }

  @Test
  void executeShouldBindParameterList() {
    DbStatement sth = dbh.prepare("UPDATE pairs SET v = ? WHERE k = ?");
    Assertions.assertNull(dbh.execute(sth, Arrays.asList(0, "a")));
    Assertions.assertEquals(2, dbh.affectedRows());
    Assertions.assertEquals(Arrays.asList(0, 2, 0), dbh.getCol("SELECT v FROM pairs ORDER BY id", "v"));
  }

  @Test
  void helpersRequireAResultSet() {
    DbException e = Assertions.assertThrows(DbException.class,
        () -> dbh.getAll("UPDATE pairs SET v = 0"));
    Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
  }

}
