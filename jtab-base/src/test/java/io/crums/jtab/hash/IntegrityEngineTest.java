/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.hash;


import static io.crums.jtab.JtabConstants.HASH;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.json.simple.JSONObject;
import org.junit.jupiter.api.Test;

import io.crums.jtab.ColumnConfig;
import io.crums.jtab.ColumnType;
import io.crums.jtab.HashMismatchException;
import io.crums.jtab.Table;
import io.crums.jtab.TableBundle;
import io.crums.jtab.TableConfig;

/**
 * 
 */
public class IntegrityEngineTest {
  
  
  @SuppressWarnings("unchecked")
  private static JSONObject row(Object... kvs) {
    var row = new JSONObject();
    for (int index = 0; index < kvs.length; index += 2)
      row.put(kvs[index], kvs[index + 1]);
    return row;
  }
  

  @Test
  public void testStampIdempotent() {
    var engine = IntegrityEngine.LENIENT;
    var row = engine.stampMissing(row("id", 1L, "name", "Alice"));
    String hash = (String) row.get(HASH);
    assertNotNull(hash);
    
    engine.stampMissing(row);
    assertEquals(hash, row.get(HASH));
    assertEquals(engine.hash(row), hash);
  }
  
  
  @Test
  public void testLenientKeepsStaleHash() {
    var row = row("id", 1L, "_hash", "stale");
    IntegrityEngine.LENIENT.stampMissing(row);
    assertEquals("stale", row.get(HASH));
  }
  
  
  @Test
  public void testStrictRejectsStaleHash() {
    var row = row("id", 1L, "_hash", "stale");
    var x = assertThrows(
        HashMismatchException.class,
        () -> IntegrityEngine.STRICT.stampMissing(row));
    assertEquals("stale", x.stamped());
    assertEquals(IntegrityEngine.STRICT.hash(row), x.computed());
    
    var good = IntegrityEngine.STRICT.stampMissing(row("id", 1L));
    IntegrityEngine.STRICT.verify(good);
  }
  
  
  @Test
  public void testStampConfig() {
    var config = TableConfig.of("users", "components", new ColumnConfig("id", ColumnType.NUMBER));
    var stamped = IntegrityEngine.LENIENT.stamp(config);
    assertTrue(stamped.hash().isPresent());
    assertSame(stamped, IntegrityEngine.LENIENT.stamp(stamped));
    assertSame(stamped, IntegrityEngine.STRICT.stamp(stamped));
    assertThrows(
        HashMismatchException.class,
        () -> IntegrityEngine.STRICT.stamp(config.withHash("nope")));
  }
  
  
  @Test
  public void testStampRows() {
    var table = Table.of("components", List.of(Map.of("id", 2), Map.of("id", 1)));
    var stamped = IntegrityEngine.LENIENT.stampRows(table);
    assertTrue(stamped.hash().isPresent());
    assertEquals(2L, stamped.data().get(0).get("id"));
    for (var row : stamped.data())
      assertNotNull(row.get(HASH));
    // original is untouched
    assertNull(table.data().get(0).get(HASH));
    
    assertEquals(stamped, IntegrityEngine.LENIENT.stampRows(stamped));
  }
  
  
  @Test
  public void testRehashOrderIndependent() {
    var a = Map.of("id", 1);
    var b = Map.of("id", 2);
    var ab = IntegrityEngine.LENIENT.rehash(Table.of("components", List.of(a, b)));
    var ba = IntegrityEngine.LENIENT.rehash(Table.of("components", List.of(b, a)));
    assertEquals(ab, ba);
    
    var rows = ab.data();
    assertTrue(rows.get(0).get(HASH).toString().compareTo(rows.get(1).get(HASH).toString()) < 0);
  }
  
  
  @Test
  public void testStampBundle() {
    var bundle = TableBundle.of("users", Table.of("components", List.of(Map.of("id", 1))));
    var stamped = IntegrityEngine.LENIENT.stamp(bundle);
    assertTrue(stamped.hash().isPresent());
    assertTrue(stamped.table("users").get().hash().isPresent());
    assertEquals(stamped, IntegrityEngine.STRICT.stamp(stamped));
    
    var again = IntegrityEngine.LENIENT.stamp(bundle);
    assertEquals(stamped.hash(), again.hash());
  }

}
