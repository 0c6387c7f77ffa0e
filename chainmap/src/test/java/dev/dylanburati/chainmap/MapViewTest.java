package dev.dylanburati.chainmap;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.stream.Collectors;
import java.util.stream.Stream;

class MapViewTest {
  @Test void testInsert() {
    Map<String, Integer> m = ChainedHashTable.create(8).asMap();
    assertEquals(0, m.size());
    assertNull(m.put("a", 505));
    assertEquals(1, m.size());
    assertNull(m.put("b", 606));
    assertEquals(505, m.get("a"));
    assertEquals(606, m.get("b"));
    assertNull(m.get("c"));
    assertNull(m.get(42));
  }

  @Test void testInsertOverwrite() {
    Map<String, Integer> m = ChainedHashTable.create(8).asMap();
    assertNull(m.put("a", 505));
    assertEquals(505, m.put("a", 606));
    assertEquals(606, m.get("a"));
  }

  @Test void testRejectsNulls() {
    Map<String, Integer> m = ChainedHashTable.create(8).asMap();
    assertThrows(NullPointerException.class, () -> m.put(null, 1));
    assertThrows(NullPointerException.class, () -> m.put("a", null));
    assertFalse(m.containsKey(null));
  }

  @Test void testViewIsLive() {
    ChainedHashTable t = ChainedHashTable.create(8);
    Map<String, Integer> m = t.asMap();
    t.put("a", 505);
    assertEquals(505, m.get("a"));
    m.put("b", 606);
    assertEquals(606, t.get("b").value());
    assertEquals(606, m.remove("b"));
    assertFalse(t.containsKey("b"));
    assertNull(m.remove("b"));
  }

  @Test void testPutAllAndEquals() {
    Map<String, Integer> m = ChainedHashTable.create(2).asMap();
    m.putAll(Map.of("a", 505, "bb", 606, "ccc", 707));
    Map<String, Integer> expected = new HashMap<>();
    expected.put("a", 505);
    expected.put("bb", 606);
    assertNotEquals(expected, m);
    expected.put("ccc", 707);
    assertEquals(expected, m);
    assertEquals(m, expected);
    assertEquals(expected.hashCode(), m.hashCode());
  }

  @Test void testMergeCounts() {
    Map<String, Integer> m = ChainedHashTable.create(4).asMap();
    for (String w : "the cat and the hat and the bat".split(" ")) {
      m.merge(w, 1, Integer::sum);
    }
    assertEquals(3, m.get("the"));
    assertEquals(2, m.get("and"));
    assertEquals(1, m.get("bat"));
    assertEquals(5, m.size());
  }

  @Test void testEmptyIterators() {
    Map<String, Integer> m = ChainedHashTable.create(8).asMap();
    assertFalse(m.keySet().iterator().hasNext());
    assertFalse(m.values().iterator().hasNext());
    assertFalse(m.entrySet().iterator().hasNext());
  }

  @Test void testEntryIterator() {
    Map<String, Integer> m = ChainedHashTable.create(8).asMap();
    List<Integer> values = Stream.generate(() -> List.of(505, 606, 707, 808)).limit(8).flatMap(List::stream).collect(Collectors.toList());
    for (Integer v : values) {
      String k = Integer.toString(m.size());
      assertNull(m.put(k, v));
    }
    assertEquals(32, m.size());

    long observed = 0;
    for (Entry<String, Integer> e : m.entrySet()) {
      int k = Integer.valueOf(e.getKey());
      assertEquals(values.get(k), e.getValue());
      long mask = 1L << k;
      assertEquals(0L, observed & mask, String.format("unexpected second occurence of %s", e.getKey()));
      observed |= mask;
    }

    assertEquals(0xFFFF_FFFFL, observed);
  }

  @Test void testEntryIteratorMutating() {
    Map<String, Integer> m = ChainedHashTable.create(8).asMap();
    List<Integer> values = Stream.generate(() -> List.of(505, 606, 707, 808)).limit(8).flatMap(List::stream).collect(Collectors.toList());
    for (Integer v : values) {
      String k = Integer.toString(m.size());
      assertNull(m.put(k, v));
    }

    for (Iterator<Entry<String, Integer>> it = m.entrySet().iterator(); it.hasNext(); ) {
      Entry<String, Integer> e = it.next();
      int k = Integer.valueOf(e.getKey());
      assertEquals(values.get(k), e.getValue());
      if (k % 2 == 0) {
        it.remove();
      }
    }
    assertEquals(16, m.size());

    long observed = 0;
    for (Entry<String, Integer> e : m.entrySet()) {
      int k = Integer.valueOf(e.getKey());
      long mask = 1L << k;
      assertEquals(0L, observed & mask, String.format("unexpected second occurence of %s", e.getKey()));
      observed |= mask;
      e.setValue(-e.getValue());
    }
    assertEquals(0xAAAA_AAAAL, observed);

    for (Entry<String, Integer> e : m.entrySet()) {
      int k = Integer.valueOf(e.getKey());
      assertEquals(-values.get(k), e.getValue());
    }
  }

  @Test void testIteratorRemoveTwice() {
    Map<String, Integer> m = ChainedHashTable.create(8).asMap();
    m.put("a", 1);
    Iterator<String> it = m.keySet().iterator();
    assertThrows(IllegalStateException.class, it::remove);
    it.next();
    it.remove();
    assertThrows(IllegalStateException.class, it::remove);
    assertTrue(m.isEmpty());
  }

  @Test void testIteratorFailsFast() {
    Map<String, Integer> m = ChainedHashTable.create(8).asMap();
    m.put("a", 1);
    m.put("b", 2);
    Iterator<String> it = m.keySet().iterator();
    it.next();
    m.put("c", 3);
    assertThrows(ConcurrentModificationException.class, it::next);
  }

  @Test void testOverwriteDuringIteration() {
    Map<String, Integer> m = ChainedHashTable.create(8).asMap();
    m.put("a", 1);
    m.put("b", 2);
    for (String k : m.keySet()) {
      m.put(k, 10);
    }
    assertEquals(List.of(10, 10), List.copyOf(m.values()));
  }

  @Test void testEntrySurvivesResize() {
    ChainedHashTable t = ChainedHashTable.create(2);
    Map<String, Integer> m = t.asMap();
    m.put("a", 505);
    Entry<String, Integer> e = m.entrySet().iterator().next();
    for (int i = 0; i < 100; i++) {
      t.put(Integer.toString(i), i);
    }
    assertTrue(t.capacity() > 2);
    assertEquals(505, e.setValue(606));
    assertEquals(606, m.get("a"));

    m.remove("a");
    assertThrows(IllegalStateException.class, e::getValue);
  }

  @Test void testEntrySetContainsAndRemove() {
    Map<String, Integer> m = ChainedHashTable.create(8).asMap();
    m.put("a", 505);
    assertTrue(m.entrySet().contains(Map.entry("a", 505)));
    assertFalse(m.entrySet().contains(Map.entry("a", 606)));
    assertFalse(m.entrySet().remove(Map.entry("a", 606)));
    assertTrue(m.entrySet().remove(Map.entry("a", 505)));
    assertTrue(m.isEmpty());
  }

  @Test void testKeySetAndValues() {
    Map<String, Integer> m = ChainedHashTable.create(8).asMap();
    m.put("a", 505);
    m.put("b", 606);
    assertTrue(m.keySet().contains("a"));
    assertTrue(m.values().contains(606));
    assertTrue(m.keySet().remove("a"));
    assertFalse(m.keySet().remove("a"));
    assertEquals(1, m.size());
    m.values().clear();
    assertTrue(m.isEmpty());
  }

  @Test void testPutOnDestroyedTable() {
    ChainedHashTable t = ChainedHashTable.create(8);
    Map<String, Integer> m = t.asMap();
    t.destroy();
    assertNull(m.get("a"));
    assertFalse(m.entrySet().iterator().hasNext());
    HashTableException e = assertThrows(HashTableException.class, () -> m.put("a", 1));
    assertEquals(HashTableStatus.INVALID_ARGUMENT, e.getStatus());
  }

  @Test void testMissingKeyReadsAsNull() {
    Map<String, Integer> m = ChainedHashTable.create(8).asMap();
    assertNull(m.get("missing"));
    assertNull(m.getOrDefault("missing", null));
    assertEquals(808, m.getOrDefault("missing", 808));
    assertEquals(606, m.computeIfAbsent("missing", k -> 606));
    assertEquals(606, m.get("missing"));
  }

  @Test void testPutKeepsValueWhenTableCannotGrow() {
    TrackingAllocator alloc = new TrackingAllocator();
    alloc.maxBuckets = 4;
    ChainedHashTable t = ChainedHashTable.create(4, Djb2Hasher.instance(), alloc);
    Map<String, Integer> m = t.asMap();
    for (int i = 0; i < 6; i++) {
      assertNull(m.put("k" + i, i));
    }
    assertEquals(4, t.capacity());
    assertEquals(6, m.size());
    for (int i = 0; i < 6; i++) {
      assertEquals(i, m.get("k" + i));
    }
    assertEquals(5, m.put("k5", 50));
  }
}
