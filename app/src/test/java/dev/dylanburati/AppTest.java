package dev.dylanburati;

import dev.dylanburati.chainmap.ChainedHashTable;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;

class AppTest {
  @Test void testImplementationsAgree() {
    int words = 200_000;
    int expected = App.wordcount(new HashMap<>(), words);
    assertTrue(expected > 0);
    assertEquals(expected, App.wordcount(new Object2IntOpenHashMap<>(), words));
    assertEquals(expected, App.wordcount(ChainedHashTable.create(16).asMap(), words));
    try (ChainedHashTable t = ChainedHashTable.create(16)) {
      assertEquals(expected, App.wordcountNative(t, words));
      assertTrue(t.loadFactor() <= ChainedHashTable.MAX_LOAD_FACTOR);
    }
  }
}
