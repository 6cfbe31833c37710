/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import dev.keymeta.api.Comparison;
import dev.keymeta.api.ErrorCode;
import dev.keymeta.api.MetaValue;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryAttributeStoreTest {
  private final InMemoryAttributeStore store = new InMemoryAttributeStore(List.of("post"));

  @Test
  void setCollapsesRowsAddedForKey() {
    store.add("post", 1, "k", MetaValue.of("a"));
    store.add("post", 1, "k", MetaValue.of("b"));

    assertEquals(2, store.values("post", 1, "k").size());
    assertTrue(store.set("post", 1, "k", MetaValue.of("c")));
    assertEquals(List.of(MetaValue.of("c")), store.values("post", 1, "k"));
  }

  @Test
  void allKeepsInsertionOrder() {
    store.set("post", 1, "z", MetaValue.of(1L));
    store.set("post", 1, "a", MetaValue.of(2L));

    Map<String, List<MetaValue>> all = store.all("post", 1);

    assertEquals(List.of("z", "a"), List.copyOf(all.keySet()));
    assertTrue(store.all("post", 2).isEmpty());
  }

  @Test
  void unknownTypeRejectsWritesAndReadsEmpty() {
    assertFalse(store.supports("widget"));
    assertFalse(store.set("widget", 1, "k", MetaValue.of(1L)));
    assertFalse(store.add("widget", 1, "k", MetaValue.of(1L)));
    assertTrue(store.values("widget", 1, "k").isEmpty());
    assertEquals(0, store.deleteRowsByKey("widget", "k"));
    assertTrue(store.findIds("widget", "k", MetaValue.of(1L), Comparison.EQ).isEmpty());
  }

  @Test
  void readsAndWritesAreCounted() {
    Metrics metrics = mock(Metrics.class);
    InMemoryAttributeStore counted = new InMemoryAttributeStore(List.of("post"), metrics);

    counted.set("post", 1, "k", MetaValue.of(1L));
    counted.values("post", 1, "k");
    counted.all("post", 1);
    counted.delete("post", 1, "k");
    counted.set("widget", 1, "k", MetaValue.of(1L));

    verify(metrics, times(2)).recordWrite(true, null);
    verify(metrics, times(2)).recordRead(true, null);
    verify(metrics).recordWrite(false, ErrorCode.UNKNOWN_ENTITY_TYPE);
  }

  @Test
  void prefixScanIsLiteralAndSorted() {
    store.set("post", 1, "temp_b", MetaValue.of(1L));
    store.set("post", 2, "temp_a", MetaValue.of(1L));
    store.set("post", 2, "tempXa", MetaValue.of(1L));
    store.set("post", 3, "other", MetaValue.of(1L));

    assertEquals(List.of("temp_a", "temp_b"), store.distinctKeysByPrefix("post", "temp_"));
  }

  @Test
  void findIdsMatchesAnyRowOnce() {
    store.add("post", 5, "color", MetaValue.of("red"));
    store.add("post", 5, "color", MetaValue.of("red"));
    store.add("post", 2, "color", MetaValue.of("blue"));
    store.add("post", 2, "color", MetaValue.of("red"));

    assertEquals(
        List.of(2L, 5L), store.findIds("post", "color", MetaValue.of("red"), Comparison.EQ));
  }
}
