/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.keymeta.api.CastKind;
import dev.keymeta.api.MetaValue;
import dev.keymeta.api.storage.AttributeStore;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AttributesImplTest {
  private static final String POST = "post";

  private InMemoryAttributeStore store;
  private AttributesImpl attributes;

  @BeforeEach
  void setUp() {
    store = new InMemoryAttributeStore(List.of("post", "user"));
    attributes = new AttributesImpl(store);
  }

  @Test
  void counterLifecycle() {
    assertTrue(attributes.update(POST, 42, "view_count", MetaValue.of(5L)));

    assertEquals(OptionalLong.of(6L), attributes.increment(POST, 42, "view_count"));
    assertEquals(OptionalLong.of(4L), attributes.decrement(POST, 42, "view_count", 2));
    assertEquals(4L, attributes.getInt(POST, 42, "view_count", 0));
    assertEquals(MetaValue.of(4L), attributes.get(POST, 42, "view_count"));
  }

  @Test
  void absentCounterStartsAtZero() {
    assertEquals(
        MetaValue.of(0L),
        attributes.getCast(POST, 123, "view_count", CastKind.INT, MetaValue.of(0L)));
    assertEquals(OptionalLong.of(1L), attributes.increment(POST, 123, "view_count"));
    assertEquals(MetaValue.of(1L), attributes.get(POST, 123, "view_count"));
  }

  @Test
  void incrementThenDecrementRestoresValue() {
    attributes.update(POST, 1, "n", MetaValue.of(-4L));

    attributes.increment(POST, 1, "n", 9);
    attributes.decrement(POST, 1, "n", 9);

    assertEquals(-4L, attributes.getInt(POST, 1, "n", 0));
  }

  @Test
  void appendThenRemoveRestoresList() {
    MetaValue before = MetaValue.list(MetaValue.of("a"), MetaValue.of(2L));
    attributes.update(POST, 1, "tags", before);

    attributes.arrayAppend(POST, 1, "tags", MetaValue.map(Map.of("k", MetaValue.of(true))));
    attributes.arrayRemove(POST, 1, "tags", MetaValue.map(Map.of("k", MetaValue.of(true))));

    assertEquals(before, attributes.get(POST, 1, "tags"));
  }

  @Test
  void nestedReadStopsAtScalarIntermediate() {
    attributes.setNested(POST, 1, "cfg", "a.b", MetaValue.of(5L));

    assertEquals(MetaValue.of(5L), attributes.getNested(POST, 1, "cfg", "a.b", null));
    assertEquals(
        MetaValue.of("d"), attributes.getNested(POST, 1, "cfg", "a.b.c", MetaValue.of("d")));
  }

  @Test
  void incrementTreatsAbsentAndTextAsNumbers() {
    assertEquals(OptionalLong.of(1L), attributes.increment(POST, 1, "hits"));

    attributes.update(POST, 1, "legacy", MetaValue.of("7 views"));
    assertEquals(OptionalLong.of(10L), attributes.increment(POST, 1, "legacy", 3));
  }

  @Test
  void decrementIgnoresSign() {
    attributes.update(POST, 1, "stock", MetaValue.of(10L));

    assertEquals(OptionalLong.of(7L), attributes.decrement(POST, 1, "stock", -3));
  }

  @Test
  void incrementOverflowLeavesValueUntouched() {
    attributes.update(POST, 1, "big", MetaValue.of(Long.MAX_VALUE));

    assertTrue(attributes.increment(POST, 1, "big").isEmpty());
    assertEquals(MetaValue.of(Long.MAX_VALUE), attributes.get(POST, 1, "big"));
  }

  @Test
  void emptyStringReadsAsAbsent() {
    attributes.update(POST, 1, "blank", MetaValue.of(""));

    assertFalse(attributes.exists(POST, 1, "blank"));
    assertNull(attributes.get(POST, 1, "blank"));
    assertEquals(
        MetaValue.of("fallback"),
        attributes.getOrDefault(POST, 1, "blank", MetaValue.of("fallback")));
    assertEquals(List.of(MetaValue.of("")), attributes.getValues(POST, 1, "blank"));
  }

  @Test
  void getValuesReturnsEveryRow() {
    store.add(POST, 3, "tag", MetaValue.of("a"));
    store.add(POST, 3, "tag", MetaValue.of("b"));

    assertEquals(
        List.of(MetaValue.of("a"), MetaValue.of("b")), attributes.getValues(POST, 3, "tag"));
    assertEquals(MetaValue.of("a"), attributes.get(POST, 3, "tag"));
    assertNull(attributes.getValues(POST, 3, "missing"));

    attributes.update(POST, 3, "tag", MetaValue.of("c"));
    assertEquals(List.of(MetaValue.of("c")), attributes.getValues(POST, 3, "tag"));
  }

  @Test
  void typedReadsApplyCasts() {
    attributes.update(POST, 1, "price", MetaValue.of("19.99"));
    attributes.update(POST, 1, "ratio", MetaValue.of(15.0d));

    assertEquals(19L, attributes.getInt(POST, 1, "price", 0));
    assertEquals(19.99d, attributes.getFloat(POST, 1, "price", 0));
    assertEquals("15", attributes.getString(POST, 1, "ratio", null));
    assertEquals("none", attributes.getString(POST, 1, "missing", "none"));
    assertTrue(attributes.getBool(POST, 1, "price", false));
    assertTrue(attributes.getBool(POST, 1, "missing", true));
    assertEquals(
        MetaValue.of(7L),
        attributes.getCast(POST, 1, "missing", CastKind.INT, MetaValue.of("7")));
    assertEquals(
        MetaValue.list(MetaValue.of("19.99")),
        attributes.getCast(POST, 1, "price", CastKind.LIST, null));
  }

  @Test
  void updateIfChangedDistinguishesTypes() {
    attributes.update(POST, 1, "flag", MetaValue.of("1"));

    assertFalse(attributes.updateIfChanged(POST, 1, "flag", MetaValue.of("1")));
    assertTrue(attributes.updateIfChanged(POST, 1, "flag", MetaValue.of(1L)));
    assertEquals(MetaValue.of(1L), attributes.get(POST, 1, "flag"));
  }

  @Test
  void updateIfChangedSkipsWriteForEqualContainers() {
    AttributeStore mocked = mock(AttributeStore.class);
    MetaValue stored = MetaValue.map(Map.of("a", MetaValue.list(MetaValue.of(1L))));
    when(mocked.values(POST, 9, "settings")).thenReturn(List.of(stored));

    AttributesImpl subject = new AttributesImpl(mocked);
    boolean written =
        subject.updateIfChanged(
            POST, 9, "settings", MetaValue.map(Map.of("a", MetaValue.list(MetaValue.of(1L)))));

    assertFalse(written);
    verify(mocked, never()).set(anyString(), anyLong(), anyString(), any());
  }

  @Test
  void deleteIgnoresNonPositiveIds() {
    attributes.update(POST, 1, "k", MetaValue.of("v"));

    assertFalse(attributes.delete(POST, 0, "k"));
    assertTrue(attributes.delete(POST, 1, "k"));
    assertFalse(attributes.delete(POST, 1, "k"));
  }

  @Test
  void arrayOperationsUseStrictEquality() {
    assertTrue(attributes.arrayAppend(POST, 1, "tags", MetaValue.of("1")));
    assertTrue(attributes.arrayAppend(POST, 1, "tags", MetaValue.of(1L)));
    assertTrue(attributes.arrayAppend(POST, 1, "tags", MetaValue.of("1")));

    assertEquals(3, attributes.arrayCount(POST, 1, "tags"));
    assertTrue(attributes.arrayContains(POST, 1, "tags", MetaValue.of(1L)));
    assertFalse(attributes.arrayContains(POST, 1, "tags", MetaValue.of(1.0d)));

    assertTrue(attributes.arrayRemove(POST, 1, "tags", MetaValue.of(1L)));
    assertFalse(attributes.arrayRemove(POST, 1, "tags", MetaValue.of(1L)));
    assertEquals(
        MetaValue.list(MetaValue.of("1"), MetaValue.of("1")), attributes.get(POST, 1, "tags"));

    assertTrue(attributes.arrayUnique(POST, 1, "tags"));
    assertFalse(attributes.arrayUnique(POST, 1, "tags"));
    assertEquals(MetaValue.list(MetaValue.of("1")), attributes.get(POST, 1, "tags"));

    assertTrue(attributes.arrayRemoveAll(POST, 1, "tags", MetaValue.of("1")));
    assertEquals(MetaValue.list(), attributes.get(POST, 1, "tags"));
    assertFalse(attributes.arrayRemoveAll(POST, 1, "tags", MetaValue.of("1")));
  }

  @Test
  void arrayAppendReplacesScalar() {
    attributes.update(POST, 1, "tags", MetaValue.of("solo"));

    assertFalse(attributes.arrayContains(POST, 1, "tags", MetaValue.of("solo")));
    assertEquals(0, attributes.arrayCount(POST, 1, "tags"));
    assertTrue(attributes.arrayAppend(POST, 1, "tags", MetaValue.of("x")));
    assertEquals(MetaValue.list(MetaValue.of("x")), attributes.get(POST, 1, "tags"));
  }

  @Test
  void nestedWriteBuildsIntermediateMaps() {
    assertTrue(attributes.setNested(POST, 1, "prefs", "a.b.c", MetaValue.of("dark")));

    assertEquals(
        MetaValue.of("dark"), attributes.getNested(POST, 1, "prefs", "a.b.c", MetaValue.of("x")));
    assertEquals(
        MetaValue.of("x"), attributes.getNested(POST, 1, "prefs", "a.b.z", MetaValue.of("x")));
    assertTrue(attributes.removeNested(POST, 1, "prefs", "a.b.c"));
    assertEquals(
        MetaValue.map(Map.of("a", MetaValue.map(Map.of("b", MetaValue.emptyMap())))),
        attributes.get(POST, 1, "prefs"));
    assertFalse(attributes.removeNested(POST, 1, "prefs", "a.b.c"));
  }

  @Test
  void nestedReadOfScalarReturnsDefault() {
    attributes.update(POST, 1, "prefs", MetaValue.of("plain"));

    assertEquals(
        MetaValue.of(0L), attributes.getNested(POST, 1, "prefs", "theme", MetaValue.of(0L)));
    assertNull(attributes.getNested(POST, 2, "prefs", "theme", null));
  }

  @Test
  void jsonAccessors() {
    attributes.update(POST, 1, "raw", MetaValue.of("{\"a\":1}"));
    attributes.update(POST, 1, "broken", MetaValue.of("{\"a\":"));

    assertEquals(
        MetaValue.map(Map.of("a", MetaValue.of(1L))),
        attributes.getJson(POST, 1, "raw", null));
    assertEquals(MetaValue.emptyMap(), attributes.getJson(POST, 1, "broken", MetaValue.emptyMap()));
    assertThrows(
        IllegalArgumentException.class,
        () -> attributes.setJson(POST, 1, "raw", MetaValue.of(3L)));
    assertTrue(attributes.setJson(POST, 1, "list", MetaValue.list(MetaValue.of(true))));
    assertEquals(
        MetaValue.list(MetaValue.of(true)), attributes.getJson(POST, 1, "list", null));
  }

  @Test
  void toggleFlipsTruthiness() {
    assertEquals(Optional.of(true), attributes.toggle(POST, 1, "featured"));
    assertEquals(Optional.of(false), attributes.toggle(POST, 1, "featured"));
    assertFalse(attributes.isTruthy(POST, 1, "featured", true));
    assertTrue(attributes.isTruthy(POST, 1, "missing", true));

    attributes.update(POST, 1, "zero", MetaValue.of("0"));
    assertFalse(attributes.isTruthy(POST, 1, "zero", true));
  }

  @Test
  void typeAndSizeIntrospection() {
    attributes.update(POST, 1, "settings", MetaValue.map(Map.of("k", MetaValue.of("é"))));

    assertEquals("array", attributes.getType(POST, 1, "settings"));
    assertTrue(attributes.isType(POST, 1, "settings", "array"));
    assertTrue(attributes.isType(POST, 1, "settings", "MAP"));
    assertFalse(attributes.isType(POST, 1, "settings", "list"));
    assertNull(attributes.getType(POST, 1, "missing"));
    assertEquals(10, attributes.getSize(POST, 1, "settings"));
    assertEquals(0, attributes.getSize(POST, 1, "missing"));
    assertTrue(attributes.isLarge(POST, 1, "settings", 9));
    assertFalse(attributes.isLarge(POST, 1, "settings"));
  }

  @Test
  void isLargeWithoutLimitUsesConfiguredThreshold() {
    AttributesImpl limited = new AttributesImpl(store, 9);
    limited.update(POST, 1, "settings", MetaValue.map(Map.of("k", MetaValue.of("é"))));
    limited.update(POST, 1, "tiny", MetaValue.of(1L));

    assertTrue(limited.isLarge(POST, 1, "settings"));
    assertFalse(limited.isLarge(POST, 1, "tiny"));
  }

  @Test
  void migrateKeyMovesValue() {
    attributes.update(POST, 1, "old_name", MetaValue.of("v"));

    assertTrue(attributes.migrateKey(POST, 1, "old_name", "new_name"));
    assertEquals(MetaValue.of("v"), attributes.get(POST, 1, "new_name"));
    assertFalse(attributes.exists(POST, 1, "old_name"));
  }

  @Test
  void migrateKeyOfAbsentSourceWritesAbsentValue() {
    assertFalse(attributes.migrateKey(POST, 1, "ghost", "dest", true));
    assertFalse(attributes.exists(POST, 1, "dest"));
    assertEquals(List.of(MetaValue.of("")), attributes.getValues(POST, 1, "dest"));

    assertTrue(attributes.migrateKey(POST, 1, "ghost", "dest2", false));
    assertFalse(attributes.exists(POST, 1, "dest2"));
  }

  @Test
  void unknownEntityTypeBehavesLikeEmptyNamespace() {
    assertFalse(attributes.update("widget", 1, "k", MetaValue.of("v")));
    assertNull(attributes.get("widget", 1, "k"));
    assertTrue(attributes.increment("widget", 1, "k").isEmpty());
    assertTrue(attributes.toggle("widget", 1, "k").isEmpty());
  }

  @Test
  void emptyKeyIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> attributes.get(POST, 1, ""));
    assertThrows(
        IllegalArgumentException.class, () -> attributes.update(POST, 1, "", MetaValue.of(1L)));
  }
}
