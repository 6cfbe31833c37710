/* Keymeta © 2025 — MIT */
package dev.keymeta.util;

import dev.keymeta.api.MetaValue;
import dev.keymeta.api.MetaValue.ListValue;
import dev.keymeta.api.MetaValue.MapValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Dot-separated paths ({@code a.b.c}) into tree-shaped values.
 *
 * <p>Values are immutable, so writes rebuild the chain of containers from the leaf back up to the
 * root and return a new root. Maps are addressed by key and lists by decimal index; a scalar on
 * the way ends a read and is replaced by a new map on a write.
 */
public final class DotPath {

  private DotPath() {}

  /**
   * Splits a path on {@code '.'}. Empty segments are kept, so {@code "a..b"} has three segments.
   *
   * @param path dot path
   * @return segments
   * @throws IllegalArgumentException when the path is empty
   */
  public static String[] segments(String path) {
    Objects.requireNonNull(path, "path");
    if (path.isEmpty()) {
      throw new IllegalArgumentException("path must not be empty");
    }
    return path.split("\\.", -1);
  }

  /**
   * Resolves {@code path} below {@code root}.
   *
   * @param root value to walk, may be {@code null}
   * @param path dot path
   * @return the value at the path, or empty when a segment is missing or a scalar is reached
   */
  public static Optional<MetaValue> get(MetaValue root, String path) {
    MetaValue node = root;
    for (String segment : segments(path)) {
      node = child(node, segment);
      if (node == null) {
        return Optional.empty();
      }
    }
    return Optional.of(node);
  }

  /**
   * Returns a copy of {@code root} with {@code value} placed at {@code path}. Missing maps are
   * created and scalar nodes on the way are replaced by new maps. A list keeps its shape when the
   * segment is an index within it or one past its end; any other segment turns it into a map keyed
   * by the former indexes.
   *
   * @param root current value, may be {@code null}
   * @param path dot path
   * @param value value to place
   * @return new root
   */
  public static MetaValue set(MetaValue root, String path, MetaValue value) {
    Objects.requireNonNull(value, "value");
    return setIn(root, segments(path), 0, value);
  }

  /**
   * Returns a copy of {@code root} without the entry at {@code path}.
   *
   * @param root current value, may be {@code null}
   * @param path dot path
   * @return new root, or empty when the path does not resolve to an existing entry
   */
  public static Optional<MetaValue> remove(MetaValue root, String path) {
    if (root == null || !root.isContainer()) {
      return Optional.empty();
    }
    return removeIn(root, segments(path), 0);
  }

  private static MetaValue setIn(MetaValue node, String[] segments, int depth, MetaValue value) {
    String segment = segments[depth];
    MetaValue replacement =
        depth == segments.length - 1
            ? value
            : setIn(child(node, segment), segments, depth + 1, value);
    if (node instanceof ListValue list) {
      int index = index(segment);
      if (index >= 0 && index <= list.size()) {
        List<MetaValue> items = new ArrayList<>(list.items());
        if (index == items.size()) {
          items.add(replacement);
        } else {
          items.set(index, replacement);
        }
        return new ListValue(items);
      }
    }
    Map<String, MetaValue> copy = entries(node);
    copy.put(segment, replacement);
    return new MapValue(copy);
  }

  private static Optional<MetaValue> removeIn(MetaValue node, String[] segments, int depth) {
    String segment = segments[depth];
    MetaValue current = child(node, segment);
    if (current == null) {
      return Optional.empty();
    }
    MetaValue replacement = null;
    if (depth < segments.length - 1) {
      if (!current.isContainer()) {
        return Optional.empty();
      }
      Optional<MetaValue> rebuilt = removeIn(current, segments, depth + 1);
      if (rebuilt.isEmpty()) {
        return Optional.empty();
      }
      replacement = rebuilt.get();
    }
    if (node instanceof ListValue list) {
      List<MetaValue> items = new ArrayList<>(list.items());
      int index = index(segment);
      if (replacement == null) {
        items.remove(index);
      } else {
        items.set(index, replacement);
      }
      return Optional.of(new ListValue(items));
    }
    Map<String, MetaValue> copy = entries(node);
    if (replacement == null) {
      copy.remove(segment);
    } else {
      copy.put(segment, replacement);
    }
    return Optional.of(new MapValue(copy));
  }

  private static MetaValue child(MetaValue node, String segment) {
    if (node instanceof MapValue map) {
      return map.get(segment);
    }
    if (node instanceof ListValue list) {
      int index = index(segment);
      return index >= 0 && index < list.size() ? list.items().get(index) : null;
    }
    return null;
  }

  /** Copies a container into a mutable map; list indexes become keys, scalars yield nothing. */
  private static Map<String, MetaValue> entries(MetaValue node) {
    Map<String, MetaValue> copy = new LinkedHashMap<>();
    if (node instanceof MapValue map) {
      copy.putAll(map.entries());
    } else if (node instanceof ListValue list) {
      for (int i = 0; i < list.size(); i++) {
        copy.put(Integer.toString(i), list.items().get(i));
      }
    }
    return copy;
  }

  private static int index(String segment) {
    if (segment.isEmpty() || segment.length() > 9) {
      return -1;
    }
    for (int i = 0; i < segment.length(); i++) {
      if (!Character.isDigit(segment.charAt(i))) {
        return -1;
      }
    }
    if (segment.length() > 1 && segment.charAt(0) == '0') {
      return -1;
    }
    return Integer.parseInt(segment);
  }
}
