package com.mesosphere.dra.specification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies collections handed to the specification objects. A {@code null} input stays {@code null}, since an absent
 * field and an empty one are distinguished when documents are resolved and written back out.
 */
public final class SpecCollections {

  private SpecCollections() {
    // do not instantiate
  }

  public static <K, V> Map<K, V> copyOf(Map<K, V> map) {
    return map == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(map));
  }

  public static <T> List<T> copyOf(List<T> list) {
    return list == null ? null : Collections.unmodifiableList(new ArrayList<>(list));
  }

  public static int size(Map<?, ?> map) {
    return map == null ? 0 : map.size();
  }

  public static int size(List<?> list) {
    return list == null ? 0 : list.size();
  }

  /**
   * Returns the list itself, or an empty list if it's {@code null}.
   */
  public static <T> List<T> orEmpty(List<T> list) {
    return list == null ? Collections.emptyList() : list;
  }

  /**
   * Returns the map itself, or an empty map if it's {@code null}.
   */
  public static <K, V> Map<K, V> orEmpty(Map<K, V> map) {
    return map == null ? Collections.emptyMap() : map;
  }
}
