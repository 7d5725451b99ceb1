package com.github.flowengine;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recursive value comparison for context graphs. Maps are compared by key set and per-key value,
 * lists and object arrays element-wise and primitive arrays by content, so that an array held in
 * flowData compares by content instead of identity. Everything else falls back to
 * {@link Object#equals(Object)}.
 */
final class StructuralEquality {

  static boolean deepEquals(final Object left, final Object right) {
    if (left == right) {
      return true;
    }
    if (left == null || right == null) {
      return false;
    }
    if (left instanceof Object[] && right instanceof Object[]) {
      return deepEquals(Arrays.asList((Object[]) left), Arrays.asList((Object[]) right));
    }
    if (left.getClass().isArray() && right.getClass().isArray()) {
      return Arrays.deepEquals(new Object[] {left}, new Object[] {right});
    }
    if (left instanceof Map && right instanceof Map) {
      final Map<?, ?> leftMap = (Map<?, ?>) left;
      final Map<?, ?> rightMap = (Map<?, ?>) right;
      if (leftMap.size() != rightMap.size()) {
        return false;
      }
      for (final Map.Entry<?, ?> entry : leftMap.entrySet()) {
        if (!rightMap.containsKey(entry.getKey())) {
          return false;
        }
        if (!deepEquals(entry.getValue(), rightMap.get(entry.getKey()))) {
          return false;
        }
      }
      return true;
    }
    if (left instanceof List && right instanceof List) {
      final List<?> leftList = (List<?>) left;
      final List<?> rightList = (List<?>) right;
      if (leftList.size() != rightList.size()) {
        return false;
      }
      final Iterator<?> leftIterator = leftList.iterator();
      final Iterator<?> rightIterator = rightList.iterator();
      while (leftIterator.hasNext()) {
        if (!deepEquals(leftIterator.next(), rightIterator.next())) {
          return false;
        }
      }
      return true;
    }
    return left.equals(right);
  }

  static int deepHashCode(final Object value) {
    if (value == null) {
      return 0;
    }
    if (value instanceof Object[]) {
      return deepHashCode(Arrays.asList((Object[]) value));
    }
    if (value.getClass().isArray()) {
      return Arrays.deepHashCode(new Object[] {value});
    }
    if (value instanceof Map) {
      int result = 0;
      for (final Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        result += Objects.hashCode(entry.getKey()) ^ deepHashCode(entry.getValue());
      }
      return result;
    }
    if (value instanceof List) {
      int result = 1;
      for (final Object element : (List<?>) value) {
        result = 31 * result + deepHashCode(element);
      }
      return result;
    }
    return value.hashCode();
  }

  private StructuralEquality() {}
}
