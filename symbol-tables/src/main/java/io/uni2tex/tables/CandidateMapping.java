/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable, insertion-ordered, one-to-many mapping. Each key maps to a
 * non-empty list of candidates; the first candidate is the canonical one.
 * 
 * @param <K> key type
 * @param <V> candidate type
 */
public abstract class CandidateMapping<K, V> {
  
  private final Map<K, List<V>> map;
  
  
  /**
   * Copies the given map. Keys with empty candidate lists are dropped.
   */
  protected CandidateMapping(Map<K, ? extends List<V>> map) {
    var copy = new LinkedHashMap<K, List<V>>();
    for (var e : map.entrySet()) {
      var candidates = e.getValue();
      if (candidates.isEmpty())
        continue;
      copy.put(
          Objects.requireNonNull(e.getKey(), "null key"),
          Collections.unmodifiableList(new ArrayList<>(candidates)));
    }
    this.map = Collections.unmodifiableMap(copy);
  }
  
  
  /** Returns the candidates for the given key, in order; empty if not mapped. */
  public List<V> candidates(K key) {
    return map.getOrDefault(key, List.of());
  }
  
  /** Returns the first (canonical) candidate, if any. */
  public Optional<V> canonical(K key) {
    var candidates = map.get(key);
    return candidates == null ? Optional.empty() : Optional.of(candidates.get(0));
  }
  
  
  public boolean contains(K key) {
    return map.containsKey(key);
  }
  
  
  /** Returns the keys in insertion order. */
  public Set<K> keys() {
    return map.keySet();
  }
  
  
  public int size() {
    return map.size();
  }
  
  
  public boolean isEmpty() {
    return map.isEmpty();
  }
  
  
  /** Returns an unmodifiable, insertion-ordered view. */
  public Map<K, List<V>> asMap() {
    return map;
  }
  
  
  /**
   * Returns the number of keys mapped to more than one candidate.
   */
  public int ambiguousCount() {
    int count = 0;
    for (var candidates : map.values())
      if (candidates.size() > 1)
        ++count;
    return count;
  }
  
  
  /**
   * Instances are equal if they're of the same class and map the
   * same keys to the same candidate lists. Key order is not considered.
   */
  @Override
  public final boolean equals(Object o) {
    return o == this ||
        o != null && o.getClass() == getClass() &&
        ((CandidateMapping<?, ?>) o).map.equals(map);
  }
  
  
  @Override
  public final int hashCode() {
    return map.hashCode();
  }
  
  
  @Override
  public String toString() {
    return getClass().getSimpleName() + "[size=" + map.size() + "]";
  }

}
