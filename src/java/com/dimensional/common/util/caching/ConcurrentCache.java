// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.dimensional.common.util.caching;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;

import com.dimensional.common.base.MorePreconditions;

/**
 * An unbounded, thread-safe cache for values that never go stale, such as patterns compiled from
 * immutable tables.  Lookups never lock; a miss computes the value outside of any lock and the
 * first value stored for a key wins, so racing loaders of the same key are harmless.
 */
public class ConcurrentCache<K, V> implements Cache<K, V> {

  private final String name;
  private final ConcurrentMap<K, V> map = new ConcurrentHashMap<K, V>();
  private final AtomicLong accesses = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();

  /**
   * Creates a new empty cache.
   *
   * @param name Name for this cache, used when describing it.
   */
  public ConcurrentCache(String name) {
    this.name = MorePreconditions.checkNotBlank(name);
  }

  @Override
  public V get(K key) {
    accesses.incrementAndGet();
    V value = map.get(key);
    if (value == null) {
      misses.incrementAndGet();
    }
    return value;
  }

  @Override
  public V fetch(K key, Supplier<? extends V> loader) {
    V value = get(key);
    if (value != null) {
      return value;
    }

    V computed = Preconditions.checkNotNull(loader.get(), "Loader returned null for %s", key);
    V raced = map.putIfAbsent(key, computed);
    return raced != null ? raced : computed;
  }

  @Override
  public void put(K key, V value) {
    map.put(Preconditions.checkNotNull(key), Preconditions.checkNotNull(value));
  }

  @Override
  public void delete(K key) {
    map.remove(key);
  }

  public int size() {
    return map.size();
  }

  public long getAccesses() {
    return accesses.get();
  }

  public long getMisses() {
    return misses.get();
  }

  @Override
  public String toString() {
    return String.format("%s size: %d, accesses: %s, misses: %s", name, map.size(), accesses,
        misses);
  }
}
