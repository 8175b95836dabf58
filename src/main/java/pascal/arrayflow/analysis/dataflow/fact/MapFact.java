/*
 * Tai-e: A Static Analysis Framework for Java
 *
 * Copyright (C) 2022 Tian Tan <tiantan@nju.edu.cn>
 * Copyright (C) 2022 Yue Li <yueli@nju.edu.cn>
 *
 * This file is part of Tai-e.
 *
 * Tai-e is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License
 * as published by the Free Software Foundation, either version 3
 * of the License, or (at your option) any later version.
 *
 * Tai-e is distributed in the hope that it will be useful,but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY
 * or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General
 * Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public
 * License along with Tai-e. If not, see <https://www.gnu.org/licenses/>.
 */

package pascal.arrayflow.analysis.dataflow.fact;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Represents map-like data-flow facts.
 *
 * @param <K> type of keys
 * @param <V> type of values
 */
public class MapFact<K, V> {

    protected final Map<K, V> map;

    public MapFact(Map<K, V> map) {
        this.map = new HashMap<>(map);
    }

    /**
     * @return the value bound to given key, or null if key is absent.
     */
    public V get(K key) {
        return map.get(key);
    }

    /**
     * Updates the key-value mapping in this fact.
     *
     * @return true if the update changes this fact, otherwise false.
     */
    public boolean update(K key, V value) {
        return !Objects.equals(map.put(key, value), value);
    }

    /**
     * Removes the key and its value from this fact.
     *
     * @return the previous value bound to given key, or null if absent.
     */
    public V remove(K key) {
        return map.remove(key);
    }

    /**
     * Replaces the content of this fact by the content of given fact.
     *
     * @return true if this fact changed, otherwise false.
     */
    public boolean copyFrom(MapFact<K, V> fact) {
        if (map.equals(fact.map)) {
            return false;
        }
        map.clear();
        map.putAll(fact.map);
        return true;
    }

    public MapFact<K, V> copy() {
        return new MapFact<>(map);
    }

    public Set<K> keySet() {
        return Collections.unmodifiableSet(map.keySet());
    }

    public void forEach(BiConsumer<K, V> action) {
        map.forEach(action);
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public int size() {
        return map.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MapFact<?, ?> that = (MapFact<?, ?>) o;
        return map.equals(that.map);
    }

    @Override
    public int hashCode() {
        return map.hashCode();
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
