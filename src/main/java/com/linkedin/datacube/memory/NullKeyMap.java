/* (c) 2014 LinkedIn Corp. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use
 * this file except in compliance with the License. You may obtain a copy of the
 * License at  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed
 * under the License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR
 * CONDITIONS OF ANY KIND, either express or implied.
 */

package com.linkedin.datacube.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import com.linkedin.datacube.CubeDefinitionErrorType;
import com.linkedin.datacube.CubeDefinitionException;
import com.linkedin.datacube.utils.Pair;

/**
 * Read-only lookup that accepts exactly one reserved {@code null} key next to regular
 * keys. Regular keys live in an insertion-ordered map, the {@code null} key in a
 * dedicated slot. Iteration order is insertion order, with the {@code null} entry at
 * the place it was supplied.
 *
 * @param <K>
 *            the key type
 * @param <V>
 *            the value type
 */
public final class NullKeyMap<K, V>
{
    private final Map<K, V> inner;
    private final boolean hasNullKey;
    private final V valueForNullKey;
    private final List<Pair<K, V>> entries;

    public NullKeyMap(List<Pair<K, V>> keyValuePairs)
    {
        Map<K, V> map = new LinkedHashMap<K, V>();
        boolean nullKeySeen = false;
        V nullKeyValue = null;

        for (Pair<K, V> pair : keyValuePairs)
        {
            K key = pair.getFirst();
            if (key == null)
            {
                if (nullKeySeen)
                    throw new CubeDefinitionException(CubeDefinitionErrorType.DUPLICATE_DEFAULT_KEY,
                                                      "Default key is duplicated.");
                nullKeySeen = true;
                nullKeyValue = pair.getSecond();
            }
            else
            {
                if (map.containsKey(key))
                    throw new IllegalArgumentException("Key " + key + " is duplicated.");
                map.put(key, pair.getSecond());
            }
        }

        this.inner = map;
        this.hasNullKey = nullKeySeen;
        this.valueForNullKey = nullKeyValue;
        this.entries =
                Collections.unmodifiableList(new ArrayList<Pair<K, V>>(keyValuePairs));
    }

    public int size()
    {
        return hasNullKey ? inner.size() + 1 : inner.size();
    }

    public boolean containsKey(K key)
    {
        return key == null ? hasNullKey : inner.containsKey(key);
    }

    /**
     * Returns the value mapped to the key.
     *
     * @throws NoSuchElementException
     *             if the key is absent
     */
    public V get(K key)
    {
        if (!containsKey(key))
            throw new NoSuchElementException("Key " + key + " is not found in dictionary");
        return key == null ? valueForNullKey : inner.get(key);
    }

    /**
     * Returns the value mapped to the key, or {@code fallback} if the key is absent.
     */
    public V get(K key, V fallback)
    {
        if (!containsKey(key))
            return fallback;
        return key == null ? valueForNullKey : inner.get(key);
    }

    public List<K> keys()
    {
        List<K> keys = new ArrayList<K>(entries.size());
        for (Pair<K, V> entry : entries)
            keys.add(entry.getFirst());
        return keys;
    }

    public List<V> values()
    {
        List<V> values = new ArrayList<V>(entries.size());
        for (Pair<K, V> entry : entries)
            values.add(entry.getSecond());
        return values;
    }

    public List<Pair<K, V>> entries()
    {
        return entries;
    }
}
