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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Address of one cell of the cube: a fixed-length tuple holding one index value per
 * dimension. A {@code null} slot stands for the total (default) index of its
 * dimension.
 * <p>
 * Keys are immutable and compare by element-wise value equality, so they are used
 * directly as hash map keys. The {@code with}, {@code select} and {@code remove}
 * methods return new keys.
 *
 * @param <T>
 *            the type of the index values
 */
public final class CompositeKey<T>
{
    private final Object[] slots;

    private CompositeKey(Object[] slots)
    {
        this.slots = slots;
    }

    public static <T> CompositeKey<T> of(List<? extends T> values)
    {
        return new CompositeKey<T>(values.toArray());
    }

    @SafeVarargs
    public static <T> CompositeKey<T> of(T... values)
    {
        return new CompositeKey<T>(Arrays.copyOf(values, values.length, Object[].class));
    }

    /**
     * Returns a key of the given length with every slot set to the total index.
     */
    public static <T> CompositeKey<T> totals(int size)
    {
        return new CompositeKey<T>(new Object[size]);
    }

    public int size()
    {
        return slots.length;
    }

    @SuppressWarnings("unchecked")
    public T get(int position)
    {
        return (T) slots[position];
    }

    public CompositeKey<T> with(int position, T value)
    {
        Object[] copy = slots.clone();
        copy[position] = value;
        return new CompositeKey<T>(copy);
    }

    /**
     * Returns the key holding only the slots at the given positions, in the given
     * order.
     */
    public CompositeKey<T> select(int[] positions)
    {
        Object[] selected = new Object[positions.length];
        for (int i = 0; i < positions.length; i++)
            selected[i] = slots[positions[i]];
        return new CompositeKey<T>(selected);
    }

    /**
     * Returns the key with the slots at the given positions removed. The relative order
     * of the remaining slots is kept.
     */
    public CompositeKey<T> remove(int[] positions)
    {
        boolean[] removed = new boolean[slots.length];
        int count = 0;
        for (int position : positions)
        {
            if (!removed[position])
                count++;
            removed[position] = true;
        }

        Object[] remaining = new Object[slots.length - count];
        int idx = 0;
        for (int i = 0; i < slots.length; i++)
        {
            if (!removed[i])
                remaining[idx++] = slots[i];
        }
        return new CompositeKey<T>(remaining);
    }

    @SuppressWarnings("unchecked")
    public List<T> asList()
    {
        List<T> list = new ArrayList<T>(slots.length);
        for (Object slot : slots)
            list.add((T) slot);
        return Collections.unmodifiableList(list);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(slots);
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        CompositeKey<?> other = (CompositeKey<?>) obj;
        return Arrays.equals(slots, other.slots);
    }

    @Override
    public String toString()
    {
        StringBuilder b = new StringBuilder("(");

        for (int i = 0; i < slots.length; i++)
        {
            if (slots[i] != null)
                b.append(slots[i]);
            if (i != slots.length - 1)
                b.append(",");
        }

        return b.append(")").toString();
    }
}
