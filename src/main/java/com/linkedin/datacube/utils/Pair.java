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

package com.linkedin.datacube.utils;

/**
 * An immutable pair of values. Either value may be null; equality and hashing are
 * null-safe.
 *
 * @param <A>
 *            type of the first value
 * @param <B>
 *            type of the second value
 */
public final class Pair<A, B>
{
    private final A first;
    private final B second;

    public Pair(A first, B second)
    {
        this.first = first;
        this.second = second;
    }

    public static <A, B> Pair<A, B> of(A first, B second)
    {
        return new Pair<A, B>(first, second);
    }

    public A getFirst()
    {
        return first;
    }

    public B getSecond()
    {
        return second;
    }

    @Override
    public int hashCode()
    {
        int hashFirst = first != null ? first.hashCode() : 0;
        int hashSecond = second != null ? second.hashCode() : 0;

        return 31 * hashFirst + hashSecond;
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other)
            return true;
        if (!(other instanceof Pair))
            return false;

        Pair<?, ?> otherPair = (Pair<?, ?>) other;
        return (first == null ? otherPair.first == null : first.equals(otherPair.first))
                && (second == null ? otherPair.second == null
                        : second.equals(otherPair.second));
    }

    @Override
    public String toString()
    {
        return "(" + first + ", " + second + ")";
    }
}
