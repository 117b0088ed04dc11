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

package com.linkedin.datacube.cube;

/**
 * A position in an ordered list whose length is only known when the position is used,
 * counted either from the start (0-based) or from the end (1-based, so that
 * {@code fromEnd(1)} is the last element).
 */
public final class Position
{
    private final int value;
    private final boolean fromEnd;

    private Position(int value, boolean fromEnd)
    {
        if (value < 0)
            throw new IllegalArgumentException("Position must not be negative: " + value);

        this.value = value;
        this.fromEnd = fromEnd;
    }

    public static Position fromStart(int value)
    {
        return new Position(value, false);
    }

    public static Position fromEnd(int value)
    {
        return new Position(value, true);
    }

    public int getValue()
    {
        return value;
    }

    public boolean isFromEnd()
    {
        return fromEnd;
    }

    /**
     * Returns the 0-based offset of this position in a list of the given length. The
     * result is not range checked and may be negative or not less than {@code length}.
     */
    public int getOffset(int length)
    {
        return fromEnd ? length - value : value;
    }

    @Override
    public int hashCode()
    {
        return 31 * value + (fromEnd ? 1 : 0);
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
            return true;
        if (!(obj instanceof Position))
            return false;
        Position other = (Position) obj;
        return value == other.value && fromEnd == other.fromEnd;
    }

    @Override
    public String toString()
    {
        return fromEnd ? "^" + value : Integer.toString(value);
    }
}
