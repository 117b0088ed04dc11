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
 * A half-open range of positions, {@code [start, end)}, resolved against a length when
 * it is used.
 */
public final class PositionRange
{
    private final Position start;
    private final Position end;

    private PositionRange(Position start, Position end)
    {
        if (start == null || end == null)
            throw new IllegalArgumentException("Range bounds must not be null");

        this.start = start;
        this.end = end;
    }

    public static PositionRange of(Position start, Position end)
    {
        return new PositionRange(start, end);
    }

    public static PositionRange of(int start, int end)
    {
        return new PositionRange(Position.fromStart(start), Position.fromStart(end));
    }

    /**
     * The range covering every position.
     */
    public static PositionRange all()
    {
        return new PositionRange(Position.fromStart(0), Position.fromEnd(0));
    }

    public Position getStart()
    {
        return start;
    }

    public Position getEnd()
    {
        return end;
    }

    /**
     * Returns the 0-based offsets covered by this range in a list of the given length.
     *
     * @throws IllegalArgumentException
     *             if the range does not fit into the length
     */
    public int[] getOffsets(int length)
    {
        int startOffset = start.getOffset(length);
        int endOffset = end.getOffset(length);
        if (startOffset < 0 || endOffset > length || startOffset > endOffset)
            throw new IllegalArgumentException("Range " + this + " is out of range for length "
                    + length + ".");

        int[] offsets = new int[endOffset - startOffset];
        for (int i = 0; i < offsets.length; i++)
            offsets[i] = startOffset + i;
        return offsets;
    }

    @Override
    public String toString()
    {
        return start + ".." + end;
    }
}
