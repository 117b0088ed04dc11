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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.linkedin.datacube.dimension.Dimension;
import com.linkedin.datacube.dimension.IndexDefinition;
import com.linkedin.datacube.memory.CompositeKey;
import com.linkedin.datacube.utils.CartesianProduct;
import com.linkedin.datacube.utils.Pair;

/**
 * Immutable view of a built cube.
 * <p>
 * A view has a number of <em>free</em> dimensions and a history of <em>bound</em>
 * dimensions, each pinned to one index by a slice. Slicing returns a new view that shares
 * the cells and dimensions of this one; no view is ever modified, so views can be queried
 * from any number of threads.
 * <p>
 * Dimension numbers passed to the methods of this class are relative: free dimension
 * numbers count the free dimensions of this view from 0, bound dimension numbers count
 * the slices in the order they were applied. Every such number can be given as an
 * {@code int} (from the start) or as a {@link Position}.
 * <p>
 * A {@code null} index denotes the total (default) index of a dimension. Reading a cell
 * no record contributed to returns the seed of the aggregation; it is not an error.
 *
 * @param <T>
 *            the type of the index values
 * @param <V>
 *            the type of the aggregated value
 */
public final class CubeResult<T, V>
{
    private final Map<CompositeKey<T>, V> resultMap;
    private final V seed;
    private final List<Dimension<T>> dimensions;
    private final List<Pair<Integer, T>> boundings;
    private final int[] freeDimensionNumbers;
    private final int[] boundDimensionNumbers;
    private final CompositeKey<T> key;

    CubeResult(Map<CompositeKey<T>, V> resultMap, V seed, List<Dimension<T>> dimensions)
    {
        this(Collections.unmodifiableMap(resultMap),
             seed,
             Collections.unmodifiableList(dimensions),
             Collections.<Pair<Integer, T>> emptyList());
    }

    private CubeResult(Map<CompositeKey<T>, V> resultMap,
                       V seed,
                       List<Dimension<T>> dimensions,
                       List<Pair<Integer, T>> boundings)
    {
        this.resultMap = resultMap;
        this.seed = seed;
        this.dimensions = dimensions;
        this.boundings = boundings;

        CompositeKey<T> boundKey = CompositeKey.totals(dimensions.size());
        boundDimensionNumbers = new int[boundings.size()];
        boolean[] bound = new boolean[dimensions.size()];
        for (int i = 0; i < boundings.size(); i++)
        {
            int number = boundings.get(i).getFirst();
            boundDimensionNumbers[i] = number;
            bound[number] = true;
            boundKey = boundKey.with(number, boundings.get(i).getSecond());
        }
        this.key = boundKey;

        freeDimensionNumbers = new int[dimensions.size() - boundings.size()];
        int idx = 0;
        for (int number = 0; number < dimensions.size(); number++)
        {
            if (!bound[number])
                freeDimensionNumbers[idx++] = number;
        }
    }

    public int getFreeDimensionCount()
    {
        return freeDimensionNumbers.length;
    }

    public int getBoundDimensionCount()
    {
        return boundings.size();
    }

    /**
     * @return the value reported for cells without any contribution
     */
    public V getSeed()
    {
        return seed;
    }

    /**
     * Slices this view by the index in the first free dimension.
     */
    public CubeResult<T, V> get(T index)
    {
        return slice(0, index);
    }

    public CubeResult<T, V> slice(int dimensionNumber, T index)
    {
        return slice(Position.fromStart(dimensionNumber), index);
    }

    /**
     * Slices this view by the index in the given free dimension. The new view's free
     * dimensions are renumbered from 0.
     *
     * @throws IllegalArgumentException
     *             if the dimension number is out of range
     */
    public CubeResult<T, V> slice(Position dimensionNumber, T index)
    {
        List<Pair<Integer, T>> updated = new ArrayList<Pair<Integer, T>>(boundings);
        updated.add(Pair.of(getFreeDimensionNumber(dimensionNumber), index));
        return new CubeResult<T, V>(resultMap, seed, dimensions, Collections.unmodifiableList(updated));
    }

    @SafeVarargs
    public final CubeResult<T, V> slice(Pair<Position, T>... dimensionsAndIndexes)
    {
        return slice(Arrays.asList(dimensionsAndIndexes));
    }

    /**
     * Slices this view by several free dimensions at once. All dimension numbers are
     * resolved against the free dimensions of this view before any of them is bound.
     *
     * @throws IllegalArgumentException
     *             if a dimension number is out of range, or two of them denote the same
     *             dimension
     */
    public CubeResult<T, V> slice(List<Pair<Position, T>> dimensionsAndIndexes)
    {
        List<Pair<Integer, T>> updated = new ArrayList<Pair<Integer, T>>(boundings);
        Set<Integer> numbers = new HashSet<Integer>();
        for (Pair<Position, T> item : dimensionsAndIndexes)
        {
            int number = getFreeDimensionNumber(item.getFirst());
            if (!numbers.add(number))
                throw new IllegalArgumentException("Dimension numbers should not contain duplicates.");
            updated.add(Pair.of(number, item.getSecond()));
        }
        return new CubeResult<T, V>(resultMap, seed, dimensions, Collections.unmodifiableList(updated));
    }

    /**
     * Slices the first free dimensions by the given indexes, in order.
     */
    @SafeVarargs
    public final CubeResult<T, V> sliceInOrder(T... indexes)
    {
        List<Pair<Position, T>> pairs = new ArrayList<Pair<Position, T>>(indexes.length);
        for (int i = 0; i < indexes.length; i++)
            pairs.add(Pair.of(Position.fromStart(i), indexes[i]));
        return slice(pairs);
    }

    /**
     * Returns the value of this view as a whole: bound dimensions at their bound indexes,
     * free dimensions at their totals.
     */
    public V getValue()
    {
        return getValueFromResultMap(key);
    }

    /**
     * Returns the value at the index of the first free dimension, other free dimensions
     * at their totals.
     *
     * @throws IllegalStateException
     *             if this view has no free dimensions
     */
    public V getValue(T index)
    {
        if (freeDimensionNumbers.length == 0)
            throw new IllegalStateException("Cube result does not have any free dimensions.");

        return getValueFromResultMap(key.with(freeDimensionNumbers[0], index));
    }

    /**
     * Returns the value at the given indexes of the free dimensions, in free dimension
     * order. Free dimensions beyond the given indexes are taken at their totals.
     *
     * @throws IllegalArgumentException
     *             if more indexes than free dimensions are given
     */
    @SafeVarargs
    public final V getValue(T... indexes)
    {
        if (indexes.length > freeDimensionNumbers.length)
            throw new IllegalArgumentException("Number of specified indexes is greater than number of dimensions.");

        CompositeKey<T> updatedKey = key;
        for (int i = 0; i < indexes.length; i++)
            updatedKey = updatedKey.with(freeDimensionNumbers[i], indexes[i]);
        return getValueFromResultMap(updatedKey);
    }

    public Dimension<T> getFreeDimension(int number)
    {
        return getFreeDimension(Position.fromStart(number));
    }

    /**
     * @throws IllegalArgumentException
     *             if the dimension number is out of range
     */
    public Dimension<T> getFreeDimension(Position number)
    {
        return dimensions.get(getFreeDimensionNumber(number));
    }

    public List<Dimension<T>> getFreeDimensions()
    {
        List<Dimension<T>> result = new ArrayList<Dimension<T>>(freeDimensionNumbers.length);
        for (int number : freeDimensionNumbers)
            result.add(dimensions.get(number));
        return result;
    }

    public Dimension<T> getBoundDimension(int number)
    {
        return getBoundDimension(Position.fromStart(number));
    }

    /**
     * Returns the dimension bound by the given slice, counting slices in the order they
     * were applied.
     *
     * @throws IllegalArgumentException
     *             if the bound dimension number is out of range
     */
    public Dimension<T> getBoundDimension(Position number)
    {
        return dimensions.get(getBounding(number).getFirst());
    }

    public T getBoundIndex(int number)
    {
        return getBoundIndex(Position.fromStart(number));
    }

    /**
     * Returns the index bound by the given slice, counting slices in the order they were
     * applied.
     *
     * @throws IllegalArgumentException
     *             if the bound dimension number is out of range
     */
    public T getBoundIndex(Position number)
    {
        return getBounding(number).getSecond();
    }

    public Pair<Dimension<T>, T> getBoundDimensionAndIndex(int number)
    {
        return getBoundDimensionAndIndex(Position.fromStart(number));
    }

    public Pair<Dimension<T>, T> getBoundDimensionAndIndex(Position number)
    {
        Pair<Integer, T> bounding = getBounding(number);
        return Pair.of(dimensions.get(bounding.getFirst()), bounding.getSecond());
    }

    /**
     * @return every bound dimension with its index, in the order the slices were applied
     */
    public List<Pair<Dimension<T>, T>> getBoundDimensionsAndIndexes()
    {
        List<Pair<Dimension<T>, T>> result = new ArrayList<Pair<Dimension<T>, T>>(boundings.size());
        for (Pair<Integer, T> bounding : boundings)
            result.add(Pair.of(dimensions.get(bounding.getFirst()), bounding.getSecond()));
        return result;
    }

    public IndexDefinition<T> getBoundIndexDefinition(int number)
    {
        return getBoundIndexDefinition(Position.fromStart(number));
    }

    /**
     * Returns the definition of the index bound by the given slice.
     *
     * @throws IllegalArgumentException
     *             if the bound dimension number is out of range, or the bound index is
     *             not defined in its dimension
     */
    public IndexDefinition<T> getBoundIndexDefinition(Position number)
    {
        Pair<Dimension<T>, T> bound = getBoundDimensionAndIndex(number);
        return bound.getFirst().getIndexDefinition(bound.getSecond());
    }

    /**
     * Returns the cells visible in this view: every cell whose bound slots match the
     * bound indexes, keyed by its free slots in free dimension order.
     */
    public Map<CompositeKey<T>, V> asMap()
    {
        CompositeKey<T> boundKey = key.select(boundDimensionNumbers);
        Map<CompositeKey<T>, V> result = new HashMap<CompositeKey<T>, V>();
        for (Map.Entry<CompositeKey<T>, V> entry : resultMap.entrySet())
        {
            CompositeKey<T> cellKey = entry.getKey();
            if (cellKey.select(boundDimensionNumbers).equals(boundKey))
                result.put(cellKey.remove(boundDimensionNumbers), entry.getValue());
        }
        return result;
    }

    /**
     * Returns this view as the only element.
     */
    public List<CubeResult<T, V>> breakdownByDimensions()
    {
        return Collections.singletonList(this);
    }

    public List<CubeResult<T, V>> breakdownByDimensions(int... dimensionNumbers)
    {
        Position[] positions = new Position[dimensionNumbers.length];
        for (int i = 0; i < dimensionNumbers.length; i++)
            positions[i] = Position.fromStart(dimensionNumbers[i]);
        return breakdownByDimensions(positions);
    }

    public List<CubeResult<T, V>> breakdownByDimensions(PositionRange dimensionNumbers)
    {
        return breakdownByDimensions(dimensionNumbers.getOffsets(freeDimensionNumbers.length));
    }

    /**
     * Slices this view by every combination of the indexes of the given free dimensions.
     * Each dimension contributes its index definitions in traversal order; the first
     * given dimension varies slowest. Without dimensions, the result holds this view.
     *
     * @throws IllegalArgumentException
     *             if a dimension number is out of range, or two of them denote the same
     *             dimension
     */
    public List<CubeResult<T, V>> breakdownByDimensions(Position... dimensionNumbers)
    {
        if (dimensionNumbers.length == 0)
            return breakdownByDimensions();

        Set<Integer> numbers = new HashSet<Integer>();
        List<List<Pair<Position, T>>> axes = new ArrayList<List<Pair<Position, T>>>();
        for (Position dimensionNumber : dimensionNumbers)
        {
            if (!numbers.add(getFreeDimensionNumber(dimensionNumber)))
                throw new IllegalArgumentException("Dimension numbers should not contain duplicates.");

            List<Pair<Position, T>> axis = new ArrayList<Pair<Position, T>>();
            for (IndexDefinition<T> def : getFreeDimension(dimensionNumber))
                axis.add(Pair.of(dimensionNumber, def.getValue()));
            axes.add(axis);
        }

        List<CubeResult<T, V>> result = new ArrayList<CubeResult<T, V>>();
        for (List<Pair<Position, T>> combination : CartesianProduct.of(axes))
            result.add(slice(combination));
        return result;
    }

    private V getValueFromResultMap(CompositeKey<T> cellKey)
    {
        if (!resultMap.containsKey(cellKey))
            return seed;
        return resultMap.get(cellKey);
    }

    private int getFreeDimensionNumber(Position dimensionNumber)
    {
        int offset = dimensionNumber.getOffset(freeDimensionNumbers.length);
        if (offset < 0 || offset >= freeDimensionNumbers.length)
            throw new IllegalArgumentException("Dimension number " + dimensionNumber
                    + " is out of range.");

        return freeDimensionNumbers[offset];
    }

    private Pair<Integer, T> getBounding(Position dimensionNumber)
    {
        int offset = dimensionNumber.getOffset(boundings.size());
        if (offset < 0 || offset >= boundings.size())
            throw new IllegalArgumentException("Bound dimension number " + dimensionNumber
                    + " is out of range.");

        return boundings.get(offset);
    }

    @Override
    public String toString()
    {
        return "CubeResult [cells=" + resultMap.size() + ", freeDimensions="
                + freeDimensionNumbers.length + ", boundDimensions=" + boundings.size() + "]";
    }
}
