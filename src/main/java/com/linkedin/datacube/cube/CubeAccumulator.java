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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.linkedin.datacube.aggregate.AggregationDefinition;
import com.linkedin.datacube.dimension.DimensionDefinition;
import com.linkedin.datacube.memory.CompositeKey;
import com.linkedin.datacube.utils.CartesianProduct;

/**
 * Folds source records into the cell map of a cube, one record at a time.
 * <p>
 * For each record, every dimension yields the set of indexes the record affects (its
 * selected indexes and their rollup chains). The record's value is combined into every
 * cell of the Cartesian product of these sets.
 * <p>
 * Not thread safe; a parallel build uses one accumulator per partition and merges them.
 *
 * @param <S>
 *            the type of the source records
 * @param <T>
 *            the type of the index values
 * @param <V>
 *            the type of the aggregated value
 */
final class CubeAccumulator<S, T, V>
{
    private static final Log LOG = LogFactory.getLog(CubeAccumulator.class.getName());

    private final AggregationDefinition<S, V> aggregation;
    private final List<DimensionDefinition<S, T>> dimensions;
    private final CubeBuildOptions options;
    private final Map<CompositeKey<T>, V> cells = new HashMap<CompositeKey<T>, V>();
    private long recordCount = 0;

    CubeAccumulator(AggregationDefinition<S, V> aggregation,
                    List<DimensionDefinition<S, T>> dimensions,
                    CubeBuildOptions options)
    {
        this.aggregation = aggregation;
        this.dimensions = dimensions;
        this.options = options;
    }

    void add(S record)
    {
        List<List<T>> affected = new ArrayList<List<T>>(dimensions.size());
        for (DimensionDefinition<S, T> dimension : dimensions)
            affected.add(dimension.getAffectedIndexes(record));

        V value = aggregation.selectValue(record);
        for (List<T> combination : CartesianProduct.of(affected))
            aggregate(CompositeKey.<T> of(combination), value);

        recordCount++;
        if (options.getProgressInterval() > 0
                && recordCount % options.getProgressInterval() == 0 && LOG.isDebugEnabled())
        {
            LOG.debug("Cube " + options.getName() + ": " + recordCount + " records, "
                    + cells.size() + " cells");
        }
    }

    /**
     * Combines every cell of the other accumulator into this one.
     */
    void merge(CubeAccumulator<S, T, V> other)
    {
        for (Map.Entry<CompositeKey<T>, V> entry : other.cells.entrySet())
            aggregate(entry.getKey(), entry.getValue());
        recordCount += other.recordCount;
    }

    private void aggregate(CompositeKey<T> key, V value)
    {
        if (cells.containsKey(key))
            cells.put(key, aggregation.combine(cells.get(key), value));
        else
            cells.put(key, value);
    }

    long getRecordCount()
    {
        return recordCount;
    }

    Map<CompositeKey<T>, V> getCells()
    {
        return cells;
    }
}
