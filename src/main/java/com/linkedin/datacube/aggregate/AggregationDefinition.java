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

package com.linkedin.datacube.aggregate;

import java.util.function.BinaryOperator;
import java.util.function.Function;

import org.apache.commons.lang.Validate;

/**
 * Describes how the records of the source are combined into one value per cell of the
 * cube.
 * <p>
 * The extractor maps each record to a value; the combiner merges two values; the seed is
 * the value of a cell no record contributed to.
 * <p>
 * The combiner must be associative and commutative. A single record is folded into many
 * cells (every rollup index and every multi-selected index), and the order in which
 * values meet in a cell is not specified. A combiner without these properties gives
 * order-dependent results; that is the caller's responsibility and is not detected.
 *
 * @param <S>
 *            the type of the source records
 * @param <V>
 *            the type of the aggregated value
 */
public final class AggregationDefinition<S, V>
{
    private final Function<? super S, ? extends V> valueSelector;
    private final BinaryOperator<V> combiner;
    private final V seed;

    AggregationDefinition(Function<? super S, ? extends V> valueSelector,
                          BinaryOperator<V> combiner,
                          V seed)
    {
        Validate.notNull(valueSelector, "Value selector must not be null");
        Validate.notNull(combiner, "Aggregation function must not be null");

        this.valueSelector = valueSelector;
        this.combiner = combiner;
        this.seed = seed;
    }

    public Function<? super S, ? extends V> getValueSelector()
    {
        return valueSelector;
    }

    public BinaryOperator<V> getCombiner()
    {
        return combiner;
    }

    public V getSeed()
    {
        return seed;
    }

    public V selectValue(S record)
    {
        return valueSelector.apply(record);
    }

    public V combine(V accumulated, V value)
    {
        return combiner.apply(accumulated, value);
    }
}
