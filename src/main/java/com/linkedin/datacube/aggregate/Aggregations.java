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

/**
 * Ready-made aggregations.
 * <p>
 * Like the SUM, COUNT, MAX and MIN operators they are modeled on, they ignore
 * {@code null} input values. SUM and COUNT are seeded with zero; MAX and MIN are seeded
 * with {@code null}, which is also what an empty cell reports.
 */
public final class Aggregations
{
    private Aggregations()
    {
    }

    public static <S> AggregationDefinition<S, Long> sumOfLong(final Function<? super S, ? extends Number> column)
    {
        Function<S, Long> selector = new Function<S, Long>()
        {
            @Override
            public Long apply(S record)
            {
                Number val = column.apply(record);
                return val == null ? 0L : val.longValue();
            }
        };
        return AggregationDefinitions.create(selector, longSum(), 0L);
    }

    public static <S> AggregationDefinition<S, Double> sumOfDouble(final Function<? super S, ? extends Number> column)
    {
        Function<S, Double> selector = new Function<S, Double>()
        {
            @Override
            public Double apply(S record)
            {
                Number val = column.apply(record);
                return val == null ? 0.0 : val.doubleValue();
            }
        };
        BinaryOperator<Double> sum = new BinaryOperator<Double>()
        {
            @Override
            public Double apply(Double a, Double b)
            {
                return a + b;
            }
        };
        return AggregationDefinitions.create(selector, sum, 0.0);
    }

    /**
     * Counts the records.
     */
    public static <S> AggregationDefinition<S, Long> count()
    {
        Function<S, Long> selector = new Function<S, Long>()
        {
            @Override
            public Long apply(S record)
            {
                return 1L;
            }
        };
        return AggregationDefinitions.create(selector, longSum(), 0L);
    }

    /**
     * Counts the records for which the column is not {@code null}.
     */
    public static <S> AggregationDefinition<S, Long> countNonNull(final Function<? super S, ?> column)
    {
        Function<S, Long> selector = new Function<S, Long>()
        {
            @Override
            public Long apply(S record)
            {
                return column.apply(record) == null ? 0L : 1L;
            }
        };
        return AggregationDefinitions.create(selector, longSum(), 0L);
    }

    public static <S, V extends Comparable<? super V>> AggregationDefinition<S, V> max(Function<? super S, ? extends V> column)
    {
        BinaryOperator<V> max = new BinaryOperator<V>()
        {
            @Override
            public V apply(V a, V b)
            {
                if (a == null)
                    return b;
                if (b == null)
                    return a;
                return a.compareTo(b) >= 0 ? a : b;
            }
        };
        return AggregationDefinitions.<S, V> create(column, max, null);
    }

    public static <S, V extends Comparable<? super V>> AggregationDefinition<S, V> min(Function<? super S, ? extends V> column)
    {
        BinaryOperator<V> min = new BinaryOperator<V>()
        {
            @Override
            public V apply(V a, V b)
            {
                if (a == null)
                    return b;
                if (b == null)
                    return a;
                return a.compareTo(b) <= 0 ? a : b;
            }
        };
        return AggregationDefinitions.<S, V> create(column, min, null);
    }

    private static BinaryOperator<Long> longSum()
    {
        return new BinaryOperator<Long>()
        {
            @Override
            public Long apply(Long a, Long b)
            {
                return a + b;
            }
        };
    }
}
