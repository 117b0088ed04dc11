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

import java.util.Map;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * Static factories for {@link AggregationDefinition}.
 * <p>
 * {@code createForMaps} fixes the source type to {@code Map<String, Object>};
 * {@code createForCollection} takes the source only to infer the record type.
 *
 * @see Aggregations
 */
public final class AggregationDefinitions
{
    private AggregationDefinitions()
    {
    }

    public static <S, V> AggregationDefinition<S, V> create(Function<? super S, ? extends V> valueSelector,
                                                            BinaryOperator<V> combiner,
                                                            V seed)
    {
        return new AggregationDefinition<S, V>(valueSelector, combiner, seed);
    }

    public static <V> AggregationDefinition<Map<String, Object>, V> createForMaps(Function<? super Map<String, Object>, ? extends V> valueSelector,
                                                                                  BinaryOperator<V> combiner,
                                                                                  V seed)
    {
        return new AggregationDefinition<Map<String, Object>, V>(valueSelector, combiner, seed);
    }

    public static <S, V> AggregationDefinition<S, V> createForCollection(Iterable<S> collection,
                                                                         Function<? super S, ? extends V> valueSelector,
                                                                         BinaryOperator<V> combiner,
                                                                         V seed)
    {
        return new AggregationDefinition<S, V>(valueSelector, combiner, seed);
    }
}
