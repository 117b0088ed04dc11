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

package com.linkedin.datacube.dimension;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.function.Function;

import org.apache.commons.lang.Validate;

/**
 * Static factories for {@link DimensionDefinition}.
 * <p>
 * The {@code ForMaps} variants fix the source type to {@code Map<String, Object>} and
 * the {@code ForCollection} variants take the source collection only to infer the
 * record type; neither changes how the dimension behaves.
 */
public final class DimensionDefinitions
{
    private DimensionDefinitions()
    {
    }

    /**
     * Creates a dimension whose selector maps each record to one index value.
     */
    @SafeVarargs
    public static <S, T> DimensionDefinition<S, T> create(Function<? super S, ? extends T> indexSelector,
                                                          String title,
                                                          IndexDefinition<T>... indexDefinitions)
    {
        return new DimensionDefinition<S, T>(DimensionDefinitions.<S, T> singleToMulti(indexSelector),
                                             title,
                                             null,
                                             Arrays.asList(indexDefinitions));
    }

    /**
     * Creates a dimension whose selector maps each record to any number of index values.
     * The record contributes in full to each of them.
     */
    @SafeVarargs
    public static <S, T> DimensionDefinition<S, T> createWithMultiSelector(Function<? super S, ? extends Iterable<? extends T>> indexSelector,
                                                                           String title,
                                                                           IndexDefinition<T>... indexDefinitions)
    {
        return new DimensionDefinition<S, T>(indexSelector,
                                             title,
                                             null,
                                             Arrays.asList(indexDefinitions));
    }

    /**
     * Creates a placeholder dimension holding only the default index. It yields the total
     * of the cube along an extra axis.
     */
    public static <S, T> DimensionDefinition<S, T> createDefault(String title,
                                                                 String indexTitle)
    {
        Function<S, T> selector = new Function<S, T>()
        {
            @Override
            public T apply(S record)
            {
                return null;
            }
        };
        IndexDefinition<T> total = IndexDefinitions.create(null, indexTitle);
        return create(selector, title, total);
    }

    @SafeVarargs
    public static <T> DimensionDefinition<Map<String, Object>, T> createForMaps(Function<? super Map<String, Object>, ? extends T> indexSelector,
                                                                                String title,
                                                                                IndexDefinition<T>... indexDefinitions)
    {
        return DimensionDefinitions.<Map<String, Object>, T> create(indexSelector,
                                                                    title,
                                                                    indexDefinitions);
    }

    @SafeVarargs
    public static <T> DimensionDefinition<Map<String, Object>, T> createForMapsWithMultiSelector(Function<? super Map<String, Object>, ? extends Iterable<? extends T>> indexSelector,
                                                                                                 String title,
                                                                                                 IndexDefinition<T>... indexDefinitions)
    {
        return DimensionDefinitions.<Map<String, Object>, T> createWithMultiSelector(indexSelector,
                                                                                     title,
                                                                                     indexDefinitions);
    }

    public static <T> DimensionDefinition<Map<String, Object>, T> createDefaultForMaps(String title,
                                                                                       String indexTitle)
    {
        return DimensionDefinitions.<Map<String, Object>, T> createDefault(title, indexTitle);
    }

    @SafeVarargs
    public static <S, T> DimensionDefinition<S, T> createForCollection(Iterable<S> collection,
                                                                       Function<? super S, ? extends T> indexSelector,
                                                                       String title,
                                                                       IndexDefinition<T>... indexDefinitions)
    {
        return DimensionDefinitions.<S, T> create(indexSelector, title, indexDefinitions);
    }

    @SafeVarargs
    public static <S, T> DimensionDefinition<S, T> createForCollectionWithMultiSelector(Iterable<S> collection,
                                                                                        Function<? super S, ? extends Iterable<? extends T>> indexSelector,
                                                                                        String title,
                                                                                        IndexDefinition<T>... indexDefinitions)
    {
        return DimensionDefinitions.<S, T> createWithMultiSelector(indexSelector,
                                                                   title,
                                                                   indexDefinitions);
    }

    private static <S, T> Function<S, Iterable<T>> singleToMulti(final Function<? super S, ? extends T> indexSelector)
    {
        Validate.notNull(indexSelector, "Index selector must not be null");
        return new Function<S, Iterable<T>>()
        {
            @Override
            public Iterable<T> apply(S record)
            {
                T index = indexSelector.apply(record);
                return Collections.singletonList(index);
            }
        };
    }
}
