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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.apache.commons.lang.Validate;

import com.linkedin.datacube.CubeDefinitionErrorType;
import com.linkedin.datacube.CubeDefinitionException;

/**
 * A {@link Dimension} together with the selector that maps a source record to zero or
 * more index values of the dimension.
 * <p>
 * Selected values that are {@code null} or not defined in the dimension resolve to the
 * default index. A record whose selection is empty contributes to the default index
 * only.
 *
 * @param <S>
 *            the type of the source records
 * @param <T>
 *            the type of the index value
 */
public final class DimensionDefinition<S, T> extends Dimension<T>
{
    private final Function<? super S, ? extends Iterable<? extends T>> selector;

    DimensionDefinition(Function<? super S, ? extends Iterable<? extends T>> selector,
                        String title,
                        Map<String, Object> metadata,
                        List<IndexDefinition<T>> indexDefinitions)
    {
        super(title, metadata, indexDefinitions);
        Validate.notNull(selector, "Index selector must not be null");
        this.selector = selector;
    }

    public Function<? super S, ? extends Iterable<? extends T>> getSelector()
    {
        return selector;
    }

    /**
     * Applies the selector to the record and returns its raw result. A {@code null}
     * result is treated as an empty selection.
     */
    public List<T> selectIndexes(S record)
    {
        Iterable<? extends T> selected = selector.apply(record);
        if (selected == null)
            return Collections.emptyList();

        List<T> indexes = new ArrayList<T>();
        for (T index : selected)
            indexes.add(index);
        return indexes;
    }

    /**
     * Returns the distinct indexes the record is mapped to, each resolved against the
     * dimension. Never empty: an empty selection resolves to the default index.
     */
    public List<T> getPrimaryIndexes(S record)
    {
        Set<T> primary = new LinkedHashSet<T>();
        for (T index : selectIndexes(record))
            primary.add(getPrimaryIndex(index));

        if (primary.isEmpty())
            return Collections.<T> singletonList(null);
        return new ArrayList<T>(primary);
    }

    /**
     * Returns every index of this dimension the record contributes to: the union of the
     * rollup chains of its primary indexes, without duplicates.
     */
    public List<T> getAffectedIndexes(S record)
    {
        Set<T> affected = new LinkedHashSet<T>();
        for (T primary : getPrimaryIndexes(record))
            affected.addAll(getRollupChain(primary));

        if (affected.isEmpty())
            return Collections.<T> singletonList(null);
        return new ArrayList<T>(affected);
    }

    /**
     * Returns a copy of this definition with the roots wrapped into a synthesized default
     * index listed before them.
     *
     * @throws CubeDefinitionException
     *             if the dimension already defines the default index
     */
    public DimensionDefinition<S, T> withLeadingDefaultIndex(String indexTitle)
    {
        ensureNoDefaultIndex();
        IndexDefinition<T> total =
                IndexDefinitions.create(null, indexTitle, getIndexDefinitions());
        return withIndexDefinitions(Collections.singletonList(total));
    }

    /**
     * Returns a copy of this definition with the roots wrapped into a synthesized default
     * index listed after them.
     *
     * @throws CubeDefinitionException
     *             if the dimension already defines the default index
     */
    public DimensionDefinition<S, T> withTrailingDefaultIndex(String indexTitle)
    {
        ensureNoDefaultIndex();
        IndexDefinition<T> total =
                IndexDefinitions.createChildrenFirst(null, indexTitle, getIndexDefinitions());
        return withIndexDefinitions(Collections.singletonList(total));
    }

    public DimensionDefinition<S, T> withTitle(String newTitle)
    {
        return new DimensionDefinition<S, T>(selector,
                                             newTitle,
                                             getMetadata(),
                                             getIndexDefinitions());
    }

    public DimensionDefinition<S, T> withMetadata(String key, Object value)
    {
        return new DimensionDefinition<S, T>(selector,
                                             getTitle(),
                                             metadataWith(key, value),
                                             getIndexDefinitions());
    }

    DimensionDefinition<S, T> withIndexDefinitions(List<IndexDefinition<T>> indexDefinitions)
    {
        return new DimensionDefinition<S, T>(selector,
                                             getTitle(),
                                             getMetadata(),
                                             indexDefinitions);
    }

    private void ensureNoDefaultIndex()
    {
        if (containsIndex(null))
            throw new CubeDefinitionException(CubeDefinitionErrorType.DEFAULT_INDEX_ALREADY_DEFINED,
                                              "Dimension already contains default index.");
    }
}
