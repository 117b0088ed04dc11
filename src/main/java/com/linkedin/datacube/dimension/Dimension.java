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
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang.Validate;

import com.linkedin.datacube.CubeDefinitionErrorType;
import com.linkedin.datacube.CubeDefinitionException;
import com.linkedin.datacube.memory.NullKeyMap;
import com.linkedin.datacube.utils.Pair;

/**
 * An axis of the cube: an ordered list of root index definitions.
 * <p>
 * At construction the hierarchy is flattened into a value lookup and, for every value,
 * its rollup chain is computed. The rollup chain of a value lists every index that
 * receives a contribution made to that value: the value itself, each of its ancestors,
 * and finally the default (total) index, unless the root of the chain is the default
 * index already. A value that is not defined in the dimension rolls up to the default
 * index only.
 * <p>
 * If the default index is a root, it must be the only root.
 *
 * @param <T>
 *            the type of the index value
 */
public class Dimension<T> extends AbstractDefinition implements Iterable<IndexDefinition<T>>
{
    private final List<IndexDefinition<T>> indexDefinitions;
    private final List<IndexDefinition<T>> flattened;
    private final NullKeyMap<T, IndexDefinition<T>> indexLookup;
    private final NullKeyMap<T, List<T>> rollupChains;

    protected Dimension(String title,
                        Map<String, Object> metadata,
                        List<IndexDefinition<T>> indexDefinitions)
    {
        super(title, metadata);
        Validate.noNullElements(indexDefinitions, "Index definitions must not be null");

        this.indexDefinitions =
                Collections.unmodifiableList(new ArrayList<IndexDefinition<T>>(indexDefinitions));

        List<IndexDefinition<T>> all = new ArrayList<IndexDefinition<T>>();
        for (IndexDefinition<T> root : this.indexDefinitions)
            all.addAll(root.flatten());
        this.flattened = Collections.unmodifiableList(all);

        this.indexLookup = createIndexLookup();
        this.rollupChains = createRollupChains();

        if (containsIndex(null) && this.indexDefinitions.size() > 1)
            throw new CubeDefinitionException(CubeDefinitionErrorType.DEFAULT_INDEX_NOT_SOLE_ROOT,
                                              "Default index should be the only root index.");
    }

    /**
     * @return the root index definitions, in declaration order
     */
    public List<IndexDefinition<T>> getIndexDefinitions()
    {
        return indexDefinitions;
    }

    /**
     * @return every index definition of the hierarchy, in traversal order
     */
    public List<IndexDefinition<T>> getFlattenedIndexDefinitions()
    {
        return flattened;
    }

    @Override
    public Iterator<IndexDefinition<T>> iterator()
    {
        return flattened.iterator();
    }

    public boolean containsIndex(T index)
    {
        return indexLookup.containsKey(index);
    }

    /**
     * Finds the index definition with the given value anywhere in the hierarchy.
     *
     * @throws IllegalArgumentException
     *             if the value is not defined in this dimension
     */
    public IndexDefinition<T> getIndexDefinition(T index)
    {
        if (!indexLookup.containsKey(index))
            throw new IllegalArgumentException("Index " + index + " is not found in dimension");
        return indexLookup.get(index);
    }

    /**
     * Returns the value itself if it is defined in this dimension, otherwise the default
     * index ({@code null}).
     */
    public T getPrimaryIndex(T index)
    {
        return containsIndex(index) ? index : null;
    }

    /**
     * Returns the indexes a contribution to {@code index} is rolled up into, starting
     * with the index itself. Unknown values yield a chain holding the default index only.
     */
    public List<T> getRollupChain(T index)
    {
        return rollupChains.get(index, Collections.<T> singletonList(null));
    }

    /**
     * Returns the next index up the rollup chain, or {@code null} when the value is
     * unknown or has nothing above it.
     */
    public T getParentIndex(T index)
    {
        List<T> chain = getRollupChain(index);
        return chain.size() > 1 ? chain.get(1) : null;
    }

    private NullKeyMap<T, IndexDefinition<T>> createIndexLookup()
    {
        Set<T> seen = new HashSet<T>();
        List<Pair<T, IndexDefinition<T>>> pairs =
                new ArrayList<Pair<T, IndexDefinition<T>>>(flattened.size());
        for (IndexDefinition<T> def : flattened)
        {
            if (!seen.add(def.getValue()))
                throw new CubeDefinitionException(CubeDefinitionErrorType.DUPLICATE_INDEX,
                                                  "Index definitions contain duplicated value "
                                                          + def.getValue() + ".");
            pairs.add(Pair.of(def.getValue(), def));
        }
        return new NullKeyMap<T, IndexDefinition<T>>(pairs);
    }

    private NullKeyMap<T, List<T>> createRollupChains()
    {
        List<Pair<T, List<T>>> chains = new ArrayList<Pair<T, List<T>>>(flattened.size());
        for (IndexDefinition<T> root : indexDefinitions)
        {
            List<T> rootPath =
                    root.isDefault() ? Collections.<T> emptyList()
                            : Collections.<T> singletonList(null);
            collectRollupChains(root, rootPath, chains);
        }
        return new NullKeyMap<T, List<T>>(chains);
    }

    private void collectRollupChains(IndexDefinition<T> node,
                                     List<T> parentPath,
                                     List<Pair<T, List<T>>> chains)
    {
        List<T> path = new ArrayList<T>(parentPath.size() + 1);
        path.add(node.getValue());
        path.addAll(parentPath);
        List<T> chain = Collections.unmodifiableList(path);

        chains.add(Pair.of(node.getValue(), chain));
        for (IndexDefinition<T> child : node.getChildren())
            collectRollupChains(child, chain, chains);
    }

    @Override
    public String toString()
    {
        return "Dimension [title=" + getTitle() + ", indexes=" + flattened.size() + "]";
    }
}
