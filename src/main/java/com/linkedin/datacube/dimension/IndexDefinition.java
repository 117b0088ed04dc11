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
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang.Validate;

import com.linkedin.datacube.CubeDefinitionErrorType;
import com.linkedin.datacube.CubeDefinitionException;

/**
 * A node in the value hierarchy of a dimension.
 * <p>
 * The node with the {@code null} value is the default index: it stands for the total
 * of the dimension and may only be used as a root, never as a child or below one.
 * Values are unique within the subtree of a node.
 * <p>
 * The {@code childrenBeforeParent} flag decides where the node itself appears when its
 * subtree is enumerated: before its children (the default) or after them.
 * <p>
 * Instances are immutable. Use {@link IndexDefinitions} to create them.
 *
 * @param <T>
 *            the type of the index value
 */
public final class IndexDefinition<T> extends AbstractDefinition
{
    private final T value;
    private final List<IndexDefinition<T>> children;
    private final boolean childrenBeforeParent;

    IndexDefinition(T value,
                    String title,
                    Map<String, Object> metadata,
                    List<IndexDefinition<T>> children,
                    boolean childrenBeforeParent)
    {
        super(title, metadata);
        Validate.noNullElements(children, "Child index definitions must not be null");

        this.value = value;
        this.children =
                Collections.unmodifiableList(new ArrayList<IndexDefinition<T>>(children));
        this.childrenBeforeParent = childrenBeforeParent;

        for (IndexDefinition<T> child : this.children)
        {
            if (child.isDefault())
                throw new CubeDefinitionException(CubeDefinitionErrorType.NESTED_DEFAULT_INDEX,
                                                  "Default index cannot be nested.");
        }

        Set<T> seen = new HashSet<T>();
        for (IndexDefinition<T> def : flatten())
        {
            if (!seen.add(def.getValue()))
                throw new CubeDefinitionException(CubeDefinitionErrorType.DUPLICATE_INDEX,
                                                  "Index definition contains duplicated value "
                                                          + def.getValue() + ".");
        }
    }

    public T getValue()
    {
        return value;
    }

    public List<IndexDefinition<T>> getChildren()
    {
        return children;
    }

    public boolean isChildrenBeforeParent()
    {
        return childrenBeforeParent;
    }

    /**
     * @return {@code true} if this is the default (total) index of a dimension
     */
    public boolean isDefault()
    {
        return value == null;
    }

    /**
     * Returns this node and all of its descendants in traversal order.
     */
    public List<IndexDefinition<T>> flatten()
    {
        List<IndexDefinition<T>> result = new ArrayList<IndexDefinition<T>>();
        flattenInto(result);
        return result;
    }

    private void flattenInto(List<IndexDefinition<T>> result)
    {
        if (!childrenBeforeParent)
            result.add(this);

        for (IndexDefinition<T> child : children)
            child.flattenInto(result);

        if (childrenBeforeParent)
            result.add(this);
    }

    public IndexDefinition<T> withTitle(String newTitle)
    {
        return new IndexDefinition<T>(value,
                                      newTitle,
                                      getMetadata(),
                                      children,
                                      childrenBeforeParent);
    }

    public IndexDefinition<T> withMetadata(String key, Object metadataValue)
    {
        return new IndexDefinition<T>(value,
                                      getTitle(),
                                      metadataWith(key, metadataValue),
                                      children,
                                      childrenBeforeParent);
    }

    @Override
    public String toString()
    {
        return "IndexDefinition [value=" + value + ", title=" + getTitle() + ", children="
                + children.size() + "]";
    }
}
