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
import java.util.List;

/**
 * Static factories for {@link IndexDefinition}.
 * <p>
 * Children created through {@code create} are enumerated after their parent; children
 * created through {@code createChildrenFirst} are enumerated before it. A {@code null}
 * value, or one of the {@code total} factories, creates the default (total) index.
 */
public final class IndexDefinitions
{
    private IndexDefinitions()
    {
    }

    public static <T> IndexDefinition<T> create(T value)
    {
        return create(value, null);
    }

    @SafeVarargs
    public static <T> IndexDefinition<T> create(T value,
                                                String title,
                                                IndexDefinition<T>... children)
    {
        return create(value, title, Arrays.asList(children));
    }

    public static <T> IndexDefinition<T> create(T value,
                                                String title,
                                                List<IndexDefinition<T>> children)
    {
        return new IndexDefinition<T>(value, title, null, children, false);
    }

    @SafeVarargs
    public static <T> IndexDefinition<T> createChildrenFirst(T value,
                                                             String title,
                                                             IndexDefinition<T>... children)
    {
        return createChildrenFirst(value, title, Arrays.asList(children));
    }

    public static <T> IndexDefinition<T> createChildrenFirst(T value,
                                                             String title,
                                                             List<IndexDefinition<T>> children)
    {
        return new IndexDefinition<T>(value, title, null, children, true);
    }

    /**
     * Creates the default index, listed before its children.
     */
    @SafeVarargs
    public static <T> IndexDefinition<T> total(String title, IndexDefinition<T>... children)
    {
        return create(null, title, Arrays.asList(children));
    }

    /**
     * Creates the default index, listed after its children.
     */
    @SafeVarargs
    public static <T> IndexDefinition<T> totalAfter(String title,
                                                    IndexDefinition<T>... children)
    {
        return createChildrenFirst(null, title, Arrays.asList(children));
    }
}
