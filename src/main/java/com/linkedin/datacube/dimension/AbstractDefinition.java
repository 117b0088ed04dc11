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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Common state of index and dimension definitions: an optional title and an immutable
 * metadata map supplied at construction.
 */
public abstract class AbstractDefinition
{
    private final String title;
    private final Map<String, Object> metadata;

    protected AbstractDefinition(String title, Map<String, Object> metadata)
    {
        this.title = title;
        this.metadata =
                metadata == null || metadata.isEmpty()
                        ? Collections.<String, Object> emptyMap()
                        : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(metadata));
    }

    /**
     * @return the title, or {@code null} when none was given
     */
    public String getTitle()
    {
        return title;
    }

    public Map<String, Object> getMetadata()
    {
        return metadata;
    }

    /**
     * Returns a copy of the metadata with one more entry, for use by the
     * {@code withMetadata} methods of subclasses.
     */
    protected Map<String, Object> metadataWith(String key, Object value)
    {
        if (metadata.containsKey(key))
            throw new IllegalArgumentException("Metadata key " + key + " is already defined.");

        Map<String, Object> copy = new LinkedHashMap<String, Object>(metadata);
        copy.put(key, value);
        return copy;
    }
}
