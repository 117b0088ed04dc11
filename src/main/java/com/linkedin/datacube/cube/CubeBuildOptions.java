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

import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

import org.codehaus.jackson.JsonNode;

import com.linkedin.datacube.CubeDefinitionErrorType;
import com.linkedin.datacube.CubeDefinitionException;
import com.linkedin.datacube.utils.JsonUtils;

/**
 * Options of a cube build. None of them changes the content of the built cube.
 * <ul>
 * <li>{@code name}: label of the cube in log messages</li>
 * <li>{@code progressInterval}: number of records between two progress messages at
 * DEBUG level; 0 turns progress messages off</li>
 * <li>{@code parallelism}: number of partitions a list source is folded in
 * concurrently; 1 folds sequentially</li>
 * </ul>
 * Options can be read from Json, e.g. {@code {"name": "sales", "parallelism": 4}}.
 */
public final class CubeBuildOptions
{
    public static final String DEFAULT_NAME = "cube";
    public static final int DEFAULT_PROGRESS_INTERVAL = 100000;
    public static final int DEFAULT_PARALLELISM = 1;

    private static final Set<String> PROPERTIES =
            new HashSet<String>(Arrays.asList("name", "progressInterval", "parallelism"));

    private static final CubeBuildOptions DEFAULTS =
            new CubeBuildOptions(DEFAULT_NAME, DEFAULT_PROGRESS_INTERVAL, DEFAULT_PARALLELISM);

    private final String name;
    private final int progressInterval;
    private final int parallelism;

    private CubeBuildOptions(String name, int progressInterval, int parallelism)
    {
        if (name == null)
            throw invalid("name must not be null");
        if (progressInterval < 0)
            throw invalid("progressInterval must not be negative. Found: " + progressInterval);
        if (parallelism < 1)
            throw invalid("parallelism must be at least 1. Found: " + parallelism);

        this.name = name;
        this.progressInterval = progressInterval;
        this.parallelism = parallelism;
    }

    public static CubeBuildOptions defaults()
    {
        return DEFAULTS;
    }

    public static CubeBuildOptions fromJson(String json)
    {
        return fromJson(JsonUtils.parse(json));
    }

    public static CubeBuildOptions fromJson(JsonNode json)
    {
        if (json == null || !json.isObject())
            throw invalid("Expected a json object. Found: " + json);

        Iterator<String> fieldNames = json.getFieldNames();
        while (fieldNames.hasNext())
        {
            String field = fieldNames.next();
            if (!PROPERTIES.contains(field))
                throw invalid("Unknown property " + field + " in " + json);
        }

        return new CubeBuildOptions(JsonUtils.getText(json, "name", DEFAULT_NAME),
                                    JsonUtils.getInt(json,
                                                     "progressInterval",
                                                     DEFAULT_PROGRESS_INTERVAL),
                                    JsonUtils.getInt(json, "parallelism", DEFAULT_PARALLELISM));
    }

    public String getName()
    {
        return name;
    }

    public int getProgressInterval()
    {
        return progressInterval;
    }

    public int getParallelism()
    {
        return parallelism;
    }

    public CubeBuildOptions withName(String newName)
    {
        return new CubeBuildOptions(newName, progressInterval, parallelism);
    }

    public CubeBuildOptions withProgressInterval(int newProgressInterval)
    {
        return new CubeBuildOptions(name, newProgressInterval, parallelism);
    }

    public CubeBuildOptions withParallelism(int newParallelism)
    {
        return new CubeBuildOptions(name, progressInterval, newParallelism);
    }

    private static CubeDefinitionException invalid(String message)
    {
        return new CubeDefinitionException(CubeDefinitionErrorType.INVALID_CONFIG, message);
    }

    @Override
    public String toString()
    {
        return "CubeBuildOptions [name=" + name + ", progressInterval=" + progressInterval
                + ", parallelism=" + parallelism + "]";
    }
}
