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
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.codehaus.jackson.JsonNode;

import com.linkedin.datacube.CubeDefinitionErrorType;
import com.linkedin.datacube.CubeDefinitionException;
import com.linkedin.datacube.utils.JsonUtils;

/**
 * Builds string-valued index hierarchies from Json.
 * <p>
 * Each index is an object of the form
 *
 * <pre>
 * { "value": "EU", "title": "Europe", "childrenFirst": false,
 *   "metadata": { "color": "blue" }, "children": [ ... ] }
 * </pre>
 *
 * A missing or {@code null} value denotes the default (total) index. Every property
 * except {@code value} is optional.
 */
public final class IndexDefinitionParser
{
    private static final Set<String> PROPERTIES =
            new HashSet<String>(Arrays.asList("value",
                                              "title",
                                              "childrenFirst",
                                              "metadata",
                                              "children"));

    private IndexDefinitionParser()
    {
    }

    public static List<IndexDefinition<String>> parseAll(String json)
    {
        return parseAll(JsonUtils.parse(json));
    }

    /**
     * Parses a Json array of index objects into root index definitions.
     */
    public static List<IndexDefinition<String>> parseAll(JsonNode json)
    {
        if (json == null || !json.isArray())
            throw new CubeDefinitionException(CubeDefinitionErrorType.INVALID_CONFIG,
                                              "Expected an array of index definitions. Found: "
                                                      + json);

        List<IndexDefinition<String>> result = new ArrayList<IndexDefinition<String>>();
        for (JsonNode element : json)
            result.add(parse(element));
        return result;
    }

    public static IndexDefinition<String> parse(JsonNode json)
    {
        if (json == null || !json.isObject())
            throw new CubeDefinitionException(CubeDefinitionErrorType.INVALID_CONFIG,
                                              "Expected an index definition object. Found: "
                                                      + json);

        Iterator<String> fieldNames = json.getFieldNames();
        while (fieldNames.hasNext())
        {
            String field = fieldNames.next();
            if (!PROPERTIES.contains(field))
                throw new CubeDefinitionException(CubeDefinitionErrorType.INVALID_CONFIG,
                                                  "Unknown property " + field + " in " + json);
        }

        String value = JsonUtils.getText(json, "value", null);
        String title = JsonUtils.getText(json, "title", null);
        boolean childrenFirst = JsonUtils.getBoolean(json, "childrenFirst", false);

        List<IndexDefinition<String>> children = new ArrayList<IndexDefinition<String>>();
        if (JsonUtils.isDefined(json, "children"))
            children = parseAll(json.get("children"));

        return new IndexDefinition<String>(value,
                                           title,
                                           parseMetadata(json),
                                           children,
                                           childrenFirst);
    }

    private static Map<String, Object> parseMetadata(JsonNode json)
    {
        Map<String, Object> metadata = new LinkedHashMap<String, Object>();
        if (!JsonUtils.isDefined(json, "metadata"))
            return metadata;

        JsonNode node = json.get("metadata");
        if (!node.isObject())
            throw new CubeDefinitionException(CubeDefinitionErrorType.INVALID_CONFIG,
                                              "Property metadata must be an object in "
                                                      + json);

        Iterator<Map.Entry<String, JsonNode>> fields = node.getFields();
        while (fields.hasNext())
        {
            Map.Entry<String, JsonNode> field = fields.next();
            Object value = JsonUtils.asObject(field.getValue());
            if (value == null)
                throw new CubeDefinitionException(CubeDefinitionErrorType.INVALID_CONFIG,
                                                  "Metadata " + field.getKey()
                                                          + " must be a scalar value in " + json);
            metadata.put(field.getKey(), value);
        }
        return metadata;
    }
}
