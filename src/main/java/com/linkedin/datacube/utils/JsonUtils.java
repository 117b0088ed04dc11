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

package com.linkedin.datacube.utils;

import java.io.IOException;

import org.codehaus.jackson.JsonNode;
import org.codehaus.jackson.map.ObjectMapper;

import com.linkedin.datacube.CubeDefinitionErrorType;
import com.linkedin.datacube.CubeDefinitionException;

/**
 * Utility methods for reading cube configuration out of Json documents.
 *
 */
public final class JsonUtils
{
    private static final ObjectMapper mapper = new ObjectMapper();

    private JsonUtils()
    {
    }

    public static JsonNode parse(String json)
    {
        try
        {
            return mapper.readTree(json);
        }
        catch (IOException e)
        {
            throw new CubeDefinitionException(CubeDefinitionErrorType.INVALID_CONFIG,
                                              "Cannot parse json: " + e.getMessage(),
                                              e);
        }
    }

    public static boolean isDefined(JsonNode node, String property)
    {
        return node.has(property) && !node.get(property).isNull();
    }

    public static String getText(JsonNode node, String property, String defaultValue)
    {
        if (!isDefined(node, property))
            return defaultValue;

        JsonNode val = node.get(property);
        if (!val.isTextual())
            throw invalid(node, property, "a string");
        return val.getTextValue();
    }

    public static int getInt(JsonNode node, String property, int defaultValue)
    {
        if (!isDefined(node, property))
            return defaultValue;

        JsonNode val = node.get(property);
        if (!val.isInt())
            throw invalid(node, property, "an integer");
        return val.getIntValue();
    }

    public static boolean getBoolean(JsonNode node, String property, boolean defaultValue)
    {
        if (!isDefined(node, property))
            return defaultValue;

        JsonNode val = node.get(property);
        if (!val.isBoolean())
            throw invalid(node, property, "a boolean");
        return val.getBooleanValue();
    }

    /**
     * Converts a scalar Json value to the matching Java object. Arrays and objects yield
     * {@code null}.
     */
    public static Object asObject(JsonNode node)
    {
        if (node.isTextual())
            return node.getTextValue();
        else if (node.isInt())
            return node.getIntValue();
        else if (node.isLong())
            return node.getLongValue();
        else if (node.isFloatingPointNumber())
            return node.getDoubleValue();
        else if (node.isBoolean())
            return node.getBooleanValue();

        return null;
    }

    private static CubeDefinitionException invalid(JsonNode node, String property, String what)
    {
        return new CubeDefinitionException(CubeDefinitionErrorType.INVALID_CONFIG,
                                           "Property " + property + " must be " + what
                                                   + " in " + node);
    }
}
