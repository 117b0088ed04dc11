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

import org.codehaus.jackson.JsonNode;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.linkedin.datacube.CubeDefinitionErrorType;
import com.linkedin.datacube.CubeDefinitionException;

public class TestJsonUtils
{
    @Test
    public void testReadsPropertiesWithDefaults()
    {
        JsonNode json = JsonUtils.parse("{\"name\": \"sales\", \"size\": 3, \"flag\": true, \"none\": null}");

        Assert.assertEquals(JsonUtils.getText(json, "name", "x"), "sales");
        Assert.assertEquals(JsonUtils.getInt(json, "size", 0), 3);
        Assert.assertTrue(JsonUtils.getBoolean(json, "flag", false));
        Assert.assertEquals(JsonUtils.getText(json, "none", "fallback"), "fallback");
        Assert.assertEquals(JsonUtils.getInt(json, "missing", 7), 7);
        Assert.assertFalse(JsonUtils.isDefined(json, "none"));
    }

    @Test
    public void testWrongTypeIsInvalidConfig()
    {
        JsonNode json = JsonUtils.parse("{\"size\": \"three\"}");

        try
        {
            JsonUtils.getInt(json, "size", 0);
            Assert.fail("Expected CubeDefinitionException");
        }
        catch (CubeDefinitionException e)
        {
            Assert.assertEquals(e.getErrorType(), CubeDefinitionErrorType.INVALID_CONFIG);
        }
    }

    @Test
    public void testMalformedJsonIsInvalidConfig()
    {
        try
        {
            JsonUtils.parse("{\"name\": ");
            Assert.fail("Expected CubeDefinitionException");
        }
        catch (CubeDefinitionException e)
        {
            Assert.assertEquals(e.getErrorType(), CubeDefinitionErrorType.INVALID_CONFIG);
            Assert.assertNotNull(e.getCause());
        }
    }

    @Test
    public void testScalarConversion()
    {
        JsonNode json = JsonUtils.parse("{\"s\": \"x\", \"i\": 1, \"l\": 10000000000, \"d\": 1.5, \"b\": false, \"a\": []}");

        Assert.assertEquals(JsonUtils.asObject(json.get("s")), "x");
        Assert.assertEquals(JsonUtils.asObject(json.get("i")), 1);
        Assert.assertEquals(JsonUtils.asObject(json.get("l")), 10000000000L);
        Assert.assertEquals(JsonUtils.asObject(json.get("d")), 1.5);
        Assert.assertEquals(JsonUtils.asObject(json.get("b")), Boolean.FALSE);
        Assert.assertNull(JsonUtils.asObject(json.get("a")));
    }
}
