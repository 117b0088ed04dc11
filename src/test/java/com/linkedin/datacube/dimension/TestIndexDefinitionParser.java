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

import org.testng.Assert;
import org.testng.annotations.Test;

import com.linkedin.datacube.CubeDefinitionErrorType;
import com.linkedin.datacube.CubeDefinitionException;

public class TestIndexDefinitionParser
{
    @Test
    public void testParseHierarchy()
    {
        String json =
                "[{\"title\": \"World\", \"childrenFirst\": true, \"children\": ["
                        + "  {\"value\": \"EU\", \"title\": \"Europe\", \"metadata\": {\"rank\": 1, \"color\": \"blue\"},"
                        + "   \"children\": [{\"value\": \"DE\"}, {\"value\": \"FR\"}]},"
                        + "  {\"value\": \"US\"}]}]";

        List<IndexDefinition<String>> roots = IndexDefinitionParser.parseAll(json);

        Assert.assertEquals(roots.size(), 1);
        IndexDefinition<String> world = roots.get(0);
        Assert.assertTrue(world.isDefault());
        Assert.assertTrue(world.isChildrenBeforeParent());
        Assert.assertEquals(world.getTitle(), "World");
        Assert.assertEquals(TestIndexDefinition.values(world.flatten()),
                            Arrays.asList("EU", "DE", "FR", "US", null));

        IndexDefinition<String> eu = world.getChildren().get(0);
        Assert.assertEquals(eu.getMetadata().get("rank"), 1);
        Assert.assertEquals(eu.getMetadata().get("color"), "blue");
        Assert.assertNull(eu.getChildren().get(0).getTitle());
    }

    @Test
    public void testParsedRootsBuildDimension()
    {
        List<IndexDefinition<String>> roots =
                IndexDefinitionParser.parseAll("[{\"value\": \"2007\"}, {\"value\": \"2008\"}]");

        Dimension<String> year = DimensionDefinitions.<String> createDefaultForMaps("Year", null)
                                                     .withIndexDefinitions(roots);

        Assert.assertEquals(TestIndexDefinition.values(year), Arrays.asList("2007", "2008"));
    }

    @Test
    public void testUnknownProperty()
    {
        assertInvalid("[{\"value\": \"EU\", \"label\": \"Europe\"}]");
    }

    @Test
    public void testNotAnArray()
    {
        assertInvalid("{\"value\": \"EU\"}");
    }

    @Test
    public void testNonScalarMetadata()
    {
        assertInvalid("[{\"value\": \"EU\", \"metadata\": {\"tags\": [1, 2]}}]");
    }

    @Test
    public void testWrongValueType()
    {
        assertInvalid("[{\"value\": 2007}]");
    }

    @Test
    public void testNestedDefaultIsRejected()
    {
        try
        {
            IndexDefinitionParser.parseAll("[{\"value\": \"EU\", \"children\": [{\"title\": \"All\"}]}]");
            Assert.fail("Expected CubeDefinitionException");
        }
        catch (CubeDefinitionException e)
        {
            Assert.assertEquals(e.getErrorType(), CubeDefinitionErrorType.NESTED_DEFAULT_INDEX);
        }
    }

    private static void assertInvalid(String json)
    {
        try
        {
            IndexDefinitionParser.parseAll(json);
            Assert.fail("Expected CubeDefinitionException for " + json);
        }
        catch (CubeDefinitionException e)
        {
            Assert.assertEquals(e.getErrorType(), CubeDefinitionErrorType.INVALID_CONFIG);
        }
    }
}
