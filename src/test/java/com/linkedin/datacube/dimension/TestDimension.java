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
import java.util.Collections;

import org.testng.Assert;
import org.testng.annotations.Test;

import com.linkedin.datacube.CubeDefinitionErrorType;
import com.linkedin.datacube.CubeDefinitionException;
import com.linkedin.datacube.SampleData;

public class TestDimension
{
    private final Dimension<String> region = createRegion();

    private static Dimension<String> createRegion()
    {
        IndexDefinition<String> eu =
                IndexDefinitions.create("EU",
                                        "Europe",
                                        IndexDefinitions.create("DE", "Germany"),
                                        IndexDefinitions.create("FR", "France"));
        IndexDefinition<String> all =
                IndexDefinitions.total("All", eu, IndexDefinitions.create("US", "United States"));

        return DimensionDefinitions.<String> createDefaultForMaps("Region", "All")
                                   .withIndexDefinitions(Collections.singletonList(all));
    }

    @Test
    public void testFlattenedTraversal()
    {
        Assert.assertEquals(TestIndexDefinition.values(region),
                            Arrays.asList(null, "EU", "DE", "FR", "US"));
        Assert.assertEquals(region.getIndexDefinitions().size(), 1);
        Assert.assertEquals(region.getFlattenedIndexDefinitions().size(), 5);
    }

    @Test
    public void testRollupChains()
    {
        Assert.assertEquals(region.getRollupChain("DE"), Arrays.asList("DE", "EU", null));
        Assert.assertEquals(region.getRollupChain("US"), Arrays.asList("US", null));
        Assert.assertEquals(region.getRollupChain(null), Collections.singletonList(null));
        Assert.assertEquals(region.getRollupChain("JP"), Collections.singletonList(null));

        Assert.assertEquals(region.getParentIndex("DE"), "EU");
        Assert.assertNull(region.getParentIndex("EU"));
        Assert.assertNull(region.getParentIndex(null));
    }

    @Test
    public void testRollupWithoutDefaultIndex()
    {
        Dimension<String> year = TestDimensionDefinition.yearsWithoutTotal();

        Assert.assertFalse(year.containsIndex(null));
        Assert.assertEquals(year.getRollupChain("2007"), Arrays.asList("2007", null));
        Assert.assertEquals(year.getRollupChain("1999"), Collections.singletonList(null));
    }

    @Test
    public void testTrailingTotal()
    {
        Assert.assertEquals(TestIndexDefinition.values(SampleData.YEAR),
                            Arrays.asList("2007", "2008", null));
        Assert.assertEquals(SampleData.YEAR.getRollupChain("2008"), Arrays.asList("2008", null));
    }

    @Test
    public void testLookup()
    {
        Assert.assertTrue(region.containsIndex("FR"));
        Assert.assertTrue(region.containsIndex(null));
        Assert.assertFalse(region.containsIndex("JP"));

        Assert.assertEquals(region.getIndexDefinition("FR").getTitle(), "France");
        Assert.assertEquals(region.getIndexDefinition(null).getTitle(), "All");
        Assert.assertEquals(region.getPrimaryIndex("FR"), "FR");
        Assert.assertNull(region.getPrimaryIndex("JP"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testLookupOfUnknownIndex()
    {
        region.getIndexDefinition("JP");
    }

    @Test
    public void testDefaultIndexMustBeSoleRoot()
    {
        try
        {
            SampleData.YEAR.withIndexDefinitions(Arrays.asList(IndexDefinitions.<String> total("Total"),
                                                               IndexDefinitions.create("2009", "2009")));
            Assert.fail("Expected CubeDefinitionException");
        }
        catch (CubeDefinitionException e)
        {
            Assert.assertEquals(e.getErrorType(),
                                CubeDefinitionErrorType.DEFAULT_INDEX_NOT_SOLE_ROOT);
        }
    }

    @Test
    public void testDuplicateValueAcrossRoots()
    {
        try
        {
            SampleData.YEAR.withIndexDefinitions(Arrays.asList(IndexDefinitions.create("2007", "a"),
                                                               IndexDefinitions.create("2007", "b")));
            Assert.fail("Expected CubeDefinitionException");
        }
        catch (CubeDefinitionException e)
        {
            Assert.assertEquals(e.getErrorType(), CubeDefinitionErrorType.DUPLICATE_INDEX);
        }
    }
}
