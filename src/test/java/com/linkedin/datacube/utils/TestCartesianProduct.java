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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

public class TestCartesianProduct
{
    @Test
    public void testFirstListVariesSlowest()
    {
        List<List<String>> lists =
                Arrays.asList(Arrays.asList("a", "b"), Arrays.asList("1", "2", "3"));

        List<List<String>> product = CartesianProduct.of(lists);

        Assert.assertEquals(product.size(), 6);
        Assert.assertEquals(product.get(0), Arrays.asList("a", "1"));
        Assert.assertEquals(product.get(1), Arrays.asList("a", "2"));
        Assert.assertEquals(product.get(2), Arrays.asList("a", "3"));
        Assert.assertEquals(product.get(3), Arrays.asList("b", "1"));
        Assert.assertEquals(product.get(5), Arrays.asList("b", "3"));
    }

    @Test
    public void testNullElementsArePreserved()
    {
        List<List<String>> lists =
                Arrays.asList(Arrays.asList("a", null), Collections.<String> singletonList(null));

        List<List<String>> product = CartesianProduct.of(lists);

        Assert.assertEquals(product.size(), 2);
        Assert.assertEquals(product.get(0), Arrays.asList("a", null));
        Assert.assertEquals(product.get(1), Arrays.asList(null, null));
    }

    @Test
    public void testNoListsGiveOneEmptyRow()
    {
        List<List<String>> product =
                CartesianProduct.of(Collections.<List<String>> emptyList());

        Assert.assertEquals(product.size(), 1);
        Assert.assertTrue(product.get(0).isEmpty());
    }

    @Test
    public void testEmptyListGivesEmptyProduct()
    {
        List<List<String>> lists =
                Arrays.asList(Arrays.asList("a", "b"), Collections.<String> emptyList());

        Assert.assertTrue(CartesianProduct.of(lists).isEmpty());
    }
}
