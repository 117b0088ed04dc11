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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * N-way Cartesian product over ordered lists.
 * <p>
 * Combinations are produced in odometer order: the first list varies slowest and the
 * last list varies fastest. The product of zero lists is a single empty combination;
 * the product involving an empty list is empty.
 */
public final class CartesianProduct
{
    private CartesianProduct()
    {
    }

    public static <T> List<List<T>> of(List<? extends List<? extends T>> lists)
    {
        int numCols = lists.size();
        int numRows = 1;
        for (List<? extends T> list : lists)
            numRows = Math.multiplyExact(numRows, list.size());

        List<List<T>> rows = new ArrayList<List<T>>(numRows);
        if (numRows == 0)
            return rows;

        int[] cursor = new int[numCols];
        for (int r = 0; r < numRows; r++)
        {
            List<T> row = new ArrayList<T>(numCols);
            for (int c = 0; c < numCols; c++)
                row.add(lists.get(c).get(cursor[c]));
            rows.add(Collections.unmodifiableList(row));

            // advance the odometer, rightmost column first
            for (int c = numCols - 1; c >= 0; c--)
            {
                if (++cursor[c] < lists.get(c).size())
                    break;
                cursor[c] = 0;
            }
        }

        return rows;
    }
}
