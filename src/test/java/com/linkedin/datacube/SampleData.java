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


package com.linkedin.datacube;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BinaryOperator;
import java.util.function.Function;

import com.linkedin.datacube.aggregate.AggregationDefinition;
import com.linkedin.datacube.aggregate.AggregationDefinitions;
import com.linkedin.datacube.aggregate.Aggregations;
import com.linkedin.datacube.dimension.DimensionDefinition;
import com.linkedin.datacube.dimension.DimensionDefinitions;
import com.linkedin.datacube.dimension.IndexDefinitions;

/**
 * Records, dimensions and aggregations shared by the tests.
 */
public final class SampleData
{
    public static final class SampleRecord
    {
        private final String a;
        private final int b;
        private final int c;
        private final Long d;
        private final int[] e;

        SampleRecord(String a, int b, int c, Long d, int... e)
        {
            this.a = a;
            this.b = b;
            this.c = c;
            this.d = d;
            this.e = e;
        }

        public String getA()
        {
            return a;
        }

        public int getB()
        {
            return b;
        }

        public int getC()
        {
            return c;
        }

        public Long getD()
        {
            return d;
        }

        public int[] getE()
        {
            return e;
        }

        public long getDOrZero()
        {
            return d == null ? 0L : d;
        }
    }

    public static final List<SampleRecord> RECORDS =
            Arrays.asList(new SampleRecord("1", 1, 11, 100L, 1, 2),
                          new SampleRecord("3", 1, 11, null, 1),
                          new SampleRecord("1", 2, 22, 250L, 2, 3),
                          new SampleRecord("1", 2, 11, 300L),
                          new SampleRecord("1", 4, 22, 250L, 4, 4, 6),
                          new SampleRecord("1", 0, 22, 180L, 1, 3, 4),
                          new SampleRecord(null, 2, 22, 320L, 3, 2),
                          new SampleRecord("1", 3, 22, 50L, 4, 2, 1),
                          new SampleRecord("4", 4, 22, 40L, 0, 3),
                          new SampleRecord("2", 1, 11, 300L, 2, 1),
                          new SampleRecord("1", 2, 22, 340L, 5),
                          new SampleRecord("2", 2, 11, 100L, 2),
                          new SampleRecord("2", 3, 22, 150L, 3, 4),
                          new SampleRecord("2", 2, 44, 250L, 4),
                          new SampleRecord("1", 0, 0, 290L, 0));

    public static final AggregationDefinition<SampleRecord, Long> SUM_OF_D =
            Aggregations.sumOfLong(new Function<SampleRecord, Long>()
            {
                @Override
                public Long apply(SampleRecord record)
                {
                    return record.getD();
                }
            });

    public static final DimensionDefinition<SampleRecord, String> A =
            DimensionDefinitions.create(new Function<SampleRecord, String>()
                                        {
                                            @Override
                                            public String apply(SampleRecord record)
                                            {
                                                return record.getA();
                                            }
                                        },
                                        "A",
                                        IndexDefinitions.total("A Total",
                                                               IndexDefinitions.create("1", "A 1"),
                                                               IndexDefinitions.create("2", "A 2")));

    public static final DimensionDefinition<SampleRecord, String> B =
            DimensionDefinitions.create(new Function<SampleRecord, String>()
                                        {
                                            @Override
                                            public String apply(SampleRecord record)
                                            {
                                                return Integer.toString(record.getB());
                                            }
                                        },
                                        "B",
                                        IndexDefinitions.total("B Total",
                                                               IndexDefinitions.create("1", "B 1"),
                                                               IndexDefinitions.create("2", "B 2"),
                                                               IndexDefinitions.create("3", "B 3")));

    public static final DimensionDefinition<SampleRecord, String> C =
            DimensionDefinitions.create(new Function<SampleRecord, String>()
                                        {
                                            @Override
                                            public String apply(SampleRecord record)
                                            {
                                                return Integer.toString(record.getC());
                                            }
                                        },
                                        "C",
                                        IndexDefinitions.total("C Total",
                                                               IndexDefinitions.create("11", "C 11"),
                                                               IndexDefinitions.create("22", "C 22")));

    public static final DimensionDefinition<SampleRecord, String> E =
            DimensionDefinitions.createWithMultiSelector(new Function<SampleRecord, List<String>>()
                                                         {
                                                             @Override
                                                             public List<String> apply(SampleRecord record)
                                                             {
                                                                 List<String> indexes =
                                                                         new ArrayList<String>();
                                                                 for (int e : record.getE())
                                                                     indexes.add(Integer.toString(e));
                                                                 return indexes;
                                                             }
                                                         },
                                                         "E",
                                                         IndexDefinitions.total("E Total",
                                                                                IndexDefinitions.create("1", "E 1"),
                                                                                IndexDefinitions.create("2", "E 2"),
                                                                                IndexDefinitions.create("3", "E 3"),
                                                                                IndexDefinitions.create("4", "E 4")));

    /* Orders keyed by customer and year, with the totals listed after their children. */

    public static final List<Map<String, Object>> ORDERS =
            Arrays.asList(order("A", "2007", 10L), order("B", "2007", 12L));

    public static final AggregationDefinition<Map<String, Object>, Long> SUM_OF_QTY =
            AggregationDefinitions.createForMaps(new Function<Map<String, Object>, Long>()
                                                 {
                                                     @Override
                                                     public Long apply(Map<String, Object> order)
                                                     {
                                                         return (Long) order.get("qty");
                                                     }
                                                 },
                                                 new BinaryOperator<Long>()
                                                 {
                                                     @Override
                                                     public Long apply(Long x, Long y)
                                                     {
                                                         return x + y;
                                                     }
                                                 },
                                                 0L);

    public static final DimensionDefinition<Map<String, Object>, String> CUSTOMER =
            DimensionDefinitions.<String> createForMaps(column("customer"),
                                                        "Customer",
                                                        IndexDefinitions.totalAfter("Total",
                                                                                    IndexDefinitions.create("A", "A"),
                                                                                    IndexDefinitions.create("B", "B")));

    public static final DimensionDefinition<Map<String, Object>, String> YEAR =
            DimensionDefinitions.<String> createForMaps(column("year"),
                                                        "Year",
                                                        IndexDefinitions.totalAfter("Total",
                                                                                    IndexDefinitions.create("2007", "2007"),
                                                                                    IndexDefinitions.create("2008", "2008")));

    private SampleData()
    {
    }

    /**
     * Sums D over the records matching every non-null filter on A and B.
     */
    public static long sumOfD(String a, String b)
    {
        long sum = 0;
        for (SampleRecord record : RECORDS)
        {
            if (a != null && !a.equals(record.getA()))
                continue;
            if (b != null && !b.equals(Integer.toString(record.getB())))
                continue;
            sum += record.getDOrZero();
        }
        return sum;
    }

    public static Map<String, Object> order(String customer, String year, long qty)
    {
        Map<String, Object> order = new HashMap<String, Object>();
        order.put("customer", customer);
        order.put("year", year);
        order.put("qty", qty);
        return order;
    }

    private static Function<Map<String, Object>, String> column(final String name)
    {
        return new Function<Map<String, Object>, String>()
        {
            @Override
            public String apply(Map<String, Object> row)
            {
                return (String) row.get(name);
            }
        };
    }
}
