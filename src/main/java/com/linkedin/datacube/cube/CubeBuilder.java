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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.Future;

import org.apache.commons.lang.Validate;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.linkedin.datacube.aggregate.AggregationDefinition;
import com.linkedin.datacube.dimension.Dimension;
import com.linkedin.datacube.dimension.DimensionDefinition;

/**
 * Entry points for building cubes.
 * <p>
 * The source is read once. Each record is mapped to the indexes it affects in every
 * dimension and its value is combined into each resulting cell; see
 * {@link AggregationDefinition} for the requirements on the combiner.
 * <p>
 * The asynchronous variant consumes a {@link Flow.Publisher}, requesting one record at a
 * time, and produces the same cells as the synchronous build over the same records.
 */
public final class CubeBuilder
{
    private static final Log LOG = LogFactory.getLog(CubeBuilder.class.getName());

    private CubeBuilder()
    {
    }

    @SafeVarargs
    public static <S, T, V> CubeResult<T, V> build(Iterable<? extends S> source,
                                                   AggregationDefinition<S, V> aggregation,
                                                   DimensionDefinition<S, T>... dimensions)
    {
        return build(source, CubeBuildOptions.defaults(), aggregation, dimensions);
    }

    /**
     * Builds a cube from the source. If the source is a {@link List} and the options ask
     * for more than one partition, the partitions are folded concurrently and merged.
     */
    @SafeVarargs
    public static <S, T, V> CubeResult<T, V> build(Iterable<? extends S> source,
                                                   CubeBuildOptions options,
                                                   AggregationDefinition<S, V> aggregation,
                                                   DimensionDefinition<S, T>... dimensions)
    {
        Validate.notNull(source, "Source must not be null");
        List<DimensionDefinition<S, T>> dims = validate(options, aggregation, dimensions);

        long start = System.currentTimeMillis();
        CubeAccumulator<S, T, V> accumulator;
        String variant;

        if (options.getParallelism() > 1 && source instanceof List)
        {
            accumulator = foldPartitions((List<? extends S>) source, options, aggregation, dims);
            variant = "parallel";
        }
        else
        {
            accumulator = new CubeAccumulator<S, T, V>(aggregation, dims, options);
            for (S record : source)
                accumulator.add(record);
            variant = "sequential";
        }

        return finish(accumulator, options, aggregation, dims, variant, start);
    }

    @SafeVarargs
    public static <S, T, V> CompletableFuture<CubeResult<T, V>> buildAsync(Flow.Publisher<? extends S> source,
                                                                           AggregationDefinition<S, V> aggregation,
                                                                           DimensionDefinition<S, T>... dimensions)
    {
        return buildAsync(source, CubeBuildOptions.defaults(), aggregation, dimensions);
    }

    /**
     * Builds a cube from a publisher. Records are requested one at a time and folded in
     * the order they are published. The returned future completes exceptionally if the
     * publisher signals an error or folding a record fails, in which case the subscription
     * is cancelled. The parallelism option is ignored.
     */
    @SafeVarargs
    public static <S, T, V> CompletableFuture<CubeResult<T, V>> buildAsync(Flow.Publisher<? extends S> source,
                                                                           CubeBuildOptions options,
                                                                           AggregationDefinition<S, V> aggregation,
                                                                           DimensionDefinition<S, T>... dimensions)
    {
        Validate.notNull(source, "Source must not be null");
        List<DimensionDefinition<S, T>> dims = validate(options, aggregation, dimensions);

        CompletableFuture<CubeResult<T, V>> future = new CompletableFuture<CubeResult<T, V>>();
        source.subscribe(new FoldingSubscriber<S, T, V>(options, aggregation, dims, future));
        return future;
    }

    private static <S, T, V> List<DimensionDefinition<S, T>> validate(CubeBuildOptions options,
                                                                      AggregationDefinition<S, V> aggregation,
                                                                      DimensionDefinition<S, T>[] dimensions)
    {
        Validate.notNull(options, "Build options must not be null");
        Validate.notNull(aggregation, "Aggregation definition must not be null");
        Validate.noNullElements(dimensions, "Dimension definitions must not be null");

        return Collections.unmodifiableList(new ArrayList<DimensionDefinition<S, T>>(Arrays.asList(dimensions)));
    }

    private static <S, T, V> CubeResult<T, V> finish(CubeAccumulator<S, T, V> accumulator,
                                                     CubeBuildOptions options,
                                                     AggregationDefinition<S, V> aggregation,
                                                     List<DimensionDefinition<S, T>> dimensions,
                                                     String variant,
                                                     long start)
    {
        if (LOG.isInfoEnabled())
        {
            LOG.info(String.format("Built cube %s (%s): %d records, %d cells, %d dimensions in %d ms",
                                   options.getName(),
                                   variant,
                                   accumulator.getRecordCount(),
                                   accumulator.getCells().size(),
                                   dimensions.size(),
                                   System.currentTimeMillis() - start));
        }

        return new CubeResult<T, V>(accumulator.getCells(),
                                    aggregation.getSeed(),
                                    new ArrayList<Dimension<T>>(dimensions));
    }

    private static <S, T, V> CubeAccumulator<S, T, V> foldPartitions(final List<? extends S> source,
                                                                     final CubeBuildOptions options,
                                                                     final AggregationDefinition<S, V> aggregation,
                                                                     final List<DimensionDefinition<S, T>> dimensions)
    {
        int numPartitions = Math.max(1, Math.min(options.getParallelism(), source.size()));
        int partitionSize = (source.size() + numPartitions - 1) / Math.max(1, numPartitions);

        LOG.debug("Cube " + options.getName() + ": folding " + source.size() + " records in "
                + numPartitions + " partitions");

        ExecutorService pool = Executors.newFixedThreadPool(numPartitions);
        try
        {
            List<Future<CubeAccumulator<S, T, V>>> futures =
                    new ArrayList<Future<CubeAccumulator<S, T, V>>>(numPartitions);
            for (int p = 0; p < numPartitions; p++)
            {
                final List<? extends S> partition =
                        source.subList(Math.min(source.size(), p * partitionSize),
                                       Math.min(source.size(), (p + 1) * partitionSize));
                futures.add(pool.submit(new Callable<CubeAccumulator<S, T, V>>()
                {
                    @Override
                    public CubeAccumulator<S, T, V> call()
                    {
                        CubeAccumulator<S, T, V> accumulator =
                                new CubeAccumulator<S, T, V>(aggregation, dimensions, options);
                        for (S record : partition)
                            accumulator.add(record);
                        return accumulator;
                    }
                }));
            }

            // merge in partition order
            CubeAccumulator<S, T, V> result =
                    new CubeAccumulator<S, T, V>(aggregation, dimensions, options);
            for (Future<CubeAccumulator<S, T, V>> future : futures)
                result.merge(future.get());
            return result;
        }
        catch (ExecutionException e)
        {
            throw new CubeBuildException("Cube " + options.getName()
                    + ": failed to fold a partition", e.getCause());
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new CubeBuildException("Cube " + options.getName()
                    + ": interrupted while folding partitions", e);
        }
        finally
        {
            pool.shutdownNow();
        }
    }

    /**
     * Subscriber that pulls one record at a time and completes the future with the cube
     * once the publisher completes.
     */
    private static final class FoldingSubscriber<S, T, V> implements Flow.Subscriber<S>
    {
        private final CubeBuildOptions options;
        private final AggregationDefinition<S, V> aggregation;
        private final List<DimensionDefinition<S, T>> dimensions;
        private final CompletableFuture<CubeResult<T, V>> future;
        private final CubeAccumulator<S, T, V> accumulator;
        private final long start = System.currentTimeMillis();
        private Flow.Subscription subscription;

        FoldingSubscriber(CubeBuildOptions options,
                          AggregationDefinition<S, V> aggregation,
                          List<DimensionDefinition<S, T>> dimensions,
                          CompletableFuture<CubeResult<T, V>> future)
        {
            this.options = options;
            this.aggregation = aggregation;
            this.dimensions = dimensions;
            this.future = future;
            this.accumulator = new CubeAccumulator<S, T, V>(aggregation, dimensions, options);
        }

        @Override
        public void onSubscribe(Flow.Subscription newSubscription)
        {
            if (subscription != null)
            {
                newSubscription.cancel();
                return;
            }

            subscription = newSubscription;
            subscription.request(1);
        }

        @Override
        public void onNext(S record)
        {
            if (future.isDone())
                return;

            try
            {
                accumulator.add(record);
            }
            catch (RuntimeException e)
            {
                subscription.cancel();
                future.completeExceptionally(e);
                return;
            }

            subscription.request(1);
        }

        @Override
        public void onError(Throwable throwable)
        {
            future.completeExceptionally(throwable);
        }

        @Override
        public void onComplete()
        {
            if (future.isDone())
                return;

            future.complete(finish(accumulator,
                                   options,
                                   aggregation,
                                   dimensions,
                                   "async",
                                   start));
        }
    }
}
