/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Cellforge.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.cellforge.common;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Ordered parallel map over a fixed thread pool. Results keep the order of the inputs, so callers that assign ids or
 * labels afterwards stay deterministic whatever the thread count.
 *
 * @author hal.hildebrand
 */
public final class ParallelTasks {

    private ParallelTasks() {
    }

    /**
     * Apply the function to every item, on up to {@code parallelism} threads. With a parallelism of 1 or a single
     * item the work runs on the calling thread.
     *
     * @throws InterruptedException if interrupted while waiting, remaining work is cancelled
     * @throws RuntimeException     the first failure of the function, in input order
     */
    public static <T, R> List<R> map(List<T> items, Function<? super T, ? extends R> function, int parallelism)
    throws InterruptedException {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
        }
        var results = new ArrayList<R>(items.size());
        if (parallelism == 1 || items.size() <= 1) {
            for (var item : items) {
                results.add(function.apply(item));
            }
            return results;
        }
        var executor = Executors.newFixedThreadPool(Math.min(parallelism, items.size()));
        try {
            var futures = new ArrayList<Future<? extends R>>(items.size());
            for (var item : items) {
                futures.add(executor.submit(() -> function.apply(item)));
            }
            for (var future : futures) {
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    var cause = e.getCause();
                    if (cause instanceof RuntimeException runtime) {
                        throw runtime;
                    }
                    if (cause instanceof Error error) {
                        throw error;
                    }
                    throw new IllegalStateException("Parallel task failed", cause);
                }
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
