package io.github.goodees.esbus.dispatch;

/*-
 * #%L
 * esbus
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import org.junit.AfterClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;

import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class LaneTest {
    static ExecutorService executor = Executors.newFixedThreadPool(4);

    @Rule
    public ErrorCollector collector = new ErrorCollector();

    @AfterClass
    public static void shutdown() {
        executor.shutdown();
    }

    @Test
    public void tasks_run_one_at_a_time_in_submission_order() throws Exception {
        Lane lane = new Lane("ordering", executor);
        AtomicBoolean running = new AtomicBoolean();
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Integer>> results = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            int task = i;
            results.add(lane.submit(() -> {
                if (!running.compareAndSet(false, true)) {
                    collector.addError(new AssertionError("Task " + task + " overlaps with another one"));
                }
                LockSupport.parkNanos(TimeUnit.MICROSECONDS.toNanos(100));
                order.add(task);
                running.set(false);
                return task;
            }));
        }
        for (int i = 0; i < 100; i++) {
            assertEquals(i, (int) results.get(i).get(5, TimeUnit.SECONDS));
        }
        for (int i = 0; i < 100; i++) {
            assertEquals(i, (int) order.get(i));
        }
    }

    @Test
    public void concurrent_submitters_are_all_served() throws Exception {
        Lane lane = new Lane("concurrent", executor);
        AtomicBoolean running = new AtomicBoolean();
        List<CompletableFuture<?>> results = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Void>> submitters = new ArrayList<>();
        for (int s = 0; s < 4; s++) {
            submitters.add(CompletableFuture.runAsync(() -> {
                for (int i = 0; i < 50; i++) {
                    results.add(lane.submit(() -> {
                        if (!running.compareAndSet(false, true)) {
                            collector.addError(new AssertionError("Tasks overlap"));
                        }
                        running.set(false);
                        return null;
                    }));
                }
            }));
        }
        CompletableFuture.allOf(submitters.toArray(new CompletableFuture<?>[0])).get(5, TimeUnit.SECONDS);
        lane.drain().get(5, TimeUnit.SECONDS);
        assertEquals(200, results.size());
        for (CompletableFuture<?> result : results) {
            assertTrue(result.isDone());
        }
    }

    @Test
    public void failing_task_does_not_stop_the_lane() throws Exception {
        Lane lane = new Lane("failing", executor);
        CompletableFuture<Object> failed = lane.submit(() -> {
            throw new IllegalStateException("on purpose");
        });
        CompletableFuture<String> next = lane.submit(() -> "done");

        assertEquals("done", next.get(5, TimeUnit.SECONDS));
        try {
            failed.get();
            fail("Task should have failed");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(IllegalStateException.class));
        }
    }

    @Test
    public void drain_waits_for_earlier_tasks() throws Exception {
        Lane lane = new Lane("drain", executor);
        AtomicBoolean finished = new AtomicBoolean();
        lane.submit(() -> {
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(50));
            finished.set(true);
            return null;
        });

        lane.drain().get(5, TimeUnit.SECONDS);

        assertTrue(finished.get());
        assertEquals(0, lane.pending());
    }
}
