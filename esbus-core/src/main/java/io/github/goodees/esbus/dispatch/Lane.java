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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single lane of work. Guarantees that at most one submitted task runs at a time, and that tasks run in the order
 * they were submitted. The lane does not own a thread, it borrows one from the executor for every task, so many lanes
 * may share a single pool.
 *
 * <p>Event stores put their commits through a lane, so that concurrent commands of one process do not all race for
 * the same stream position at once. Event streams deliver through a lane, so that pushes, polls and flushes of a
 * stream never overlap.</p>
 */
public class Lane {
    private final String name;
    private final Executor executor;
    private final Deque<Task<?>> queue = new ConcurrentLinkedDeque<>();
    private final AtomicInteger enqueuesWhileBusy = new AtomicInteger();
    private final Logger logger;

    public Lane(String name, Executor executor) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.executor = Objects.requireNonNull(executor, "Executor must be specified");
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + name);
    }

    public String getName() {
        return name;
    }

    /**
     * Queue work at the end of the lane.
     * @param work the work to do
     * @param <T> type of result
     * @return future completing with the result of the work, or exceptionally with whatever it threw
     */
    public <T> CompletableFuture<T> submit(Callable<T> work) {
        Task<T> task = new Task<>(Objects.requireNonNull(work));
        queue.add(task);
        if (canStartProcessing()) {
            executor.execute(this::run);
        }
        return task.result;
    }

    /**
     * Future completing when all the work submitted so far has finished. Work submitted later is not awaited.
     * @return future of the drain
     */
    public CompletableFuture<Void> drain() {
        return submit(() -> null);
    }

    /**
     * Number of tasks waiting in the lane, excluding the running one.
     * @return number of queued tasks
     */
    public int pending() {
        return queue.size();
    }

    private boolean canStartProcessing() {
        int queueSize = enqueuesWhileBusy.getAndIncrement();
        if (queueSize == 0) {
            logger.debug("Will start processing lane {}", name);
            return true;
        } else {
            logger.debug("Will not start processing lane {}, {} tasks enqueued during current execution", name,
                queueSize);
            return false;
        }
    }

    private boolean canStopProcessing(int observedEnqueues) {
        return enqueuesWhileBusy.compareAndSet(observedEnqueues, 0);
    }

    private void run() {
        Task<?> task = nextTask();
        if (task != null) {
            try {
                task.run();
            } finally {
                executor.execute(this::run);
            }
        }
    }

    private Task<?> nextTask() {
        while (true) {
            int enqueues = enqueuesWhileBusy.get();
            Task<?> task = queue.poll();
            if (task == null) {
                // a task might have been queued right after the poll. Either canStartProcessing was called in
                // between and we poll again, or it will return true past the next statement.
                if (canStopProcessing(enqueues)) {
                    logger.debug("Stopping processing of lane {}", name);
                    return null;
                }
            } else {
                return task;
            }
        }
    }

    class Task<T> implements Runnable {
        private final Callable<T> work;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        private final Instant submission = Instant.now();

        Task(Callable<T> work) {
            this.work = work;
        }

        @Override
        public void run() {
            try {
                result.complete(work.call());
            } catch (Exception e) {
                result.completeExceptionally(e);
            } catch (Error e) {
                result.completeExceptionally(e);
                throw e;
            }
        }

        @Override
        public String toString() {
            return "Task[lane=" + name + ", work=" + work + ", submissionTime=" + submission + "]";
        }
    }
}
