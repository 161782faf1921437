/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.tessera.orchestration;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs tasks on a shared pool while guaranteeing that tasks submitted under the same key run one
 * at a time, in submission order. Tasks with different keys run concurrently.
 *
 * <p>Each key may have at most {@code maxPendingPerKey} tasks waiting behind the one in flight;
 * further submissions are rejected with {@link RejectedExecutionException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class KeyedSerialExecutor implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(KeyedSerialExecutor.class.getName());

    private final ExecutorService executor;
    private final int maxPendingPerKey;
    private final Map<String, Deque<Task>> queues = new HashMap<>();
    private final Object lock = new Object();
    private boolean closed;

    public KeyedSerialExecutor(int threads, int maxPendingPerKey) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Thread count must be positive");
        }
        if (maxPendingPerKey <= 0) {
            throw new IllegalArgumentException("Max pending per key must be positive");
        }
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "tessera-pattern-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.maxPendingPerKey = maxPendingPerKey;
    }

    /**
     * Queues a task behind any task already running or waiting for the key.
     *
     * @return a future completed when the task has run, exceptionally if it threw
     * @throws RejectedExecutionException if the key's queue is full or the executor is closed
     */
    public CompletableFuture<Void> submit(String key, Runnable task) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(task, "Task cannot be null");
        Task queued = new Task(task);
        boolean startNow;
        synchronized (lock) {
            if (closed) {
                throw new RejectedExecutionException("Executor is closed");
            }
            Deque<Task> queue = queues.get(key);
            if (queue == null) {
                queue = new ArrayDeque<>();
                queues.put(key, queue);
                startNow = true;
            } else {
                // the head of a live queue is the task in flight
                if (queue.size() - 1 >= maxPendingPerKey) {
                    throw new RejectedExecutionException("Too many pending tasks for " + key + " (max " +
                            maxPendingPerKey + ")");
                }
                startNow = false;
            }
            queue.addLast(queued);
        }
        if (startNow) {
            schedule(key, queued);
        }
        return queued.future;
    }

    /**
     * Number of tasks waiting behind the one in flight for the key.
     */
    public int pendingCount(String key) {
        synchronized (lock) {
            Deque<Task> queue = queues.get(key);
            return queue == null ? 0 : queue.size() - 1;
        }
    }

    public int activeKeys() {
        synchronized (lock) {
            return queues.size();
        }
    }

    private void schedule(String key, Task task) {
        try {
            executor.execute(() -> runAndAdvance(key, task));
        } catch (RejectedExecutionException e) {
            failQueue(key, e);
        }
    }

    private void runAndAdvance(String key, Task task) {
        try {
            task.action.run();
            task.future.complete(null);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Task for " + key + " failed: " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Task failure details for " + key, e);
            }
            task.future.completeExceptionally(e);
        } catch (Error e) {
            logger.log(Level.SEVERE, "Task for " + key + " raised " + e);
            task.future.completeExceptionally(e);
            throw e;
        } finally {
            advance(key);
        }
    }

    private void advance(String key) {
        Task next;
        synchronized (lock) {
            Deque<Task> queue = queues.get(key);
            if (queue == null) {
                return;
            }
            queue.pollFirst();
            next = queue.peekFirst();
            if (next == null) {
                queues.remove(key);
            }
        }
        if (next != null) {
            schedule(key, next);
        }
    }

    private void failQueue(String key, RejectedExecutionException cause) {
        Deque<Task> abandoned;
        synchronized (lock) {
            abandoned = queues.remove(key);
        }
        if (abandoned != null) {
            for (Task task : abandoned) {
                task.future.completeExceptionally(cause);
            }
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            closed = true;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warning("Pattern executor did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static final class Task {
        private final Runnable action;
        private final CompletableFuture<Void> future = new CompletableFuture<>();

        private Task(Runnable action) {
            this.action = action;
        }
    }
}
