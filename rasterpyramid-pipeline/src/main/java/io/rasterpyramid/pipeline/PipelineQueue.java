/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.rasterpyramid.pipeline;

import static java.util.Objects.requireNonNull;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * A FIFO channel between pipeline stages that can be closed to release its consumers.
 * <p>
 * Closing does not discard queued items: consumers keep receiving them and only see
 * {@link Optional#empty()} from {@link #take()} once the queue is both closed and drained.
 * Items offered after {@link #close()} are rejected.
 * <p>
 * A bounded queue blocks producers in {@link #put} while full, applying backpressure.
 *
 * @param <T> the item type
 */
@NullMarked
class PipelineQueue<T> {

    /** Wakes up blocked consumers on close; re-queued by each consumer that sees it. */
    private static final Object CLOSED = new Object();

    /** Upper bound on how long a consumer waits before re-checking the closed flag. */
    private static final long POLL_MILLIS = 250;

    private final String name;

    private final BlockingQueue<Object> queue;

    private final AtomicBoolean closed = new AtomicBoolean();

    /** Whether {@link #CLOSED} is currently in {@link #queue}. */
    private final AtomicBoolean markerQueued = new AtomicBoolean();

    private PipelineQueue(String name, BlockingQueue<Object> queue) {
        this.name = requireNonNull(name);
        this.queue = queue;
    }

    static <T> PipelineQueue<T> unbounded(String name) {
        return new PipelineQueue<>(name, new LinkedBlockingQueue<>());
    }

    static <T> PipelineQueue<T> bounded(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        return new PipelineQueue<>(name, new LinkedBlockingQueue<>(capacity));
    }

    /**
     * Appends an item, waiting for space if the queue is bounded and full.
     *
     * @throws IllegalStateException if the queue is closed
     * @throws InterruptedException  if interrupted while waiting for space
     */
    void put(T item) throws InterruptedException {
        requireNonNull(item);
        if (closed.get()) {
            throw new IllegalStateException(name + " queue is closed");
        }
        queue.put(item);
    }

    /**
     * Waits for the next item.
     *
     * @return the next item, or empty once the queue is closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<T> take() throws InterruptedException {
        while (true) {
            @Nullable Object item = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (item == CLOSED) {
                // let the next consumer see it too
                markerQueued.set(queue.offer(CLOSED));
                return Optional.empty();
            }
            if (item != null) {
                @SuppressWarnings("unchecked")
                T value = (T) item;
                return Optional.of(value);
            }
            if (closed.get() && queue.isEmpty()) {
                return Optional.empty();
            }
        }
    }

    /**
     * Closes the queue. Idempotent.
     */
    void close() {
        if (closed.compareAndSet(false, true)) {
            // may not fit if the queue is full; consumers then find out by polling
            markerQueued.set(queue.offer(CLOSED));
        }
    }

    boolean isClosed() {
        return closed.get();
    }

    /**
     * @return the approximate number of queued items
     */
    int size() {
        int size = queue.size();
        return markerQueued.get() ? Math.max(0, size - 1) : size;
    }

    @Override
    public String toString() {
        return "PipelineQueue[%s, size=%d, closed=%s]".formatted(name, size(), closed.get());
    }
}
