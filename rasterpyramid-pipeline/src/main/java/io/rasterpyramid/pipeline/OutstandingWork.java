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

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.jspecify.annotations.NullMarked;

/**
 * Counts the fetch tasks enqueued but not yet fully processed, and detects when there are none left.
 * <p>
 * The pipeline is a closed loop: the writer feeds new tasks to the workers that feed it results,
 * so no stage can tell on its own that the run is over. Every enqueued task is
 * {@link #increment() counted} before it is queued, and {@link #done() released} only after the
 * writer processed its result, including enqueuing (and therefore counting) its children. The
 * count can hence only drop to zero once no task is queued, being fetched, or waiting for the
 * writer; at that point the completion action runs, exactly once.
 * <p>
 * A producer seeding the loop from outside holds one unit of its own while it enqueues, so that
 * fast workers can't drive the count to zero before all initial tasks are in.
 */
@NullMarked
class OutstandingWork {

    private final AtomicLong count = new AtomicLong();

    private final AtomicBoolean complete = new AtomicBoolean();

    private final Runnable onComplete;

    OutstandingWork(Runnable onComplete) {
        this.onComplete = requireNonNull(onComplete);
    }

    /**
     * Accounts for one more unit of work.
     *
     * @throws IllegalStateException if the count already reached zero
     */
    void increment() {
        if (complete.get()) {
            throw new IllegalStateException("Work already completed");
        }
        count.incrementAndGet();
    }

    /**
     * Releases one unit of work, running the completion action if it was the last one.
     *
     * @throws IllegalStateException if there is no outstanding work
     */
    void done() {
        long remaining = count.decrementAndGet();
        if (remaining < 0) {
            count.incrementAndGet();
            throw new IllegalStateException("done() called more times than increment()");
        }
        if (remaining == 0 && complete.compareAndSet(false, true)) {
            onComplete.run();
        }
    }

    long get() {
        return count.get();
    }

    boolean isComplete() {
        return complete.get();
    }
}
