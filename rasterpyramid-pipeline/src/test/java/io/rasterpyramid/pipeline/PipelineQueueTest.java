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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(10)
class PipelineQueueTest {

    @Test
    void testFifo() throws InterruptedException {
        PipelineQueue<String> queue = PipelineQueue.unbounded("test");
        queue.put("a");
        queue.put("b");
        assertThat(queue.size()).isEqualTo(2);
        assertThat(queue.take()).hasValue("a");
        assertThat(queue.take()).hasValue("b");
    }

    @Test
    void testCloseDrainsRemainingItems() throws InterruptedException {
        PipelineQueue<String> queue = PipelineQueue.unbounded("test");
        queue.put("a");
        queue.close();
        assertThat(queue.isClosed()).isTrue();
        assertThat(queue.size()).isOne();
        assertThat(queue.take()).hasValue("a");
        assertThat(queue.take()).isEmpty();
        assertThat(queue.take()).isEmpty();
        assertThat(queue.size()).as("the re-queued close marker is not counted").isZero();
    }

    @Test
    void testPutAfterClose() {
        PipelineQueue<String> queue = PipelineQueue.unbounded("test");
        queue.close();
        queue.close();
        assertThatThrownBy(() -> queue.put("a"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("test");
    }

    @Test
    void testCloseReleasesAllBlockedConsumers() throws InterruptedException {
        PipelineQueue<String> queue = PipelineQueue.unbounded("test");
        List<Optional<String>> taken = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(3);
        for (int i = 0; i < 3; i++) {
            Thread consumer = new Thread(() -> {
                try {
                    taken.add(queue.take());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                done.countDown();
            });
            consumer.setDaemon(true);
            consumer.start();
        }
        queue.close();
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(taken).hasSize(3).allSatisfy(item -> assertThat(item).isEmpty());
    }

    @Test
    void testBoundedQueueBlocksProducer() throws InterruptedException {
        PipelineQueue<Integer> queue = PipelineQueue.bounded("test", 1);
        queue.put(1);
        CountDownLatch produced = new CountDownLatch(1);
        Thread producer = new Thread(() -> {
            try {
                queue.put(2);
                produced.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.setDaemon(true);
        producer.start();

        assertThat(produced.await(200, TimeUnit.MILLISECONDS)).isFalse();
        assertThat(queue.take()).hasValue(1);
        assertThat(produced.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(queue.take()).hasValue(2);
    }

    @Test
    void testClosingFullBoundedQueue() throws InterruptedException {
        PipelineQueue<Integer> queue = PipelineQueue.bounded("test", 1);
        queue.put(1);
        queue.close();
        assertThat(queue.size()).as("the close marker did not fit").isOne();
        assertThat(queue.take()).hasValue(1);
        assertThat(queue.take()).isEmpty();
        assertThat(queue.size()).isZero();
    }

    @Test
    void testInvalidCapacity() {
        assertThatThrownBy(() -> PipelineQueue.bounded("test", 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
