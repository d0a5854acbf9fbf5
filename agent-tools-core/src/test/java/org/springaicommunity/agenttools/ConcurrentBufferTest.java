/*
 * Copyright 2024 Spring AI Community
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.springaicommunity.agenttools;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConcurrentBuffer}.
 */
class ConcurrentBufferTest {

	@Test
	void readRangeShouldReturnAppendedBytes() {
		ConcurrentBuffer buffer = new ConcurrentBuffer();
		buffer.append("hello ".getBytes(StandardCharsets.UTF_8));
		buffer.append("world".getBytes(StandardCharsets.UTF_8));

		assertThat(buffer.snapshotLength()).isEqualTo(11);
		assertThat(new String(buffer.readRange(0, 5), StandardCharsets.UTF_8)).isEqualTo("hello");
		assertThat(new String(buffer.readRange(6, 11), StandardCharsets.UTF_8)).isEqualTo("world");
	}

	@Test
	void readRangeShouldClampEndOffset() {
		ConcurrentBuffer buffer = new ConcurrentBuffer();
		buffer.append("abc".getBytes(StandardCharsets.UTF_8));

		assertThat(new String(buffer.readRange(1, 100), StandardCharsets.UTF_8)).isEqualTo("bc");
	}

	@Test
	void readRangeShouldReturnEmptyPastTheEnd() {
		ConcurrentBuffer buffer = new ConcurrentBuffer();
		buffer.append("abc".getBytes(StandardCharsets.UTF_8));

		assertThat(buffer.readRange(3, 10)).isEmpty();
		assertThat(buffer.readRange(42, 50)).isEmpty();
		assertThat(new ConcurrentBuffer().readRange(0, 0)).isEmpty();
	}

	@Test
	void growthShouldDoubleUpToTheMaximumCapacity() {
		assertThat(ConcurrentBuffer.grownCapacity(1024, 1025)).isEqualTo(2048);
		assertThat(ConcurrentBuffer.grownCapacity(1024, 5000)).isEqualTo(5000);
		assertThat(ConcurrentBuffer.grownCapacity(1 << 30, (1 << 30) + 1)).isEqualTo(ConcurrentBuffer.MAX_CAPACITY);
		assertThat(ConcurrentBuffer.grownCapacity(1 << 30, ConcurrentBuffer.MAX_CAPACITY))
			.isEqualTo(ConcurrentBuffer.MAX_CAPACITY);
	}

	@Test
	void growthBeyondTheMaximumCapacityShouldFailWithOutOfMemory() {
		assertThatThrownBy(() -> ConcurrentBuffer.grownCapacity(1 << 30, ConcurrentBuffer.MAX_CAPACITY + 1))
			.isInstanceOf(OutOfMemoryError.class);
		assertThatThrownBy(() -> ConcurrentBuffer.grownCapacity(1 << 30, Integer.MIN_VALUE))
			.isInstanceOf(OutOfMemoryError.class);
	}

	@Test
	void readRangeShouldRejectNegativeOffsets() {
		ConcurrentBuffer buffer = new ConcurrentBuffer();

		assertThatThrownBy(() -> buffer.readRange(-1, 2)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> buffer.readRange(0, -2)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void returnedBytesShouldNotChangeAfterFurtherAppends() {
		ConcurrentBuffer buffer = new ConcurrentBuffer();
		buffer.append("first".getBytes(StandardCharsets.UTF_8));
		byte[] snapshot = buffer.readRange(0, buffer.snapshotLength());

		for (int i = 0; i < 500; i++) {
			buffer.append("more data to force growth ".getBytes(StandardCharsets.UTF_8));
		}

		assertThat(new String(snapshot, StandardCharsets.UTF_8)).isEqualTo("first");
		assertThat(new String(buffer.readRange(0, 5), StandardCharsets.UTF_8)).isEqualTo("first");
	}

	@Test
	void shouldWorkAsOutputStream() throws Exception {
		ConcurrentBuffer buffer = new ConcurrentBuffer();
		buffer.write('x');
		buffer.write("yz!".getBytes(StandardCharsets.UTF_8), 0, 2);
		buffer.flush();

		assertThat(new String(buffer.toByteArray(), StandardCharsets.UTF_8)).isEqualTo("xyz");
	}

	@Test
	void concurrentReadersShouldSeeAConsistentPrefix() throws Exception {
		ConcurrentBuffer buffer = new ConcurrentBuffer();
		ExecutorService executor = Executors.newFixedThreadPool(4);
		CountDownLatch started = new CountDownLatch(1);
		try {
			Future<?> writer = executor.submit(() -> {
				started.countDown();
				for (int i = 0; i < 10_000; i++) {
					buffer.append(new byte[] { (byte) (i % 128) });
				}
			});
			List<Future<Boolean>> readers = new ArrayList<>();
			for (int r = 0; r < 3; r++) {
				readers.add(executor.submit(() -> {
					started.await();
					ByteArrayOutputStream seen = new ByteArrayOutputStream();
					int cursor = 0;
					while (cursor < 10_000) {
						byte[] chunk = buffer.readRange(cursor, buffer.snapshotLength());
						seen.write(chunk);
						cursor += chunk.length;
					}
					byte[] all = seen.toByteArray();
					for (int i = 0; i < all.length; i++) {
						if (all[i] != (byte) (i % 128)) {
							return false;
						}
					}
					return all.length == 10_000;
				}));
			}

			writer.get(10, TimeUnit.SECONDS);
			for (Future<Boolean> reader : readers) {
				assertThat(reader.get(10, TimeUnit.SECONDS)).isTrue();
			}
		}
		finally {
			executor.shutdownNow();
		}
	}

}
