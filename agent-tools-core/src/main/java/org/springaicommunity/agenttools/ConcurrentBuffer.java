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

import java.io.OutputStream;
import java.util.Arrays;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only byte sink written by one process pump and read by any number of pollers.
 *
 * <p>
 * Being an {@link OutputStream}, the buffer can be handed directly to the process
 * executor as the stdout or stderr target. Reads never block the writer for longer than
 * one array copy, and bytes already handed out by {@link #readRange(int, int)} are never
 * modified afterwards.
 * </p>
 *
 * <p>
 * The internal lock is private to the buffer and unrelated to the
 * {@link ProcessRegistry} lock.
 * </p>
 */
public final class ConcurrentBuffer extends OutputStream {

	private static final int INITIAL_CAPACITY = 1024;

	static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

	private final ReentrantLock lock = new ReentrantLock();

	private byte[] data = new byte[INITIAL_CAPACITY];

	private int length;

	/**
	 * Appends bytes to the end of the buffer.
	 * @param bytes the bytes to append
	 */
	public void append(byte[] bytes) {
		write(bytes, 0, bytes.length);
	}

	@Override
	public void write(int b) {
		lock.lock();
		try {
			ensureCapacity(length + 1);
			data[length++] = (byte) b;
		}
		finally {
			lock.unlock();
		}
	}

	@Override
	public void write(byte[] bytes, int offset, int count) {
		if (offset < 0 || count < 0 || offset + count > bytes.length) {
			throw new IndexOutOfBoundsException(
					"offset=" + offset + ", count=" + count + ", array length=" + bytes.length);
		}
		if (count == 0) {
			return;
		}
		lock.lock();
		try {
			ensureCapacity(length + count);
			System.arraycopy(bytes, offset, data, length, count);
			length += count;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Gets the number of bytes appended so far.
	 * @return the current length
	 */
	public int snapshotLength() {
		lock.lock();
		try {
			return length;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Copies the bytes in {@code [fromOffset, toOffset)}. An end offset past the current
	 * length is clamped, and a start offset at or past the end yields an empty array.
	 * @param fromOffset inclusive start offset
	 * @param toOffset exclusive end offset
	 * @return a copy of the requested range
	 */
	public byte[] readRange(int fromOffset, int toOffset) {
		if (fromOffset < 0 || toOffset < 0) {
			throw new IllegalArgumentException("Offsets cannot be negative: " + fromOffset + ", " + toOffset);
		}
		lock.lock();
		try {
			int end = Math.min(toOffset, length);
			if (fromOffset >= end) {
				return new byte[0];
			}
			return Arrays.copyOfRange(data, fromOffset, end);
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Copies the whole buffer.
	 * @return all bytes appended so far
	 */
	public byte[] toByteArray() {
		lock.lock();
		try {
			return Arrays.copyOf(data, length);
		}
		finally {
			lock.unlock();
		}
	}

	private void ensureCapacity(int required) {
		if (required < 0 || required > data.length) {
			data = Arrays.copyOf(data, grownCapacity(data.length, required));
		}
	}

	/**
	 * Capacity to grow to: at least {@code required}, doubling when possible, never above
	 * {@link #MAX_CAPACITY}.
	 * @throws OutOfMemoryError if {@code required} overflowed or exceeds the maximum
	 */
	static int grownCapacity(int currentCapacity, int required) {
		if (required < 0 || required > MAX_CAPACITY) {
			throw new OutOfMemoryError("Buffer size exceeds maximum array length");
		}
		int doubled = currentCapacity << 1;
		if (doubled < 0 || doubled > MAX_CAPACITY) {
			return MAX_CAPACITY;
		}
		return Math.max(required, doubled);
	}

	@Override
	public String toString() {
		return "ConcurrentBuffer{length=" + snapshotLength() + "}";
	}

}
