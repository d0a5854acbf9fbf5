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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Optimistic-concurrency guard for file mutations.
 *
 * <p>
 * Remembers, per canonical path, the modification time observed at the latest successful
 * read or mutation. A mutation of an existing file is allowed only if the file was
 * observed before and has not been modified on disk since. Entries are overwritten and
 * never removed.
 * </p>
 *
 * <p>
 * The table has its own lock, independent of the {@link ProcessRegistry} lock.
 * </p>
 *
 * @since 0.1.0
 */
public class FileMutationGuard {

	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	private final Map<Path, Instant> observed = new HashMap<>();

	/**
	 * Turns a caller-supplied path into the key used by the guard.
	 * @param path the path as supplied by the caller
	 * @return the normalized absolute path
	 * @throws ToolException of kind {@code INVALID_INPUT} for a relative or malformed path
	 */
	public static Path canonicalize(String path) {
		if (path == null || path.isEmpty()) {
			throw ToolException.invalidInput("file path must be absolute, not relative");
		}
		Path candidate;
		try {
			candidate = Path.of(path);
		}
		catch (InvalidPathException e) {
			throw new ToolException(ToolException.ErrorKind.INVALID_INPUT, "Invalid file path: " + e.getMessage(), e);
		}
		if (!candidate.isAbsolute()) {
			throw ToolException.invalidInput("file path must be absolute, not relative");
		}
		return candidate.normalize();
	}

	/**
	 * Records the modification time seen by a read, replacing any earlier entry.
	 * @param path canonical path
	 * @param modificationTime modification time observed before the content was read
	 */
	public void recordRead(Path path, Instant modificationTime) {
		Objects.requireNonNull(path, "path cannot be null");
		Objects.requireNonNull(modificationTime, "modificationTime cannot be null");
		lock.writeLock().lock();
		try {
			observed.put(path, modificationTime);
		}
		finally {
			lock.writeLock().unlock();
		}
	}

	/**
	 * Records the current on-disk modification time, after a successful mutation.
	 * @param path canonical path
	 * @throws ToolException of kind {@code OS_FAILURE} if the file cannot be stat'ed
	 */
	public void recordCurrent(Path path) {
		recordRead(path, modificationTime(path));
	}

	public Optional<Instant> lastObserved(Path path) {
		lock.readLock().lock();
		try {
			return Optional.ofNullable(observed.get(path));
		}
		finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Decides whether a file may be mutated.
	 * @param path canonical path
	 * @return {@link MutationCheck#OK} for a file observed and unchanged since, or for a
	 * path with no file (creation)
	 * @throws ToolException of kind {@code OS_FAILURE} if the file exists but cannot be
	 * stat'ed
	 */
	public MutationCheck checkMutation(Path path) {
		Optional<Instant> last = lastObserved(path);
		if (last.isEmpty()) {
			return Files.exists(path) ? MutationCheck.NOT_READ : MutationCheck.OK;
		}
		Instant current;
		try {
			current = Files.getLastModifiedTime(path).toInstant();
		}
		catch (NoSuchFileException e) {
			// deleted since it was observed: recreating it is a creation
			return MutationCheck.OK;
		}
		catch (IOException e) {
			throw ToolException.osFailure("Cannot stat file " + path + ": " + e.getMessage(), e);
		}
		return current.isAfter(last.get()) ? MutationCheck.MODIFIED_SINCE_READ : MutationCheck.OK;
	}

	static Instant modificationTime(Path path) {
		try {
			return Files.getLastModifiedTime(path).toInstant();
		}
		catch (IOException e) {
			throw ToolException.osFailure("Cannot stat file " + path + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Result of {@link #checkMutation(Path)}.
	 */
	public enum MutationCheck {

		OK,

		/**
		 * The file exists but was never read.
		 */
		NOT_READ,

		/**
		 * The file changed on disk after it was last read or mutated.
		 */
		MODIFIED_SINCE_READ

	}

}
