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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle to one command running in the background.
 *
 * <p>
 * The process pump appends to {@link #stdout()} and {@link #stderr()} while the command
 * runs. The monitoring task owned by {@link ProcessRegistry} completes the handle exactly
 * once with an {@link ExitOutcome}; {@link #isCompleted()} observes that without blocking.
 * </p>
 *
 * <p>
 * Read cursors and the terminating mark are only read and written while holding the
 * registry write lock.
 * </p>
 *
 * @since 0.1.0
 */
public final class BackgroundExecution {

	private final String id;

	private final String command;

	private final String description;

	private final Instant startTime;

	private final ConcurrentBuffer stdout;

	private final ConcurrentBuffer stderr;

	private final Process process;

	private final CompletableFuture<ExitOutcome> completion = new CompletableFuture<>();

	private int stdoutCursor;

	private int stderrCursor;

	private boolean terminating;

	BackgroundExecution(String id, String command, String description, Process process, ConcurrentBuffer stdout,
			ConcurrentBuffer stderr) {
		this.id = Objects.requireNonNull(id, "id cannot be null");
		this.command = Objects.requireNonNull(command, "command cannot be null");
		this.description = description != null ? description : "";
		this.process = process;
		this.stdout = Objects.requireNonNull(stdout, "stdout cannot be null");
		this.stderr = Objects.requireNonNull(stderr, "stderr cannot be null");
		this.startTime = Instant.now();
	}

	public String id() {
		return id;
	}

	public String command() {
		return command;
	}

	public String description() {
		return description;
	}

	public Instant startTime() {
		return startTime;
	}

	public ConcurrentBuffer stdout() {
		return stdout;
	}

	public ConcurrentBuffer stderr() {
		return stderr;
	}

	/**
	 * Gets the underlying process, absent if the spawn bookkeeping did not capture it.
	 * @return the process handle
	 */
	public Optional<Process> process() {
		return Optional.ofNullable(process);
	}

	/**
	 * Non-blocking check of the completion signal.
	 * @return true once the monitoring task has recorded the exit outcome
	 */
	public boolean isCompleted() {
		return completion.isDone();
	}

	/**
	 * Gets the exit outcome without blocking.
	 * @return the outcome, empty while the process is running
	 */
	public Optional<ExitOutcome> exitOutcome() {
		return Optional.ofNullable(completion.getNow(null));
	}

	public ExecutionStatus status() {
		return ExecutionStatus.of(completion.getNow(null));
	}

	/**
	 * Blocks until the process has exited or the timeout elapses.
	 * @param timeout maximum time to wait
	 * @return the exit outcome
	 * @throws TimeoutException if the process is still running after the timeout
	 * @throws InterruptedException if the calling thread is interrupted
	 */
	public ExitOutcome awaitCompletion(Duration timeout) throws TimeoutException, InterruptedException {
		try {
			return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (ExecutionException e) {
			// never completed exceptionally: outcomes carry their own error
			throw new IllegalStateException("Completion signal failed for " + id, e.getCause());
		}
	}

	/**
	 * Returns a view of the completion signal that callers cannot complete.
	 * @return a dependent future completing with the exit outcome
	 */
	public CompletableFuture<ExitOutcome> onCompletion() {
		return completion.copy();
	}

	boolean complete(ExitOutcome outcome) {
		return completion.complete(outcome);
	}

	int stdoutCursor() {
		return stdoutCursor;
	}

	int stderrCursor() {
		return stderrCursor;
	}

	void advanceCursors(int newStdoutCursor, int newStderrCursor) {
		if (newStdoutCursor < stdoutCursor || newStderrCursor < stderrCursor) {
			throw new IllegalStateException("Read cursors cannot move backwards for " + id);
		}
		this.stdoutCursor = newStdoutCursor;
		this.stderrCursor = newStderrCursor;
	}

	boolean isTerminating() {
		return terminating;
	}

	void markTerminating(boolean terminating) {
		this.terminating = terminating;
	}

	@Override
	public String toString() {
		return String.format("BackgroundExecution{id=%s, status=%s, started=%s, command='%s'}", id, status(),
				startTime, command);
	}

}
