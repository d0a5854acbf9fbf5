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
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeroturnaround.exec.ProcessExecutor;
import org.zeroturnaround.exec.ProcessResult;
import org.zeroturnaround.exec.StartedProcess;

/**
 * Registry of commands running in the background.
 *
 * <p>
 * Each started command gets an identifier {@code shell_<n>} that stays unique for the
 * lifetime of the registry, and one monitoring task that records the exit outcome when
 * the process ends. Independent callers poll new output through
 * {@link #pollOutput(String, String)}, list entries and request termination, concurrently
 * and in any order.
 * </p>
 *
 * <p>
 * One reader/writer lock guards the entry map, the identifier counter and the read
 * cursors of every entry. Critical sections only touch in-memory bookkeeping: process
 * output accumulates in each entry's {@link ConcurrentBuffer}, and the kill grace period is
 * waited out after the lock is released.
 * </p>
 *
 * <p>
 * Completed entries are kept until the registry is closed, so their final output and exit
 * status stay available to pollers.
 * </p>
 *
 * @since 0.1.0
 */
public class ProcessRegistry implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ProcessRegistry.class);

	/**
	 * Prefix of every background identifier.
	 */
	public static final String ID_PREFIX = "shell_";

	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	private final Map<String, BackgroundExecution> executions = new LinkedHashMap<>();

	private final ExecutorService monitors = Executors.newCachedThreadPool(new MonitorThreadFactory());

	private final Duration killGracePeriod;

	private final OutputLimits limits;

	private long nextId = 1;

	private boolean closed = false;

	public ProcessRegistry() {
		this(ToolsConfig.defaults());
	}

	public ProcessRegistry(ToolsConfig config) {
		Objects.requireNonNull(config, "config cannot be null");
		this.killGracePeriod = config.killGracePeriod();
		this.limits = new OutputLimits(config);
	}

	/**
	 * Spawns a command through the platform shell and registers it.
	 * @param command the command line
	 * @param description optional human-readable description
	 * @param workingDirectory directory the command runs in
	 * @return the registered execution
	 * @throws ToolException of kind {@code OS_FAILURE} if the process cannot be started, in
	 * which case nothing is registered
	 * @throws IllegalStateException if the registry is closed
	 */
	public BackgroundExecution start(String command, String description, Path workingDirectory) {
		Objects.requireNonNull(command, "command cannot be null");
		Objects.requireNonNull(workingDirectory, "workingDirectory cannot be null");
		ensureOpen();

		List<String> finalCommand = ShellCommands.shell(command);
		ConcurrentBuffer stdout = new ConcurrentBuffer();
		ConcurrentBuffer stderr = new ConcurrentBuffer();

		StartedProcess started;
		try {
			logger.debug("Starting background command in directory {}: {}", workingDirectory, finalCommand);
			started = new ProcessExecutor().command(finalCommand)
				.directory(workingDirectory.toFile())
				.redirectOutput(stdout)
				.redirectError(stderr)
				.exitValueAny()
				.destroyOnExit()
				.start();
		}
		catch (IOException e) {
			throw ToolException.osFailure("Failed to start background command: " + e.getMessage(), e);
		}

		BackgroundExecution execution = allocate(command, description, started.getProcess(), stdout, stderr);
		try {
			monitors.execute(() -> monitor(execution, started.getFuture()));
		}
		catch (RejectedExecutionException e) {
			// closed after the entry was inserted: close() has killed the process
			execution.complete(ExitOutcome.failedWith(ExitOutcome.UNKNOWN_EXIT_CODE, e));
			throw new IllegalStateException("Process registry is closed", e);
		}
		logger.info("Started background execution {}: {}", execution.id(), command);
		return execution;
	}

	/**
	 * Registers an already spawned process under a fresh identifier.
	 * @param command the command line
	 * @param description optional description
	 * @param process the process handle, may be null
	 * @param stdout sink receiving standard output
	 * @param stderr sink receiving standard error
	 * @return the registered execution
	 * @throws IllegalStateException if the registry was closed, in which case the process
	 * is killed and nothing is registered
	 */
	BackgroundExecution allocate(String command, String description, Process process, ConcurrentBuffer stdout,
			ConcurrentBuffer stderr) {
		BackgroundExecution execution = null;
		lock.writeLock().lock();
		try {
			if (!closed) {
				String id = ID_PREFIX + nextId++;
				execution = new BackgroundExecution(id, command, description, process, stdout, stderr);
				executions.put(id, execution);
			}
		}
		finally {
			lock.writeLock().unlock();
		}
		if (execution == null) {
			if (process != null) {
				killTree(process);
			}
			throw new IllegalStateException("Process registry is closed");
		}
		return execution;
	}

	/**
	 * Looks up an execution.
	 * @param id the identifier
	 * @return the execution, or empty if unknown or already terminated
	 */
	public Optional<BackgroundExecution> lookup(String id) {
		lock.readLock().lock();
		try {
			return Optional.ofNullable(executions.get(id));
		}
		finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Delivers the output produced since the previous poll of the same execution.
	 *
	 * <p>
	 * The status is observed before the output is read, so a poll that reports a finished
	 * execution also delivers everything the process wrote. Cursor reads and advances
	 * happen in one critical section: sequential polls observe each byte exactly once and
	 * concurrent polls never deliver the same byte twice. A multi-byte character split at
	 * the end of a running execution's output is held back until its remaining bytes
	 * arrive.
	 * </p>
	 * @param id the identifier
	 * @param filter optional regular expression; only fully matching lines are returned,
	 * the others are consumed
	 * @return the newly delivered output and the current status
	 * @throws ToolException {@code INVALID_INPUT} for a blank id or an invalid filter
	 * (cursors untouched), {@code NOT_FOUND} for an unknown id
	 */
	public OutputSnapshot pollOutput(String id, String filter) {
		if (id == null || id.isBlank()) {
			throw ToolException.invalidInput("shell_id is required.");
		}
		if (lookup(id).isEmpty()) {
			throw notFound(id);
		}
		Pattern pattern = OutputFilter.compile(filter);

		Optional<ExitOutcome> outcome;
		byte[] newStdout;
		byte[] newStderr;
		lock.writeLock().lock();
		try {
			BackgroundExecution execution = executions.get(id);
			if (execution == null) {
				// terminated since the lookup above
				throw notFound(id);
			}
			outcome = execution.exitOutcome();
			newStdout = readNew(execution.stdout(), execution.stdoutCursor(), outcome.isPresent());
			newStderr = readNew(execution.stderr(), execution.stderrCursor(), outcome.isPresent());
			execution.advanceCursors(execution.stdoutCursor() + newStdout.length,
					execution.stderrCursor() + newStderr.length);
		}
		finally {
			lock.writeLock().unlock();
		}

		String stdout = OutputFilter.apply(new String(newStdout, StandardCharsets.UTF_8), pattern);
		String stderr = OutputFilter.apply(new String(newStderr, StandardCharsets.UTF_8), pattern);
		if (limits.exceedsOutputSize(stdout) || limits.exceedsOutputSize(stderr)) {
			logger.warn("Output of {} exceeds the output size limit (stdout={} chars, stderr={} chars)", id,
					stdout.length(), stderr.length());
		}

		ExecutionStatus status = ExecutionStatus.of(outcome.orElse(null));
		Integer exitCode = outcome.map(ExitOutcome::exitCode).orElse(null);
		return new OutputSnapshot(status, exitCode, stdout, stderr, Instant.now());
	}

	private static ToolException notFound(String id) {
		return ToolException.notFound(String.format("Background shell with ID '%s' not found.", id));
	}

	private static byte[] readNew(ConcurrentBuffer buffer, int cursor, boolean finished) {
		byte[] bytes = buffer.readRange(cursor, buffer.snapshotLength());
		if (finished) {
			return bytes;
		}
		int complete = completeUtf8Length(bytes);
		return complete == bytes.length ? bytes : Arrays.copyOf(bytes, complete);
	}

	/**
	 * Length of the longest prefix that does not end inside a UTF-8 sequence.
	 */
	static int completeUtf8Length(byte[] bytes) {
		int length = bytes.length;
		for (int back = 1; back <= Math.min(4, length); back++) {
			int b = bytes[length - back] & 0xFF;
			if ((b & 0xC0) == 0x80) {
				continue;
			}
			return sequenceLength(b) > back ? length - back : length;
		}
		return length;
	}

	private static int sequenceLength(int leadByte) {
		if ((leadByte & 0xE0) == 0xC0) {
			return 2;
		}
		if ((leadByte & 0xF0) == 0xE0) {
			return 3;
		}
		if ((leadByte & 0xF8) == 0xF0) {
			return 4;
		}
		return 1;
	}

	/**
	 * Forcibly kills a running execution and removes it.
	 * @param id the identifier
	 * @return the outcome; {@link TerminationResult.Outcome#NOT_FOUND} also covers an
	 * execution that another caller is already terminating
	 * @throws ToolException of kind {@code INVALID_INPUT} for a blank id
	 */
	public TerminationResult terminate(String id) {
		if (id == null || id.isBlank()) {
			throw ToolException.invalidInput("shell_id is required.");
		}

		BackgroundExecution execution;
		lock.writeLock().lock();
		try {
			execution = executions.get(id);
			if (execution == null || execution.isTerminating()) {
				return TerminationResult.notFound(id);
			}
			if (execution.isCompleted()) {
				return TerminationResult.alreadyCompleted(execution);
			}
			execution.markTerminating(true);
		}
		finally {
			lock.writeLock().unlock();
		}

		try {
			execution.process().ifPresent(ProcessRegistry::killTree);
		}
		catch (RuntimeException e) {
			logger.warn("Failed to kill background execution {}", id, e);
			lock.writeLock().lock();
			try {
				execution.markTerminating(false);
			}
			finally {
				lock.writeLock().unlock();
			}
			return TerminationResult.killFailed(execution, e);
		}

		sleepGracePeriod();

		lock.writeLock().lock();
		try {
			executions.remove(id, execution);
		}
		finally {
			lock.writeLock().unlock();
		}
		logger.info("Terminated background execution {}", id);
		return TerminationResult.terminated(execution);
	}

	/**
	 * Lists every registered execution in start order. Read cursors are not affected.
	 * @return identifier, description and status per execution
	 */
	public List<ExecutionInfo> list() {
		lock.readLock().lock();
		try {
			List<ExecutionInfo> infos = new ArrayList<>(executions.size());
			for (BackgroundExecution execution : executions.values()) {
				infos.add(new ExecutionInfo(execution.id(), execution.description(), execution.status()));
			}
			return infos;
		}
		finally {
			lock.readLock().unlock();
		}
	}

	public int size() {
		lock.readLock().lock();
		try {
			return executions.size();
		}
		finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Kills every running execution and stops the monitoring tasks.
	 */
	@Override
	public void close() {
		List<BackgroundExecution> running = new ArrayList<>();
		lock.writeLock().lock();
		try {
			if (closed) {
				return;
			}
			closed = true;
			for (BackgroundExecution execution : executions.values()) {
				if (!execution.isCompleted()) {
					running.add(execution);
				}
			}
		}
		finally {
			lock.writeLock().unlock();
		}

		for (BackgroundExecution execution : running) {
			try {
				execution.process().ifPresent(ProcessRegistry::killTree);
			}
			catch (RuntimeException e) {
				logger.warn("Failed to kill background execution {} during shutdown", execution.id(), e);
			}
		}
		monitors.shutdownNow();
		logger.info("Process registry closed, killed {} running execution(s)", running.size());
	}

	public boolean isClosed() {
		lock.readLock().lock();
		try {
			return closed;
		}
		finally {
			lock.readLock().unlock();
		}
	}

	private void ensureOpen() {
		if (isClosed()) {
			throw new IllegalStateException("Process registry is closed");
		}
	}

	private void monitor(BackgroundExecution execution, Future<ProcessResult> future) {
		ExitOutcome outcome;
		try {
			outcome = ExitOutcome.exited(future.get().getExitValue());
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			outcome = ExitOutcome.failedWith(exitCodeOf(execution), e);
		}
		catch (ExecutionException e) {
			outcome = ExitOutcome.failedWith(exitCodeOf(execution), e.getCause());
		}

		boolean discarded;
		lock.readLock().lock();
		try {
			discarded = executions.get(execution.id()) != execution || execution.isTerminating();
		}
		finally {
			lock.readLock().unlock();
		}
		execution.complete(outcome);

		if (discarded) {
			logger.debug("Discarding outcome of terminated execution {}: {}", execution.id(), outcome);
		}
		else if (outcome.error() != null) {
			logger.debug("Failed waiting for background execution {}", execution.id(), outcome.error());
		}
		else {
			logger.debug("Background execution {} exited with code {}", execution.id(), outcome.exitCode());
		}
	}

	private static int exitCodeOf(BackgroundExecution execution) {
		return execution.process()
			.filter(process -> !process.isAlive())
			.map(Process::exitValue)
			.orElse(ExitOutcome.UNKNOWN_EXIT_CODE);
	}

	private static void killTree(Process process) {
		process.descendants().forEach(ProcessHandle::destroyForcibly);
		process.destroyForcibly();
	}

	private void sleepGracePeriod() {
		try {
			Thread.sleep(killGracePeriod.toMillis());
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	@Override
	public String toString() {
		return String.format("ProcessRegistry{executions=%d, closed=%s}", size(), isClosed());
	}

	private static final class MonitorThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "agent-tools-monitor-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

}
