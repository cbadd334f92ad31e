/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.orchestrator.registry;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * In-memory {@link Process} whose exit is driven by the test.
 */
class FakeProcess extends Process {

	private final CompletableFuture<Process> exit = new CompletableFuture<>();

	private final long pid;

	private final boolean ignoresTerminate;

	private volatile int exitCode = -1;

	volatile boolean destroyed;

	volatile boolean destroyedForcibly;

	FakeProcess(long pid) {
		this(pid, false);
	}

	FakeProcess(long pid, boolean ignoresTerminate) {
		this.pid = pid;
		this.ignoresTerminate = ignoresTerminate;
	}

	void exit(int code) {
		if (!exit.isDone()) {
			exitCode = code;
			exit.complete(this);
		}
	}

	@Override
	public OutputStream getOutputStream() {
		return OutputStream.nullOutputStream();
	}

	@Override
	public InputStream getInputStream() {
		return InputStream.nullInputStream();
	}

	@Override
	public InputStream getErrorStream() {
		return InputStream.nullInputStream();
	}

	@Override
	public int waitFor() throws InterruptedException {
		try {
			exit.get();
		}
		catch (ExecutionException e) {
			throw new IllegalStateException(e);
		}
		return exitCode;
	}

	@Override
	public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
		try {
			exit.get(timeout, unit);
			return true;
		}
		catch (TimeoutException e) {
			return false;
		}
		catch (ExecutionException e) {
			throw new IllegalStateException(e);
		}
	}

	@Override
	public int exitValue() {
		if (!exit.isDone()) {
			throw new IllegalThreadStateException("process " + pid + " has not exited");
		}
		return exitCode;
	}

	@Override
	public void destroy() {
		destroyed = true;
		if (!ignoresTerminate) {
			exit(143);
		}
	}

	@Override
	public Process destroyForcibly() {
		destroyedForcibly = true;
		exit(137);
		return this;
	}

	@Override
	public boolean isAlive() {
		return !exit.isDone();
	}

	@Override
	public long pid() {
		return pid;
	}

	@Override
	public CompletableFuture<Process> onExit() {
		return exit;
	}

}
