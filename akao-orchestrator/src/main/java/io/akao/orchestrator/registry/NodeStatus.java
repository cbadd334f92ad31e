/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.orchestrator.registry;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import io.akao.orchestrator.manifest.NodeManifest;
import reactor.util.annotation.Nullable;

/**
 * Point-in-time snapshot of a registered node.
 *
 * @param manifest the manifest the node was registered or last updated with
 * @param manifestPath the manifest file
 * @param state lifecycle state
 * @param pid process id, {@code -1} when no process is running
 * @param running whether a process spawned by the registry is alive
 * @param startedAt when the current process was started
 * @param restartCount number of restarts through the registry, automatic ones included
 * @param exitCode exit code of the last process, {@code null} while it runs or before the
 * first exit
 * @param connected whether a client is connected to the node
 * @param healthy result of the last health check
 * @param lastHealthCheck when the last health check completed
 */
public record NodeStatus(NodeManifest manifest, Path manifestPath, NodeState state, long pid, boolean running,
		@Nullable Instant startedAt, int restartCount, @Nullable Integer exitCode, boolean connected, boolean healthy,
		@Nullable Instant lastHealthCheck) {

	public static final String STATUS_STOPPED = "stopped";

	public static final String STATUS_RUNNING_DISCONNECTED = "running-disconnected";

	public static final String STATUS_RUNNING_UNHEALTHY = "running-unhealthy";

	public static final String STATUS_RUNNING_HEALTHY = "running-healthy";

	public String id() {
		return manifest.id();
	}

	/**
	 * @return how long the current process has been running, zero when stopped
	 */
	public Duration uptime() {
		if (!running || startedAt == null) {
			return Duration.ZERO;
		}
		return Duration.between(startedAt, Instant.now());
	}

	public String statusString() {
		if (!running) {
			return STATUS_STOPPED;
		}
		if (!connected) {
			return STATUS_RUNNING_DISCONNECTED;
		}
		return healthy ? STATUS_RUNNING_HEALTHY : STATUS_RUNNING_UNHEALTHY;
	}

}
