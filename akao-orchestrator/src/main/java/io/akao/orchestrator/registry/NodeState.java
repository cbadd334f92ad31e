/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.orchestrator.registry;

/**
 * Lifecycle of a registered node. A node moves forward through
 * {@code DISCOVERED → STARTING → RUNNING → CONNECTED → HEALTHY | UNHEALTHY → STOPPING → STOPPED}
 * and from {@code STOPPED} back to {@code STARTING} when restarted. A process that exits
 * on its own, without being stopped through the registry, leaves the node
 * {@code CRASHED}.
 */
public enum NodeState {

	DISCOVERED,

	STARTING,

	RUNNING,

	CONNECTED,

	HEALTHY,

	UNHEALTHY,

	STOPPING,

	STOPPED,

	CRASHED;

	boolean isConnectedState() {
		return this == CONNECTED || this == HEALTHY || this == UNHEALTHY;
	}

}
