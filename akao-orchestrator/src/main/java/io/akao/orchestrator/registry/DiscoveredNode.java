/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.orchestrator.registry;

import java.time.Instant;

import io.akao.orchestrator.discovery.DiscoveredManifest;
import io.akao.orchestrator.manifest.NodeManifest;
import io.akao.yamlrpc.client.YamlRpcClient;
import reactor.core.Disposable;

/**
 * Mutable bookkeeping of one registered node. Owned by the {@link NodeRegistry} and only
 * accessed while holding its lock.
 */
final class DiscoveredNode {

	DiscoveredManifest source;

	NodeState state = NodeState.DISCOVERED;

	Process process;

	long pid = -1;

	boolean running;

	Instant startedAt;

	int restartCount;

	// automatic restarts since the last start or stop requested through the registry
	int crashRestarts;

	Integer exitCode;

	Disposable pendingRestart;

	YamlRpcClient client;

	boolean healthy;

	Instant lastHealthCheck;

	DiscoveredNode(DiscoveredManifest source) {
		this.source = source;
	}

	NodeManifest manifest() {
		return source.manifest();
	}

	void cancelPendingRestart() {
		if (pendingRestart != null) {
			pendingRestart.dispose();
			pendingRestart = null;
		}
	}

	boolean isConnected() {
		return client != null && client.isConnected();
	}

	NodeStatus toStatus() {
		return new NodeStatus(manifest(), source.manifestPath(), state, pid, running, startedAt, restartCount,
				exitCode, isConnected(), healthy, lastHealthCheck);
	}

}
