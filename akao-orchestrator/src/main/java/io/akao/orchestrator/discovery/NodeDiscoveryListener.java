/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.orchestrator.discovery;

/**
 * Receives the node events of a {@link NodeDiscoveryScanner}. Callbacks run
 * synchronously on the scanning thread, after the scan finished comparing manifests.
 */
public interface NodeDiscoveryListener {

	/**
	 * A manifest with a new id appeared.
	 * @param node the discovered node
	 */
	default void onNodeDiscovered(DiscoveredManifest node) {
	}

	/**
	 * The manifest of a known node was modified or moved.
	 * @param node the node with its new manifest
	 */
	default void onNodeChanged(DiscoveredManifest node) {
	}

	/**
	 * The manifest of a known node disappeared.
	 * @param nodeId the id of the lost node
	 */
	default void onNodeLost(String nodeId) {
	}

}
