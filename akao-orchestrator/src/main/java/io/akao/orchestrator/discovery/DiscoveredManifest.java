/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.orchestrator.discovery;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import io.akao.orchestrator.manifest.NodeManifest;
import io.akao.yamlrpc.util.Assert;

/**
 * A manifest found on disk by the {@link NodeDiscoveryScanner}.
 *
 * @param manifest the parsed manifest
 * @param manifestPath the manifest file
 * @param nodeDirectory the directory holding the manifest file
 * @param discoveredAt when the node was first seen
 * @param lastModified modification time of the manifest file when it was parsed
 * @param problems validation problems; the node is reported even when not empty
 */
public record DiscoveredManifest(NodeManifest manifest, Path manifestPath, Path nodeDirectory, Instant discoveredAt,
		Instant lastModified, List<String> problems) {

	public DiscoveredManifest {
		Assert.notNull(manifest, "manifest must not be null");
		Assert.notNull(manifestPath, "manifestPath must not be null");
		Assert.notNull(nodeDirectory, "nodeDirectory must not be null");
		Assert.notNull(discoveredAt, "discoveredAt must not be null");
		Assert.notNull(lastModified, "lastModified must not be null");
		problems = (problems != null) ? List.copyOf(problems) : List.of();
	}

	public String id() {
		return manifest.id();
	}

	public boolean isValid() {
		return problems.isEmpty();
	}

	DiscoveredManifest withDiscoveredAt(Instant discoveredAt) {
		return new DiscoveredManifest(manifest, manifestPath, nodeDirectory, discoveredAt, lastModified, problems);
	}

}
