/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.orchestrator.registry;

import io.akao.orchestrator.manifest.NodeManifest;
import io.akao.yamlrpc.client.YamlRpcClient;

/**
 * Creates the client the {@link NodeRegistry} uses to talk to a node.
 */
@FunctionalInterface
public interface NodeClientFactory {

	YamlRpcClient create(NodeManifest manifest);

	/**
	 * @return a factory for Unix domain socket clients whose request timeout is the
	 * node's {@code resources.timeout_seconds}
	 */
	static NodeClientFactory ofDefault() {
		return manifest -> YamlRpcClient.builder().requestTimeout(manifest.resources().timeout()).build();
	}

}
