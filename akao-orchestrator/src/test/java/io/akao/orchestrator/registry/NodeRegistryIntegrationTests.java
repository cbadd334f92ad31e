/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.orchestrator.registry;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.akao.orchestrator.discovery.DiscoveredManifest;
import io.akao.orchestrator.manifest.NodeManifest;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcMessage;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcResponse;
import io.akao.yamlrpc.yaml.YamlMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Runs {@link TestNodeMain} as a real child JVM and drives it through the registry.
 */
@Timeout(60)
class NodeRegistryIntegrationTests {

	@TempDir
	Path tempDir;

	private NodeRegistry registry;

	@BeforeEach
	void setUp() throws Exception {
		registry = NodeRegistry.builder().connectRetry(40, Duration.ofMillis(100), Duration.ofMillis(500)).build();
		registry.registerNode(echoNode());
	}

	@AfterEach
	void tearDown() {
		registry.close();
	}

	private DiscoveredManifest echoNode() throws Exception {
		Path nodeDirectory = Files.createDirectories(tempDir.resolve("echo"));
		String socket = tempDir.resolve("echo.sock").toString();
		String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();

		Map<String, Object> runtime = new LinkedHashMap<>();
		runtime.put("type", NodeManifest.RUNTIME_EXECUTABLE);
		runtime.put("command", java);
		runtime.put("args", List.of("-cp", System.getProperty("java.class.path"), TestNodeMain.class.getName(), socket));
		runtime.put("shutdown_timeout_seconds", 5);
		Map<String, Object> manifest = new LinkedHashMap<>();
		manifest.put("id", "echo");
		manifest.put("name", "Echo Node");
		manifest.put("runtime", runtime);
		manifest.put("communication", Map.of("socket_path", socket));

		Path manifestPath = nodeDirectory.resolve("_.yaml");
		Files.writeString(manifestPath, YamlMapper.createDefault().writeValueAsString(manifest));
		NodeManifest parsed = NodeManifest.parse(manifestPath).orElseThrow();
		assertThat(parsed.validate(nodeDirectory)).isEmpty();
		return new DiscoveredManifest(parsed, manifestPath, nodeDirectory, Instant.now(), Instant.now(), List.of());
	}

	@Test
	void startsCallsAndStopsARealNode() {
		assertThat(registry.startAndConnectNode("echo")).isTrue();
		NodeStatus started = registry.getNode("echo").orElseThrow();
		assertThat(started.pid()).isPositive();
		assertThat(registry.performHealthCheck("echo")).isTrue();

		YamlRpcMessage executed = registry.executeNode("echo", Map.of("text", "hello"), null);
		assertThat(executed).isInstanceOf(YamlRpcResponse.class);
		assertThat(((Map<?, ?>) ((YamlRpcResponse) executed).result()).get("input")).isEqualTo(Map.of("text", "hello"));

		YamlRpcMessage info = registry.getNodeInfo("echo");
		assertThat(((Map<?, ?>) ((YamlRpcResponse) info).result()).get("name")).isEqualTo("Echo Node");

		ProcessHandle handle = ProcessHandle.of(started.pid()).orElseThrow();
		assertThat(registry.stopNode("echo")).isTrue();

		assertThat(handle.isAlive()).isFalse();
		assertThat(registry.getNode("echo").orElseThrow().state()).isEqualTo(NodeState.STOPPED);
	}

	@Test
	void detectsAKilledNode() {
		assertThat(registry.startAndConnectNode("echo")).isTrue();
		long pid = registry.getNode("echo").orElseThrow().pid();

		ProcessHandle.of(pid).orElseThrow().destroyForcibly();

		await().atMost(Duration.ofSeconds(10))
			.until(() -> registry.getNode("echo").orElseThrow().state() == NodeState.CRASHED);
		assertThat(registry.getNode("echo").orElseThrow().connected()).isFalse();
		assertThat(registry.performHealthCheck("echo")).isFalse();
	}

}
