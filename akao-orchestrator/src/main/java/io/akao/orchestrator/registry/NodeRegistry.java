/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.orchestrator.registry;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Predicate;

import io.akao.orchestrator.discovery.DiscoveredManifest;
import io.akao.orchestrator.discovery.NodeDiscoveryListener;
import io.akao.orchestrator.discovery.NodeDiscoveryScanner;
import io.akao.orchestrator.manifest.NodeManifest;
import io.akao.yamlrpc.client.YamlRpcClient;
import io.akao.yamlrpc.spec.YamlRpcSchema;
import io.akao.yamlrpc.spec.YamlRpcSchema.ErrorCodes;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcMessage;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcResponse;
import io.akao.yamlrpc.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;
import reactor.util.retry.Retry;

/**
 * Registry of external node processes: spawns them from their manifests, connects a
 * YAML-RPC client to each, routes calls, checks their health and stops them again.
 *
 * <p>
 * One lock guards the node map and the per-node bookkeeping. It is never held while a
 * process is spawned or awaited, while a client connects or calls, or while listeners
 * run, so a slow node cannot block operations on other nodes. Lifecycle failures are
 * reported as {@code false} results, never as exceptions.
 * </p>
 *
 * <p>
 * Attached to a {@link NodeDiscoveryScanner} through {@link #enableDiscovery()}, the
 * registry registers discovered nodes, updates the manifest of changed ones and
 * unregisters (and stops) lost ones.
 * </p>
 */
public class NodeRegistry implements NodeDiscoveryListener, AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(NodeRegistry.class);

	public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(30);

	public static final int DEFAULT_CONNECT_MAX_ATTEMPTS = 10;

	public static final Duration DEFAULT_CONNECT_INITIAL_BACKOFF = Duration.ofMillis(100);

	public static final Duration DEFAULT_CONNECT_MAX_BACKOFF = Duration.ofSeconds(2);

	public static final Duration DEFAULT_STOP_FORCE_KILL_TIMEOUT = Duration.ofSeconds(2);

	public static final Duration DEFAULT_CRASH_RESTART_DELAY = Duration.ofSeconds(5);

	static final String NODE_NOT_CONNECTED = "Node not connected";

	@Nullable
	private final NodeDiscoveryScanner scanner;

	private final ProcessLauncher processLauncher;

	private final NodeClientFactory clientFactory;

	private final Duration healthCheckInterval;

	private final int connectMaxAttempts;

	private final Duration connectInitialBackoff;

	private final Duration connectMaxBackoff;

	private final Duration stopForceKillTimeout;

	private final int crashRestartMax;

	private final Duration crashRestartDelay;

	private final Map<String, DiscoveredNode> nodes = new LinkedHashMap<>();

	private final Object lock = new Object();

	private final Object monitorLock = new Object();

	private ScheduledExecutorService healthMonitor;

	private volatile boolean discoveryEnabled;

	private NodeRegistry(Builder builder) {
		this.scanner = builder.scanner;
		this.processLauncher = builder.processLauncher;
		this.clientFactory = builder.clientFactory;
		this.healthCheckInterval = builder.healthCheckInterval;
		this.connectMaxAttempts = builder.connectMaxAttempts;
		this.connectInitialBackoff = builder.connectInitialBackoff;
		this.connectMaxBackoff = builder.connectMaxBackoff;
		this.stopForceKillTimeout = builder.stopForceKillTimeout;
		this.crashRestartMax = builder.crashRestartMax;
		this.crashRestartDelay = builder.crashRestartDelay;
	}

	public static Builder builder() {
		return new Builder();
	}

	// ---------------------------
	// Registration
	// ---------------------------

	/**
	 * @param discovered the node to register
	 * @return {@code false} if a node with the same id is already registered
	 */
	public boolean registerNode(DiscoveredManifest discovered) {
		Assert.notNull(discovered, "discovered must not be null");
		synchronized (lock) {
			if (nodes.containsKey(discovered.id())) {
				return false;
			}
			nodes.put(discovered.id(), new DiscoveredNode(discovered));
		}
		logger.info("Registered node {} from {}", discovered.id(), discovered.manifestPath());
		return true;
	}

	/**
	 * Stops the node if it is running and removes it.
	 * @param nodeId the node id
	 * @return {@code false} if the node is unknown
	 */
	public boolean unregisterNode(String nodeId) {
		if (!stopNode(nodeId)) {
			return false;
		}
		synchronized (lock) {
			if (nodes.remove(nodeId) == null) {
				return false;
			}
		}
		logger.info("Unregistered node {}", nodeId);
		return true;
	}

	public void unregisterAll() {
		getRegisteredNodeIds().forEach(this::unregisterNode);
	}

	/**
	 * Replaces the manifest of a registered node, registering it if unknown. A running
	 * process keeps running; the new manifest applies from the next start.
	 * @param discovered the updated node
	 */
	public void updateNode(DiscoveredManifest discovered) {
		Assert.notNull(discovered, "discovered must not be null");
		synchronized (lock) {
			DiscoveredNode node = nodes.get(discovered.id());
			if (node == null) {
				nodes.put(discovered.id(), new DiscoveredNode(discovered));
			}
			else {
				node.source = discovered;
			}
		}
		logger.info("Updated manifest of node {} from {}", discovered.id(), discovered.manifestPath());
	}

	// ---------------------------
	// Discovery
	// ---------------------------

	/**
	 * Registers the nodes the scanner already knows, subscribes to its events and starts
	 * its background scanning.
	 * @return {@code false} if the registry has no scanner or discovery is already
	 * enabled
	 */
	public boolean enableDiscovery() {
		if (scanner == null || discoveryEnabled) {
			return false;
		}
		discoveryEnabled = true;
		scanner.addListener(this);
		scanner.getNodes().forEach(this::registerNode);
		scanner.startScanning();
		logger.info("Node discovery enabled on {}", scanner.getBasePath());
		return true;
	}

	public void disableDiscovery() {
		if (scanner == null || !discoveryEnabled) {
			return;
		}
		discoveryEnabled = false;
		scanner.removeListener(this);
		scanner.stopScanning();
		logger.info("Node discovery disabled");
	}

	public boolean isDiscoveryEnabled() {
		return discoveryEnabled;
	}

	@Override
	public void onNodeDiscovered(DiscoveredManifest node) {
		registerNode(node);
	}

	@Override
	public void onNodeChanged(DiscoveredManifest node) {
		updateNode(node);
	}

	@Override
	public void onNodeLost(String nodeId) {
		unregisterNode(nodeId);
	}

	// ---------------------------
	// Process Lifecycle
	// ---------------------------

	/**
	 * Spawns the node process described by the manifest. A successful start resets the
	 * count of automatic crash restarts.
	 * @param nodeId the node id
	 * @return {@code false} if the node is unknown, already running, not launchable, or
	 * the process could not be spawned
	 */
	public boolean startNode(String nodeId) {
		if (!spawn(nodeId)) {
			return false;
		}
		synchronized (lock) {
			DiscoveredNode node = nodes.get(nodeId);
			if (node != null) {
				node.crashRestarts = 0;
			}
		}
		return true;
	}

	private boolean spawn(String nodeId) {
		DiscoveredNode node;
		List<String> command;
		Path workingDirectory;
		Map<String, String> environment;
		synchronized (lock) {
			node = nodes.get(nodeId);
			if (node == null) {
				logger.warn("Cannot start unknown node {}", nodeId);
				return false;
			}
			if (node.running || node.state == NodeState.STARTING || node.state == NodeState.STOPPING) {
				logger.debug("Node {} is already {}", nodeId, node.state);
				return false;
			}
			NodeManifest manifest = node.manifest();
			if (!manifest.isLaunchable()) {
				logger.warn("Node {} with runtime type {} cannot be launched", nodeId, manifest.runtime().type());
				return false;
			}
			Path nodeDirectory = node.source.nodeDirectory();
			command = manifest.launchCommand(nodeDirectory);
			workingDirectory = manifest.workingDirectory(nodeDirectory);
			environment = manifest.runtime().env();
			node.state = NodeState.STARTING;
		}

		Process process;
		try {
			process = processLauncher.launch(command, workingDirectory, environment);
		}
		catch (IOException | RuntimeException e) {
			logger.warn("Failed to start node {} with {}: {}", nodeId, command, e.getMessage());
			synchronized (lock) {
				node.state = NodeState.DISCOVERED;
			}
			return false;
		}

		synchronized (lock) {
			if (nodes.get(nodeId) != node) {
				process.destroyForcibly();
				return false;
			}
			node.process = process;
			node.pid = process.pid();
			node.running = true;
			node.exitCode = null;
			node.startedAt = Instant.now();
			node.healthy = false;
			node.state = NodeState.RUNNING;
		}
		process.onExit().thenAccept(exited -> onProcessExit(nodeId, exited));
		logger.info("Started node {} (pid {})", nodeId, process.pid());
		return true;
	}

	/**
	 * Asks the node to shut down and gives it the manifest's grace period, counted from
	 * the shutdown request, to exit. Then terminates and finally kills the process. A
	 * pending automatic restart of a crashed node is cancelled.
	 * @param nodeId the node id
	 * @return {@code false} only if the node is unknown
	 */
	public boolean stopNode(String nodeId) {
		DiscoveredNode node;
		Process process;
		YamlRpcClient client;
		int graceSeconds;
		synchronized (lock) {
			node = nodes.get(nodeId);
			if (node == null) {
				return false;
			}
			node.cancelPendingRestart();
			node.crashRestarts = 0;
			if (!node.running && node.client == null) {
				if (node.state == NodeState.CRASHED) {
					node.state = NodeState.STOPPED;
				}
				return true;
			}
			node.state = NodeState.STOPPING;
			process = node.process;
			client = node.client;
			graceSeconds = node.manifest().runtime().shutdownTimeoutSeconds();
		}

		Duration grace = Duration.ofSeconds(graceSeconds);
		long deadline = System.nanoTime() + grace.toNanos();
		if (client != null && client.isConnected()) {
			YamlRpcMessage reply = client.call(YamlRpcSchema.METHOD_NODE_SHUTDOWN,
					Map.of(YamlRpcSchema.PARAM_TIMEOUT_SECONDS, graceSeconds),
					grace.isZero() ? stopForceKillTimeout : grace);
			logger.debug("Node {} answered shutdown with {}", nodeId, reply);
		}
		if (process != null) {
			terminate(nodeId, process, Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
		}
		if (client != null) {
			client.close();
		}

		synchronized (lock) {
			if (node.client == client) {
				node.client = null;
			}
			if (node.process == process) {
				node.process = null;
				node.pid = -1;
				node.running = false;
				if (process != null && !process.isAlive()) {
					node.exitCode = process.exitValue();
				}
			}
			node.healthy = false;
			node.state = NodeState.STOPPED;
		}
		logger.info("Stopped node {}", nodeId);
		return true;
	}

	/**
	 * Stops and starts the node again, counting the restart.
	 * @param nodeId the node id
	 * @return whether the node was started again
	 */
	public boolean restartNode(String nodeId) {
		if (!stopNode(nodeId)) {
			return false;
		}
		synchronized (lock) {
			DiscoveredNode node = nodes.get(nodeId);
			if (node == null) {
				return false;
			}
			node.restartCount++;
		}
		logger.info("Restarting node {}", nodeId);
		return startNode(nodeId);
	}

	private void terminate(String nodeId, Process process, Duration remainingGrace) {
		if (waitFor(process, remainingGrace)) {
			return;
		}
		logger.debug("Node {} did not exit within its grace period, terminating", nodeId);
		process.destroy();
		if (waitFor(process, stopForceKillTimeout)) {
			return;
		}
		logger.warn("Node {} ignored termination, killing pid {}", nodeId, process.pid());
		process.destroyForcibly();
		waitFor(process, stopForceKillTimeout);
	}

	private static boolean waitFor(Process process, Duration timeout) {
		try {
			return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return !process.isAlive();
		}
	}

	private void onProcessExit(String nodeId, Process process) {
		YamlRpcClient client;
		int exitCode = process.exitValue();
		int attempt = 0;
		synchronized (lock) {
			DiscoveredNode node = nodes.get(nodeId);
			if (node == null || node.process != process || node.state == NodeState.STOPPING) {
				return;
			}
			node.process = null;
			node.pid = -1;
			node.running = false;
			node.healthy = false;
			node.exitCode = exitCode;
			node.state = NodeState.CRASHED;
			client = node.client;
			node.client = null;
			if (node.crashRestarts < crashRestartMax) {
				attempt = ++node.crashRestarts;
				boolean reconnect = client != null;
				node.pendingRestart = Mono.delay(crashRestartDelay, Schedulers.boundedElastic())
					.subscribe(tick -> restartCrashed(nodeId, node, reconnect));
			}
		}
		logger.warn("Node {} exited unexpectedly with code {}", nodeId, exitCode);
		if (attempt > 0) {
			logger.info("Restarting node {} in {} (automatic restart {} of {})", nodeId, crashRestartDelay, attempt,
					crashRestartMax);
		}
		if (client != null) {
			client.close();
		}
	}

	private void restartCrashed(String nodeId, DiscoveredNode node, boolean reconnect) {
		synchronized (lock) {
			if (nodes.get(nodeId) != node || node.state != NodeState.CRASHED) {
				return;
			}
			node.pendingRestart = null;
			node.restartCount++;
		}
		if (!spawn(nodeId)) {
			logger.warn("Automatic restart of node {} failed", nodeId);
			return;
		}
		if (reconnect) {
			connectToNode(nodeId, connectMaxAttempts);
		}
	}

	// ---------------------------
	// Connections
	// ---------------------------

	/**
	 * Makes one attempt to connect a client to the node's endpoint.
	 * @param nodeId the node id
	 * @return whether the node is connected
	 */
	public boolean connectToNode(String nodeId) {
		DiscoveredNode node;
		NodeManifest manifest;
		synchronized (lock) {
			node = nodes.get(nodeId);
			if (node == null) {
				return false;
			}
			if (node.isConnected()) {
				return true;
			}
			manifest = node.manifest();
		}

		YamlRpcClient client = clientFactory.create(manifest);
		if (!client.connect(manifest.getSocketPath())) {
			client.close();
			return false;
		}

		boolean attached = false;
		YamlRpcClient stale = null;
		synchronized (lock) {
			if (nodes.get(nodeId) == node && !node.isConnected() && node.state != NodeState.STOPPING) {
				stale = node.client;
				node.client = client;
				node.state = NodeState.CONNECTED;
				attached = true;
			}
		}
		if (stale != null) {
			stale.close();
		}
		if (!attached) {
			client.close();
			return false;
		}
		logger.info("Connected to node {} at {}", nodeId, manifest.getSocketPath());
		return true;
	}

	/**
	 * Connects to the node, retrying with exponential backoff while the node's process
	 * is alive.
	 * @param nodeId the node id
	 * @param maxAttempts the maximum number of attempts, at least 1
	 * @return whether the node is connected
	 */
	public boolean connectToNode(String nodeId, int maxAttempts) {
		Assert.isTrue(maxAttempts > 0, "maxAttempts must be positive");
		Boolean connected = Mono.fromCallable(() -> connectToNode(nodeId))
			.flatMap(success -> success ? Mono.just(true) : Mono.<Boolean>error(new ConnectAttemptFailed(nodeId)))
			.retryWhen(Retry.backoff(maxAttempts - 1, connectInitialBackoff)
				.maxBackoff(connectMaxBackoff)
				.filter(e -> e instanceof ConnectAttemptFailed && isWorthConnecting(nodeId)))
			.onErrorReturn(false)
			.block();
		if (!Boolean.TRUE.equals(connected)) {
			logger.warn("Could not connect to node {} after up to {} attempts", nodeId, maxAttempts);
			return false;
		}
		return true;
	}

	/**
	 * Starts the node, unless it is already running, and connects to it with
	 * exponential backoff while it comes up.
	 * @param nodeId the node id
	 * @return whether the node is running and connected
	 */
	public boolean startAndConnectNode(String nodeId) {
		if (!startNode(nodeId) && !isRunning(nodeId)) {
			return false;
		}
		return connectToNode(nodeId, connectMaxAttempts);
	}

	/**
	 * @param nodeId the node id
	 * @return whether a client was connected
	 */
	public boolean disconnectFromNode(String nodeId) {
		YamlRpcClient client;
		synchronized (lock) {
			DiscoveredNode node = nodes.get(nodeId);
			if (node == null || node.client == null) {
				return false;
			}
			client = node.client;
			node.client = null;
			node.healthy = false;
			if (node.state.isConnectedState()) {
				node.state = node.running ? NodeState.RUNNING : NodeState.STOPPED;
			}
		}
		client.close();
		logger.info("Disconnected from node {}", nodeId);
		return true;
	}

	private boolean isWorthConnecting(String nodeId) {
		synchronized (lock) {
			DiscoveredNode node = nodes.get(nodeId);
			// a node never spawned by the registry may have been started elsewhere
			return node != null && node.state != NodeState.STOPPING && (node.running || node.process == null);
		}
	}

	private boolean isRunning(String nodeId) {
		synchronized (lock) {
			DiscoveredNode node = nodes.get(nodeId);
			return node != null && node.running;
		}
	}

	// ---------------------------
	// Calls
	// ---------------------------

	/**
	 * Calls a method on a connected node.
	 * @param nodeId the node id
	 * @param method the method name
	 * @param params the parameters, may be null
	 * @return the node's reply, or an internal error when the node is not connected
	 */
	public YamlRpcMessage callNode(String nodeId, String method, @Nullable Object params) {
		return withClient(nodeId, client -> client.call(method, params));
	}

	public YamlRpcMessage getNodeInfo(String nodeId) {
		return withClient(nodeId, YamlRpcClient::nodeInfo);
	}

	public YamlRpcMessage validateNodeInput(String nodeId, @Nullable Object input) {
		return withClient(nodeId, client -> client.nodeValidate(input));
	}

	public YamlRpcMessage executeNode(String nodeId, @Nullable Object input, @Nullable Object context) {
		return withClient(nodeId, client -> client.nodeExecute(input, context));
	}

	private YamlRpcMessage withClient(String nodeId, Function<YamlRpcClient, YamlRpcMessage> call) {
		YamlRpcClient client;
		synchronized (lock) {
			DiscoveredNode node = nodes.get(nodeId);
			client = (node != null && node.isConnected()) ? node.client : null;
		}
		if (client == null) {
			return YamlRpcSchema.error(ErrorCodes.INTERNAL_ERROR, NODE_NOT_CONNECTED, "");
		}
		return call.apply(client);
	}

	// ---------------------------
	// Health
	// ---------------------------

	/**
	 * Sends {@code node.health} to the node. The node is healthy when it answers with a
	 * response whose result is not {@code false}. An unhealthy node is only marked, never
	 * restarted.
	 * @param nodeId the node id
	 * @return whether the node is healthy
	 */
	public boolean performHealthCheck(String nodeId) {
		YamlRpcClient client;
		DiscoveredNode node;
		synchronized (lock) {
			node = nodes.get(nodeId);
			if (node == null) {
				return false;
			}
			client = node.isConnected() ? node.client : null;
			if (client == null) {
				node.healthy = false;
				node.lastHealthCheck = Instant.now();
				return false;
			}
		}

		YamlRpcMessage reply = client.nodeHealth();
		boolean healthy = reply instanceof YamlRpcResponse response && !Boolean.FALSE.equals(response.result());

		synchronized (lock) {
			if (nodes.get(nodeId) == node && node.client == client) {
				node.healthy = healthy;
				node.lastHealthCheck = Instant.now();
				if (node.state.isConnectedState()) {
					node.state = healthy ? NodeState.HEALTHY : NodeState.UNHEALTHY;
				}
			}
		}
		if (!healthy) {
			logger.warn("Health check of node {} failed: {}", nodeId, reply);
		}
		return healthy;
	}

	public boolean startHealthMonitoring() {
		return startHealthMonitoring(healthCheckInterval);
	}

	/**
	 * Periodically checks the health of every running or connected node.
	 * @param interval the delay between two rounds of checks
	 * @return {@code false} if monitoring is already enabled
	 */
	public boolean startHealthMonitoring(Duration interval) {
		Assert.notNull(interval, "interval must not be null");
		Assert.isTrue(!interval.isNegative() && !interval.isZero(), "interval must be positive");
		synchronized (monitorLock) {
			if (healthMonitor != null) {
				return false;
			}
			healthMonitor = Executors.newSingleThreadScheduledExecutor(runnable -> {
				Thread thread = new Thread(runnable, "akao-node-health");
				thread.setDaemon(true);
				return thread;
			});
			healthMonitor.scheduleWithFixedDelay(this::monitorHealth, interval.toMillis(), interval.toMillis(),
					TimeUnit.MILLISECONDS);
		}
		logger.info("Health monitoring enabled every {}", interval);
		return true;
	}

	public void stopHealthMonitoring() {
		ScheduledExecutorService monitor;
		synchronized (monitorLock) {
			monitor = healthMonitor;
			healthMonitor = null;
		}
		if (monitor != null) {
			monitor.shutdownNow();
			logger.info("Health monitoring disabled");
		}
	}

	public boolean isHealthMonitoringEnabled() {
		synchronized (monitorLock) {
			return healthMonitor != null;
		}
	}

	private void monitorHealth() {
		try {
			List<String> ids;
			synchronized (lock) {
				ids = nodes.entrySet()
					.stream()
					.filter(entry -> entry.getValue().running || entry.getValue().client != null)
					.map(Map.Entry::getKey)
					.toList();
			}
			forEachNode(ids, this::performHealthCheck);
		}
		catch (RuntimeException e) {
			logger.error("Health monitoring round failed", e);
		}
	}

	// ---------------------------
	// Batch Operations
	// ---------------------------

	/**
	 * Starts and connects every registered node concurrently.
	 * @return node id to success
	 */
	public Map<String, Boolean> startAllNodes() {
		return forEachNode(getRegisteredNodeIds(), this::startAndConnectNode);
	}

	public Map<String, Boolean> stopAllNodes() {
		return forEachNode(getRegisteredNodeIds(), this::stopNode);
	}

	public Map<String, Boolean> healthCheckAll() {
		return forEachNode(getRegisteredNodeIds(), this::performHealthCheck);
	}

	private Map<String, Boolean> forEachNode(Collection<String> nodeIds, Predicate<String> operation) {
		if (nodeIds.isEmpty()) {
			return Map.of();
		}
		Map<String, Boolean> results = Flux.fromIterable(nodeIds)
			.flatMap(nodeId -> Mono.fromCallable(() -> Map.entry(nodeId, test(operation, nodeId)))
				.subscribeOn(Schedulers.boundedElastic()))
			.collectMap(Map.Entry::getKey, Map.Entry::getValue, TreeMap::new)
			.block();
		return (results != null) ? results : Map.of();
	}

	private static boolean test(Predicate<String> operation, String nodeId) {
		try {
			return operation.test(nodeId);
		}
		catch (RuntimeException e) {
			logger.warn("Operation on node {} failed", nodeId, e);
			return false;
		}
	}

	// ---------------------------
	// Introspection
	// ---------------------------

	public List<String> getRegisteredNodeIds() {
		synchronized (lock) {
			return nodes.keySet().stream().sorted().toList();
		}
	}

	public Optional<NodeStatus> getNode(String nodeId) {
		synchronized (lock) {
			return Optional.ofNullable(nodes.get(nodeId)).map(DiscoveredNode::toStatus);
		}
	}

	/**
	 * @param runtimeType a manifest runtime type such as {@code executable}
	 * @return snapshots of the nodes with that runtime type
	 */
	public List<NodeStatus> getNodesByType(String runtimeType) {
		return statuses().stream().filter(status -> status.manifest().runtime().type().equals(runtimeType)).toList();
	}

	public int getRegisteredCount() {
		synchronized (lock) {
			return nodes.size();
		}
	}

	public int getRunningCount() {
		return (int) statuses().stream().filter(NodeStatus::running).count();
	}

	public int getConnectedCount() {
		return (int) statuses().stream().filter(NodeStatus::connected).count();
	}

	public int getHealthyCount() {
		return (int) statuses().stream().filter(NodeStatus::healthy).count();
	}

	/**
	 * @return node id to one of {@code stopped}, {@code running-disconnected},
	 * {@code running-unhealthy} or {@code running-healthy}
	 */
	public Map<String, String> getRegistryStatus() {
		Map<String, String> status = new TreeMap<>();
		statuses().forEach(node -> status.put(node.id(), node.statusString()));
		return status;
	}

	private List<NodeStatus> statuses() {
		synchronized (lock) {
			List<NodeStatus> statuses = new ArrayList<>(nodes.size());
			nodes.values().forEach(node -> statuses.add(node.toStatus()));
			return statuses;
		}
	}

	/**
	 * Stops health monitoring and discovery, then stops every node.
	 */
	@Override
	public void close() {
		stopHealthMonitoring();
		disableDiscovery();
		stopAllNodes();
	}

	private static final class ConnectAttemptFailed extends RuntimeException {

		private static final long serialVersionUID = 1L;

		ConnectAttemptFailed(String nodeId) {
			super("Node " + nodeId + " is not accepting connections", null, false, false);
		}

	}

	/**
	 * Builder for {@link NodeRegistry}.
	 */
	public static class Builder {

		private NodeDiscoveryScanner scanner;

		private ProcessLauncher processLauncher = new DefaultProcessLauncher();

		private NodeClientFactory clientFactory = NodeClientFactory.ofDefault();

		private Duration healthCheckInterval = DEFAULT_HEALTH_CHECK_INTERVAL;

		private int connectMaxAttempts = DEFAULT_CONNECT_MAX_ATTEMPTS;

		private Duration connectInitialBackoff = DEFAULT_CONNECT_INITIAL_BACKOFF;

		private Duration connectMaxBackoff = DEFAULT_CONNECT_MAX_BACKOFF;

		private Duration stopForceKillTimeout = DEFAULT_STOP_FORCE_KILL_TIMEOUT;

		private int crashRestartMax;

		private Duration crashRestartDelay = DEFAULT_CRASH_RESTART_DELAY;

		private Builder() {
		}

		/**
		 * Sets the scanner used by {@link NodeRegistry#enableDiscovery()}. Without one,
		 * nodes are only registered explicitly.
		 * @param scanner the discovery scanner
		 * @return this builder
		 */
		public Builder scanner(NodeDiscoveryScanner scanner) {
			Assert.notNull(scanner, "scanner must not be null");
			this.scanner = scanner;
			return this;
		}

		public Builder processLauncher(ProcessLauncher processLauncher) {
			Assert.notNull(processLauncher, "processLauncher must not be null");
			this.processLauncher = processLauncher;
			return this;
		}

		public Builder clientFactory(NodeClientFactory clientFactory) {
			Assert.notNull(clientFactory, "clientFactory must not be null");
			this.clientFactory = clientFactory;
			return this;
		}

		public Builder healthCheckInterval(Duration healthCheckInterval) {
			Assert.notNull(healthCheckInterval, "healthCheckInterval must not be null");
			Assert.isTrue(!healthCheckInterval.isNegative() && !healthCheckInterval.isZero(),
					"healthCheckInterval must be positive");
			this.healthCheckInterval = healthCheckInterval;
			return this;
		}

		/**
		 * Sets how often {@link NodeRegistry#startAndConnectNode(String)} tries to
		 * connect, backing off exponentially from {@code initialBackoff} up to
		 * {@code maxBackoff} between attempts. Defaults to 10 attempts, 100ms and 2s.
		 * @param maxAttempts the maximum number of attempts
		 * @param initialBackoff the delay after the first failed attempt
		 * @param maxBackoff the upper bound of the delay
		 * @return this builder
		 */
		public Builder connectRetry(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
			Assert.isTrue(maxAttempts > 0, "maxAttempts must be positive");
			Assert.notNull(initialBackoff, "initialBackoff must not be null");
			Assert.notNull(maxBackoff, "maxBackoff must not be null");
			this.connectMaxAttempts = maxAttempts;
			this.connectInitialBackoff = initialBackoff;
			this.connectMaxBackoff = maxBackoff;
			return this;
		}

		/**
		 * Sets how long to wait for a process to exit after asking it to terminate, and
		 * again after killing it. Defaults to 2 seconds.
		 * @param stopForceKillTimeout the timeout
		 * @return this builder
		 */
		public Builder stopForceKillTimeout(Duration stopForceKillTimeout) {
			Assert.notNull(stopForceKillTimeout, "stopForceKillTimeout must not be null");
			this.stopForceKillTimeout = stopForceKillTimeout;
			return this;
		}

		/**
		 * Restarts a node whose process exits without being stopped through the registry,
		 * at most {@code maxRestarts} times in a row, each after {@code delay}. A node
		 * that was connected when it crashed is reconnected. Disabled by default.
		 * @param maxRestarts the number of consecutive automatic restarts, 0 to disable
		 * @param delay the delay between the crash and the restart
		 * @return this builder
		 */
		public Builder crashRestart(int maxRestarts, Duration delay) {
			Assert.isTrue(maxRestarts >= 0, "maxRestarts must not be negative");
			Assert.notNull(delay, "delay must not be null");
			Assert.isTrue(!delay.isNegative(), "delay must not be negative");
			this.crashRestartMax = maxRestarts;
			this.crashRestartDelay = delay;
			return this;
		}

		public NodeRegistry build() {
			return new NodeRegistry(this);
		}

	}

}
