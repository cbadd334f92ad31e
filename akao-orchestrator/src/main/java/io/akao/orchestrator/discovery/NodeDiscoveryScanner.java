/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.orchestrator.discovery;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import io.akao.orchestrator.manifest.NodeManifest;
import io.akao.yamlrpc.util.Assert;
import io.akao.yamlrpc.yaml.YamlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds node manifests below a base directory and tracks them across scans.
 *
 * <p>
 * Every scan walks the base directory recursively, parses each file whose name matches
 * one of the search patterns and compares the result with the previous scan: a new id
 * is <em>discovered</em>, a manifest whose file was modified later than before, or that
 * moved, is <em>changed</em>, and an id whose manifest is gone is <em>lost</em>. Events
 * are delivered to the registered {@link NodeDiscoveryListener}s once the comparison is
 * complete. Scanning an unchanged tree again produces no events.
 * </p>
 *
 * <p>
 * Scans run either on demand through {@link #scanOnce()} or periodically after
 * {@link #startScanning()}; two scans never overlap.
 * </p>
 */
public class NodeDiscoveryScanner implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(NodeDiscoveryScanner.class);

	public static final Path DEFAULT_BASE_PATH = Path.of(".akao", "nodes");

	public static final List<String> DEFAULT_SEARCH_PATTERNS = List.of("_.yaml", "manifest.yaml", "node.yaml");

	public static final Duration DEFAULT_SCAN_INTERVAL = Duration.ofSeconds(10);

	private final Path basePath;

	private final Duration scanInterval;

	private final YamlMapper yamlMapper;

	private final List<String> searchPatterns = new CopyOnWriteArrayList<>();

	private final List<PathMatcher> matchers = new CopyOnWriteArrayList<>();

	private final List<NodeDiscoveryListener> listeners = new CopyOnWriteArrayList<>();

	private final Map<String, DiscoveredManifest> nodes = new LinkedHashMap<>();

	private final Object nodesLock = new Object();

	private final ReentrantLock scanLock = new ReentrantLock();

	private final Object schedulerLock = new Object();

	private ScheduledExecutorService scheduler;

	private NodeDiscoveryScanner(Builder builder) {
		this.basePath = builder.basePath;
		this.scanInterval = builder.scanInterval;
		this.yamlMapper = builder.yamlMapper;
		builder.searchPatterns.forEach(this::addSearchPattern);
	}

	public static Builder builder() {
		return new Builder();
	}

	public Path getBasePath() {
		return basePath;
	}

	public Duration getScanInterval() {
		return scanInterval;
	}

	public List<String> getSearchPatterns() {
		return List.copyOf(searchPatterns);
	}

	/**
	 * Adds a file name pattern. Plain names match exactly; glob syntax such as
	 * {@code *.node.yaml} is accepted.
	 * @param pattern the file name pattern
	 */
	public void addSearchPattern(String pattern) {
		Assert.hasText(pattern, "pattern must not be empty");
		if (searchPatterns.contains(pattern)) {
			return;
		}
		matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
		searchPatterns.add(pattern);
	}

	public void addListener(NodeDiscoveryListener listener) {
		Assert.notNull(listener, "listener must not be null");
		listeners.add(listener);
	}

	public void removeListener(NodeDiscoveryListener listener) {
		listeners.remove(listener);
	}

	// ---------------------------
	// Background Scanning
	// ---------------------------

	/**
	 * Starts scanning at the configured interval, beginning immediately.
	 * @return {@code false} if scanning was already running
	 */
	public boolean startScanning() {
		synchronized (schedulerLock) {
			if (scheduler != null) {
				return false;
			}
			scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
				Thread thread = new Thread(runnable, "akao-node-discovery");
				thread.setDaemon(true);
				return thread;
			});
			scheduler.scheduleWithFixedDelay(this::scanSafely, 0, scanInterval.toMillis(), TimeUnit.MILLISECONDS);
			logger.info("Scanning {} for node manifests every {}", basePath, scanInterval);
			return true;
		}
	}

	/**
	 * Stops background scanning and waits for a running scan to finish.
	 */
	public void stopScanning() {
		ScheduledExecutorService stopped;
		synchronized (schedulerLock) {
			stopped = scheduler;
			scheduler = null;
		}
		if (stopped == null) {
			return;
		}
		stopped.shutdown();
		try {
			if (!stopped.awaitTermination(5, TimeUnit.SECONDS)) {
				stopped.shutdownNow();
			}
		}
		catch (InterruptedException e) {
			stopped.shutdownNow();
			Thread.currentThread().interrupt();
		}
		logger.info("Stopped scanning {}", basePath);
	}

	public boolean isScanning() {
		synchronized (schedulerLock) {
			return scheduler != null;
		}
	}

	@Override
	public void close() {
		stopScanning();
	}

	private void scanSafely() {
		try {
			scanOnce();
		}
		catch (RuntimeException e) {
			logger.error("Node discovery scan failed", e);
		}
	}

	// ---------------------------
	// Scanning
	// ---------------------------

	/**
	 * Runs one scan and notifies listeners of the differences to the previous one.
	 * @return whether the base directory could be scanned; a base directory that does
	 * not exist scans as empty
	 */
	public boolean scanOnce() {
		scanLock.lock();
		try {
			List<Path> candidates;
			try {
				candidates = findManifestFiles(basePath, Integer.MAX_VALUE);
			}
			catch (IOException | UncheckedIOException e) {
				logger.warn("Cannot scan {}: {}", basePath, e.getMessage());
				return false;
			}
			Map<String, DiscoveredManifest> previous = snapshot();
			Map<String, DiscoveredManifest> current = collect(candidates, previous);

			List<Consumer<NodeDiscoveryListener>> events = new ArrayList<>();
			synchronized (nodesLock) {
				for (DiscoveredManifest node : current.values()) {
					DiscoveredManifest known = previous.get(node.id());
					if (known == null) {
						events.add(listener -> listener.onNodeDiscovered(node));
					}
					else if (known != node) {
						events.add(listener -> listener.onNodeChanged(node));
					}
				}
				for (String id : previous.keySet()) {
					if (!current.containsKey(id)) {
						events.add(listener -> listener.onNodeLost(id));
					}
				}
				nodes.clear();
				nodes.putAll(current);
			}
			if (!events.isEmpty()) {
				logger.debug("Scan of {} produced {} events", basePath, events.size());
			}
			events.forEach(this::fire);
			return true;
		}
		finally {
			scanLock.unlock();
		}
	}

	/**
	 * Parses the manifests directly inside a directory, without descending into
	 * subdirectories and without affecting the tracked nodes.
	 * @param directory the directory to look in
	 * @return the manifests found
	 */
	public List<DiscoveredManifest> scanDirectory(Path directory) {
		try {
			return findManifestFiles(directory, 1).stream()
				.map(this::scanManifest)
				.flatMap(Optional::stream)
				.collect(Collectors.toList());
		}
		catch (IOException | UncheckedIOException e) {
			logger.warn("Cannot scan {}: {}", directory, e.getMessage());
			return List.of();
		}
	}

	/**
	 * Parses a single manifest file.
	 * @param manifestPath the manifest file
	 * @return the manifest with its validation problems, or empty if the file is not a
	 * manifest or declares no id
	 */
	public Optional<DiscoveredManifest> scanManifest(Path manifestPath) {
		Instant lastModified;
		try {
			lastModified = Files.getLastModifiedTime(manifestPath).toInstant();
		}
		catch (IOException e) {
			logger.warn("Cannot read manifest {}: {}", manifestPath, e.getMessage());
			return Optional.empty();
		}
		Optional<NodeManifest> parsed = NodeManifest.parse(manifestPath, yamlMapper);
		if (parsed.isEmpty()) {
			logger.warn("Skipping unparseable manifest {}", manifestPath);
			return Optional.empty();
		}
		NodeManifest manifest = parsed.get();
		if (manifest.id().isEmpty()) {
			logger.warn("Skipping manifest without id {}", manifestPath);
			return Optional.empty();
		}
		Path nodeDirectory = manifestPath.toAbsolutePath().getParent();
		List<String> problems = manifest.validate(nodeDirectory);
		if (!problems.isEmpty()) {
			logger.warn("Manifest {} of node {} has problems: {}", manifestPath, manifest.id(), problems);
		}
		return Optional.of(new DiscoveredManifest(manifest, manifestPath, nodeDirectory, Instant.now(), lastModified,
				problems));
	}

	// ---------------------------
	// Tracked Nodes
	// ---------------------------

	public Set<String> getDiscoveredNodeIds() {
		synchronized (nodesLock) {
			return new TreeSet<>(nodes.keySet());
		}
	}

	public Optional<DiscoveredManifest> getNode(String nodeId) {
		synchronized (nodesLock) {
			return Optional.ofNullable(nodes.get(nodeId));
		}
	}

	public List<DiscoveredManifest> getNodes() {
		synchronized (nodesLock) {
			return List.copyOf(nodes.values());
		}
	}

	public int getDiscoveredCount() {
		synchronized (nodesLock) {
			return nodes.size();
		}
	}

	private Map<String, DiscoveredManifest> snapshot() {
		synchronized (nodesLock) {
			return new HashMap<>(nodes);
		}
	}

	/**
	 * Builds the node map of this scan. Unchanged files reuse the previous entry, so
	 * reference equality with the previous map means "not changed".
	 */
	private Map<String, DiscoveredManifest> collect(List<Path> candidates, Map<String, DiscoveredManifest> previous) {
		Map<Path, DiscoveredManifest> previousByPath = new HashMap<>();
		previous.values().forEach(node -> previousByPath.put(node.manifestPath(), node));

		Map<String, DiscoveredManifest> current = new LinkedHashMap<>();
		for (Path candidate : candidates) {
			Optional<DiscoveredManifest> scanned = rescan(candidate, previousByPath.get(candidate));
			if (scanned.isEmpty()) {
				continue;
			}
			DiscoveredManifest node = scanned.get();
			DiscoveredManifest tracked = previous.get(node.id());
			boolean trackedElsewhere = tracked != null && !tracked.manifestPath().equals(candidate)
					&& candidates.contains(tracked.manifestPath());
			if (trackedElsewhere || current.containsKey(node.id())) {
				logger.warn("Ignoring manifest {}: node id {} is already declared by {}", candidate, node.id(),
						trackedElsewhere ? tracked.manifestPath() : current.get(node.id()).manifestPath());
				continue;
			}
			current.put(node.id(), reconcile(node, tracked));
		}
		return current;
	}

	private Optional<DiscoveredManifest> rescan(Path candidate, DiscoveredManifest previousAtPath) {
		if (previousAtPath != null) {
			try {
				Instant lastModified = Files.getLastModifiedTime(candidate).toInstant();
				if (lastModified.equals(previousAtPath.lastModified())) {
					return Optional.of(previousAtPath);
				}
			}
			catch (IOException e) {
				logger.debug("Cannot stat {}: {}", candidate, e.getMessage());
			}
		}
		return scanManifest(candidate);
	}

	private static DiscoveredManifest reconcile(DiscoveredManifest node, DiscoveredManifest tracked) {
		if (tracked == null || tracked == node) {
			return node;
		}
		boolean moved = !tracked.manifestPath().equals(node.manifestPath());
		boolean modified = node.lastModified().isAfter(tracked.lastModified());
		return (moved || modified) ? node.withDiscoveredAt(tracked.discoveredAt()) : tracked;
	}

	private List<Path> findManifestFiles(Path directory, int maxDepth) throws IOException {
		if (!Files.isDirectory(directory)) {
			return List.of();
		}
		try (Stream<Path> files = Files.walk(directory, maxDepth)) {
			return files.filter(Files::isRegularFile).filter(this::matches).sorted().collect(Collectors.toList());
		}
	}

	private boolean matches(Path file) {
		Path fileName = file.getFileName();
		return fileName != null && matchers.stream().anyMatch(matcher -> matcher.matches(fileName));
	}

	private void fire(Consumer<NodeDiscoveryListener> event) {
		for (NodeDiscoveryListener listener : listeners) {
			try {
				event.accept(listener);
			}
			catch (RuntimeException e) {
				logger.warn("Node discovery listener {} failed", listener, e);
			}
		}
	}

	/**
	 * Builder for {@link NodeDiscoveryScanner}.
	 */
	public static class Builder {

		private Path basePath = DEFAULT_BASE_PATH;

		private List<String> searchPatterns = DEFAULT_SEARCH_PATTERNS;

		private Duration scanInterval = DEFAULT_SCAN_INTERVAL;

		private YamlMapper yamlMapper;

		private Builder() {
		}

		/**
		 * Sets the directory scanned for manifests. Defaults to {@code .akao/nodes}.
		 * @param basePath the base directory
		 * @return this builder
		 */
		public Builder basePath(Path basePath) {
			Assert.notNull(basePath, "basePath must not be null");
			this.basePath = basePath;
			return this;
		}

		/**
		 * Replaces the manifest file name patterns. Defaults to {@code _.yaml},
		 * {@code manifest.yaml} and {@code node.yaml}.
		 * @param searchPatterns the file name patterns
		 * @return this builder
		 */
		public Builder searchPatterns(List<String> searchPatterns) {
			Assert.notEmpty(searchPatterns, "searchPatterns must not be empty");
			this.searchPatterns = List.copyOf(searchPatterns);
			return this;
		}

		public Builder scanInterval(Duration scanInterval) {
			Assert.notNull(scanInterval, "scanInterval must not be null");
			Assert.isTrue(!scanInterval.isNegative() && !scanInterval.isZero(), "scanInterval must be positive");
			this.scanInterval = scanInterval;
			return this;
		}

		public Builder yamlMapper(YamlMapper yamlMapper) {
			Assert.notNull(yamlMapper, "yamlMapper must not be null");
			this.yamlMapper = yamlMapper;
			return this;
		}

		public NodeDiscoveryScanner build() {
			if (yamlMapper == null) {
				yamlMapper = YamlMapper.createDefault();
			}
			return new NodeDiscoveryScanner(this);
		}

	}

}
