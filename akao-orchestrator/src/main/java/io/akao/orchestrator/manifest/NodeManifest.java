/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.orchestrator.manifest;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.akao.yamlrpc.util.Utils;
import io.akao.yamlrpc.yaml.YamlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Declarative description of an external node: its identity, how to launch it, where
 * it listens and what it consumes and produces. Manifests are immutable; a changed
 * manifest file yields a new instance.
 *
 * <pre>{@code
 * id: akao:node:validator:v1
 * name: Validator
 * runtime:
 *   type: executable
 *   command: ./bin/validator
 *   args: [--verbose]
 * communication:
 *   protocol: yamlrpc
 *   socket_path: /tmp/akao-node-validator.sock
 * }</pre>
 *
 * @param id unique node id
 * @param name human readable name
 * @param version node version, {@code 1.0.0} when absent
 * @param description free text
 * @param runtime how the node process is launched
 * @param communication how the node is reached
 * @param inputs declared inputs
 * @param outputs declared outputs
 * @param resources resource hints
 * @param dependencies required system tools and other nodes
 * @param metadata free-form metadata
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeManifest( // @formatter:off
	@JsonProperty("id") String id,
	@JsonProperty("name") String name,
	@JsonProperty("version") String version,
	@JsonProperty("description") String description,
	@JsonProperty("runtime") NodeRuntime runtime,
	@JsonProperty("communication") Communication communication,
	@JsonProperty("inputs") List<Input> inputs,
	@JsonProperty("outputs") List<Output> outputs,
	@JsonProperty("resources") Resources resources,
	@JsonProperty("dependencies") Dependencies dependencies,
	@JsonProperty("metadata") Map<String, Object> metadata) { // @formatter:on

	private static final Logger logger = LoggerFactory.getLogger(NodeManifest.class);

	public static final String DEFAULT_VERSION = "1.0.0";

	public static final String RUNTIME_EXECUTABLE = "executable";

	public static final String RUNTIME_SCRIPT = "script";

	public static final String RUNTIME_LIBRARY = "library";

	public static final String PROTOCOL_YAMLRPC = "yamlrpc";

	public NodeManifest {
		id = Utils.nullToEmpty(id).trim();
		name = Utils.nullToEmpty(name);
		version = Utils.hasText(version) ? version : DEFAULT_VERSION;
		description = Utils.nullToEmpty(description);
		runtime = (runtime != null) ? runtime : new NodeRuntime(null, null, null, null, null, null, null);
		communication = (communication != null) ? communication : new Communication(null, null, null, null);
		inputs = withoutNulls(inputs);
		outputs = withoutNulls(outputs);
		resources = (resources != null) ? resources : new Resources(null, null, null, null);
		dependencies = (dependencies != null) ? dependencies : new Dependencies(null, null);
		metadata = (metadata != null) ? metadata : Map.of();
	}

	// YAML allows null entries such as "args: [--x, ~]", which the immutable copies reject
	private static <T> List<T> withoutNulls(@Nullable List<T> values) {
		if (values == null) {
			return List.of();
		}
		return values.stream().filter(Objects::nonNull).toList();
	}

	private static Map<String, String> withoutNulls(@Nullable Map<String, String> values) {
		if (values == null) {
			return Map.of();
		}
		Map<String, String> copy = new LinkedHashMap<>();
		values.forEach((key, value) -> {
			if (key != null && value != null) {
				copy.put(key, value);
			}
		});
		return Collections.unmodifiableMap(copy);
	}

	// ---------------------------
	// Parsing
	// ---------------------------

	public static Optional<NodeManifest> parse(Path path) {
		return parse(path, YamlMapper.createDefault());
	}

	/**
	 * Reads and parses a manifest file.
	 * @param path the manifest file
	 * @param yamlMapper the mapper used to bind the document
	 * @return the manifest, or empty if the file cannot be read or is not a manifest
	 * document
	 */
	public static Optional<NodeManifest> parse(Path path, YamlMapper yamlMapper) {
		String content;
		try {
			content = Files.readString(path);
		}
		catch (IOException e) {
			logger.warn("Cannot read manifest {}: {}", path, e.getMessage());
			return Optional.empty();
		}
		return fromYaml(content, yamlMapper);
	}

	public static Optional<NodeManifest> fromYaml(String content) {
		return fromYaml(content, YamlMapper.createDefault());
	}

	/**
	 * Parses a manifest document. Absent fields take their defaults.
	 * @param content the YAML text
	 * @param yamlMapper the mapper used to bind the document
	 * @return the manifest, or empty if the text is not a YAML mapping
	 */
	public static Optional<NodeManifest> fromYaml(String content, YamlMapper yamlMapper) {
		if (!Utils.hasText(content)) {
			return Optional.empty();
		}
		try {
			return Optional.ofNullable(yamlMapper.readValue(content, NodeManifest.class));
		}
		catch (IOException | RuntimeException e) {
			logger.debug("Not a manifest document: {}", e.getMessage());
			return Optional.empty();
		}
	}

	// ---------------------------
	// Validation
	// ---------------------------

	/**
	 * Checks the fields every launchable node needs, without touching the file system.
	 * @return the problems found, empty for a valid manifest
	 */
	public List<String> validate() {
		List<String> problems = new ArrayList<>();
		if (id.isEmpty()) {
			problems.add("Missing required field: id");
		}
		if (name.isEmpty()) {
			problems.add("Missing required field: name");
		}
		if (runtime.command().isEmpty()) {
			problems.add("Missing required field: runtime.command");
		}
		switch (runtime.type()) {
			case RUNTIME_EXECUTABLE, RUNTIME_SCRIPT -> {
			}
			case RUNTIME_LIBRARY -> problems.add("Runtime type library is not launchable as a process");
			default -> problems.add("Unsupported runtime type: " + runtime.type());
		}
		if (!PROTOCOL_YAMLRPC.equals(communication.protocol())) {
			problems.add("Unsupported communication protocol: " + communication.protocol());
		}
		if (communication.socketPath().isEmpty()) {
			problems.add("Missing required field: communication.socket_path");
		}
		return problems;
	}

	/**
	 * Checks the manifest like {@link #validate()} and additionally that the command can
	 * be found: paths are resolved against the node directory, bare names are searched
	 * on {@code PATH}.
	 * @param nodeDirectory the directory holding the manifest file
	 * @return the problems found, empty for a valid manifest
	 */
	public List<String> validate(Path nodeDirectory) {
		List<String> problems = validate();
		if (!runtime.command().isEmpty() && resolveCommand(nodeDirectory).isEmpty()) {
			problems.add("Command not found: " + runtime.command());
		}
		return problems;
	}

	@JsonIgnore
	public boolean isValid() {
		return validate().isEmpty();
	}

	/**
	 * @return whether the command is launched directly rather than through an
	 * interpreter
	 */
	@JsonIgnore
	public boolean isExecutable() {
		return RUNTIME_EXECUTABLE.equals(runtime.type());
	}

	@JsonIgnore
	public boolean isLaunchable() {
		return RUNTIME_EXECUTABLE.equals(runtime.type()) || RUNTIME_SCRIPT.equals(runtime.type());
	}

	@JsonIgnore
	public String getSocketPath() {
		return communication.socketPath();
	}

	@JsonIgnore
	public String getExecutablePath() {
		return runtime.command();
	}

	// ---------------------------
	// Launching
	// ---------------------------

	/**
	 * Locates the command on disk.
	 * @param nodeDirectory the directory holding the manifest file
	 * @return the resolved command, or empty when it does not exist
	 */
	public Optional<Path> resolveCommand(Path nodeDirectory) {
		String command = runtime.command();
		if (command.isEmpty()) {
			return Optional.empty();
		}
		if (command.contains(File.separator)) {
			Path path = nodeDirectory.resolve(command).normalize();
			return Files.exists(path) ? Optional.of(path) : Optional.empty();
		}
		Path local = nodeDirectory.resolve(command);
		if (RUNTIME_SCRIPT.equals(runtime.type()) && Files.isRegularFile(local)) {
			return Optional.of(local);
		}
		return searchPath(command);
	}

	/**
	 * Builds the process command line: the command followed by its arguments, prefixed
	 * by the interpreter for script runtimes.
	 * @param nodeDirectory the directory holding the manifest file
	 * @return the command line
	 * @throws IllegalStateException if the runtime is not launchable
	 */
	public List<String> launchCommand(Path nodeDirectory) {
		if (!isLaunchable()) {
			throw new IllegalStateException("Node " + id + " with runtime type " + runtime.type()
					+ " cannot be launched as a process");
		}
		List<String> commandLine = new ArrayList<>();
		if (RUNTIME_SCRIPT.equals(runtime.type())) {
			commandLine.add(runtime.interpreter());
		}
		commandLine.add(resolveCommand(nodeDirectory).map(Path::toString).orElse(runtime.command()));
		commandLine.addAll(runtime.args());
		return commandLine;
	}

	/**
	 * @param nodeDirectory the directory holding the manifest file
	 * @return the working directory of the node process, the node directory by default
	 */
	public Path workingDirectory(Path nodeDirectory) {
		return runtime.workingDir().isEmpty() ? nodeDirectory : nodeDirectory.resolve(runtime.workingDir());
	}

	private static Optional<Path> searchPath(String command) {
		String searchPath = System.getenv("PATH");
		if (!Utils.hasText(searchPath)) {
			return Optional.empty();
		}
		for (String entry : searchPath.split(File.pathSeparator)) {
			if (entry.isEmpty()) {
				continue;
			}
			Path candidate = Path.of(entry, command);
			if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
				return Optional.of(candidate);
			}
		}
		return Optional.empty();
	}

	// ---------------------------
	// Sections
	// ---------------------------

	/**
	 * @param type {@code executable}, {@code script} or {@code library}
	 * @param command the executable, or the script for script runtimes
	 * @param args command arguments
	 * @param workingDir working directory, relative to the node directory
	 * @param env environment overrides
	 * @param interpreter interpreter of script runtimes, {@code sh} when absent
	 * @param shutdownTimeoutSeconds grace period between the shutdown request and
	 * termination of the process
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record NodeRuntime( // @formatter:off
		@JsonProperty("type") String type,
		@JsonProperty("command") String command,
		@JsonProperty("args") List<String> args,
		@JsonProperty("working_dir") String workingDir,
		@JsonProperty("env") Map<String, String> env,
		@JsonProperty("interpreter") String interpreter,
		@JsonProperty("shutdown_timeout_seconds") Integer shutdownTimeoutSeconds) { // @formatter:on

		public static final String DEFAULT_INTERPRETER = "sh";

		public static final int DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 10;

		public NodeRuntime {
			type = Utils.hasText(type) ? type : RUNTIME_EXECUTABLE;
			command = Utils.nullToEmpty(command);
			args = withoutNulls(args);
			workingDir = Utils.nullToEmpty(workingDir);
			env = withoutNulls(env);
			interpreter = Utils.hasText(interpreter) ? interpreter : DEFAULT_INTERPRETER;
			shutdownTimeoutSeconds = (shutdownTimeoutSeconds != null && shutdownTimeoutSeconds >= 0)
					? shutdownTimeoutSeconds : DEFAULT_SHUTDOWN_TIMEOUT_SECONDS;
		}

		@JsonIgnore
		public Duration shutdownTimeout() {
			return Duration.ofSeconds(shutdownTimeoutSeconds);
		}

	}

	/**
	 * @param protocol wire protocol, only {@code yamlrpc} is supported
	 * @param version protocol version
	 * @param socketPath Unix domain socket path the node listens on
	 * @param methods methods the node declares beyond the standard ones
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Communication( // @formatter:off
		@JsonProperty("protocol") String protocol,
		@JsonProperty("version") String version,
		@JsonProperty("socket_path") String socketPath,
		@JsonProperty("methods") List<String> methods) { // @formatter:on

		public Communication {
			protocol = Utils.hasText(protocol) ? protocol : PROTOCOL_YAMLRPC;
			version = Utils.hasText(version) ? version : "1.0";
			socketPath = Utils.nullToEmpty(socketPath);
			methods = withoutNulls(methods);
		}

	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Input( // @formatter:off
		@JsonProperty("name") String name,
		@JsonProperty("type") String type,
		@JsonProperty("required") Boolean required,
		@JsonProperty("default") Object defaultValue,
		@JsonProperty("description") String description) { // @formatter:on

		public Input {
			name = Utils.nullToEmpty(name);
			type = Utils.hasText(type) ? type : "string";
			required = Boolean.TRUE.equals(required);
			description = Utils.nullToEmpty(description);
		}

	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Output( // @formatter:off
		@JsonProperty("name") String name,
		@JsonProperty("type") String type,
		@JsonProperty("description") String description) { // @formatter:on

		public Output {
			name = Utils.nullToEmpty(name);
			type = Utils.hasText(type) ? type : "string";
			description = Utils.nullToEmpty(description);
		}

	}

	/**
	 * Resource hints. They are recorded but not enforced, except {@code timeout_seconds}
	 * which bounds each call to the node.
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Resources( // @formatter:off
		@JsonProperty("memory") String memory,
		@JsonProperty("cpu") String cpu,
		@JsonProperty("timeout_seconds") Integer timeoutSeconds,
		@JsonProperty("max_instances") Integer maxInstances) { // @formatter:on

		public Resources {
			memory = Utils.hasText(memory) ? memory : "128MB";
			cpu = Utils.hasText(cpu) ? cpu : "100m";
			timeoutSeconds = (timeoutSeconds != null && timeoutSeconds > 0) ? timeoutSeconds : 30;
			maxInstances = (maxInstances != null && maxInstances > 0) ? maxInstances : 1;
		}

		@JsonIgnore
		public Duration timeout() {
			return Duration.ofSeconds(timeoutSeconds);
		}

	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Dependencies( // @formatter:off
		@JsonProperty("system") List<String> system,
		@JsonProperty("nodes") List<String> nodes) { // @formatter:on

		public Dependencies {
			system = withoutNulls(system);
			nodes = withoutNulls(nodes);
		}

	}

}
