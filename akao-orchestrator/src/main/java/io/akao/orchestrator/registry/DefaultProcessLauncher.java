/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.orchestrator.registry;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launches node processes with {@link ProcessBuilder}. Standard output is discarded and
 * standard error is inherited so node failures stay visible.
 */
public class DefaultProcessLauncher implements ProcessLauncher {

	private static final Logger logger = LoggerFactory.getLogger(DefaultProcessLauncher.class);

	@Override
	public Process launch(List<String> command, Path workingDirectory, Map<String, String> environment)
			throws IOException {
		ProcessBuilder builder = new ProcessBuilder(command).directory(workingDirectory.toFile())
			.redirectInput(ProcessBuilder.Redirect.PIPE)
			.redirectOutput(ProcessBuilder.Redirect.DISCARD)
			.redirectError(ProcessBuilder.Redirect.INHERIT);
		builder.environment().putAll(environment);
		logger.debug("Launching {} in {}", command, workingDirectory);
		return builder.start();
	}

}
