/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.orchestrator.registry;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Spawns node processes for the {@link NodeRegistry}.
 */
@FunctionalInterface
public interface ProcessLauncher {

	/**
	 * @param command the command line
	 * @param workingDirectory the working directory of the process
	 * @param environment variables added to the inherited environment
	 * @return the started process
	 * @throws IOException if the process could not be started
	 */
	Process launch(List<String> command, Path workingDirectory, Map<String, String> environment) throws IOException;

}
