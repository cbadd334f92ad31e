/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.yamlrpc.transport;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import io.akao.yamlrpc.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Listening side of the Unix domain socket transport.
 *
 * <p>
 * {@link #bind(String)} removes any stale socket file first, so the most recent server
 * bound to a path wins; there is no handoff with a server that may still be running on
 * the same path.
 * </p>
 */
public class UnixSocketServerTransport implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(UnixSocketServerTransport.class);

	private static final int BACKLOG = 5;

	private final int maxFrameSize;

	private final Object stateLock = new Object();

	private volatile ServerSocketChannel serverChannel;

	private volatile Path socketPath;

	public UnixSocketServerTransport() {
		this(FrameCodec.DEFAULT_MAX_FRAME_SIZE);
	}

	public UnixSocketServerTransport(int maxFrameSize) {
		Assert.isTrue(maxFrameSize > 0, "maxFrameSize must be positive");
		this.maxFrameSize = maxFrameSize;
	}

	/**
	 * Creates the listening socket at the given path.
	 * @param endpoint the socket file path
	 * @return whether the endpoint is bound and listening
	 */
	public boolean bind(String endpoint) {
		Assert.hasText(endpoint, "endpoint must not be empty");
		synchronized (stateLock) {
			if (serverChannel != null && serverChannel.isOpen()) {
				return false;
			}
			Path path = Path.of(endpoint);
			ServerSocketChannel channel = null;
			try {
				Files.deleteIfExists(path);
				channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
				channel.bind(UnixDomainSocketAddress.of(path), BACKLOG);
				this.serverChannel = channel;
				this.socketPath = path;
				logger.info("Listening on {}", endpoint);
				return true;
			}
			catch (IOException | RuntimeException e) {
				logger.warn("Failed to bind {}: {}", endpoint, e.getMessage());
				if (channel != null) {
					try {
						channel.close();
					}
					catch (IOException closeFailure) {
						e.addSuppressed(closeFailure);
					}
				}
				return false;
			}
		}
	}

	/**
	 * Blocks until a client connects.
	 * @return the accepted connection, or empty when the transport is closed or accepting
	 * failed
	 */
	public Optional<UnixSocketConnection> accept() {
		ServerSocketChannel channel = this.serverChannel;
		if (channel == null || !channel.isOpen()) {
			return Optional.empty();
		}
		try {
			SocketChannel client = channel.accept();
			return Optional.of(new UnixSocketConnection(client, maxFrameSize));
		}
		catch (IOException e) {
			logger.debug("Accept failed: {}", e.getMessage());
			return Optional.empty();
		}
	}

	public boolean isBound() {
		ServerSocketChannel channel = this.serverChannel;
		return channel != null && channel.isOpen();
	}

	public String getEndpoint() {
		Path path = this.socketPath;
		return (path != null) ? path.toString() : null;
	}

	/**
	 * Stops listening and removes the socket file.
	 */
	@Override
	public void close() {
		synchronized (stateLock) {
			if (serverChannel == null) {
				return;
			}
			try {
				serverChannel.close();
			}
			catch (IOException e) {
				logger.debug("Error closing server channel", e);
			}
			try {
				Files.deleteIfExists(socketPath);
			}
			catch (IOException e) {
				logger.debug("Could not remove socket file {}", socketPath, e);
			}
			serverChannel = null;
		}
	}

}
