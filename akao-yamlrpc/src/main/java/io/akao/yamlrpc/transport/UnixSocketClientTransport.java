/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.yamlrpc.transport;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SocketChannel;
import java.util.Optional;

import io.akao.yamlrpc.spec.YamlRpcClientTransport;
import io.akao.yamlrpc.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link YamlRpcClientTransport} over a Unix domain socket whose endpoint is the path of
 * the socket file.
 */
public class UnixSocketClientTransport implements YamlRpcClientTransport {

	private static final Logger logger = LoggerFactory.getLogger(UnixSocketClientTransport.class);

	private final int maxFrameSize;

	private final Object stateLock = new Object();

	private volatile UnixSocketConnection connection;

	private volatile String endpoint;

	public UnixSocketClientTransport() {
		this(FrameCodec.DEFAULT_MAX_FRAME_SIZE);
	}

	public UnixSocketClientTransport(int maxFrameSize) {
		Assert.isTrue(maxFrameSize > 0, "maxFrameSize must be positive");
		this.maxFrameSize = maxFrameSize;
	}

	@Override
	public boolean connect(String endpoint) {
		Assert.hasText(endpoint, "endpoint must not be empty");
		synchronized (stateLock) {
			if (isConnected()) {
				return true;
			}
			SocketChannel channel = null;
			try {
				channel = SocketChannel.open(StandardProtocolFamily.UNIX);
				channel.connect(UnixDomainSocketAddress.of(endpoint));
				this.connection = new UnixSocketConnection(channel, maxFrameSize);
				this.endpoint = endpoint;
				logger.debug("Connected to {}", endpoint);
				return true;
			}
			catch (IOException | RuntimeException e) {
				logger.debug("Failed to connect to {}: {}", endpoint, e.getMessage());
				closeQuietly(channel);
				return false;
			}
		}
	}

	@Override
	public boolean send(byte[] payload) {
		UnixSocketConnection current = this.connection;
		return current != null && current.send(payload);
	}

	@Override
	public Optional<byte[]> receive() {
		UnixSocketConnection current = this.connection;
		return (current != null) ? current.receive() : Optional.empty();
	}

	@Override
	public boolean isConnected() {
		UnixSocketConnection current = this.connection;
		return current != null && current.isOpen();
	}

	@Override
	public String getEndpoint() {
		return endpoint;
	}

	@Override
	public void close() {
		synchronized (stateLock) {
			if (connection != null) {
				connection.close();
				logger.debug("Disconnected from {}", endpoint);
			}
		}
	}

	private static void closeQuietly(SocketChannel channel) {
		if (channel == null) {
			return;
		}
		try {
			channel.close();
		}
		catch (IOException e) {
			logger.debug("Error closing socket channel", e);
		}
	}

}
