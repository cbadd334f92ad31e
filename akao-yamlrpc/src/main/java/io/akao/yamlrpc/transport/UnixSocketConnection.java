/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.yamlrpc.transport;

import java.io.IOException;
import java.nio.channels.SocketChannel;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import io.akao.yamlrpc.spec.YamlRpcTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One established Unix domain socket connection carrying length-prefixed frames.
 *
 * <p>
 * Writes are serialized by one exclusive lock and reads by another, so frames never
 * interleave on the wire while a reader blocked in {@link #receive()} does not hold up
 * a concurrent {@link #send(byte[])}.
 * </p>
 */
public class UnixSocketConnection implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(UnixSocketConnection.class);

	private final SocketChannel channel;

	private final int maxFrameSize;

	private final ReentrantLock writeLock = new ReentrantLock();

	private final ReentrantLock readLock = new ReentrantLock();

	public UnixSocketConnection(SocketChannel channel) {
		this(channel, FrameCodec.DEFAULT_MAX_FRAME_SIZE);
	}

	public UnixSocketConnection(SocketChannel channel, int maxFrameSize) {
		this.channel = channel;
		this.maxFrameSize = maxFrameSize;
	}

	/**
	 * Writes one frame.
	 * @param payload the payload
	 * @return {@code false} if the frame could not be written completely
	 */
	public boolean send(byte[] payload) {
		writeLock.lock();
		try {
			FrameCodec.writeFrame(channel, payload);
			return true;
		}
		catch (YamlRpcTransportException e) {
			logger.debug("Send failed: {}", e.getMessage());
			return false;
		}
		finally {
			writeLock.unlock();
		}
	}

	/**
	 * Blocks until a whole frame has arrived.
	 * @return the payload, or empty if the connection failed or was closed
	 */
	public Optional<byte[]> receive() {
		readLock.lock();
		try {
			return Optional.of(FrameCodec.readFrame(channel, maxFrameSize));
		}
		catch (YamlRpcTransportException e) {
			logger.debug("Receive failed: {}", e.getMessage());
			return Optional.empty();
		}
		finally {
			readLock.unlock();
		}
	}

	public boolean isOpen() {
		return channel.isOpen();
	}

	@Override
	public void close() {
		try {
			channel.close();
		}
		catch (IOException e) {
			logger.debug("Error closing socket channel", e);
		}
	}

}
