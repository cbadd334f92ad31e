/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.yamlrpc.transport;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;

import io.akao.yamlrpc.spec.YamlRpcTransportException;

/**
 * Length-prefixed framing: a 4-byte unsigned length in big-endian byte order followed by
 * exactly that many payload bytes.
 */
public final class FrameCodec {

	public static final int HEADER_SIZE = 4;

	/** 16 MiB */
	public static final int DEFAULT_MAX_FRAME_SIZE = 16 * 1024 * 1024;

	private FrameCodec() {
	}

	/**
	 * Writes one frame, looping until the header and payload are fully written.
	 * @param channel the channel to write to
	 * @param payload the payload
	 * @throws YamlRpcTransportException if the frame could not be written completely
	 */
	public static void writeFrame(WritableByteChannel channel, byte[] payload) {
		ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.BIG_ENDIAN);
		header.putInt(payload.length).flip();
		ByteBuffer body = ByteBuffer.wrap(payload);
		try {
			writeFully(channel, header);
			writeFully(channel, body);
		}
		catch (IOException e) {
			throw new YamlRpcTransportException("Failed to write frame", e);
		}
	}

	/**
	 * Reads one frame, blocking until the whole payload has arrived.
	 * @param channel the channel to read from
	 * @param maxFrameSize the largest payload accepted
	 * @return the payload
	 * @throws YamlRpcTransportException on a short read, a closed channel or an
	 * oversized frame
	 */
	public static byte[] readFrame(ReadableByteChannel channel, int maxFrameSize) {
		try {
			ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.BIG_ENDIAN);
			readFully(channel, header);
			long length = Integer.toUnsignedLong(header.flip().getInt());
			if (length > maxFrameSize) {
				throw new YamlRpcTransportException(
						"Frame of " + length + " bytes exceeds the limit of " + maxFrameSize + " bytes");
			}
			ByteBuffer body = ByteBuffer.allocate((int) length);
			readFully(channel, body);
			return body.array();
		}
		catch (IOException e) {
			throw new YamlRpcTransportException("Failed to read frame", e);
		}
	}

	/**
	 * Encodes the frame header for a payload of the given length.
	 * @param length the payload length
	 * @return the 4 header bytes
	 */
	public static byte[] header(int length) {
		return ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.BIG_ENDIAN).putInt(length).array();
	}

	private static void writeFully(WritableByteChannel channel, ByteBuffer buffer) throws IOException {
		while (buffer.hasRemaining()) {
			if (channel.write(buffer) < 0) {
				throw new YamlRpcTransportException("Channel refused further writes");
			}
		}
	}

	private static void readFully(ReadableByteChannel channel, ByteBuffer buffer) throws IOException {
		while (buffer.hasRemaining()) {
			if (channel.read(buffer) < 0) {
				throw new YamlRpcTransportException(
						"Peer closed the connection after " + buffer.position() + " of " + buffer.capacity() + " bytes");
			}
		}
	}

}
