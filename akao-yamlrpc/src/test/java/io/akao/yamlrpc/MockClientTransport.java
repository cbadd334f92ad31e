/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.yamlrpc;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.akao.yamlrpc.spec.YamlRpcClientTransport;
import io.akao.yamlrpc.spec.YamlRpcCodec;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcMessage;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcRequest;

/**
 * An in-memory {@link YamlRpcClientTransport}: frames sent by the client are decoded and
 * recorded, frames for the client are queued by the test.
 */
public class MockClientTransport implements YamlRpcClientTransport {

	private static final byte[] CLOSED = new byte[0];

	private final YamlRpcCodec codec = new YamlRpcCodec();

	private final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();

	private final BlockingQueue<YamlRpcMessage> sent = new LinkedBlockingQueue<>();

	private final AtomicInteger connectCount = new AtomicInteger();

	private volatile boolean connected;

	private volatile boolean failSends;

	private volatile String endpoint;

	@Override
	public boolean connect(String endpoint) {
		if (connected) {
			return true;
		}
		inbound.removeIf(frame -> frame == CLOSED);
		this.endpoint = endpoint;
		this.connected = true;
		connectCount.incrementAndGet();
		return true;
	}

	@Override
	public boolean send(byte[] payload) {
		if (!connected || failSends) {
			return false;
		}
		sent.add(codec.decode(payload).orElseThrow());
		return true;
	}

	@Override
	public Optional<byte[]> receive() {
		try {
			byte[] frame = inbound.take();
			return (frame == CLOSED) ? Optional.empty() : Optional.of(frame);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return Optional.empty();
		}
	}

	@Override
	public boolean isConnected() {
		return connected;
	}

	@Override
	public String getEndpoint() {
		return endpoint;
	}

	@Override
	public void close() {
		connected = false;
		inbound.add(CLOSED);
	}

	public void simulateIncomingMessage(YamlRpcMessage message) {
		inbound.add(codec.encode(message));
	}

	public void simulateIncomingFrame(String document) {
		inbound.add(document.getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Makes the pending receive report a closed connection, as when the node exits.
	 */
	public void simulatePeerClose() {
		inbound.add(CLOSED);
	}

	public void setFailSends(boolean failSends) {
		this.failSends = failSends;
	}

	public int getConnectCount() {
		return connectCount.get();
	}

	public YamlRpcMessage awaitSentMessage() {
		try {
			YamlRpcMessage message = sent.poll(2, TimeUnit.SECONDS);
			if (message == null) {
				throw new AssertionError("No message was sent");
			}
			return message;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new AssertionError("Interrupted while waiting for a sent message", e);
		}
	}

	public YamlRpcRequest awaitSentRequest() {
		return (YamlRpcRequest) awaitSentMessage();
	}

}
