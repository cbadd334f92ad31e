/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.yamlrpc.client;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.akao.yamlrpc.spec.RequestIdGenerator;
import io.akao.yamlrpc.spec.YamlRpcClientTransport;
import io.akao.yamlrpc.spec.YamlRpcCodec;
import io.akao.yamlrpc.spec.YamlRpcSchema;
import io.akao.yamlrpc.spec.YamlRpcSchema.ErrorCodes;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcMessage;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcRequest;
import io.akao.yamlrpc.transport.UnixSocketClientTransport;
import io.akao.yamlrpc.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.util.annotation.Nullable;

/**
 * YAML-RPC client multiplexing concurrent calls over a single connection to one node.
 *
 * <p>
 * Each call registers a pending {@link MonoSink} under a fresh request id before the
 * request is sent. A single background reader thread decodes incoming frames and
 * resolves the sink whose id matches the reply; frames that cannot be decoded, carry an
 * unknown id, or are requests are dropped. Transport and protocol faults never surface
 * as exceptions: every call resolves to a message, synthesized locally as an
 * {@link ErrorCodes#INTERNAL_ERROR} or {@link ErrorCodes#NODE_EXECUTION_TIMEOUT} error
 * where needed.
 * </p>
 *
 * <pre>{@code
 * try (YamlRpcClient client = YamlRpcClient.builder().requestTimeout(Duration.ofSeconds(5)).build()) {
 *     client.connect("/tmp/akao-node-validator.sock");
 *     YamlRpcMessage reply = client.nodeHealth();
 * }
 * }</pre>
 */
public class YamlRpcClient implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(YamlRpcClient.class);

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	public static final int DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 10;

	static final String NOT_CONNECTED = "Not connected";

	static final String SEND_FAILED = "Send failed";

	static final String CONNECTION_CLOSED = "Connection closed";

	static final String REQUEST_TIMEOUT = "Request timeout";

	private final YamlRpcClientTransport transport;

	private final YamlRpcCodec codec;

	private final Duration requestTimeout;

	private final RequestIdGenerator requestIdGenerator;

	private final Map<String, MonoSink<YamlRpcMessage>> pendingCalls = new ConcurrentHashMap<>();

	private final Object lifecycleLock = new Object();

	private volatile boolean running;

	private volatile Thread readerThread;

	private YamlRpcClient(Builder builder) {
		this.transport = builder.transport;
		this.codec = builder.codec;
		this.requestTimeout = builder.requestTimeout;
		this.requestIdGenerator = builder.requestIdGenerator;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Connects the transport and starts the reader thread. Connecting an already
	 * connected client is a no-op success.
	 * @param endpoint the node endpoint
	 * @return whether the client is connected
	 */
	public boolean connect(String endpoint) {
		Assert.hasText(endpoint, "endpoint must not be empty");
		synchronized (lifecycleLock) {
			if (running && transport.isConnected()) {
				return true;
			}
			if (!transport.connect(endpoint)) {
				logger.debug("Could not connect to {}", endpoint);
				return false;
			}
			running = true;
			Thread reader = new Thread(this::readLoop, "yamlrpc-reader-" + endpoint);
			reader.setDaemon(true);
			readerThread = reader;
			reader.start();
			logger.info("YAML-RPC client connected to {}", endpoint);
			return true;
		}
	}

	/**
	 * Stops accepting calls, closes the transport, waits for the reader thread to exit
	 * and resolves every call still pending with a "Connection closed" error.
	 */
	public void disconnect() {
		Thread reader;
		synchronized (lifecycleLock) {
			if (!running && readerThread == null) {
				return;
			}
			running = false;
			transport.close();
			reader = readerThread;
			readerThread = null;
		}
		if (reader != null && reader != Thread.currentThread()) {
			try {
				reader.join();
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}
		failPendingCalls(CONNECTION_CLOSED);
		logger.info("YAML-RPC client disconnected from {}", transport.getEndpoint());
	}

	public boolean isConnected() {
		return running && transport.isConnected();
	}

	public String getEndpoint() {
		return transport.getEndpoint();
	}

	/**
	 * @return the number of calls awaiting a reply
	 */
	public int pendingCount() {
		return pendingCalls.size();
	}

	/**
	 * Sends a request and blocks for the reply using the default request timeout.
	 * @param method the method name
	 * @param params the parameters, may be null
	 * @return the reply, or a locally synthesized error
	 */
	public YamlRpcMessage call(String method, @Nullable Object params) {
		return call(method, params, requestTimeout);
	}

	/**
	 * Sends a request and blocks for the reply.
	 * @param method the method name
	 * @param params the parameters, may be null
	 * @param timeout how long to wait for the reply
	 * @return the reply as received, or a locally synthesized error
	 */
	public YamlRpcMessage call(String method, @Nullable Object params, Duration timeout) {
		return callAsync(method, params, timeout).block();
	}

	public Mono<YamlRpcMessage> callAsync(String method, @Nullable Object params) {
		return callAsync(method, params, requestTimeout);
	}

	/**
	 * Lazily sends a request when subscribed. The returned {@link Mono} always emits
	 * exactly one message and never errors.
	 * @param method the method name
	 * @param params the parameters, may be null
	 * @param timeout how long to wait for the reply
	 * @return the reply
	 */
	public Mono<YamlRpcMessage> callAsync(String method, @Nullable Object params, Duration timeout) {
		Assert.hasText(method, "method must not be empty");
		Assert.notNull(timeout, "timeout must not be null");
		Assert.isTrue(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive");
		return Mono.defer(() -> {
			if (!isConnected()) {
				return Mono.just(YamlRpcSchema.error(ErrorCodes.INTERNAL_ERROR, NOT_CONNECTED, ""));
			}
			String requestId = requestIdGenerator.generate();
			YamlRpcRequest request = YamlRpcSchema.request(method, params, requestId);
			return Mono.<YamlRpcMessage>create(sink -> {
				pendingCalls.put(requestId, sink);
				sink.onCancel(() -> pendingCalls.remove(requestId));
				if (!running) {
					pendingCalls.remove(requestId);
					sink.success(YamlRpcSchema.error(ErrorCodes.INTERNAL_ERROR, CONNECTION_CLOSED, requestId));
					return;
				}
				logger.debug("Sending request {} ({})", requestId, method);
				if (!sendMessage(request)) {
					pendingCalls.remove(requestId);
					sink.success(YamlRpcSchema.error(ErrorCodes.INTERNAL_ERROR, SEND_FAILED, requestId));
				}
			}).timeout(timeout, Mono.fromSupplier(() -> {
				pendingCalls.remove(requestId);
				logger.debug("Request {} ({}) timed out after {}", requestId, method, timeout);
				return YamlRpcSchema.error(ErrorCodes.NODE_EXECUTION_TIMEOUT, REQUEST_TIMEOUT, requestId);
			}));
		});
	}

	/**
	 * Sends a notification: a request with an empty id for which no reply is awaited.
	 * @param method the method name
	 * @param params the parameters, may be null
	 * @return whether the frame was written
	 */
	public boolean notify(String method, @Nullable Object params) {
		Assert.hasText(method, "method must not be empty");
		return isConnected() && sendMessage(YamlRpcSchema.notification(method, params));
	}

	// ---------------------------
	// Standard Node Methods
	// ---------------------------

	public YamlRpcMessage nodeInfo() {
		return call(YamlRpcSchema.METHOD_NODE_INFO, null);
	}

	public YamlRpcMessage nodeValidate(@Nullable Object input) {
		return call(YamlRpcSchema.METHOD_NODE_VALIDATE, params(YamlRpcSchema.PARAM_INPUT, input));
	}

	public YamlRpcMessage nodeExecute(@Nullable Object input, @Nullable Object context) {
		Map<String, Object> params = params(YamlRpcSchema.PARAM_INPUT, input);
		params.put(YamlRpcSchema.PARAM_CONTEXT, context);
		return call(YamlRpcSchema.METHOD_NODE_EXECUTE, params);
	}

	public YamlRpcMessage nodeHealth() {
		return call(YamlRpcSchema.METHOD_NODE_HEALTH, null);
	}

	public YamlRpcMessage nodeShutdown() {
		return nodeShutdown(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
	}

	public YamlRpcMessage nodeShutdown(int timeoutSeconds) {
		return call(YamlRpcSchema.METHOD_NODE_SHUTDOWN, params(YamlRpcSchema.PARAM_TIMEOUT_SECONDS, timeoutSeconds));
	}

	@Override
	public void close() {
		disconnect();
	}

	private static Map<String, Object> params(String name, @Nullable Object value) {
		// LinkedHashMap rather than Map.of: values may be null
		Map<String, Object> params = new LinkedHashMap<>();
		params.put(name, value);
		return params;
	}

	private boolean sendMessage(YamlRpcMessage message) {
		byte[] payload;
		try {
			payload = codec.encode(message);
		}
		catch (RuntimeException e) {
			logger.warn("Failed to encode {}: {}", message, e.getMessage());
			return false;
		}
		return transport.send(payload);
	}

	private void readLoop() {
		while (running) {
			Optional<byte[]> frame = transport.receive();
			if (frame.isEmpty()) {
				break;
			}
			Optional<YamlRpcMessage> decoded = codec.decode(frame.get());
			if (decoded.isEmpty()) {
				logger.debug("Dropping undecodable frame of {} bytes", frame.get().length);
				continue;
			}
			YamlRpcMessage message = decoded.get();
			if (message.isRequest() || message.id().isEmpty()) {
				logger.debug("Dropping unsolicited message {}", message);
				continue;
			}
			MonoSink<YamlRpcMessage> sink = pendingCalls.remove(message.id());
			if (sink == null) {
				logger.debug("Dropping reply with unknown id {}", message.id());
				continue;
			}
			sink.success(message);
		}
		onReaderExit();
	}

	private void onReaderExit() {
		boolean lostByPeer;
		synchronized (lifecycleLock) {
			lostByPeer = running;
			if (lostByPeer) {
				running = false;
				transport.close();
				readerThread = null;
			}
		}
		if (lostByPeer) {
			logger.info("Connection to {} lost", transport.getEndpoint());
			failPendingCalls(CONNECTION_CLOSED);
		}
	}

	private void failPendingCalls(String reason) {
		for (String requestId : pendingCalls.keySet()) {
			MonoSink<YamlRpcMessage> sink = pendingCalls.remove(requestId);
			if (sink != null) {
				sink.success(YamlRpcSchema.error(ErrorCodes.INTERNAL_ERROR, reason, requestId));
			}
		}
	}

	/**
	 * Builder for {@link YamlRpcClient}.
	 */
	public static class Builder {

		private YamlRpcClientTransport transport;

		private YamlRpcCodec codec;

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		private RequestIdGenerator requestIdGenerator;

		private Builder() {
		}

		/**
		 * Sets the transport. Defaults to a {@link UnixSocketClientTransport}.
		 * @param transport the transport
		 * @return this builder
		 */
		public Builder transport(YamlRpcClientTransport transport) {
			Assert.notNull(transport, "transport must not be null");
			this.transport = transport;
			return this;
		}

		public Builder codec(YamlRpcCodec codec) {
			Assert.notNull(codec, "codec must not be null");
			this.codec = codec;
			return this;
		}

		/**
		 * Sets the default timeout of {@link YamlRpcClient#call(String, Object)}.
		 * Defaults to 30 seconds.
		 * @param requestTimeout the timeout
		 * @return this builder
		 */
		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "requestTimeout must not be null");
			Assert.isTrue(!requestTimeout.isNegative() && !requestTimeout.isZero(),
					"requestTimeout must be positive");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder requestIdGenerator(RequestIdGenerator requestIdGenerator) {
			Assert.notNull(requestIdGenerator, "requestIdGenerator must not be null");
			this.requestIdGenerator = requestIdGenerator;
			return this;
		}

		public YamlRpcClient build() {
			if (transport == null) {
				transport = new UnixSocketClientTransport();
			}
			if (codec == null) {
				codec = new YamlRpcCodec();
			}
			if (requestIdGenerator == null) {
				requestIdGenerator = RequestIdGenerator.ofDefault();
			}
			return new YamlRpcClient(this);
		}

	}

}
