/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.yamlrpc.server;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import io.akao.yamlrpc.spec.YamlRpcCodec;
import io.akao.yamlrpc.spec.YamlRpcException;
import io.akao.yamlrpc.spec.YamlRpcSchema;
import io.akao.yamlrpc.spec.YamlRpcSchema.ErrorCodes;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcMessage;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcRequest;
import io.akao.yamlrpc.transport.FrameCodec;
import io.akao.yamlrpc.transport.UnixSocketConnection;
import io.akao.yamlrpc.transport.UnixSocketServerTransport;
import io.akao.yamlrpc.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * YAML-RPC server run inside a node process.
 *
 * <p>
 * One thread accepts connections on the bound Unix domain socket and every accepted
 * connection is served by a dedicated worker thread that reads a request, dispatches it
 * to the registered {@link MethodHandler} and writes the reply. Methods can be
 * registered and removed while the server is running.
 * </p>
 */
public class YamlRpcServer implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(YamlRpcServer.class);

	static final String METHODS_KEY = "methods";

	static final Duration MIN_ACCEPT_BACKOFF = Duration.ofMillis(10);

	static final Duration MAX_ACCEPT_BACKOFF = Duration.ofSeconds(1);

	private final YamlRpcCodec codec;

	private final int maxFrameSize;

	private final Map<String, MethodHandler> handlers = new LinkedHashMap<>();

	private final ReadWriteLock handlersLock = new ReentrantReadWriteLock();

	private final Set<UnixSocketConnection> connections = ConcurrentHashMap.newKeySet();

	private final AtomicInteger workerCounter = new AtomicInteger();

	// set by node.shutdown on the worker of the requesting connection
	private final ThreadLocal<Runnable> shutdownAfterReply = new ThreadLocal<>();

	private final Object lifecycleLock = new Object();

	private volatile UnixSocketServerTransport serverTransport;

	private volatile Thread acceptThread;

	private volatile boolean running;

	private volatile CountDownLatch terminated = new CountDownLatch(0);

	private YamlRpcServer(Builder builder) {
		this.codec = builder.codec;
		this.maxFrameSize = builder.maxFrameSize;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Binds the endpoint and starts accepting connections.
	 * @param endpoint the socket file path
	 * @return {@code false} if the server is already running or binding failed
	 */
	public boolean start(String endpoint) {
		Assert.hasText(endpoint, "endpoint must not be empty");
		synchronized (lifecycleLock) {
			if (running) {
				return false;
			}
			UnixSocketServerTransport transport = new UnixSocketServerTransport(maxFrameSize);
			if (!transport.bind(endpoint)) {
				return false;
			}
			serverTransport = transport;
			terminated = new CountDownLatch(1);
			running = true;
			Thread thread = new Thread(this::acceptLoop, "yamlrpc-accept");
			thread.setDaemon(true);
			acceptThread = thread;
			thread.start();
			logger.info("YAML-RPC server started on {}", endpoint);
			return true;
		}
	}

	/**
	 * Stops accepting, closes every open connection and removes the socket file.
	 */
	public void stop() {
		Thread thread;
		synchronized (lifecycleLock) {
			if (!running) {
				return;
			}
			running = false;
			serverTransport.close();
			connections.forEach(UnixSocketConnection::close);
			thread = acceptThread;
			acceptThread = null;
		}
		if (thread != null && thread != Thread.currentThread()) {
			try {
				thread.join(TimeUnit.SECONDS.toMillis(5));
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}
		terminated.countDown();
		logger.info("YAML-RPC server stopped");
	}

	public boolean isRunning() {
		return running;
	}

	public String getEndpoint() {
		UnixSocketServerTransport transport = this.serverTransport;
		return (transport != null) ? transport.getEndpoint() : null;
	}

	/**
	 * Blocks until the server has stopped, for example after a {@code node.shutdown}
	 * request.
	 * @param timeout the maximum time to wait
	 * @return whether the server stopped within the timeout
	 */
	public boolean awaitTermination(Duration timeout) {
		try {
			return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	// ---------------------------
	// Method Registration
	// ---------------------------

	public void registerMethod(String method, MethodHandler handler) {
		Assert.hasText(method, "method must not be empty");
		Assert.notNull(handler, "handler must not be null");
		handlersLock.writeLock().lock();
		try {
			handlers.put(method, handler);
		}
		finally {
			handlersLock.writeLock().unlock();
		}
	}

	public boolean unregisterMethod(String method) {
		handlersLock.writeLock().lock();
		try {
			return handlers.remove(method) != null;
		}
		finally {
			handlersLock.writeLock().unlock();
		}
	}

	public boolean hasMethod(String method) {
		return findHandler(method).isPresent();
	}

	/**
	 * @return the registered method names in registration order
	 */
	public List<String> getMethods() {
		handlersLock.readLock().lock();
		try {
			return new ArrayList<>(handlers.keySet());
		}
		finally {
			handlersLock.readLock().unlock();
		}
	}

	/**
	 * Installs the handlers every node answers:
	 * <ul>
	 * <li>{@code node.info} replies with the given info plus the registered method
	 * names</li>
	 * <li>{@code node.health} replies {@code true}</li>
	 * <li>{@code node.shutdown} acknowledges, then stops the server once the reply has
	 * been written and runs the hook</li>
	 * </ul>
	 * @param nodeInfo identity of the node, for example id, name and version
	 * @param shutdownHook run after the server stopped on request, may be null
	 */
	public void registerStandardMethods(Map<String, Object> nodeInfo, @Nullable Runnable shutdownHook) {
		Assert.notNull(nodeInfo, "nodeInfo must not be null");
		Map<String, Object> info = new LinkedHashMap<>(nodeInfo);
		registerMethod(YamlRpcSchema.METHOD_NODE_INFO, request -> {
			Map<String, Object> result = new LinkedHashMap<>(info);
			result.put(METHODS_KEY, getMethods());
			return YamlRpcSchema.response(result, request.id());
		});
		registerMethod(YamlRpcSchema.METHOD_NODE_HEALTH, request -> YamlRpcSchema.response(true, request.id()));
		registerMethod(YamlRpcSchema.METHOD_NODE_SHUTDOWN, request -> {
			shutdownAfterReply.set((shutdownHook != null) ? shutdownHook : () -> {
			});
			return YamlRpcSchema.response(Map.of("status", "shutting_down"), request.id());
		});
	}

	@Override
	public void close() {
		stop();
	}

	// ---------------------------
	// Dispatch
	// ---------------------------

	/**
	 * Produces the reply to one inbound frame.
	 * @param frame the frame payload
	 * @return the reply, or {@code null} for a notification
	 */
	@Nullable
	YamlRpcMessage handleFrame(byte[] frame) {
		Optional<YamlRpcMessage> decoded = codec.decode(frame);
		if (decoded.isEmpty()) {
			return YamlRpcSchema.error(ErrorCodes.PARSE_ERROR, "Parse error", "");
		}
		if (!(decoded.get() instanceof YamlRpcRequest request)) {
			return YamlRpcSchema.error(ErrorCodes.INVALID_REQUEST, "Invalid request", decoded.get().id());
		}
		YamlRpcMessage reply = dispatch(request);
		if (request.isNotification()) {
			logger.debug("Handled notification {}", request.method());
			return null;
		}
		return reply.withId(request.id());
	}

	private YamlRpcMessage dispatch(YamlRpcRequest request) {
		Optional<MethodHandler> handler = findHandler(request.method());
		if (handler.isEmpty()) {
			return YamlRpcSchema.error(ErrorCodes.METHOD_NOT_FOUND, "Method not found: " + request.method(),
					request.id());
		}
		try {
			YamlRpcMessage reply = handler.get().handle(request);
			if (reply == null) {
				return YamlRpcSchema.error(ErrorCodes.INTERNAL_ERROR,
						"Handler for " + request.method() + " returned no reply", request.id());
			}
			return reply;
		}
		catch (YamlRpcException e) {
			return e.toError(request.id());
		}
		catch (RuntimeException e) {
			logger.warn("Handler for {} failed", request.method(), e);
			String message = (e.getMessage() != null) ? e.getMessage() : e.getClass().getSimpleName();
			return YamlRpcSchema.error(ErrorCodes.INTERNAL_ERROR, message, request.id());
		}
	}

	private Optional<MethodHandler> findHandler(String method) {
		handlersLock.readLock().lock();
		try {
			return Optional.ofNullable(handlers.get(method));
		}
		finally {
			handlersLock.readLock().unlock();
		}
	}

	// ---------------------------
	// Connection Handling
	// ---------------------------

	private void acceptLoop() {
		UnixSocketServerTransport transport = this.serverTransport;
		int failures = 0;
		while (running && transport.isBound()) {
			Optional<UnixSocketConnection> accepted = transport.accept();
			if (accepted.isEmpty()) {
				if (running && transport.isBound() && !pauseAfterFailedAccept(++failures)) {
					break;
				}
				continue;
			}
			failures = 0;
			UnixSocketConnection connection = accepted.get();
			if (!running) {
				connection.close();
				break;
			}
			connections.add(connection);
			Thread worker = new Thread(() -> serve(connection), "yamlrpc-worker-" + workerCounter.incrementAndGet());
			worker.setDaemon(true);
			worker.start();
			logger.debug("Accepted connection on {}", transport.getEndpoint());
		}
	}

	private boolean pauseAfterFailedAccept(int failures) {
		Duration pause = acceptBackoff(failures);
		logger.debug("Accept failed {} times in a row, retrying in {}", failures, pause);
		try {
			Thread.sleep(pause.toMillis());
			return true;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	/**
	 * Doubles from {@link #MIN_ACCEPT_BACKOFF} with every consecutive failure, capped at
	 * {@link #MAX_ACCEPT_BACKOFF}.
	 */
	static Duration acceptBackoff(int failures) {
		int exponent = Math.min(Math.max(failures - 1, 0), 16);
		Duration backoff = MIN_ACCEPT_BACKOFF.multipliedBy(1L << exponent);
		return (backoff.compareTo(MAX_ACCEPT_BACKOFF) > 0) ? MAX_ACCEPT_BACKOFF : backoff;
	}

	private void serve(UnixSocketConnection connection) {
		try {
			while (running && connection.isOpen()) {
				Optional<byte[]> frame = connection.receive();
				if (frame.isEmpty()) {
					break;
				}
				YamlRpcMessage reply = handleFrame(frame.get());
				if (reply != null && !connection.send(encode(reply))) {
					logger.debug("Failed to write reply {}", reply.id());
					break;
				}
				Runnable hook = shutdownAfterReply.get();
				if (hook != null) {
					shutdownAfterReply.remove();
					shutdownInBackground(hook);
				}
			}
		}
		catch (RuntimeException e) {
			logger.error("Unexpected failure serving connection", e);
		}
		finally {
			connection.close();
			connections.remove(connection);
		}
	}

	private byte[] encode(YamlRpcMessage reply) {
		try {
			return codec.encode(reply);
		}
		catch (RuntimeException e) {
			logger.warn("Failed to encode reply {}", reply.id(), e);
			return codec.encode(YamlRpcSchema.error(ErrorCodes.INTERNAL_ERROR, "Failed to encode reply", reply.id()));
		}
	}

	private void shutdownInBackground(Runnable hook) {
		Thread shutdown = new Thread(() -> {
			stop();
			hook.run();
		}, "yamlrpc-shutdown");
		shutdown.setDaemon(true);
		shutdown.start();
	}

	/**
	 * Builder for {@link YamlRpcServer}.
	 */
	public static class Builder {

		private YamlRpcCodec codec;

		private int maxFrameSize = FrameCodec.DEFAULT_MAX_FRAME_SIZE;

		private Builder() {
		}

		public Builder codec(YamlRpcCodec codec) {
			Assert.notNull(codec, "codec must not be null");
			this.codec = codec;
			return this;
		}

		/**
		 * Sets the largest accepted frame payload. Defaults to 16 MiB.
		 * @param maxFrameSize the limit in bytes
		 * @return this builder
		 */
		public Builder maxFrameSize(int maxFrameSize) {
			Assert.isTrue(maxFrameSize > 0, "maxFrameSize must be positive");
			this.maxFrameSize = maxFrameSize;
			return this;
		}

		public YamlRpcServer build() {
			if (codec == null) {
				codec = new YamlRpcCodec();
			}
			return new YamlRpcServer(this);
		}

	}

}
