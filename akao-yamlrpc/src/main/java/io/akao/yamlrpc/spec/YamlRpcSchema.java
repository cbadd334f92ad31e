/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.yamlrpc.spec;

import io.akao.yamlrpc.util.Assert;
import io.akao.yamlrpc.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Message schema of the YAML-RPC 1.0 protocol spoken between the core process and
 * external node processes. The envelope mirrors JSON-RPC: a message is a request, a
 * response or an error, each tagged with {@code yamlrpc: "1.0"} and correlated by an
 * opaque {@code id}.
 */
public final class YamlRpcSchema {

	private YamlRpcSchema() {
	}

	public static final String YAMLRPC_VERSION = "1.0";

	// ---------------------------
	// Field Names
	// ---------------------------

	public static final String FIELD_YAMLRPC = "yamlrpc";

	public static final String FIELD_ID = "id";

	public static final String FIELD_METHOD = "method";

	public static final String FIELD_PARAMS = "params";

	public static final String FIELD_RESULT = "result";

	public static final String FIELD_ERROR = "error";

	public static final String FIELD_CODE = "code";

	public static final String FIELD_MESSAGE = "message";

	public static final String FIELD_DATA = "data";

	// ---------------------------
	// Standard Node Methods
	// ---------------------------

	public static final String METHOD_NODE_INFO = "node.info";

	public static final String METHOD_NODE_VALIDATE = "node.validate";

	public static final String METHOD_NODE_EXECUTE = "node.execute";

	public static final String METHOD_NODE_HEALTH = "node.health";

	public static final String METHOD_NODE_SHUTDOWN = "node.shutdown";

	public static final String PARAM_INPUT = "input";

	public static final String PARAM_CONTEXT = "context";

	public static final String PARAM_TIMEOUT_SECONDS = "timeout_seconds";

	// ---------------------------
	// Error Codes
	// ---------------------------
	/**
	 * Error codes carried by {@link YamlRpcError} messages. The first block is inherited
	 * from JSON-RPC, the second is specific to node execution.
	 */
	public static final class ErrorCodes {

		private ErrorCodes() {
		}

		/**
		 * Invalid YAML was received.
		 */
		public static final int PARSE_ERROR = -32700;

		/**
		 * The document sent is not a valid request.
		 */
		public static final int INVALID_REQUEST = -32600;

		/**
		 * The method does not exist / is not available.
		 */
		public static final int METHOD_NOT_FOUND = -32601;

		/**
		 * Invalid method parameter(s).
		 */
		public static final int INVALID_PARAMS = -32602;

		/**
		 * Internal error, also used for any failure to reach the node.
		 */
		public static final int INTERNAL_ERROR = -32603;

		public static final int NODE_INIT_ERROR = -1000;

		public static final int NODE_CONFIG_ERROR = -1001;

		public static final int NODE_VALIDATION_ERROR = -1002;

		/**
		 * No response arrived before the caller's deadline.
		 */
		public static final int NODE_EXECUTION_TIMEOUT = -1003;

		public static final int NODE_RESOURCE_LIMIT = -1004;

		public static final int NODE_INTERNAL_ERROR = -1005;

	}

	// ---------------------------
	// Message Types
	// ---------------------------

	/**
	 * A YAML-RPC message: exactly one of request, response or error.
	 */
	public sealed interface YamlRpcMessage permits YamlRpcRequest, YamlRpcResponse, YamlRpcError {

		/**
		 * @return the protocol version tag
		 */
		String yamlrpc();

		/**
		 * @return the correlation id, empty when the message is not correlated
		 */
		String id();

		/**
		 * Returns a copy of this message carrying the given correlation id.
		 * @param id the new id
		 * @return the re-identified message
		 */
		YamlRpcMessage withId(String id);

		default boolean isRequest() {
			return this instanceof YamlRpcRequest;
		}

		default boolean isResponse() {
			return this instanceof YamlRpcResponse;
		}

		default boolean isError() {
			return this instanceof YamlRpcError;
		}

	}

	/**
	 * A method invocation. An empty id marks a notification that expects no reply.
	 *
	 * @param yamlrpc the protocol version (must be "1.0")
	 * @param method the name of the method to be invoked
	 * @param params structured parameters, may be null
	 * @param id the correlation id, never null
	 */
	public record YamlRpcRequest(String yamlrpc, String method, @Nullable Object params,
			String id) implements YamlRpcMessage {

		public YamlRpcRequest {
			Assert.notNull(yamlrpc, "yamlrpc version must not be null");
			Assert.hasText(method, "method must not be empty");
			id = Utils.nullToEmpty(id);
		}

		@Override
		public YamlRpcRequest withId(String id) {
			return new YamlRpcRequest(yamlrpc, method, params, id);
		}

		public boolean isNotification() {
			return id.isEmpty();
		}

	}

	/**
	 * A successful reply.
	 *
	 * @param yamlrpc the protocol version (must be "1.0")
	 * @param result the structured result, may be null
	 * @param id the id of the originating request
	 */
	public record YamlRpcResponse(String yamlrpc, @Nullable Object result, String id) implements YamlRpcMessage {

		public YamlRpcResponse {
			Assert.notNull(yamlrpc, "yamlrpc version must not be null");
			id = Utils.nullToEmpty(id);
		}

		@Override
		public YamlRpcResponse withId(String id) {
			return new YamlRpcResponse(yamlrpc, result, id);
		}

	}

	/**
	 * A failed reply, either sent by the node or synthesized locally by the client.
	 *
	 * @param yamlrpc the protocol version (must be "1.0")
	 * @param error the error details
	 * @param id the id of the originating request
	 */
	public record YamlRpcError(String yamlrpc, ErrorDetail error, String id) implements YamlRpcMessage {

		public YamlRpcError {
			Assert.notNull(yamlrpc, "yamlrpc version must not be null");
			Assert.notNull(error, "error must not be null");
			id = Utils.nullToEmpty(id);
		}

		@Override
		public YamlRpcError withId(String id) {
			return new YamlRpcError(yamlrpc, error, id);
		}

		public int code() {
			return error.code();
		}

		public String message() {
			return error.message();
		}

		/**
		 * @param code one of {@link ErrorCodes}
		 * @param message a short description of the error
		 * @param data additional information about the error, may be null
		 */
		public record ErrorDetail(int code, String message, @Nullable Object data) {

			public ErrorDetail {
				message = Utils.nullToEmpty(message);
			}

		}

	}

	// ---------------------------
	// Factories
	// ---------------------------

	public static YamlRpcRequest request(String method, @Nullable Object params, String id) {
		return new YamlRpcRequest(YAMLRPC_VERSION, method, params, id);
	}

	public static YamlRpcRequest notification(String method, @Nullable Object params) {
		return new YamlRpcRequest(YAMLRPC_VERSION, method, params, "");
	}

	public static YamlRpcResponse response(@Nullable Object result, String id) {
		return new YamlRpcResponse(YAMLRPC_VERSION, result, id);
	}

	public static YamlRpcError error(int code, String message, String id) {
		return error(code, message, id, null);
	}

	public static YamlRpcError error(int code, String message, String id, @Nullable Object data) {
		return new YamlRpcError(YAMLRPC_VERSION, new YamlRpcError.ErrorDetail(code, message, data), id);
	}

}
