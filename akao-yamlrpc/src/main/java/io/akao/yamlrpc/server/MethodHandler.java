/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.yamlrpc.server;

import io.akao.yamlrpc.spec.YamlRpcException;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcMessage;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcRequest;

/**
 * Handles one registered method on a {@link YamlRpcServer}.
 *
 * <p>
 * The returned message is sent back carrying the request id, whatever id it was built
 * with. Throwing {@link YamlRpcException} replies with that error code; any other runtime
 * exception replies with an internal error.
 */
@FunctionalInterface
public interface MethodHandler {

	YamlRpcMessage handle(YamlRpcRequest request);

}
