/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.yamlrpc.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import io.akao.yamlrpc.MockClientTransport;
import io.akao.yamlrpc.spec.RequestIdGenerator;
import io.akao.yamlrpc.spec.YamlRpcSchema;
import io.akao.yamlrpc.spec.YamlRpcSchema.ErrorCodes;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcError;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcMessage;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcRequest;
import io.akao.yamlrpc.spec.YamlRpcSchema.YamlRpcResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link YamlRpcClient} request correlation, timeouts and connection loss.
 */
class YamlRpcClientTests {

	private static final String ENDPOINT = "/tmp/akao-test-node.sock";

	private static final String TEST_METHOD = "test.method";

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private MockClientTransport transport;

	private YamlRpcClient client;

	@BeforeEach
	void setUp() {
		transport = new MockClientTransport();
		client = YamlRpcClient.builder().transport(transport).requestTimeout(TIMEOUT).build();
	}

	@AfterEach
	void tearDown() {
		client.close();
	}

	@Test
	void callResolvesWithMatchingResponse() {
		assertThat(client.connect(ENDPOINT)).isTrue();

		StepVerifier.create(client.callAsync(TEST_METHOD, Map.of("key", "value"))).then(() -> {
			YamlRpcRequest request = transport.awaitSentRequest();
			assertThat(request.method()).isEqualTo(TEST_METHOD);
			assertThat(request.params()).isEqualTo(Map.of("key", "value"));
			assertThat(request.id()).startsWith("req-");
			transport.simulateIncomingMessage(YamlRpcSchema.response("done", request.id()));
		}).assertNext(reply -> {
			assertThat(reply).isInstanceOf(YamlRpcResponse.class);
			assertThat(((YamlRpcResponse) reply).result()).isEqualTo("done");
		}).verifyComplete();

		assertThat(client.pendingCount()).isZero();
	}

	@Test
	void errorRepliesAreReturnedUnchanged() {
		client.connect(ENDPOINT);

		StepVerifier.create(client.callAsync(TEST_METHOD, null)).then(() -> {
			YamlRpcRequest request = transport.awaitSentRequest();
			transport.simulateIncomingMessage(
					YamlRpcSchema.error(ErrorCodes.NODE_VALIDATION_ERROR, "bad input", request.id(), "rules"));
		}).assertNext(reply -> {
			YamlRpcError error = (YamlRpcError) reply;
			assertThat(error.code()).isEqualTo(ErrorCodes.NODE_VALIDATION_ERROR);
			assertThat(error.message()).isEqualTo("bad input");
			assertThat(error.error().data()).isEqualTo("rules");
		}).verifyComplete();
	}

	@Test
	void repliesInAnyOrderReachTheirCallers() throws Exception {
		client.connect(ENDPOINT);
		List<CompletableFuture<YamlRpcMessage>> futures = new ArrayList<>();
		for (int i = 0; i < 20; i++) {
			futures.add(client.callAsync(TEST_METHOD, i).toFuture());
		}
		List<YamlRpcRequest> requests = new ArrayList<>();
		for (int i = 0; i < 20; i++) {
			requests.add(transport.awaitSentRequest());
		}

		Collections.shuffle(requests, new Random(42));
		requests.forEach(request -> transport.simulateIncomingMessage(
				YamlRpcSchema.response(((Integer) request.params()) * 10, request.id())));

		for (int i = 0; i < 20; i++) {
			YamlRpcMessage reply = futures.get(i).get(5, TimeUnit.SECONDS);
			assertThat(((YamlRpcResponse) reply).result()).isEqualTo(i * 10);
		}
		assertThat(client.pendingCount()).isZero();
	}

	@Test
	void unmatchedAndUndecodableFramesAreDropped() {
		client.connect(ENDPOINT);

		StepVerifier.create(client.callAsync(TEST_METHOD, null)).then(() -> {
			YamlRpcRequest request = transport.awaitSentRequest();
			transport.simulateIncomingFrame("key: [unclosed");
			transport.simulateIncomingMessage(YamlRpcSchema.response("stray", "req-unknown"));
			transport.simulateIncomingMessage(YamlRpcSchema.request("node.info", null, request.id()));
			transport.simulateIncomingMessage(YamlRpcSchema.response("expected", request.id()));
		})
			.assertNext(reply -> assertThat(((YamlRpcResponse) reply).result()).isEqualTo("expected"))
			.verifyComplete();

		assertThat(client.isConnected()).isTrue();
	}

	@Test
	void callTimesOutAndForgetsPendingEntry() {
		client = YamlRpcClient.builder().transport(transport).requestIdGenerator(() -> "req-3").build();
		client.connect(ENDPOINT);

		YamlRpcMessage reply = client.call(TEST_METHOD, null, Duration.ofMillis(200));

		assertThat(reply).isInstanceOf(YamlRpcError.class);
		assertThat(((YamlRpcError) reply).code()).isEqualTo(ErrorCodes.NODE_EXECUTION_TIMEOUT);
		assertThat(reply.id()).isEqualTo("req-3");
		assertThat(client.pendingCount()).isZero();

		// a late reply is discarded
		transport.simulateIncomingMessage(YamlRpcSchema.response(true, "req-3"));
		await().during(Duration.ofMillis(100)).atMost(Duration.ofSeconds(1))
			.until(() -> client.pendingCount() == 0 && client.isConnected());
	}

	@Test
	void timeoutOfOneCallDoesNotAffectOthers() throws Exception {
		client.connect(ENDPOINT);
		CompletableFuture<YamlRpcMessage> slow = client.callAsync("slow", null, Duration.ofMillis(150)).toFuture();
		CompletableFuture<YamlRpcMessage> fast = client.callAsync("fast", null).toFuture();
		transport.awaitSentRequest();
		YamlRpcRequest fastRequest = transport.awaitSentRequest();

		assertThat(((YamlRpcError) slow.get(2, TimeUnit.SECONDS)).code())
			.isEqualTo(ErrorCodes.NODE_EXECUTION_TIMEOUT);
		transport.simulateIncomingMessage(YamlRpcSchema.response("ok", fastRequest.id()));

		assertThat(fast.get(2, TimeUnit.SECONDS)).isInstanceOf(YamlRpcResponse.class);
	}

	@Test
	void callWhileDisconnectedFailsImmediately() {
		YamlRpcMessage reply = client.call(TEST_METHOD, null);

		assertThat(((YamlRpcError) reply).code()).isEqualTo(ErrorCodes.INTERNAL_ERROR);
		assertThat(((YamlRpcError) reply).message()).isEqualTo(YamlRpcClient.NOT_CONNECTED);
	}

	@Test
	void sendFailureFailsImmediately() {
		client.connect(ENDPOINT);
		transport.setFailSends(true);

		YamlRpcMessage reply = client.call(TEST_METHOD, null);

		assertThat(((YamlRpcError) reply).code()).isEqualTo(ErrorCodes.INTERNAL_ERROR);
		assertThat(((YamlRpcError) reply).message()).isEqualTo(YamlRpcClient.SEND_FAILED);
		assertThat(client.pendingCount()).isZero();
	}

	@Test
	void disconnectResolvesPendingCalls() throws Exception {
		client.connect(ENDPOINT);
		CompletableFuture<YamlRpcMessage> pending = client.callAsync(TEST_METHOD, null).toFuture();
		transport.awaitSentRequest();

		client.disconnect();

		YamlRpcError error = (YamlRpcError) pending.get(2, TimeUnit.SECONDS);
		assertThat(error.code()).isEqualTo(ErrorCodes.INTERNAL_ERROR);
		assertThat(error.message()).isEqualTo(YamlRpcClient.CONNECTION_CLOSED);
		assertThat(client.isConnected()).isFalse();
		assertThat(client.pendingCount()).isZero();
	}

	@Test
	void peerCloseResolvesPendingCalls() throws Exception {
		client.connect(ENDPOINT);
		CompletableFuture<YamlRpcMessage> pending = client.callAsync(TEST_METHOD, null).toFuture();
		transport.awaitSentRequest();

		transport.simulatePeerClose();

		YamlRpcError error = (YamlRpcError) pending.get(2, TimeUnit.SECONDS);
		assertThat(error.message()).isEqualTo(YamlRpcClient.CONNECTION_CLOSED);
		await().atMost(Duration.ofSeconds(2)).until(() -> !client.isConnected());
	}

	@Test
	void connectIsIdempotentAndReconnectsAfterDisconnect() {
		assertThat(client.connect(ENDPOINT)).isTrue();
		assertThat(client.connect(ENDPOINT)).isTrue();
		assertThat(transport.getConnectCount()).isEqualTo(1);
		assertThat(client.getEndpoint()).isEqualTo(ENDPOINT);

		client.disconnect();
		assertThat(client.connect(ENDPOINT)).isTrue();

		assertThat(transport.getConnectCount()).isEqualTo(2);
		assertThat(client.isConnected()).isTrue();
	}

	@Test
	void notifySendsRequestWithoutId() {
		client.connect(ENDPOINT);

		assertThat(client.notify("node.log", "hello")).isTrue();

		YamlRpcRequest sent = transport.awaitSentRequest();
		assertThat(sent.isNotification()).isTrue();
		assertThat(client.pendingCount()).isZero();
	}

	@Test
	void standardMethodsUseProtocolNamesAndParameters() {
		RequestIdGenerator ids = RequestIdGenerator.ofIncremental();
		client = YamlRpcClient.builder().transport(transport).requestIdGenerator(ids).build();
		client.connect(ENDPOINT);

		CompletableFuture.runAsync(() -> client.nodeExecute(Map.of("path", "src"), "ci"));
		YamlRpcRequest execute = transport.awaitSentRequest();
		transport.simulateIncomingMessage(YamlRpcSchema.response(null, execute.id()));

		CompletableFuture.runAsync(() -> client.nodeShutdown());
		YamlRpcRequest shutdown = transport.awaitSentRequest();
		transport.simulateIncomingMessage(YamlRpcSchema.response(null, shutdown.id()));

		assertThat(execute.method()).isEqualTo(YamlRpcSchema.METHOD_NODE_EXECUTE);
		assertThat(execute.params()).isEqualTo(Map.of("input", Map.of("path", "src"), "context", "ci"));
		assertThat(shutdown.method()).isEqualTo(YamlRpcSchema.METHOD_NODE_SHUTDOWN);
		assertThat(shutdown.params()).isEqualTo(Map.of("timeout_seconds", 10));
	}

	@Test
	void builderRejectsNonPositiveTimeout() {
		assertThatIllegalArgumentException()
			.isThrownBy(() -> YamlRpcClient.builder().requestTimeout(Duration.ZERO));
	}

}
