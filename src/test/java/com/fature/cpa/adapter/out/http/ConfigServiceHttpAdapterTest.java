package com.fature.cpa.adapter.out.http;

import com.fature.cpa.application.port.out.ConfigurationOrigin.OriginConfiguration;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.client.WebClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for ConfigServiceHttpAdapter against a local stand-in of the configuration service
 */
class ConfigServiceHttpAdapterTest {

    private Vertx vertx;
    private HttpServer server;
    private WebClient webClient;
    private ConfigServiceHttpAdapter adapter;
    private volatile boolean healthy = true;

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        Router router = Router.router(vertx);

        router.get("/api/v1/configurations/cpa.validacao.opcao1.deposito_minimo").handler(ctx -> ctx.json(
                new JsonObject()
                        .put("success", true)
                        .put("data", new JsonObject().put("value", "30.0").put("data_type", "float"))));
        router.get("/api/v1/configurations/cpa.validacao.prazo_dias").handler(ctx -> ctx.json(
                new JsonObject()
                        .put("success", true)
                        .put("data", new JsonObject().put("value", 30).put("data_type", "int"))));
        router.get("/api/v1/configurations/cpa.validacao.timezone").handler(ctx -> ctx.json(
                new JsonObject().put("success", false).put("message", "Configuration not found")));
        router.get("/api/v1/configurations/cpa.validacao.broken").handler(ctx -> ctx.response()
                .putHeader("Content-Type", "application/json")
                .end("{not json"));
        router.get("/api/v1/configurations/cpa.validacao.unstable").handler(ctx -> ctx.response()
                .setStatusCode(503)
                .end());
        router.get("/health").handler(ctx -> ctx.response().setStatusCode(healthy ? 200 : 500).end());

        CountDownLatch latch = new CountDownLatch(1);
        vertx.createHttpServer()
                .requestHandler(router)
                .listen(0)
                .onSuccess(s -> {
                    server = s;
                    latch.countDown();
                });
        assertTrue(latch.await(5, TimeUnit.SECONDS), "Stub configuration service did not start");

        webClient = WebClient.create(vertx);
        adapter = new ConfigServiceHttpAdapter(
                webClient,
                "http://localhost:" + server.actualPort() + "/",
                "/api/v1/configurations",
                Duration.ofSeconds(5),
                Duration.ofSeconds(3)
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        if (webClient != null) {
            webClient.close();
        }
        if (vertx != null) {
            CountDownLatch latch = new CountDownLatch(1);
            vertx.close().onComplete(ar -> latch.countDown());
            latch.await(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void fetch_returnsValueAndDataType() throws Exception {
        OriginConfiguration answer = await(adapter.fetch("cpa.validacao.opcao1.deposito_minimo"));

        assertTrue(answer.success());
        assertEquals("30.0", answer.value());
        assertEquals("float", answer.dataType());
    }

    @Test
    void fetch_stringifiesScalarValues() throws Exception {
        OriginConfiguration answer = await(adapter.fetch("cpa.validacao.prazo_dias"));

        assertEquals("30", answer.value());
        assertEquals("int", answer.dataType());
    }

    @Test
    void fetch_unsuccessfulAnswerIsNotFound() throws Exception {
        assertFalse(await(adapter.fetch("cpa.validacao.timezone")).success());
    }

    @Test
    void fetch_unknownRouteIsNotFound() throws Exception {
        assertFalse(await(adapter.fetch("cpa.validacao.unknown")).success());
    }

    @Test
    void fetch_malformedBodyFails() {
        assertThrows(ExecutionException.class, () -> await(adapter.fetch("cpa.validacao.broken")));
    }

    @Test
    void fetch_serverErrorFails() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> await(adapter.fetch("cpa.validacao.unstable")));
        assertTrue(error.getCause().getMessage().contains("503"));
    }

    @Test
    void ping_followsHealthEndpoint() throws Exception {
        await(adapter.ping());

        healthy = false;
        assertThrows(ExecutionException.class, () -> await(adapter.ping()));
    }

    @Test
    void location_hasNoTrailingSlash() {
        assertEquals("http://localhost:" + server.actualPort(), adapter.location());
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }
}
