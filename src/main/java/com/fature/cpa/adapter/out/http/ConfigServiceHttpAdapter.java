package com.fature.cpa.adapter.out.http;

import com.fature.cpa.application.port.out.ConfigurationOrigin;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * HTTP adapter for the configuration service.
 * Implements ConfigurationOrigin output port
 * <p>
 * {@code GET {baseUrl}{configurationsPath}/{key}} answers
 * {@code {"success": bool, "data": {"value": "...", "data_type": "float|int|bool|json|..."}}}.
 */
@Slf4j
public class ConfigServiceHttpAdapter implements ConfigurationOrigin {

    private final WebClient webClient;
    private final String baseUrl;
    private final String configurationsPath;
    private final Duration requestTimeout;
    private final Duration healthTimeout;

    public ConfigServiceHttpAdapter(
            WebClient webClient,
            String baseUrl,
            String configurationsPath,
            Duration requestTimeout,
            Duration healthTimeout
    ) {
        this.webClient = webClient;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.configurationsPath = configurationsPath;
        this.requestTimeout = requestTimeout;
        this.healthTimeout = healthTimeout;
    }

    @Override
    public Future<OriginConfiguration> fetch(String key) {
        String url = baseUrl + configurationsPath + "/" + key;
        log.debug("Fetching configuration {} from {}", key, url);

        return webClient.getAbs(url)
                .timeout(requestTimeout.toMillis())
                .send()
                .compose(response -> parse(key, response));
    }

    @Override
    public Future<Void> ping() {
        return webClient.getAbs(baseUrl + "/health")
                .timeout(healthTimeout.toMillis())
                .send()
                .compose(response -> response.statusCode() == 200
                        ? Future.<Void>succeededFuture()
                        : Future.<Void>failedFuture("Health endpoint returned status " + response.statusCode()));
    }

    @Override
    public String location() {
        return baseUrl;
    }

    private Future<OriginConfiguration> parse(String key, HttpResponse<Buffer> response) {
        if (response.statusCode() == 404) {
            return Future.succeededFuture(OriginConfiguration.notFound());
        }
        if (response.statusCode() != 200) {
            return Future.failedFuture("Configuration service returned status "
                    + response.statusCode() + " for " + key);
        }

        JsonObject body;
        try {
            body = response.bodyAsJsonObject();
        } catch (DecodeException e) {
            return Future.failedFuture(new IllegalStateException("Malformed configuration response for " + key, e));
        }
        if (body == null) {
            return Future.failedFuture("Empty configuration response for " + key);
        }

        if (!body.getBoolean("success", false)) {
            return Future.succeededFuture(OriginConfiguration.notFound());
        }

        JsonObject data = body.getJsonObject("data");
        if (data == null) {
            return Future.failedFuture("Configuration response for " + key + " has no data");
        }
        return Future.succeededFuture(new OriginConfiguration(
                true,
                stringify(data.getValue("value")),
                data.getString("data_type")
        ));
    }

    // Some deployments serve the value as a JSON scalar instead of a string
    private static String stringify(Object value) {
        return value == null ? null : value.toString();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
