package io.relayhive.core.management;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relayhive.core.config.ManagementSettings;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin client for the parts of the RabbitMQ management HTTP API used to configure retry queues.
 * <p>
 * Every call is best effort: transport failures and unexpected status codes are logged and
 * reported as {@code false} or an empty result, never thrown.
 */
public class RabbitManagementClient {

    private static final Logger log = LoggerFactory.getLogger(RabbitManagementClient.class);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final int NOT_FOUND = 404;

    private final HttpClient http;
    private final ObjectMapper json;
    private final String baseUrl;
    private final String vhost;
    private final String authorization;
    private final Duration requestTimeout;

    public RabbitManagementClient(ManagementSettings settings, HttpClient http, ObjectMapper json) {
        this(settings, http, json, DEFAULT_REQUEST_TIMEOUT);
    }

    public RabbitManagementClient(ManagementSettings settings,
                                  HttpClient http,
                                  ObjectMapper json,
                                  Duration requestTimeout) {
        Objects.requireNonNull(settings, "settings");
        this.http = Objects.requireNonNull(http, "http");
        this.json = Objects.requireNonNull(json, "json");
        this.baseUrl = stripTrailingSlash(settings.url().toString());
        this.vhost = settings.vhost();
        this.authorization = basicAuth(settings.username(), settings.password());
        this.requestTimeout = resolveTimeout(requestTimeout, DEFAULT_REQUEST_TIMEOUT);
    }

    public static RabbitManagementClient create(ManagementSettings settings, ObjectMapper json) {
        HttpClient http = HttpClient.newBuilder()
            .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
            .build();
        return new RabbitManagementClient(settings, http, json);
    }

    /**
     * Returns whether the management plugin answers {@code GET /api/overview} with a 2xx status.
     */
    public boolean isAvailable() {
        Optional<HttpResponse<String>> response = send(request("/api/overview").GET(), "overview");
        return response.map(r -> isSuccess(r.statusCode())).orElse(false);
    }

    public boolean putOperatorPolicy(OperatorPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        ObjectNode body = json.createObjectNode();
        body.put("pattern", policy.pattern());
        body.set("definition", json.valueToTree(policy.definition()));
        body.put("priority", policy.priority());
        body.put("apply-to", policy.applyTo());
        String label = "operator policy " + policy.name();
        Optional<HttpResponse<String>> response = sendJson(operatorPolicyPath(policy.name()), label, body);
        if (response.isEmpty()) {
            return false;
        }
        int status = response.get().statusCode();
        if (!isSuccess(status)) {
            log.error("{} PUT status {} body {}", label, status, response.get().body());
            return false;
        }
        log.info("applied {} pattern={} definition={}", label, policy.pattern(), policy.definition());
        return true;
    }

    public Optional<OperatorPolicy> getOperatorPolicy(String name) {
        String label = "operator policy " + name;
        return fetch(operatorPolicyPath(name), label)
            .flatMap(node -> read(node, OperatorPolicy.class, label));
    }

    public boolean deleteOperatorPolicy(String name) {
        return delete(operatorPolicyPath(name), "operator policy " + name);
    }

    /**
     * Stores {@code value} under the global parameter {@code name}, replacing any previous value.
     */
    public boolean putGlobalParameter(String name, JsonNode value) {
        Objects.requireNonNull(value, "value");
        ObjectNode body = json.createObjectNode();
        body.put("name", name);
        body.set("value", value);
        String label = "global parameter " + name;
        Optional<HttpResponse<String>> response = sendJson(globalParameterPath(name), label, body);
        if (response.isEmpty()) {
            return false;
        }
        int status = response.get().statusCode();
        if (!isSuccess(status)) {
            log.error("{} PUT status {} body {}", label, status, response.get().body());
            return false;
        }
        log.info("stored {}", label);
        return true;
    }

    /**
     * Returns the {@code value} of a global parameter, or empty when it does not exist.
     */
    public Optional<JsonNode> getGlobalParameter(String name) {
        return fetch(globalParameterPath(name), "global parameter " + name)
            .map(node -> node.get("value"))
            .filter(value -> value != null && !value.isNull());
    }

    public boolean deleteGlobalParameter(String name) {
        return delete(globalParameterPath(name), "global parameter " + name);
    }

    private <T> Optional<T> read(JsonNode node, Class<T> type, String label) {
        try {
            return Optional.of(json.treeToValue(node, type));
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("{} could not be read: {}", label, ex.getMessage());
            return Optional.empty();
        }
    }

    private Optional<JsonNode> fetch(String path, String label) {
        Optional<HttpResponse<String>> response = send(request(path).GET(), label);
        if (response.isEmpty()) {
            return Optional.empty();
        }
        int status = response.get().statusCode();
        if (status == NOT_FOUND) {
            log.debug("{} not found", label);
            return Optional.empty();
        }
        if (!isSuccess(status)) {
            log.error("{} GET status {} body {}", label, status, response.get().body());
            return Optional.empty();
        }
        try {
            return Optional.of(json.readTree(response.get().body()));
        } catch (JsonProcessingException ex) {
            log.warn("{} returned invalid JSON: {}", label, ex.getMessage());
            return Optional.empty();
        }
    }

    private boolean delete(String path, String label) {
        Optional<HttpResponse<String>> response = send(request(path).DELETE(), label);
        if (response.isEmpty()) {
            return false;
        }
        int status = response.get().statusCode();
        if (!isSuccess(status) && status != NOT_FOUND) {
            log.error("{} DELETE status {} body {}", label, status, response.get().body());
            return false;
        }
        log.info("deleted {} status={}", label, status);
        return true;
    }

    private Optional<HttpResponse<String>> sendJson(String path, String label, JsonNode body) {
        String payload;
        try {
            payload = json.writeValueAsString(body);
        } catch (JsonProcessingException ex) {
            log.error("{} could not be serialised", label, ex);
            return Optional.empty();
        }
        HttpRequest.Builder builder = request(path)
            .header("Content-Type", "application/json")
            .PUT(HttpRequest.BodyPublishers.ofString(payload));
        return send(builder, label);
    }

    private Optional<HttpResponse<String>> send(HttpRequest.Builder builder, String label) {
        HttpRequest request = builder.build();
        log.debug("{} {} {}", request.method(), label, request.uri());
        try {
            return Optional.of(http.send(request, HttpResponse.BodyHandlers.ofString()));
        } catch (IOException ex) {
            log.warn("{} {} failed: {}", request.method(), label, ex.toString());
            return Optional.empty();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("{} {} interrupted", request.method(), label);
            return Optional.empty();
        }
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .header("Accept", "application/json")
            .header("Authorization", authorization)
            .timeout(requestTimeout);
    }

    private String operatorPolicyPath(String name) {
        return "/api/operator-policies/" + encode(vhost) + "/" + encode(requireText(name, "name"));
    }

    private String globalParameterPath(String name) {
        return "/api/global-parameters/" + encode(requireText(name, "name"));
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String basicAuth(String username, String password) {
        String credentials = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static Duration resolveTimeout(Duration candidate, Duration fallback) {
        if (candidate == null || candidate.isZero() || candidate.isNegative()) {
            return fallback;
        }
        return candidate;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        return value;
    }
}
