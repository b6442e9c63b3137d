package com.hpcwatch.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hpcwatch.config.SourceConfig.MetricsProperties;
import com.hpcwatch.source.TimeRanges.QueryWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Client for the Prometheus-compatible HTTP API of the metrics backend
 * ({@code /api/v1/query} and {@code /api/v1/query_range}).
 * <p>
 * Every call completes normally with a {@link FetchResult}; transport failures, non-2xx
 * responses, {@code status != "success"} envelopes and unreadable bodies all become a
 * {@link FetchError}.
 */
@Slf4j
@Component
public class MetricsSourceAdapter {

    private static final String INSTANT_PATH = "/api/v1/query";
    private static final String RANGE_PATH = "/api/v1/query_range";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final String authorization;

    public MetricsSourceAdapter(MetricsProperties properties, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(properties.getBaseUrl());
        this.requestTimeout = properties.getRequestTimeout();
        this.authorization = authorizationHeader(properties);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        log.info("MetricsSourceAdapter initialized for {} with {}ms timeout, auth={}",
                baseUrl, requestTimeout.toMillis(), authorization == null ? "none" : authorization.split(" ")[0]);
    }

    public CompletableFuture<FetchResult<List<MetricSeries>>> instant(String query) {
        return send(query, INSTANT_PATH + "?query=" + encode(query));
    }

    public CompletableFuture<FetchResult<List<MetricSeries>>> range(String query, QueryWindow window) {
        String pathAndQuery = RANGE_PATH
                + "?query=" + encode(query)
                + "&start=" + window.start()
                + "&end=" + window.end()
                + "&step=" + encode(window.step());
        return send(query, pathAndQuery);
    }

    private CompletableFuture<FetchResult<List<MetricSeries>>> send(String query, String pathAndQuery) {
        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + pathAndQuery))
                    .timeout(requestTimeout)
                    .header("Accept", "application/json")
                    .GET();
            if (authorization != null) {
                builder.header("Authorization", authorization);
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(FetchResult.failure(FetchError.rejected(query, e)));
        }

        log.debug("Querying metrics backend: {}", request.uri());

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, throwable) -> {
                    if (throwable != null) {
                        Throwable cause = unwrap(throwable);
                        log.debug("Metrics query '{}' failed: {}", query, cause.toString());
                        return FetchResult.<List<MetricSeries>>failure(FetchError.unreachable(query, cause));
                    }
                    return parse(query, response);
                });
    }

    private FetchResult<List<MetricSeries>> parse(String query, HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            return FetchResult.failure(FetchError.rejected(query, "HTTP " + status));
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            return FetchResult.failure(FetchError.malformed(query, "unreadable body: " + e.getOriginalMessage()));
        }
        if (root == null || !root.isObject()) {
            return FetchResult.failure(FetchError.malformed(query, "response is not a JSON object"));
        }

        String envelopeStatus = root.path("status").asText("");
        if (!"success".equals(envelopeStatus)) {
            String error = root.path("error").asText("status=" + envelopeStatus);
            return FetchResult.failure(FetchError.rejected(query, error));
        }

        JsonNode result = root.path("data").path("result");
        if (!result.isArray()) {
            return FetchResult.failure(FetchError.malformed(query, "missing data.result array"));
        }

        List<MetricSeries> series = new ArrayList<>(result.size());
        for (JsonNode item : result) {
            series.add(toSeries(item));
        }
        return FetchResult.success(series);
    }

    private MetricSeries toSeries(JsonNode item) {
        Map<String, String> labels = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = item.path("metric").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            labels.put(field.getKey(), field.getValue().asText());
        }

        List<MetricPoint> points = new ArrayList<>();
        if (item.has("value")) {
            points.add(toPoint(item.get("value")));
        }
        JsonNode values = item.path("values");
        if (values.isArray()) {
            for (JsonNode pair : values) {
                points.add(toPoint(pair));
            }
        }
        return new MetricSeries(labels, points);
    }

    private static MetricPoint toPoint(JsonNode pair) {
        if (pair == null || !pair.isArray() || pair.size() != 2 || !pair.get(0).isNumber()) {
            return new MetricPoint(0, null);
        }
        JsonNode value = pair.get(1);
        return new MetricPoint(pair.get(0).asLong(), value.isNull() ? null : value.asText());
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String authorizationHeader(MetricsProperties properties) {
        if (properties.getToken() != null && !properties.getToken().isBlank()) {
            return "Bearer " + properties.getToken();
        }
        if (properties.getUsername() != null && !properties.getUsername().isBlank()
                && properties.getPassword() != null) {
            String credentials = properties.getUsername() + ":" + properties.getPassword();
            return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        }
        return null;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
