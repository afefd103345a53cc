package de.bycsitsm.calendar;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JSON-over-HTTP client for calendar provider APIs, built on Java's
 * {@link HttpClient}. Requests are authorized with a Bearer token.
 * <p>
 * Response status codes are mapped onto the calendar exceptions:
 * 401, 429 and 5xx mean the provider is unavailable, 404 and 410 mean the
 * event is gone, any other non-2xx status means the provider rejected the request.
 */
public class ProviderHttpClient {

    private static final Logger log = LoggerFactory.getLogger(ProviderHttpClient.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private static final String JSON = "application/json";

    private final String serviceName;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public ProviderHttpClient(String serviceName, ObjectMapper objectMapper) {
        this.serviceName = serviceName;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public JsonNode get(URI uri, String accessToken, Map<String, String> headers) {
        var builder = authorized(uri, accessToken).GET();
        headers.forEach(builder::header);
        return exchange(builder.build());
    }

    public JsonNode post(URI uri, String accessToken, JsonNode body) {
        return exchange(authorized(uri, accessToken)
                .header("Content-Type", JSON)
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build());
    }

    public JsonNode patch(URI uri, String accessToken, JsonNode body) {
        return exchange(authorized(uri, accessToken)
                .header("Content-Type", JSON)
                .method("PATCH", HttpRequest.BodyPublishers.ofString(body.toString()))
                .build());
    }

    public void delete(URI uri, String accessToken) {
        exchange(authorized(uri, accessToken).DELETE().build());
    }

    /**
     * Posts an {@code application/x-www-form-urlencoded} body without authorization,
     * as used by OAuth token endpoints.
     */
    public JsonNode postForm(URI uri, Map<String, String> form) {
        var body = form.entrySet().stream()
                .map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue()))
                .collect(Collectors.joining("&"));
        return exchange(HttpRequest.newBuilder()
                .uri(uri)
                .header("Accept", JSON)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .timeout(REQUEST_TIMEOUT)
                .build());
    }

    /**
     * Builds a URI from a base URL and query parameters, encoding the values.
     */
    public static URI uri(String url, Map<String, String> query) {
        if (query.isEmpty()) {
            return URI.create(url);
        }
        var queryString = query.entrySet().stream()
                .map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue()))
                .collect(Collectors.joining("&"));
        return URI.create(url + "?" + queryString);
    }

    /**
     * Encodes a single path segment or query value.
     */
    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private HttpRequest.Builder authorized(URI uri, String accessToken) {
        return HttpRequest.newBuilder()
                .uri(uri)
                .header("Accept", JSON)
                .header("Authorization", "Bearer " + accessToken)
                .timeout(REQUEST_TIMEOUT);
    }

    private JsonNode exchange(HttpRequest request) {
        log.debug("Sending {} to {}", request.method(), request.uri());
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderUnavailableException(serviceName + " could not be reached: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException("Interrupted while calling " + serviceName + ".", e);
        }

        var status = response.statusCode();
        if (status >= 200 && status < 300) {
            return parse(response.body());
        }
        log.debug("{} answered {} {} with status {}: {}", serviceName, request.method(), request.uri(),
                status, response.body());
        if (status == 429 || status >= 500) {
            throw new ProviderUnavailableException(
                    serviceName + " is temporarily unavailable (status " + status + ").");
        }
        switch (status) {
            case 401 -> throw new ProviderUnavailableException(
                    "Authentication with " + serviceName + " failed. Please reconnect the calendar.");
            case 404, 410 -> throw new EventNotFoundException("Event not found in " + serviceName + ".");
            default -> throw new ProviderRejectedException(
                    serviceName + " returned status " + status + ": " + abbreviate(response.body()));
        }
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderRejectedException("Failed to parse response from " + serviceName + ": "
                    + e.getOriginalMessage(), e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
