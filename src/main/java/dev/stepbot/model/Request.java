package dev.stepbot.model;

import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHost;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable description of a single HTTP call produced by a step.
 * Every {@code with*} method returns a new instance; the receiver is never modified.
 */
public record Request(
    String method,
    String url,
    Map<String, List<String>> headers,
    Duration timeout,
    String proxy, // nullable — e.g. "http://proxy.local:3128"
    List<Integer> statusCodes, // nullable — falls back to the 2xx range
    boolean compression,
    String userAgent,
    String body, // nullable
    String contentType // nullable
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_USER_AGENT = "step-bot/0.1";

    private static final Set<String> METHODS =
        Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS", "TRACE");

    public Request {
        if (method == null || !METHODS.contains(method.toUpperCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Unsupported HTTP method: " + method);
        }
        method = method.toUpperCase(Locale.ROOT);
        requireHttpUrl(url);
        // the transport works in whole milliseconds, and zero means no deadline there
        if (timeout == null || timeout.toMillis() < 1) {
            throw new IllegalArgumentException("Timeout must be at least 1 ms: " + timeout);
        }
        requireProxy(proxy);
        requireContentType(contentType);
        headers = copyHeaders(headers);
        statusCodes = statusCodes == null ? null : List.copyOf(statusCodes);
        userAgent = userAgent == null ? DEFAULT_USER_AGENT : userAgent;
    }

    /**
     * A request with default settings: 30 second timeout, compression on, no proxy,
     * and any 2xx status accepted.
     */
    public static Request of(String method, String url) {
        return new Request(method, url, Map.of(), DEFAULT_TIMEOUT, null, null,
            true, DEFAULT_USER_AGENT, null, null);
    }

    public static Request get(String url) {
        return of("GET", url);
    }

    public Request withHeaders(Map<String, List<String>> headers) {
        return new Request(method, url, headers, timeout, proxy, statusCodes,
            compression, userAgent, body, contentType);
    }

    /** Adds one header value, keeping any values already present under the same name. */
    public Request withHeader(String name, String value) {
        var merged = new LinkedHashMap<String, List<String>>(headers);
        var values = new ArrayList<>(headers.getOrDefault(name, List.of()));
        values.add(value);
        merged.put(name, values);
        return withHeaders(merged);
    }

    public Request withTimeout(Duration timeout) {
        return new Request(method, url, headers, timeout, proxy, statusCodes,
            compression, userAgent, body, contentType);
    }

    public Request withProxy(String proxy) {
        return new Request(method, url, headers, timeout, proxy, statusCodes,
            compression, userAgent, body, contentType);
    }

    public Request withStatusCodes(List<Integer> statusCodes) {
        return new Request(method, url, headers, timeout, proxy, statusCodes,
            compression, userAgent, body, contentType);
    }

    public Request withCompression(boolean compression) {
        return new Request(method, url, headers, timeout, proxy, statusCodes,
            compression, userAgent, body, contentType);
    }

    public Request withUserAgent(String userAgent) {
        return new Request(method, url, headers, timeout, proxy, statusCodes,
            compression, userAgent, body, contentType);
    }

    public Request withBody(String body, String contentType) {
        return new Request(method, url, headers, timeout, proxy, statusCodes,
            compression, userAgent, body, contentType);
    }

    public boolean hasStatusCodes() {
        return statusCodes != null;
    }

    /**
     * Parse a block of {@code Name: value} lines into a header map.
     * Blank lines are skipped; repeated names accumulate values in order.
     */
    public static Map<String, List<String>> parseHeaders(String block) {
        var headers = new LinkedHashMap<String, List<String>>();
        if (block == null) {
            return headers;
        }
        for (String line : block.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int colon = trimmed.indexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("Malformed header line: " + trimmed);
            }
            String name = trimmed.substring(0, colon).trim();
            String value = trimmed.substring(colon + 1).trim();
            headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        }
        return headers;
    }

    private static void requireHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL is required");
        }
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid URL: " + url, e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
            || uri.getHost() == null) {
            throw new IllegalArgumentException("URL must be an absolute http(s) URL: " + url);
        }
    }

    private static void requireProxy(String proxy) {
        if (proxy == null || proxy.isBlank()) {
            return;
        }
        try {
            HttpHost.create(proxy);
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid proxy: " + proxy, e);
        }
    }

    private static void requireContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return;
        }
        try {
            ContentType.parse(contentType);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid content type: " + contentType, e);
        }
    }

    private static Map<String, List<String>> copyHeaders(Map<String, List<String>> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        var copy = new LinkedHashMap<String, List<String>>();
        headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }
}
