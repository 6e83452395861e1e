package dev.stepbot.http;

import dev.stepbot.model.Request;
import org.apache.hc.client5.http.ConnectTimeoutException;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.cookie.BasicCookieStore;
import org.apache.hc.client5.http.cookie.CookieStore;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Holds transport settings and a cookie store, and turns a {@link Request}
 * into a transport call.
 */
public final class HttpRequester {

    private final RequesterSettings settings = new RequesterSettings();
    private final CookieStore cookieStore = new BasicCookieStore();
    private final HttpTransport transport;

    public HttpRequester() {
        this(new ApacheHttpTransport());
    }

    public HttpRequester(HttpTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public RequesterSettings settings() { return settings; }
    public CookieStore cookieStore() { return cookieStore; }

    /**
     * Build the transport request for a descriptor: method, URL, headers, body and
     * the response deadline. Proxy, user agent and compression come from the settings.
     */
    public ClassicHttpRequest build(Request request) {
        HttpUriRequestBase built = new HttpUriRequestBase(request.method(), URI.create(request.url()));
        request.headers().forEach((name, values) -> values.forEach(value -> built.addHeader(name, value)));
        if (request.body() != null) {
            built.setEntity(new StringEntity(request.body(), contentType(request.contentType())));
        }
        built.setConfig(RequestConfig.custom()
            .setResponseTimeout(Timeout.ofMilliseconds(request.timeout().toMillis()))
            .build());
        return built;
    }

    public TransportResponse send(ClassicHttpRequest request) throws IOException {
        return transport.execute(request, settings, cookieStore);
    }

    /**
     * True when the failure, or any of its causes, is a connect or read deadline.
     */
    public static boolean isTimeout(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof ConnectTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static ContentType contentType(String value) {
        if (value == null || value.isBlank()) {
            return ContentType.TEXT_PLAIN.withCharset(StandardCharsets.UTF_8);
        }
        ContentType parsed = ContentType.parse(value);
        return parsed.getCharset() == null ? parsed.withCharset(StandardCharsets.UTF_8) : parsed;
    }
}
