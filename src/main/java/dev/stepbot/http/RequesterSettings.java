package dev.stepbot.http;

import dev.stepbot.model.Request;
import org.apache.hc.core5.http.HttpHost;

import java.net.URISyntaxException;
import java.time.Duration;

/**
 * Transport-level settings owned by an {@link HttpRequester}.
 */
public final class RequesterSettings {
    private HttpHost proxy;
    private String userAgent = Request.DEFAULT_USER_AGENT;
    private boolean compression = true;
    private Duration connectTimeout = Request.DEFAULT_TIMEOUT;

    public HttpHost proxy() { return proxy; }
    public String userAgent() { return userAgent; }
    public boolean compression() { return compression; }
    public Duration connectTimeout() { return connectTimeout; }

    /**
     * Route requests through the given proxy, e.g. {@code http://proxy.local:3128}.
     * A null value clears the proxy.
     */
    public void setProxy(String proxy) {
        if (proxy == null || proxy.isBlank()) {
            this.proxy = null;
            return;
        }
        try {
            this.proxy = HttpHost.create(proxy);
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid proxy: " + proxy, e);
        }
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public void setCompression(boolean compression) {
        this.compression = compression;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }
}
