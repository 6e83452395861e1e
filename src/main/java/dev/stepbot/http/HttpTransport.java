package dev.stepbot.http;

import org.apache.hc.client5.http.cookie.CookieStore;
import org.apache.hc.core5.http.ClassicHttpRequest;

import java.io.IOException;

/**
 * Sends one built request and buffers its response.
 * Redirects, connection reuse and TLS are the implementation's concern.
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * @param request     the request to send, used once
     * @param settings    proxy, user agent, compression and connect timeout
     * @param cookieStore cookies shared by the owning requester
     * @return the buffered response, whatever its status
     * @throws IOException on any failure to send or receive, including timeouts
     */
    TransportResponse execute(ClassicHttpRequest request, RequesterSettings settings,
                              CookieStore cookieStore) throws IOException;
}
