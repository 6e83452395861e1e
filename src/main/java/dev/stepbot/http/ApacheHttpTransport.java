package dev.stepbot.http;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.cookie.CookieStore;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link HttpTransport} backed by Apache HttpClient 5.
 * A client is built from the settings for each send and closed afterwards.
 * Redirects are followed; failed sends are never retried.
 */
public final class ApacheHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(ApacheHttpTransport.class);

    @Override
    public TransportResponse execute(ClassicHttpRequest request, RequesterSettings settings,
                                     CookieStore cookieStore) throws IOException {
        log.debug("HTTP {} {} proxy={} compression={}", request.getMethod(), request.getRequestUri(),
            settings.proxy(), settings.compression());
        try (CloseableHttpClient client = buildClient(settings, cookieStore)) {
            return client.execute(request, ApacheHttpTransport::buffer);
        }
    }

    private static CloseableHttpClient buildClient(RequesterSettings settings, CookieStore cookieStore) {
        Timeout connectTimeout = Timeout.ofMilliseconds(settings.connectTimeout().toMillis());
        HttpClientBuilder builder = HttpClients.custom()
            .setDefaultCookieStore(cookieStore)
            .setUserAgent(settings.userAgent())
            .disableAutomaticRetries()
            .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                    .setConnectTimeout(connectTimeout)
                    .setSocketTimeout(connectTimeout)
                    .build())
                .build());
        if (!settings.compression()) {
            builder.disableContentCompression();
        }
        if (settings.proxy() != null) {
            builder.setProxy(settings.proxy());
        }
        return builder.build();
    }

    private static TransportResponse buffer(ClassicHttpResponse response) throws IOException {
        byte[] body = response.getEntity() == null
            ? new byte[0]
            : EntityUtils.toByteArray(response.getEntity());
        return new TransportResponse(response.getCode(), lowercaseHeaders(response), body);
    }

    private static Map<String, List<String>> lowercaseHeaders(ClassicHttpResponse response) {
        Header[] headers = response.getHeaders();
        if (headers == null || headers.length == 0) {
            return Map.of();
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (Header header : headers) {
            String key = header.getName() == null ? "" : header.getName().toLowerCase(Locale.ROOT);
            result.computeIfAbsent(key, k -> new ArrayList<>()).add(header.getValue());
        }
        return result;
    }
}
