package dev.stepbot.http;

import dev.stepbot.model.Request;
import org.apache.hc.client5.http.ConnectTimeoutException;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpRequesterTest {

    @Test
    void buildsMethodUrlHeadersAndDeadline() throws Exception {
        var requester = new HttpRequester((request, settings, cookies) -> null);
        Request descriptor = Request.of("post", "http://example.test/login?next=home")
            .withHeader("Accept", "text/html")
            .withHeader("Accept", "application/json")
            .withTimeout(Duration.ofMillis(1500));

        ClassicHttpRequest built = requester.build(descriptor);

        assertThat(built.getMethod()).isEqualTo("POST");
        assertThat(built.getUri().toString()).isEqualTo("http://example.test/login?next=home");
        assertThat(built.getHeaders("Accept")).extracting(h -> h.getValue())
            .containsExactly("text/html", "application/json");
        assertThat(((HttpUriRequestBase) built).getConfig().getResponseTimeout().toMilliseconds())
            .isEqualTo(1500L);
        assertThat(built.getEntity()).isNull();
    }

    @Test
    void buildsBodyWithUtf8DefaultCharset() throws Exception {
        var requester = new HttpRequester((request, settings, cookies) -> null);

        ClassicHttpRequest built = requester.build(Request.of("POST", "http://example.test/form")
            .withBody("{\"name\":\"zoë\"}", "application/json"));

        assertThat(built.getEntity().getContentType()).isEqualTo("application/json; charset=UTF-8");
        assertThat(EntityUtils.toString(built.getEntity())).isEqualTo("{\"name\":\"zoë\"}");
    }

    @Test
    void sendPassesSettingsAndCookieStoreToTransport() throws IOException {
        var seenSettings = new AtomicReference<RequesterSettings>();
        var requester = new HttpRequester((request, settings, cookies) -> {
            seenSettings.set(settings);
            assertThat(cookies).isNotNull();
            return new TransportResponse(204, null, null);
        });
        requester.settings().setUserAgent("crawler/1.0");

        TransportResponse response = requester.send(requester.build(Request.get("http://example.test/")));

        assertThat(response.statusCode()).isEqualTo(204);
        assertThat(response.body()).isEmpty();
        assertThat(seenSettings.get().userAgent()).isEqualTo("crawler/1.0");
    }

    @Test
    void classifiesTimeoutsIncludingWrappedOnes() {
        assertThat(HttpRequester.isTimeout(new SocketTimeoutException("Read timed out"))).isTrue();
        assertThat(HttpRequester.isTimeout(new ConnectTimeoutException("Connect timed out"))).isTrue();
        assertThat(HttpRequester.isTimeout(new IOException("wrapped", new SocketTimeoutException()))).isTrue();
        assertThat(HttpRequester.isTimeout(new ConnectException("Connection refused"))).isFalse();
        assertThat(HttpRequester.isTimeout(new IOException("reset"))).isFalse();
    }

    @Test
    void parsesProxyAndRejectsMalformedOne() {
        var settings = new RequesterSettings();

        settings.setProxy("http://proxy.local:3128");
        assertThat(settings.proxy().getHostName()).isEqualTo("proxy.local");
        assertThat(settings.proxy().getPort()).isEqualTo(3128);

        settings.setProxy(null);
        assertThat(settings.proxy()).isNull();

        assertThatThrownBy(() -> settings.setProxy("http://proxy.local:notaport"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
