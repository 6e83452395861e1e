package dev.stepbot.http;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A fully buffered HTTP response. Header names are lower-cased.
 * The body is copied in and out, and compared by content.
 */
public record TransportResponse(
    int statusCode,
    Map<String, List<String>> headers,
    byte[] body
) {
    public TransportResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body.clone();
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /** First value of the named header, or null. */
    public String header(String name) {
        List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TransportResponse other)) {
            return false;
        }
        return statusCode == other.statusCode
            && headers.equals(other.headers)
            && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(statusCode, headers) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "TransportResponse[statusCode=" + statusCode + ", headers=" + headers
            + ", body=" + body.length + " bytes]";
    }
}
