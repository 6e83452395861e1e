package dev.stepbot.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.stepbot.http.HttpRequester;
import dev.stepbot.http.TransportResponse;
import dev.stepbot.model.Request;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ContentType;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Mutable record of one step execution: the request, the buffered response,
 * timing, and the next-step hint set by the step's callbacks.
 *
 * <p>Owned by a single execution; not thread-safe.
 */
public final class Context {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Request request;
    private final HttpRequester httpRequester;
    private final List<Integer> statusCodes; // nullable
    private String currentStep;
    private ClassicHttpRequest pendingRequest;
    private TransportResponse rawResponse;
    private int statusCode;
    private Map<String, List<String>> responseHeaders = Map.of();
    private byte[] response;
    private String nextStep;
    private Duration nextDelay = Duration.ZERO;
    private long timeElapsed;

    /**
     * Create a context for the request, with the transport request built and pending.
     */
    public Context(Request request, HttpRequester httpRequester) {
        this.request = Objects.requireNonNull(request, "request");
        this.httpRequester = Objects.requireNonNull(httpRequester, "httpRequester");
        this.statusCodes = request.statusCodes();
        this.pendingRequest = httpRequester.build(request);
    }

    public Request request() { return request; }
    public HttpRequester httpRequester() { return httpRequester; }
    public List<Integer> statusCodes() { return statusCodes; }

    /** Name of the step that produced this context, or null outside the driver. */
    public String currentStep() { return currentStep; }

    void setCurrentStep(String currentStep) {
        this.currentStep = currentStep;
    }

    public boolean hasPendingRequest() {
        return pendingRequest != null;
    }

    /**
     * Hand over the built transport request. A context sends at most once.
     *
     * @throws IllegalStateException if the request was already taken
     */
    ClassicHttpRequest takePendingRequest() {
        if (pendingRequest == null) {
            throw new IllegalStateException("Request already sent for step " + currentStep);
        }
        ClassicHttpRequest taken = pendingRequest;
        pendingRequest = null;
        return taken;
    }

    void recordResponse(TransportResponse transportResponse) {
        this.rawResponse = transportResponse;
        this.statusCode = transportResponse.statusCode();
        this.responseHeaders = transportResponse.headers();
        this.response = transportResponse.body();
    }

    /** Drop the transport response handle once its contents live in this context. */
    void releaseRawResponse() {
        this.rawResponse = null;
    }

    boolean hasRawResponse() {
        return rawResponse != null;
    }

    /** Set the body directly, e.g. when testing a step's callbacks in isolation. */
    public void setResponse(byte[] body) {
        this.response = body == null ? null : body.clone();
    }

    /** Forget the buffered body; later body accessors behave as if nothing was received. */
    public void clearResponse() {
        this.response = null;
    }

    public OptionalInt statusCode() {
        return statusCode == 0 ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }

    public Map<String, List<String>> responseHeaders() {
        return responseHeaders;
    }

    /** Snapshot of the body; each call returns a fresh copy. */
    public Optional<byte[]> bodyBytes() {
        return response == null ? Optional.empty() : Optional.of(response.clone());
    }

    /**
     * The body decoded with the charset named by the response {@code Content-Type},
     * UTF-8 otherwise. Empty when no body is present; never fails.
     */
    public String bodyText() {
        if (response == null) {
            return "";
        }
        return new String(response, charset());
    }

    /**
     * Decode the body as JSON. A decode failure does not change the step's outcome.
     *
     * @throws IOException if no body is present or it does not fit {@code type}
     */
    public <T> T bodyJson(Class<T> type) throws IOException {
        return MAPPER.readValue(requireBody(), type);
    }

    public <T> T bodyJson(TypeReference<T> type) throws IOException {
        return MAPPER.readValue(requireBody(), type);
    }

    public void setNextStep(String step) {
        this.nextStep = step;
    }

    public void clearNextStep() {
        this.nextStep = null;
    }

    public Optional<String> getNextStep() {
        return Optional.ofNullable(nextStep);
    }

    /**
     * Ask the caller to wait before running the next step, instead of sleeping
     * inside a callback.
     */
    public void delayNextStep(Duration delay) {
        this.nextDelay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
    }

    public Duration getNextDelay() {
        return nextDelay;
    }

    /** Milliseconds from the start of the execution until the outcome was known. */
    public long getTimeElapsed() {
        return timeElapsed;
    }

    public void setTimeElapsed(long timeElapsed) {
        this.timeElapsed = timeElapsed;
    }

    private byte[] requireBody() throws IOException {
        if (response == null) {
            throw new IOException("No response body");
        }
        return response;
    }

    private Charset charset() {
        List<String> values = responseHeaders.get("content-type");
        if (values == null || values.isEmpty()) {
            return StandardCharsets.UTF_8;
        }
        try {
            ContentType contentType = ContentType.parseLenient(values.get(0));
            if (contentType == null || contentType.getCharset() == null) {
                return StandardCharsets.UTF_8;
            }
            return contentType.getCharset();
        } catch (IllegalArgumentException e) {
            // illegal or unsupported charset name
            return StandardCharsets.UTF_8;
        }
    }
}
