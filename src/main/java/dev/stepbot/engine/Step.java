package dev.stepbot.engine;

import dev.stepbot.model.Request;
import dev.stepbot.model.StepError;

/**
 * A named unit of work: builds one request and reacts to its outcome.
 *
 * <p>Instances are shared between registry entries and callers, so implementations
 * must be stateless or synchronize internally. All mutation goes through the
 * {@link Context} argument, which must not be retained after the callback returns.
 * Callbacks run on the executing thread; use {@link Context#delayNextStep} instead of
 * sleeping when a pause before the next step is wanted.
 */
public interface Step {

    /** Stable identifier, used as the registry key. */
    String name();

    /** Build the request to send. Must not block or perform I/O. */
    Request onRequest();

    /** The response status satisfied the acceptance rule. */
    void onSuccess(Context ctx);

    /** The transport failed or the response status was rejected. */
    void onError(Context ctx, StepError error);

    /** The transport deadline was exceeded. {@link #onError} is not called in this case. */
    void onTimeout(Context ctx);
}
