package dev.stepbot.engine;

import dev.stepbot.model.StepError;

import java.util.Optional;

/**
 * Checked failure surfaced to the caller of a step execution.
 * When the step was notified before the failure was thrown, the context it saw is
 * attached, so a recovery next-step set by the step stays visible to the caller.
 */
public class StepException extends Exception {

    private final StepError error;
    private final transient Context context; // nullable

    public StepException(StepError error) {
        this(error, null, null);
    }

    public StepException(StepError error, Context context, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
        this.context = context;
    }

    public StepError error() {
        return error;
    }

    public Optional<Context> context() {
        return Optional.ofNullable(context);
    }
}
