package dev.stepbot.model;

import java.util.List;

/**
 * Why a step did not complete successfully.
 * Passed to {@link dev.stepbot.engine.Step#onError} and carried by {@link dev.stepbot.engine.StepException}.
 */
public sealed interface StepError {

    String message();

    /** The requested step name is not registered. Raised before any network activity. */
    record StepNotFound(String name) implements StepError {
        @Override
        public String message() {
            return "Step not found: " + name;
        }
    }

    /** Sending the request or reading the response failed (DNS, refused connection, TLS, ...). */
    record TransportFailure(String detail) implements StepError {
        @Override
        public String message() {
            return "Transport failure: " + detail;
        }
    }

    /** The transport deadline carried by the request was exceeded. */
    record Timeout(String detail) implements StepError {
        @Override
        public String message() {
            return "Request timed out: " + detail;
        }
    }

    /**
     * A response arrived but its status is not accepted.
     * {@code expected} is empty when the 2xx range was required.
     */
    record StatusCodeNotFound(int actual, List<Integer> expected) implements StepError {
        public StatusCodeNotFound {
            expected = List.copyOf(expected);
        }

        @Override
        public String message() {
            return expected.isEmpty()
                ? "Status code %d is not a 2xx success".formatted(actual)
                : "Status code %d not in expected codes %s".formatted(actual, expected);
        }
    }

    /** A strict registry refused a second step with the same name. */
    record DuplicateStepName(String name) implements StepError {
        @Override
        public String message() {
            return "Duplicate step name: " + name;
        }
    }
}
