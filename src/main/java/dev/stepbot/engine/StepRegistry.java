package dev.stepbot.engine;

import dev.stepbot.model.StepError;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Name-keyed store of steps. Populated once at startup, then read concurrently.
 *
 * <p>By default a step inserted under an existing name replaces the earlier one.
 * A registry created with {@link #strict()} rejects the duplicate instead.
 */
public final class StepRegistry {

    private final ConcurrentMap<String, Step> steps = new ConcurrentHashMap<>();
    private final boolean strict;

    public StepRegistry() {
        this(false);
    }

    private StepRegistry(boolean strict) {
        this.strict = strict;
    }

    public static StepRegistry strict() {
        return new StepRegistry(true);
    }

    /**
     * Register a step under its own name.
     *
     * @throws StepException with {@link StepError.DuplicateStepName} in a strict registry
     */
    public void insert(Step step) throws StepException {
        String name = step.name();
        if (strict) {
            if (steps.putIfAbsent(name, step) != null) {
                throw new StepException(new StepError.DuplicateStepName(name));
            }
        } else {
            steps.put(name, step);
        }
    }

    public void insertAll(Collection<? extends Step> toInsert) throws StepException {
        for (Step step : toInsert) {
            insert(step);
        }
    }

    public Optional<Step> get(String name) {
        return Optional.ofNullable(steps.get(name));
    }

    /**
     * @throws StepException with {@link StepError.StepNotFound} when the name is not registered
     */
    public Step require(String name) throws StepException {
        Step step = steps.get(name);
        if (step == null) {
            throw new StepException(new StepError.StepNotFound(name));
        }
        return step;
    }

    public int size() {
        return steps.size();
    }

    public boolean containsName(String name) {
        return steps.containsKey(name);
    }

    /** Membership by name: a different instance with the same name counts as present. */
    public boolean containsStep(Step step) {
        return steps.containsKey(step.name());
    }

    /** Registered names, sorted. */
    public Set<String> names() {
        return new TreeSet<>(steps.keySet());
    }
}
