package dev.stepbot.cli;

import dev.stepbot.config.DeclarativeStep;
import dev.stepbot.config.Guardrails;
import dev.stepbot.config.StepDefinitionLoader;
import dev.stepbot.config.StepDefinitionValidator;
import dev.stepbot.config.StepDefinitions;
import dev.stepbot.engine.Bot;
import dev.stepbot.engine.Context;
import dev.stepbot.engine.StepException;
import dev.stepbot.engine.StepRegistry;
import dev.stepbot.http.ApacheHttpTransport;
import dev.stepbot.http.HttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * CLI entry point: runs steps from a JSON definitions file, optionally following
 * each step's next-step hint.
 */
@Command(
    name = "step-bot",
    mixinStandardHelpOptions = true,
    description = "Run HTTP steps from a definitions file and follow their next-step hints."
)
public class StepBotCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_GUARDRAIL = 2;

    private static final Logger log = LoggerFactory.getLogger(StepBotCli.class);

    @Parameters(index = "0", description = "Step definitions file (JSON)")
    private Path definitionsFile;

    @Option(names = "--step", description = "Step to start from (default: initialStep of the file)")
    private String startStep;

    @Option(names = "--follow", description = "Keep running next-step hints until the chain ends")
    private boolean follow;

    @Option(names = "--max-steps", description = "Override the maxSteps guardrail")
    private Integer maxSteps;

    @Option(names = "--max-visits", description = "Override the maxStepVisits guardrail")
    private Integer maxVisits;

    @Option(names = "--list", description = "List the steps in the file and exit")
    private boolean list;

    private final HttpTransport transport;
    private final PrintStream out;
    private final PrintStream err;

    public StepBotCli() {
        this(new ApacheHttpTransport(), System.out, System.err);
    }

    StepBotCli(HttpTransport transport, PrintStream out, PrintStream err) {
        this.transport = transport;
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        StepDefinitions definitions;
        try {
            definitions = StepDefinitionLoader.loadFromFile(definitionsFile);
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: cannot load " + definitionsFile + ": " + e.getMessage());
            return EXIT_FAILED;
        }

        List<String> errors = StepDefinitionValidator.validate(definitions);
        if (!errors.isEmpty()) {
            err.println("Error: invalid definitions in " + definitionsFile + ":");
            errors.forEach(e -> err.println("  " + e));
            return EXIT_FAILED;
        }

        if (list) {
            out.println("Steps:");
            definitions.steps().values().forEach(s ->
                out.printf("  %s %s %s%n", s.name(), s.method(), s.url()));
            return EXIT_OK;
        }

        StepRegistry registry = new StepRegistry();
        try {
            registry.insertAll(DeclarativeStep.fromDefinitions(definitions));
        } catch (StepException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        }

        Guardrails guardrails = new Guardrails(
            maxSteps != null ? maxSteps : definitions.guardrails().maxSteps(),
            maxVisits != null ? maxVisits : definitions.guardrails().maxStepVisits());
        String first = startStep != null ? startStep : definitions.initialStep();

        return run(new Bot(registry, transport), first, guardrails);
    }

    private int run(Bot bot, String first, Guardrails guardrails) {
        Map<String, Integer> visits = new HashMap<>();
        int executed = 0;
        String current = first;

        while (current != null) {
            if (executed >= guardrails.maxSteps()) {
                err.printf("Guardrail: maxSteps %d reached before %s%n", guardrails.maxSteps(), current);
                return EXIT_GUARDRAIL;
            }
            int visitCount = visits.merge(current, 1, Integer::sum);
            if (visitCount > guardrails.maxStepVisits()) {
                err.printf("Guardrail: step %s visited more than %d times%n", current, guardrails.maxStepVisits());
                return EXIT_GUARDRAIL;
            }
            executed++;

            Context ctx;
            try {
                ctx = bot.execute(current);
                report(current, "ok", ctx);
            } catch (StepException e) {
                report(current, e.getMessage(), e.context().orElse(null));
                if (!follow || e.context().flatMap(Context::getNextStep).isEmpty()) {
                    return EXIT_FAILED;
                }
                ctx = e.context().get();
                log.info("Step {} failed, recovering with {}", current, ctx.getNextStep().get());
            }

            if (!follow) {
                return EXIT_OK;
            }
            Optional<String> next = ctx.getNextStep();
            if (next.isPresent() && !pause(ctx.getNextDelay())) {
                return EXIT_FAILED;
            }
            current = next.orElse(null);
        }
        return EXIT_OK;
    }

    private void report(String step, String outcome, Context ctx) {
        if (ctx == null) {
            out.printf("%s: %s%n", step, outcome);
            return;
        }
        out.printf("%s: %s status=%s elapsed=%dms next=%s%n", step, outcome,
            ctx.statusCode().isPresent() ? String.valueOf(ctx.statusCode().getAsInt()) : "-",
            ctx.getTimeElapsed(), ctx.getNextStep().orElse("-"));
    }

    private static boolean pause(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
