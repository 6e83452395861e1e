package dev.stepbot;

import dev.stepbot.cli.StepBotCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new StepBotCli()).execute(args);
        System.exit(exitCode);
    }
}
