package com.awesomeposter.dispatch.cli;

import com.awesomeposter.core.engine.HitlService;
import com.awesomeposter.core.engine.ThreadNotFoundException;
import com.awesomeposter.core.hitl.HitlRequest;
import com.awesomeposter.core.model.PlanStep;
import com.awesomeposter.core.persistence.RunSnapshot;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: awesomeposter thread &lt;threadId&gt;
 * <p>
 * Prints the plan and pending HITL request stored for a thread.
 */
@Command(name = "thread", mixinStandardHelpOptions = true, description = "Show stored state for a thread")
@Component
public class ThreadCommand implements Runnable {

    @Parameters(index = "0", description = "Thread id")
    private String threadId;

    private final HitlService hitlService;

    public ThreadCommand(HitlService hitlService) {
        this.hitlService = hitlService;
    }

    @Override
    public void run() {
        RunSnapshot snapshot;
        try {
            snapshot = hitlService.snapshot(threadId);
        } catch (ThreadNotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        System.out.println("THREAD " + threadId);
        System.out.println("Objective: " + snapshot.objective());
        System.out.println("Last run:  " + snapshot.runId() + " at " + snapshot.updatedAt());
        System.out.println();
        System.out.println("Plan v" + snapshot.plan().version() + ":");
        for (PlanStep step : snapshot.plan().steps()) {
            System.out.printf("  %-20s %-12s %s%n", step.id(), step.target(), step.status().wireName());
        }
        System.out.println();
        System.out.println("Facets: " + String.join(", ", snapshot.facets().keySet()));
        snapshot.hitl().pending().ifPresentOrElse(
                ThreadCommand::printPending,
                () -> ConsoleOutput.info("No pending HITL request"));
    }

    private static void printPending(HitlRequest request) {
        ConsoleOutput.warn("Pending HITL request " + request.id() + " (" + request.payload().kind().wireName() + "): "
                + request.payload().question());
        request.payload().options().forEach(option ->
                System.out.println("    - " + option.id() + ": " + option.label()));
    }
}
