package com.awesomeposter.dispatch.cli;

import com.awesomeposter.core.engine.OrchestratorEngine;
import com.awesomeposter.core.engine.RunOutcome;
import com.awesomeposter.core.engine.RunRequest;
import com.awesomeposter.core.engine.RunResult;
import com.awesomeposter.core.hitl.HitlResponse;
import com.awesomeposter.core.model.RunMode;
import com.awesomeposter.core.policy.PolicyConfigurationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * CLI command: awesomeposter run "&lt;objective&gt;"
 * <p>
 * Runs an objective in-process and prints the event stream. With {@code --thread} the run
 * continues the stored thread; {@code --approve}/{@code --reject} answer its pending request.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run or resume an objective")
@Component
public class RunCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "What to produce (optional when resuming a thread)")
    private String objective;

    @Option(names = {"--thread", "-t"}, description = "Thread id to store and resume state under")
    private String threadId;

    @Option(names = {"--mode", "-m"}, description = "Run mode: app or chat", defaultValue = "app")
    private String mode;

    @Option(names = "--approve", description = "Approve a pending HITL request by id")
    private List<String> approve = new ArrayList<>();

    @Option(names = "--reject", description = "Reject a pending HITL request by id")
    private List<String> reject = new ArrayList<>();

    private final OrchestratorEngine engine;

    public RunCommand(OrchestratorEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        RunMode runMode;
        try {
            runMode = RunMode.fromWire(mode);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage() + ". Valid modes: app, chat");
            return;
        }
        if ((objective == null || objective.isBlank()) && (threadId == null || threadId.isBlank())) {
            ConsoleOutput.error("An objective is required unless --thread is given");
            return;
        }

        List<HitlResponse> responses = new ArrayList<>();
        approve.forEach(id -> responses.add(HitlResponse.approve(id)));
        reject.forEach(id -> responses.add(HitlResponse.reject(id, "Rejected from the command line")));

        RunRequest request = new RunRequest(objective, runMode, threadId, null, null, responses, null);
        RunResult result;
        try {
            result = engine.run(request, ConsoleOutput::event, UUID.randomUUID().toString());
        } catch (PolicyConfigurationException e) {
            ConsoleOutput.error("Invalid policies: " + e.getMessage());
            return;
        }

        System.out.println();
        switch (result.outcome()) {
            case COMPLETED -> ConsoleOutput.success("Run " + result.runId() + " completed at plan v" + result.planVersion());
            case PENDING_HITL -> ConsoleOutput.warn("Waiting for a human: request " + result.pendingRequestId()
                    + (result.threadId() != null
                        ? ". Resume with: run --thread " + result.threadId() + " --approve " + result.pendingRequestId()
                        : ". Run with --thread to be able to resume"));
            case PAUSED -> ConsoleOutput.warn("Run paused" + (result.threadId() != null ? " on thread " + result.threadId() : ""));
            case FAILED, ERROR -> ConsoleOutput.error("Run " + result.outcome().wireName() + ": " + result.error());
        }
        if (result.outcome() == RunOutcome.COMPLETED && !result.facets().isEmpty()) {
            ConsoleOutput.info("Facets: " + String.join(", ", result.facets().keySet()));
        }
    }
}
