package com.marketpulse.dispatch.cli;

import com.marketpulse.core.model.Checkpoint;
import com.marketpulse.core.persistence.CheckpointStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: marketpulse checkpoints [&lt;sessionId&gt;]
 * <p>
 * Lists the checkpoints of one session, or every session id in the store
 * when no id is given.
 */
@Command(name = "checkpoints", mixinStandardHelpOptions = true,
        description = "Inspect stored checkpoints")
@Component
public class CheckpointsCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Session id")
    private String sessionId;

    @Option(names = "--payload", description = "Print each checkpoint's JSON payload")
    private boolean showPayload;

    private final CheckpointStore checkpointStore;

    public CheckpointsCommand(CheckpointStore checkpointStore) {
        this.checkpointStore = checkpointStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Store: " + checkpointStore.describe());

        if (sessionId == null) {
            List<String> sessions = checkpointStore.listSessions();
            if (sessions.isEmpty()) {
                ConsoleOutput.info("No sessions found.");
                return;
            }
            sessions.forEach(id -> System.out.println("  " + id));
            return;
        }

        List<Checkpoint> checkpoints = checkpointStore.readSession(sessionId);
        if (checkpoints.isEmpty()) {
            ConsoleOutput.error("No checkpoints for session " + sessionId);
            return;
        }
        System.out.println("SESSION " + sessionId + " (" + checkpoints.size() + " checkpoints)");
        for (Checkpoint checkpoint : checkpoints) {
            ConsoleOutput.checkpoint(checkpoint);
            if (showPayload) {
                System.out.println("         " + checkpoint.payload());
            }
        }
    }
}
