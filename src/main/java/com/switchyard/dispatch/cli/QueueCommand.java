package com.switchyard.dispatch.cli;

import com.switchyard.core.model.QueueStatus;
import com.switchyard.core.model.QueuedJob;
import com.switchyard.core.model.RouterException;
import com.switchyard.core.queue.OfflineQueue;
import com.switchyard.core.queue.QueueStats;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: switchyard queue [--list | --retry ID | --clear-completed | --clear-failed]
 * <p>
 * Without options prints queue counts and lifetime statistics.
 */
@Command(name = "queue", mixinStandardHelpOptions = true, description = "Inspect and manage the offline queue")
@Component
public class QueueCommand implements Runnable {

    @ArgGroup(exclusive = true)
    private Action action;

    static class Action {
        @Option(names = {"--list", "-l"}, description = "List all jobs")
        boolean list;

        @Option(names = "--retry", paramLabel = "JOB_ID", description = "Re-queue a failed job")
        String retryId;

        @Option(names = "--retry-failed", description = "Re-queue all failed jobs")
        boolean retryFailed;

        @Option(names = "--remove", paramLabel = "JOB_ID", description = "Delete a job")
        String removeId;

        @Option(names = "--clear-completed", description = "Delete completed jobs")
        boolean clearCompleted;

        @Option(names = "--clear-failed", description = "Delete failed jobs")
        boolean clearFailed;

        @Option(names = "--sync", description = "Run a drain pass now")
        boolean sync;
    }

    private final OfflineQueue queue;

    public QueueCommand(OfflineQueue queue) {
        this.queue = queue;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            if (action == null) {
                printStats(queue.stats());
            } else if (action.list) {
                List<QueuedJob> jobs = queue.listJobs(null);
                if (jobs.isEmpty()) {
                    ConsoleOutput.info("Queue is empty");
                }
                jobs.forEach(ConsoleOutput::job);
            } else if (action.retryId != null) {
                ConsoleOutput.job(queue.retryJob(action.retryId));
                ConsoleOutput.success("Job re-queued");
            } else if (action.retryFailed) {
                ConsoleOutput.success("Re-queued " + queue.retryAllFailed() + " failed jobs");
            } else if (action.removeId != null) {
                queue.removeJob(action.removeId);
                ConsoleOutput.success("Job " + action.removeId + " removed");
            } else if (action.clearCompleted) {
                ConsoleOutput.success("Removed " + queue.clearCompleted() + " completed jobs");
            } else if (action.clearFailed) {
                ConsoleOutput.success("Removed " + queue.clearFailed() + " failed jobs");
            } else if (action.sync) {
                int completed = queue.drain();
                ConsoleOutput.success("Drain pass completed " + completed + " jobs");
            }
        } catch (RouterException e) {
            ConsoleOutput.error(e.kind() + ": " + e.getMessage());
        }
    }

    private static void printStats(QueueStats stats) {
        QueueStatus s = stats.status();
        ConsoleOutput.info("Queued: " + s.queued() + " | Processing: " + s.processing()
                + " | Completed: " + s.completed() + " | Failed: " + s.failed());
        ConsoleOutput.info("Lifetime: " + stats.processed() + " processed, "
                + stats.succeeded() + " succeeded, " + stats.failed() + " failed");
        if (stats.lastSuccessfulSync() != null) {
            ConsoleOutput.info("Last successful sync: " + stats.lastSuccessfulSync());
        }
    }
}
