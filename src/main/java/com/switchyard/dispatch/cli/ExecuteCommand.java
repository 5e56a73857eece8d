package com.switchyard.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchyard.core.events.EventBus;
import com.switchyard.core.events.RouterEvent;
import com.switchyard.core.model.ExecutionOutcome;
import com.switchyard.core.model.JobStatus;
import com.switchyard.core.model.QueuedJob;
import com.switchyard.core.model.RouterException;
import com.switchyard.core.queue.OfflineQueue;
import com.switchyard.core.router.ExecutionRouter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: switchyard execute &lt;tool&gt; -p key=value ...
 * <p>
 * Runs a tool through the router. With {@code --wait}, a deferred call triggers a
 * drain and blocks until the job completes or fails.
 */
@Command(name = "execute", mixinStandardHelpOptions = true, description = "Execute a tool")
@Component
public class ExecuteCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Tool name")
    private String tool;

    @Option(names = {"-p", "--param"}, description = "Parameter as key=value (repeatable)")
    private Map<String, String> params = new LinkedHashMap<>();

    @Option(names = {"--wait", "-w"}, description = "Wait for a deferred job to finish")
    private boolean wait;

    @Option(names = {"--timeout"}, description = "Seconds to wait with --wait (default: ${DEFAULT-VALUE})",
            defaultValue = "60")
    private long timeoutSeconds;

    private final ExecutionRouter router;
    private final OfflineQueue queue;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public ExecuteCommand(ExecutionRouter router, OfflineQueue queue, EventBus eventBus, ObjectMapper objectMapper) {
        this.router = router;
        this.queue = queue;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ExecutionOutcome outcome;
        try {
            outcome = router.execute(tool, new LinkedHashMap<>(params));
        } catch (RouterException e) {
            ConsoleOutput.error(e.kind() + ": " + e.getMessage());
            return 1;
        }

        ConsoleOutput.route(outcome.route().key(), outcome.latencyMs());
        if (!outcome.isDeferred()) {
            printResult(outcome.result());
            return 0;
        }

        ConsoleOutput.warn("Deferred as job " + outcome.jobId());
        if (!wait) {
            return 0;
        }
        return awaitJob(outcome.jobId());
    }

    private int awaitJob(String jobId) {
        var done = new CountDownLatch(1);
        EventBus.Subscription subscription = eventBus.subscribe(jobId, event -> {
            if (event.isTerminal()) {
                done.countDown();
            } else if (RouterEvent.JOB_RETRY_SCHEDULED.equals(event.eventType())) {
                ConsoleOutput.warn("Attempt failed, retry at " + event.payload().get("next_attempt_at"));
            }
        });
        try {
            if (queue.getJob(jobId).map(j -> j.status().isActive()).orElse(false)) {
                queue.requestDrain();
                if (!done.await(timeoutSeconds, TimeUnit.SECONDS)) {
                    ConsoleOutput.error("Timed out waiting for job " + jobId);
                    return 2;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } finally {
            subscription.unsubscribe();
        }

        QueuedJob job = queue.getJob(jobId).orElse(null);
        if (job == null) {
            ConsoleOutput.error("Job " + jobId + " was removed");
            return 1;
        }
        ConsoleOutput.job(job);
        if (job.result() != null) {
            printResult(job.result());
        }
        return job.status() == JobStatus.COMPLETED ? 0 : 1;
    }

    private void printResult(Object result) {
        try {
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        } catch (JsonProcessingException e) {
            System.out.println(result);
        }
    }
}
