package com.switchyard.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchyard.SwitchyardApplication;
import com.switchyard.core.connectivity.ConnectivityMonitor;
import com.switchyard.core.connectivity.ConnectivityProperties;
import com.switchyard.core.events.EventBus;
import com.switchyard.core.health.HealthCheckService;
import com.switchyard.core.health.HealthStatus;
import com.switchyard.core.metrics.ExportFormat;
import com.switchyard.core.metrics.PerformanceMonitor;
import com.switchyard.core.model.ErrorKind;
import com.switchyard.core.model.ExecutionOutcome;
import com.switchyard.core.model.InvocationRequest;
import com.switchyard.core.model.QueueStatus;
import com.switchyard.core.model.QueuedJob;
import com.switchyard.core.model.Route;
import com.switchyard.core.model.RouterException;
import com.switchyard.core.queue.JobNotFoundException;
import com.switchyard.core.queue.JobStoreException;
import com.switchyard.core.queue.OfflineQueue;
import com.switchyard.core.queue.QueueStats;
import com.switchyard.core.router.ExecutionRouter;
import com.switchyard.core.router.RouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Exercises the picocli command tree without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private ExecutionRouter router;
    private OfflineQueue queue;
    private PerformanceMonitor monitor;
    private HealthCheckService health;

    @BeforeEach
    void setUp() {
        router = mock(ExecutionRouter.class);
        queue = mock(OfflineQueue.class);
        monitor = mock(PerformanceMonitor.class);
        health = mock(HealthCheckService.class);
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ExecuteCommand.class) {
                    return (K) new ExecuteCommand(router, queue, new EventBus(), new ObjectMapper());
                }
                if (cls == QueueCommand.class) {
                    return (K) new QueueCommand(queue);
                }
                if (cls == MetricsCommand.class) {
                    return (K) new MetricsCommand(monitor);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(health);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand(queue, new ConnectivityMonitor(new ConnectivityProperties()),
                            new RouterProperties());
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = CliRunner.commandLine(new SwitchyardCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static QueuedJob job(String id) {
        var request = new InvocationRequest("generate_outline", Map.of("topic", "rivers"), NOW, "fp-" + id);
        return QueuedJob.create(id, request, 5, 3, NOW);
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String name : List.of("execute", "queue", "metrics", "health", "serve", "help")) {
                assertTrue(result.output().contains(name), "Help should list '" + name + "'");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Switchyard 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints banner and usage")
        void noArgs() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SWITCHYARD"));
            assertTrue(result.output().contains("Usage"));
        }

        @Test
        @DisplayName("unknown subcommand fails")
        void unknownSubcommand() {
            CliResult result = execute("bogus");
            assertNotEquals(0, result.exitCode());
        }
    }

    @Nested
    @DisplayName("execute")
    class ExecuteTests {

        @Test
        @DisplayName("prints route and result of a completed invocation")
        void completed() {
            when(router.execute(eq("word_count"), anyMap()))
                    .thenReturn(ExecutionOutcome.completed(Map.of("words", 3), Route.LOCAL, 4));

            CliResult result = execute("execute", "word_count", "-p", "text=one two three");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("[LOCAL]"));
            assertTrue(result.output().contains("\"words\" : 3"));
            verify(router).execute("word_count", Map.of("text", "one two three"));
        }

        @Test
        @DisplayName("reports the job id of a deferred invocation")
        void deferred() {
            when(router.execute(eq("generate_outline"), anyMap()))
                    .thenReturn(ExecutionOutcome.deferred("job-1", 2));

            CliResult result = execute("execute", "generate_outline", "-p", "topic=rivers");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("[QUEUE]"));
            assertTrue(result.output().contains("Deferred as job job-1"));
            verify(queue, never()).requestDrain();
        }

        @Test
        @DisplayName("--wait prints the stored result of a job that already finished")
        void waitForFinishedJob() {
            when(router.execute(eq("generate_outline"), anyMap()))
                    .thenReturn(ExecutionOutcome.deferred("job-1", 2));
            when(queue.getJob("job-1")).thenReturn(Optional.of(
                    job("job-1").complete(Map.of("outline", "intro"), NOW)));

            CliResult result = execute("execute", "generate_outline", "--wait");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("completed"));
            assertTrue(result.output().contains("\"outline\" : \"intro\""));
            verify(queue, never()).requestDrain();
        }

        @Test
        @DisplayName("--wait fails when the job disappears")
        void waitForRemovedJob() {
            when(router.execute(eq("generate_outline"), anyMap()))
                    .thenReturn(ExecutionOutcome.deferred("job-1", 2));
            when(queue.getJob("job-1")).thenReturn(Optional.empty());

            CliResult result = execute("execute", "generate_outline", "--wait");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("was removed"));
        }

        @Test
        @DisplayName("router errors exit with 1 and print the error kind")
        void routerError() {
            when(router.execute(eq("nope"), anyMap()))
                    .thenThrow(new RouterException(ErrorKind.UNKNOWN_TOOL, "Unknown tool: nope"));

            CliResult result = execute("execute", "nope");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("UNKNOWN_TOOL: Unknown tool: nope"));
        }

        @Test
        @DisplayName("tool name is required")
        void missingTool() {
            CliResult result = execute("execute");
            assertNotEquals(0, result.exitCode());
            verifyNoInteractions(router);
        }
    }

    @Nested
    @DisplayName("queue")
    class QueueTests {

        @Test
        @DisplayName("without options prints counts and lifetime stats")
        void stats() {
            when(queue.stats()).thenReturn(new QueueStats(new QueueStatus(2, 1, 5, 1),
                    7, 5, 1, NOW, NOW, false));

            CliResult result = execute("queue");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Queued: 2 | Processing: 1 | Completed: 5 | Failed: 1"));
            assertTrue(result.output().contains("Lifetime: 7 processed, 5 succeeded, 1 failed"));
            assertTrue(result.output().contains("Last successful sync: 2025-03-01T10:00:00Z"));
        }

        @Test
        @DisplayName("--list prints every job")
        void list() {
            when(queue.listJobs(null)).thenReturn(List.of(job("job-1"), job("job-2")));

            CliResult result = execute("queue", "--list");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("job-1"));
            assertTrue(result.output().contains("job-2"));
            assertTrue(result.output().contains("attempts=0/3"));
        }

        @Test
        @DisplayName("--list on an empty queue says so")
        void listEmpty() {
            when(queue.listJobs(null)).thenReturn(List.of());

            CliResult result = execute("queue", "--list");

            assertTrue(result.output().contains("Queue is empty"));
        }

        @Test
        @DisplayName("--retry re-queues a failed job")
        void retry() {
            when(queue.retryJob("job-1")).thenReturn(job("job-1"));

            CliResult result = execute("queue", "--retry", "job-1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Job re-queued"));
            verify(queue).retryJob("job-1");
        }

        @Test
        @DisplayName("--retry of an unknown job prints the error")
        void retryUnknown() {
            when(queue.retryJob("ghost")).thenThrow(new JobNotFoundException("ghost"));

            CliResult result = execute("queue", "--retry", "ghost");

            assertTrue(result.output().contains("JOB_NOT_FOUND"));
        }

        @Test
        @DisplayName("--sync runs one drain pass")
        void sync() {
            when(queue.drain()).thenReturn(3);

            CliResult result = execute("queue", "--sync");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Drain pass completed 3 jobs"));
        }

        @Test
        @DisplayName("clear and remove actions report their counts")
        void clearAndRemove() {
            when(queue.clearCompleted()).thenReturn(4);
            when(queue.clearFailed()).thenReturn(2);
            when(queue.retryAllFailed()).thenReturn(1);

            assertTrue(execute("queue", "--clear-completed").output().contains("Removed 4 completed jobs"));
            assertTrue(execute("queue", "--clear-failed").output().contains("Removed 2 failed jobs"));
            assertTrue(execute("queue", "--retry-failed").output().contains("Re-queued 1 failed jobs"));
            assertTrue(execute("queue", "--remove", "job-9").output().contains("Job job-9 removed"));
            verify(queue).removeJob("job-9");
        }

        @Test
        @DisplayName("actions are mutually exclusive")
        void exclusiveActions() {
            CliResult result = execute("queue", "--list", "--sync");
            assertNotEquals(0, result.exitCode());
            verify(queue, never()).drain();
        }
    }

    @Nested
    @DisplayName("metrics")
    class MetricsTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("defaults to JSON on stdout")
        void jsonToStdout() {
            when(monitor.export(ExportFormat.JSON))
                    .thenReturn("{\"total_requests\":0}".getBytes(StandardCharsets.UTF_8));

            CliResult result = execute("metrics");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("{\"total_requests\":0}"));
        }

        @Test
        @DisplayName("--format csv --output writes the file")
        void csvToFile() throws Exception {
            byte[] csv = "Metric,Value\nTotal Requests,0\n".getBytes(StandardCharsets.UTF_8);
            when(monitor.export(ExportFormat.CSV)).thenReturn(csv);
            Path target = tempDir.resolve("metrics.csv");

            CliResult result = execute("metrics", "--format", "csv", "--output", target.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Metrics written to"));
            assertArrayEquals(csv, Files.readAllBytes(target));
        }

        @Test
        @DisplayName("unsupported format prints an error and exports nothing")
        void badFormat() {
            CliResult result = execute("metrics", "--format", "xml");

            assertTrue(result.output().contains("Unsupported export format: xml"));
            verify(monitor, never()).export(any());
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("prints each component and the overall status")
        void degraded() {
            when(health.checkAll()).thenReturn(List.of(
                    new HealthStatus("cache", HealthStatus.Status.UP, "12 entries", Map.of()),
                    new HealthStatus("remote", HealthStatus.Status.DEGRADED, "offline", Map.of())));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("cache: 12 entries"));
            assertTrue(result.output().contains("remote: offline"));
            assertTrue(result.output().contains("Overall: degraded"));
        }

        @Test
        @DisplayName("all components up")
        void allUp() {
            when(health.checkAll()).thenReturn(List.of(
                    new HealthStatus("queue", HealthStatus.Status.UP, "0 queued", Map.of())));

            CliResult result = execute("health");

            assertTrue(result.output().contains("Overall: all systems operational"));
        }
    }

    @Nested
    @DisplayName("serve")
    class ServeTests {

        @Test
        @DisplayName("prints the API address, remote endpoint and job store")
        void summary() {
            when(queue.storeDescription()).thenReturn("file:/tmp/jobs");
            when(queue.status()).thenReturn(new QueueStatus(4, 0, 0, 0));

            CliResult result = execute("serve");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("/api/v1"));
            assertTrue(result.output().contains("http://localhost:8000/api/tools (online)"));
            assertTrue(result.output().contains("file:/tmp/jobs, 4 queued"));
        }

        @Test
        @DisplayName("only a leading serve command selects server mode")
        void serveModeDetection() {
            assertTrue(SwitchyardApplication.isServeMode("serve"));
            assertTrue(SwitchyardApplication.isServeMode("--debug", "serve"));
            assertFalse(SwitchyardApplication.isServeMode("execute", "serve"));
            assertFalse(SwitchyardApplication.isServeMode("execute", "count_words", "-p", "text=serve"));
            assertFalse(SwitchyardApplication.isServeMode());
        }
    }

    @Nested
    @DisplayName("failures escaping a command")
    class FailureTests {

        @Test
        @DisplayName("job store failures exit with the store-unavailable code")
        void jobStoreFailure() {
            when(queue.drain()).thenThrow(new JobStoreException("disk full"));

            CliResult result = execute("queue", "--sync");

            assertEquals(CliRunner.EXIT_STORE_UNAVAILABLE, result.exitCode());
            assertTrue(result.output().contains("Job store unavailable: disk full"));
        }

        @Test
        @DisplayName("router errors thrown outside a command's own handling print their kind")
        void routerErrorEscapes() {
            when(monitor.export(any())).thenThrow(new RouterException(ErrorKind.QUEUE_FULL, "queue is full"));

            CliResult result = execute("metrics");

            assertEquals(CliRunner.EXIT_FAILED, result.exitCode());
            assertTrue(result.output().contains("QUEUE_FULL: queue is full"));
        }
    }
}
