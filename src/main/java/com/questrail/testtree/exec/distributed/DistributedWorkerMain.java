package com.questrail.testtree.exec.distributed;

import com.questrail.testtree.api.TestPlan;
import com.questrail.testtree.core.Scheduler;
import com.questrail.testtree.exec.CaseRunner;
import com.questrail.testtree.exec.RunGuard;
import com.questrail.testtree.exec.distributed.codec.BatchCodecException;
import com.questrail.testtree.exec.distributed.codec.BatchFrame;
import com.questrail.testtree.exec.distributed.codec.BatchFrameDecoder;
import com.questrail.testtree.exec.distributed.codec.BatchFrameEncoder;
import com.questrail.testtree.exec.distributed.transport.BatchClient;
import com.questrail.testtree.exec.distributed.transport.TransportException;
import com.questrail.testtree.exec.distributed.transport.netty.NettyBatchClient;
import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.ScheduledCase;
import com.questrail.testtree.model.TestTree;
import com.questrail.testtree.observability.Slf4jRunObservabilitySink;
import com.questrail.testtree.time.SystemMonotonicClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * DistributedWorkerMain
 * =============================================================================
 * Entry point of a worker process.
 *
 * <pre>
 *   connect → Hello → rebuild plan → await Assign → (run case → CaseReport)* → Done
 * </pre>
 *
 * <p>The worker rebuilds the plan from its class name and runs the cases at the
 * discovery indices the coordinator sends in its {@link BatchFrame.Assign}
 * reply. Each report is written before the next case
 * starts, so a worker that dies loses at most the case it was running. An
 * {@link BatchFrame.Abort} from the coordinator stops the worker from starting
 * further cases; those are reported as aborted.</p>
 *
 * <p>Reports are encoded through {@link ReportClipper}, so one oversized case
 * never costs the link and with it the worker's remaining cases.</p>
 *
 * <h2>Exit codes</h2>
 * <ul>
 *   <li>{@value #EXIT_OK}: every assigned case was reported</li>
 *   <li>{@value #EXIT_USAGE}: bad arguments (picocli's usage exit code)</li>
 *   <li>{@value #EXIT_PLAN_ERROR}: the plan could not be rebuilt</li>
 *   <li>{@value #EXIT_TRANSPORT_ERROR}: the coordinator link failed</li>
 * </ul>
 */
@Command(
        name = "testtree-worker",
        mixinStandardHelpOptions = true,
        description = "Runs a share of a test plan for a distributed coordinator"
)
public final class DistributedWorkerMain implements Callable<Integer>
{
    private static final Logger log = LoggerFactory.getLogger(DistributedWorkerMain.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_PLAN_ERROR = 3;
    public static final int EXIT_TRANSPORT_ERROR = 4;

    @Option(names = "--plan", required = true, description = "Fully qualified TestPlan class")
    private String planClass;

    @Option(names = "--coordinator", required = true, description = "Coordinator address as host:port")
    private String coordinator;

    @Option(names = "--worker-id", required = true, description = "Id of this worker")
    private int workerId;

    @Option(names = "--timeout-ms", description = "Time left in the run; 0 for no deadline (default: ${DEFAULT-VALUE})",
            defaultValue = "0")
    private long timeoutMillis;

    static final Duration ASSIGN_TIMEOUT = Duration.ofSeconds(30);

    private final BatchFrameEncoder encoder = new BatchFrameEncoder();
    private final BatchFrameDecoder decoder = new BatchFrameDecoder();
    private final ReportClipper clipper = new ReportClipper(encoder);
    private final CompletableFuture<List<Integer>> assignment = new CompletableFuture<>();

    public static void main(String[] args)
    {
        System.exit(execute(args));
    }

    /**
     * Runs a worker in the current JVM and returns its exit code.
     */
    public static int execute(String... args)
    {
        return new CommandLine(new DistributedWorkerMain()).execute(args);
    }

    @Override
    public Integer call()
    {
        final InetSocketAddress address;
        try {
            address = parseAddress(coordinator);
        }
        catch (IllegalArgumentException e) {
            log.error("Worker {}: {}", workerId, e.getMessage());
            return EXIT_USAGE;
        }

        RunGuard guard = timeoutMillis > 0
                ? RunGuard.withTimeout(SystemMonotonicClock.INSTANCE, Duration.ofMillis(timeoutMillis))
                : RunGuard.unbounded(SystemMonotonicClock.INSTANCE);

        try (BatchClient client = new NettyBatchClient()) {
            client.connect(address, bytes -> onInbound(bytes, guard));
            client.send(encoder.encode(new BatchFrame.Hello(workerId)));

            final TestTree tree;
            try {
                tree = rebuild();
            }
            catch (ReflectiveOperationException | RuntimeException | LinkageError e) {
                log.error("Worker {} cannot rebuild plan {}", workerId, planClass, e);
                return EXIT_PLAN_ERROR;
            }

            final List<Integer> cases;
            try {
                cases = awaitAssignment();
            }
            catch (TimeoutException e) {
                log.error("Worker {} received no assignment within {}", workerId, ASSIGN_TIMEOUT);
                return EXIT_TRANSPORT_ERROR;
            }

            Slf4jRunObservabilitySink sink = new Slf4jRunObservabilitySink();
            CaseRunner runner = new CaseRunner(sink, SystemMonotonicClock.INSTANCE, guard);
            String worker = "worker-" + workerId;
            for (int index : cases) {
                if (index < 0 || index >= tree.discovered().size()) {
                    log.error("Worker {}: case index {} does not exist in the rebuilt plan ({} cases)",
                            workerId, index, tree.discovered().size());
                    return EXIT_PLAN_ERROR;
                }
                ScheduledCase sc = tree.discovered().get(index);
                CaseResult result = runner.runOrAbort(sc, worker);
                client.send(clipper.encode(new BatchFrame.CaseReport(workerId, index, sc.id(), result)));
            }

            client.send(encoder.encode(new BatchFrame.Done(workerId)));
            return EXIT_OK;
        }
        catch (TransportException e) {
            log.error("Worker {} lost its coordinator link", workerId, e);
            return EXIT_TRANSPORT_ERROR;
        }
    }

    private List<Integer> awaitAssignment() throws TimeoutException
    {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return assignment.get(ASSIGN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                }
                catch (InterruptedException e) {
                    interrupted = true;
                }
                catch (ExecutionException e) {
                    // Only ever completed normally.
                    throw new IllegalStateException(e.getCause());
                }
            }
        }
        finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private TestTree rebuild() throws ReflectiveOperationException
    {
        Class<?> type = Class.forName(planClass, true, Thread.currentThread().getContextClassLoader());
        if (!TestPlan.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException(planClass + " is not a " + TestPlan.class.getSimpleName());
        }
        TestPlan plan = (TestPlan) type.getConstructor().newInstance();
        return new Scheduler(new Slf4jRunObservabilitySink(), SystemMonotonicClock.INSTANCE).build(plan);
    }

    private void onInbound(byte[] bytes, RunGuard guard)
    {
        try {
            BatchFrame frame = decoder.decodeOrThrow(bytes);
            if (frame instanceof BatchFrame.Assign) {
                BatchFrame.Assign assign = (BatchFrame.Assign) frame;
                if (assign.workerId() != workerId) {
                    log.warn("Worker {} ignoring assignment for worker {}", workerId, assign.workerId());
                }
                else if (!assignment.complete(assign.caseIndices())) {
                    log.warn("Worker {} ignoring repeated assignment", workerId);
                }
                else {
                    log.debug("Worker {} assigned {} case(s)", workerId, assign.caseIndices().size());
                }
            }
            else if (frame instanceof BatchFrame.Abort) {
                String reason = ((BatchFrame.Abort) frame).reason();
                log.info("Worker {} aborting: {}", workerId, reason);
                guard.abort(reason);
            }
            else {
                log.warn("Worker {} ignoring unexpected frame {}", workerId, frame);
            }
        }
        catch (BatchCodecException e) {
            log.warn("Worker {} dropping malformed frame: {}", workerId, e.getMessage());
        }
    }

    static InetSocketAddress parseAddress(String hostPort)
    {
        int colon = hostPort.lastIndexOf(':');
        if (colon <= 0 || colon == hostPort.length() - 1) {
            throw new IllegalArgumentException("coordinator must be host:port, got '" + hostPort + "'");
        }
        final int port;
        try {
            port = Integer.parseInt(hostPort.substring(colon + 1));
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid coordinator port in '" + hostPort + "'", e);
        }
        return new InetSocketAddress(hostPort.substring(0, colon), port);
    }
}
