package com.questrail.testtree.exec.distributed;

import com.questrail.testtree.api.TestPlan;
import com.questrail.testtree.exec.CaseRunner;
import com.questrail.testtree.exec.ExecutionStrategy;
import com.questrail.testtree.exec.RunGuard;
import com.questrail.testtree.exec.distributed.codec.BatchCodecException;
import com.questrail.testtree.exec.distributed.codec.BatchFrame;
import com.questrail.testtree.exec.distributed.codec.BatchFrameDecoder;
import com.questrail.testtree.exec.distributed.codec.BatchFrameEncoder;
import com.questrail.testtree.exec.distributed.transport.BatchServer;
import com.questrail.testtree.exec.distributed.transport.BatchServerListener;
import com.questrail.testtree.exec.distributed.transport.netty.NettyBatchServer;
import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.CaseStatus;
import com.questrail.testtree.model.ScheduledCase;
import com.questrail.testtree.observability.CaseFinishedEvent;
import com.questrail.testtree.observability.RunObservabilitySink;
import com.questrail.testtree.record.DuplicateRecordException;
import com.questrail.testtree.record.OutcomeRecorder;
import com.questrail.testtree.time.MonotonicClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.function.Supplier;

/**
 * DistributedStrategy
 * =============================================================================
 * Runs cases in separate worker processes and merges their reports.
 *
 * <h2>Flow</h2>
 * <pre>
 *   pending ──round-robin──▶ W assignments
 *   coordinator binds loopback, launches W workers
 *   worker: Hello                        ◀── Assign (that worker's indices)
 *   worker: CaseReport*, Done            ──▶ recorder.record(...)
 *   guard stops: coordinator broadcasts Abort
 *   every worker exited and drained      ──▶ unreported cases are synthesized
 * </pre>
 *
 * <h2>Crash semantics</h2>
 * <p>A worker that exits before reporting some of its cases (non-zero exit,
 * signal, or a body that halts the JVM) does not fail the run. Each unreported
 * case is recorded as {@link CaseStatus#CRASHED} with the worker's exit code;
 * reports that arrived before the crash are kept.</p>
 *
 * <h2>Abort</h2>
 * <p>When the {@link RunGuard} stops, workers are told to stop starting cases.
 * Workers still alive {@code abortGrace} later are terminated, and their
 * unreported cases are recorded as {@link CaseStatus#ABORTED}.</p>
 *
 * <h2>Plan identity</h2>
 * <p>Workers rebuild the plan from its class, so the plan must be rebuildable by
 * name and must discover the same cases in the same order every time. A report
 * whose case id disagrees with the coordinator's case at that index is recorded
 * as a crash of that case.</p>
 */
public final class DistributedStrategy implements ExecutionStrategy
{
    private static final Logger log = LoggerFactory.getLogger(DistributedStrategy.class);

    static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);
    static final Duration DEFAULT_ABORT_GRACE = Duration.ofSeconds(10);
    private static final long POLL_MILLIS = 20;

    private final Class<? extends TestPlan> planClass;
    private final int workerCount;
    private final WorkerLauncher launcher;
    private final RunGuard guard;
    private final RunObservabilitySink sink;
    private final MonotonicClock clock;
    private final Supplier<BatchServer> servers;
    private final Duration drainTimeout;
    private final Duration abortGrace;

    public DistributedStrategy(Class<? extends TestPlan> planClass,
                               int workerCount,
                               WorkerLauncher launcher,
                               RunGuard guard,
                               RunObservabilitySink sink,
                               MonotonicClock clock)
    {
        this(planClass, workerCount, launcher, guard, sink, clock,
                NettyBatchServer::loopback, DEFAULT_DRAIN_TIMEOUT, DEFAULT_ABORT_GRACE);
    }

    DistributedStrategy(Class<? extends TestPlan> planClass,
                        int workerCount,
                        WorkerLauncher launcher,
                        RunGuard guard,
                        RunObservabilitySink sink,
                        MonotonicClock clock,
                        Supplier<BatchServer> servers,
                        Duration drainTimeout,
                        Duration abortGrace)
    {
        this.planClass = Objects.requireNonNull(planClass, "planClass");
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        this.workerCount = workerCount;
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.servers = Objects.requireNonNull(servers, "servers");
        this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
        this.abortGrace = Objects.requireNonNull(abortGrace, "abortGrace");
    }

    @Override
    public String name()
    {
        return "distributed(workers=" + workerCount + ")";
    }

    public int workerCount()
    {
        return workerCount;
    }

    @Override
    public void execute(List<ScheduledCase> pending, OutcomeRecorder recorder)
    {
        if (pending.isEmpty()) {
            return;
        }

        List<WorkerSlot> slots = assign(pending, workerCount);
        BatchServer server = servers.get();
        Coordinator coordinator = new Coordinator(slots, recorder, server);
        server.setListener(coordinator);
        InetSocketAddress address = server.start();
        log.info("Coordinator listening on {} for {} worker(s), {} case(s)", address, slots.size(), pending.size());

        try {
            for (WorkerSlot slot : slots) {
                launch(slot, address);
            }
            await(slots, coordinator);
        }
        finally {
            server.stop();
            for (WorkerSlot slot : slots) {
                if (slot.process != null && slot.process.isAlive()) {
                    slot.process.destroy();
                }
            }
        }

        recordUnreported(slots, recorder);
    }

    /** Round-robin by position in the work list. */
    static List<WorkerSlot> assign(List<ScheduledCase> pending, int workerCount)
    {
        int n = Math.min(workerCount, pending.size());
        List<WorkerSlot> slots = new ArrayList<>(n);
        for (int w = 0; w < n; w++) {
            slots.add(new WorkerSlot(w));
        }
        for (int i = 0; i < pending.size(); i++) {
            slots.get(i % n).add(pending.get(i));
        }
        return slots;
    }

    private void launch(WorkerSlot slot, InetSocketAddress address)
    {
        Optional<String> stop = guard.stopReason();
        if (stop.isPresent()) {
            slot.notLaunched = stop.get();
            return;
        }

        // The indices travel in the Assign frame, never on the command line.
        WorkerAssignment assignment = new WorkerAssignment(
                slot.id,
                planClass.getName(),
                address.getHostString(),
                address.getPort(),
                slot.indices(),
                guard.remaining().orElse(null));
        try {
            slot.process = launcher.launch(assignment);
            log.info("Worker {} ({}) assigned {} case(s)", slot.id, slot.process.describe(), slot.cases.size());
        }
        catch (IOException | RuntimeException e) {
            slot.launchFailure = e.toString();
            log.error("Worker {} could not be started", slot.id, e);
        }
    }

    private void await(List<WorkerSlot> slots, Coordinator coordinator)
    {
        final long drainNanos = drainTimeout.toNanos();
        long abortedAt = 0;
        boolean aborting = false;
        boolean terminated = false;

        while (true) {
            long now = clock.nowNanos();
            if (!aborting) {
                Optional<String> stop = guard.stopReason();
                if (stop.isPresent()) {
                    aborting = true;
                    abortedAt = now;
                    log.warn("Run stopping ({}); telling workers to abort", stop.get());
                    coordinator.abort(stop.get());
                }
            }
            else if (!terminated && now - abortedAt >= abortGrace.toNanos()) {
                terminated = true;
                terminateAlive(slots);
            }

            boolean settled = true;
            for (WorkerSlot slot : slots) {
                settled &= slot.isSettled(now, drainNanos);
            }
            if (settled) {
                return;
            }

            try {
                Thread.sleep(POLL_MILLIS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                guard.abort("coordinator interrupted");
                terminateAlive(slots);
                return;
            }
        }
    }

    private static void terminateAlive(List<WorkerSlot> slots)
    {
        for (WorkerSlot slot : slots) {
            if (slot.process != null && slot.process.isAlive()) {
                log.warn("Terminating worker {} ({})", slot.id, slot.process.describe());
                slot.terminated = true;
                slot.process.destroy();
            }
        }
    }

    private void recordUnreported(List<WorkerSlot> slots, OutcomeRecorder recorder)
    {
        for (WorkerSlot slot : slots) {
            for (ScheduledCase sc : slot.cases) {
                if (recorder.isRecorded(sc.id())) {
                    continue;
                }
                CaseResult result = unreported(slot);
                recorder.record(sc.id(), result);
                sink.onCaseFinished(new CaseFinishedEvent(Instant.now(), sc.id(), result));
            }
        }
    }

    private CaseResult unreported(WorkerSlot slot)
    {
        if (slot.notLaunched != null) {
            return CaseRunner.aborted(slot.notLaunched);
        }
        if (slot.launchFailure != null) {
            return CaseResult.unexecuted(CaseStatus.CRASHED,
                    "worker process " + slot.id + " could not be started: " + slot.launchFailure);
        }
        if (slot.terminated) {
            return CaseRunner.aborted(guard.stopReason().orElse("run stopped")
                    + "; worker process " + slot.id + " was terminated");
        }
        String exit = slot.process.isAlive() ? "unknown" : Integer.toString(slot.process.exitCode());
        return CaseResult.unexecuted(CaseStatus.CRASHED,
                "worker process " + slot.id + " exited with code " + exit + " before reporting this case");
    }

    /**
     * Per-worker bookkeeping. Written by the coordinator thread, except the
     * connection fields, which the transport thread writes.
     */
    static final class WorkerSlot
    {
        final int id;
        final List<ScheduledCase> cases = new ArrayList<>();
        final Map<Integer, ScheduledCase> byIndex = new HashMap<>();
        final CountDownLatch disconnected = new CountDownLatch(1);

        volatile WorkerProcess process;
        volatile String launchFailure;
        volatile String notLaunched;
        volatile boolean terminated;
        volatile boolean done;

        private long exitSeenAt = -1;

        WorkerSlot(int id)
        {
            this.id = id;
        }

        void add(ScheduledCase sc)
        {
            cases.add(sc);
            byIndex.put(sc.index(), sc);
        }

        List<Integer> indices()
        {
            List<Integer> out = new ArrayList<>(cases.size());
            for (ScheduledCase sc : cases) {
                out.add(sc.index());
            }
            return out;
        }

        /**
         * Whether nothing more can arrive from this worker: it never started, or
         * it exited and its connection closed (or had {@code drainNanos} to).
         */
        boolean isSettled(long now, long drainNanos)
        {
            if (process == null) {
                return true;
            }
            if (process.isAlive()) {
                return false;
            }
            if (exitSeenAt < 0) {
                exitSeenAt = now;
            }
            return disconnected.getCount() == 0 || now - exitSeenAt >= drainNanos;
        }
    }

    /**
     * Transport callbacks; decodes frames and records reports.
     */
    private final class Coordinator implements BatchServerListener
    {
        private final Map<Integer, WorkerSlot> slotsById = new HashMap<>();
        private final Map<Integer, WorkerSlot> byConnection = new ConcurrentHashMap<>();
        private final OutcomeRecorder recorder;
        private final BatchServer server;
        private final BatchFrameEncoder encoder = new BatchFrameEncoder();
        private final BatchFrameDecoder decoder = new BatchFrameDecoder();

        private volatile String abortReason;

        Coordinator(List<WorkerSlot> slots, OutcomeRecorder recorder, BatchServer server)
        {
            for (WorkerSlot slot : slots) {
                slotsById.put(slot.id, slot);
            }
            this.recorder = recorder;
            this.server = server;
        }

        void abort(String reason)
        {
            abortReason = reason;
            server.broadcast(encoder.encode(new BatchFrame.Abort(reason)));
        }

        @Override
        public void onConnected(int connection)
        {
            log.debug("Worker connection {} opened", connection);
        }

        @Override
        public void onFrame(int connection, byte[] bytes)
        {
            final BatchFrame frame;
            try {
                frame = decoder.decodeOrThrow(bytes);
            }
            catch (BatchCodecException e) {
                log.warn("Dropping malformed frame on connection {}: {}", connection, e.getMessage());
                return;
            }

            if (frame instanceof BatchFrame.Hello) {
                onHello(connection, (BatchFrame.Hello) frame);
            }
            else if (frame instanceof BatchFrame.CaseReport) {
                onReport(connection, (BatchFrame.CaseReport) frame);
            }
            else if (frame instanceof BatchFrame.Done) {
                WorkerSlot slot = byConnection.get(connection);
                if (slot != null) {
                    slot.done = true;
                    log.debug("Worker {} reported all of its cases", slot.id);
                }
            }
            else {
                log.warn("Ignoring unexpected frame on connection {}: {}", connection, frame);
            }
        }

        private void onHello(int connection, BatchFrame.Hello hello)
        {
            WorkerSlot slot = slotsById.get(hello.workerId());
            if (slot == null) {
                log.warn("Connection {} claims unknown worker id {}", connection, hello.workerId());
                return;
            }
            if (byConnection.putIfAbsent(connection, slot) != null) {
                log.warn("Ignoring repeated Hello from worker {} on connection {}", slot.id, connection);
                return;
            }
            server.send(connection, encoder.encode(new BatchFrame.Assign(slot.id, slot.indices())));
            String reason = abortReason;
            if (reason != null) {
                // Connected after the broadcast.
                server.send(connection, encoder.encode(new BatchFrame.Abort(reason)));
            }
        }

        private void onReport(int connection, BatchFrame.CaseReport report)
        {
            WorkerSlot slot = byConnection.get(connection);
            if (slot == null || slot.id != report.workerId()) {
                log.warn("Dropping report for {} from unidentified connection {}", report.caseId(), connection);
                return;
            }
            ScheduledCase sc = slot.byIndex.get(report.index());
            if (sc == null) {
                log.warn("Worker {} reported case index {} it was not assigned", slot.id, report.index());
                return;
            }

            CaseResult result = report.result();
            if (!sc.id().equals(report.caseId())) {
                result = CaseResult.unexecuted(CaseStatus.CRASHED, "worker process " + slot.id
                        + " rebuilt a different plan: expected " + sc.id() + " at index " + sc.index()
                        + " but found " + report.caseId());
            }
            try {
                recorder.record(sc.id(), result);
            }
            catch (DuplicateRecordException e) {
                log.warn("Worker {} reported {} twice; keeping the first report", slot.id, sc.id());
                return;
            }
            sink.onCaseFinished(new CaseFinishedEvent(Instant.now(), sc.id(), result));
        }

        @Override
        public void onDisconnected(int connection, Throwable cause)
        {
            WorkerSlot slot = byConnection.get(connection);
            if (slot == null) {
                log.debug("Unidentified connection {} closed", connection);
                return;
            }
            if (cause != null) {
                log.warn("Connection of worker {} failed: {}", slot.id, cause.toString());
            }
            else if (!slot.done) {
                log.warn("Worker {} disconnected before finishing", slot.id);
            }
            slot.disconnected.countDown();
        }
    }
}
