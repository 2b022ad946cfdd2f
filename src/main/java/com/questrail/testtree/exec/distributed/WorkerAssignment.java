package com.questrail.testtree.exec.distributed;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * What one worker process must do: rebuild {@code planClass}, connect to the
 * coordinator, and run the cases at {@code caseIndices} (discovery indices) in
 * the given order.
 *
 * <p>Every field except {@code caseIndices} goes on the worker's command line.
 * The index list has no length bound, so the coordinator sends it in an
 * {@code Assign} frame once the worker has said Hello.</p>
 *
 * @param timeout time left in the run when the worker was launched;
 *                {@code null} when the run has no deadline
 */
public record WorkerAssignment(
        int workerId,
        String planClass,
        String coordinatorHost,
        int coordinatorPort,
        List<Integer> caseIndices,
        Duration timeout
) {
    public WorkerAssignment {
        Objects.requireNonNull(planClass, "planClass");
        Objects.requireNonNull(coordinatorHost, "coordinatorHost");
        caseIndices = List.copyOf(caseIndices);
        if (workerId < 0) {
            throw new IllegalArgumentException("workerId must be >= 0");
        }
        if (coordinatorPort < 1 || coordinatorPort > 65535) {
            throw new IllegalArgumentException("coordinatorPort out of range: " + coordinatorPort);
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
    }

    /**
     * Command-line arguments understood by {@link DistributedWorkerMain}.
     */
    public List<String> toArguments()
    {
        List<String> args = new ArrayList<>();
        args.add("--plan");
        args.add(planClass);
        args.add("--coordinator");
        args.add(coordinatorHost + ":" + coordinatorPort);
        args.add("--worker-id");
        args.add(Integer.toString(workerId));
        if (timeout != null) {
            args.add("--timeout-ms");
            // A zero remainder would read as "no deadline" on the worker side.
            args.add(Long.toString(Math.max(1, timeout.toMillis())));
        }
        return args;
    }
}
