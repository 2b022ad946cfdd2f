package com.questrail.testtree.exec.distributed;

/**
 * Handle on one launched worker.
 *
 * <p>Implementations wrap an operating-system process in production and a
 * thread in tests; the coordinator only needs liveness and an exit code.</p>
 */
public interface WorkerProcess
{
    int workerId();

    boolean isAlive();

    /**
     * @throws IllegalStateException if the worker is still running
     */
    int exitCode();

    /** Forcibly terminates the worker. No effect once it has exited. */
    void destroy();

    /** Short human-readable identity for logs, e.g. {@code pid 4711}. */
    String describe();
}
