package com.questrail.testtree.exec.distributed;

import java.io.IOException;

/**
 * Starts worker processes for a distributed run.
 */
@FunctionalInterface
public interface WorkerLauncher
{
    /**
     * @throws IOException if the worker cannot be started
     */
    WorkerProcess launch(WorkerAssignment assignment) throws IOException;
}
