package com.questrail.testtree.exec.distributed;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs {@link DistributedWorkerMain} on a thread instead of a forked JVM, so
 * the full coordinator/worker protocol is exercised without process start-up.
 */
final class InProcessWorkerLauncher implements WorkerLauncher
{
    final List<WorkerAssignment> launched = new CopyOnWriteArrayList<>();

    @Override
    public WorkerProcess launch(WorkerAssignment assignment)
    {
        launched.add(assignment);
        String[] args = assignment.toArguments().toArray(new String[0]);
        return ThreadWorkerProcess.start(assignment.workerId(), () -> DistributedWorkerMain.execute(args));
    }
}
