package com.questrail.testtree.exec;

import com.questrail.testtree.model.ScheduledCase;
import com.questrail.testtree.record.OutcomeRecorder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ParallelStrategy
 * =============================================================================
 * Runs cases on a fixed pool of worker threads sharing one work list.
 *
 * <h2>Work distribution</h2>
 * <p>Workers claim the next index with {@link AtomicInteger#getAndIncrement()},
 * so no two workers ever claim the same case, and a slow or blocked body only
 * occupies the worker that claimed it. The pool is sized
 * {@code min(workerCount, pending.size())}.</p>
 *
 * <h2>Thread safety of bodies</h2>
 * <p>The engine does not make case bodies reentrant. Its only obligation is that
 * the recorder accepts concurrent writes from distinct cases, which
 * {@link OutcomeRecorder} provides through per-case slots.</p>
 *
 * <h2>Join</h2>
 * <p>{@link #execute} returns once every worker has drained the list. A defect
 * raised by the recorder in a worker (e.g. a duplicate record) is rethrown on
 * the calling thread after the join.</p>
 */
public final class ParallelStrategy implements ExecutionStrategy
{
    private final CaseRunner runner;
    private final int workerCount;

    public ParallelStrategy(CaseRunner runner, int workerCount)
    {
        this.runner = Objects.requireNonNull(runner, "runner");
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        this.workerCount = workerCount;
    }

    @Override
    public String name()
    {
        return "parallel(workers=" + workerCount + ")";
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

        int threads = Math.min(workerCount, pending.size());
        AtomicInteger next = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
        List<Future<?>> workers = new ArrayList<>(threads);
        try {
            for (int w = 0; w < threads; w++) {
                workers.add(pool.submit(() -> drain(pending, next, recorder)));
            }
            join(workers);
        }
        finally {
            pool.shutdown();
        }
    }

    private void drain(List<ScheduledCase> pending, AtomicInteger next, OutcomeRecorder recorder)
    {
        String worker = Thread.currentThread().getName();
        for (int i = next.getAndIncrement(); i < pending.size(); i = next.getAndIncrement()) {
            runner.dispatch(pending.get(i), recorder, worker);
        }
    }

    private static void join(List<Future<?>> workers)
    {
        RuntimeException failure = null;
        boolean interrupted = false;
        for (Future<?> f : workers) {
            while (true) {
                try {
                    f.get();
                    break;
                }
                catch (InterruptedException e) {
                    // In-flight bodies are never interrupted; keep waiting and restore the flag after.
                    interrupted = true;
                }
                catch (ExecutionException e) {
                    RuntimeException cause = asRuntime(e.getCause());
                    if (failure == null) {
                        failure = cause;
                    } else {
                        failure.addSuppressed(cause);
                    }
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static RuntimeException asRuntime(Throwable t)
    {
        if (t instanceof RuntimeException) {
            return (RuntimeException) t;
        }
        return new IllegalStateException("parallel worker failed", t);
    }

    private static final class WorkerThreadFactory implements ThreadFactory
    {
        private static final AtomicInteger POOL_IDS = new AtomicInteger();

        private final int poolId = POOL_IDS.incrementAndGet();
        private final AtomicInteger threadIds = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r)
        {
            Thread t = new Thread(r, "testtree-" + poolId + "-worker-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
