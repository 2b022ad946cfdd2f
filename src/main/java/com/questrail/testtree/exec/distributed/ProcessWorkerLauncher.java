package com.questrail.testtree.exec.distributed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ProcessWorkerLauncher
 * =============================================================================
 * Forks each worker as a separate JVM running {@link DistributedWorkerMain}.
 *
 * <h2>Classpath</h2>
 * <p>The child inherits the classpath of this JVM. Under Surefire the effective
 * test classpath is published as {@value #SUREFIRE_CLASSPATH_PROPERTY}, which
 * takes precedence over {@code java.class.path} (a manifest-only jar there).</p>
 *
 * <h2>Output</h2>
 * <p>Standard output and error of the child are merged and forwarded line by
 * line to this class's logger by a daemon thread.</p>
 *
 * <p>Bodies can detect that they run in a worker through the system property
 * {@value #WORKER_ID_PROPERTY}.</p>
 */
public final class ProcessWorkerLauncher implements WorkerLauncher
{
    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    public static final String WORKER_ID_PROPERTY = "testtree.worker.id";

    static final String SUREFIRE_CLASSPATH_PROPERTY = "surefire.test.class.path";

    private final String javaExecutable;
    private final String classpath;
    private final List<String> jvmOptions;

    public ProcessWorkerLauncher()
    {
        this(defaultJavaExecutable(), defaultClasspath(), List.of());
    }

    public ProcessWorkerLauncher(String javaExecutable, String classpath, List<String> jvmOptions)
    {
        this.javaExecutable = Objects.requireNonNull(javaExecutable, "javaExecutable");
        this.classpath = Objects.requireNonNull(classpath, "classpath");
        this.jvmOptions = List.copyOf(jvmOptions);
    }

    @Override
    public WorkerProcess launch(WorkerAssignment assignment) throws IOException
    {
        Objects.requireNonNull(assignment, "assignment");

        List<String> command = command(assignment);
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();

        Thread pump = new Thread(() -> forwardOutput(assignment.workerId(), process),
                "testtree-worker-" + assignment.workerId() + "-output");
        pump.setDaemon(true);
        pump.start();

        log.debug("Started worker {} as pid {}", assignment.workerId(), process.pid());
        return new OsWorkerProcess(assignment.workerId(), process);
    }

    List<String> command(WorkerAssignment assignment)
    {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        command.addAll(jvmOptions);
        command.add("-D" + WORKER_ID_PROPERTY + "=" + assignment.workerId());
        command.add("-cp");
        command.add(classpath);
        command.add(DistributedWorkerMain.class.getName());
        command.addAll(assignment.toArguments());
        return command;
    }

    static String defaultJavaExecutable()
    {
        return Paths.get(System.getProperty("java.home"), "bin", "java").toString();
    }

    static String defaultClasspath()
    {
        String surefire = System.getProperty(SUREFIRE_CLASSPATH_PROPERTY);
        if (surefire != null && !surefire.isBlank()) {
            return surefire;
        }
        return System.getProperty("java.class.path");
    }

    private static void forwardOutput(int workerId, Process process)
    {
        try (BufferedReader in = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                log.info("[worker {}] {}", workerId, line);
            }
        }
        catch (IOException e) {
            // Stream closes abruptly when the child is destroyed.
            log.debug("Output of worker {} ended: {}", workerId, e.getMessage());
        }
    }

    private static final class OsWorkerProcess implements WorkerProcess
    {
        private final int workerId;
        private final Process process;

        OsWorkerProcess(int workerId, Process process)
        {
            this.workerId = workerId;
            this.process = process;
        }

        @Override
        public int workerId()
        {
            return workerId;
        }

        @Override
        public boolean isAlive()
        {
            return process.isAlive();
        }

        @Override
        public int exitCode()
        {
            if (process.isAlive()) {
                throw new IllegalStateException("worker " + workerId + " is still running");
            }
            return process.exitValue();
        }

        @Override
        public void destroy()
        {
            process.destroyForcibly();
        }

        @Override
        public String describe()
        {
            return "pid " + process.pid();
        }
    }
}
