package com.questrail.testtree.cli;

import com.questrail.testtree.api.TestPlan;
import com.questrail.testtree.config.RunOptions;
import com.questrail.testtree.config.StrategyName;
import com.questrail.testtree.runtime.RunResult;
import com.questrail.testtree.runtime.TestTreeRunner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * CLI command: testtree [options] &lt;planClass&gt;
 * <p>
 * Loads a {@link TestPlan} by class name, runs it with the chosen strategy and
 * prints the summary table.
 * <p>
 * Exit codes: {@value #EXIT_SUCCESS} all assertions held, {@value #EXIT_TEST_FAILURE}
 * a failure, error or build error occurred, {@value #EXIT_USAGE} bad arguments or
 * an unloadable plan.
 */
@Command(
        name = "testtree",
        mixinStandardHelpOptions = true,
        version = "testtree 0.1.0",
        description = "Runs a test plan with a sequential, shuffled, parallel or distributed strategy"
)
public class TestTreeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TestTreeCommand.class);

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_TEST_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    @Parameters(index = "0", paramLabel = "<planClass>", description = "Fully qualified TestPlan class name")
    private String planClass;

    @Option(names = "--strategy", converter = StrategyNameConverter.class, defaultValue = "sequential",
            description = "sequential, shuffled, parallel or distributed (default: ${DEFAULT-VALUE})")
    private StrategyName strategy;

    @Option(names = "--seed", defaultValue = "0", description = "Seed of the shuffled strategy (default: ${DEFAULT-VALUE})")
    private long seed;

    @Option(names = "--workers", description = "Worker threads or processes (default: available processors)")
    private Integer workers;

    @Option(names = "--filter", description = "Path prefix (a/b) or glob (a/**/c*) selecting the cases to run")
    private String filter;

    @Option(names = "--timeout", converter = DurationConverter.class,
            description = "Stop starting cases after this long; milliseconds or ISO-8601 (PT30S)")
    private Duration timeout;

    @Option(names = "--xml", description = "Write a JUnit XML report to this file")
    private Path xml;

    @Spec
    private CommandSpec spec;

    private final Supplier<TestTreeRunner> runners;

    public TestTreeCommand() {
        this(TestTreeRunner::new);
    }

    public TestTreeCommand(Supplier<TestTreeRunner> runners) {
        this.runners = runners;
    }

    public static void main(String[] args) {
        System.exit(execute(new TestTreeCommand(), args));
    }

    /** Parses {@code args}, runs the command and returns its exit code. */
    public static int execute(TestTreeCommand command, String... args) {
        return new CommandLine(command).execute(args);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        final TestPlan plan;
        final RunOptions options;
        try {
            plan = loadPlan(planClass);
            RunOptions.Builder builder = RunOptions.builder()
                    .withSeed(seed)
                    .withTimeout(timeout)
                    .withXmlOutputPath(xml);
            if (workers != null) {
                builder.withWorkerCount(workers);
            }
            if (filter != null) {
                builder.withFilter(filter);
            }
            options = builder.build();
        }
        catch (IllegalArgumentException e) {
            err.println("testtree: " + e.getMessage());
            return EXIT_USAGE;
        }

        final RunResult result;
        try {
            result = runners.get().run(plan, strategy, options);
        }
        catch (IllegalArgumentException e) {
            err.println("testtree: " + e.getMessage());
            return EXIT_USAGE;
        }

        out.print(result.summary());
        result.xmlReportPath().ifPresent(p -> out.println("JUnit XML report: " + p));
        out.flush();
        log.debug("Plan {} finished with {}", planClass, result.totals());
        return result.success() ? EXIT_SUCCESS : EXIT_TEST_FAILURE;
    }

    static TestPlan loadPlan(String className) {
        final Class<?> type;
        try {
            type = Class.forName(className, true, Thread.currentThread().getContextClassLoader());
        }
        catch (ClassNotFoundException | LinkageError e) {
            throw new IllegalArgumentException("cannot load plan class " + className + ": " + e, e);
        }
        if (!TestPlan.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException(className + " does not implement " + TestPlan.class.getName());
        }
        try {
            return (TestPlan) type.getConstructor().newInstance();
        }
        catch (ReflectiveOperationException | RuntimeException e) {
            throw new IllegalArgumentException("cannot instantiate plan " + className
                    + " (a public no-arg constructor is required): " + e, e);
        }
    }
}
