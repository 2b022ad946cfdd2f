package com.questrail.testtree.core;

/**
 * Helpers for the engine's catch-all boundaries (suite discovery, case bodies).
 */
public final class Throwables
{
    private Throwables() {}

    /**
     * Rethrows errors the JVM cannot recover from; everything else is left for
     * the caller to record. A {@link StackOverflowError} has already unwound the
     * frames that overflowed by the time it is caught, so it is recordable.
     */
    public static void rethrowIfUnrecoverable(Throwable t)
    {
        if (t instanceof VirtualMachineError && !(t instanceof StackOverflowError)) {
            throw (VirtualMachineError) t;
        }
    }
}
