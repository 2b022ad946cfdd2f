package com.questrail.testtree.exec.distributed.transport;

/**
 * Raised when the worker link cannot be opened or written.
 */
public final class TransportException extends RuntimeException
{
    public TransportException(String message)
    {
        super(message);
    }

    public TransportException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
