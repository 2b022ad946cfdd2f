package com.questrail.testtree.report;

/**
 * Raised when a report cannot be rendered or written.
 */
public final class ReportException extends RuntimeException
{
    public ReportException(String message)
    {
        super(message);
    }

    public ReportException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
