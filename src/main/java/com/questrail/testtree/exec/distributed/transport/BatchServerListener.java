package com.questrail.testtree.exec.distributed.transport;

/**
 * Callback sink for {@link BatchServer}.
 *
 * <p>Callbacks for one connection are delivered serially and in arrival order.
 * Connection ids are assigned by the server and are only meaningful to it and
 * to this listener.</p>
 */
public interface BatchServerListener
{
    void onConnected(int connection);

    /**
     * One complete frame, exactly as the peer sent it (length prefix removed).
     */
    void onFrame(int connection, byte[] frame);

    /**
     * The connection is gone. Called at most once per connection.
     *
     * @param cause transport failure, or {@code null} for an orderly close
     */
    void onDisconnected(int connection, Throwable cause);
}
