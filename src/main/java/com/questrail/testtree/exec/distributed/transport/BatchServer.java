package com.questrail.testtree.exec.distributed.transport;

import java.net.InetSocketAddress;

/**
 * BatchServer
 * -----------------------------------------------------------------------------
 * Coordinator side of the worker link: a stream listener that delivers whole
 * frames from any number of worker connections.
 *
 * <p>Implementations perform transport I/O only. They never decode frames and
 * never decide what a frame means; that belongs to the coordinator.</p>
 */
public interface BatchServer
{
    /**
     * Register the listener that receives frames and connection events.
     * Must be called before {@link #start()}.
     */
    void setListener(BatchServerListener listener);

    /**
     * Bind and begin accepting connections.
     *
     * @return the address workers must connect to
     * @throws TransportException if the server cannot bind
     */
    InetSocketAddress start();

    /**
     * Send one frame to a single connection. Best effort: a connection that is
     * unknown or already closed is skipped.
     */
    void send(int connection, byte[] frame);

    /**
     * Send one frame to every open connection. Best effort: connections that
     * close concurrently are skipped.
     */
    void broadcast(byte[] frame);

    /** Close every connection and release transport resources. Idempotent. */
    void stop();
}
