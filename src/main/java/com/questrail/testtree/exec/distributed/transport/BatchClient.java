package com.questrail.testtree.exec.distributed.transport;

import java.net.InetSocketAddress;
import java.util.function.Consumer;

/**
 * BatchClient
 * -----------------------------------------------------------------------------
 * Worker side of the worker link.
 *
 * <p>{@link #send(byte[])} returns only once the frame has been handed to the
 * operating system, so every frame sent before a worker dies is visible to the
 * coordinator.</p>
 */
public interface BatchClient extends AutoCloseable
{
    /**
     * Connect to the coordinator.
     *
     * @param inbound receives every frame the coordinator sends
     * @throws TransportException if the connection cannot be established
     */
    void connect(InetSocketAddress coordinator, Consumer<byte[]> inbound);

    /**
     * @throws TransportException if the frame cannot be written
     */
    void send(byte[] frame);

    @Override
    void close();
}
