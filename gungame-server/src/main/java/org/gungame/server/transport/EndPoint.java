package org.gungame.server.transport;

import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.util.function.BiConsumer;

/**
 * A datagram socket that sends and receives raw bytes.
 *
 * <p>The endpoint knows nothing about message formats. Delivery is best
 * effort: packets may be lost, duplicated or reordered.</p>
 */
public interface EndPoint extends AutoCloseable
{
    /**
     * Sends data to a destination address.
     *
     * <p>This method is thread-safe and may be called from any thread.
     * Send failures are logged, not thrown.</p>
     *
     * @param data        the data to send (position to limit)
     * @param destination the destination address
     * @return true if the datagram was handed to the network
     * @throws IllegalStateException if the endpoint is not running
     */
    boolean send(ByteBuffer data, SocketAddress destination);

    /**
     * Sets the handler for received data.
     *
     * <p>The handler is called from the endpoint's receive thread and must
     * not block. The buffer is only valid during the callback.</p>
     *
     * @param handler called with (data, sourceAddress) for each packet
     */
    void setReceiveHandler(BiConsumer<ByteBuffer, SocketAddress> handler);

    /**
     * Binds the socket and starts receiving.
     */
    void start();

    /**
     * Closes the endpoint and releases resources.
     */
    @Override
    void close();

    /**
     * Returns the local address this endpoint is bound to.
     *
     * @return the local socket address, or null if not bound
     */
    SocketAddress getLocalAddress();
}
