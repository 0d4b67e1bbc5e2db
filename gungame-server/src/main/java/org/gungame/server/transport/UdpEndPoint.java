package org.gungame.server.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.DatagramChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * Datagram endpoint on an NIO {@link DatagramChannel}.
 *
 * <p>One daemon thread reads packets and hands each to the receive handler.
 * A handler failure is logged and the loop continues with the next packet.
 * Sending happens on the calling thread.</p>
 */
public class UdpEndPoint implements EndPoint
{
    private static final Logger LOG = LoggerFactory.getLogger(UdpEndPoint.class);
    private static final int DEFAULT_BUFFER_SIZE = 65536;
    private static final long SELECT_TIMEOUT_MS = 100;

    private final InetSocketAddress bindAddress;
    private final int receiveBufferSize;

    private volatile DatagramChannel channel;
    private Selector selector;
    private Thread receiveThread;
    private BiConsumer<ByteBuffer, SocketAddress> receiveHandler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * Creates an endpoint that binds to a specific address.
     *
     * @param bindAddress the address and port to bind to
     */
    public UdpEndPoint(InetSocketAddress bindAddress)
    {
        this(bindAddress, DEFAULT_BUFFER_SIZE);
    }

    /**
     * Creates an endpoint with a custom receive buffer size.
     *
     * @param bindAddress       the address and port to bind to
     * @param receiveBufferSize largest datagram that can be received whole
     */
    public UdpEndPoint(InetSocketAddress bindAddress, int receiveBufferSize)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (receiveBufferSize <= 0)
        {
            throw new IllegalArgumentException("receiveBufferSize must be positive: " + receiveBufferSize);
        }
        this.receiveBufferSize = receiveBufferSize;
    }

    /**
     * Creates an endpoint on an ephemeral port, as used by clients and tests.
     *
     * @return a new endpoint
     */
    public static UdpEndPoint client()
    {
        return new UdpEndPoint(new InetSocketAddress(0));
    }

    /**
     * Creates a server endpoint on all interfaces.
     *
     * @param port the port to bind to, 0 for ephemeral
     * @return a new endpoint
     */
    public static UdpEndPoint server(int port)
    {
        return new UdpEndPoint(new InetSocketAddress(port));
    }

    /**
     * Creates a server endpoint on a specific address.
     *
     * @param address the address to bind to
     * @param port    the port to bind to, 0 for ephemeral
     * @return a new endpoint
     */
    public static UdpEndPoint server(String address, int port)
    {
        return new UdpEndPoint(new InetSocketAddress(address, port));
    }

    @Override
    public void setReceiveHandler(BiConsumer<ByteBuffer, SocketAddress> handler)
    {
        this.receiveHandler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public void start()
    {
        if (receiveHandler == null)
        {
            throw new IllegalStateException("Receive handler must be set before starting");
        }
        if (!running.compareAndSet(false, true))
        {
            throw new IllegalStateException("Endpoint already started");
        }

        DatagramChannel opened = null;
        try
        {
            opened = DatagramChannel.open();
            opened.configureBlocking(false);
            opened.bind(bindAddress);
            selector = Selector.open();
            opened.register(selector, SelectionKey.OP_READ);
        }
        catch (IOException e)
        {
            running.set(false);
            if (opened != null)
            {
                closeQuietly(opened, "channel");
            }
            if (selector != null)
            {
                closeQuietly(selector, "selector");
            }
            throw new UncheckedIOException("Failed to bind UDP endpoint to " + bindAddress, e);
        }
        channel = opened;

        SocketAddress local = getLocalAddress();
        receiveThread = new Thread(this::receiveLoop, "udp-endpoint-" + local);
        receiveThread.setDaemon(true);
        receiveThread.start();
        LOG.info("UDP endpoint listening on {}", local);
    }

    @Override
    public boolean send(ByteBuffer data, SocketAddress destination)
    {
        if (!running.get())
        {
            throw new IllegalStateException("Endpoint not running");
        }

        try
        {
            // A non-blocking channel returns 0 when the socket buffer is full.
            return channel.send(data, destination) > 0 || !data.hasRemaining();
        }
        catch (IOException e)
        {
            LOG.warn("Failed to send packet to {}: {}", destination, e.getMessage());
            return false;
        }
    }

    @Override
    public void close()
    {
        if (!running.compareAndSet(true, false))
        {
            return;
        }
        LOG.info("Closing UDP endpoint {}", getLocalAddress());

        selector.wakeup();
        awaitReceiveThread();
        closeQuietly(selector, "selector");
        closeQuietly(channel, "channel");
    }

    private void awaitReceiveThread()
    {
        try
        {
            receiveThread.join(1000);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        if (receiveThread.isAlive())
        {
            LOG.warn("Receive thread {} did not stop within 1s", receiveThread.getName());
        }
    }

    private static void closeQuietly(Closeable resource, String what)
    {
        try
        {
            resource.close();
        }
        catch (IOException e)
        {
            LOG.warn("Error closing UDP {}", what, e);
        }
    }

    @Override
    public SocketAddress getLocalAddress()
    {
        DatagramChannel current = channel;
        if (current == null || !current.isOpen())
        {
            return null;
        }
        try
        {
            return current.getLocalAddress();
        }
        catch (IOException e)
        {
            return null;
        }
    }

    /**
     * Returns the bound port, useful when binding to port 0.
     *
     * @return the local port, or -1 if not bound
     */
    public int getLocalPort()
    {
        SocketAddress local = getLocalAddress();
        return local instanceof InetSocketAddress inet ? inet.getPort() : -1;
    }

    // ========== Receive thread ==========

    private void receiveLoop()
    {
        ByteBuffer buffer = ByteBuffer.allocate(receiveBufferSize);

        while (running.get())
        {
            try
            {
                // Bounded wait so the loop notices close().
                if (selector.select(SELECT_TIMEOUT_MS) > 0)
                {
                    selector.selectedKeys().clear();
                    drain(buffer);
                }
            }
            catch (IOException | ClosedSelectorException e)
            {
                if (running.get())
                {
                    LOG.error("UDP receive failed", e);
                }
            }
        }

        LOG.debug("Receive loop exited");
    }

    /**
     * Delivers every datagram queued on the channel.
     */
    private void drain(ByteBuffer buffer) throws IOException
    {
        while (true)
        {
            buffer.clear();
            SocketAddress source = channel.receive(buffer);
            if (source == null)
            {
                return;
            }
            buffer.flip();
            try
            {
                receiveHandler.accept(buffer, source);
            }
            catch (RuntimeException e)
            {
                LOG.error("Receive handler failed for packet from {}", source, e);
            }
        }
    }
}
