package org.gungame.server.http;

import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP control plane on the JDK's built-in {@link HttpServer}.
 *
 * <p>Requests are served by a fixed pool of daemon worker threads.</p>
 */
public class HttpApiServer implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(HttpApiServer.class);

    private final InetSocketAddress bindAddress;
    private final LobbyHttpHandler handler;
    private final int threads;

    private HttpServer server;
    private ExecutorService executor;

    /**
     * Creates the server. Nothing is bound until {@link #start()}.
     *
     * @param bindAddress address and port, port 0 for ephemeral
     * @param handler     request handler
     * @param threads     worker thread count
     */
    public HttpApiServer(InetSocketAddress bindAddress, LobbyHttpHandler handler, int threads)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.handler = Objects.requireNonNull(handler, "handler");
        if (threads <= 0)
        {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.threads = threads;
    }

    public void start()
    {
        if (server != null)
        {
            throw new IllegalStateException("HTTP server already started");
        }
        try
        {
            server = HttpServer.create(bindAddress, 0);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Failed to bind HTTP server to " + bindAddress, e);
        }

        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(threads, r ->
        {
            Thread t = new Thread(r, "http-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        server.createContext("/", handler);
        server.setExecutor(executor);
        server.start();
        LOG.info("HTTP API listening on {}", server.getAddress());
    }

    /**
     * Returns the bound port, useful when binding to port 0.
     *
     * @return the local port
     * @throws IllegalStateException if not started
     */
    public int getPort()
    {
        if (server == null)
        {
            throw new IllegalStateException("HTTP server not started");
        }
        return server.getAddress().getPort();
    }

    @Override
    public void close()
    {
        if (server == null)
        {
            return;
        }
        LOG.info("Stopping HTTP API");
        server.stop(0);
        executor.shutdownNow();
        server = null;
    }
}
