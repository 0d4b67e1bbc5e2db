package org.gungame.server;

import org.gungame.server.config.DefaultLobby;
import org.gungame.server.config.ServerConfig;
import org.gungame.server.config.ServerConfigLoader;
import org.gungame.server.domain.CombatDomain;
import org.gungame.server.domain.LobbyDomain;
import org.gungame.server.domain.LobbySnapshot;
import org.gungame.server.http.HttpApiServer;
import org.gungame.server.http.LobbyHttpHandler;
import org.gungame.server.simulation.StubWorldSimulator;
import org.gungame.server.simulation.WorldSimulator;
import org.gungame.server.state.SharedState;
import org.gungame.server.stats.DefaultServerStats;
import org.gungame.server.stats.ServerStats;
import org.gungame.server.task.DummyBotTask;
import org.gungame.server.task.InactivitySweepTask;
import org.gungame.server.task.ReloadTickTask;
import org.gungame.server.task.StateSyncTask;
import org.gungame.server.task.TaskScheduler;
import org.gungame.server.transport.UdpEndPoint;
import org.gungame.server.udp.Broadcaster;
import org.gungame.server.udp.UdpDispatcher;
import org.gungame.server.weapon.WeaponDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * The game server process: HTTP lobby control plane, UDP data plane and
 * periodic tasks around one shared state.
 *
 * <p>Start order matters: the UDP endpoint binds first so the HTTP API can
 * report its actual port, which may be ephemeral in tests.</p>
 */
public class GameServer implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(GameServer.class);

    /**
     * Monotonic millisecond clock used for all game timing.
     */
    public static final LongSupplier MONOTONIC_CLOCK = () -> System.nanoTime() / 1_000_000L;

    private final ServerConfig config;
    private final LongSupplier clock;
    private final SharedState state;
    private final DefaultServerStats stats;
    private final LobbyDomain lobbies;
    private final CombatDomain combat;
    private final UdpEndPoint endPoint;
    private final Broadcaster broadcaster;
    private final HttpApiServer httpServer;
    private final TaskScheduler scheduler = new TaskScheduler();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);

    /**
     * Creates a server with the weapon table named in the configuration and
     * no hit detection.
     *
     * @param config server configuration
     */
    public GameServer(ServerConfig config)
    {
        this(config, WeaponDatabase.load(config.getWeaponsResource()), new StubWorldSimulator(), MONOTONIC_CLOCK);
    }

    /**
     * Creates a server with explicit collaborators.
     *
     * @param config    server configuration
     * @param weapons   weapon table
     * @param simulator world queries for hit resolution
     * @param clock     millisecond clock
     */
    public GameServer(ServerConfig config, WeaponDatabase weapons, WorldSimulator simulator, LongSupplier clock)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.state = new SharedState();
        this.stats = new DefaultServerStats(state);
        this.lobbies = new LobbyDomain(config, weapons);
        this.combat = new CombatDomain(weapons, simulator);

        this.endPoint = UdpEndPoint.server(config.getBindAddress(), config.getUdpPort());
        this.broadcaster = new Broadcaster(endPoint, stats);
        endPoint.setReceiveHandler(new UdpDispatcher(state, lobbies, combat, broadcaster, stats, clock));

        LobbyHttpHandler handler = new LobbyHttpHandler(
                state, lobbies, stats, config, endPoint::getLocalPort, clock);
        this.httpServer = new HttpApiServer(
                new InetSocketAddress(config.getBindAddress(), config.getHttpPort()), handler, config.getHttpThreads());
    }

    // ========== Lifecycle ==========

    public void start()
    {
        if (!running.compareAndSet(false, true))
        {
            throw new IllegalStateException("Server already started");
        }

        long startMs = clock.getAsLong();
        createDefaultLobbies(startMs);

        endPoint.start();
        httpServer.start();

        scheduler.scheduleAtFixedRate("reload-tick",
                new ReloadTickTask(state, combat, broadcaster, clock), config.getReloadTick());
        scheduler.scheduleAtFixedRate("inactivity-sweep",
                new InactivitySweepTask(state, lobbies, broadcaster, stats, clock, config.getInactivityTimeout()),
                config.getSweepInterval());
        scheduler.scheduleAtFixedRate("state-sync",
                new StateSyncTask(state, combat, broadcaster), config.getStateSyncInterval());
        if (config.isDummyBotEnabled())
        {
            scheduler.scheduleAtFixedRate("dummy-bot",
                    new DummyBotTask(state, broadcaster, clock, startMs), config.getDummyBotTick());
        }

        LOG.info("Game server started: HTTP port {}, UDP port {}", getHttpPort(), getUdpPort());
    }

    private void createDefaultLobbies(long nowMs)
    {
        for (DefaultLobby lobby : config.getDefaultLobbies())
        {
            state.write(s -> lobbies.createLobby(s, lobby.code(), lobby.maxPlayers(), lobby.scene(), nowMs, true));
        }
    }

    @Override
    public void close()
    {
        if (!running.compareAndSet(true, false))
        {
            return;
        }
        scheduler.close();
        httpServer.close();
        endPoint.close();
        stopped.countDown();
        LOG.info("Game server stopped");
    }

    /**
     * Blocks until {@link #close()} has run.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitStop() throws InterruptedException
    {
        stopped.await();
    }

    // ========== Accessors ==========

    public int getHttpPort()
    {
        return httpServer.getPort();
    }

    public int getUdpPort()
    {
        return endPoint.getLocalPort();
    }

    public ServerStats getStats()
    {
        return stats;
    }

    public ServerConfig getConfig()
    {
        return config;
    }

    SharedState getState()
    {
        return state;
    }

    // ========== Console ==========

    /**
     * Reads operator commands from standard input until {@code quit} or end
     * of input.
     *
     * @return true if the operator asked to quit, false on end of input
     */
    public boolean runCommandLoop()
    {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.out.println("Server commands: lobbies, stats, quit");

        try
        {
            String line;
            while ((line = reader.readLine()) != null)
            {
                String command = line.trim().toLowerCase();
                switch (command)
                {
                    case "lobbies" -> listLobbies();
                    case "stats" -> System.out.println(stats.snapshot());
                    case "quit", "exit", "q" ->
                    {
                        System.out.println("Shutting down...");
                        return true;
                    }
                    case "" ->
                    {
                        // Ignore empty input
                    }
                    default -> System.out.println("Unknown command: " + command);
                }
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console input", e);
        }
        return false;
    }

    private void listLobbies()
    {
        List<LobbySnapshot> all = state.read(lobbies::listLobbies);
        if (all.isEmpty())
        {
            System.out.println("No lobbies");
            return;
        }
        for (LobbySnapshot lobby : all)
        {
            System.out.printf("  %s [%s] %d/%d%n",
                    lobby.code(), lobby.scene(), lobby.playerCount(), lobby.maxPlayers());
        }
    }

    public static void main(String[] args)
    {
        ServerConfig config;
        try
        {
            config = args.length > 0 ? ServerConfigLoader.load(Path.of(args[0])) : ServerConfig.defaults();
        }
        catch (RuntimeException e)
        {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return;
        }
        LOG.info("Starting with {}", config);

        GameServer server = new GameServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "shutdown"));
        server.start();

        if (!server.runCommandLoop())
        {
            // No console attached: serve until the process is stopped.
            try
            {
                server.awaitStop();
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }
        }

        server.close();
    }
}
