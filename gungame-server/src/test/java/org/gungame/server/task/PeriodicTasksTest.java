package org.gungame.server.task;

import org.gungame.protocol.PlayerSyncSnapshot;
import org.gungame.protocol.ServerMessage;
import org.gungame.protocol.Vec3;
import org.gungame.server.Fixtures;
import org.gungame.server.domain.CombatDomain;
import org.gungame.server.domain.LobbyDomain;
import org.gungame.server.simulation.StubWorldSimulator;
import org.gungame.server.state.SharedState;
import org.gungame.server.stats.DefaultServerStats;
import org.gungame.server.udp.Broadcaster;
import org.gungame.server.udp.RecordingEndPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the reload, sweep, dummy bot and state sync tasks.
 */
class PeriodicTasksTest
{
    private static final SocketAddress ADDR_A = new InetSocketAddress("127.0.0.1", 51001);
    private static final SocketAddress ADDR_B = new InetSocketAddress("127.0.0.1", 51002);

    private final AtomicLong clock = new AtomicLong(0);
    private SharedState state;
    private RecordingEndPoint endPoint;
    private DefaultServerStats stats;
    private Broadcaster broadcaster;
    private LobbyDomain lobbies;
    private CombatDomain combat;
    private int alice;
    private int bob;

    @BeforeEach
    void setUp()
    {
        state = new SharedState();
        endPoint = new RecordingEndPoint();
        stats = new DefaultServerStats(state);
        broadcaster = new Broadcaster(endPoint, stats);
        lobbies = new LobbyDomain(Fixtures.config().dummyBotEnabled(true).build(), Fixtures.weapons());
        combat = new CombatDomain(Fixtures.weapons(), new StubWorldSimulator());

        state.update(s -> lobbies.createLobby(s, "L", 4, "world", 0));
        alice = state.write(s -> lobbies.joinLobby(s, "L", "Alice", 0)).playerId();
        bob = state.write(s -> lobbies.joinLobby(s, "L", "Bob", 0)).playerId();
        state.update(s ->
        {
            lobbies.setPlayerAddress(s, "L", alice, ADDR_A, 0);
            lobbies.setPlayerAddress(s, "L", bob, ADDR_B, 0);
        });
    }

    // ========== Reload ==========

    @Test
    void reloadTick_completesElapsedReloadAndBroadcasts()
    {
        state.update(s ->
        {
            combat.playerSwitchWeapon(s, "L", alice, Fixtures.PISTOL);
            combat.playerShoot(s, "L", alice, 100);
            combat.playerStartReload(s, "L", alice, 200);
        });
        ReloadTickTask task = new ReloadTickTask(state, combat, broadcaster, clock::get);

        clock.set(600);
        task.run();
        assertEquals(0, endPoint.sentCount());

        clock.set(700);
        task.run();
        task.run();

        assertEquals(List.of(new ServerMessage.ReloadFinished(alice)), endPoint.messagesTo(ADDR_B));
        int ammo = state.read(s -> s.getLobby("L").orElseThrow().getPlayer(alice).orElseThrow()
                .getCurrentAmmo());
        assertEquals(6, ammo);
    }

    // ========== Sweep ==========

    @Test
    void sweep_evictsIdlePlayerAndNotifiesOthers()
    {
        state.update(s -> lobbies.setPlayerAddress(s, "L", bob, ADDR_B, 25_000));
        InactivitySweepTask task = new InactivitySweepTask(
                state, lobbies, broadcaster, stats, clock::get, Duration.ofSeconds(30));

        clock.set(31_000);
        task.run();

        assertEquals(List.of(new ServerMessage.PlayerLeft(alice)), endPoint.messagesTo(ADDR_B));
        assertTrue(endPoint.messagesTo(ADDR_A).isEmpty());
        assertEquals(1, stats.getPlayerCount());
    }

    // ========== Dummy bot ==========

    @Test
    void dummyBot_positionFollowsCircle()
    {
        Vec3 start = DummyBotTask.positionAt(0);
        assertEquals(3.0, start.x(), 1e-9);
        assertEquals(1.0, start.y(), 1e-9);
        assertEquals(0.0, start.z(), 1e-9);

        // quarter turn at 0.5 rad/s takes pi seconds
        Vec3 quarter = DummyBotTask.positionAt(Math.round(Math.PI * 1000));
        assertEquals(0.0, quarter.x(), 1e-3);
        assertEquals(3.0, quarter.z(), 1e-3);

        for (long t = 0; t < 20_000; t += 737)
        {
            Vec3 p = DummyBotTask.positionAt(t);
            assertEquals(3.0, Math.hypot(p.x(), p.z()), 1e-9);
        }
    }

    @Test
    void dummyBot_broadcastsPositionToBoundMembers()
    {
        DummyBotTask task = new DummyBotTask(state, broadcaster, clock::get, 0);

        clock.set(1_000);
        task.run();

        Vec3 expected = DummyBotTask.positionAt(1_000);
        assertEquals(List.of(new ServerMessage.ServerDummyUpdate(expected)), endPoint.messagesTo(ADDR_A));
        assertEquals(List.of(new ServerMessage.ServerDummyUpdate(expected)), endPoint.messagesTo(ADDR_B));
        Vec3 botPosition = state.read(s -> s.getLobby("L").orElseThrow().getDummyPlayer().orElseThrow()
                .getPosition());
        assertEquals(expected, botPosition);
    }

    @Test
    void dummyBot_isNotPartOfStateSync()
    {
        List<PlayerSyncSnapshot> players = state.read(s -> combat.getLobbyStateSync(s, "L"));
        assertEquals(2, players.size());
    }

    // ========== State sync ==========

    @Test
    void stateSync_broadcastsSnapshotToEveryMember()
    {
        new StateSyncTask(state, combat, broadcaster).run();

        List<ServerMessage.StateSync> toA = endPoint.messagesTo(ADDR_A, ServerMessage.StateSync.class);
        List<ServerMessage.StateSync> toB = endPoint.messagesTo(ADDR_B, ServerMessage.StateSync.class);
        assertEquals(1, toA.size());
        assertEquals(toA, toB);
        assertEquals(List.of(alice, bob), toA.get(0).players().stream().map(p -> p.id()).toList());
    }

    @Test
    void stateSync_skipsLobbiesWithoutBoundClients()
    {
        state.update(s -> lobbies.createLobby(s, "Empty", 4, "world", 0));
        endPoint.clear();

        new StateSyncTask(state, combat, broadcaster).run();

        assertEquals(2, endPoint.sentCount());
    }
}
