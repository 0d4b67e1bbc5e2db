package org.gungame.server.domain;

import org.gungame.protocol.Vec3;
import org.gungame.server.Fixtures;
import org.gungame.server.state.Lobby;
import org.gungame.server.state.Player;
import org.gungame.server.state.ServerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LobbyDomain}.
 */
class LobbyDomainTest
{
    private static final long TIMEOUT = 30_000;
    private static final SocketAddress ADDR_A = new InetSocketAddress("127.0.0.1", 40001);
    private static final SocketAddress ADDR_B = new InetSocketAddress("127.0.0.1", 40002);

    private ServerState state;
    private LobbyDomain domain;

    @BeforeEach
    void setUp()
    {
        state = new ServerState();
        domain = new LobbyDomain(Fixtures.config().build(), Fixtures.weapons());
    }

    // ========== Create ==========

    @Test
    void createLobby_returnsEmptyLobby()
    {
        LobbySnapshot lobby = domain.createLobby(state, "Arena", 4, "world", 0);

        assertEquals("Arena", lobby.code());
        assertEquals(4, lobby.maxPlayers());
        assertEquals("world", lobby.scene());
        assertEquals(0, lobby.playerCount());
        assertTrue(state.getLobby("arena").isPresent());
    }

    @Test
    void createLobby_duplicateCodeIgnoringCase_conflictsWithoutChange()
    {
        domain.createLobby(state, "X", 2, "world", 0);

        assertThrows(ConflictException.class, () -> domain.createLobby(state, "x", 8, "other", 5));

        assertEquals(1, state.getLobbyCount());
        Lobby lobby = state.getLobby("X").orElseThrow();
        assertEquals(2, lobby.getMaxPlayers());
        assertEquals("world", lobby.getScene());
        assertEquals(1, state.peekNextPlayerId());
    }

    @Test
    void createLobby_invalidArguments_throw()
    {
        assertThrows(IllegalArgumentException.class, () -> domain.createLobby(state, " ", 4, "world", 0));
        assertThrows(IllegalArgumentException.class, () -> domain.createLobby(state, "a", 0, "world", 0));
        assertEquals(0, state.getLobbyCount());
    }

    @Test
    void createLobby_overLobbyLimit_throwsServerFull()
    {
        LobbyDomain limited = new LobbyDomain(Fixtures.config().maxLobbies(1).build(), Fixtures.weapons());
        limited.createLobby(state, "one", 2, "world", 0);

        assertThrows(ServerFullException.class, () -> limited.createLobby(state, "two", 2, "world", 0));
    }

    @Test
    void createLobby_withBotEnabled_addsDummyOutsideRoster()
    {
        LobbyDomain withBot = new LobbyDomain(Fixtures.config().dummyBotEnabled(true).build(), Fixtures.weapons());
        withBot.createLobby(state, "bots", 2, "world", 0);

        Lobby lobby = state.getLobby("bots").orElseThrow();
        Player bot = lobby.getDummyPlayer().orElseThrow();
        assertEquals(LobbyDomain.DUMMY_BOT_ID, bot.getId());
        assertEquals(Fixtures.KNIFE, bot.getCurrentWeaponId());
        assertEquals(0, lobby.getPlayerCount());
    }

    // ========== Join ==========

    @Test
    void joinLobby_allocatesIncreasingIds()
    {
        domain.createLobby(state, "L", 4, "world", 0);

        JoinResult a = domain.joinLobby(state, "L", "A", 0);
        JoinResult b = domain.joinLobby(state, "l", "B", 0);

        assertEquals(1, a.playerId());
        assertEquals(2, b.playerId());
        assertEquals(2, b.lobby().playerCount());
        assertEquals("A", b.lobby().players().get(0).name());
        assertEquals("B", b.lobby().players().get(1).name());
    }

    @Test
    void joinLobby_newPlayerHasDefaultState()
    {
        domain.createLobby(state, "L", 4, "world", 0);
        int id = domain.joinLobby(state, "L", "A", 0).playerId();

        Player player = state.getLobby("L").orElseThrow().getPlayer(id).orElseThrow();
        assertEquals(100, player.getHealth());
        assertEquals(0, player.getCurrentWeaponId());
        assertEquals(0, player.getCurrentAmmo());
    }

    @Test
    void joinLobby_withStartingWeapon_equipsIt()
    {
        LobbyDomain armed = new LobbyDomain(
                Fixtures.config().startingWeaponId(Fixtures.PISTOL).build(), Fixtures.weapons());
        armed.createLobby(state, "L", 4, "world", 0);
        int id = armed.joinLobby(state, "L", "A", 0).playerId();

        Player player = state.getLobby("L").orElseThrow().getPlayer(id).orElseThrow();
        assertEquals(Fixtures.PISTOL, player.getCurrentWeaponId());
        assertEquals(6, player.getCurrentAmmo());
    }

    @Test
    void constructor_unknownStartingWeapon_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> new LobbyDomain(
                Fixtures.config().startingWeaponId(99).build(), Fixtures.weapons()));
    }

    @Test
    void joinLobby_full_throwsAndNeverExceedsCapacity()
    {
        domain.createLobby(state, "L", 2, "world", 0);
        domain.joinLobby(state, "L", "A", 0);
        domain.joinLobby(state, "L", "B", 0);

        assertThrows(LobbyFullException.class, () -> domain.joinLobby(state, "L", "C", 0));
        assertEquals(2, state.getLobby("L").orElseThrow().getPlayerCount());
        assertEquals(3, state.peekNextPlayerId());
    }

    @Test
    void joinLobby_missingLobby_throwsNotFound()
    {
        assertThrows(NotFoundException.class, () -> domain.joinLobby(state, "nope", "A", 0));
    }

    @Test
    void joinLobby_blankName_throws()
    {
        domain.createLobby(state, "L", 2, "world", 0);

        assertThrows(IllegalArgumentException.class, () -> domain.joinLobby(state, "L", "  ", 0));
    }

    // ========== Leave ==========

    @Test
    void leaveLobby_removesPlayerAndAddress()
    {
        domain.createLobby(state, "L", 2, "world", 0);
        int id = domain.joinLobby(state, "L", "A", 0).playerId();
        domain.setPlayerAddress(state, "L", id, ADDR_A, 0);

        Optional<GameEvent.PlayerLeft> left = domain.leaveLobby(state, "L", id);

        assertEquals(Optional.of(new GameEvent.PlayerLeft("L", id)), left);
        Lobby lobby = state.getLobby("L").orElseThrow();
        assertEquals(0, lobby.getPlayerCount());
        assertTrue(lobby.getClientAddresses().isEmpty());
    }

    @Test
    void leaveLobby_twice_isNoOp()
    {
        domain.createLobby(state, "L", 2, "world", 0);
        int id = domain.joinLobby(state, "L", "A", 0).playerId();
        domain.leaveLobby(state, "L", id);

        assertTrue(domain.leaveLobby(state, "L", id).isEmpty());
        assertTrue(domain.leaveLobby(state, "missing", id).isEmpty());
    }

    // ========== Addresses and position ==========

    @Test
    void setPlayerAddress_rebindsAndTouches()
    {
        domain.createLobby(state, "L", 2, "world", 0);
        int id = domain.joinLobby(state, "L", "A", 0).playerId();

        assertTrue(domain.setPlayerAddress(state, "L", id, ADDR_A, 100));
        assertFalse(domain.setPlayerAddress(state, "L", id, ADDR_A, 200));
        assertTrue(domain.setPlayerAddress(state, "L", id, ADDR_B, 300));

        Lobby lobby = state.getLobby("L").orElseThrow();
        assertEquals(ADDR_B, lobby.getClientAddresses().get(id));
        assertEquals(300, lobby.getPlayer(id).orElseThrow().getLastActivityMs());
    }

    @Test
    void setPlayerAddress_unknownPlayer_throws()
    {
        domain.createLobby(state, "L", 2, "world", 0);

        assertThrows(NotFoundException.class, () -> domain.setPlayerAddress(state, "L", 77, ADDR_A, 0));
        assertTrue(state.getLobby("L").orElseThrow().getClientAddresses().isEmpty());
    }

    @Test
    void updatePlayerPosition_withoutLobbyCode_findsPlayer()
    {
        domain.createLobby(state, "L", 2, "world", 0);
        int id = domain.joinLobby(state, "L", "A", 0).playerId();

        String code = domain.updatePlayerPosition(state, null, id, new Vec3(5, 0, 5), new Vec3(0, 45, 0), 10);

        assertEquals("L", code);
        Player player = state.getLobby("L").orElseThrow().getPlayer(id).orElseThrow();
        assertEquals(new Vec3(5, 0, 5), player.getPosition());
        assertEquals(new Vec3(0, 45, 0), player.getRotation());
        assertEquals(10, player.getLastActivityMs());
    }

    @Test
    void updatePlayerPosition_unknownPlayer_throws()
    {
        assertThrows(NotFoundException.class,
                () -> domain.updatePlayerPosition(state, null, 5, Vec3.ZERO, Vec3.ZERO, 0));
    }

    // ========== Sweep ==========

    @Test
    void cleanup_removesOnlyPlayersPastTimeout()
    {
        domain.createLobby(state, "L", 4, "world", 0);
        int idle = domain.joinLobby(state, "L", "Idle", 0).playerId();
        int active = domain.joinLobby(state, "L", "Active", 0).playerId();
        domain.setPlayerAddress(state, "L", active, ADDR_A, 20_000);

        SweepResult result = domain.cleanupInactivePlayers(state, 40_000, TIMEOUT);

        assertEquals(1, result.playersRemoved());
        assertEquals(0, result.lobbiesRemoved());
        assertEquals(List.of(new GameEvent.PlayerLeft("L", idle)), result.departures());
        Lobby lobby = state.getLobby("L").orElseThrow();
        assertTrue(lobby.getPlayer(active).isPresent());
        assertTrue(lobby.getPlayer(idle).isEmpty());
    }

    @Test
    void cleanup_atExactTimeout_keepsPlayer()
    {
        domain.createLobby(state, "L", 4, "world", 0);
        domain.joinLobby(state, "L", "A", 0);

        SweepResult result = domain.cleanupInactivePlayers(state, TIMEOUT, TIMEOUT);

        assertTrue(result.isEmpty());
    }

    @Test
    void cleanup_lastPlayerEvictedPastGrace_removesLobby()
    {
        domain.createLobby(state, "L", 4, "world", 0);
        domain.joinLobby(state, "L", "A", 0);

        SweepResult result = domain.cleanupInactivePlayers(state, 90_000, TIMEOUT);

        assertEquals(1, result.playersRemoved());
        assertEquals(1, result.lobbiesRemoved());
        assertFalse(state.hasLobby("L"));
    }

    @Test
    void cleanup_emptyLobbyWithinGrace_isKept()
    {
        domain.createLobby(state, "L", 4, "world", 50_000);

        SweepResult result = domain.cleanupInactivePlayers(state, 60_000, TIMEOUT);

        assertEquals(0, result.lobbiesRemoved());
        assertTrue(state.hasLobby("L"));
    }

    @Test
    void cleanup_persistentLobby_isNeverRemoved()
    {
        domain.createLobby(state, "test", 8, "test_world", 0, true);

        domain.cleanupInactivePlayers(state, Duration.ofHours(1).toMillis(), TIMEOUT);

        assertTrue(state.hasLobby("test"));
    }

    // ========== Queries ==========

    @Test
    void listLobbies_returnsCreationOrder()
    {
        domain.createLobby(state, "b", 2, "world", 0);
        domain.createLobby(state, "a", 2, "world", 0);

        List<LobbySnapshot> lobbies = domain.listLobbies(state);

        assertEquals(List.of("b", "a"), lobbies.stream().map(LobbySnapshot::code).toList());
    }

    @Test
    void getLobby_isCaseInsensitive()
    {
        domain.createLobby(state, "MixedCase", 2, "world", 0);

        assertEquals("MixedCase", domain.getLobby(state, " mixedcase ").orElseThrow().code());
        assertTrue(domain.getLobby(state, "other").isEmpty());
    }
}
