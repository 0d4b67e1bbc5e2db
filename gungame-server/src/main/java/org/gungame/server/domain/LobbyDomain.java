package org.gungame.server.domain;

import org.gungame.protocol.PlayerInfo;
import org.gungame.protocol.Vec3;
import org.gungame.server.config.ServerConfig;
import org.gungame.server.state.Lobby;
import org.gungame.server.state.Player;
import org.gungame.server.state.ServerState;
import org.gungame.server.weapon.WeaponDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Lobby lifecycle: creation, membership, address binding and the
 * inactivity sweep.
 *
 * <p>Every operation receives the {@link ServerState} explicitly and must be
 * called while the caller holds the matching lock. Time is passed in as a
 * millisecond timestamp so that tests control it.</p>
 */
public class LobbyDomain
{
    private static final Logger LOG = LoggerFactory.getLogger(LobbyDomain.class);

    /**
     * Id of the server-owned bot. Never issued to a player.
     */
    public static final int DUMMY_BOT_ID = 0;

    public static final String DUMMY_BOT_NAME = "DummyBot";

    public static final Vec3 SPAWN_POSITION = new Vec3(0, 1, 0);

    private final ServerConfig config;
    private final WeaponDatabase weapons;

    public LobbyDomain(ServerConfig config, WeaponDatabase weapons)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.weapons = Objects.requireNonNull(weapons, "weapons");
        if (config.getStartingWeaponId() != WeaponDatabase.NO_WEAPON
                && !weapons.contains(config.getStartingWeaponId()))
        {
            throw new IllegalArgumentException(
                    "Starting weapon is not in the weapon table: " + config.getStartingWeaponId());
        }
    }

    // ========== Creation ==========

    /**
     * Creates an ordinary lobby that expires once empty past its grace period.
     *
     * @param state      server state
     * @param code       lobby code, unique ignoring case
     * @param maxPlayers capacity
     * @param scene      world label
     * @param nowMs      current time
     * @return snapshot of the new lobby
     * @throws ConflictException        if the code is taken
     * @throws ServerFullException      if the lobby limit is reached
     * @throws IllegalArgumentException if code is blank or maxPlayers is not positive
     */
    public LobbySnapshot createLobby(ServerState state, String code, int maxPlayers, String scene, long nowMs)
    {
        return createLobby(state, code, maxPlayers, scene, nowMs, false);
    }

    /**
     * Creates a lobby.
     *
     * @param persistent true to exempt the lobby from empty-lobby expiry
     * @see #createLobby(ServerState, String, int, String, long)
     */
    public LobbySnapshot createLobby(ServerState state, String code, int maxPlayers, String scene, long nowMs,
                                     boolean persistent)
    {
        if (code == null || code.isBlank())
        {
            throw new IllegalArgumentException("Lobby code must not be empty");
        }
        if (maxPlayers <= 0)
        {
            throw new IllegalArgumentException("max_players must be positive: " + maxPlayers);
        }
        Objects.requireNonNull(scene, "scene");

        String trimmed = code.trim();
        if (state.hasLobby(trimmed))
        {
            throw new ConflictException("Lobby already exists: " + trimmed);
        }
        if (state.getLobbyCount() >= config.getMaxLobbies())
        {
            throw new ServerFullException("Lobby limit reached: " + config.getMaxLobbies());
        }

        Lobby lobby = new Lobby(trimmed, maxPlayers, scene, nowMs, persistent);
        if (config.isDummyBotEnabled())
        {
            lobby.setDummyPlayer(createDummyBot(nowMs));
        }
        state.putLobby(lobby);

        LOG.info("Created lobby '{}' (max {}, scene '{}'{})",
                trimmed, maxPlayers, scene, persistent ? ", persistent" : "");
        return LobbySnapshot.of(lobby);
    }

    private Player createDummyBot(long nowMs)
    {
        Player bot = new Player(DUMMY_BOT_ID, DUMMY_BOT_NAME, SPAWN_POSITION, nowMs);
        weapons.all().stream()
                .filter(w -> !w.hasMagazine())
                .findFirst()
                .ifPresent(bot::equip);
        return bot;
    }

    // ========== Membership ==========

    /**
     * Admits a new player to a lobby.
     *
     * <p>The player starts at full health with the configured starting
     * weapon, which is none by default.</p>
     *
     * @param state      server state
     * @param code       lobby code
     * @param playerName display name
     * @param nowMs      current time
     * @return the new player id and the lobby after the join
     * @throws NotFoundException        if the lobby does not exist
     * @throws LobbyFullException       if the lobby is at capacity
     * @throws IllegalArgumentException if the name is blank
     */
    public JoinResult joinLobby(ServerState state, String code, String playerName, long nowMs)
    {
        if (playerName == null || playerName.isBlank())
        {
            throw new IllegalArgumentException("player_name must not be empty");
        }
        Lobby lobby = StateLookup.requireLobby(state, code);
        if (lobby.isFull())
        {
            throw new LobbyFullException("Lobby is full: " + lobby.getCode());
        }

        int playerId = state.allocatePlayerId();
        Player player = new Player(playerId, playerName.trim(), SPAWN_POSITION, nowMs);
        if (config.getStartingWeaponId() != WeaponDatabase.NO_WEAPON)
        {
            weapons.get(config.getStartingWeaponId()).ifPresent(player::equip);
        }
        lobby.addPlayer(player);

        LOG.info("Player {} '{}' joined lobby '{}' ({}/{})",
                playerId, player.getName(), lobby.getCode(), lobby.getPlayerCount(), lobby.getMaxPlayers());
        return new JoinResult(playerId, LobbySnapshot.of(lobby));
    }

    /**
     * Removes a player and its address binding. Leaving twice is a no-op.
     *
     * @param state    server state
     * @param code     lobby code
     * @param playerId player to remove
     * @return the departure to broadcast, or empty if nothing was removed
     */
    public Optional<GameEvent.PlayerLeft> leaveLobby(ServerState state, String code, int playerId)
    {
        Optional<Lobby> lobby = state.getLobby(code);
        if (lobby.isEmpty())
        {
            return Optional.empty();
        }
        return lobby.get().removePlayer(playerId).map(removed ->
        {
            LOG.info("Player {} left lobby '{}'", playerId, lobby.get().getCode());
            return new GameEvent.PlayerLeft(lobby.get().getCode(), playerId);
        });
    }

    /**
     * Binds or refreshes the UDP address of a player and marks it active.
     *
     * @param state    server state
     * @param code     lobby code
     * @param playerId player id
     * @param address  source address of the latest packet
     * @param nowMs    current time
     * @return true if the address was not bound before, or changed
     * @throws NotFoundException if the lobby or player does not exist
     */
    public boolean setPlayerAddress(ServerState state, String code, int playerId, SocketAddress address,
                                    long nowMs)
    {
        Lobby lobby = StateLookup.requireLobby(state, code);
        Player player = StateLookup.requirePlayer(lobby, playerId);
        player.touch(nowMs);

        SocketAddress previous = lobby.getClientAddresses().get(playerId);
        if (address.equals(previous))
        {
            return false;
        }
        lobby.bindAddress(playerId, address);
        if (previous == null)
        {
            LOG.debug("Bound player {} in '{}' to {}", playerId, lobby.getCode(), address);
        }
        else
        {
            LOG.debug("Rebound player {} in '{}' from {} to {}", playerId, lobby.getCode(), previous, address);
        }
        return true;
    }

    /**
     * Stores a self-reported transform without plausibility checks.
     *
     * @param state    server state
     * @param code     lobby code, or null to locate the player by id
     * @param playerId player id
     * @param position new position
     * @param rotation new rotation
     * @param nowMs    current time
     * @return the code of the player's lobby
     * @throws NotFoundException if the player cannot be found
     */
    public String updatePlayerPosition(ServerState state, String code, int playerId, Vec3 position,
                                       Vec3 rotation, long nowMs)
    {
        Lobby lobby = code != null
                ? StateLookup.requireLobby(state, code)
                : StateLookup.findLobbyOfPlayer(state, playerId)
                        .orElseThrow(() -> NotFoundException.player(playerId));
        Player player = StateLookup.requirePlayer(lobby, playerId);
        player.setTransform(position, rotation);
        player.touch(nowMs);
        return lobby.getCode();
    }

    /**
     * Finds the lobby a player belongs to.
     *
     * @param state    server state
     * @param playerId player id
     * @return the lobby code, or empty if no lobby holds the player
     */
    public Optional<String> findLobbyOfPlayer(ServerState state, int playerId)
    {
        return StateLookup.findLobbyOfPlayer(state, playerId).map(Lobby::getCode);
    }

    // ========== Sweep ==========

    /**
     * Evicts idle players and removes expired empty lobbies.
     *
     * <p>A player is idle once its last activity is more than
     * {@code timeoutMs} old. An empty lobby expires once it is older than
     * the configured grace period, unless it is persistent.</p>
     *
     * @param state     server state
     * @param nowMs     current time
     * @param timeoutMs inactivity timeout
     * @return counts and one departure event per evicted player
     */
    public SweepResult cleanupInactivePlayers(ServerState state, long nowMs, long timeoutMs)
    {
        long graceMs = config.getEmptyLobbyGrace().toMillis();
        List<GameEvent.PlayerLeft> departures = new ArrayList<>();
        List<String> expired = new ArrayList<>();

        for (Lobby lobby : state.getLobbies())
        {
            List<Integer> idle = lobby.getPlayers().values().stream()
                    .filter(p -> nowMs - p.getLastActivityMs() > timeoutMs)
                    .map(Player::getId)
                    .toList();
            for (int playerId : idle)
            {
                lobby.removePlayer(playerId);
                departures.add(new GameEvent.PlayerLeft(lobby.getCode(), playerId));
                LOG.info("Evicted inactive player {} from lobby '{}'", playerId, lobby.getCode());
            }

            if (lobby.getPlayerCount() == 0
                    && !lobby.isPersistent()
                    && nowMs - lobby.getCreatedAtMs() >= graceMs)
            {
                expired.add(lobby.getCode());
            }
        }

        for (String code : expired)
        {
            state.removeLobby(code);
            LOG.info("Removed empty lobby '{}'", code);
        }

        return new SweepResult(departures.size(), expired.size(), departures);
    }

    // ========== Queries ==========

    /**
     * Looks up a lobby.
     *
     * @param state server state
     * @param code  lobby code
     * @return a snapshot, or empty if absent
     */
    public Optional<LobbySnapshot> getLobby(ServerState state, String code)
    {
        return state.getLobby(code).map(LobbySnapshot::of);
    }

    /**
     * Lists every lobby in creation order.
     *
     * @param state server state
     * @return one snapshot per lobby
     */
    public List<LobbySnapshot> listLobbies(ServerState state)
    {
        return state.getLobbies().stream()
                .map(LobbySnapshot::of)
                .toList();
    }

    /**
     * Returns the public info of a player, used for join notifications.
     *
     * @param state    server state
     * @param code     lobby code
     * @param playerId player id
     * @return the player's info
     * @throws NotFoundException if the lobby or player does not exist
     */
    public PlayerInfo getPlayerInfo(ServerState state, String code, int playerId)
    {
        return StateLookup.requirePlayer(state, code, playerId).toInfo();
    }
}
