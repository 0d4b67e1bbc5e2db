package org.gungame.server.state;

import java.net.SocketAddress;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named group of players sharing one session and one UDP broadcast set.
 *
 * <p>Owns its players and their address bindings. Not thread-safe: guarded
 * by the {@link SharedState} lock.</p>
 */
public class Lobby
{
    private final String code;
    private final int maxPlayers;
    private final String scene;
    private final long createdAtMs;
    private final boolean persistent;

    private final Map<Integer, Player> players = new LinkedHashMap<>();
    private final Map<Integer, SocketAddress> clientAddresses = new LinkedHashMap<>();
    private Player dummyPlayer;

    /**
     * Creates an empty lobby.
     *
     * @param code        lobby code as requested
     * @param maxPlayers  capacity, positive
     * @param scene       opaque world label
     * @param createdAtMs creation time
     * @param persistent  true to exempt the lobby from empty-lobby expiry
     */
    public Lobby(String code, int maxPlayers, String scene, long createdAtMs, boolean persistent)
    {
        this.code = Objects.requireNonNull(code, "code");
        if (maxPlayers <= 0)
        {
            throw new IllegalArgumentException("maxPlayers must be positive: " + maxPlayers);
        }
        this.maxPlayers = maxPlayers;
        this.scene = Objects.requireNonNull(scene, "scene");
        this.createdAtMs = createdAtMs;
        this.persistent = persistent;
    }

    /**
     * Normalizes a lobby code for lookup: trimmed and lower-cased.
     *
     * @param code raw code
     * @return the lookup key
     */
    public static String key(String code)
    {
        return code.trim().toLowerCase(Locale.ROOT);
    }

    public String getCode()
    {
        return code;
    }

    public String getKey()
    {
        return key(code);
    }

    public int getMaxPlayers()
    {
        return maxPlayers;
    }

    public String getScene()
    {
        return scene;
    }

    public long getCreatedAtMs()
    {
        return createdAtMs;
    }

    public boolean isPersistent()
    {
        return persistent;
    }

    // ========== Players ==========

    public Map<Integer, Player> getPlayers()
    {
        return Collections.unmodifiableMap(players);
    }

    public Optional<Player> getPlayer(int playerId)
    {
        return Optional.ofNullable(players.get(playerId));
    }

    public int getPlayerCount()
    {
        return players.size();
    }

    public boolean isFull()
    {
        return players.size() >= maxPlayers;
    }

    public void addPlayer(Player player)
    {
        players.put(player.getId(), player);
    }

    /**
     * Removes a player and its address binding.
     *
     * @param playerId player to remove
     * @return the removed player, or empty if absent
     */
    public Optional<Player> removePlayer(int playerId)
    {
        clientAddresses.remove(playerId);
        return Optional.ofNullable(players.remove(playerId));
    }

    // ========== Addresses ==========

    public Map<Integer, SocketAddress> getClientAddresses()
    {
        return Collections.unmodifiableMap(clientAddresses);
    }

    public void bindAddress(int playerId, SocketAddress address)
    {
        clientAddresses.put(playerId, Objects.requireNonNull(address, "address"));
    }

    // ========== Dummy Bot ==========

    public Optional<Player> getDummyPlayer()
    {
        return Optional.ofNullable(dummyPlayer);
    }

    public void setDummyPlayer(Player dummyPlayer)
    {
        this.dummyPlayer = dummyPlayer;
    }
}
