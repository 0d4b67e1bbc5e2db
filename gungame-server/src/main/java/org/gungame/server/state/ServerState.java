package org.gungame.server.state;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Root of all mutable game state: every lobby and the player id counter.
 *
 * <p>Holds data only. Behavior lives in the domain classes, which receive
 * this object explicitly. Not thread-safe: access it through
 * {@link SharedState}.</p>
 */
public class ServerState
{
    /**
     * First id handed out to a player. Lower ids are reserved.
     */
    public static final int FIRST_PLAYER_ID = 1;

    private final Map<String, Lobby> lobbies = new LinkedHashMap<>();
    private int nextPlayerId = FIRST_PLAYER_ID;

    /**
     * Looks up a lobby by code, ignoring case and surrounding whitespace.
     *
     * @param code lobby code
     * @return the lobby, or empty if absent
     */
    public Optional<Lobby> getLobby(String code)
    {
        if (code == null)
        {
            return Optional.empty();
        }
        return Optional.ofNullable(lobbies.get(Lobby.key(code)));
    }

    public boolean hasLobby(String code)
    {
        return lobbies.containsKey(Lobby.key(code));
    }

    public void putLobby(Lobby lobby)
    {
        lobbies.put(lobby.getKey(), lobby);
    }

    public Optional<Lobby> removeLobby(String code)
    {
        return Optional.ofNullable(lobbies.remove(Lobby.key(code)));
    }

    public Collection<Lobby> getLobbies()
    {
        return Collections.unmodifiableCollection(lobbies.values());
    }

    public int getLobbyCount()
    {
        return lobbies.size();
    }

    /**
     * Issues the next player id. Ids are never reused.
     *
     * @return a fresh player id
     */
    public int allocatePlayerId()
    {
        return nextPlayerId++;
    }

    public int peekNextPlayerId()
    {
        return nextPlayerId;
    }
}
