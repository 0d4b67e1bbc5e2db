package org.gungame.server.domain;

import org.gungame.protocol.PlayerInfo;
import org.gungame.server.state.Lobby;
import org.gungame.server.state.Player;

import java.util.List;

/**
 * Immutable copy of a lobby's public data, safe to use after the state
 * lock is released.
 *
 * @param code       lobby code as created
 * @param maxPlayers capacity
 * @param scene      world label
 * @param players    roster in join order
 */
public record LobbySnapshot(String code, int maxPlayers, String scene, List<PlayerInfo> players)
{
    public LobbySnapshot
    {
        players = List.copyOf(players);
    }

    public static LobbySnapshot of(Lobby lobby)
    {
        List<PlayerInfo> roster = lobby.getPlayers().values().stream()
                .map(Player::toInfo)
                .toList();
        return new LobbySnapshot(lobby.getCode(), lobby.getMaxPlayers(), lobby.getScene(), roster);
    }

    public int playerCount()
    {
        return players.size();
    }
}
