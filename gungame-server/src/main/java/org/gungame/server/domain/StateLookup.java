package org.gungame.server.domain;

import org.gungame.server.state.Lobby;
import org.gungame.server.state.Player;
import org.gungame.server.state.ServerState;

import java.util.Optional;

/**
 * Lookups shared by the domain classes.
 */
final class StateLookup
{
    private StateLookup()
    {
    }

    static Lobby requireLobby(ServerState state, String code)
    {
        return state.getLobby(code).orElseThrow(() -> NotFoundException.lobby(code));
    }

    static Player requirePlayer(Lobby lobby, int playerId)
    {
        return lobby.getPlayer(playerId)
                .orElseThrow(() -> NotFoundException.player(lobby.getCode(), playerId));
    }

    static Player requirePlayer(ServerState state, String code, int playerId)
    {
        return requirePlayer(requireLobby(state, code), playerId);
    }

    static Optional<Lobby> findLobbyOfPlayer(ServerState state, int playerId)
    {
        return state.getLobbies().stream()
                .filter(lobby -> lobby.getPlayer(playerId).isPresent())
                .findFirst();
    }
}
