package org.gungame.protocol.http;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /lobbies}.
 *
 * @param code       requested lobby code
 * @param scene      world label, server default when null
 * @param maxPlayers capacity, server default when null
 */
public record CreateLobbyRequest(
        String code,
        String scene,
        @JsonProperty("max_players") Integer maxPlayers
)
{
}
