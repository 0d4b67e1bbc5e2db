package org.gungame.protocol.http;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of a successful join.
 *
 * @param lobby    lobby state after the join, including the new player
 * @param playerId id to present in every UDP message
 */
public record JoinLobbyResponse(
        LobbyInfo lobby,
        @JsonProperty("player_id") int playerId
)
{
}
