package org.gungame.protocol.http;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /lobbies/{code}/join}.
 *
 * @param playerName display name for the new player
 */
public record JoinLobbyRequest(@JsonProperty("player_name") String playerName)
{
}
