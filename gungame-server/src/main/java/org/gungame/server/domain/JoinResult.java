package org.gungame.server.domain;

/**
 * Result of admitting a player to a lobby.
 *
 * @param playerId id allocated for the new player
 * @param lobby    lobby state after the join
 */
public record JoinResult(int playerId, LobbySnapshot lobby)
{
}
