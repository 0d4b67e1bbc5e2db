package org.gungame.server.domain;

/**
 * The lobby already holds {@code max_players} players.
 */
public class LobbyFullException extends GameException
{
    public LobbyFullException(String message)
    {
        super(message);
    }
}
