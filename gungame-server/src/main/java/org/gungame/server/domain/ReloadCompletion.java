package org.gungame.server.domain;

/**
 * A reload that finished during a reload tick.
 *
 * @param lobbyCode lobby of the player
 * @param playerId  player whose magazine is full again
 */
public record ReloadCompletion(String lobbyCode, int playerId)
{
    public GameEvent.ReloadFinished toEvent()
    {
        return new GameEvent.ReloadFinished(lobbyCode, playerId);
    }
}
