package org.gungame.server.domain;

import java.util.List;

/**
 * Result of one inactivity sweep.
 *
 * @param playersRemoved number of evicted players
 * @param lobbiesRemoved number of expired lobbies
 * @param departures     one event per evicted player
 */
public record SweepResult(int playersRemoved, int lobbiesRemoved, List<GameEvent.PlayerLeft> departures)
{
    public SweepResult
    {
        departures = List.copyOf(departures);
    }

    public boolean isEmpty()
    {
        return playersRemoved == 0 && lobbiesRemoved == 0;
    }
}
