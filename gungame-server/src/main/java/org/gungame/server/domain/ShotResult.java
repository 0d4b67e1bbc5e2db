package org.gungame.server.domain;

import java.util.List;

/**
 * Result of a trigger pull.
 *
 * @param fired  whether the shot was accepted
 * @param events damage and death events caused by the shot
 */
public record ShotResult(boolean fired, List<GameEvent> events)
{
    public static final ShotResult NOT_FIRED = new ShotResult(false, List.of());

    public ShotResult
    {
        events = List.copyOf(events);
    }
}
