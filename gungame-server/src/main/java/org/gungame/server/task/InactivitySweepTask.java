package org.gungame.server.task;

import org.gungame.server.domain.LobbyDomain;
import org.gungame.server.domain.SweepResult;
import org.gungame.server.state.SharedState;
import org.gungame.server.stats.ServerStats;
import org.gungame.server.udp.Broadcaster;
import org.gungame.server.udp.Outbound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Evicts idle players, expires empty lobbies and tells the remaining
 * members with {@code player_left}.
 */
public class InactivitySweepTask implements Runnable
{
    private static final Logger LOG = LoggerFactory.getLogger(InactivitySweepTask.class);

    private final SharedState state;
    private final LobbyDomain lobbies;
    private final Broadcaster broadcaster;
    private final ServerStats stats;
    private final LongSupplier clock;
    private final long timeoutMs;

    public InactivitySweepTask(SharedState state,
                               LobbyDomain lobbies,
                               Broadcaster broadcaster,
                               ServerStats stats,
                               LongSupplier clock,
                               Duration timeout)
    {
        this.state = state;
        this.lobbies = lobbies;
        this.broadcaster = broadcaster;
        this.stats = stats;
        this.clock = clock;
        this.timeoutMs = timeout.toMillis();
    }

    @Override
    public void run()
    {
        long now = clock.getAsLong();
        SweepOutcome outcome = state.write(s ->
        {
            SweepResult result = lobbies.cleanupInactivePlayers(s, now, timeoutMs);
            List<Outbound> outbound = result.departures().stream()
                    .map(event -> Outbound.forEvent(s, event))
                    .toList();
            return new SweepOutcome(result, outbound);
        });
        broadcaster.sendAll(outcome.outbound());

        if (!outcome.result().isEmpty())
        {
            LOG.info("Sweep removed {} players and {} lobbies; {} lobbies, {} players remain",
                    outcome.result().playersRemoved(), outcome.result().lobbiesRemoved(),
                    stats.getLobbyCount(), stats.getPlayerCount());
        }
    }

    private record SweepOutcome(SweepResult result, List<Outbound> outbound)
    {
    }
}
