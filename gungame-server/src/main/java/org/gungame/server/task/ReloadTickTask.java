package org.gungame.server.task;

import org.gungame.server.domain.CombatDomain;
import org.gungame.server.domain.ReloadCompletion;
import org.gungame.server.state.SharedState;
import org.gungame.server.udp.Broadcaster;
import org.gungame.server.udp.Outbound;

import java.util.List;
import java.util.function.LongSupplier;

/**
 * Completes elapsed reloads and announces them with {@code reload_finished}.
 */
public class ReloadTickTask implements Runnable
{
    private final SharedState state;
    private final CombatDomain combat;
    private final Broadcaster broadcaster;
    private final LongSupplier clock;

    public ReloadTickTask(SharedState state, CombatDomain combat, Broadcaster broadcaster, LongSupplier clock)
    {
        this.state = state;
        this.combat = combat;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    @Override
    public void run()
    {
        long now = clock.getAsLong();
        List<Outbound> outbound = state.write(s ->
        {
            List<ReloadCompletion> completed = combat.updateReloadStates(s, now);
            return completed.stream()
                    .map(c -> Outbound.forEvent(s, c.toEvent()))
                    .toList();
        });
        broadcaster.sendAll(outbound);
    }
}
