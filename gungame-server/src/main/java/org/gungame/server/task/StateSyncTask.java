package org.gungame.server.task;

import org.gungame.protocol.ServerMessage;
import org.gungame.server.domain.CombatDomain;
import org.gungame.server.state.Lobby;
import org.gungame.server.state.SharedState;
import org.gungame.server.udp.Broadcaster;
import org.gungame.server.udp.Outbound;

import java.util.List;

/**
 * Broadcasts a full {@code state_sync} to every lobby with a bound client so
 * that clients that missed packets converge.
 */
public class StateSyncTask implements Runnable
{
    private final SharedState state;
    private final CombatDomain combat;
    private final Broadcaster broadcaster;

    public StateSyncTask(SharedState state, CombatDomain combat, Broadcaster broadcaster)
    {
        this.state = state;
        this.combat = combat;
        this.broadcaster = broadcaster;
    }

    @Override
    public void run()
    {
        List<Outbound> outbound = state.read(s -> s.getLobbies().stream()
                .filter(lobby -> !lobby.getClientAddresses().isEmpty())
                .map(Lobby::getCode)
                .map(code -> Outbound.toLobby(s, code,
                        new ServerMessage.StateSync(combat.getLobbyStateSync(s, code))))
                .toList());
        broadcaster.sendAll(outbound);
    }
}
