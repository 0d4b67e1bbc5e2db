package org.gungame.server.udp;

import org.gungame.protocol.ServerMessage;
import org.gungame.server.domain.GameEvent;
import org.gungame.server.state.Lobby;
import org.gungame.server.state.ServerState;

import java.net.SocketAddress;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A message and the addresses it goes to.
 *
 * <p>Recipients are resolved while the state lock is held; the datagrams are
 * sent after it is released.</p>
 *
 * @param message    message to send
 * @param recipients destination addresses
 */
public record Outbound(ServerMessage message, List<SocketAddress> recipients)
{
    public Outbound
    {
        recipients = List.copyOf(recipients);
    }

    public static Outbound toOne(SocketAddress recipient, ServerMessage message)
    {
        return new Outbound(message, List.of(recipient));
    }

    /**
     * Addresses a message to every bound member of a lobby.
     *
     * @param state   server state
     * @param code    lobby code
     * @param message message to send
     * @return the outbound message, with no recipients if the lobby is gone
     */
    public static Outbound toLobby(ServerState state, String code, ServerMessage message)
    {
        return new Outbound(message, addresses(state.getLobby(code), null));
    }

    /**
     * Addresses a message to every bound member of a lobby except one.
     *
     * @param state    server state
     * @param code     lobby code
     * @param excluded player that should not receive the message
     * @param message  message to send
     * @return the outbound message, with no recipients if the lobby is gone
     */
    public static Outbound toOthers(ServerState state, String code, int excluded, ServerMessage message)
    {
        return new Outbound(message, addresses(state.getLobby(code), excluded));
    }

    /**
     * Addresses an event's message to the lobby it happened in. A join is
     * not echoed to the joining player.
     *
     * @param state server state
     * @param event domain event
     * @return the outbound message
     */
    public static Outbound forEvent(ServerState state, GameEvent event)
    {
        if (event instanceof GameEvent.PlayerJoined joined)
        {
            return toOthers(state, event.lobbyCode(), joined.player().id(), event.toMessage());
        }
        return toLobby(state, event.lobbyCode(), event.toMessage());
    }

    private static List<SocketAddress> addresses(Optional<Lobby> lobby, Integer excluded)
    {
        if (lobby.isEmpty())
        {
            return List.of();
        }
        return lobby.get().getClientAddresses().entrySet().stream()
                .filter(e -> excluded == null || e.getKey().intValue() != excluded)
                .map(Map.Entry::getValue)
                .toList();
    }
}
