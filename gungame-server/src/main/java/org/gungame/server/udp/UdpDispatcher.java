package org.gungame.server.udp;

import org.gungame.protocol.ClientMessage;
import org.gungame.protocol.ServerMessage;
import org.gungame.protocol.serialization.MalformedMessageException;
import org.gungame.protocol.serialization.MessageCodec;
import org.gungame.server.domain.CombatDomain;
import org.gungame.server.domain.GameEvent;
import org.gungame.server.domain.GameException;
import org.gungame.server.domain.LobbyDomain;
import org.gungame.server.domain.NotFoundException;
import org.gungame.server.domain.ReloadStatus;
import org.gungame.server.domain.ShotResult;
import org.gungame.server.state.ServerState;
import org.gungame.server.state.SharedState;
import org.gungame.server.stats.DefaultServerStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.LongSupplier;

/**
 * Turns inbound datagrams into domain calls and the resulting broadcasts.
 *
 * <p>Each packet is decoded, applied to the shared state in a single write
 * lock acquisition, and answered after the lock is released. Malformed or
 * invalid packets are logged, counted as dropped and otherwise ignored:
 * nothing is sent back and state is unchanged.</p>
 */
public class UdpDispatcher implements BiConsumer<ByteBuffer, SocketAddress>
{
    private static final Logger LOG = LoggerFactory.getLogger(UdpDispatcher.class);

    static final String WELCOME = "Welcome to the game server";

    private final SharedState state;
    private final LobbyDomain lobbies;
    private final CombatDomain combat;
    private final Broadcaster broadcaster;
    private final DefaultServerStats stats;
    private final LongSupplier clock;

    public UdpDispatcher(SharedState state,
                         LobbyDomain lobbies,
                         CombatDomain combat,
                         Broadcaster broadcaster,
                         DefaultServerStats stats,
                         LongSupplier clock)
    {
        this.state = Objects.requireNonNull(state, "state");
        this.lobbies = Objects.requireNonNull(lobbies, "lobbies");
        this.combat = Objects.requireNonNull(combat, "combat");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void accept(ByteBuffer data, SocketAddress source)
    {
        stats.recordReceived();

        byte[] bytes = new byte[data.remaining()];
        data.get(bytes);

        ClientMessage message;
        try
        {
            message = MessageCodec.decodeClient(bytes);
        }
        catch (MalformedMessageException e)
        {
            stats.recordDropped();
            LOG.debug("Dropped malformed packet from {}: {}", source, e.getMessage());
            return;
        }

        handle(message, source);
    }

    /**
     * Applies one decoded message and sends the resulting messages.
     *
     * @param message decoded message
     * @param source  sender address
     */
    public void handle(ClientMessage message, SocketAddress source)
    {
        long now = clock.getAsLong();
        List<Outbound> outbound;
        try
        {
            outbound = state.write(s -> dispatch(s, message, source, now));
        }
        catch (GameException | IllegalArgumentException e)
        {
            stats.recordDropped();
            LOG.debug("Ignored {} from {}: {}", message.getClass().getSimpleName(), source, e.getMessage());
            return;
        }
        broadcaster.sendAll(outbound);
    }

    private List<Outbound> dispatch(ServerState s, ClientMessage message, SocketAddress source, long now)
    {
        int playerId = message.playerId();

        if (message instanceof ClientMessage.Leave leave)
        {
            return lobbies.leaveLobby(s, leave.lobbyCode(), playerId)
                    .map(event -> List.of(Outbound.forEvent(s, event)))
                    .orElse(List.of());
        }

        String code = message.lobbyCode() != null
                ? message.lobbyCode()
                : lobbies.findLobbyOfPlayer(s, playerId).orElseThrow(() -> NotFoundException.player(playerId));
        lobbies.setPlayerAddress(s, code, playerId, source, now);

        List<Outbound> out = new ArrayList<>();
        if (message instanceof ClientMessage.Join)
        {
            out.add(Outbound.toOne(source, new ServerMessage.Welcome(WELCOME)));
            GameEvent joined = new GameEvent.PlayerJoined(code, lobbies.getPlayerInfo(s, code, playerId));
            out.add(Outbound.forEvent(s, joined));
        }
        else if (message instanceof ClientMessage.PositionUpdate update)
        {
            lobbies.updatePlayerPosition(s, code, playerId, update.position(), update.rotation(), now);
            ServerMessage relay = new ServerMessage.PositionUpdate(playerId, update.position(), update.rotation());
            out.add(Outbound.toOthers(s, code, playerId, relay));
        }
        else if (message instanceof ClientMessage.Shoot)
        {
            ShotResult shot = combat.playerShoot(s, code, playerId, now);
            if (!shot.fired())
            {
                LOG.debug("Shot from player {} refused", playerId);
            }
            addEvents(s, shot.events(), out);
        }
        else if (message instanceof ClientMessage.Reload)
        {
            ReloadStatus status = combat.playerStartReload(s, code, playerId, now);
            if (status == ReloadStatus.STARTED)
            {
                out.add(Outbound.forEvent(s, new GameEvent.ReloadStarted(code, playerId)));
            }
            else
            {
                LOG.debug("Reload from player {} ignored: {}", playerId, status);
            }
        }
        else if (message instanceof ClientMessage.WeaponSwitch weaponSwitch)
        {
            GameEvent switched = combat.playerSwitchWeapon(s, code, playerId, weaponSwitch.weaponId());
            out.add(Outbound.forEvent(s, switched));
        }
        else if (message instanceof ClientMessage.RequestState)
        {
            out.add(Outbound.toOne(source, new ServerMessage.StateSync(combat.getLobbyStateSync(s, code))));
        }
        else if (message instanceof ClientMessage.Respawn)
        {
            combat.respawnPlayer(s, code, playerId)
                    .ifPresent(event -> out.add(Outbound.forEvent(s, event)));
        }
        // Keepalive: the address refresh above is all it does.
        return out;
    }

    private static void addEvents(ServerState s, List<GameEvent> events, List<Outbound> out)
    {
        for (GameEvent event : events)
        {
            out.add(Outbound.forEvent(s, event));
        }
    }
}
