package org.gungame.server.task;

import org.gungame.protocol.ServerMessage;
import org.gungame.protocol.Vec3;
import org.gungame.server.state.Lobby;
import org.gungame.server.state.Player;
import org.gungame.server.state.SharedState;
import org.gungame.server.udp.Broadcaster;
import org.gungame.server.udp.Outbound;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Moves each lobby's dummy bot along a circle and broadcasts
 * {@code server_dummy_update}.
 */
public class DummyBotTask implements Runnable
{
    static final double RADIUS = 3.0;
    static final double HEIGHT = 1.0;
    static final double ANGULAR_SPEED = 0.5; // rad/s

    private final SharedState state;
    private final Broadcaster broadcaster;
    private final LongSupplier clock;
    private final long startMs;

    /**
     * Creates the task.
     *
     * @param state       shared state
     * @param broadcaster outbound sender
     * @param clock       millisecond clock
     * @param startMs     time at which the path starts, usually server start
     */
    public DummyBotTask(SharedState state, Broadcaster broadcaster, LongSupplier clock, long startMs)
    {
        this.state = state;
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.startMs = startMs;
    }

    /**
     * Returns the bot position after the given time on its path.
     *
     * @param elapsedMs time since the path started
     * @return position on a circle of radius 3 at height 1
     */
    public static Vec3 positionAt(long elapsedMs)
    {
        double angle = ANGULAR_SPEED * elapsedMs / 1000.0;
        return new Vec3(RADIUS * Math.cos(angle), HEIGHT, RADIUS * Math.sin(angle));
    }

    @Override
    public void run()
    {
        Vec3 position = positionAt(clock.getAsLong() - startMs);
        List<Outbound> outbound = state.write(s ->
        {
            List<Outbound> out = new ArrayList<>();
            for (Lobby lobby : s.getLobbies())
            {
                Optional<Player> bot = lobby.getDummyPlayer();
                if (bot.isEmpty())
                {
                    continue;
                }
                bot.get().setTransform(position, Vec3.ZERO);
                if (!lobby.getClientAddresses().isEmpty())
                {
                    out.add(Outbound.toLobby(s, lobby.getCode(), new ServerMessage.ServerDummyUpdate(position)));
                }
            }
            return out;
        });
        broadcaster.sendAll(outbound);
    }
}
