package org.gungame.server.stats;

import org.gungame.server.state.Lobby;
import org.gungame.server.state.SharedState;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of ServerStats.
 *
 * <p>Packet counters are updated by the UDP layer; lobby and player counts
 * are read from the shared state under its read lock.</p>
 */
public class DefaultServerStats implements ServerStats
{
    private final SharedState state;
    private final AtomicLong packetsReceived = new AtomicLong(0);
    private final AtomicLong packetsDropped = new AtomicLong(0);
    private final AtomicLong packetsSent = new AtomicLong(0);
    private final AtomicLong bytesSent = new AtomicLong(0);

    /**
     * Creates stats for the given state.
     *
     * @param state the state to count lobbies and players in
     */
    public DefaultServerStats(SharedState state)
    {
        this.state = state;
    }

    @Override
    public long getPacketsReceived()
    {
        return packetsReceived.get();
    }

    @Override
    public long getPacketsDropped()
    {
        return packetsDropped.get();
    }

    @Override
    public long getPacketsSent()
    {
        return packetsSent.get();
    }

    @Override
    public long getBytesSent()
    {
        return bytesSent.get();
    }

    @Override
    public int getLobbyCount()
    {
        return state.read(s -> s.getLobbyCount());
    }

    @Override
    public int getPlayerCount()
    {
        return state.read(s -> s.getLobbies().stream()
                .mapToInt(Lobby::getPlayerCount)
                .sum());
    }

    // ========== Update Methods ==========

    /**
     * Records a datagram received.
     */
    public void recordReceived()
    {
        packetsReceived.incrementAndGet();
    }

    /**
     * Records a datagram discarded.
     */
    public void recordDropped()
    {
        packetsDropped.incrementAndGet();
    }

    /**
     * Records a datagram sent.
     *
     * @param bytes payload size
     */
    public void recordSent(int bytes)
    {
        packetsSent.incrementAndGet();
        bytesSent.addAndGet(bytes);
    }
}
