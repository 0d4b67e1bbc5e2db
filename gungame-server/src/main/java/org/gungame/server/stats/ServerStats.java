package org.gungame.server.stats;

/**
 * Server statistics for monitoring.
 *
 * <p>Statistics are pollable values. Counters only grow; lobby and player
 * counts reflect the moment of the call.</p>
 */
public interface ServerStats
{
    /**
     * Returns the number of datagrams received.
     *
     * @return received packet count
     */
    long getPacketsReceived();

    /**
     * Returns the number of datagrams discarded as malformed or invalid.
     *
     * @return dropped packet count
     */
    long getPacketsDropped();

    /**
     * Returns the number of datagrams sent.
     *
     * @return sent packet count
     */
    long getPacketsSent();

    /**
     * Returns the total payload bytes sent.
     *
     * @return sent byte count
     */
    long getBytesSent();

    /**
     * Returns the number of lobbies that currently exist.
     *
     * @return lobby count
     */
    int getLobbyCount();

    /**
     * Returns the number of players across all lobbies.
     *
     * @return player count
     */
    int getPlayerCount();

    /**
     * Captures every value at once, for serialization.
     *
     * @return a snapshot
     */
    default StatsSnapshot snapshot()
    {
        return new StatsSnapshot(
                getPacketsReceived(),
                getPacketsDropped(),
                getPacketsSent(),
                getBytesSent(),
                getLobbyCount(),
                getPlayerCount()
        );
    }
}
