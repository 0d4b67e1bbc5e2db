package org.gungame.server.udp;

import org.gungame.protocol.serialization.MessageCodec;
import org.gungame.server.stats.DefaultServerStats;
import org.gungame.server.transport.EndPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.Objects;

/**
 * Encodes outbound messages and sends them through the endpoint.
 *
 * <p>Never call this while holding the state lock.</p>
 */
public class Broadcaster
{
    private static final Logger LOG = LoggerFactory.getLogger(Broadcaster.class);

    private final EndPoint endPoint;
    private final DefaultServerStats stats;

    public Broadcaster(EndPoint endPoint, DefaultServerStats stats)
    {
        this.endPoint = Objects.requireNonNull(endPoint, "endPoint");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    /**
     * Sends one message to each of its recipients.
     *
     * @param outbound message and recipients
     */
    public void send(Outbound outbound)
    {
        if (outbound.recipients().isEmpty())
        {
            return;
        }
        byte[] payload = MessageCodec.encode(outbound.message());
        for (SocketAddress recipient : outbound.recipients())
        {
            try
            {
                if (endPoint.send(ByteBuffer.wrap(payload), recipient))
                {
                    stats.recordSent(payload.length);
                }
            }
            catch (RuntimeException e)
            {
                LOG.warn("Failed to send {} to {}: {}",
                        outbound.message().getClass().getSimpleName(), recipient, e.getMessage());
            }
        }
    }

    /**
     * Sends several messages in order.
     *
     * @param outbound messages and recipients
     */
    public void sendAll(Collection<Outbound> outbound)
    {
        for (Outbound o : outbound)
        {
            send(o);
        }
    }
}
