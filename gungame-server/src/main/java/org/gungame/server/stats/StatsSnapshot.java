package org.gungame.server.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code GET /stats}.
 */
public record StatsSnapshot(
        @JsonProperty("packets_received") long packetsReceived,
        @JsonProperty("packets_dropped") long packetsDropped,
        @JsonProperty("packets_sent") long packetsSent,
        @JsonProperty("bytes_sent") long bytesSent,
        int lobbies,
        int players
)
{
}
