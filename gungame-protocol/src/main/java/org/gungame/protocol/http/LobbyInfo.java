package org.gungame.protocol.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.gungame.protocol.PlayerInfo;

import java.util.List;

/**
 * Public description of a lobby, returned by every lobby endpoint.
 *
 * @param code        lobby code as created
 * @param playerCount number of players in the lobby
 * @param maxPlayers  capacity
 * @param players     roster
 * @param serverIp    address clients should send UDP to
 * @param udpPort     UDP port of the data plane
 * @param scene       opaque world label chosen by the creator
 */
public record LobbyInfo(
        String code,
        @JsonProperty("player_count") int playerCount,
        @JsonProperty("max_players") int maxPlayers,
        List<PlayerInfo> players,
        @JsonProperty("server_ip") String serverIp,
        @JsonProperty("udp_port") int udpPort,
        String scene
)
{
    public LobbyInfo
    {
        players = List.copyOf(players);
    }
}
