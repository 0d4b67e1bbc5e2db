package org.gungame.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;

/**
 * Datagrams sent from client to server.
 *
 * <p>Every message names the sending player. All but {@link PositionUpdate}
 * also name the lobby; a position update without a lobby code is resolved
 * by player id.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ClientMessage.Join.class, name = "join"),
        @JsonSubTypes.Type(value = ClientMessage.Leave.class, name = "leave"),
        @JsonSubTypes.Type(value = ClientMessage.PositionUpdate.class, name = "position_update"),
        @JsonSubTypes.Type(value = ClientMessage.Shoot.class, name = "shoot"),
        @JsonSubTypes.Type(value = ClientMessage.Reload.class, name = "reload"),
        @JsonSubTypes.Type(value = ClientMessage.WeaponSwitch.class, name = "weapon_switch"),
        @JsonSubTypes.Type(value = ClientMessage.RequestState.class, name = "request_state"),
        @JsonSubTypes.Type(value = ClientMessage.Keepalive.class, names = {"keepalive", "heartbeat"}),
        @JsonSubTypes.Type(value = ClientMessage.Respawn.class, name = "respawn")
})
public sealed interface ClientMessage permits
        ClientMessage.Join,
        ClientMessage.Leave,
        ClientMessage.PositionUpdate,
        ClientMessage.Shoot,
        ClientMessage.Reload,
        ClientMessage.WeaponSwitch,
        ClientMessage.RequestState,
        ClientMessage.Keepalive,
        ClientMessage.Respawn
{
    /**
     * Returns the lobby the message is addressed to.
     *
     * @return the lobby code, or null when the sender omitted it
     */
    String lobbyCode();

    /**
     * Returns the id of the sending player.
     *
     * @return the player id
     */
    Integer playerId();

    /**
     * Binds the sender's UDP address to a player previously admitted over HTTP.
     *
     * @param lobbyCode lobby the player joined
     * @param playerId  id returned by the HTTP join
     */
    @JsonTypeName("join")
    record Join(
            @JsonProperty("lobby_code") String lobbyCode,
            @JsonProperty("player_id") Integer playerId
    ) implements ClientMessage
    {
        public Join
        {
            requireLobby(lobbyCode);
            requirePlayer(playerId);
        }
    }

    /**
     * Leaves the lobby immediately instead of waiting for the inactivity sweep.
     */
    @JsonTypeName("leave")
    record Leave(
            @JsonProperty("lobby_code") String lobbyCode,
            @JsonProperty("player_id") Integer playerId
    ) implements ClientMessage
    {
        public Leave
        {
            requireLobby(lobbyCode);
            requirePlayer(playerId);
        }
    }

    /**
     * Reports the sender's own transform.
     *
     * @param lobbyCode optional lobby code
     * @param playerId  sender id
     * @param position  new position
     * @param rotation  new rotation, zero when omitted
     */
    @JsonTypeName("position_update")
    record PositionUpdate(
            @JsonProperty("lobby_code") String lobbyCode,
            @JsonProperty("player_id") Integer playerId,
            Vec3 position,
            Vec3 rotation
    ) implements ClientMessage
    {
        public PositionUpdate
        {
            requirePlayer(playerId);
            Objects.requireNonNull(position, "position is required");
            if (rotation == null)
            {
                rotation = Vec3.ZERO;
            }
        }
    }

    /**
     * Pulls the trigger. Targets are resolved by the server.
     */
    @JsonTypeName("shoot")
    record Shoot(
            @JsonProperty("lobby_code") String lobbyCode,
            @JsonProperty("player_id") Integer playerId
    ) implements ClientMessage
    {
        public Shoot
        {
            requireLobby(lobbyCode);
            requirePlayer(playerId);
        }
    }

    /**
     * Starts reloading the equipped weapon.
     */
    @JsonTypeName("reload")
    record Reload(
            @JsonProperty("lobby_code") String lobbyCode,
            @JsonProperty("player_id") Integer playerId
    ) implements ClientMessage
    {
        public Reload
        {
            requireLobby(lobbyCode);
            requirePlayer(playerId);
        }
    }

    /**
     * Equips another weapon from the weapon table.
     *
     * @param lobbyCode lobby code
     * @param playerId  sender id
     * @param weaponId  weapon to equip
     */
    @JsonTypeName("weapon_switch")
    record WeaponSwitch(
            @JsonProperty("lobby_code") String lobbyCode,
            @JsonProperty("player_id") Integer playerId,
            @JsonProperty("weapon_id") Integer weaponId
    ) implements ClientMessage
    {
        public WeaponSwitch
        {
            requireLobby(lobbyCode);
            requirePlayer(playerId);
            Objects.requireNonNull(weaponId, "weapon_id is required");
        }
    }

    /**
     * Asks for an immediate {@code state_sync} of the whole lobby.
     */
    @JsonTypeName("request_state")
    record RequestState(
            @JsonProperty("lobby_code") String lobbyCode,
            @JsonProperty("player_id") Integer playerId
    ) implements ClientMessage
    {
        public RequestState
        {
            requireLobby(lobbyCode);
            requirePlayer(playerId);
        }
    }

    /**
     * Keeps the player alive while no position updates are flowing.
     */
    @JsonTypeName("keepalive")
    record Keepalive(
            @JsonProperty("lobby_code") String lobbyCode,
            @JsonProperty("player_id") Integer playerId
    ) implements ClientMessage
    {
        public Keepalive
        {
            requireLobby(lobbyCode);
            requirePlayer(playerId);
        }
    }

    /**
     * Brings a dead player back at full health.
     */
    @JsonTypeName("respawn")
    record Respawn(
            @JsonProperty("lobby_code") String lobbyCode,
            @JsonProperty("player_id") Integer playerId
    ) implements ClientMessage
    {
        public Respawn
        {
            requireLobby(lobbyCode);
            requirePlayer(playerId);
        }
    }

    private static void requireLobby(String lobbyCode)
    {
        if (lobbyCode == null || lobbyCode.isBlank())
        {
            throw new IllegalArgumentException("lobby_code is required");
        }
    }

    private static void requirePlayer(Integer playerId)
    {
        Objects.requireNonNull(playerId, "player_id is required");
    }
}
