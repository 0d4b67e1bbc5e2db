package org.gungame.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * Datagrams sent from server to clients.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ServerMessage.Welcome.class, name = "welcome"),
        @JsonSubTypes.Type(value = ServerMessage.PositionUpdate.class, name = "position_update"),
        @JsonSubTypes.Type(value = ServerMessage.PlayerJoined.class, name = "player_joined"),
        @JsonSubTypes.Type(value = ServerMessage.PlayerLeft.class, name = "player_left"),
        @JsonSubTypes.Type(value = ServerMessage.WeaponSwitched.class, name = "weapon_switched"),
        @JsonSubTypes.Type(value = ServerMessage.PlayerDamaged.class, name = "player_damaged"),
        @JsonSubTypes.Type(value = ServerMessage.PlayerDied.class, name = "player_died"),
        @JsonSubTypes.Type(value = ServerMessage.PlayerRespawned.class, name = "player_respawned"),
        @JsonSubTypes.Type(value = ServerMessage.ReloadStarted.class, name = "reload_started"),
        @JsonSubTypes.Type(value = ServerMessage.ReloadFinished.class, name = "reload_finished"),
        @JsonSubTypes.Type(value = ServerMessage.StateSync.class, name = "state_sync"),
        @JsonSubTypes.Type(value = ServerMessage.ServerDummyUpdate.class, name = "server_dummy_update")
})
public sealed interface ServerMessage permits
        ServerMessage.Welcome,
        ServerMessage.PositionUpdate,
        ServerMessage.PlayerJoined,
        ServerMessage.PlayerLeft,
        ServerMessage.WeaponSwitched,
        ServerMessage.PlayerDamaged,
        ServerMessage.PlayerDied,
        ServerMessage.PlayerRespawned,
        ServerMessage.ReloadStarted,
        ServerMessage.ReloadFinished,
        ServerMessage.StateSync,
        ServerMessage.ServerDummyUpdate
{
    /**
     * Confirms that the sender's address is now bound to its player.
     *
     * @param message human-readable greeting
     */
    @JsonTypeName("welcome")
    record Welcome(String message) implements ServerMessage
    {
    }

    /**
     * Relays another player's transform.
     *
     * @param playerId the player that moved
     * @param position its new position
     * @param rotation its new rotation
     */
    @JsonTypeName("position_update")
    record PositionUpdate(
            @JsonProperty("player_id") int playerId,
            Vec3 position,
            Vec3 rotation
    ) implements ServerMessage
    {
    }

    /**
     * Notifies lobby members that a player bound its address.
     *
     * @param player the player who joined
     */
    @JsonTypeName("player_joined")
    record PlayerJoined(PlayerInfo player) implements ServerMessage
    {
    }

    /**
     * Notifies lobby members that a player left or was evicted.
     *
     * @param playerId the player who left
     */
    @JsonTypeName("player_left")
    record PlayerLeft(@JsonProperty("player_id") int playerId) implements ServerMessage
    {
    }

    /**
     * Notifies lobby members of a weapon change.
     *
     * @param playerId the player who switched
     * @param weaponId the weapon now equipped
     */
    @JsonTypeName("weapon_switched")
    record WeaponSwitched(
            @JsonProperty("player_id") int playerId,
            @JsonProperty("weapon_id") int weaponId
    ) implements ServerMessage
    {
    }

    /**
     * Notifies lobby members that a player was hit.
     *
     * @param playerId   the player who took damage
     * @param damage     damage dealt
     * @param attackerId the player who fired
     */
    @JsonTypeName("player_damaged")
    record PlayerDamaged(
            @JsonProperty("player_id") int playerId,
            int damage,
            @JsonProperty("attacker_id") int attackerId
    ) implements ServerMessage
    {
    }

    /**
     * Notifies lobby members that a player's health reached zero.
     *
     * @param playerId the player who died
     * @param killerId the player who dealt the lethal hit
     */
    @JsonTypeName("player_died")
    record PlayerDied(
            @JsonProperty("player_id") int playerId,
            @JsonProperty("killer_id") int killerId
    ) implements ServerMessage
    {
    }

    /**
     * Notifies lobby members that a dead player is back at full health.
     *
     * @param playerId the respawned player
     */
    @JsonTypeName("player_respawned")
    record PlayerRespawned(@JsonProperty("player_id") int playerId) implements ServerMessage
    {
    }

    /**
     * Notifies lobby members that a player started reloading.
     *
     * @param playerId the reloading player
     */
    @JsonTypeName("reload_started")
    record ReloadStarted(@JsonProperty("player_id") int playerId) implements ServerMessage
    {
    }

    /**
     * Notifies lobby members that a player's magazine is full again.
     *
     * @param playerId the player who finished reloading
     */
    @JsonTypeName("reload_finished")
    record ReloadFinished(@JsonProperty("player_id") int playerId) implements ServerMessage
    {
    }

    /**
     * Full authoritative snapshot of every player in the lobby.
     *
     * @param players one snapshot per player
     */
    @JsonTypeName("state_sync")
    record StateSync(List<PlayerSyncSnapshot> players) implements ServerMessage
    {
        public StateSync
        {
            players = List.copyOf(players);
        }
    }

    /**
     * Position of the server-owned dummy bot.
     *
     * @param position the bot's current position
     */
    @JsonTypeName("server_dummy_update")
    record ServerDummyUpdate(Vec3 position) implements ServerMessage
    {
    }
}
