package org.gungame.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Authoritative state of one player, as carried by {@code state_sync}.
 *
 * <p>Clients treat these values as ground truth and overwrite any local
 * prediction with them.</p>
 *
 * @param id              player id
 * @param position        last reported position
 * @param rotation        last reported rotation
 * @param health          current health
 * @param maxHealth       maximum health
 * @param currentWeaponId equipped weapon id, 0 for none
 * @param currentAmmo     rounds left in the magazine
 * @param maxAmmo         magazine capacity of the equipped weapon
 * @param isReloading     whether a reload is in progress
 */
public record PlayerSyncSnapshot(
        int id,
        Vec3 position,
        Vec3 rotation,
        int health,
        @JsonProperty("max_health") int maxHealth,
        @JsonProperty("current_weapon_id") int currentWeaponId,
        @JsonProperty("current_ammo") int currentAmmo,
        @JsonProperty("max_ammo") int maxAmmo,
        @JsonProperty("is_reloading") boolean isReloading
)
{
}
