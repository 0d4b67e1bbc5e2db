package org.gungame.server.weapon;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable stats of one weapon.
 *
 * <p>A weapon with {@code ammoCapacity == 0} is a melee weapon: it has no
 * magazine, never consumes ammo and never reloads.</p>
 *
 * @param id           weapon id, positive
 * @param name         display name
 * @param damage       damage per hit
 * @param fireRate     shots per second
 * @param ammoCapacity magazine size, 0 for melee
 * @param reloadTime   reload duration in seconds
 * @param range        maximum hit distance in world units
 */
public record WeaponData(
        int id,
        String name,
        int damage,
        @JsonProperty("fire_rate") double fireRate,
        @JsonProperty("ammo_capacity") int ammoCapacity,
        @JsonProperty("reload_time") double reloadTime,
        double range
)
{
    public WeaponData
    {
        if (id <= 0)
        {
            throw new IllegalArgumentException("Weapon id must be positive: " + id);
        }
        if (damage < 0)
        {
            throw new IllegalArgumentException("Damage must be >= 0: " + damage);
        }
        if (fireRate <= 0)
        {
            throw new IllegalArgumentException("Fire rate must be positive: " + fireRate);
        }
        if (ammoCapacity < 0)
        {
            throw new IllegalArgumentException("Ammo capacity must be >= 0: " + ammoCapacity);
        }
        if (reloadTime < 0)
        {
            throw new IllegalArgumentException("Reload time must be >= 0: " + reloadTime);
        }
        if (range < 0)
        {
            throw new IllegalArgumentException("Range must be >= 0: " + range);
        }
    }

    /**
     * Returns whether this weapon has a finite magazine.
     *
     * @return false for melee weapons
     */
    public boolean hasMagazine()
    {
        return ammoCapacity > 0;
    }

    /**
     * Returns the minimum time between two accepted shots.
     *
     * @return cooldown in milliseconds
     */
    public long cooldownMs()
    {
        return (long) Math.ceil(1000.0 / fireRate);
    }

    /**
     * Returns the reload duration.
     *
     * @return reload time in milliseconds
     */
    public long reloadTimeMs()
    {
        return Math.round(reloadTime * 1000.0);
    }
}
