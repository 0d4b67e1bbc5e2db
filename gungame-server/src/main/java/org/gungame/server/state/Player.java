package org.gungame.server.state;

import org.gungame.protocol.PlayerInfo;
import org.gungame.protocol.PlayerSyncSnapshot;
import org.gungame.protocol.Vec3;
import org.gungame.server.weapon.WeaponData;
import org.gungame.server.weapon.WeaponDatabase;

import java.util.Objects;

/**
 * Authoritative state of one player.
 *
 * <p>Health stays within {@code [0, maxHealth]} and ammo within
 * {@code [0, maxAmmo]}; every mutator preserves these bounds. Not
 * thread-safe: guarded by the {@link SharedState} lock.</p>
 */
public class Player implements Damageable
{
    public static final int DEFAULT_MAX_HEALTH = 100;

    private static final long NEVER = Long.MIN_VALUE;

    private final int id;
    private final String name;

    private Vec3 position;
    private Vec3 rotation;

    private int health;
    private final int maxHealth;

    private int currentWeaponId;
    private int currentAmmo;
    private int maxAmmo;

    private boolean reloading;
    private long reloadStartedAtMs;
    private long lastShotAtMs;
    private long lastActivityMs;

    /**
     * Creates a player at full health with no weapon.
     *
     * @param id        unique player id
     * @param name      display name
     * @param position  spawn position
     * @param createdMs creation time, used as first activity
     */
    public Player(int id, String name, Vec3 position, long createdMs)
    {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.position = Objects.requireNonNull(position, "position");
        this.rotation = Vec3.ZERO;
        this.maxHealth = DEFAULT_MAX_HEALTH;
        this.health = DEFAULT_MAX_HEALTH;
        this.currentWeaponId = WeaponDatabase.NO_WEAPON;
        this.currentAmmo = 0;
        this.maxAmmo = 0;
        this.reloading = false;
        this.reloadStartedAtMs = NEVER;
        this.lastShotAtMs = NEVER;
        this.lastActivityMs = createdMs;
    }

    public int getId()
    {
        return id;
    }

    public String getName()
    {
        return name;
    }

    // ========== Transform ==========

    public Vec3 getPosition()
    {
        return position;
    }

    public Vec3 getRotation()
    {
        return rotation;
    }

    public void setTransform(Vec3 position, Vec3 rotation)
    {
        this.position = Objects.requireNonNull(position, "position");
        this.rotation = Objects.requireNonNull(rotation, "rotation");
    }

    // ========== Damageable ==========

    @Override
    public boolean takeDamage(int amount)
    {
        if (amount <= 0)
        {
            throw new IllegalArgumentException("Damage must be positive: " + amount);
        }
        boolean wasAlive = health > 0;
        health = Math.max(0, health - amount);
        return wasAlive && health == 0;
    }

    @Override
    public void heal(int amount)
    {
        if (amount <= 0)
        {
            throw new IllegalArgumentException("Heal amount must be positive: " + amount);
        }
        health = Math.min(maxHealth, health + amount);
    }

    @Override
    public boolean isAlive()
    {
        return health > 0;
    }

    public int getHealth()
    {
        return health;
    }

    public int getMaxHealth()
    {
        return maxHealth;
    }

    // ========== Weapon and Ammo ==========

    public int getCurrentWeaponId()
    {
        return currentWeaponId;
    }

    public int getCurrentAmmo()
    {
        return currentAmmo;
    }

    public int getMaxAmmo()
    {
        return maxAmmo;
    }

    /**
     * Equips a weapon with a full magazine and cancels any reload.
     *
     * @param weapon the weapon to equip
     */
    public void equip(WeaponData weapon)
    {
        this.currentWeaponId = weapon.id();
        this.maxAmmo = weapon.ammoCapacity();
        this.currentAmmo = weapon.ammoCapacity();
        this.reloading = false;
        this.reloadStartedAtMs = NEVER;
    }

    /**
     * Removes one round from the magazine.
     *
     * @throws IllegalStateException if the magazine is empty
     */
    public void consumeRound()
    {
        if (currentAmmo == 0)
        {
            throw new IllegalStateException("Magazine is empty");
        }
        currentAmmo--;
    }

    public boolean isMagazineFull()
    {
        return currentAmmo == maxAmmo;
    }

    // ========== Reload ==========

    public boolean isReloading()
    {
        return reloading;
    }

    public long getReloadStartedAtMs()
    {
        return reloadStartedAtMs;
    }

    public void startReload(long nowMs)
    {
        this.reloading = true;
        this.reloadStartedAtMs = nowMs;
    }

    /**
     * Refills the magazine and ends the reload.
     */
    public void finishReload()
    {
        this.currentAmmo = maxAmmo;
        this.reloading = false;
        this.reloadStartedAtMs = NEVER;
    }

    // ========== Timing ==========

    /**
     * Returns when the last accepted shot was fired.
     *
     * @return timestamp in milliseconds, or {@link Long#MIN_VALUE} if never
     */
    public long getLastShotAtMs()
    {
        return lastShotAtMs;
    }

    public void setLastShotAtMs(long lastShotAtMs)
    {
        this.lastShotAtMs = lastShotAtMs;
    }

    public boolean hasShot()
    {
        return lastShotAtMs != NEVER;
    }

    public long getLastActivityMs()
    {
        return lastActivityMs;
    }

    public void touch(long nowMs)
    {
        this.lastActivityMs = nowMs;
    }

    // ========== Views ==========

    public PlayerInfo toInfo()
    {
        return new PlayerInfo(id, name);
    }

    public PlayerSyncSnapshot toSnapshot()
    {
        return new PlayerSyncSnapshot(
                id,
                position,
                rotation,
                health,
                maxHealth,
                currentWeaponId,
                currentAmmo,
                maxAmmo,
                reloading
        );
    }

    @Override
    public String toString()
    {
        return "Player[" + id + " '" + name + "']";
    }
}
