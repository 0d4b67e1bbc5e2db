package org.gungame.server.state;

/**
 * An entity that has health and can be hurt and healed.
 */
public interface Damageable
{
    /**
     * Applies damage, clamping health at zero.
     *
     * @param amount damage to apply, must be positive
     * @return true if this call moved health from positive to zero
     * @throws IllegalArgumentException if amount is not positive
     */
    boolean takeDamage(int amount);

    /**
     * Restores health, clamping at the maximum.
     *
     * @param amount health to restore, must be positive
     * @throws IllegalArgumentException if amount is not positive
     */
    void heal(int amount);

    /**
     * Returns whether health is above zero.
     *
     * @return true if alive
     */
    boolean isAlive();
}
