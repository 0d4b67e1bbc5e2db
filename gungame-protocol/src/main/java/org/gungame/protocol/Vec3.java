package org.gungame.protocol;

/**
 * A three-component vector used for positions and Euler rotations.
 *
 * @param x x component
 * @param y y component
 * @param z z component
 */
public record Vec3(double x, double y, double z)
{
    public static final Vec3 ZERO = new Vec3(0.0, 0.0, 0.0);
}
