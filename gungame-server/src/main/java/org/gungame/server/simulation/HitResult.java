package org.gungame.server.simulation;

import org.gungame.protocol.Vec3;

/**
 * A hitscan hit.
 *
 * @param playerId the player that was hit
 * @param point    impact point
 * @param distance distance from the ray origin
 */
public record HitResult(int playerId, Vec3 point, double distance)
{
}
