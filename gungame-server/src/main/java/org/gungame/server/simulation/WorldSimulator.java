package org.gungame.server.simulation;

import org.gungame.protocol.Vec3;

import java.util.Collection;
import java.util.Optional;

/**
 * World queries used to resolve game outcomes.
 *
 * <p>The server does not simulate physics; implementations answer
 * geometric questions against the lobby's stored transforms.</p>
 */
public interface WorldSimulator
{
    /**
     * Returns whether nothing blocks the straight segment between two points.
     *
     * @param from start point
     * @param to   end point
     * @return true if the segment is unobstructed
     */
    boolean hasLineOfSight(Vec3 from, Vec3 to);

    /**
     * Casts an instant ray and returns the first target it hits.
     *
     * @param origin     ray origin, the shooter's position
     * @param rotation   shooter's rotation, defining the ray direction
     * @param range      maximum distance
     * @param candidates targets that may be hit
     * @return the hit, or empty if nothing was hit
     */
    Optional<HitResult> hitscan(Vec3 origin, Vec3 rotation, double range, Collection<HitCandidate> candidates);

    /**
     * Returns whether moving between two points would pass through geometry.
     *
     * @param from start point
     * @param to   end point
     * @return true if the move collides
     */
    boolean collides(Vec3 from, Vec3 to);
}
