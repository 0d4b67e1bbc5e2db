package org.gungame.server.simulation;

import org.gungame.protocol.Vec3;

/**
 * A potential hitscan target.
 *
 * @param playerId target id
 * @param position target's stored position
 */
public record HitCandidate(int playerId, Vec3 position)
{
}
