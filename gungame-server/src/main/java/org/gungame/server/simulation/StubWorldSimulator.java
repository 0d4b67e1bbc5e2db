package org.gungame.server.simulation;

import org.gungame.protocol.Vec3;

import java.util.Collection;
import java.util.Optional;

/**
 * World without geometry or hit detection.
 *
 * <p>Every line of sight is clear, nothing collides and no ray ever hits a
 * target. Shots are still accepted and consume ammo.</p>
 */
public class StubWorldSimulator implements WorldSimulator
{
    @Override
    public boolean hasLineOfSight(Vec3 from, Vec3 to)
    {
        return true;
    }

    @Override
    public Optional<HitResult> hitscan(Vec3 origin, Vec3 rotation, double range, Collection<HitCandidate> candidates)
    {
        return Optional.empty();
    }

    @Override
    public boolean collides(Vec3 from, Vec3 to)
    {
        return false;
    }
}
