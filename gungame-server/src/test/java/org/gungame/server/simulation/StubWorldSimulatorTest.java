package org.gungame.server.simulation;

import org.gungame.protocol.Vec3;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link StubWorldSimulator}.
 */
class StubWorldSimulatorTest
{
    private final StubWorldSimulator simulator = new StubWorldSimulator();

    @Test
    void hitscan_neverHits()
    {
        List<HitCandidate> candidates = List.of(new HitCandidate(2, new Vec3(0, 0, 1)));

        assertTrue(simulator.hitscan(Vec3.ZERO, Vec3.ZERO, 100.0, candidates).isEmpty());
    }

    @Test
    void lineOfSight_isAlwaysClear()
    {
        assertTrue(simulator.hasLineOfSight(Vec3.ZERO, new Vec3(10, 0, 10)));
    }

    @Test
    void collides_isAlwaysFalse()
    {
        assertFalse(simulator.collides(Vec3.ZERO, new Vec3(10, 0, 10)));
    }
}
