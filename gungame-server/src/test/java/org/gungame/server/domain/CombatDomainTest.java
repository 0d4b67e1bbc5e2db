package org.gungame.server.domain;

import org.gungame.protocol.PlayerSyncSnapshot;
import org.gungame.protocol.Vec3;
import org.gungame.server.Fixtures;
import org.gungame.server.simulation.HitCandidate;
import org.gungame.server.simulation.HitResult;
import org.gungame.server.simulation.StubWorldSimulator;
import org.gungame.server.simulation.WorldSimulator;
import org.gungame.server.state.Player;
import org.gungame.server.state.ServerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CombatDomain}.
 */
class CombatDomainTest
{
    private ServerState state;
    private LobbyDomain lobbies;
    private CombatDomain combat;
    private int alice;
    private int bob;

    @BeforeEach
    void setUp()
    {
        state = new ServerState();
        lobbies = new LobbyDomain(Fixtures.config().build(), Fixtures.weapons());
        combat = new CombatDomain(Fixtures.weapons(), new StubWorldSimulator());

        lobbies.createLobby(state, "L", 4, "world", 0);
        alice = lobbies.joinLobby(state, "L", "Alice", 0).playerId();
        bob = lobbies.joinLobby(state, "L", "Bob", 0).playerId();
    }

    private Player player(int id)
    {
        return state.getLobby("L").orElseThrow().getPlayer(id).orElseThrow();
    }

    // ========== Shoot ==========

    @Test
    void shoot_unarmed_doesNotFire()
    {
        assertFalse(combat.playerShoot(state, "L", alice, 1000).fired());
    }

    @Test
    void shoot_consumesRoundAndRecordsTime()
    {
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.PISTOL);

        ShotResult result = combat.playerShoot(state, "L", alice, 1000);

        assertTrue(result.fired());
        assertTrue(result.events().isEmpty());
        assertEquals(5, player(alice).getCurrentAmmo());
        assertEquals(1000, player(alice).getLastShotAtMs());
    }

    @Test
    void shoot_withinCooldown_doesNotFireAndKeepsAmmo()
    {
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.PISTOL);
        assertTrue(combat.playerShoot(state, "L", alice, 1000).fired());

        assertFalse(combat.playerShoot(state, "L", alice, 1099).fired());
        assertEquals(5, player(alice).getCurrentAmmo());

        assertTrue(combat.playerShoot(state, "L", alice, 1100).fired());
        assertEquals(4, player(alice).getCurrentAmmo());
    }

    @Test
    void shoot_emptyMagazine_doesNotFire()
    {
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.PISTOL);
        for (int i = 0; i < 6; i++)
        {
            assertTrue(combat.playerShoot(state, "L", alice, 1000 + i * 100L).fired(), "shot " + i);
        }

        assertFalse(combat.playerShoot(state, "L", alice, 5000).fired());
        assertEquals(0, player(alice).getCurrentAmmo());
    }

    @Test
    void shoot_whileReloading_doesNotFire()
    {
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.PISTOL);
        combat.playerShoot(state, "L", alice, 1000);
        combat.playerStartReload(state, "L", alice, 1100);

        assertFalse(combat.playerShoot(state, "L", alice, 1200).fired());
        assertEquals(5, player(alice).getCurrentAmmo());
    }

    @Test
    void shoot_melee_neverUsesAmmo()
    {
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.KNIFE);

        assertTrue(combat.playerShoot(state, "L", alice, 1000).fired());
        assertTrue(combat.playerShoot(state, "L", alice, 1500).fired());
        assertEquals(0, player(alice).getCurrentAmmo());
    }

    @Test
    void shoot_missingPlayer_throwsNotFound()
    {
        assertThrows(NotFoundException.class, () -> combat.playerShoot(state, "L", 99, 0));
        assertThrows(NotFoundException.class, () -> combat.playerShoot(state, "nope", alice, 0));
    }

    @Test
    void shoot_hitReportedBySimulator_damagesTarget()
    {
        RecordingSimulator simulator = new RecordingSimulator(bob);
        combat = new CombatDomain(Fixtures.weapons(), simulator);
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.RIFLE);
        player(alice).setTransform(new Vec3(1, 0, 0), new Vec3(0, 90, 0));

        ShotResult result = combat.playerShoot(state, "L", alice, 1000);

        assertTrue(result.fired());
        assertEquals(List.of(new GameEvent.PlayerDamaged("L", bob, 40, alice)), result.events());
        assertEquals(60, player(bob).getHealth());
        assertEquals(new Vec3(1, 0, 0), simulator.lastOrigin);
        assertEquals(150.0, simulator.lastRange);
        assertEquals(List.of(bob), simulator.lastCandidates);
    }

    @Test
    void shoot_lethalHit_reportsDeath()
    {
        combat = new CombatDomain(Fixtures.weapons(), new RecordingSimulator(bob));
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.RIFLE);
        player(bob).takeDamage(80);

        ShotResult result = combat.playerShoot(state, "L", alice, 1000);

        assertEquals(List.of(
                new GameEvent.PlayerDamaged("L", bob, 40, alice),
                new GameEvent.PlayerDied("L", bob, alice)), result.events());
        assertEquals(0, player(bob).getHealth());
    }

    @Test
    void shoot_dead_doesNotFire()
    {
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.PISTOL);
        player(alice).takeDamage(100);

        assertFalse(combat.playerShoot(state, "L", alice, 1000).fired());
        assertEquals(6, player(alice).getCurrentAmmo());
    }

    // ========== Damage ==========

    @Test
    void takeDamage_deathReportedExactlyOnce()
    {
        List<GameEvent> first = combat.playerTakeDamage(state, "L", bob, 70, alice);
        List<GameEvent> second = combat.playerTakeDamage(state, "L", bob, 70, alice);
        List<GameEvent> third = combat.playerTakeDamage(state, "L", bob, 70, alice);

        assertEquals(List.of(new GameEvent.PlayerDamaged("L", bob, 70, alice)), first);
        assertTrue(second.contains(new GameEvent.PlayerDied("L", bob, alice)));
        assertTrue(third.isEmpty());
        assertEquals(0, player(bob).getHealth());
    }

    @Test
    void takeDamage_nonPositive_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> combat.playerTakeDamage(state, "L", bob, 0, alice));
        assertEquals(100, player(bob).getHealth());
    }

    @Test
    void respawn_restoresDeadPlayerOnly()
    {
        assertTrue(combat.respawnPlayer(state, "L", bob).isEmpty());

        combat.playerTakeDamage(state, "L", bob, 100, alice);
        Optional<GameEvent.PlayerRespawned> respawned = combat.respawnPlayer(state, "L", bob);

        assertEquals(Optional.of(new GameEvent.PlayerRespawned("L", bob)), respawned);
        assertEquals(100, player(bob).getHealth());
    }

    // ========== Reload ==========

    @Test
    void reload_thenTickAfterReloadTime_refillsMagazine()
    {
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.PISTOL);
        combat.playerShoot(state, "L", alice, 1000);
        combat.playerShoot(state, "L", alice, 1100);

        assertEquals(ReloadStatus.STARTED, combat.playerStartReload(state, "L", alice, 2000));
        assertTrue(combat.updateReloadStates(state, 2499).isEmpty());
        assertTrue(player(alice).isReloading());

        List<ReloadCompletion> done = combat.updateReloadStates(state, 2500);

        assertEquals(List.of(new ReloadCompletion("L", alice)), done);
        assertEquals(6, player(alice).getCurrentAmmo());
        assertFalse(player(alice).isReloading());
        assertTrue(combat.updateReloadStates(state, 2500).isEmpty());
        assertEquals(6, player(alice).getCurrentAmmo());
    }

    @Test
    void reload_alreadyReloading_isNoOp()
    {
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.PISTOL);
        combat.playerShoot(state, "L", alice, 1000);
        combat.playerStartReload(state, "L", alice, 2000);

        assertEquals(ReloadStatus.ALREADY_RELOADING, combat.playerStartReload(state, "L", alice, 2100));
        assertEquals(2000, player(alice).getReloadStartedAtMs());
    }

    @Test
    void reload_fullMagazine_isNoOp()
    {
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.PISTOL);

        assertEquals(ReloadStatus.MAGAZINE_FULL, combat.playerStartReload(state, "L", alice, 1000));
        assertFalse(player(alice).isReloading());
    }

    @Test
    void reload_meleeWeapon_isNoOp()
    {
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.KNIFE);

        assertEquals(ReloadStatus.MAGAZINE_FULL, combat.playerStartReload(state, "L", alice, 1000));
    }

    @Test
    void reload_dead_isNoOp()
    {
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.PISTOL);
        combat.playerShoot(state, "L", alice, 1000);
        player(alice).takeDamage(100);

        assertEquals(ReloadStatus.DEAD, combat.playerStartReload(state, "L", alice, 1100));
    }

    // ========== Weapon switch ==========

    @Test
    void switchWeapon_grantsFullMagazineAndCancelsReload()
    {
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.PISTOL);
        combat.playerShoot(state, "L", alice, 1000);
        combat.playerStartReload(state, "L", alice, 1100);

        GameEvent.WeaponSwitched event = combat.playerSwitchWeapon(state, "L", alice, Fixtures.RIFLE);

        assertEquals(new GameEvent.WeaponSwitched("L", alice, Fixtures.RIFLE), event);
        assertEquals(3, player(alice).getCurrentAmmo());
        assertEquals(3, player(alice).getMaxAmmo());
        assertFalse(player(alice).isReloading());
    }

    @Test
    void switchWeapon_unknownWeapon_throwsAndLeavesPlayerUnchanged()
    {
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.PISTOL);
        combat.playerShoot(state, "L", alice, 1000);

        assertThrows(NotFoundException.class, () -> combat.playerSwitchWeapon(state, "L", alice, 42));

        assertEquals(Fixtures.PISTOL, player(alice).getCurrentWeaponId());
        assertEquals(5, player(alice).getCurrentAmmo());
    }

    // ========== Sync ==========

    @Test
    void stateSync_snapshotsEveryPlayer()
    {
        combat.playerSwitchWeapon(state, "L", alice, Fixtures.PISTOL);
        combat.playerTakeDamage(state, "L", bob, 15, alice);

        List<PlayerSyncSnapshot> sync = combat.getLobbyStateSync(state, "L");

        assertEquals(2, sync.size());
        assertEquals(alice, sync.get(0).id());
        assertEquals(6, sync.get(0).currentAmmo());
        assertEquals(bob, sync.get(1).id());
        assertEquals(85, sync.get(1).health());
    }

    @Test
    void stateSync_missingLobby_throws()
    {
        assertThrows(NotFoundException.class, () -> combat.getLobbyStateSync(state, "nope"));
    }

    /**
     * Simulator that always hits one player and records the query.
     */
    private static class RecordingSimulator implements WorldSimulator
    {
        private final int target;
        Vec3 lastOrigin;
        double lastRange;
        List<Integer> lastCandidates = new ArrayList<>();

        RecordingSimulator(int target)
        {
            this.target = target;
        }

        @Override
        public boolean hasLineOfSight(Vec3 from, Vec3 to)
        {
            return true;
        }

        @Override
        public Optional<HitResult> hitscan(Vec3 origin, Vec3 rotation, double range,
                                           Collection<HitCandidate> candidates)
        {
            lastOrigin = origin;
            lastRange = range;
            lastCandidates = candidates.stream().map(HitCandidate::playerId).toList();
            return candidates.stream()
                    .filter(c -> c.playerId() == target)
                    .findFirst()
                    .map(c -> new HitResult(c.playerId(), c.position(), 1.0));
        }

        @Override
        public boolean collides(Vec3 from, Vec3 to)
        {
            return false;
        }
    }
}
