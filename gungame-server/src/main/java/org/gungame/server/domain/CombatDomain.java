package org.gungame.server.domain;

import org.gungame.protocol.PlayerSyncSnapshot;
import org.gungame.server.simulation.HitCandidate;
import org.gungame.server.simulation.HitResult;
import org.gungame.server.simulation.WorldSimulator;
import org.gungame.server.state.Lobby;
import org.gungame.server.state.Player;
import org.gungame.server.state.ServerState;
import org.gungame.server.weapon.WeaponData;
import org.gungame.server.weapon.WeaponDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Combat rules: firing, damage, reloading, weapon switching and respawn.
 *
 * <p>Each player moves along two independent axes. The fire axis goes
 * {@code Ready -> Reloading -> Ready}, gated by ammo and the weapon's
 * cooldown. The life axis goes {@code Alive -> Dead} when health reaches
 * zero and back only through an explicit respawn.</p>
 *
 * <p>Requests that the rules refuse (a shot while reloading, a second
 * reload) are reported through return values, not exceptions. Only
 * missing lobbies, players and weapons throw.</p>
 */
public class CombatDomain
{
    private static final Logger LOG = LoggerFactory.getLogger(CombatDomain.class);

    private final WeaponDatabase weapons;
    private final WorldSimulator simulator;

    public CombatDomain(WeaponDatabase weapons, WorldSimulator simulator)
    {
        this.weapons = Objects.requireNonNull(weapons, "weapons");
        this.simulator = Objects.requireNonNull(simulator, "simulator");
    }

    // ========== Firing ==========

    /**
     * Pulls the trigger for a player.
     *
     * <p>The shot is refused when the player is dead, unarmed, reloading,
     * out of ammo, or still inside the weapon's cooldown. An accepted shot
     * uses one round (melee weapons use none) and is resolved as a hitscan
     * from the shooter's stored transform.</p>
     *
     * @param state    server state
     * @param code     lobby code
     * @param playerId shooter
     * @param nowMs    current time
     * @return whether the shot fired, plus any damage events
     * @throws NotFoundException if the lobby or player does not exist
     */
    public ShotResult playerShoot(ServerState state, String code, int playerId, long nowMs)
    {
        Lobby lobby = StateLookup.requireLobby(state, code);
        Player shooter = StateLookup.requirePlayer(lobby, playerId);

        Optional<WeaponData> equipped = weapons.get(shooter.getCurrentWeaponId());
        if (!shooter.isAlive() || equipped.isEmpty() || shooter.isReloading())
        {
            return ShotResult.NOT_FIRED;
        }
        WeaponData weapon = equipped.get();
        if (weapon.hasMagazine() && shooter.getCurrentAmmo() == 0)
        {
            return ShotResult.NOT_FIRED;
        }
        if (shooter.hasShot() && nowMs - shooter.getLastShotAtMs() < weapon.cooldownMs())
        {
            return ShotResult.NOT_FIRED;
        }

        if (weapon.hasMagazine())
        {
            shooter.consumeRound();
        }
        shooter.setLastShotAtMs(nowMs);

        List<HitCandidate> candidates = lobby.getPlayers().values().stream()
                .filter(p -> p.getId() != playerId && p.isAlive())
                .map(p -> new HitCandidate(p.getId(), p.getPosition()))
                .toList();
        Optional<HitResult> hit = simulator.hitscan(
                shooter.getPosition(), shooter.getRotation(), weapon.range(), candidates);

        if (hit.isEmpty() || weapon.damage() == 0)
        {
            return new ShotResult(true, List.of());
        }
        LOG.debug("Player {} hit player {} at {} with {}",
                playerId, hit.get().playerId(), hit.get().distance(), weapon.name());
        return new ShotResult(true, applyDamage(lobby, hit.get().playerId(), weapon.damage(), playerId));
    }

    // ========== Damage ==========

    /**
     * Applies damage to a player.
     *
     * <p>Health is clamped at zero. The hit that takes health from positive
     * to zero produces the only {@link GameEvent.PlayerDied} for that life;
     * hitting a dead player changes nothing.</p>
     *
     * @param state      server state
     * @param code       lobby code
     * @param playerId   target
     * @param amount     damage, must be positive
     * @param attackerId player credited with the hit
     * @return a damage event, followed by a death event if the hit was lethal
     * @throws NotFoundException        if the lobby or player does not exist
     * @throws IllegalArgumentException if amount is not positive
     */
    public List<GameEvent> playerTakeDamage(ServerState state, String code, int playerId, int amount,
                                            int attackerId)
    {
        if (amount <= 0)
        {
            throw new IllegalArgumentException("Damage must be positive: " + amount);
        }
        return applyDamage(StateLookup.requireLobby(state, code), playerId, amount, attackerId);
    }

    private List<GameEvent> applyDamage(Lobby lobby, int playerId, int amount, int attackerId)
    {
        Player target = StateLookup.requirePlayer(lobby, playerId);
        if (!target.isAlive())
        {
            return List.of();
        }

        List<GameEvent> events = new ArrayList<>(2);
        boolean killed = target.takeDamage(amount);
        events.add(new GameEvent.PlayerDamaged(lobby.getCode(), playerId, amount, attackerId));
        if (killed)
        {
            LOG.info("Player {} killed player {} in lobby '{}'", attackerId, playerId, lobby.getCode());
            events.add(new GameEvent.PlayerDied(lobby.getCode(), playerId, attackerId));
        }
        return events;
    }

    /**
     * Restores a dead player to full health. Living players are unaffected.
     *
     * @param state    server state
     * @param code     lobby code
     * @param playerId player to respawn
     * @return the respawn event, or empty if the player was alive
     * @throws NotFoundException if the lobby or player does not exist
     */
    public Optional<GameEvent.PlayerRespawned> respawnPlayer(ServerState state, String code, int playerId)
    {
        Lobby lobby = StateLookup.requireLobby(state, code);
        Player player = StateLookup.requirePlayer(lobby, playerId);
        if (player.isAlive())
        {
            return Optional.empty();
        }
        player.heal(player.getMaxHealth());
        LOG.debug("Player {} respawned in lobby '{}'", playerId, lobby.getCode());
        return Optional.of(new GameEvent.PlayerRespawned(lobby.getCode(), playerId));
    }

    // ========== Reload ==========

    /**
     * Starts a reload.
     *
     * @param state    server state
     * @param code     lobby code
     * @param playerId player id
     * @param nowMs    current time
     * @return {@link ReloadStatus#STARTED} if a reload began, otherwise why not
     * @throws NotFoundException if the lobby or player does not exist
     */
    public ReloadStatus playerStartReload(ServerState state, String code, int playerId, long nowMs)
    {
        Player player = StateLookup.requirePlayer(state, code, playerId);
        if (!player.isAlive())
        {
            return ReloadStatus.DEAD;
        }
        if (player.isReloading())
        {
            return ReloadStatus.ALREADY_RELOADING;
        }
        if (player.isMagazineFull())
        {
            return ReloadStatus.MAGAZINE_FULL;
        }
        player.startReload(nowMs);
        return ReloadStatus.STARTED;
    }

    /**
     * Completes every reload whose reload time has elapsed.
     *
     * <p>This is the only place reloads finish; call it on a fixed cadence.
     * Calling it again with the same time changes nothing.</p>
     *
     * @param state server state
     * @param nowMs current time
     * @return the reloads that finished
     */
    public List<ReloadCompletion> updateReloadStates(ServerState state, long nowMs)
    {
        List<ReloadCompletion> completed = new ArrayList<>();
        for (Lobby lobby : state.getLobbies())
        {
            for (Player player : lobby.getPlayers().values())
            {
                if (!player.isReloading())
                {
                    continue;
                }
                long reloadMs = weapons.get(player.getCurrentWeaponId())
                        .map(WeaponData::reloadTimeMs)
                        .orElse(0L);
                if (nowMs - player.getReloadStartedAtMs() >= reloadMs)
                {
                    player.finishReload();
                    completed.add(new ReloadCompletion(lobby.getCode(), player.getId()));
                }
            }
        }
        return completed;
    }

    // ========== Weapons ==========

    /**
     * Equips a weapon with a full magazine, cancelling any reload.
     *
     * @param state    server state
     * @param code     lobby code
     * @param playerId player id
     * @param weaponId weapon to equip
     * @return the switch event
     * @throws NotFoundException if the lobby, player or weapon does not exist
     */
    public GameEvent.WeaponSwitched playerSwitchWeapon(ServerState state, String code, int playerId, int weaponId)
    {
        Lobby lobby = StateLookup.requireLobby(state, code);
        Player player = StateLookup.requirePlayer(lobby, playerId);
        WeaponData weapon = weapons.get(weaponId).orElseThrow(() -> NotFoundException.weapon(weaponId));

        player.equip(weapon);
        LOG.debug("Player {} switched to {}", playerId, weapon.name());
        return new GameEvent.WeaponSwitched(lobby.getCode(), playerId, weaponId);
    }

    // ========== Sync ==========

    /**
     * Snapshots every player in a lobby.
     *
     * @param state server state
     * @param code  lobby code
     * @return one snapshot per player, in join order
     * @throws NotFoundException if the lobby does not exist
     */
    public List<PlayerSyncSnapshot> getLobbyStateSync(ServerState state, String code)
    {
        return StateLookup.requireLobby(state, code).getPlayers().values().stream()
                .map(Player::toSnapshot)
                .toList();
    }
}
