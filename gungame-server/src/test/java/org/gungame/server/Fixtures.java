package org.gungame.server;

import org.gungame.server.config.ServerConfig;
import org.gungame.server.weapon.WeaponData;
import org.gungame.server.weapon.WeaponDatabase;

import java.time.Duration;
import java.util.List;

/**
 * Shared test data.
 */
public final class Fixtures
{
    public static final int PISTOL = 1;
    public static final int KNIFE = 2;
    public static final int RIFLE = 3;

    public static final WeaponData PISTOL_DATA = new WeaponData(PISTOL, "Six Shooter", 25, 10.0, 6, 0.5, 50.0);
    public static final WeaponData KNIFE_DATA = new WeaponData(KNIFE, "Knife", 50, 2.0, 0, 0.0, 2.0);
    public static final WeaponData RIFLE_DATA = new WeaponData(RIFLE, "Rifle", 40, 1.0, 3, 2.0, 150.0);

    private Fixtures()
    {
    }

    /**
     * Pistol: 100 ms cooldown, 6 rounds, 500 ms reload. Knife: melee, 500 ms
     * cooldown. Rifle: 1000 ms cooldown, 3 rounds, 2000 ms reload.
     */
    public static WeaponDatabase weapons()
    {
        return WeaponDatabase.of(List.of(PISTOL_DATA, KNIFE_DATA, RIFLE_DATA));
    }

    /**
     * Configuration without default lobbies or dummy bot, on ephemeral ports.
     */
    public static ServerConfig.Builder config()
    {
        return ServerConfig.builder()
                .bindAddress("127.0.0.1")
                .httpPort(0)
                .udpPort(0)
                .dummyBotEnabled(false)
                .defaultLobbies(List.of())
                .emptyLobbyGrace(Duration.ofSeconds(60));
    }
}
