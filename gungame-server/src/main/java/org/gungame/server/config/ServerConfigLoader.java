package org.gungame.server.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.gungame.protocol.serialization.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Reads a JSON configuration file and applies it over the defaults.
 *
 * <p>Every key is optional. Durations are given in milliseconds. Unknown
 * keys are ignored.</p>
 */
public final class ServerConfigLoader
{
    private static final Logger LOG = LoggerFactory.getLogger(ServerConfigLoader.class);

    private ServerConfigLoader()
    {
    }

    /**
     * Loads configuration from a file.
     *
     * @param path JSON file
     * @return the resulting configuration
     * @throws UncheckedIOException     if the file cannot be read or parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ServerConfig load(Path path)
    {
        try (InputStream in = Files.newInputStream(path))
        {
            ServerConfig config = read(in);
            LOG.info("Loaded configuration from {}", path);
            return config;
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Failed to read configuration " + path, e);
        }
    }

    /**
     * Parses configuration from a stream.
     *
     * @param in JSON input
     * @return the resulting configuration
     * @throws IOException if the input is not valid JSON
     */
    public static ServerConfig read(InputStream in) throws IOException
    {
        ConfigFile file = MessageCodec.mapper().readValue(in, ConfigFile.class);
        return apply(file, ServerConfig.builder()).build();
    }

    private static ServerConfig.Builder apply(ConfigFile file, ServerConfig.Builder builder)
    {
        if (file.bindAddress != null)
        {
            builder.bindAddress(file.bindAddress);
        }
        if (file.httpPort != null)
        {
            builder.httpPort(file.httpPort);
        }
        if (file.udpPort != null)
        {
            builder.udpPort(file.udpPort);
        }
        if (file.publicAddress != null)
        {
            builder.publicAddress(file.publicAddress);
        }
        if (file.httpThreads != null)
        {
            builder.httpThreads(file.httpThreads);
        }
        if (file.inactivityTimeoutMs != null)
        {
            builder.inactivityTimeout(Duration.ofMillis(file.inactivityTimeoutMs));
        }
        if (file.sweepIntervalMs != null)
        {
            builder.sweepInterval(Duration.ofMillis(file.sweepIntervalMs));
        }
        if (file.emptyLobbyGraceMs != null)
        {
            builder.emptyLobbyGrace(Duration.ofMillis(file.emptyLobbyGraceMs));
        }
        if (file.reloadTickMs != null)
        {
            builder.reloadTick(Duration.ofMillis(file.reloadTickMs));
        }
        if (file.dummyBotTickMs != null)
        {
            builder.dummyBotTick(Duration.ofMillis(file.dummyBotTickMs));
        }
        if (file.stateSyncIntervalMs != null)
        {
            builder.stateSyncInterval(Duration.ofMillis(file.stateSyncIntervalMs));
        }
        if (file.maxLobbies != null)
        {
            builder.maxLobbies(file.maxLobbies);
        }
        if (file.defaultMaxPlayers != null)
        {
            builder.defaultMaxPlayers(file.defaultMaxPlayers);
        }
        if (file.defaultScene != null)
        {
            builder.defaultScene(file.defaultScene);
        }
        if (file.startingWeaponId != null)
        {
            builder.startingWeaponId(file.startingWeaponId);
        }
        if (file.dummyBotEnabled != null)
        {
            builder.dummyBotEnabled(file.dummyBotEnabled);
        }
        if (file.weaponsResource != null)
        {
            builder.weaponsResource(file.weaponsResource);
        }
        if (file.defaultLobbies != null)
        {
            builder.defaultLobbies(file.defaultLobbies);
        }
        return builder;
    }

    /**
     * On-disk shape of the configuration. Absent keys stay null.
     */
    static class ConfigFile
    {
        @JsonProperty("bind_address")
        String bindAddress;
        @JsonProperty("http_port")
        Integer httpPort;
        @JsonProperty("udp_port")
        Integer udpPort;
        @JsonProperty("public_address")
        String publicAddress;
        @JsonProperty("http_threads")
        Integer httpThreads;
        @JsonProperty("inactivity_timeout_ms")
        Long inactivityTimeoutMs;
        @JsonProperty("sweep_interval_ms")
        Long sweepIntervalMs;
        @JsonProperty("empty_lobby_grace_ms")
        Long emptyLobbyGraceMs;
        @JsonProperty("reload_tick_ms")
        Long reloadTickMs;
        @JsonProperty("dummy_bot_tick_ms")
        Long dummyBotTickMs;
        @JsonProperty("state_sync_interval_ms")
        Long stateSyncIntervalMs;
        @JsonProperty("max_lobbies")
        Integer maxLobbies;
        @JsonProperty("default_max_players")
        Integer defaultMaxPlayers;
        @JsonProperty("default_scene")
        String defaultScene;
        @JsonProperty("starting_weapon_id")
        Integer startingWeaponId;
        @JsonProperty("dummy_bot_enabled")
        Boolean dummyBotEnabled;
        @JsonProperty("weapons_resource")
        String weaponsResource;
        @JsonProperty("default_lobbies")
        List<DefaultLobby> defaultLobbies;
    }
}
