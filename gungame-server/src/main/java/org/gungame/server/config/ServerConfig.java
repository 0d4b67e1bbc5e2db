package org.gungame.server.config;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable server configuration.
 *
 * <p>Create instances with {@link #builder()}; every setter validates its
 * argument so an invalid configuration fails before anything binds a
 * socket.</p>
 */
public final class ServerConfig
{
    private final String bindAddress;
    private final int httpPort;
    private final int udpPort;
    private final String publicAddress;
    private final int httpThreads;
    private final Duration inactivityTimeout;
    private final Duration sweepInterval;
    private final Duration emptyLobbyGrace;
    private final Duration reloadTick;
    private final Duration dummyBotTick;
    private final Duration stateSyncInterval;
    private final int maxLobbies;
    private final int defaultMaxPlayers;
    private final String defaultScene;
    private final int startingWeaponId;
    private final boolean dummyBotEnabled;
    private final String weaponsResource;
    private final List<DefaultLobby> defaultLobbies;

    private ServerConfig(Builder builder)
    {
        this.bindAddress = builder.bindAddress;
        this.httpPort = builder.httpPort;
        this.udpPort = builder.udpPort;
        this.publicAddress = builder.publicAddress;
        this.httpThreads = builder.httpThreads;
        this.inactivityTimeout = builder.inactivityTimeout;
        this.sweepInterval = builder.sweepInterval;
        this.emptyLobbyGrace = builder.emptyLobbyGrace;
        this.reloadTick = builder.reloadTick;
        this.dummyBotTick = builder.dummyBotTick;
        this.stateSyncInterval = builder.stateSyncInterval;
        this.maxLobbies = builder.maxLobbies;
        this.defaultMaxPlayers = builder.defaultMaxPlayers;
        this.defaultScene = builder.defaultScene;
        this.startingWeaponId = builder.startingWeaponId;
        this.dummyBotEnabled = builder.dummyBotEnabled;
        this.weaponsResource = builder.weaponsResource;
        this.defaultLobbies = List.copyOf(builder.defaultLobbies);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Returns the configuration with every default applied.
     *
     * @return default configuration
     */
    public static ServerConfig defaults()
    {
        return builder().build();
    }

    public String getBindAddress()
    {
        return bindAddress;
    }

    public int getHttpPort()
    {
        return httpPort;
    }

    public int getUdpPort()
    {
        return udpPort;
    }

    /**
     * Returns the address reported to clients as {@code server_ip}.
     *
     * @return public address
     */
    public String getPublicAddress()
    {
        return publicAddress;
    }

    public int getHttpThreads()
    {
        return httpThreads;
    }

    public Duration getInactivityTimeout()
    {
        return inactivityTimeout;
    }

    public Duration getSweepInterval()
    {
        return sweepInterval;
    }

    /**
     * Returns how long a new lobby may stay empty before the sweep removes it.
     *
     * @return grace period measured from lobby creation
     */
    public Duration getEmptyLobbyGrace()
    {
        return emptyLobbyGrace;
    }

    public Duration getReloadTick()
    {
        return reloadTick;
    }

    public Duration getDummyBotTick()
    {
        return dummyBotTick;
    }

    public Duration getStateSyncInterval()
    {
        return stateSyncInterval;
    }

    public int getMaxLobbies()
    {
        return maxLobbies;
    }

    public int getDefaultMaxPlayers()
    {
        return defaultMaxPlayers;
    }

    public String getDefaultScene()
    {
        return defaultScene;
    }

    /**
     * Returns the weapon new players start with.
     *
     * @return weapon id, 0 for none
     */
    public int getStartingWeaponId()
    {
        return startingWeaponId;
    }

    public boolean isDummyBotEnabled()
    {
        return dummyBotEnabled;
    }

    /**
     * Returns where the weapon table is loaded from.
     *
     * @return a file path, or a classpath resource name when no such file exists
     */
    public String getWeaponsResource()
    {
        return weaponsResource;
    }

    public List<DefaultLobby> getDefaultLobbies()
    {
        return defaultLobbies;
    }

    @Override
    public String toString()
    {
        return "ServerConfig[http=" + bindAddress + ":" + httpPort
                + ", udp=" + bindAddress + ":" + udpPort
                + ", public=" + publicAddress
                + ", maxLobbies=" + maxLobbies
                + ", inactivityTimeout=" + inactivityTimeout
                + ", defaultLobbies=" + defaultLobbies.size() + "]";
    }

    public static class Builder
    {
        private String bindAddress = "0.0.0.0";
        private int httpPort = 8080;
        private int udpPort = 8081;
        private String publicAddress = "127.0.0.1";
        private int httpThreads = 8;
        private Duration inactivityTimeout = Duration.ofSeconds(30);
        private Duration sweepInterval = Duration.ofSeconds(5);
        private Duration emptyLobbyGrace = Duration.ofSeconds(60);
        private Duration reloadTick = Duration.ofMillis(100);
        private Duration dummyBotTick = Duration.ofMillis(100);
        private Duration stateSyncInterval = Duration.ofSeconds(1);
        private int maxLobbies = 1000;
        private int defaultMaxPlayers = 4;
        private String defaultScene = "world";
        private int startingWeaponId = 0;
        private boolean dummyBotEnabled = true;
        private String weaponsResource = "weapons.json";
        private List<DefaultLobby> defaultLobbies = List.of(new DefaultLobby("public", 8, "test_world"));

        private Builder()
        {
        }

        public Builder bindAddress(String bindAddress)
        {
            this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
            return this;
        }

        public Builder httpPort(int port)
        {
            this.httpPort = checkPort(port);
            return this;
        }

        public Builder udpPort(int port)
        {
            this.udpPort = checkPort(port);
            return this;
        }

        public Builder publicAddress(String publicAddress)
        {
            this.publicAddress = Objects.requireNonNull(publicAddress, "publicAddress");
            return this;
        }

        public Builder httpThreads(int threads)
        {
            if (threads <= 0)
            {
                throw new IllegalArgumentException("httpThreads must be positive: " + threads);
            }
            this.httpThreads = threads;
            return this;
        }

        public Builder inactivityTimeout(Duration timeout)
        {
            this.inactivityTimeout = checkPositive(timeout, "Inactivity timeout");
            return this;
        }

        public Builder sweepInterval(Duration interval)
        {
            this.sweepInterval = checkPositive(interval, "Sweep interval");
            return this;
        }

        public Builder emptyLobbyGrace(Duration grace)
        {
            Objects.requireNonNull(grace, "grace");
            if (grace.isNegative())
            {
                throw new IllegalArgumentException("Empty lobby grace must not be negative");
            }
            this.emptyLobbyGrace = grace;
            return this;
        }

        public Builder reloadTick(Duration tick)
        {
            this.reloadTick = checkPositive(tick, "Reload tick");
            return this;
        }

        public Builder dummyBotTick(Duration tick)
        {
            this.dummyBotTick = checkPositive(tick, "Dummy bot tick");
            return this;
        }

        public Builder stateSyncInterval(Duration interval)
        {
            this.stateSyncInterval = checkPositive(interval, "State sync interval");
            return this;
        }

        public Builder maxLobbies(int maxLobbies)
        {
            if (maxLobbies <= 0)
            {
                throw new IllegalArgumentException("maxLobbies must be positive: " + maxLobbies);
            }
            this.maxLobbies = maxLobbies;
            return this;
        }

        public Builder defaultMaxPlayers(int maxPlayers)
        {
            if (maxPlayers <= 0)
            {
                throw new IllegalArgumentException("defaultMaxPlayers must be positive: " + maxPlayers);
            }
            this.defaultMaxPlayers = maxPlayers;
            return this;
        }

        public Builder defaultScene(String scene)
        {
            this.defaultScene = Objects.requireNonNull(scene, "scene");
            return this;
        }

        public Builder startingWeaponId(int weaponId)
        {
            if (weaponId < 0)
            {
                throw new IllegalArgumentException("startingWeaponId must be >= 0: " + weaponId);
            }
            this.startingWeaponId = weaponId;
            return this;
        }

        public Builder dummyBotEnabled(boolean enabled)
        {
            this.dummyBotEnabled = enabled;
            return this;
        }

        public Builder weaponsResource(String resource)
        {
            this.weaponsResource = Objects.requireNonNull(resource, "resource");
            return this;
        }

        public Builder defaultLobbies(List<DefaultLobby> lobbies)
        {
            this.defaultLobbies = List.copyOf(Objects.requireNonNull(lobbies, "lobbies"));
            return this;
        }

        public ServerConfig build()
        {
            return new ServerConfig(this);
        }

        private static int checkPort(int port)
        {
            if (port < 0 || port > 65535)
            {
                throw new IllegalArgumentException("Port must be 0-65535: " + port);
            }
            return port;
        }

        private static Duration checkPositive(Duration value, String name)
        {
            Objects.requireNonNull(value, name);
            if (value.isNegative() || value.isZero())
            {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
