package org.gungame.server.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A lobby created at startup and kept for the lifetime of the process.
 *
 * @param code       lobby code
 * @param maxPlayers capacity
 * @param scene      world label
 */
public record DefaultLobby(
        String code,
        @JsonProperty("max_players") int maxPlayers,
        String scene
)
{
    public DefaultLobby
    {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(scene, "scene");
        if (code.isBlank())
        {
            throw new IllegalArgumentException("Default lobby code must not be blank");
        }
        if (maxPlayers <= 0)
        {
            throw new IllegalArgumentException("Default lobby max_players must be positive: " + maxPlayers);
        }
    }
}
