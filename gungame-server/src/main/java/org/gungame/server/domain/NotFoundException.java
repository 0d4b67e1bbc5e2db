package org.gungame.server.domain;

/**
 * A lobby, player or weapon does not exist.
 */
public class NotFoundException extends GameException
{
    public NotFoundException(String message)
    {
        super(message);
    }

    public static NotFoundException lobby(String code)
    {
        return new NotFoundException("Lobby not found: " + code);
    }

    public static NotFoundException player(String code, int playerId)
    {
        return new NotFoundException("Player " + playerId + " not found in lobby " + code);
    }

    public static NotFoundException player(int playerId)
    {
        return new NotFoundException("Player not found: " + playerId);
    }

    public static NotFoundException weapon(int weaponId)
    {
        return new NotFoundException("Weapon not found: " + weaponId);
    }
}
