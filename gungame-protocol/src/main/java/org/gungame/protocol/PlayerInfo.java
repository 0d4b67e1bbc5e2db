package org.gungame.protocol;

/**
 * Public identity of a player as listed in lobby rosters.
 *
 * @param id   server-assigned player id
 * @param name display name chosen at join
 */
public record PlayerInfo(int id, String name)
{
}
