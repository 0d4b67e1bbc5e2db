package org.gungame.server.domain;

import org.gungame.protocol.PlayerInfo;
import org.gungame.protocol.ServerMessage;

/**
 * Something that happened in a lobby and that members should be told about.
 *
 * <p>Domain operations return events instead of sending anything; the
 * transport layer decides who receives the corresponding message.</p>
 */
public sealed interface GameEvent permits
        GameEvent.PlayerJoined,
        GameEvent.PlayerLeft,
        GameEvent.PlayerDamaged,
        GameEvent.PlayerDied,
        GameEvent.PlayerRespawned,
        GameEvent.ReloadStarted,
        GameEvent.ReloadFinished,
        GameEvent.WeaponSwitched
{
    /**
     * Returns the lobby in which the event happened.
     *
     * @return lobby code
     */
    String lobbyCode();

    /**
     * Converts the event to the message broadcast to lobby members.
     *
     * @return the wire message
     */
    ServerMessage toMessage();

    record PlayerJoined(String lobbyCode, PlayerInfo player) implements GameEvent
    {
        @Override
        public ServerMessage toMessage()
        {
            return new ServerMessage.PlayerJoined(player);
        }
    }

    record PlayerLeft(String lobbyCode, int playerId) implements GameEvent
    {
        @Override
        public ServerMessage toMessage()
        {
            return new ServerMessage.PlayerLeft(playerId);
        }
    }

    record PlayerDamaged(String lobbyCode, int playerId, int damage, int attackerId) implements GameEvent
    {
        @Override
        public ServerMessage toMessage()
        {
            return new ServerMessage.PlayerDamaged(playerId, damage, attackerId);
        }
    }

    record PlayerDied(String lobbyCode, int playerId, int killerId) implements GameEvent
    {
        @Override
        public ServerMessage toMessage()
        {
            return new ServerMessage.PlayerDied(playerId, killerId);
        }
    }

    record PlayerRespawned(String lobbyCode, int playerId) implements GameEvent
    {
        @Override
        public ServerMessage toMessage()
        {
            return new ServerMessage.PlayerRespawned(playerId);
        }
    }

    record ReloadStarted(String lobbyCode, int playerId) implements GameEvent
    {
        @Override
        public ServerMessage toMessage()
        {
            return new ServerMessage.ReloadStarted(playerId);
        }
    }

    record ReloadFinished(String lobbyCode, int playerId) implements GameEvent
    {
        @Override
        public ServerMessage toMessage()
        {
            return new ServerMessage.ReloadFinished(playerId);
        }
    }

    record WeaponSwitched(String lobbyCode, int playerId, int weaponId) implements GameEvent
    {
        @Override
        public ServerMessage toMessage()
        {
            return new ServerMessage.WeaponSwitched(playerId, weaponId);
        }
    }
}
