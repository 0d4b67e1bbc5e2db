package org.gungame.server.domain;

/**
 * The server already hosts the maximum number of lobbies.
 */
public class ServerFullException extends GameException
{
    public ServerFullException(String message)
    {
        super(message);
    }
}
