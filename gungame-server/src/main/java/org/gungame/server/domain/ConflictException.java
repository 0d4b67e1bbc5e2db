package org.gungame.server.domain;

/**
 * A lobby with the requested code already exists.
 */
public class ConflictException extends GameException
{
    public ConflictException(String message)
    {
        super(message);
    }
}
