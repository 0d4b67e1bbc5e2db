package org.gungame.server.domain;

/**
 * Base class for domain failures that callers are expected to translate,
 * for example into an HTTP status code.
 */
public class GameException extends RuntimeException
{
    public GameException(String message)
    {
        super(message);
    }
}
