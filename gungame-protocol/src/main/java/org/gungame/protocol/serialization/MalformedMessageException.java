package org.gungame.protocol.serialization;

/**
 * Thrown when bytes received from the network cannot be decoded into a message.
 */
public class MalformedMessageException extends Exception
{
    public MalformedMessageException(String message)
    {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
