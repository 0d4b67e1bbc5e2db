package org.gungame.protocol.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.gungame.protocol.ClientMessage;
import org.gungame.protocol.ServerMessage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Encodes and decodes protocol messages to/from JSON.
 *
 * <p>Client and server messages are tagged by a {@code type} property.
 * Unknown properties are ignored so that clients may carry extra fields;
 * unknown types, missing required fields, and invalid JSON are reported as
 * {@link MalformedMessageException}.</p>
 */
public final class MessageCodec
{
    private MessageCodec() {}

    /**
     * Largest datagram the server will attempt to decode.
     */
    public static final int MAX_DATAGRAM_SIZE = 8192;

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    /**
     * Returns the shared mapper configured for the wire format.
     *
     * @return the object mapper
     */
    public static ObjectMapper mapper()
    {
        return MAPPER;
    }

    // ========== Encoding ==========

    /**
     * Encodes a server message.
     *
     * @param message the message to encode
     * @return UTF-8 JSON bytes
     */
    public static byte[] encode(ServerMessage message)
    {
        Objects.requireNonNull(message, "message");
        return write(ServerMessage.class, message);
    }

    /**
     * Encodes a client message.
     *
     * @param message the message to encode
     * @return UTF-8 JSON bytes
     */
    public static byte[] encode(ClientMessage message)
    {
        Objects.requireNonNull(message, "message");
        return write(ClientMessage.class, message);
    }

    /**
     * Encodes any JSON-mappable value, such as an HTTP body.
     *
     * @param value the value to encode
     * @return UTF-8 JSON bytes
     */
    public static byte[] toJson(Object value)
    {
        try
        {
            return MAPPER.writeValueAsBytes(value);
        }
        catch (JsonProcessingException e)
        {
            throw new UncheckedIOException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    // ========== Decoding ==========

    /**
     * Decodes a client message.
     *
     * @param data   buffer holding the datagram
     * @param offset start of the datagram
     * @param length datagram length
     * @return the decoded message
     * @throws MalformedMessageException if the bytes are not a valid client message
     */
    public static ClientMessage decodeClient(byte[] data, int offset, int length) throws MalformedMessageException
    {
        if (length > MAX_DATAGRAM_SIZE)
        {
            throw new MalformedMessageException("Datagram too large: " + length + " bytes");
        }
        return read(data, offset, length, ClientMessage.class);
    }

    /**
     * Decodes a client message.
     *
     * @param data the datagram
     * @return the decoded message
     * @throws MalformedMessageException if the bytes are not a valid client message
     */
    public static ClientMessage decodeClient(byte[] data) throws MalformedMessageException
    {
        return decodeClient(data, 0, data.length);
    }

    /**
     * Decodes a server message.
     *
     * @param data the datagram
     * @return the decoded message
     * @throws MalformedMessageException if the bytes are not a valid server message
     */
    public static ServerMessage decodeServer(byte[] data) throws MalformedMessageException
    {
        return read(data, 0, data.length, ServerMessage.class);
    }

    /**
     * Decodes any JSON-mappable value, such as an HTTP body.
     *
     * @param data the JSON bytes
     * @param type target type
     * @param <T>  target type
     * @return the decoded value
     * @throws MalformedMessageException if the bytes do not map onto the type
     */
    public static <T> T fromJson(byte[] data, Class<T> type) throws MalformedMessageException
    {
        return read(data, 0, data.length, type);
    }

    private static byte[] write(Class<?> baseType, Object message)
    {
        try
        {
            return MAPPER.writerFor(baseType).writeValueAsBytes(message);
        }
        catch (JsonProcessingException e)
        {
            throw new UncheckedIOException("Failed to encode " + message.getClass().getSimpleName(), e);
        }
    }

    private static <T> T read(byte[] data, int offset, int length, Class<T> type) throws MalformedMessageException
    {
        if (length == 0)
        {
            throw new MalformedMessageException("Empty payload");
        }

        T value;
        try
        {
            value = MAPPER.readValue(data, offset, length, type);
        }
        catch (IOException e)
        {
            throw new MalformedMessageException(describe(e), e);
        }
        catch (RuntimeException e)
        {
            throw new MalformedMessageException("Invalid " + type.getSimpleName() + ": " + e.getMessage(), e);
        }

        if (value == null)
        {
            throw new MalformedMessageException("Payload is JSON null");
        }
        return value;
    }

    private static String describe(IOException e)
    {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root)
        {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null)
        {
            return e.getClass().getSimpleName();
        }
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }
}
