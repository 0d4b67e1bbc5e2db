package org.gungame.protocol.http;

/**
 * Body of every non-2xx HTTP response.
 *
 * @param error description of the failure
 */
public record ErrorResponse(String error)
{
}
