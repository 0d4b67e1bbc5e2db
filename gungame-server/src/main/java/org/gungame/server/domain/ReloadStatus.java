package org.gungame.server.domain;

/**
 * Outcome of a reload request. Only {@link #STARTED} changes state.
 */
public enum ReloadStatus
{
    STARTED,
    ALREADY_RELOADING,
    MAGAZINE_FULL,
    DEAD
}
