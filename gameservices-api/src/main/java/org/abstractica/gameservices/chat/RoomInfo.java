package org.abstractica.gameservices.chat;

import java.util.Objects;

/**
 * Room metadata.
 *
 * @param id          room identifier
 * @param name        unique room name
 * @param topic       room topic
 * @param memberCount joined members, never negative
 */
public record RoomInfo(long id, String name, String topic, int memberCount)
{
    public RoomInfo
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(topic, "topic");
    }
}
