package org.abstractica.gameservices.chat;

import java.util.Objects;

/**
 * Result of creating a room.
 *
 * @param info the new room's metadata
 * @param room a handle posting as the system sender; it does not count as a member
 */
public record RoomCreation(RoomInfo info, ChatRoom room)
{
    public RoomCreation
    {
        Objects.requireNonNull(info, "info");
        Objects.requireNonNull(room, "room");
    }
}
