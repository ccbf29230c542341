package org.abstractica.gameservices.chat;

import org.abstractica.gameservices.Capability;
import org.abstractica.gameservices.PlayerInfo;
import org.abstractica.gameservices.Reply;

import java.util.List;

/**
 * The chat directory service.
 */
public interface ChatService extends Capability
{
    /**
     * Creates a room.
     *
     * @param name  unique room name
     * @param topic room topic
     * @return OK with the room info and a system handle, or ALREADY_EXISTS
     */
    Reply<RoomCreation> createRoom(String name, String topic);

    /**
     * Joins a room, minting a handle bound to the player.
     *
     * @param name   room name
     * @param player the joining player
     * @return OK with the handle, or NOT_FOUND
     */
    Reply<ChatRoom> joinRoom(String name, PlayerInfo player);

    /**
     * Lists all rooms.
     *
     * @return room metadata, in no particular order
     */
    List<RoomInfo> listRooms();

    /**
     * Builds a whisper. The message is returned, not stored in any room.
     *
     * @param from       the sender
     * @param toPlayerId the recipient's player id
     * @param content    message text
     * @return OK with the message
     */
    Reply<ChatMessage> whisper(PlayerInfo from, long toPlayerId, String content);
}
