package org.abstractica.gameservices.chat;

import org.abstractica.gameservices.Capability;
import org.abstractica.gameservices.PlayerInfo;
import org.abstractica.gameservices.Reply;
import org.abstractica.gameservices.Status;

import java.util.List;

/**
 * A handle onto one chat room, bound to one sender.
 *
 * <p>Every handle minted for the same room shares that room's log and
 * member count. Each call resolves the room by name; if it no longer
 * resolves the call reports NOT_FOUND.</p>
 */
public interface ChatRoom extends Capability
{
    /**
     * Returns the name of the room this handle is bound to.
     *
     * @return the room name
     */
    String roomName();

    /**
     * Returns the sender this handle posts as.
     *
     * @return the bound sender
     */
    PlayerInfo sender();

    /**
     * Appends a normal message.
     *
     * @param content message text
     * @return OK with the stored message, or NOT_FOUND
     */
    Reply<ChatMessage> sendMessage(String content);

    /**
     * Appends an emote.
     *
     * @param content emote text
     * @return OK with the stored message, or NOT_FOUND
     */
    Reply<ChatMessage> sendEmote(String content);

    /**
     * Returns the most recent messages in chronological order.
     *
     * @param limit maximum number of messages, non-negative; 0 for all
     * @return up to {@code limit} messages, oldest first
     */
    List<ChatMessage> getHistory(int limit);

    /**
     * Reads the current room metadata.
     *
     * @return OK with the room info, or NOT_FOUND
     */
    Reply<RoomInfo> getInfo();

    /**
     * Leaves the room, decrementing its member count.
     *
     * <p>The handle remains usable after leaving. Leaving through the
     * system handle of a room is a no-op.</p>
     *
     * @return OK, or NOT_FOUND
     */
    Status leave();
}
