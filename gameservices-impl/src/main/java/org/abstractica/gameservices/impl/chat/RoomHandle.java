package org.abstractica.gameservices.impl.chat;

import org.abstractica.gameservices.PlayerInfo;
import org.abstractica.gameservices.Reply;
import org.abstractica.gameservices.Status;
import org.abstractica.gameservices.chat.ChatMessage;
import org.abstractica.gameservices.chat.ChatRoom;
import org.abstractica.gameservices.chat.MessageKind;
import org.abstractica.gameservices.chat.RoomInfo;

import java.util.List;
import java.util.Objects;

/**
 * Chat room handle bound to one (room, sender) pair.
 *
 * <p>The binding is immutable. All room state lives in the directory and
 * is reached through its lock on every call. Handles that are not members
 * (the system handle returned on room creation) never change the member
 * count.</p>
 */
class RoomHandle implements ChatRoom
{
    private final ChatDirectory directory;
    private final String roomName;
    private final PlayerInfo sender;
    private final boolean member;

    RoomHandle(ChatDirectory directory, String roomName, PlayerInfo sender, boolean member)
    {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.roomName = Objects.requireNonNull(roomName, "roomName");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.member = member;
    }

    @Override
    public String roomName()
    {
        return roomName;
    }

    @Override
    public PlayerInfo sender()
    {
        return sender;
    }

    @Override
    public Reply<ChatMessage> sendMessage(String content)
    {
        return directory.post(roomName, sender, content, new MessageKind.Normal());
    }

    @Override
    public Reply<ChatMessage> sendEmote(String content)
    {
        return directory.post(roomName, sender, content, new MessageKind.Emote());
    }

    @Override
    public List<ChatMessage> getHistory(int limit)
    {
        if (limit < 0)
        {
            throw new IllegalArgumentException("limit must be >= 0: " + limit);
        }
        return directory.history(roomName, limit);
    }

    @Override
    public Reply<RoomInfo> getInfo()
    {
        return directory.info(roomName);
    }

    @Override
    public Status leave()
    {
        return directory.leave(roomName, sender, member);
    }

    @Override
    public String toString()
    {
        return "RoomHandle[" + roomName + ", " + sender.name() + "]";
    }
}
