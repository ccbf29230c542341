package org.abstractica.gameservices.impl.chat;

import org.abstractica.gameservices.chat.ChatMessage;
import org.abstractica.gameservices.chat.RoomInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable directory entry for one room.
 *
 * <p>Not thread-safe; only touched while holding the directory's lock.</p>
 */
class RoomState
{
    private final long id;
    private final String name;
    private final String topic;
    private final List<ChatMessage> messages = new ArrayList<>();
    private int memberCount;

    RoomState(long id, String name, String topic)
    {
        this.id = id;
        this.name = name;
        this.topic = topic;
    }

    void append(ChatMessage message)
    {
        messages.add(message);
    }

    /**
     * Returns the most recent messages, oldest first. A limit of 0 returns
     * the whole log.
     */
    List<ChatMessage> recent(int limit)
    {
        int from = limit == 0 ? 0 : Math.max(0, messages.size() - limit);
        return List.copyOf(messages.subList(from, messages.size()));
    }

    void join()
    {
        memberCount++;
    }

    void leave()
    {
        if (memberCount > 0)
        {
            memberCount--;
        }
    }

    RoomInfo info()
    {
        return new RoomInfo(id, name, topic, memberCount);
    }
}
