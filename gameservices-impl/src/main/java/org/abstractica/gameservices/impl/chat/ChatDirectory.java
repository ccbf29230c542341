package org.abstractica.gameservices.impl.chat;

import org.abstractica.gameservices.Faction;
import org.abstractica.gameservices.PlayerInfo;
import org.abstractica.gameservices.Reply;
import org.abstractica.gameservices.Status;
import org.abstractica.gameservices.chat.ChatMessage;
import org.abstractica.gameservices.chat.ChatRoom;
import org.abstractica.gameservices.chat.ChatService;
import org.abstractica.gameservices.chat.MessageKind;
import org.abstractica.gameservices.chat.RoomCreation;
import org.abstractica.gameservices.chat.RoomInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registry of named chat rooms.
 *
 * <p>Rooms are keyed by name. Room handles minted by
 * {@link #joinRoom} and {@link #createRoom} resolve their room by name
 * through this directory on every call, so a missing room is reported
 * as NOT_FOUND rather than acted on.</p>
 */
public class ChatDirectory implements ChatService
{
    private static final Logger LOG = LoggerFactory.getLogger(ChatDirectory.class);

    /**
     * Sender bound to the handle returned from room creation.
     */
    static final PlayerInfo SYSTEM_SENDER = new PlayerInfo(0, "system", Faction.NEUTRAL, 0);

    private final Object lock = new Object();
    private final Map<String, RoomState> rooms = new HashMap<>();
    private final Clock clock;
    private long nextRoomId = 1;

    /**
     * Creates an empty directory.
     *
     * @param clock clock used to timestamp messages
     */
    public ChatDirectory(Clock clock)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ========== ChatService Interface ==========

    @Override
    public Reply<RoomCreation> createRoom(String name, String topic)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(topic, "topic");

        RoomInfo info;
        synchronized (lock)
        {
            if (rooms.containsKey(name))
            {
                return Reply.of(Status.ALREADY_EXISTS);
            }
            RoomState room = new RoomState(nextRoomId++, name, topic);
            rooms.put(name, room);
            info = room.info();
        }

        LOG.info("Room created: id={}, name={}", info.id(), name);
        return Reply.ok(new RoomCreation(info, new RoomHandle(this, name, SYSTEM_SENDER, false)));
    }

    @Override
    public Reply<ChatRoom> joinRoom(String name, PlayerInfo player)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(player, "player");

        synchronized (lock)
        {
            RoomState room = rooms.get(name);
            if (room == null)
            {
                return Reply.of(Status.NOT_FOUND);
            }
            room.join();
        }

        LOG.debug("Player {} joined room {}", player.id(), name);
        return Reply.ok(new RoomHandle(this, name, player, true));
    }

    @Override
    public List<RoomInfo> listRooms()
    {
        synchronized (lock)
        {
            List<RoomInfo> infos = new ArrayList<>(rooms.size());
            for (RoomState room : rooms.values())
            {
                infos.add(room.info());
            }
            return infos;
        }
    }

    @Override
    public Reply<ChatMessage> whisper(PlayerInfo from, long toPlayerId, String content)
    {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(content, "content");

        return Reply.ok(new ChatMessage(from, content, clock.millis(), new MessageKind.Whisper(toPlayerId)));
    }

    // ========== Room Access ==========

    Reply<ChatMessage> post(String roomName, PlayerInfo sender, String content, MessageKind kind)
    {
        Objects.requireNonNull(content, "content");

        synchronized (lock)
        {
            RoomState room = rooms.get(roomName);
            if (room == null)
            {
                return Reply.of(Status.NOT_FOUND);
            }
            ChatMessage message = new ChatMessage(sender, content, clock.millis(), kind);
            room.append(message);
            return Reply.ok(message);
        }
    }

    List<ChatMessage> history(String roomName, int limit)
    {
        synchronized (lock)
        {
            RoomState room = rooms.get(roomName);
            if (room == null)
            {
                return List.of();
            }
            return room.recent(limit);
        }
    }

    Reply<RoomInfo> info(String roomName)
    {
        synchronized (lock)
        {
            RoomState room = rooms.get(roomName);
            if (room == null)
            {
                return Reply.of(Status.NOT_FOUND);
            }
            return Reply.ok(room.info());
        }
    }

    Status leave(String roomName, PlayerInfo player, boolean member)
    {
        synchronized (lock)
        {
            RoomState room = rooms.get(roomName);
            if (room == null)
            {
                return Status.NOT_FOUND;
            }
            if (!member)
            {
                return Status.OK;
            }
            room.leave();
        }

        LOG.debug("Player {} left room {}", player.id(), roomName);
        return Status.OK;
    }
}
