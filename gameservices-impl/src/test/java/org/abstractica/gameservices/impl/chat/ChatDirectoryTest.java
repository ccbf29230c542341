package org.abstractica.gameservices.impl.chat;

import org.abstractica.gameservices.Faction;
import org.abstractica.gameservices.PlayerInfo;
import org.abstractica.gameservices.Reply;
import org.abstractica.gameservices.Status;
import org.abstractica.gameservices.chat.ChatMessage;
import org.abstractica.gameservices.chat.ChatRoom;
import org.abstractica.gameservices.chat.MessageKind;
import org.abstractica.gameservices.chat.RoomCreation;
import org.abstractica.gameservices.chat.RoomInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ChatDirectory} and the room handles it mints.
 */
class ChatDirectoryTest
{
    private static final long NOW = 1_700_000_000_000L;
    private static final PlayerInfo ALICE = new PlayerInfo(1, "Alice", Faction.ALLIANCE, 10);
    private static final PlayerInfo BOB = new PlayerInfo(2, "Bob", Faction.HORDE, 12);

    private ChatDirectory directory;

    @BeforeEach
    void setUp()
    {
        directory = new ChatDirectory(Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
    }

    // ========== Rooms ==========

    @Test
    void createRoom_returnsInfoAndSystemHandle()
    {
        RoomCreation creation = directory.createRoom("lobby", "General chat").orElseThrow();

        assertEquals(1, creation.info().id());
        assertEquals("lobby", creation.info().name());
        assertEquals("General chat", creation.info().topic());
        assertEquals(0, creation.info().memberCount());
        assertEquals(ChatDirectory.SYSTEM_SENDER, creation.room().sender());
    }

    @Test
    void createRoom_duplicateName_returnsAlreadyExists()
    {
        directory.createRoom("x", "t");

        Reply<RoomCreation> second = directory.createRoom("x", "t2");

        assertEquals(Status.ALREADY_EXISTS, second.status());
        List<RoomInfo> rooms = directory.listRooms();
        assertEquals(1, rooms.size());
        assertEquals("x", rooms.get(0).name());
        assertEquals("t", rooms.get(0).topic());
    }

    @Test
    void createRoom_idsIncrease()
    {
        long first = directory.createRoom("a", "").orElseThrow().info().id();
        long second = directory.createRoom("b", "").orElseThrow().info().id();

        assertTrue(second > first);
    }

    @Test
    void joinRoom_unknownRoom_returnsNotFound()
    {
        assertEquals(Status.NOT_FOUND, directory.joinRoom("nowhere", ALICE).status());
    }

    @Test
    void joinRoom_incrementsMemberCount()
    {
        directory.createRoom("lobby", "");

        directory.joinRoom("lobby", ALICE);
        ChatRoom bob = directory.joinRoom("lobby", BOB).orElseThrow();

        assertEquals(2, bob.getInfo().orElseThrow().memberCount());
    }

    @Test
    void leave_decrementsFlooredAtZero()
    {
        directory.createRoom("lobby", "");
        ChatRoom alice = directory.joinRoom("lobby", ALICE).orElseThrow();

        assertEquals(Status.OK, alice.leave());
        assertEquals(Status.OK, alice.leave());

        assertEquals(0, alice.getInfo().orElseThrow().memberCount());
    }

    @Test
    void leave_systemHandle_keepsMemberCount()
    {
        RoomCreation creation = directory.createRoom("lobby", "").orElseThrow();
        ChatRoom alice = directory.joinRoom("lobby", ALICE).orElseThrow();

        assertEquals(Status.OK, creation.room().leave());

        assertEquals(1, alice.getInfo().orElseThrow().memberCount());
        assertEquals(Status.OK, alice.leave());
        assertEquals(0, creation.room().getInfo().orElseThrow().memberCount());
    }

    // ========== Messages ==========

    @Test
    void getHistory_returnsMessagesInOrder()
    {
        directory.createRoom("lobby", "");
        ChatRoom alice = directory.joinRoom("lobby", ALICE).orElseThrow();

        alice.sendMessage("First");
        alice.sendMessage("Second");

        List<ChatMessage> history = alice.getHistory(10);
        assertEquals(2, history.size());
        assertEquals("First", history.get(0).content());
        assertEquals("Second", history.get(1).content());
    }

    @Test
    void getHistory_limitKeepsMostRecent()
    {
        directory.createRoom("lobby", "");
        ChatRoom alice = directory.joinRoom("lobby", ALICE).orElseThrow();
        for (int i = 1; i <= 5; i++)
        {
            alice.sendMessage("m" + i);
        }

        List<ChatMessage> history = alice.getHistory(2);

        assertEquals(2, history.size());
        assertEquals("m4", history.get(0).content());
        assertEquals("m5", history.get(1).content());
    }

    @Test
    void getHistory_zeroLimit_returnsWholeLog()
    {
        RoomCreation creation = directory.createRoom("lobby", "").orElseThrow();
        creation.room().sendMessage("First");
        creation.room().sendMessage("Second");

        List<ChatMessage> history = creation.room().getHistory(0);

        assertEquals(2, history.size());
        assertEquals("First", history.get(0).content());
        assertEquals("Second", history.get(1).content());
    }

    @Test
    void getHistory_limitAboveLogSize_returnsWholeLog()
    {
        RoomCreation creation = directory.createRoom("lobby", "").orElseThrow();
        creation.room().sendMessage("only");

        assertEquals(1, creation.room().getHistory(50).size());
    }

    @Test
    void getHistory_negativeLimit_throws()
    {
        RoomCreation creation = directory.createRoom("lobby", "").orElseThrow();

        assertThrows(IllegalArgumentException.class, () -> creation.room().getHistory(-1));
    }

    @Test
    void sendMessage_stampsSenderTimeAndKind()
    {
        directory.createRoom("lobby", "");
        ChatRoom bob = directory.joinRoom("lobby", BOB).orElseThrow();

        ChatMessage message = bob.sendMessage("hi").orElseThrow();
        ChatMessage emote = bob.sendEmote("waves").orElseThrow();

        assertEquals(BOB, message.sender());
        assertEquals(NOW, message.timestampMillis());
        assertEquals(new MessageKind.Normal(), message.kind());
        assertEquals(new MessageKind.Emote(), emote.kind());
    }

    @Test
    void handles_shareRoomLog()
    {
        directory.createRoom("lobby", "");
        ChatRoom alice = directory.joinRoom("lobby", ALICE).orElseThrow();
        ChatRoom bob = directory.joinRoom("lobby", BOB).orElseThrow();

        alice.sendMessage("ping");
        bob.sendMessage("pong");

        List<ChatMessage> seenByAlice = alice.getHistory(10);
        assertEquals(List.of("ping", "pong"), List.of(seenByAlice.get(0).content(), seenByAlice.get(1).content()));
        assertEquals(ALICE, seenByAlice.get(0).sender());
        assertEquals(BOB, seenByAlice.get(1).sender());
    }

    // ========== Whisper ==========

    @Test
    void whisper_isNotStoredInAnyRoom()
    {
        directory.createRoom("lobby", "");
        ChatRoom alice = directory.joinRoom("lobby", ALICE).orElseThrow();

        ChatMessage whisper = directory.whisper(ALICE, BOB.id(), "psst").orElseThrow();

        assertEquals(new MessageKind.Whisper(BOB.id()), whisper.kind());
        assertEquals(NOW, whisper.timestampMillis());
        assertTrue(alice.getHistory(10).isEmpty());
    }
}
