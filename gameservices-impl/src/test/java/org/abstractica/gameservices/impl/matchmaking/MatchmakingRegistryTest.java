package org.abstractica.gameservices.impl.matchmaking;

import org.abstractica.gameservices.Faction;
import org.abstractica.gameservices.PlayerInfo;
import org.abstractica.gameservices.Status;
import org.abstractica.gameservices.matchmaking.GameMode;
import org.abstractica.gameservices.matchmaking.MatchAssignment;
import org.abstractica.gameservices.matchmaking.MatchController;
import org.abstractica.gameservices.matchmaking.MatchInfo;
import org.abstractica.gameservices.matchmaking.MatchResult;
import org.abstractica.gameservices.matchmaking.MatchState;
import org.abstractica.gameservices.matchmaking.PlayerMatchStats;
import org.abstractica.gameservices.matchmaking.QueueStats;
import org.abstractica.gameservices.matchmaking.QueueTicket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MatchmakingRegistry} and its match controllers.
 */
class MatchmakingRegistryTest
{
    private static final long NOW = 1_700_000_000_000L;
    private static final PlayerInfo ALICE = new PlayerInfo(5, "Alice", Faction.ALLIANCE, 42);
    private static final PlayerInfo BOB = new PlayerInfo(6, "Bob", Faction.PIRATES, 7);

    private MatchmakingRegistry registry;

    @BeforeEach
    void setUp()
    {
        registry = new MatchmakingRegistry(
                Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC),
                MatchmakingRegistry.DEFAULT_ESTIMATED_WAIT
        );
    }

    private static MatchResult resultFor(long matchId)
    {
        return new MatchResult(matchId, 1, 300, List.of(new PlayerMatchStats(ALICE, 3, 1, 2, 1500)));
    }

    @Test
    void constructor_negativeWait_throws()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new MatchmakingRegistry(Clock.systemUTC(), Duration.ofSeconds(-1)));
    }

    @Test
    void constructor_waitBeyondIntSeconds_throws()
    {
        Duration tooLong = MatchmakingRegistry.MAX_ESTIMATED_WAIT.plusSeconds(1);

        assertThrows(IllegalArgumentException.class,
                () -> new MatchmakingRegistry(Clock.systemUTC(), tooLong));
    }

    @Test
    void constructor_maximumWait_isReportedExactly()
    {
        MatchmakingRegistry slow = new MatchmakingRegistry(Clock.systemUTC(), MatchmakingRegistry.MAX_ESTIMATED_WAIT);

        assertEquals(Integer.MAX_VALUE, slow.enqueue(ALICE, GameMode.DUEL).orElseThrow().estimatedWaitSecs());
    }

    // ========== Queue ==========

    @Test
    void enqueue_issuesIncreasingTickets()
    {
        QueueTicket first = registry.enqueue(ALICE, GameMode.DUEL).orElseThrow();
        QueueTicket second = registry.enqueue(BOB, GameMode.DUEL).orElseThrow();

        assertEquals(1, first.ticketId());
        assertEquals(2, second.ticketId());
        assertEquals(NOW, first.enqueuedAtMillis());
        assertEquals(30, first.estimatedWaitSecs());
    }

    @Test
    void dequeue_repeat_returnsNotFound()
    {
        QueueTicket ticket = registry.enqueue(ALICE, GameMode.ARENA).orElseThrow();

        assertEquals(Status.OK, registry.dequeue(ticket.ticketId()));
        assertEquals(Status.NOT_FOUND, registry.dequeue(ticket.ticketId()));
    }

    @Test
    void getQueueStats_countsPerMode()
    {
        registry.enqueue(ALICE, GameMode.DUEL);
        registry.enqueue(BOB, GameMode.DUEL);
        registry.enqueue(BOB, GameMode.ARENA);

        QueueStats duel = registry.getQueueStats(GameMode.DUEL);
        QueueStats battleground = registry.getQueueStats(GameMode.BATTLEGROUND);

        assertEquals(2, duel.playersInQueue());
        assertEquals(30, duel.avgWaitSecs());
        assertEquals(0, battleground.playersInQueue());
        assertEquals(0, battleground.avgWaitSecs());
    }

    @Test
    void getQueueStats_usesConfiguredWait()
    {
        MatchmakingRegistry quick = new MatchmakingRegistry(Clock.systemUTC(), Duration.ofSeconds(5));
        quick.enqueue(ALICE, GameMode.DUEL);

        assertEquals(5, quick.getQueueStats(GameMode.DUEL).avgWaitSecs());
    }

    // ========== Matches ==========

    @Test
    void findMatch_createsReadyMatchAgainstBot()
    {
        MatchAssignment assignment = registry.findMatch(ALICE, GameMode.DUEL);

        assertEquals(1, assignment.matchId());
        assertEquals(1, assignment.controller().matchId());

        MatchInfo info = assignment.controller().getInfo().orElseThrow();
        assertEquals(MatchState.READY, info.state());
        assertEquals(GameMode.DUEL, info.mode());
        assertEquals(NOW, info.createdAtMillis());
        assertEquals(List.of(ALICE), info.teamA());
        assertEquals(1, info.teamB().size());

        PlayerInfo bot = info.teamB().get(0);
        assertEquals(1005, bot.id());
        assertEquals("Bot_1", bot.name());
        assertEquals(Faction.HORDE, bot.faction());
        assertEquals(42, bot.level());
    }

    @Test
    void findMatch_doesNotConsumeQueue()
    {
        registry.enqueue(ALICE, GameMode.DUEL);

        registry.findMatch(ALICE, GameMode.DUEL);

        assertEquals(1, registry.getQueueStats(GameMode.DUEL).playersInQueue());
    }

    @Test
    void signalReady_trueOnlyWhenRosterCompletes()
    {
        MatchController controller = registry.findMatch(ALICE, GameMode.DUEL).controller();

        assertFalse(controller.signalReady(ALICE.id()).orElseThrow());
        assertFalse(controller.signalReady(ALICE.id()).orElseThrow());
        assertEquals(MatchState.READY, controller.getInfo().orElseThrow().state());

        assertTrue(controller.signalReady(1005).orElseThrow());
        assertEquals(MatchState.IN_PROGRESS, controller.getInfo().orElseThrow().state());

        assertFalse(controller.signalReady(1005).orElseThrow());
        assertFalse(controller.signalReady(99).orElseThrow());
    }

    @Test
    void signalReady_finishedMatch_keepsState()
    {
        MatchController controller = registry.findMatch(ALICE, GameMode.DUEL).controller();
        assertEquals(Status.OK, controller.cancelMatch());

        controller.signalReady(ALICE.id());
        controller.signalReady(1005);

        assertEquals(MatchState.CANCELLED, controller.getInfo().orElseThrow().state());
    }

    @Test
    void reportResult_storesAndCompletes()
    {
        MatchController controller = registry.findMatch(ALICE, GameMode.DUEL).controller();
        MatchResult result = resultFor(controller.matchId());

        assertEquals(Status.OK, controller.reportResult(result));

        assertEquals(MatchState.COMPLETED, controller.getInfo().orElseThrow().state());
        assertEquals(result, registry.getMatchResult(controller.matchId()).orElseThrow());
    }

    @Test
    void reportResult_foreignMatchId_returnsInvalidArgument()
    {
        MatchController first = registry.findMatch(ALICE, GameMode.DUEL).controller();
        MatchController second = registry.findMatch(BOB, GameMode.DUEL).controller();

        assertEquals(Status.INVALID_ARGUMENT, first.reportResult(resultFor(second.matchId())));

        assertEquals(MatchState.READY, first.getInfo().orElseThrow().state());
        assertEquals(Status.NOT_FOUND, registry.getMatchResult(first.matchId()).status());
        assertEquals(Status.NOT_FOUND, registry.getMatchResult(second.matchId()).status());
    }

    @Test
    void getMatchResult_unknown_returnsNotFound()
    {
        assertEquals(Status.NOT_FOUND, registry.getMatchResult(77).status());
    }

    @Test
    void cancelMatch_isUnconditional()
    {
        MatchController controller = registry.findMatch(ALICE, GameMode.ARENA).controller();
        controller.reportResult(resultFor(controller.matchId()));

        assertEquals(Status.OK, controller.cancelMatch());
        assertEquals(MatchState.CANCELLED, controller.getInfo().orElseThrow().state());
        assertTrue(registry.getMatchResult(controller.matchId()).isOk());
    }
}
