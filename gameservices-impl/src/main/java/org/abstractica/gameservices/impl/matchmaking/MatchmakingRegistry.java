package org.abstractica.gameservices.impl.matchmaking;

import org.abstractica.gameservices.Faction;
import org.abstractica.gameservices.PlayerInfo;
import org.abstractica.gameservices.Reply;
import org.abstractica.gameservices.Status;
import org.abstractica.gameservices.matchmaking.GameMode;
import org.abstractica.gameservices.matchmaking.MatchAssignment;
import org.abstractica.gameservices.matchmaking.MatchInfo;
import org.abstractica.gameservices.matchmaking.MatchResult;
import org.abstractica.gameservices.matchmaking.MatchState;
import org.abstractica.gameservices.matchmaking.MatchmakingService;
import org.abstractica.gameservices.matchmaking.QueueStats;
import org.abstractica.gameservices.matchmaking.QueueTicket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ticket queue, match registry and stored results.
 *
 * <p>Queue, matches and results share one lock. Match controllers reach
 * their match through this registry on every call.</p>
 */
public class MatchmakingRegistry implements MatchmakingService
{
    private static final Logger LOG = LoggerFactory.getLogger(MatchmakingRegistry.class);

    public static final Duration DEFAULT_ESTIMATED_WAIT = Duration.ofSeconds(30);

    /**
     * Largest wait estimate whose whole seconds fit the int fields of tickets and stats.
     */
    public static final Duration MAX_ESTIMATED_WAIT = Duration.ofSeconds(Integer.MAX_VALUE);

    /**
     * Offset between a player's id and the id of the bot generated to face them.
     */
    static final long BOT_ID_OFFSET = 1000;

    private final Object lock = new Object();
    private final Map<Long, QueueTicket> queue = new LinkedHashMap<>();
    private final Map<Long, MatchRecord> matches = new HashMap<>();
    private final Map<Long, MatchResult> results = new HashMap<>();
    private final Clock clock;
    private final int estimatedWaitSecs;
    private long nextTicketId = 1;
    private long nextMatchId = 1;

    /**
     * Creates an empty registry.
     *
     * @param clock         clock used for ticket and match timestamps
     * @param estimatedWait wait estimate reported for tickets and queue stats
     */
    public MatchmakingRegistry(Clock clock, Duration estimatedWait)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(estimatedWait, "estimatedWait");
        if (estimatedWait.isNegative() || estimatedWait.compareTo(MAX_ESTIMATED_WAIT) > 0)
        {
            throw new IllegalArgumentException(
                    "estimatedWait must be between 0 and " + MAX_ESTIMATED_WAIT + ": " + estimatedWait);
        }
        this.estimatedWaitSecs = Math.toIntExact(estimatedWait.toSeconds());
    }

    // ========== Queue ==========

    @Override
    public Reply<QueueTicket> enqueue(PlayerInfo player, GameMode mode)
    {
        Objects.requireNonNull(player, "player");
        Objects.requireNonNull(mode, "mode");

        QueueTicket ticket;
        synchronized (lock)
        {
            ticket = new QueueTicket(nextTicketId++, player, mode, clock.millis(), estimatedWaitSecs);
            queue.put(ticket.ticketId(), ticket);
        }

        LOG.debug("Enqueued ticket {}: player={}, mode={}", ticket.ticketId(), player.id(), mode);
        return Reply.ok(ticket);
    }

    @Override
    public Status dequeue(long ticketId)
    {
        QueueTicket removed;
        synchronized (lock)
        {
            removed = queue.remove(ticketId);
        }

        if (removed == null)
        {
            return Status.NOT_FOUND;
        }
        LOG.debug("Dequeued ticket {}", ticketId);
        return Status.OK;
    }

    @Override
    public QueueStats getQueueStats(GameMode mode)
    {
        Objects.requireNonNull(mode, "mode");

        int count = 0;
        synchronized (lock)
        {
            for (QueueTicket ticket : queue.values())
            {
                if (ticket.mode() == mode)
                {
                    count++;
                }
            }
        }
        return new QueueStats(count, count > 0 ? estimatedWaitSecs : 0);
    }

    // ========== Matches ==========

    @Override
    public MatchAssignment findMatch(PlayerInfo player, GameMode mode)
    {
        Objects.requireNonNull(player, "player");
        Objects.requireNonNull(mode, "mode");

        long matchId;
        synchronized (lock)
        {
            matchId = nextMatchId++;
            PlayerInfo bot = new PlayerInfo(
                    player.id() + BOT_ID_OFFSET,
                    "Bot_" + matchId,
                    Faction.HORDE,
                    player.level()
            );
            matches.put(matchId, new MatchRecord(matchId, mode, List.of(player), List.of(bot), clock.millis()));
        }

        LOG.info("Match {} created: mode={}, player={}", matchId, mode, player.id());
        return new MatchAssignment(matchId, new MatchHandle(this, matchId));
    }

    @Override
    public Reply<MatchResult> getMatchResult(long matchId)
    {
        synchronized (lock)
        {
            MatchResult result = results.get(matchId);
            if (result == null)
            {
                return Reply.of(Status.NOT_FOUND);
            }
            return Reply.ok(result);
        }
    }

    // ========== Controller Access ==========

    Reply<MatchInfo> matchInfo(long matchId)
    {
        synchronized (lock)
        {
            MatchRecord match = matches.get(matchId);
            if (match == null)
            {
                return Reply.of(Status.NOT_FOUND);
            }
            return Reply.ok(match.info());
        }
    }

    Reply<Boolean> signalReady(long matchId, long playerId)
    {
        boolean allReady;
        synchronized (lock)
        {
            MatchRecord match = matches.get(matchId);
            if (match == null)
            {
                return Reply.of(Status.NOT_FOUND);
            }
            allReady = match.markReady(playerId);
        }

        if (allReady)
        {
            LOG.info("Match {} all players ready", matchId);
        }
        return Reply.ok(allReady);
    }

    Status storeResult(long matchId, MatchResult result)
    {
        if (result.matchId() != matchId)
        {
            LOG.warn("Rejected result for match {} reported on controller of match {}", result.matchId(), matchId);
            return Status.INVALID_ARGUMENT;
        }

        synchronized (lock)
        {
            MatchRecord match = matches.get(matchId);
            if (match == null)
            {
                return Status.NOT_FOUND;
            }
            match.setState(MatchState.COMPLETED);
            results.put(matchId, result);
        }

        LOG.info("Match {} completed: winningTeam={}", matchId, result.winningTeam());
        return Status.OK;
    }

    Status cancel(long matchId)
    {
        synchronized (lock)
        {
            MatchRecord match = matches.get(matchId);
            if (match == null)
            {
                return Status.NOT_FOUND;
            }
            match.setState(MatchState.CANCELLED);
        }

        LOG.info("Match {} cancelled", matchId);
        return Status.OK;
    }
}
