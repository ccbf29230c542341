package org.abstractica.gameservices.matchmaking;

import org.abstractica.gameservices.Capability;
import org.abstractica.gameservices.PlayerInfo;
import org.abstractica.gameservices.Reply;
import org.abstractica.gameservices.Status;

/**
 * The matchmaking service.
 *
 * <p>Tickets and matches live until removed by an explicit call; nothing
 * expires.</p>
 */
public interface MatchmakingService extends Capability
{
    /**
     * Queues a player.
     *
     * @param player the player
     * @param mode   requested game mode
     * @return OK with the ticket
     */
    Reply<QueueTicket> enqueue(PlayerInfo player, GameMode mode);

    /**
     * Removes a ticket from the queue.
     *
     * @param ticketId the ticket
     * @return OK, or NOT_FOUND if no such ticket is queued
     */
    Status dequeue(long ticketId);

    /**
     * Creates a match for the player against a generated opponent.
     *
     * @param player the player
     * @param mode   game mode
     * @return the match id and its controller
     */
    MatchAssignment findMatch(PlayerInfo player, GameMode mode);

    /**
     * Returns queue statistics for a mode.
     *
     * @param mode the game mode
     * @return the statistics
     */
    QueueStats getQueueStats(GameMode mode);

    /**
     * Looks up a stored match result.
     *
     * @param matchId the match
     * @return OK with the result, or NOT_FOUND
     */
    Reply<MatchResult> getMatchResult(long matchId);
}
