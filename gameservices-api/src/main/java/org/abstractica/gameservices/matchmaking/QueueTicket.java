package org.abstractica.gameservices.matchmaking;

import org.abstractica.gameservices.PlayerInfo;

import java.util.Objects;

/**
 * A queued matchmaking request.
 *
 * @param ticketId          ticket identifier
 * @param player            the queued player
 * @param mode              requested game mode
 * @param enqueuedAtMillis  enqueue time in epoch milliseconds
 * @param estimatedWaitSecs estimated wait in seconds
 */
public record QueueTicket(long ticketId, PlayerInfo player, GameMode mode, long enqueuedAtMillis, int estimatedWaitSecs)
{
    public QueueTicket
    {
        Objects.requireNonNull(player, "player");
        Objects.requireNonNull(mode, "mode");
    }
}
