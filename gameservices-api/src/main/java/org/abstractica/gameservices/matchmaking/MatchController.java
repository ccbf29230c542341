package org.abstractica.gameservices.matchmaking;

import org.abstractica.gameservices.Capability;
import org.abstractica.gameservices.Reply;
import org.abstractica.gameservices.Status;

/**
 * Handle controlling one match.
 *
 * <p>Each call resolves the match in the registry; if it no longer
 * resolves the call reports NOT_FOUND.</p>
 */
public interface MatchController extends Capability
{
    /**
     * Returns the controlled match's identifier.
     *
     * @return the match id
     */
    long matchId();

    /**
     * Reads the match.
     *
     * @return OK with the match info, or NOT_FOUND
     */
    Reply<MatchInfo> getInfo();

    /**
     * Marks a player ready.
     *
     * <p>Signalling twice for the same player has no further effect.</p>
     *
     * @param playerId the player
     * @return OK with true exactly on the call that completes the roster, or NOT_FOUND
     */
    Reply<Boolean> signalReady(long playerId);

    /**
     * Stores the match result and completes the match.
     *
     * @param result the result, whose match id must be this match's
     * @return OK, NOT_FOUND, or INVALID_ARGUMENT for a result of another match
     */
    Status reportResult(MatchResult result);

    /**
     * Cancels the match.
     *
     * @return OK, or NOT_FOUND
     */
    Status cancelMatch();
}
