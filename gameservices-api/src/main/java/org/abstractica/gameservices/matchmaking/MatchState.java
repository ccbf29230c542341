package org.abstractica.gameservices.matchmaking;

/**
 * Lifecycle state of a match.
 */
public enum MatchState
{
    WAITING,
    READY,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    /**
     * Tests whether the match has ended.
     *
     * @return true for COMPLETED and CANCELLED
     */
    public boolean isFinished()
    {
        return this == COMPLETED || this == CANCELLED;
    }
}
