package org.abstractica.gameservices.matchmaking;

import java.util.List;
import java.util.Objects;

/**
 * Final result of a match.
 *
 * @param matchId      the match
 * @param winningTeam  winning team number
 * @param durationSecs match duration in seconds
 * @param playerStats  per-player statistics
 */
public record MatchResult(long matchId, int winningTeam, int durationSecs, List<PlayerMatchStats> playerStats)
{
    public MatchResult
    {
        playerStats = List.copyOf(Objects.requireNonNull(playerStats, "playerStats"));
    }
}
