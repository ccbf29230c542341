package org.abstractica.gameservices.matchmaking;

import org.abstractica.gameservices.PlayerInfo;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a match.
 *
 * @param id              match identifier
 * @param mode            game mode
 * @param state           lifecycle state
 * @param teamA           first roster
 * @param teamB           second roster
 * @param createdAtMillis creation time in epoch milliseconds
 */
public record MatchInfo(
        long id,
        GameMode mode,
        MatchState state,
        List<PlayerInfo> teamA,
        List<PlayerInfo> teamB,
        long createdAtMillis
)
{
    public MatchInfo
    {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(state, "state");
        teamA = List.copyOf(Objects.requireNonNull(teamA, "teamA"));
        teamB = List.copyOf(Objects.requireNonNull(teamB, "teamB"));
    }

    /**
     * Returns the number of players on both rosters.
     *
     * @return roster size
     */
    public int rosterSize()
    {
        return teamA.size() + teamB.size();
    }
}
