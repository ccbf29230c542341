package org.abstractica.gameservices.impl.matchmaking;

import org.abstractica.gameservices.PlayerInfo;
import org.abstractica.gameservices.matchmaking.GameMode;
import org.abstractica.gameservices.matchmaking.MatchInfo;
import org.abstractica.gameservices.matchmaking.MatchState;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable registry entry for one match.
 *
 * <p>Not thread-safe; only touched while holding the registry's lock.</p>
 */
class MatchRecord
{
    private final long id;
    private final GameMode mode;
    private final List<PlayerInfo> teamA;
    private final List<PlayerInfo> teamB;
    private final long createdAtMillis;
    private final Set<Long> readyPlayers = new LinkedHashSet<>();
    private MatchState state = MatchState.READY;

    MatchRecord(long id, GameMode mode, List<PlayerInfo> teamA, List<PlayerInfo> teamB, long createdAtMillis)
    {
        this.id = id;
        this.mode = mode;
        this.teamA = List.copyOf(teamA);
        this.teamB = List.copyOf(teamB);
        this.createdAtMillis = createdAtMillis;
    }

    /**
     * Adds a player to the ready set.
     *
     * @return true if this call completed the roster
     */
    boolean markReady(long playerId)
    {
        int rosterSize = teamA.size() + teamB.size();
        boolean wasComplete = readyPlayers.size() >= rosterSize;
        readyPlayers.add(playerId);
        boolean complete = readyPlayers.size() >= rosterSize;

        if (!complete || wasComplete)
        {
            return false;
        }
        if (!state.isFinished())
        {
            state = MatchState.IN_PROGRESS;
        }
        return true;
    }

    void setState(MatchState state)
    {
        this.state = state;
    }

    MatchInfo info()
    {
        return new MatchInfo(id, mode, state, teamA, teamB, createdAtMillis);
    }
}
