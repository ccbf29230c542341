package org.abstractica.gameservices.impl.matchmaking;

import org.abstractica.gameservices.Reply;
import org.abstractica.gameservices.Status;
import org.abstractica.gameservices.matchmaking.MatchController;
import org.abstractica.gameservices.matchmaking.MatchInfo;
import org.abstractica.gameservices.matchmaking.MatchResult;

import java.util.Objects;

/**
 * Controller handle bound to one match id.
 */
class MatchHandle implements MatchController
{
    private final MatchmakingRegistry registry;
    private final long matchId;

    MatchHandle(MatchmakingRegistry registry, long matchId)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.matchId = matchId;
    }

    @Override
    public long matchId()
    {
        return matchId;
    }

    @Override
    public Reply<MatchInfo> getInfo()
    {
        return registry.matchInfo(matchId);
    }

    @Override
    public Reply<Boolean> signalReady(long playerId)
    {
        return registry.signalReady(matchId, playerId);
    }

    @Override
    public Status reportResult(MatchResult result)
    {
        Objects.requireNonNull(result, "result");
        return registry.storeResult(matchId, result);
    }

    @Override
    public Status cancelMatch()
    {
        return registry.cancel(matchId);
    }

    @Override
    public String toString()
    {
        return "MatchHandle[" + matchId + "]";
    }
}
