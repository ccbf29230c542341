package org.abstractica.gameservices.matchmaking;

import java.util.Objects;

/**
 * A freshly created match and its controller.
 *
 * @param matchId    the match identifier
 * @param controller handle controlling the match
 */
public record MatchAssignment(long matchId, MatchController controller)
{
    public MatchAssignment
    {
        Objects.requireNonNull(controller, "controller");
    }
}
