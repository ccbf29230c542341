package org.abstractica.gameservices;

import java.util.Objects;

/**
 * Identity of a player as passed into calls.
 *
 * <p>Values are snapshots: storing one does not link it to any live player.</p>
 *
 * @param id      player identifier
 * @param name    display name
 * @param faction player faction
 * @param level   player level
 */
public record PlayerInfo(long id, String name, Faction faction, int level)
{
    public PlayerInfo
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(faction, "faction");
        if (level < 0)
        {
            throw new IllegalArgumentException("level must be >= 0: " + level);
        }
    }
}
