package org.abstractica.gameservices.matchmaking;

import org.abstractica.gameservices.PlayerInfo;

import java.util.Objects;

/**
 * One player's statistics for a match.
 *
 * @param player  the player
 * @param kills   kills
 * @param deaths  deaths
 * @param assists assists
 * @param score   score, may be negative
 */
public record PlayerMatchStats(PlayerInfo player, int kills, int deaths, int assists, int score)
{
    public PlayerMatchStats
    {
        Objects.requireNonNull(player, "player");
    }
}
