package org.abstractica.gameservices.matchmaking;

/**
 * Game mode a player queues for.
 */
public enum GameMode
{
    DUEL,
    ARENA,
    BATTLEGROUND
}
