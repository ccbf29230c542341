package org.abstractica.gameservices;

/**
 * Faction a player or entity belongs to.
 */
public enum Faction
{
    NEUTRAL,
    ALLIANCE,
    HORDE,
    PIRATES
}
