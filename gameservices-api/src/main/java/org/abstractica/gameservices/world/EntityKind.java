package org.abstractica.gameservices.world;

/**
 * Kind of entity living in the world.
 */
public enum EntityKind
{
    PLAYER,
    NPC,
    MONSTER
}
