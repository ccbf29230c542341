package org.abstractica.gameservices.world;

import org.abstractica.gameservices.Faction;
import org.abstractica.gameservices.Vec3;

import java.util.Objects;

/**
 * Snapshot of an entity at the time of the call.
 *
 * @param id        entity identifier, positive and never reused
 * @param kind      entity kind
 * @param name      display name
 * @param position  current position
 * @param health    current health, between 0 and maxHealth
 * @param maxHealth maximum health
 * @param faction   entity faction
 * @param alive     false once lethal damage has been applied
 */
public record Entity(
        long id,
        EntityKind kind,
        String name,
        Vec3 position,
        int health,
        int maxHealth,
        Faction faction,
        boolean alive
)
{
    public Entity
    {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(faction, "faction");
    }
}
