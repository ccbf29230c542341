package org.abstractica.gameservices.world;

import org.abstractica.gameservices.Faction;
import org.abstractica.gameservices.Vec3;

import java.util.Objects;

/**
 * Parameters for spawning an entity.
 *
 * @param kind      entity kind
 * @param name      display name
 * @param position  spawn position
 * @param faction   entity faction
 * @param maxHealth maximum (and initial) health, positive
 */
public record SpawnRequest(EntityKind kind, String name, Vec3 position, Faction faction, int maxHealth)
{
    public SpawnRequest
    {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(faction, "faction");
        if (maxHealth <= 0)
        {
            throw new IllegalArgumentException("maxHealth must be positive: " + maxHealth);
        }
    }
}
