package org.abstractica.gameservices.world;

import java.util.Objects;

/**
 * Result of applying damage.
 *
 * @param entity the entity after the damage
 * @param killed true if this damage brought health to zero
 */
public record DamageOutcome(Entity entity, boolean killed)
{
    public DamageOutcome
    {
        Objects.requireNonNull(entity, "entity");
    }
}
