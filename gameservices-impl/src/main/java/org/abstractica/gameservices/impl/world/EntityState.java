package org.abstractica.gameservices.impl.world;

import org.abstractica.gameservices.Faction;
import org.abstractica.gameservices.Vec3;
import org.abstractica.gameservices.world.Entity;
import org.abstractica.gameservices.world.EntityKind;

/**
 * Mutable registry entry for one entity.
 *
 * <p>Not thread-safe; only touched while holding the world's lock.</p>
 */
class EntityState
{
    private final long id;
    private final EntityKind kind;
    private final String name;
    private final int maxHealth;
    private final Faction faction;
    private Vec3 position;
    private int health;
    private boolean alive;

    EntityState(long id, EntityKind kind, String name, Vec3 position, Faction faction, int maxHealth)
    {
        this.id = id;
        this.kind = kind;
        this.name = name;
        this.position = position;
        this.faction = faction;
        this.maxHealth = maxHealth;
        this.health = maxHealth;
        this.alive = true;
    }

    Vec3 getPosition()
    {
        return position;
    }

    void setPosition(Vec3 position)
    {
        this.position = position;
    }

    /**
     * Applies damage, clamping health at zero.
     *
     * @param amount non-negative damage
     * @return true if health reached zero
     */
    boolean applyDamage(int amount)
    {
        health = Math.max(0, health - amount);
        if (health == 0)
        {
            alive = false;
            return true;
        }
        return false;
    }

    Entity snapshot()
    {
        return new Entity(id, kind, name, position, health, maxHealth, faction, alive);
    }
}
