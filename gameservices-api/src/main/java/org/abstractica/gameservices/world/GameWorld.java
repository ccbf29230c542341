package org.abstractica.gameservices.world;

import org.abstractica.gameservices.Capability;
import org.abstractica.gameservices.Reply;
import org.abstractica.gameservices.Status;
import org.abstractica.gameservices.Vec3;

import java.util.List;

/**
 * The entity world service.
 *
 * <p>Holds every spawned entity until it is despawned. Killed entities
 * stay in the world with {@code alive == false}.</p>
 */
public interface GameWorld extends Capability
{
    /**
     * Spawns an entity with full health.
     *
     * @param request spawn parameters
     * @return OK with the new entity
     */
    Reply<Entity> spawn(SpawnRequest request);

    /**
     * Looks up an entity.
     *
     * @param id entity identifier
     * @return OK with the entity, or NOT_FOUND
     */
    Reply<Entity> get(long id);

    /**
     * Moves an entity. Only the position changes.
     *
     * @param id       entity identifier
     * @param position new position
     * @return OK with the moved entity, or NOT_FOUND
     */
    Reply<Entity> move(long id, Vec3 position);

    /**
     * Applies damage, clamping health at zero.
     *
     * @param id     entity identifier
     * @param amount damage amount, non-negative
     * @return OK with the outcome, NOT_FOUND, or INVALID_ARGUMENT for a negative amount
     */
    Reply<DamageOutcome> damage(long id, int amount);

    /**
     * Removes an entity from the world.
     *
     * @param id entity identifier
     * @return OK, or NOT_FOUND if no such entity (including a second despawn)
     */
    Status despawn(long id);

    /**
     * Returns entities within the query radius that pass its filter.
     *
     * @param query the area query
     * @return matching entities, in no particular order
     */
    List<Entity> queryArea(AreaQuery query);
}
