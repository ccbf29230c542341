package org.abstractica.gameservices.impl.world;

import org.abstractica.gameservices.Reply;
import org.abstractica.gameservices.Status;
import org.abstractica.gameservices.Vec3;
import org.abstractica.gameservices.world.AreaQuery;
import org.abstractica.gameservices.world.DamageOutcome;
import org.abstractica.gameservices.world.Entity;
import org.abstractica.gameservices.world.GameWorld;
import org.abstractica.gameservices.world.SpawnRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registry of game entities.
 *
 * <p>All entries are guarded by a single lock held only for the duration
 * of each operation. Callers receive immutable snapshots.</p>
 */
public class EntityWorld implements GameWorld
{
    private static final Logger LOG = LoggerFactory.getLogger(EntityWorld.class);

    private final Object lock = new Object();
    private final Map<Long, EntityState> entities = new HashMap<>();
    private long nextId = 1;

    @Override
    public Reply<Entity> spawn(SpawnRequest request)
    {
        Objects.requireNonNull(request, "request");

        Entity entity;
        synchronized (lock)
        {
            long id = nextId++;
            EntityState state = new EntityState(
                    id,
                    request.kind(),
                    request.name(),
                    request.position(),
                    request.faction(),
                    request.maxHealth()
            );
            entities.put(id, state);
            entity = state.snapshot();
        }

        LOG.debug("Spawned entity: id={}, kind={}, name={}", entity.id(), entity.kind(), entity.name());
        return Reply.ok(entity);
    }

    @Override
    public Reply<Entity> get(long id)
    {
        synchronized (lock)
        {
            EntityState state = entities.get(id);
            if (state == null)
            {
                return Reply.of(Status.NOT_FOUND);
            }
            return Reply.ok(state.snapshot());
        }
    }

    @Override
    public Reply<Entity> move(long id, Vec3 position)
    {
        Objects.requireNonNull(position, "position");

        synchronized (lock)
        {
            EntityState state = entities.get(id);
            if (state == null)
            {
                return Reply.of(Status.NOT_FOUND);
            }
            state.setPosition(position);
            return Reply.ok(state.snapshot());
        }
    }

    @Override
    public Reply<DamageOutcome> damage(long id, int amount)
    {
        if (amount < 0)
        {
            return Reply.of(Status.INVALID_ARGUMENT);
        }

        DamageOutcome outcome;
        synchronized (lock)
        {
            EntityState state = entities.get(id);
            if (state == null)
            {
                return Reply.of(Status.NOT_FOUND);
            }
            boolean killed = state.applyDamage(amount);
            outcome = new DamageOutcome(state.snapshot(), killed);
        }

        if (outcome.killed())
        {
            LOG.debug("Entity {} killed", id);
        }
        return Reply.ok(outcome);
    }

    @Override
    public Status despawn(long id)
    {
        EntityState removed;
        synchronized (lock)
        {
            removed = entities.remove(id);
        }

        if (removed == null)
        {
            return Status.NOT_FOUND;
        }
        LOG.debug("Despawned entity: id={}", id);
        return Status.OK;
    }

    @Override
    public List<Entity> queryArea(AreaQuery query)
    {
        Objects.requireNonNull(query, "query");

        List<Entity> matches = new ArrayList<>();
        synchronized (lock)
        {
            for (EntityState state : entities.values())
            {
                if (state.getPosition().distanceTo(query.center()) > query.radius())
                {
                    continue;
                }
                Entity entity = state.snapshot();
                if (query.filter().test(entity))
                {
                    matches.add(entity);
                }
            }
        }
        return matches;
    }

    /**
     * Returns the number of entities currently in the world.
     *
     * @return entity count
     */
    public int entityCount()
    {
        synchronized (lock)
        {
            return entities.size();
        }
    }
}
