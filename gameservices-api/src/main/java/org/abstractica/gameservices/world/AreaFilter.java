package org.abstractica.gameservices.world;

import org.abstractica.gameservices.Faction;

import java.util.Objects;

/**
 * Filter applied to an area query in addition to the radius.
 *
 * <p>Sealed interface enabling exhaustive handling of filter variants.</p>
 */
public sealed interface AreaFilter
{
    /**
     * Tests whether an entity passes the filter.
     *
     * @param entity the candidate
     * @return true if the entity is included
     */
    boolean test(Entity entity);

    /**
     * Every entity passes.
     */
    record All() implements AreaFilter
    {
        @Override
        public boolean test(Entity entity)
        {
            return true;
        }
    }

    /**
     * Only entities of the given kind pass.
     *
     * @param kind the required kind
     */
    record ByKind(EntityKind kind) implements AreaFilter
    {
        public ByKind
        {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public boolean test(Entity entity)
        {
            return entity.kind() == kind;
        }
    }

    /**
     * Only entities of the given faction pass.
     *
     * @param faction the required faction
     */
    record ByFaction(Faction faction) implements AreaFilter
    {
        public ByFaction
        {
            Objects.requireNonNull(faction, "faction");
        }

        @Override
        public boolean test(Entity entity)
        {
            return entity.faction() == faction;
        }
    }
}
