package org.abstractica.gameservices.impl.world;

import org.abstractica.gameservices.Faction;
import org.abstractica.gameservices.Reply;
import org.abstractica.gameservices.Status;
import org.abstractica.gameservices.Vec3;
import org.abstractica.gameservices.world.AreaFilter;
import org.abstractica.gameservices.world.AreaQuery;
import org.abstractica.gameservices.world.DamageOutcome;
import org.abstractica.gameservices.world.Entity;
import org.abstractica.gameservices.world.EntityKind;
import org.abstractica.gameservices.world.SpawnRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link EntityWorld}.
 */
class EntityWorldTest
{
    private EntityWorld world;

    @BeforeEach
    void setUp()
    {
        world = new EntityWorld();
    }

    private Entity spawn(EntityKind kind, String name, Vec3 position, Faction faction, int maxHealth)
    {
        return world.spawn(new SpawnRequest(kind, name, position, faction, maxHealth)).orElseThrow();
    }

    // ========== Spawn ==========

    @Test
    void spawn_assignsIncreasingPositiveIds()
    {
        long previous = 0;
        for (int i = 0; i < 20; i++)
        {
            Entity entity = spawn(EntityKind.NPC, "npc" + i, Vec3.ORIGIN, Faction.NEUTRAL, 10);
            assertTrue(entity.id() > previous);
            previous = entity.id();
        }
        assertEquals(20, world.entityCount());
    }

    @Test
    void spawn_startsAtFullHealthAndAlive()
    {
        Entity entity = spawn(EntityKind.MONSTER, "Ogre", new Vec3(1, 2, 3), Faction.PIRATES, 250);

        assertEquals(1, entity.id());
        assertEquals(250, entity.health());
        assertEquals(250, entity.maxHealth());
        assertTrue(entity.alive());
        assertEquals(new Vec3(1, 2, 3), entity.position());
    }

    @Test
    void spawn_idsNotReusedAfterDespawn()
    {
        Entity first = spawn(EntityKind.NPC, "a", Vec3.ORIGIN, Faction.NEUTRAL, 10);
        assertEquals(Status.OK, world.despawn(first.id()));

        Entity second = spawn(EntityKind.NPC, "b", Vec3.ORIGIN, Faction.NEUTRAL, 10);
        assertTrue(second.id() > first.id());
    }

    @Test
    void spawnRequest_nonPositiveMaxHealth_throws()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new SpawnRequest(EntityKind.NPC, "x", Vec3.ORIGIN, Faction.NEUTRAL, 0));
    }

    // ========== Get / Move ==========

    @Test
    void get_unknownId_returnsNotFound()
    {
        Reply<Entity> reply = world.get(42);
        assertEquals(Status.NOT_FOUND, reply.status());
        assertTrue(reply.value().isEmpty());
    }

    @Test
    void move_replacesPositionOnly()
    {
        Entity entity = spawn(EntityKind.PLAYER, "Hero", Vec3.ORIGIN, Faction.ALLIANCE, 100);
        world.damage(entity.id(), 10);

        Entity moved = world.move(entity.id(), new Vec3(5, 0, 5)).orElseThrow();

        assertEquals(new Vec3(5, 0, 5), moved.position());
        assertEquals(90, moved.health());
        assertEquals("Hero", moved.name());
        assertEquals(new Vec3(5, 0, 5), world.get(entity.id()).orElseThrow().position());
    }

    @Test
    void move_unknownId_returnsNotFound()
    {
        assertEquals(Status.NOT_FOUND, world.move(7, Vec3.ORIGIN).status());
    }

    // ========== Damage ==========

    @Test
    void damage_reducesHealthThenKills()
    {
        Entity entity = spawn(EntityKind.MONSTER, "Wolf", Vec3.ORIGIN, Faction.NEUTRAL, 100);

        DamageOutcome first = world.damage(entity.id(), 30).orElseThrow();
        assertEquals(70, first.entity().health());
        assertFalse(first.killed());
        assertTrue(first.entity().alive());

        DamageOutcome second = world.damage(entity.id(), 150).orElseThrow();
        assertEquals(0, second.entity().health());
        assertTrue(second.killed());
        assertFalse(second.entity().alive());
    }

    @Test
    void damage_zeroAmount_leavesHealth()
    {
        Entity entity = spawn(EntityKind.NPC, "Guard", Vec3.ORIGIN, Faction.ALLIANCE, 40);

        DamageOutcome outcome = world.damage(entity.id(), 0).orElseThrow();

        assertEquals(40, outcome.entity().health());
        assertFalse(outcome.killed());
    }

    @Test
    void damage_negativeAmount_returnsInvalidArgument()
    {
        Entity entity = spawn(EntityKind.NPC, "Guard", Vec3.ORIGIN, Faction.ALLIANCE, 40);

        assertEquals(Status.INVALID_ARGUMENT, world.damage(entity.id(), -5).status());
        assertEquals(40, world.get(entity.id()).orElseThrow().health());
    }

    @Test
    void damage_unknownId_returnsNotFound()
    {
        assertEquals(Status.NOT_FOUND, world.damage(99, 10).status());
    }

    // ========== Despawn ==========

    @Test
    void despawn_thenGet_returnsNotFound()
    {
        Entity entity = spawn(EntityKind.NPC, "Ghost", Vec3.ORIGIN, Faction.NEUTRAL, 5);

        assertEquals(Status.OK, world.despawn(entity.id()));
        assertEquals(Status.NOT_FOUND, world.get(entity.id()).status());
    }

    @Test
    void despawn_repeat_returnsNotFound()
    {
        Entity entity = spawn(EntityKind.NPC, "Ghost", Vec3.ORIGIN, Faction.NEUTRAL, 5);

        assertEquals(Status.OK, world.despawn(entity.id()));
        assertEquals(Status.NOT_FOUND, world.despawn(entity.id()));
        assertEquals(0, world.entityCount());
    }

    // ========== Area Query ==========

    @Test
    void queryArea_includesEntityAtCenter()
    {
        Entity entity = spawn(EntityKind.PLAYER, "Hero", Vec3.ORIGIN, Faction.ALLIANCE, 100);

        List<Entity> found = world.queryArea(AreaQuery.all(Vec3.ORIGIN, 1000));

        assertEquals(1, found.size());
        assertEquals(entity.id(), found.get(0).id());
    }

    @Test
    void queryArea_boundaryInclusive()
    {
        spawn(EntityKind.NPC, "Edge", new Vec3(3, 4, 0), Faction.NEUTRAL, 10);
        spawn(EntityKind.NPC, "Outside", new Vec3(3, 4, 0.5f), Faction.NEUTRAL, 10);

        List<Entity> found = world.queryArea(AreaQuery.all(Vec3.ORIGIN, 5));

        assertEquals(1, found.size());
        assertEquals("Edge", found.get(0).name());
    }

    @Test
    void queryArea_appliesKindFilter()
    {
        spawn(EntityKind.PLAYER, "Hero", Vec3.ORIGIN, Faction.ALLIANCE, 100);
        spawn(EntityKind.MONSTER, "Rat", new Vec3(1, 0, 0), Faction.NEUTRAL, 5);
        spawn(EntityKind.MONSTER, "FarRat", new Vec3(500, 0, 0), Faction.NEUTRAL, 5);

        List<Entity> found = world.queryArea(
                new AreaQuery(Vec3.ORIGIN, 10, new AreaFilter.ByKind(EntityKind.MONSTER)));

        assertEquals(1, found.size());
        assertEquals("Rat", found.get(0).name());
    }

    @Test
    void queryArea_appliesFactionFilter()
    {
        spawn(EntityKind.PLAYER, "A", Vec3.ORIGIN, Faction.ALLIANCE, 100);
        spawn(EntityKind.PLAYER, "H", Vec3.ORIGIN, Faction.HORDE, 100);

        List<Entity> found = world.queryArea(
                new AreaQuery(Vec3.ORIGIN, 1, new AreaFilter.ByFaction(Faction.HORDE)));

        assertEquals(1, found.size());
        assertEquals("H", found.get(0).name());
    }

    @Test
    void areaQuery_negativeRadius_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> AreaQuery.all(Vec3.ORIGIN, -1));
        assertThrows(IllegalArgumentException.class, () -> AreaQuery.all(Vec3.ORIGIN, Float.NaN));
    }
}
