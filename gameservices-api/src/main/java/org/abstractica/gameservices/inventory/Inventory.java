package org.abstractica.gameservices.inventory;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a player's inventory.
 *
 * @param ownerId   owning player id
 * @param slots     occupied slots in stored order
 * @param capacity  reported capacity
 * @param usedSlots number of occupied slots
 */
public record Inventory(long ownerId, List<InventorySlot> slots, int capacity, int usedSlots)
{
    public Inventory
    {
        slots = List.copyOf(Objects.requireNonNull(slots, "slots"));
    }
}
