package org.abstractica.gameservices.inventory;

import java.util.Objects;

/**
 * An occupied inventory slot.
 *
 * @param slotIndex slot index, never reused for the same player
 * @param item      the stored item
 * @param quantity  stack size, positive
 */
public record InventorySlot(int slotIndex, Item item, int quantity)
{
    public InventorySlot
    {
        Objects.requireNonNull(item, "item");
    }
}
