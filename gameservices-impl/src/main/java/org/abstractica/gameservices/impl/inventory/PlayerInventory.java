package org.abstractica.gameservices.impl.inventory;

import org.abstractica.gameservices.Status;
import org.abstractica.gameservices.inventory.InventorySlot;
import org.abstractica.gameservices.inventory.Item;

import java.util.ArrayList;
import java.util.List;

/**
 * Slots held by one player.
 *
 * <p>Not thread-safe; only touched while holding the store's lock.</p>
 */
class PlayerInventory
{
    private final List<InventorySlot> slots = new ArrayList<>();
    private int nextSlotIndex = 0;

    InventorySlot add(Item item, int quantity)
    {
        // Indexes are never handed out twice, even after the slot is emptied.
        InventorySlot slot = new InventorySlot(nextSlotIndex++, item, quantity);
        slots.add(slot);
        return slot;
    }

    Status remove(int slotIndex, int quantity)
    {
        for (int i = 0; i < slots.size(); i++)
        {
            InventorySlot slot = slots.get(i);
            if (slot.slotIndex() != slotIndex)
            {
                continue;
            }
            if (quantity > slot.quantity())
            {
                return Status.INVALID_ARGUMENT;
            }
            int remaining = slot.quantity() - quantity;
            if (remaining == 0)
            {
                slots.remove(i);
            }
            else
            {
                slots.set(i, new InventorySlot(slotIndex, slot.item(), remaining));
            }
            return Status.OK;
        }
        return Status.NOT_FOUND;
    }

    InventorySlot find(int slotIndex)
    {
        for (InventorySlot slot : slots)
        {
            if (slot.slotIndex() == slotIndex)
            {
                return slot;
            }
        }
        return null;
    }

    List<InventorySlot> slots()
    {
        return List.copyOf(slots);
    }
}
