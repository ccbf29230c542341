package org.abstractica.gameservices.inventory;

import org.abstractica.gameservices.Capability;
import org.abstractica.gameservices.Reply;
import org.abstractica.gameservices.Status;

import java.util.List;

/**
 * The inventory and trading service.
 */
public interface InventoryService extends Capability
{
    /**
     * Returns a player's inventory. Unknown players have an empty one.
     *
     * @param playerId the player
     * @return OK with the inventory
     */
    Reply<Inventory> getInventory(long playerId);

    /**
     * Adds a stack of items in a new slot.
     *
     * @param playerId the player
     * @param item     the item
     * @param quantity stack size, positive
     * @return OK with the new slot, or INVALID_ARGUMENT for a non-positive quantity
     */
    Reply<InventorySlot> addItem(long playerId, Item item, int quantity);

    /**
     * Removes items from a slot, deleting the slot when it empties.
     *
     * @param playerId  the player
     * @param slotIndex the slot
     * @param quantity  how many to remove
     * @return OK, NOT_FOUND for an unknown player or slot, or INVALID_ARGUMENT
     *         when the quantity is not positive or exceeds the stack
     */
    Status removeItem(long playerId, int slotIndex, int quantity);

    /**
     * Returns the slots whose item rarity ranks at least as high as the minimum.
     *
     * @param playerId  the player
     * @param minRarity the minimum rarity
     * @return matching slots in stored order
     */
    List<InventorySlot> filterByRarity(long playerId, Rarity minRarity);

    /**
     * Opens a trade negotiation.
     *
     * @param initiatorId the initiating player
     * @param targetId    the other player
     * @return the initiator's handle
     */
    TradeSession startTrade(long initiatorId, long targetId);

    /**
     * Joins an open trade as its target. Confirmed and cancelled trades
     * are no longer open.
     *
     * @param tradeId  the trade
     * @param playerId the joining player
     * @return OK with the target's handle, NOT_FOUND for an unknown or
     *         closed trade, or INVALID_ARGUMENT if the player is not the
     *         trade's target
     */
    Reply<TradeSession> joinTrade(long tradeId, long playerId);
}
