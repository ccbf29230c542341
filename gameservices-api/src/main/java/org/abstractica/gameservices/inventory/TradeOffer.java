package org.abstractica.gameservices.inventory;

import java.util.List;
import java.util.Objects;

/**
 * One side's offer in a trade.
 *
 * @param playerId    the offering player
 * @param slotIndexes the offered slot indexes as submitted
 * @param items       the offered slots the player still holds
 * @param accepted    whether this side has accepted
 */
public record TradeOffer(long playerId, List<Integer> slotIndexes, List<InventorySlot> items, boolean accepted)
{
    public TradeOffer
    {
        slotIndexes = List.copyOf(Objects.requireNonNull(slotIndexes, "slotIndexes"));
        items = List.copyOf(Objects.requireNonNull(items, "items"));
    }
}
