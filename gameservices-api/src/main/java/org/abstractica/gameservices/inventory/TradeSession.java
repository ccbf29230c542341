package org.abstractica.gameservices.inventory;

import org.abstractica.gameservices.Capability;

import java.util.List;

/**
 * One side's handle onto a trade negotiation.
 *
 * <p>The initiator receives a handle from
 * {@link InventoryService#startTrade}; the target obtains the other side
 * through {@link InventoryService#joinTrade}. Both handles share the
 * negotiation's state.</p>
 */
public interface TradeSession extends Capability
{
    /**
     * Returns the trade identifier.
     *
     * @return the trade id
     */
    long tradeId();

    /**
     * Returns the player this handle acts for.
     *
     * @return the player id
     */
    long playerId();

    /**
     * Replaces this side's offered slots.
     *
     * @param slotIndexes the slots to offer
     * @return this side's offer
     */
    TradeOffer offerItems(List<Integer> slotIndexes);

    /**
     * Withdraws slots from this side's offer.
     *
     * @param slotIndexes the slots to withdraw
     * @return this side's offer
     */
    TradeOffer removeItems(List<Integer> slotIndexes);

    /**
     * Accepts the trade for this side.
     *
     * <p>The trade becomes ACCEPTED only if the other side has already
     * accepted.</p>
     *
     * @return the trade state after the call
     */
    TradeState accept();

    /**
     * Confirms the trade unconditionally.
     *
     * @return CONFIRMED
     */
    TradeState confirm();

    /**
     * Cancels the trade unconditionally.
     *
     * @return CANCELLED
     */
    TradeState cancel();

    /**
     * Returns the other side's offer.
     *
     * @return the counterpart's offer
     */
    TradeOffer viewOtherOffer();

    /**
     * Returns the current trade state.
     *
     * @return the state
     */
    TradeState getState();
}
