package org.abstractica.gameservices.impl.inventory;

import org.abstractica.gameservices.inventory.TradeState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Shared state of one trade, seen by both sides' handles.
 *
 * <p>Guarded by its own lock. Inventory data is never read while this
 * lock is held.</p>
 */
class TradeNegotiation
{
    /**
     * One participant's half of the negotiation.
     */
    enum Side
    {
        INITIATOR,
        TARGET;

        Side other()
        {
            return this == INITIATOR ? TARGET : INITIATOR;
        }
    }

    /**
     * Immutable view of one side.
     *
     * @param playerId    the player on this side
     * @param slotIndexes offered slot indexes
     * @param accepted    whether this side accepted
     */
    record SideView(long playerId, List<Integer> slotIndexes, boolean accepted) {}

    private final long tradeId;
    private final long initiatorId;
    private final long targetId;
    private final List<Integer> initiatorOffer = new ArrayList<>();
    private final List<Integer> targetOffer = new ArrayList<>();
    private boolean initiatorAccepted;
    private boolean targetAccepted;
    private TradeState state = TradeState.PROPOSING;

    TradeNegotiation(long tradeId, long initiatorId, long targetId)
    {
        this.tradeId = tradeId;
        this.initiatorId = initiatorId;
        this.targetId = targetId;
    }

    long getTradeId()
    {
        return tradeId;
    }

    long getTargetId()
    {
        return targetId;
    }

    long playerOf(Side side)
    {
        return side == Side.INITIATOR ? initiatorId : targetId;
    }

    synchronized SideView replaceOffer(Side side, Collection<Integer> slotIndexes)
    {
        List<Integer> offer = offerOf(side);
        offer.clear();
        offer.addAll(slotIndexes);
        return view(side);
    }

    synchronized SideView withdraw(Side side, Collection<Integer> slotIndexes)
    {
        offerOf(side).removeAll(slotIndexes);
        return view(side);
    }

    synchronized TradeState accept(Side side)
    {
        if (side == Side.INITIATOR)
        {
            initiatorAccepted = true;
        }
        else
        {
            targetAccepted = true;
        }
        if (state == TradeState.PROPOSING && isAccepted(side.other()))
        {
            state = TradeState.ACCEPTED;
        }
        return state;
    }

    synchronized TradeState transitionTo(TradeState newState)
    {
        state = newState;
        return state;
    }

    synchronized TradeState getState()
    {
        return state;
    }

    synchronized SideView view(Side side)
    {
        return new SideView(playerOf(side), List.copyOf(offerOf(side)), isAccepted(side));
    }

    private List<Integer> offerOf(Side side)
    {
        return side == Side.INITIATOR ? initiatorOffer : targetOffer;
    }

    private boolean isAccepted(Side side)
    {
        return side == Side.INITIATOR ? initiatorAccepted : targetAccepted;
    }
}
