package org.abstractica.gameservices.impl.inventory;

import org.abstractica.gameservices.inventory.TradeOffer;
import org.abstractica.gameservices.inventory.TradeSession;
import org.abstractica.gameservices.inventory.TradeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * One side's facade onto a trade negotiation.
 */
class TradeHandle implements TradeSession
{
    private static final Logger LOG = LoggerFactory.getLogger(TradeHandle.class);

    private final InventoryStore store;
    private final TradeNegotiation negotiation;
    private final TradeNegotiation.Side side;

    TradeHandle(InventoryStore store, TradeNegotiation negotiation, TradeNegotiation.Side side)
    {
        this.store = Objects.requireNonNull(store, "store");
        this.negotiation = Objects.requireNonNull(negotiation, "negotiation");
        this.side = Objects.requireNonNull(side, "side");
    }

    @Override
    public long tradeId()
    {
        return negotiation.getTradeId();
    }

    @Override
    public long playerId()
    {
        return negotiation.playerOf(side);
    }

    @Override
    public TradeOffer offerItems(List<Integer> slotIndexes)
    {
        Objects.requireNonNull(slotIndexes, "slotIndexes");
        return toOffer(negotiation.replaceOffer(side, List.copyOf(slotIndexes)));
    }

    @Override
    public TradeOffer removeItems(List<Integer> slotIndexes)
    {
        Objects.requireNonNull(slotIndexes, "slotIndexes");
        return toOffer(negotiation.withdraw(side, List.copyOf(slotIndexes)));
    }

    @Override
    public TradeState accept()
    {
        TradeState state = negotiation.accept(side);
        LOG.debug("Trade {}: player {} accepted, state={}", tradeId(), playerId(), state);
        return state;
    }

    @Override
    public TradeState confirm()
    {
        LOG.debug("Trade {} confirmed by player {}", tradeId(), playerId());
        TradeState state = negotiation.transitionTo(TradeState.CONFIRMED);
        store.closeTrade(tradeId());
        return state;
    }

    @Override
    public TradeState cancel()
    {
        LOG.debug("Trade {} cancelled by player {}", tradeId(), playerId());
        TradeState state = negotiation.transitionTo(TradeState.CANCELLED);
        store.closeTrade(tradeId());
        return state;
    }

    @Override
    public TradeOffer viewOtherOffer()
    {
        return toOffer(negotiation.view(side.other()));
    }

    @Override
    public TradeState getState()
    {
        return negotiation.getState();
    }

    private TradeOffer toOffer(TradeNegotiation.SideView view)
    {
        return new TradeOffer(
                view.playerId(),
                view.slotIndexes(),
                store.resolveSlots(view.playerId(), view.slotIndexes()),
                view.accepted()
        );
    }
}
