package org.abstractica.gameservices.impl.inventory;

import org.abstractica.gameservices.Reply;
import org.abstractica.gameservices.Status;
import org.abstractica.gameservices.inventory.Inventory;
import org.abstractica.gameservices.inventory.InventoryService;
import org.abstractica.gameservices.inventory.InventorySlot;
import org.abstractica.gameservices.inventory.Item;
import org.abstractica.gameservices.inventory.Rarity;
import org.abstractica.gameservices.inventory.TradeSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-player slotted inventories and the open trade negotiations.
 *
 * <p>Inventories and the trade table share one lock. Trade negotiations
 * keep their own lock for offer and acceptance state. A trade leaves the
 * table once it is confirmed or cancelled.</p>
 */
public class InventoryStore implements InventoryService
{
    private static final Logger LOG = LoggerFactory.getLogger(InventoryStore.class);

    public static final int DEFAULT_CAPACITY = 50;

    private final Object lock = new Object();
    private final Map<Long, PlayerInventory> inventories = new HashMap<>();
    private final Map<Long, TradeNegotiation> trades = new HashMap<>();
    private final int capacity;
    private long nextTradeId = 1;

    /**
     * Creates an empty store.
     *
     * @param capacity capacity reported for every inventory
     */
    public InventoryStore(int capacity)
    {
        if (capacity <= 0)
        {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    // ========== Inventory ==========

    @Override
    public Reply<Inventory> getInventory(long playerId)
    {
        List<InventorySlot> slots;
        synchronized (lock)
        {
            PlayerInventory inventory = inventories.get(playerId);
            slots = inventory == null ? List.of() : inventory.slots();
        }
        return Reply.ok(new Inventory(playerId, slots, capacity, slots.size()));
    }

    @Override
    public Reply<InventorySlot> addItem(long playerId, Item item, int quantity)
    {
        Objects.requireNonNull(item, "item");
        if (quantity <= 0)
        {
            return Reply.of(Status.INVALID_ARGUMENT);
        }

        synchronized (lock)
        {
            PlayerInventory inventory = inventories.computeIfAbsent(playerId, id -> new PlayerInventory());
            return Reply.ok(inventory.add(item, quantity));
        }
    }

    @Override
    public Status removeItem(long playerId, int slotIndex, int quantity)
    {
        synchronized (lock)
        {
            PlayerInventory inventory = inventories.get(playerId);
            if (inventory == null)
            {
                return Status.NOT_FOUND;
            }
            if (quantity <= 0)
            {
                return Status.INVALID_ARGUMENT;
            }
            return inventory.remove(slotIndex, quantity);
        }
    }

    @Override
    public List<InventorySlot> filterByRarity(long playerId, Rarity minRarity)
    {
        Objects.requireNonNull(minRarity, "minRarity");

        List<InventorySlot> matches = new ArrayList<>();
        synchronized (lock)
        {
            PlayerInventory inventory = inventories.get(playerId);
            if (inventory == null)
            {
                return matches;
            }
            for (InventorySlot slot : inventory.slots())
            {
                if (slot.item().rarity().isAtLeast(minRarity))
                {
                    matches.add(slot);
                }
            }
        }
        return matches;
    }

    // ========== Trading ==========

    @Override
    public TradeSession startTrade(long initiatorId, long targetId)
    {
        TradeNegotiation negotiation;
        synchronized (lock)
        {
            negotiation = new TradeNegotiation(nextTradeId++, initiatorId, targetId);
            trades.put(negotiation.getTradeId(), negotiation);
        }

        LOG.debug("Trade {} started: initiator={}, target={}", negotiation.getTradeId(), initiatorId, targetId);
        return new TradeHandle(this, negotiation, TradeNegotiation.Side.INITIATOR);
    }

    @Override
    public Reply<TradeSession> joinTrade(long tradeId, long playerId)
    {
        TradeNegotiation negotiation;
        synchronized (lock)
        {
            negotiation = trades.get(tradeId);
        }

        if (negotiation == null)
        {
            return Reply.of(Status.NOT_FOUND);
        }
        if (negotiation.getTargetId() != playerId)
        {
            return Reply.of(Status.INVALID_ARGUMENT);
        }
        LOG.debug("Trade {} joined by target {}", tradeId, playerId);
        return Reply.ok(new TradeHandle(this, negotiation, TradeNegotiation.Side.TARGET));
    }

    /**
     * Returns the number of trades that can still be joined.
     *
     * @return open trade count
     */
    public int openTradeCount()
    {
        synchronized (lock)
        {
            return trades.size();
        }
    }

    /**
     * Removes a confirmed or cancelled trade from the trade table. Handles
     * already minted keep their negotiation.
     *
     * @param tradeId the trade
     */
    void closeTrade(long tradeId)
    {
        boolean removed;
        synchronized (lock)
        {
            removed = trades.remove(tradeId) != null;
        }

        if (removed)
        {
            LOG.debug("Trade {} closed", tradeId);
        }
    }

    /**
     * Returns the capacity reported for every inventory.
     *
     * @return slots per inventory
     */
    public int getCapacity()
    {
        return capacity;
    }

    /**
     * Looks up the offered slots a player still holds.
     *
     * @param playerId    the owner
     * @param slotIndexes offered slot indexes
     * @return held slots in offer order
     */
    List<InventorySlot> resolveSlots(long playerId, List<Integer> slotIndexes)
    {
        List<InventorySlot> held = new ArrayList<>();
        synchronized (lock)
        {
            PlayerInventory inventory = inventories.get(playerId);
            if (inventory == null)
            {
                return held;
            }
            for (Integer slotIndex : slotIndexes)
            {
                InventorySlot slot = inventory.find(slotIndex);
                if (slot != null)
                {
                    held.add(slot);
                }
            }
        }
        return held;
    }
}
