package org.abstractica.gameservices.inventory;

/**
 * Item rarity, declared from lowest to highest rank.
 */
public enum Rarity
{
    COMMON,
    UNCOMMON,
    RARE,
    EPIC,
    LEGENDARY;

    /**
     * Returns the rank of this rarity, 0 for COMMON.
     *
     * @return the rank
     */
    public int rank()
    {
        return ordinal();
    }

    /**
     * Tests whether this rarity ranks at least as high as another.
     *
     * @param minimum the minimum rarity
     * @return true if this rank is greater than or equal to the minimum's
     */
    public boolean isAtLeast(Rarity minimum)
    {
        return rank() >= minimum.rank();
    }
}
