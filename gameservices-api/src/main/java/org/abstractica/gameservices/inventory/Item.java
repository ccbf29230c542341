package org.abstractica.gameservices.inventory;

import java.util.Objects;

/**
 * An item definition.
 *
 * @param id     item identifier
 * @param name   display name
 * @param rarity item rarity
 * @param level  item level
 */
public record Item(long id, String name, Rarity rarity, int level)
{
    public Item
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rarity, "rarity");
    }
}
