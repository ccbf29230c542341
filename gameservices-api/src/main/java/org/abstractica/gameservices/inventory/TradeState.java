package org.abstractica.gameservices.inventory;

/**
 * State of a trade negotiation.
 */
public enum TradeState
{
    PROPOSING,
    ACCEPTED,
    CONFIRMED,
    CANCELLED
}
