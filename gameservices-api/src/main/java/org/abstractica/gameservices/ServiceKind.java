package org.abstractica.gameservices;

import org.abstractica.gameservices.chat.ChatService;
import org.abstractica.gameservices.inventory.InventoryService;
import org.abstractica.gameservices.matchmaking.MatchmakingService;
import org.abstractica.gameservices.world.GameWorld;

/**
 * The top-level services a host can expose at bootstrap.
 */
public enum ServiceKind
{
    WORLD(GameWorld.class),
    CHAT(ChatService.class),
    INVENTORY(InventoryService.class),
    MATCHMAKING(MatchmakingService.class);

    private final Class<? extends Capability> capabilityType;

    ServiceKind(Class<? extends Capability> capabilityType)
    {
        this.capabilityType = capabilityType;
    }

    /**
     * Returns the capability interface implemented by this service.
     *
     * @return the interface class
     */
    public Class<? extends Capability> capabilityType()
    {
        return capabilityType;
    }
}
