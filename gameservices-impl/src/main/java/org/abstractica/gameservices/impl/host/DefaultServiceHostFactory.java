package org.abstractica.gameservices.impl.host;

import org.abstractica.gameservices.Capability;
import org.abstractica.gameservices.ServiceHost;
import org.abstractica.gameservices.ServiceHostFactory;
import org.abstractica.gameservices.ServiceKind;
import org.abstractica.gameservices.impl.chat.ChatDirectory;
import org.abstractica.gameservices.impl.inventory.InventoryStore;
import org.abstractica.gameservices.impl.matchmaking.MatchmakingRegistry;
import org.abstractica.gameservices.impl.world.EntityWorld;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Default implementation of ServiceHostFactory.
 *
 * <p>Creates DefaultServiceHost instances using a builder pattern.</p>
 */
public class DefaultServiceHostFactory implements ServiceHostFactory
{
    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private Set<ServiceKind> exposed = EnumSet.allOf(ServiceKind.class);
        private int inventoryCapacity = InventoryStore.DEFAULT_CAPACITY;
        private Duration estimatedWait = MatchmakingRegistry.DEFAULT_ESTIMATED_WAIT;
        private Clock clock = Clock.systemUTC();

        @Override
        public Builder expose(ServiceKind... kinds)
        {
            Objects.requireNonNull(kinds, "kinds");
            Set<ServiceKind> selected = EnumSet.noneOf(ServiceKind.class);
            for (ServiceKind kind : kinds)
            {
                selected.add(Objects.requireNonNull(kind, "kind"));
            }
            this.exposed = selected;
            return this;
        }

        @Override
        public Builder inventoryCapacity(int capacity)
        {
            if (capacity <= 0)
            {
                throw new IllegalArgumentException("inventoryCapacity must be positive: " + capacity);
            }
            this.inventoryCapacity = capacity;
            return this;
        }

        @Override
        public Builder estimatedWait(Duration estimatedWait)
        {
            Objects.requireNonNull(estimatedWait, "estimatedWait");
            if (estimatedWait.isNegative())
            {
                throw new IllegalArgumentException("Estimated wait must not be negative");
            }
            if (estimatedWait.compareTo(MatchmakingRegistry.MAX_ESTIMATED_WAIT) > 0)
            {
                throw new IllegalArgumentException("Estimated wait too large: " + estimatedWait);
            }
            this.estimatedWait = estimatedWait;
            return this;
        }

        @Override
        public Builder clock(Clock clock)
        {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        @Override
        public ServiceHost build()
        {
            if (exposed.isEmpty())
            {
                throw new IllegalStateException("At least one service must be exposed");
            }

            Map<ServiceKind, Capability> services = new EnumMap<>(ServiceKind.class);
            for (ServiceKind kind : exposed)
            {
                services.put(kind, createService(kind));
            }
            return new DefaultServiceHost(services);
        }

        private Capability createService(ServiceKind kind)
        {
            return switch (kind)
            {
                case WORLD -> new EntityWorld();
                case CHAT -> new ChatDirectory(clock);
                case INVENTORY -> new InventoryStore(inventoryCapacity);
                case MATCHMAKING -> new MatchmakingRegistry(clock, estimatedWait);
            };
        }
    }
}
