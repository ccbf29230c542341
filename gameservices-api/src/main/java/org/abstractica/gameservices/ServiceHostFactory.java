package org.abstractica.gameservices;

import java.time.Clock;
import java.time.Duration;

/**
 * Factory for creating ServiceHost instances.
 *
 * <p>Use the builder to configure the host before creation:</p>
 * <pre>{@code
 * ServiceHostFactory factory = new DefaultServiceHostFactory();
 * ServiceHost host = factory.builder()
 *     .expose(ServiceKind.WORLD)
 *     .inventoryCapacity(50)
 *     .estimatedWait(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 */
public interface ServiceHostFactory
{
    /**
     * Creates a new host builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a ServiceHost.
     */
    interface Builder
    {
        /**
         * Sets the services reachable at bootstrap. Defaults to all of them.
         *
         * @param kinds the services to expose
         * @return this builder
         */
        Builder expose(ServiceKind... kinds);

        /**
         * Sets the inventory capacity reported to players.
         *
         * @param capacity slots per inventory
         * @return this builder
         */
        Builder inventoryCapacity(int capacity);

        /**
         * Sets the wait estimate reported for queue tickets.
         *
         * @param estimatedWait the estimate
         * @return this builder
         */
        Builder estimatedWait(Duration estimatedWait);

        /**
         * Sets the clock used for timestamps.
         *
         * @param clock the clock
         * @return this builder
         */
        Builder clock(Clock clock);

        /**
         * Builds the host.
         *
         * @return the constructed host
         * @throws IllegalStateException if no service is exposed
         */
        ServiceHost build();
    }
}
