package org.abstractica.gameservices;

import org.abstractica.gameservices.handlers.ErrorHandler;

import java.util.Collection;

/**
 * Hosts the game services and dispatches calls to them.
 *
 * <p>Calls from all connections run one at a time on a single event
 * loop, so handlers never execute in parallel. Each service keeps its own
 * registry; handles minted by calls reference that registry.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ServiceHost host = serviceHostFactory.builder()
 *     .expose(ServiceKind.CHAT, ServiceKind.MATCHMAKING)
 *     .build();
 *
 * host.onError((connection, target, exception) -> {
 *     // Handle failed call
 * });
 *
 * host.start();
 * Connection connection = host.connect();
 * }</pre>
 */
public interface ServiceHost extends AutoCloseable
{
    /**
     * Starts the event loop.
     */
    void start();

    /**
     * Closes the host and all connections.
     *
     * <p>Pending calls complete exceptionally.</p>
     */
    @Override
    void close();

    /**
     * Opens a new connection.
     *
     * @return the connection
     * @throws IllegalStateException if the host is not running
     */
    Connection connect();

    /**
     * Registers an error handler for failed calls.
     *
     * @param handler called when a call fails at transport level
     */
    void onError(ErrorHandler handler);

    /**
     * Returns all open connections.
     *
     * @return unmodifiable collection of connections
     */
    Collection<Connection> getConnections();

    /**
     * Returns host statistics.
     *
     * @return current statistics snapshot
     */
    HostStats getStats();
}
