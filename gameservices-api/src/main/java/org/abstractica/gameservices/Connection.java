package org.abstractica.gameservices;

import org.abstractica.gameservices.handlers.CallHandler;

import java.util.concurrent.CompletableFuture;

/**
 * One client's view of a host.
 *
 * <p>A connection holds references to capabilities. References obtained
 * through {@link #bootstrap}, {@link #export} or {@link #retain} are
 * counted against the connection and released when it closes.</p>
 *
 * <p>Capabilities inside a call result (directly, or inside a
 * {@link Reply}, an {@link java.util.Optional}, a list or a record) are
 * exported to the calling connection before the result is delivered. The
 * caller receives stubs in their place: each stub method becomes a call
 * through this connection, run on the host's event loop. Once the stub's
 * reference is released, calling it fails with
 * {@link CallFailedException}.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Connection connection = host.connect();
 * CapabilityRef chat = connection.bootstrap(ServiceKind.CHAT);
 * ChatRoom room = connection.call(chat, ChatService.class,
 *         service -> service.joinRoom("lobby", player)).join().orElseThrow();
 * room.sendMessage("hello");
 *
 * CapabilityRef ref = connection.referenceOf(room);
 * connection.release(ref);
 * }</pre>
 */
public interface Connection extends AutoCloseable
{
    /**
     * Returns the unique connection identifier.
     *
     * @return connection ID
     */
    String getId();

    /**
     * Returns a reference to an exposed top-level service.
     *
     * @param kind the service kind
     * @return reference to the service
     * @throws CallFailedException if the host does not expose the service
     */
    CapabilityRef bootstrap(ServiceKind kind);

    /**
     * Invokes a capability.
     *
     * <p>The call runs on the host's event loop. The future completes
     * exceptionally with {@link CallFailedException} on transport-level
     * failure.</p>
     *
     * @param target  the capability reference
     * @param type    the interface the capability is expected to implement
     * @param handler the call to perform on the capability
     * @param <T>     the capability type
     * @param <R>     the result type
     * @return future completed with the call result
     */
    <T extends Capability, R> CompletableFuture<R> call(CapabilityRef target, Class<T> type, CallHandler<T, R> handler);

    /**
     * Exports a capability, typically a handle returned by a call.
     *
     * <p>Exporting the same object again returns the same reference with
     * its count increased. Exporting a stub takes another reference to the
     * capability behind it.</p>
     *
     * @param capability the capability to export
     * @return the reference
     */
    CapabilityRef export(Capability capability);

    /**
     * Returns the reference behind a stub handed out by this host.
     *
     * <p>The reference is not counted again; use it to pass the capability
     * to another connection or to release it.</p>
     *
     * @param stub a capability received in a call result
     * @return the reference
     * @throws CallFailedException if the object is not a stub of this host
     */
    CapabilityRef referenceOf(Capability stub);

    /**
     * Takes an additional reference to a capability exported elsewhere.
     *
     * @param ref the reference received from another connection
     * @throws CallFailedException if the reference is unknown
     */
    void retain(CapabilityRef ref);

    /**
     * Drops one reference held by this connection.
     *
     * @param ref the reference to release
     * @return true if this connection held the reference
     */
    boolean release(CapabilityRef ref);

    /**
     * Closes the connection and releases every reference it holds.
     */
    @Override
    void close();
}
