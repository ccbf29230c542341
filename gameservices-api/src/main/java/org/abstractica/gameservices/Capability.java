package org.abstractica.gameservices;

/**
 * Marker for objects that can be invoked remotely.
 *
 * <p>Both the top-level services reached at bootstrap and the handles
 * minted by their calls are capabilities. A handle stays invocable for as
 * long as some caller holds a reference to it, independently of the call
 * that created it.</p>
 */
public interface Capability
{
}
