package org.abstractica.gameservices;

import java.util.Objects;

/**
 * Reference to an exported capability.
 *
 * <p>References are what a transport would embed in responses. Any
 * connection holding a reference can invoke the capability behind it,
 * regardless of which connection it was exported on.</p>
 *
 * @param id            host-wide export identifier
 * @param interfaceName simple name of the capability interface
 */
public record CapabilityRef(long id, String interfaceName)
{
    public CapabilityRef
    {
        Objects.requireNonNull(interfaceName, "interfaceName");
        if (id <= 0)
        {
            throw new IllegalArgumentException("id must be positive: " + id);
        }
    }

    @Override
    public String toString()
    {
        return interfaceName + "#" + id;
    }
}
