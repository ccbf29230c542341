package org.abstractica.gameservices.impl.host;

import org.abstractica.gameservices.CallFailedException;
import org.abstractica.gameservices.Capability;
import org.abstractica.gameservices.CapabilityRef;
import org.abstractica.gameservices.Connection;
import org.abstractica.gameservices.ServiceKind;
import org.abstractica.gameservices.handlers.CallHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Default implementation of the Connection interface.
 *
 * <p>Tracks how many references to each capability this connection holds
 * so that closing it returns exactly those references to the table.</p>
 */
public class DefaultConnection implements Connection
{
    private final String id;
    private final DefaultServiceHost host;
    private final CapabilityTable table;

    private final Object lock = new Object();
    private final Map<CapabilityRef, Integer> held = new HashMap<>();
    private volatile boolean closed;

    DefaultConnection(String id, DefaultServiceHost host, CapabilityTable table)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.host = Objects.requireNonNull(host, "host");
        this.table = Objects.requireNonNull(table, "table");
    }

    @Override
    public String getId()
    {
        return id;
    }

    @Override
    public CapabilityRef bootstrap(ServiceKind kind)
    {
        Objects.requireNonNull(kind, "kind");
        checkOpen();

        CapabilityRef ref = host.bootstrapRef(this, kind);
        table.retain(ref);
        hold(ref);
        return ref;
    }

    @Override
    public <T extends Capability, R> CompletableFuture<R> call(
            CapabilityRef target,
            Class<T> type,
            CallHandler<T, R> handler
    )
    {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        return host.dispatch(this, target, type, handler);
    }

    @Override
    public CapabilityRef export(Capability capability)
    {
        Objects.requireNonNull(capability, "capability");
        checkOpen();

        CapabilityStub stub = CapabilityStub.of(capability);
        if (stub != null)
        {
            CapabilityRef ref = stubRef(stub, capability);
            retain(ref);
            return ref;
        }

        CapabilityRef ref = table.export(capability);
        hold(ref);
        return ref;
    }

    @Override
    public CapabilityRef referenceOf(Capability stub)
    {
        Objects.requireNonNull(stub, "stub");
        return stubRef(CapabilityStub.of(stub), stub);
    }

    @Override
    public void retain(CapabilityRef ref)
    {
        Objects.requireNonNull(ref, "ref");
        checkOpen();

        if (!table.retain(ref))
        {
            throw new CallFailedException("Unknown capability reference: " + ref);
        }
        hold(ref);
    }

    @Override
    public boolean release(CapabilityRef ref)
    {
        Objects.requireNonNull(ref, "ref");

        synchronized (lock)
        {
            Integer count = held.get(ref);
            if (count == null)
            {
                return false;
            }
            if (count == 1)
            {
                held.remove(ref);
            }
            else
            {
                held.put(ref, count - 1);
            }
        }
        table.release(ref);
        return true;
    }

    @Override
    public void close()
    {
        if (closed)
        {
            return;
        }
        closed = true;

        Map<CapabilityRef, Integer> snapshot;
        synchronized (lock)
        {
            snapshot = new HashMap<>(held);
            held.clear();
        }
        for (Map.Entry<CapabilityRef, Integer> entry : snapshot.entrySet())
        {
            for (int i = 0; i < entry.getValue(); i++)
            {
                table.release(entry.getKey());
            }
        }

        host.removeConnection(this);
    }

    /**
     * Returns whether this connection has been closed.
     *
     * @return true once closed
     */
    public boolean isClosed()
    {
        return closed;
    }

    /**
     * Returns how many references to a capability this connection holds.
     *
     * @param ref the reference
     * @return the count, 0 if none
     */
    public int heldCount(CapabilityRef ref)
    {
        synchronized (lock)
        {
            return held.getOrDefault(ref, 0);
        }
    }

    DefaultServiceHost getHost()
    {
        return host;
    }

    private CapabilityRef stubRef(CapabilityStub stub, Capability capability)
    {
        if (stub == null || !stub.belongsTo(host))
        {
            throw new CallFailedException("Not a capability stub of this host: " + capability);
        }
        return stub.ref();
    }

    private void hold(CapabilityRef ref)
    {
        synchronized (lock)
        {
            held.merge(ref, 1, Integer::sum);
        }
    }

    private void checkOpen()
    {
        if (closed)
        {
            throw new CallFailedException("Connection closed: " + id);
        }
    }

    @Override
    public String toString()
    {
        return "Connection[" + id + "]";
    }
}
