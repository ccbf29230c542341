package org.abstractica.gameservices.impl.host;

import org.abstractica.gameservices.Capability;
import org.abstractica.gameservices.CapabilityRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Host-wide table of exported capabilities.
 *
 * <p>Entries are reference counted. Pinned entries (the bootstrap
 * services) stay in the table whatever their count. Dropping an entry
 * only makes the capability unreachable through the host; the registry
 * behind it is left alone.</p>
 *
 * <p>Thread-safe.</p>
 */
public class CapabilityTable
{
    private static final Logger LOG = LoggerFactory.getLogger(CapabilityTable.class);

    private final Object lock = new Object();
    private final Map<Long, Entry> entriesById = new HashMap<>();
    private final Map<Capability, Entry> entriesByTarget = new IdentityHashMap<>();
    private long nextId = 1;

    // ========== Export ==========

    /**
     * Adds a capability that is never dropped.
     *
     * @param capability the service instance
     * @param type       the interface it is reachable as
     * @return the reference
     */
    public CapabilityRef pin(Capability capability, Class<? extends Capability> type)
    {
        Objects.requireNonNull(capability, "capability");
        Objects.requireNonNull(type, "type");

        synchronized (lock)
        {
            Entry existing = entriesByTarget.get(capability);
            if (existing != null)
            {
                existing.pinned = true;
                return existing.ref;
            }
            Entry entry = new Entry(new CapabilityRef(nextId++, type.getSimpleName()), capability, true);
            entriesById.put(entry.ref.id(), entry);
            entriesByTarget.put(capability, entry);
            LOG.debug("Pinned {}", entry.ref);
            return entry.ref;
        }
    }

    /**
     * Exports a capability, or takes another reference if it is already
     * in the table.
     *
     * @param capability the capability
     * @return the reference
     */
    public CapabilityRef export(Capability capability)
    {
        Objects.requireNonNull(capability, "capability");

        synchronized (lock)
        {
            Entry entry = entriesByTarget.get(capability);
            if (entry == null)
            {
                String name = capabilityInterface(capability.getClass()).getSimpleName();
                entry = new Entry(new CapabilityRef(nextId++, name), capability, false);
                entriesById.put(entry.ref.id(), entry);
                entriesByTarget.put(capability, entry);
            }
            entry.refCount++;
            LOG.debug("Exported {} (refs={})", entry.ref, entry.refCount);
            return entry.ref;
        }
    }

    /**
     * Takes another reference to an entry.
     *
     * @param ref the reference
     * @return false if the entry is not in the table
     */
    public boolean retain(CapabilityRef ref)
    {
        Objects.requireNonNull(ref, "ref");

        synchronized (lock)
        {
            Entry entry = entriesById.get(ref.id());
            if (entry == null)
            {
                return false;
            }
            entry.refCount++;
            return true;
        }
    }

    /**
     * Drops one reference. The entry is removed when its count reaches
     * zero unless it is pinned.
     *
     * @param ref the reference
     * @return true if the entry left the table
     */
    public boolean release(CapabilityRef ref)
    {
        Objects.requireNonNull(ref, "ref");

        synchronized (lock)
        {
            Entry entry = entriesById.get(ref.id());
            if (entry == null)
            {
                return false;
            }
            if (entry.refCount > 0)
            {
                entry.refCount--;
            }
            if (entry.refCount > 0 || entry.pinned)
            {
                return false;
            }
            entriesById.remove(ref.id());
            entriesByTarget.remove(entry.target);
            LOG.debug("Released {}", entry.ref);
            return true;
        }
    }

    // ========== Lookup ==========

    /**
     * Resolves a reference.
     *
     * @param ref the reference
     * @return the capability, or null if the reference is unknown or released
     */
    public Capability resolve(CapabilityRef ref)
    {
        Objects.requireNonNull(ref, "ref");

        synchronized (lock)
        {
            Entry entry = entriesById.get(ref.id());
            return entry == null ? null : entry.target;
        }
    }

    /**
     * Returns the reference count of an entry.
     *
     * @param ref the reference
     * @return the count, or 0 if the entry is not in the table
     */
    public int refCount(CapabilityRef ref)
    {
        synchronized (lock)
        {
            Entry entry = entriesById.get(ref.id());
            return entry == null ? 0 : entry.refCount;
        }
    }

    /**
     * Returns the number of entries, pinned ones included.
     *
     * @return entry count
     */
    public int size()
    {
        synchronized (lock)
        {
            return entriesById.size();
        }
    }

    /**
     * Finds the capability interface a class implements, searching its
     * superclasses too. Falls back to the class itself.
     */
    static Class<?> capabilityInterface(Class<?> type)
    {
        List<Class<?>> interfaces = capabilityInterfaces(type);
        return interfaces.isEmpty() ? type : interfaces.get(0);
    }

    /**
     * Lists every capability interface a class implements directly or
     * through its superclasses, in declaration order.
     */
    static List<Class<?>> capabilityInterfaces(Class<?> type)
    {
        Set<Class<?>> found = new LinkedHashSet<>();
        for (Class<?> current = type; current != null; current = current.getSuperclass())
        {
            for (Class<?> candidate : current.getInterfaces())
            {
                if (candidate != Capability.class && Capability.class.isAssignableFrom(candidate))
                {
                    found.add(candidate);
                }
            }
        }
        return List.copyOf(found);
    }

    private static final class Entry
    {
        private final CapabilityRef ref;
        private final Capability target;
        private boolean pinned;
        private int refCount;

        private Entry(CapabilityRef ref, Capability target, boolean pinned)
        {
            this.ref = ref;
            this.target = target;
            this.pinned = pinned;
        }
    }
}
