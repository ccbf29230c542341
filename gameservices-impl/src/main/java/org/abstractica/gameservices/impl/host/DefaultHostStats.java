package org.abstractica.gameservices.impl.host;

import org.abstractica.gameservices.HostStats;

import java.util.Collection;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of HostStats.
 *
 * <p>Counts are read live from the host's connection map and capability
 * table.</p>
 */
public class DefaultHostStats implements HostStats
{
    private final Collection<?> connections;
    private final CapabilityTable table;
    private final AtomicLong callsProcessed = new AtomicLong(0);
    private final AtomicLong callsFailed = new AtomicLong(0);

    /**
     * Creates stats for a host.
     *
     * @param connections the host's live connection collection
     * @param table       the host's capability table
     */
    public DefaultHostStats(Collection<?> connections, CapabilityTable table)
    {
        this.connections = connections;
        this.table = table;
    }

    @Override
    public int getActiveConnections()
    {
        return connections.size();
    }

    @Override
    public int getExportedCapabilities()
    {
        return table.size();
    }

    @Override
    public long getCallsProcessed()
    {
        return callsProcessed.get();
    }

    @Override
    public long getCallsFailed()
    {
        return callsFailed.get();
    }

    // ========== Update Methods ==========

    /**
     * Records a call that completed normally.
     */
    public void recordCall()
    {
        callsProcessed.incrementAndGet();
    }

    /**
     * Records a call that failed at transport level.
     */
    public void recordFailure()
    {
        callsFailed.incrementAndGet();
    }

    @Override
    public String toString()
    {
        return "HostStats[connections=" + getActiveConnections()
                + ", exported=" + getExportedCapabilities()
                + ", processed=" + getCallsProcessed()
                + ", failed=" + getCallsFailed() + "]";
    }
}
