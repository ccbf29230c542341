package org.abstractica.gameservices;

/**
 * Host statistics for monitoring.
 *
 * <p>Statistics are pollable snapshots.</p>
 */
public interface HostStats
{
    /**
     * Returns the number of open connections.
     *
     * @return open connection count
     */
    int getActiveConnections();

    /**
     * Returns the number of capabilities currently in the export table,
     * bootstrap services included.
     *
     * @return exported capability count
     */
    int getExportedCapabilities();

    /**
     * Returns the number of calls that completed normally.
     *
     * @return processed call count
     */
    long getCallsProcessed();

    /**
     * Returns the number of calls that failed at transport level.
     *
     * @return failed call count
     */
    long getCallsFailed();
}
