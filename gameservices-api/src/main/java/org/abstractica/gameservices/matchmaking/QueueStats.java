package org.abstractica.gameservices.matchmaking;

/**
 * Queue statistics for one game mode.
 *
 * @param playersInQueue number of queued tickets
 * @param avgWaitSecs    average wait in seconds
 */
public record QueueStats(int playersInQueue, int avgWaitSecs)
{
}
