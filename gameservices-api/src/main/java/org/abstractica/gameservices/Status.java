package org.abstractica.gameservices;

/**
 * Domain outcome of a call.
 *
 * <p>Statuses travel in the normal response payload. They are never
 * reported as call failures.</p>
 */
public enum Status
{
    OK,
    NOT_FOUND,
    ALREADY_EXISTS,
    INVALID_ARGUMENT
}
