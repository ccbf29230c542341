package org.abstractica.gameservices;

/**
 * A call failed at transport level.
 *
 * <p>Raised for structural problems: unknown or released references,
 * wrong interface types, unexposed services, closed connections, and
 * request values rejected as malformed. Domain outcomes such as
 * {@link Status#NOT_FOUND} are never reported this way.</p>
 */
public class CallFailedException extends RuntimeException
{
    public CallFailedException(String message)
    {
        super(message);
    }

    public CallFailedException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
