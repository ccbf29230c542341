package org.abstractica.gameservices;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * A domain status together with the value produced on success.
 *
 * <p>An {@link Status#OK} reply always carries a value; any other status
 * never does.</p>
 *
 * @param status the domain status
 * @param value  the value, present only when the status is OK
 * @param <T>    the value type
 */
public record Reply<T>(Status status, Optional<T> value)
{
    public Reply
    {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(value, "value");
        if ((status == Status.OK) != value.isPresent())
        {
            throw new IllegalArgumentException("OK replies carry a value, others do not: " + status);
        }
    }

    /**
     * Creates a successful reply.
     *
     * @param value the value
     * @param <T>   the value type
     * @return an OK reply
     */
    public static <T> Reply<T> ok(T value)
    {
        return new Reply<>(Status.OK, Optional.of(value));
    }

    /**
     * Creates a reply carrying only a failure status.
     *
     * @param status a status other than OK
     * @param <T>    the value type
     * @return a reply without value
     */
    public static <T> Reply<T> of(Status status)
    {
        return new Reply<>(status, Optional.empty());
    }

    public boolean isOk()
    {
        return status == Status.OK;
    }

    /**
     * Returns the value of an OK reply.
     *
     * @return the value
     * @throws NoSuchElementException if the reply is not OK
     */
    public T orElseThrow()
    {
        return value.orElseThrow(() -> new NoSuchElementException("Reply status is " + status));
    }
}
