package org.abstractica.gameservices.impl.host;

import org.abstractica.gameservices.CallFailedException;
import org.abstractica.gameservices.Capability;
import org.abstractica.gameservices.CapabilityRef;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Client-side stand-in for an exported capability.
 *
 * <p>Every interface method becomes a call through the owning connection
 * and blocks until the event loop has run it. Stubs hold no reference
 * count of their own; the connection that received them does.</p>
 */
final class CapabilityStub implements InvocationHandler
{
    private final DefaultConnection connection;
    private final CapabilityRef ref;

    private CapabilityStub(DefaultConnection connection, CapabilityRef ref)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.ref = Objects.requireNonNull(ref, "ref");
    }

    /**
     * Creates a stub implementing the given capability interfaces.
     *
     * @param connection the connection calls go through
     * @param ref        the exported reference
     * @param interfaces capability interfaces, at least one
     * @return the stub
     */
    static Capability create(DefaultConnection connection, CapabilityRef ref, List<Class<?>> interfaces)
    {
        if (interfaces.isEmpty())
        {
            throw new IllegalArgumentException("No capability interface for " + ref);
        }
        Object proxy = Proxy.newProxyInstance(
                interfaces.get(0).getClassLoader(),
                interfaces.toArray(new Class<?>[0]),
                new CapabilityStub(connection, ref)
        );
        return (Capability) proxy;
    }

    /**
     * Returns the stub handler behind an object.
     *
     * @param candidate any capability
     * @return the handler, or null if the object is not a stub
     */
    static CapabilityStub of(Object candidate)
    {
        if (candidate == null || !Proxy.isProxyClass(candidate.getClass()))
        {
            return null;
        }
        InvocationHandler handler = Proxy.getInvocationHandler(candidate);
        return handler instanceof CapabilityStub stub ? stub : null;
    }

    CapabilityRef ref()
    {
        return ref;
    }

    boolean belongsTo(DefaultServiceHost host)
    {
        return connection.getHost() == host;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args)
    {
        if (method.getDeclaringClass() == Object.class)
        {
            return switch (method.getName())
            {
                case "equals" -> proxy == args[0];
                case "hashCode" -> System.identityHashCode(proxy);
                default -> "Stub[" + ref + "]";
            };
        }

        // A blocking call from the loop would wait on itself
        if (connection.getHost().isLoopThread())
        {
            throw new CallFailedException("Stub " + ref + " called from the event loop");
        }

        CompletableFuture<Object> future = dispatch(method.getDeclaringClass().asSubclass(Capability.class),
                method, args);
        try
        {
            return future.get();
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new CallFailedException("Interrupted while calling " + ref, e);
        }
        catch (ExecutionException e)
        {
            if (e.getCause() instanceof CallFailedException failure)
            {
                throw failure;
            }
            throw new CallFailedException("Call on " + ref + " failed", e.getCause());
        }
    }

    private <T extends Capability> CompletableFuture<Object> dispatch(Class<T> type, Method method, Object[] args)
    {
        return connection.call(ref, type, target -> invokeOn(target, method, args));
    }

    private static Object invokeOn(Object target, Method method, Object[] args)
    {
        try
        {
            return method.invoke(target, args);
        }
        catch (InvocationTargetException e)
        {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime)
            {
                throw runtime;
            }
            if (cause instanceof Error error)
            {
                throw error;
            }
            throw new IllegalStateException("Capability method " + method.getName() + " failed", cause);
        }
        catch (IllegalAccessException e)
        {
            throw new IllegalStateException("Cannot invoke " + method.getName(), e);
        }
    }
}
