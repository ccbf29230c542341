package org.abstractica.gameservices.impl.host;

import org.abstractica.gameservices.CallFailedException;
import org.abstractica.gameservices.Capability;
import org.abstractica.gameservices.CapabilityRef;
import org.abstractica.gameservices.Connection;
import org.abstractica.gameservices.HostStats;
import org.abstractica.gameservices.ServiceHost;
import org.abstractica.gameservices.ServiceKind;
import org.abstractica.gameservices.handlers.CallHandler;
import org.abstractica.gameservices.handlers.ErrorHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of the ServiceHost interface.
 *
 * <p>Owns one instance of each exposed service, the capability table and
 * the event loop. Every call is queued onto the loop thread and runs there
 * alone.</p>
 */
public class DefaultServiceHost implements ServiceHost
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultServiceHost.class);
    static final String LOOP_THREAD_NAME = "service-loop";

    private final Map<ServiceKind, Capability> services;
    private final Map<ServiceKind, CapabilityRef> bootstrapRefs;
    private final CapabilityTable table;
    private final Map<String, DefaultConnection> connections;
    private final DefaultHostStats stats;
    private final AtomicLong nextConnectionId = new AtomicLong(1);

    private volatile ErrorHandler errorHandler;
    private ExecutorService loop;
    private volatile Thread loopThread;
    private volatile boolean running;
    private volatile boolean closed;

    /**
     * Creates a new host.
     *
     * <p>Use {@link DefaultServiceHostFactory} to create instances.</p>
     *
     * @param services the exposed services, one instance per kind
     */
    DefaultServiceHost(Map<ServiceKind, Capability> services)
    {
        Objects.requireNonNull(services, "services");
        if (services.isEmpty())
        {
            throw new IllegalArgumentException("At least one service must be exposed");
        }

        this.services = Collections.unmodifiableMap(new EnumMap<>(services));
        this.table = new CapabilityTable();
        this.connections = new ConcurrentHashMap<>();
        this.stats = new DefaultHostStats(connections.values(), table);

        Map<ServiceKind, CapabilityRef> refs = new EnumMap<>(ServiceKind.class);
        for (Map.Entry<ServiceKind, Capability> entry : this.services.entrySet())
        {
            refs.put(entry.getKey(), table.pin(entry.getValue(), entry.getKey().capabilityType()));
        }
        this.bootstrapRefs = Collections.unmodifiableMap(refs);
    }

    // ========== ServiceHost Interface ==========

    @Override
    public synchronized void start()
    {
        if (closed)
        {
            throw new IllegalStateException("Host closed");
        }
        if (running)
        {
            throw new IllegalStateException("Host already started");
        }

        LOG.info("Starting host");

        loop = Executors.newSingleThreadExecutor(runnable ->
        {
            Thread thread = new Thread(runnable, LOOP_THREAD_NAME);
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
        running = true;

        LOG.info("Host started, exposing {}", services.keySet());
    }

    @Override
    public synchronized void close()
    {
        if (!running)
        {
            closed = true;
            return;
        }

        LOG.info("Closing host");

        running = false;
        closed = true;

        for (DefaultConnection connection : new ArrayList<>(connections.values()))
        {
            connection.close();
        }

        // Queued calls still run and fail because the host is no longer running
        loop.shutdown();

        LOG.info("Host closed");
    }

    @Override
    public Connection connect()
    {
        if (!running)
        {
            throw new IllegalStateException("Host is not running");
        }

        String id = "connection-" + nextConnectionId.getAndIncrement();
        DefaultConnection connection = new DefaultConnection(id, this, table);
        connections.put(id, connection);

        LOG.info("Connection opened: id={}", id);
        return connection;
    }

    @Override
    public void onError(ErrorHandler handler)
    {
        this.errorHandler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public Collection<Connection> getConnections()
    {
        return Collections.unmodifiableList(new ArrayList<>(connections.values()));
    }

    @Override
    public HostStats getStats()
    {
        return stats;
    }

    /**
     * Returns the capability table shared by all connections.
     *
     * @return the table
     */
    public CapabilityTable getCapabilityTable()
    {
        return table;
    }

    /**
     * Returns whether the event loop is accepting calls.
     *
     * @return true between start and close
     */
    public boolean isRunning()
    {
        return running;
    }

    // ========== Connection Callbacks ==========

    CapabilityRef bootstrapRef(DefaultConnection connection, ServiceKind kind)
    {
        CapabilityRef ref = bootstrapRefs.get(kind);
        if (ref == null)
        {
            CallFailedException failure = new CallFailedException("Service not exposed: " + kind);
            reportFailure(connection, null, failure);
            throw failure;
        }
        return ref;
    }

    <T extends Capability, R> CompletableFuture<R> dispatch(
            DefaultConnection connection,
            CapabilityRef target,
            Class<T> type,
            CallHandler<T, R> handler
    )
    {
        CompletableFuture<R> future = new CompletableFuture<>();
        if (!running)
        {
            fail(connection, target, future, new CallFailedException("Host is not running"));
            return future;
        }

        try
        {
            loop.execute(() -> invoke(connection, target, type, handler, future));
        }
        catch (RejectedExecutionException e)
        {
            fail(connection, target, future, new CallFailedException("Host is not running", e));
        }
        return future;
    }

    boolean isLoopThread()
    {
        return Thread.currentThread() == loopThread;
    }

    void removeConnection(DefaultConnection connection)
    {
        if (connections.remove(connection.getId()) != null)
        {
            LOG.info("Connection closed: id={}", connection.getId());
        }
    }

    // ========== Event Loop ==========

    private <T extends Capability, R> void invoke(
            DefaultConnection connection,
            CapabilityRef target,
            Class<T> type,
            CallHandler<T, R> handler,
            CompletableFuture<R> future
    )
    {
        if (!running)
        {
            fail(connection, target, future, new CallFailedException("Host closed"));
            return;
        }
        if (connection.isClosed())
        {
            fail(connection, target, future, new CallFailedException("Connection closed: " + connection.getId()));
            return;
        }

        Capability capability = table.resolve(target);
        if (capability == null)
        {
            fail(connection, target, future, new CallFailedException("Unknown capability reference: " + target));
            return;
        }
        if (!type.isInstance(capability))
        {
            fail(connection, target, future, new CallFailedException(
                    "Capability " + target + " does not implement " + type.getSimpleName()));
            return;
        }

        R result;
        try
        {
            // Capabilities in the result reach the client as stubs, never as the objects themselves
            @SuppressWarnings("unchecked")
            R exported = (R) new ResultExporter(connection).export(handler.call(type.cast(capability)));
            result = exported;
        }
        catch (Throwable t)
        {
            fail(connection, target, future, new CallFailedException(
                    "Call on " + target + " failed: " + t.getMessage(), t));
            return;
        }

        stats.recordCall();
        future.complete(result);
    }

    private void fail(
            DefaultConnection connection,
            CapabilityRef target,
            CompletableFuture<?> future,
            CallFailedException failure
    )
    {
        stats.recordFailure();
        reportFailure(connection, target, failure);
        future.completeExceptionally(failure);
    }

    private void reportFailure(Connection connection, CapabilityRef target, CallFailedException failure)
    {
        LOG.warn("Call failed: connection={}, target={}: {}", connection.getId(), target, failure.getMessage());

        ErrorHandler handler = errorHandler;
        if (handler != null)
        {
            try
            {
                handler.handle(connection, target, failure);
            }
            catch (Exception e)
            {
                LOG.error("Error handler threw exception", e);
            }
        }
        else if (failure.getCause() != null)
        {
            LOG.error("Call handler exception: connection={}, target={}",
                    connection.getId(), target, failure.getCause());
        }
    }
}
