package org.abstractica.gameservices.impl.host;

import org.abstractica.gameservices.CallFailedException;
import org.abstractica.gameservices.Capability;
import org.abstractica.gameservices.CapabilityRef;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Replaces the capabilities in a call result with stubs.
 *
 * <p>Each capability found is exported to the calling connection, so the
 * connection holds one reference per capability delivered. Optionals,
 * lists and records are rebuilt only when something inside them changed;
 * every other value is passed through.</p>
 *
 * <p>Runs on the event loop.</p>
 */
class ResultExporter
{
    private final DefaultConnection connection;

    ResultExporter(DefaultConnection connection)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    /**
     * Exports the capabilities in a value.
     *
     * @param value the handler's result
     * @return the value with stubs in place of capabilities
     */
    Object export(Object value)
    {
        if (value == null)
        {
            return null;
        }
        if (value instanceof Capability capability)
        {
            return exportCapability(capability);
        }
        if (value instanceof Optional<?> optional)
        {
            if (optional.isEmpty())
            {
                return optional;
            }
            Object inner = optional.get();
            Object exported = export(inner);
            return exported == inner ? optional : Optional.of(exported);
        }
        if (value instanceof List<?> list)
        {
            return exportList(list);
        }
        if (value instanceof Record record)
        {
            return exportRecord(record);
        }
        return value;
    }

    private Capability exportCapability(Capability capability)
    {
        if (CapabilityStub.of(capability) != null)
        {
            connection.export(capability);
            return capability;
        }

        List<Class<?>> interfaces = CapabilityTable.capabilityInterfaces(capability.getClass());
        if (interfaces.isEmpty())
        {
            throw new CallFailedException(
                    capability.getClass().getName() + " implements no capability interface");
        }
        CapabilityRef ref = connection.export(capability);
        return CapabilityStub.create(connection, ref, interfaces);
    }

    private List<?> exportList(List<?> list)
    {
        List<Object> exported = new ArrayList<>(list.size());
        boolean changed = false;
        for (Object element : list)
        {
            Object replacement = export(element);
            changed |= replacement != element;
            exported.add(replacement);
        }
        return changed ? Collections.unmodifiableList(exported) : list;
    }

    private Record exportRecord(Record record)
    {
        Class<?> recordClass = record.getClass();
        RecordComponent[] components = recordClass.getRecordComponents();
        Object[] args = new Object[components.length];
        Class<?>[] argTypes = new Class<?>[components.length];
        boolean changed = false;

        for (int i = 0; i < components.length; i++)
        {
            RecordComponent component = components[i];
            argTypes[i] = component.getType();
            try
            {
                Method accessor = component.getAccessor();
                accessor.trySetAccessible();
                Object value = accessor.invoke(record);
                args[i] = export(value);
                changed |= args[i] != value;
            }
            catch (ReflectiveOperationException e)
            {
                throw new CallFailedException("Failed to read component: " + component.getName(), e);
            }
        }

        if (!changed)
        {
            return record;
        }
        try
        {
            Constructor<?> constructor = recordClass.getDeclaredConstructor(argTypes);
            constructor.trySetAccessible();
            return (Record) constructor.newInstance(args);
        }
        catch (ReflectiveOperationException e)
        {
            throw new CallFailedException("Failed to rebuild record: " + recordClass.getName(), e);
        }
    }
}
