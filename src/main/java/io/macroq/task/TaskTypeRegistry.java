package io.macroq.task;

import io.macroq.error.SchedulerException;

import java.util.Collection;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

public final class TaskTypeRegistry {
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    public static TaskTypeRegistry withBuiltins() {
        TaskTypeRegistry registry = new TaskTypeRegistry();
        registry.register(new ScaleTask());
        registry.register(new EchoTask());
        registry.register(new GroupSumTask());
        registry.register(new FailTask());
        return registry;
    }

    public void register(MacroTask<?, ?> prototype) {
        register(prototype.type(), prototype.getClass(), prototype::create);
    }

    public void register(String type, Class<?> taskClass, Supplier<? extends MacroTask<?, ?>> factory) {
        if (type == null || type.isBlank()) {
            throw SchedulerException.configuration("task type tag cannot be empty: " + taskClass.getName());
        }
        Registration existing = registrations.putIfAbsent(type, new Registration(taskClass, factory));
        if (existing != null && !existing.taskClass().equals(taskClass)) {
            throw SchedulerException.configuration(
                    "task type " + type + " already registered for " + existing.taskClass().getName()
                            + ", cannot register " + taskClass.getName());
        }
    }

    public MacroTask<?, ?> newInstance(String type) {
        Registration registration = registrations.get(type);
        if (registration == null) {
            throw SchedulerException.serialization("no task type registered for tag: " + type);
        }
        MacroTask<?, ?> task = registration.factory().get();
        if (task == null || !type.equals(task.type())) {
            throw SchedulerException.serialization("factory for " + type + " produced "
                    + (task == null ? "null" : task.type()));
        }
        return task;
    }

    public Collection<String> types() {
        return new TreeSet<>(registrations.keySet());
    }

    private record Registration(Class<?> taskClass, Supplier<? extends MacroTask<?, ?>> factory) {
    }
}
