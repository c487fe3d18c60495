package dev.fumaz.locus.container;

import dev.fumaz.locus.bind.Registration;
import dev.fumaz.locus.bind.RegistrationGroup;
import dev.fumaz.locus.bind.RegistrationOption;
import dev.fumaz.locus.bind.RegistrationOptions;
import dev.fumaz.locus.bind.RegistrationRegistry;
import dev.fumaz.locus.exception.NameNotExistException;
import dev.fumaz.locus.exception.NotExistException;
import dev.fumaz.locus.exception.ValidationException;
import dev.fumaz.locus.invoke.Invocable;
import dev.fumaz.locus.provider.Factory;
import dev.fumaz.locus.type.TypeKey;
import dev.fumaz.locus.type.Types;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

public class LocusContainer implements Container {

    private static final Logger LOGGER = Logger.getLogger(LocusContainer.class.getName());

    private final @NotNull List<RegistrationOption> defaultOptions;
    private final @NotNull RegistrationRegistry registry;

    public LocusContainer(@NotNull List<RegistrationOption> defaultOptions) {
        this.defaultOptions = Collections.unmodifiableList(new ArrayList<>(defaultOptions));
        this.registry = new RegistrationRegistry();
    }

    @Override
    public @NotNull List<RegistrationOption> getDefaultOptions() {
        return defaultOptions;
    }

    @Override
    public void registerInstance(@NotNull TypeKey key, @Nullable Object instance, @NotNull RegistrationOption... options) {
        registry.add(createInstanceRegistration(key, instance, options));
    }

    @Override
    public void registerDynamic(@NotNull TypeKey key, @NotNull Factory<?> factory, @NotNull RegistrationOption... options) {
        registry.add(createRegistration(key, factory, options));
    }

    @Override
    public void registerConstructor(@NotNull Invocable invocable, @NotNull RegistrationOption... options) {
        TypeKey key = invocable.getConstructedKey();

        registerDynamic(key, Factory.constructor(invocable), options);
    }

    @Override
    public void registerConstructor(@NotNull TypeKey key, @NotNull Invocable invocable, @NotNull RegistrationOption... options) {
        registerDynamic(key, constructorFactory(key, invocable), options);
    }

    @Override
    public void replaceConstructor(@NotNull TypeKey key, @NotNull Invocable invocable, @NotNull RegistrationOption... options) {
        replaceDynamic(key, constructorFactory(key, invocable), options);
    }

    @Override
    public void replaceInstance(@NotNull TypeKey key, @Nullable Object instance, @NotNull RegistrationOption... options) {
        replace(createInstanceRegistration(key, instance, options));
    }

    @Override
    public void replaceDynamic(@NotNull TypeKey key, @NotNull Factory<?> factory, @NotNull RegistrationOption... options) {
        replace(createRegistration(key, factory, options));
    }

    @Override
    public void removeAll(@NotNull TypeKey key) {
        RegistrationGroup removed = registry.remove(key);

        if (removed != null) {
            LOGGER.log(Level.FINE, "Removed {0} registration(s) of {1}", new Object[]{removed.size(), key});
        }
    }

    @Override
    public boolean contains(@NotNull TypeKey key) {
        return registry.contains(key);
    }

    @Override
    public @Nullable Object resolve(@NotNull TypeKey key) {
        Registration registration = group(key).primary();

        if (registration == null) {
            throw new NotExistException(key);
        }

        LOGGER.log(Level.FINER, "Resolving {0}", registration);
        return registration.resolve(this);
    }

    @Override
    public @NotNull List<Object> resolveAll(@NotNull TypeKey key) {
        List<Registration> registrations = group(key).all();
        List<Object> values = new ArrayList<>(registrations.size());

        for (Registration registration : registrations) {
            values.add(registration.resolve(this));
        }

        return values;
    }

    @Override
    public @Nullable Object resolveByName(@NotNull TypeKey key, @NotNull String name) {
        Registration registration = group(key).getNamed(name);

        if (registration == null) {
            throw new NameNotExistException(key, name);
        }

        LOGGER.log(Level.FINER, "Resolving {0}", registration);
        return registration.resolve(this);
    }

    @Override
    public @NotNull Map<String, Object> resolveMap(@NotNull TypeKey key) {
        Map<String, Object> values = new LinkedHashMap<>();

        for (Map.Entry<String, Registration> entry : group(key).getNamed().entrySet()) {
            values.put(entry.getKey(), entry.getValue().resolve(this));
        }

        return values;
    }

    private @NotNull RegistrationGroup group(@NotNull TypeKey key) {
        RegistrationGroup group = registry.find(key);

        if (group == null || group.isEmpty()) {
            throw new NotExistException(key);
        }

        return group;
    }

    private @NotNull Factory<?> constructorFactory(@NotNull TypeKey key, @NotNull Invocable invocable) {
        TypeKey constructed = invocable.getConstructedKey();

        if (!Types.isAssignable(key.getType(), constructed.getType())) {
            throw new ValidationException(invocable.describe() + " returns " + constructed
                    + " which cannot be registered as " + key);
        }

        return Factory.constructor(invocable);
    }

    private void replace(@NotNull Registration registration) {
        registry.replace(registration);
        LOGGER.log(Level.FINE, "Replaced registrations of {0} with {1}", new Object[]{registration.getKey(), registration});
    }

    private @NotNull Registration createInstanceRegistration(@NotNull TypeKey key,
                                                             @Nullable Object instance,
                                                             @NotNull RegistrationOption... options) {
        if (!key.accepts(instance)) {
            throw new ValidationException("unable to register instance of " + instance.getClass().getName() + " as " + key);
        }

        return createRegistration(key, Factory.instance(instance), options);
    }

    private @NotNull Registration createRegistration(@NotNull TypeKey key,
                                                     @NotNull Factory<?> factory,
                                                     @NotNull RegistrationOption... options) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(factory, "factory");

        Registration registration = new Registration(key, factory, RegistrationOptions.of(defaultOptions, options));
        LOGGER.log(Level.FINE, "Registered {0}", registration);

        return registration;
    }
}
