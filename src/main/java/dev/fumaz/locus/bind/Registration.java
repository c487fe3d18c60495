package dev.fumaz.locus.bind;

import dev.fumaz.locus.container.Resolver;
import dev.fumaz.locus.exception.LocusException;
import dev.fumaz.locus.exception.ProvisionException;
import dev.fumaz.locus.exception.ValidationException;
import dev.fumaz.locus.provider.Factory;
import dev.fumaz.locus.type.TypeKey;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link Registration} binds a {@link Factory} to a type under a set of {@link RegistrationOptions}.
 * <p>
 * A {@link Lifetime#STATIC} registration memoizes the outcome of its first invocation, whether that is a value
 * (including {@code null}) or a failure, and the factory runs at most once even under contention.
 */
public final class Registration {

    private static final Logger LOGGER = Logger.getLogger(Registration.class.getName());
    private static final VarHandle OUTCOME_HANDLE;

    static {
        try {
            OUTCOME_HANDLE = MethodHandles.lookup().findVarHandle(Registration.class, "outcome", Outcome.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final @NotNull TypeKey key;
    private final @NotNull Factory<?> factory;
    private final @NotNull RegistrationOptions options;
    private final Object lock = new Object();
    private Outcome outcome;

    public Registration(@NotNull TypeKey key, @NotNull Factory<?> factory, @NotNull RegistrationOptions options) {
        this.key = Objects.requireNonNull(key, "key");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.options = Objects.requireNonNull(options, "options");
    }

    public @NotNull TypeKey getKey() {
        return key;
    }

    public @NotNull Factory<?> getFactory() {
        return factory;
    }

    public @NotNull RegistrationOptions getOptions() {
        return options;
    }

    public @NotNull String getName() {
        return options.getName();
    }

    public @NotNull Lifetime getLifetime() {
        return options.getLifetime();
    }

    /**
     * Whether a {@link Lifetime#STATIC} registration has already run its factory.
     */
    public boolean isMemoized() {
        return getOutcome() != null;
    }

    public @Nullable Object resolve(@NotNull Resolver resolver) {
        if (options.getLifetime() != Lifetime.STATIC) {
            return create(resolver);
        }

        Outcome local = getOutcome();

        if (local == null) {
            synchronized (lock) {
                local = getOutcome();

                if (local == null) {
                    local = capture(resolver);
                    publish(local);
                    LOGGER.log(Level.FINE, "Memoized {0}", this);
                }
            }
        }

        return local.get();
    }

    private @NotNull Outcome capture(@NotNull Resolver resolver) {
        try {
            return Outcome.value(create(resolver));
        } catch (LocusException e) {
            return Outcome.failure(e);
        }
    }

    private @Nullable Object create(@NotNull Resolver resolver) {
        Object value;

        try {
            value = factory.create(resolver);
        } catch (LocusException e) {
            throw e;
        } catch (Exception e) {
            throw new ProvisionException("Factory for " + key + " failed", e);
        }

        if (!key.accepts(value)) {
            throw new ValidationException("unable to cast instance of " + value.getClass().getName() + " to " + key);
        }

        return value;
    }

    private Outcome getOutcome() {
        return (Outcome) OUTCOME_HANDLE.getAcquire(this);
    }

    private void publish(Outcome value) {
        OUTCOME_HANDLE.setRelease(this, value);
    }

    @Override
    public String toString() {
        return "Registration{" + key + ", " + options + "}";
    }

    private static final class Outcome {

        private final @Nullable Object value;
        private final @Nullable LocusException failure;

        private Outcome(@Nullable Object value, @Nullable LocusException failure) {
            this.value = value;
            this.failure = failure;
        }

        static Outcome value(@Nullable Object value) {
            return new Outcome(value, null);
        }

        static Outcome failure(@NotNull LocusException failure) {
            return new Outcome(null, failure);
        }

        @Nullable Object get() {
            if (failure != null) {
                throw failure;
            }

            return value;
        }
    }
}
