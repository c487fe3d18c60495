package dev.fumaz.locus.bind;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * The effective options of one registration. An empty name means the registration is anonymous.
 */
public final class RegistrationOptions {

    private static final RegistrationOptions DEFAULTS = new RegistrationOptions(Lifetime.PER_REQUEST, "");

    private final @NotNull Lifetime lifetime;
    private final @NotNull String name;

    private RegistrationOptions(@NotNull Lifetime lifetime, @NotNull String name) {
        this.lifetime = lifetime;
        this.name = name;
    }

    public static @NotNull RegistrationOptions defaults() {
        return DEFAULTS;
    }

    public static @NotNull RegistrationOptions of(@NotNull List<RegistrationOption> defaults,
                                                  @NotNull RegistrationOption... overrides) {
        RegistrationOptions options = DEFAULTS;

        for (RegistrationOption option : defaults) {
            options = Objects.requireNonNull(option.apply(options), "option produced null");
        }

        for (RegistrationOption option : overrides) {
            options = Objects.requireNonNull(option.apply(options), "option produced null");
        }

        return options;
    }

    public @NotNull Lifetime getLifetime() {
        return lifetime;
    }

    public @NotNull String getName() {
        return name;
    }

    public boolean isNamed() {
        return !name.isEmpty();
    }

    public @NotNull RegistrationOptions withLifetime(@NotNull Lifetime lifetime) {
        return new RegistrationOptions(Objects.requireNonNull(lifetime, "lifetime"), name);
    }

    public @NotNull RegistrationOptions withName(@NotNull String name) {
        return new RegistrationOptions(lifetime, Objects.requireNonNull(name, "name"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof RegistrationOptions)) {
            return false;
        }

        RegistrationOptions that = (RegistrationOptions) o;
        return lifetime == that.lifetime && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lifetime, name);
    }

    @Override
    public String toString() {
        return isNamed() ? lifetime + " '" + name + "'" : lifetime.toString();
    }
}
