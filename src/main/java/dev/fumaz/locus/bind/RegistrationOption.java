package dev.fumaz.locus.bind;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A single adjustment to the {@link RegistrationOptions} of a registration. Options are applied in order,
 * container defaults first, so a later option wins over an earlier one.
 */
@FunctionalInterface
public interface RegistrationOption {

    static @NotNull RegistrationOption lifetime(@NotNull Lifetime lifetime) {
        Objects.requireNonNull(lifetime, "lifetime");
        return options -> options.withLifetime(lifetime);
    }

    static @NotNull RegistrationOption staticLifetime() {
        return lifetime(Lifetime.STATIC);
    }

    static @NotNull RegistrationOption perRequest() {
        return lifetime(Lifetime.PER_REQUEST);
    }

    static @NotNull RegistrationOption named(@NotNull String name) {
        Objects.requireNonNull(name, "name");
        return options -> options.withName(name);
    }

    @NotNull RegistrationOptions apply(@NotNull RegistrationOptions options);

    default @NotNull RegistrationOption andThen(@NotNull RegistrationOption next) {
        Objects.requireNonNull(next, "next");
        return options -> next.apply(apply(options));
    }

}
