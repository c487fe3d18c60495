package dev.fumaz.locus.module;

import dev.fumaz.locus.bind.RegistrationBuilder;
import dev.fumaz.locus.container.Container;
import dev.fumaz.locus.type.TypeLiteral;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Base class for modules that declare their registrations through {@link #bind(Class)}.
 */
public abstract class LocusModule implements Module {

    private Container container;

    @Override
    public final void configure(@NotNull Container container) {
        Objects.requireNonNull(container, "container");

        if (this.container != null) {
            throw new IllegalStateException("A module cannot be configured recursively");
        }

        this.container = container;

        try {
            configure();
        } finally {
            this.container = null;
        }
    }

    protected abstract void configure();

    protected <T> @NotNull RegistrationBuilder<T> bind(@NotNull Class<T> type) {
        return container().bind(type);
    }

    protected <T> @NotNull RegistrationBuilder<T> bind(@NotNull TypeLiteral<T> type) {
        return container().bind(type);
    }

    protected final void install(@NotNull Module module) {
        Objects.requireNonNull(module, "module");

        if (module == this) {
            throw new IllegalArgumentException("A module cannot install itself");
        }

        module.configure(container());
    }

    protected final @NotNull Container container() {
        if (container == null) {
            throw new IllegalStateException("Registrations can only be declared while the module is being configured");
        }

        return container;
    }
}
