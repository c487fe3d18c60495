package dev.fumaz.locus.provider;

import dev.fumaz.locus.container.Resolver;
import dev.fumaz.locus.invoke.Invocable;
import dev.fumaz.locus.invoke.Invoker;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A {@link ConstructorFactory} is a {@link Factory} that invokes a callable, binding its parameters from the
 * resolver it is given.
 */
public class ConstructorFactory implements Factory<Object> {

    private final @NotNull Invocable invocable;

    public ConstructorFactory(@NotNull Invocable invocable) {
        this.invocable = Objects.requireNonNull(invocable, "invocable");
    }

    @Override
    public @Nullable Object create(@NotNull Resolver resolver) {
        return Invoker.invoke(resolver, invocable);
    }

    public @NotNull Invocable getInvocable() {
        return invocable;
    }

}
