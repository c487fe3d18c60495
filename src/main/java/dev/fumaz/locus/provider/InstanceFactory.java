package dev.fumaz.locus.provider;

import dev.fumaz.locus.container.Resolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An {@link InstanceFactory} is a {@link Factory} that always returns the same instance.
 *
 * @param <T> the type of the value
 */
public class InstanceFactory<T> implements Factory<T> {

    private final @Nullable T instance;

    public InstanceFactory(@Nullable T instance) {
        this.instance = instance;
    }

    @Override
    public @Nullable T create(@NotNull Resolver resolver) {
        return instance;
    }

    public @Nullable T getInstance() {
        return instance;
    }

}
