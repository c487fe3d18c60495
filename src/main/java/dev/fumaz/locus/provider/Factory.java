package dev.fumaz.locus.provider;

import dev.fumaz.locus.container.Resolver;
import dev.fumaz.locus.invoke.Invocable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link Factory} produces the value of a registration, resolving whatever it needs from the given
 * {@link Resolver}. A thrown exception is the failure of the factory.
 *
 * @param <T> the type of the value
 */
@FunctionalInterface
public interface Factory<T> {

    static <T> @NotNull Factory<T> instance(@Nullable T instance) {
        return new InstanceFactory<>(instance);
    }

    static @NotNull Factory<Object> constructor(@NotNull Invocable invocable) {
        return new ConstructorFactory(invocable);
    }

    @Nullable T create(@NotNull Resolver resolver) throws Exception;

}
