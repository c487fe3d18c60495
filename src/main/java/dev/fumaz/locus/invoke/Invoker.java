package dev.fumaz.locus.invoke;

import dev.fumaz.locus.container.Resolver;
import dev.fumaz.locus.exception.ProvisionException;
import dev.fumaz.locus.exception.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Calls arbitrary callables with arguments taken from a {@link Resolver}. Any resolver works, a container is
 * not required.
 * <p>
 * The callable runs only once every parameter is bound. Its result is the returned value ({@code null} for
 * {@code void}); a thrown exception voids the result and surfaces as a {@link ProvisionException}.
 */
public final class Invoker {

    private static final Logger LOGGER = Logger.getLogger(Invoker.class.getName());

    private Invoker() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static @Nullable Object invoke(@NotNull Resolver resolver, @NotNull Invocable invocable) {
        Object[] arguments = ParameterBinder.bind(resolver, invocable);

        LOGGER.log(Level.FINER, "Invoking {0}", invocable);
        return invocable.call(arguments);
    }

    /**
     * @throws ValidationException if the callable is not invocable
     * @see Invocable#from(Object)
     */
    public static @Nullable Object invoke(@NotNull Resolver resolver, @NotNull Object callable) {
        return invoke(resolver, Invocable.from(callable));
    }

    /**
     * Invokes a static method.
     */
    public static @Nullable Object invoke(@NotNull Resolver resolver, @NotNull Method method) {
        return invoke(resolver, Invocable.of(method));
    }

    public static @Nullable Object invoke(@NotNull Resolver resolver, @NotNull Object receiver, @NotNull Method method) {
        return invoke(resolver, Invocable.of(receiver, method));
    }

    public static <T> @NotNull T invoke(@NotNull Resolver resolver, @NotNull Constructor<T> constructor) {
        return constructor.getDeclaringClass().cast(invoke(resolver, Invocable.of(constructor)));
    }

    public static <T> @NotNull T construct(@NotNull Resolver resolver, @NotNull Class<T> type) {
        return type.cast(invoke(resolver, Invocable.constructorOf(type)));
    }
}
