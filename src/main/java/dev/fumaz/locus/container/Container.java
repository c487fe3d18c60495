package dev.fumaz.locus.container;

import dev.fumaz.locus.bind.RegistrationBuilder;
import dev.fumaz.locus.bind.RegistrationOption;
import dev.fumaz.locus.exception.ValidationException;
import dev.fumaz.locus.inject.FieldInjector;
import dev.fumaz.locus.invoke.Invocable;
import dev.fumaz.locus.invoke.Invoker;
import dev.fumaz.locus.module.Module;
import dev.fumaz.locus.provider.Factory;
import dev.fumaz.locus.type.TypeKey;
import dev.fumaz.locus.type.TypeLiteral;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;

/**
 * A {@link Container} stores registrations per type and resolves them on demand.
 * <p>
 * Every registration starts from the container's default options, then applies the options given with the
 * registration. Nothing is built ahead of time: constructor registrations resolve their parameters when
 * they are themselves resolved.
 */
public interface Container extends Resolver {

    static @NotNull Container create(@NotNull RegistrationOption... defaults) {
        return new LocusContainer(Arrays.asList(defaults));
    }

    static @NotNull Container create(@NotNull List<RegistrationOption> defaults) {
        return new LocusContainer(defaults);
    }

    @NotNull List<RegistrationOption> getDefaultOptions();

    /**
     * Registers a fixed value.
     *
     * @throws ValidationException if the value is not an instance of the type
     */
    void registerInstance(@NotNull TypeKey key, @Nullable Object instance, @NotNull RegistrationOption... options);

    void registerDynamic(@NotNull TypeKey key, @NotNull Factory<?> factory, @NotNull RegistrationOption... options);

    /**
     * Registers a callable under its declared return type. Its parameters are resolved each time the
     * factory runs.
     *
     * @throws ValidationException if the callable returns nothing, returns only a {@link Throwable}, or
     *                             declares a return type with type variables
     */
    void registerConstructor(@NotNull Invocable invocable, @NotNull RegistrationOption... options);

    /**
     * Registers a callable under a supertype of its declared return type.
     *
     * @throws ValidationException if the callable's shape is invalid or its return type is not assignable
     */
    void registerConstructor(@NotNull TypeKey key, @NotNull Invocable invocable, @NotNull RegistrationOption... options);

    /**
     * Removes every registration of the type, then registers the value.
     */
    void replaceInstance(@NotNull TypeKey key, @Nullable Object instance, @NotNull RegistrationOption... options);

    /**
     * Removes every registration of the type, then registers the factory.
     */
    void replaceDynamic(@NotNull TypeKey key, @NotNull Factory<?> factory, @NotNull RegistrationOption... options);

    /**
     * Validates the callable as {@link #registerConstructor(TypeKey, Invocable, RegistrationOption...)} does,
     * then swaps every registration of the type for it. A rejected callable leaves the type untouched.
     */
    void replaceConstructor(@NotNull TypeKey key, @NotNull Invocable invocable, @NotNull RegistrationOption... options);

    void removeAll(@NotNull TypeKey key);

    boolean contains(@NotNull TypeKey key);

    default <T> void registerInstance(@NotNull Class<T> type, @Nullable T instance, @NotNull RegistrationOption... options) {
        registerInstance(TypeKey.of(type), instance, options);
    }

    default <T> void registerInstance(@NotNull TypeLiteral<T> type, @Nullable T instance, @NotNull RegistrationOption... options) {
        registerInstance(TypeKey.of(type), instance, options);
    }

    default <T> void registerDynamic(@NotNull Class<T> type, @NotNull Factory<? extends T> factory, @NotNull RegistrationOption... options) {
        registerDynamic(TypeKey.of(type), factory, options);
    }

    default <T> void registerDynamic(@NotNull TypeLiteral<T> type, @NotNull Factory<? extends T> factory, @NotNull RegistrationOption... options) {
        registerDynamic(TypeKey.of(type), factory, options);
    }

    default void registerConstructor(@NotNull Class<?> type, @NotNull RegistrationOption... options) {
        registerConstructor(Invocable.constructorOf(type), options);
    }

    default <T> void registerConstructor(@NotNull Class<T> type,
                                         @NotNull Class<? extends T> implementation,
                                         @NotNull RegistrationOption... options) {
        registerConstructor(TypeKey.of(type), Invocable.constructorOf(implementation), options);
    }

    default void registerConstructor(@NotNull Method method, @NotNull RegistrationOption... options) {
        registerConstructor(Invocable.of(method), options);
    }

    default <T> void replaceInstance(@NotNull Class<T> type, @Nullable T instance, @NotNull RegistrationOption... options) {
        replaceInstance(TypeKey.of(type), instance, options);
    }

    default <T> void replaceInstance(@NotNull TypeLiteral<T> type, @Nullable T instance, @NotNull RegistrationOption... options) {
        replaceInstance(TypeKey.of(type), instance, options);
    }

    default <T> void replaceDynamic(@NotNull Class<T> type, @NotNull Factory<? extends T> factory, @NotNull RegistrationOption... options) {
        replaceDynamic(TypeKey.of(type), factory, options);
    }

    default <T> void replaceDynamic(@NotNull TypeLiteral<T> type, @NotNull Factory<? extends T> factory, @NotNull RegistrationOption... options) {
        replaceDynamic(TypeKey.of(type), factory, options);
    }

    default void removeAll(@NotNull Class<?> type) {
        removeAll(TypeKey.of(type));
    }

    default void removeAll(@NotNull TypeLiteral<?> type) {
        removeAll(TypeKey.of(type));
    }

    default boolean contains(@NotNull Class<?> type) {
        return contains(TypeKey.of(type));
    }

    default <T> @NotNull RegistrationBuilder<T> bind(@NotNull Class<T> type) {
        return new RegistrationBuilder<>(this, TypeKey.of(type));
    }

    default <T> @NotNull RegistrationBuilder<T> bind(@NotNull TypeLiteral<T> type) {
        return new RegistrationBuilder<>(this, TypeKey.of(type));
    }

    default void install(@NotNull Module... modules) {
        for (Module module : modules) {
            module.configure(this);
        }
    }

    default @Nullable Object invoke(@NotNull Object callable) {
        return Invoker.invoke(this, callable);
    }

    default <T> @NotNull T construct(@NotNull Class<T> type) {
        return Invoker.construct(this, type);
    }

    default void inject(@NotNull Object target) {
        FieldInjector.inject(this, target);
    }

}
