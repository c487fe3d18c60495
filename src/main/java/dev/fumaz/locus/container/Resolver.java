package dev.fumaz.locus.container;

import dev.fumaz.locus.exception.NameNotExistException;
import dev.fumaz.locus.exception.NotExistException;
import dev.fumaz.locus.exception.ValidationException;
import dev.fumaz.locus.type.TypeKey;
import dev.fumaz.locus.type.TypeLiteral;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link Resolver} hands out the values registered for a type.
 * <p>
 * The typed variants check that every value is an instance of the requested type and throw
 * {@link ValidationException} otherwise.
 */
public interface Resolver {

    /**
     * Resolves the last anonymous registration of the type, or a named one if the type has no anonymous
     * registrations.
     *
     * @throws NotExistException if nothing is registered for the type
     */
    @Nullable Object resolve(@NotNull TypeKey key);

    /**
     * Resolves every registration of the type: named registrations first, then anonymous ones in
     * registration order.
     *
     * @throws NotExistException if nothing is registered for the type
     */
    @NotNull List<Object> resolveAll(@NotNull TypeKey key);

    /**
     * @throws NotExistException     if nothing is registered for the type
     * @throws NameNotExistException if the type has no registration with that name
     */
    @Nullable Object resolveByName(@NotNull TypeKey key, @NotNull String name);

    /**
     * Resolves the named registrations of the type, keyed by name. Anonymous registrations are left out.
     *
     * @throws NotExistException if nothing is registered for the type
     */
    @NotNull Map<String, Object> resolveMap(@NotNull TypeKey key);

    default <T> @Nullable T resolve(@NotNull Class<T> type) {
        TypeKey key = TypeKey.of(type);
        return cast(key, resolve(key));
    }

    default <T> @Nullable T resolve(@NotNull TypeLiteral<T> type) {
        TypeKey key = TypeKey.of(type);
        return cast(key, resolve(key));
    }

    default <T> @Nullable T resolveByName(@NotNull Class<T> type, @NotNull String name) {
        TypeKey key = TypeKey.of(type);
        return cast(key, resolveByName(key, name));
    }

    default <T> @Nullable T resolveByName(@NotNull TypeLiteral<T> type, @NotNull String name) {
        TypeKey key = TypeKey.of(type);
        return cast(key, resolveByName(key, name));
    }

    default <T> @NotNull List<T> resolveAll(@NotNull Class<T> type) {
        return castAll(TypeKey.of(type));
    }

    default <T> @NotNull List<T> resolveAll(@NotNull TypeLiteral<T> type) {
        return castAll(TypeKey.of(type));
    }

    default <T> @NotNull Map<String, T> resolveMap(@NotNull Class<T> type) {
        return castMap(TypeKey.of(type));
    }

    default <T> @NotNull Map<String, T> resolveMap(@NotNull TypeLiteral<T> type) {
        return castMap(TypeKey.of(type));
    }

    private <T> @NotNull List<T> castAll(@NotNull TypeKey key) {
        List<Object> values = resolveAll(key);
        List<T> casts = new ArrayList<>(values.size());

        for (Object value : values) {
            casts.add(cast(key, value));
        }

        return casts;
    }

    private <T> @NotNull Map<String, T> castMap(@NotNull TypeKey key) {
        Map<String, Object> values = resolveMap(key);
        Map<String, T> casts = new LinkedHashMap<>();

        for (Map.Entry<String, Object> entry : values.entrySet()) {
            casts.put(entry.getKey(), cast(key, entry.getValue()));
        }

        return casts;
    }

    @SuppressWarnings("unchecked")
    private static <T> @Nullable T cast(@NotNull TypeKey key, @Nullable Object value) {
        if (!key.accepts(value)) {
            throw new ValidationException("unable to cast instance of " + value.getClass().getName() + " to " + key);
        }

        return (T) value;
    }

}
