package dev.fumaz.locus.invoke;

import dev.fumaz.locus.annotation.Named;
import dev.fumaz.locus.container.Resolver;
import dev.fumaz.locus.exception.ValidationException;
import dev.fumaz.locus.type.TypeKey;
import dev.fumaz.locus.type.Types;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Array;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the arguments of an {@link Invocable}, one parameter at a time and in declaration order.
 * <ul>
 *     <li>an array parameter, including a varargs tail, receives every registration of its component type;</li>
 *     <li>a {@code List}, {@code Collection} or {@code Iterable} parameter receives them as a list;</li>
 *     <li>a {@code Map<String, E>} parameter receives the named registrations of {@code E};</li>
 *     <li>a {@link Named} parameter receives the registration with that name;</li>
 *     <li>any other parameter receives the single resolution of its type.</li>
 * </ul>
 * The first failure aborts binding.
 */
final class ParameterBinder {

    private ParameterBinder() {
    }

    static @NotNull Object[] bind(@NotNull Resolver resolver, @NotNull Invocable invocable) {
        Parameter[] parameters = invocable.getParameters();
        Object[] arguments = new Object[parameters.length];

        for (int i = 0; i < parameters.length; i++) {
            arguments[i] = bind(resolver, invocable, parameters[i]);
        }

        return arguments;
    }

    private static @Nullable Object bind(@NotNull Resolver resolver, @NotNull Invocable invocable, @NotNull Parameter parameter) {
        Type type = parameter.getParameterizedType();
        Class<?> rawType = parameter.getType();
        Named named = parameter.getAnnotation(Named.class);

        if (named != null) {
            return checked(invocable, parameter, resolver.resolveByName(TypeKey.of(type), named.value()));
        }

        // a varargs tail is an array parameter too, each resolved value becomes one trailing argument
        Type componentType = Types.componentType(type);

        if (componentType != null) {
            return bindArray(resolver, invocable, parameter, componentType);
        }

        Type elementType = Types.typeArgument(type, 0);

        if (elementType != null && (rawType == List.class || rawType == Collection.class || rawType == Iterable.class)) {
            return bindList(resolver, invocable, parameter, elementType);
        }

        if (rawType == Map.class && elementType == String.class) {
            Type valueType = Types.typeArgument(type, 1);

            if (valueType != null) {
                return bindMap(resolver, invocable, parameter, valueType);
            }
        }

        return checked(invocable, parameter, resolver.resolve(TypeKey.of(type)));
    }

    private static @NotNull Object bindArray(@NotNull Resolver resolver,
                                             @NotNull Invocable invocable,
                                             @NotNull Parameter parameter,
                                             @NotNull Type componentType) {
        List<Object> values = resolver.resolveAll(TypeKey.of(componentType));
        Class<?> rawComponent = Types.rawType(componentType);
        Object array = Array.newInstance(rawComponent, values.size());

        for (int i = 0; i < values.size(); i++) {
            Array.set(array, i, checkElement(invocable, parameter, rawComponent, values.get(i)));
        }

        return array;
    }

    private static @NotNull List<Object> bindList(@NotNull Resolver resolver,
                                                  @NotNull Invocable invocable,
                                                  @NotNull Parameter parameter,
                                                  @NotNull Type elementType) {
        List<Object> values = resolver.resolveAll(TypeKey.of(elementType));
        Class<?> rawElement = Types.rawType(elementType);
        List<Object> list = new ArrayList<>(values.size());

        for (Object value : values) {
            list.add(checkElement(invocable, parameter, rawElement, value));
        }

        return list;
    }

    private static @NotNull Map<String, Object> bindMap(@NotNull Resolver resolver,
                                                        @NotNull Invocable invocable,
                                                        @NotNull Parameter parameter,
                                                        @NotNull Type valueType) {
        Map<String, Object> values = resolver.resolveMap(TypeKey.of(valueType));
        Class<?> rawValue = Types.rawType(valueType);
        Map<String, Object> map = new LinkedHashMap<>();

        for (Map.Entry<String, Object> entry : values.entrySet()) {
            map.put(entry.getKey(), checkElement(invocable, parameter, rawValue, entry.getValue()));
        }

        return map;
    }

    private static @Nullable Object checked(@NotNull Invocable invocable, @NotNull Parameter parameter, @Nullable Object value) {
        return checkElement(invocable, parameter, parameter.getType(), value);
    }

    private static @Nullable Object checkElement(@NotNull Invocable invocable,
                                                 @NotNull Parameter parameter,
                                                 @NotNull Class<?> expected,
                                                 @Nullable Object value) {
        if (value == null) {
            if (expected.isPrimitive()) {
                throw new ValidationException("Cannot bind null to primitive parameter '" + parameter.getName()
                        + "' of " + invocable.describe());
            }

            return null;
        }

        if (!Types.wrap(expected).isInstance(value)) {
            throw new ValidationException("unable to bind instance of " + value.getClass().getName() + " to parameter '"
                    + parameter.getName() + "' of " + invocable.describe());
        }

        return value;
    }
}
