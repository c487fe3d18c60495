package dev.fumaz.locus.type;

import dev.fumaz.locus.exception.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.HashMap;
import java.util.Map;

/**
 * Static helpers over {@link Type} used by the registry and the invocation engine.
 */
public final class Types {

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            char.class, Character.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class,
            void.class, Void.class
    );

    private Types() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static @NotNull Class<?> wrap(@NotNull Class<?> type) {
        return type.isPrimitive() ? WRAPPERS.get(type) : type;
    }

    public static @NotNull Type wrap(@NotNull Type type) {
        if (type instanceof Class) {
            return wrap((Class<?>) type);
        }

        return type;
    }

    public static @NotNull Class<?> rawType(@NotNull Type type) {
        if (type instanceof Class) {
            return (Class<?>) type;
        }

        if (type instanceof ParameterizedType) {
            return (Class<?>) ((ParameterizedType) type).getRawType();
        }

        if (type instanceof GenericArrayType) {
            Class<?> component = rawType(((GenericArrayType) type).getGenericComponentType());
            return Array.newInstance(component, 0).getClass();
        }

        if (type instanceof WildcardType) {
            return rawType(upperBound((WildcardType) type));
        }

        if (type instanceof TypeVariable) {
            Type[] bounds = ((TypeVariable<?>) type).getBounds();
            return bounds.length == 0 ? Object.class : rawType(bounds[0]);
        }

        throw new ValidationException("Unsupported type: " + type);
    }

    /**
     * Returns the element type of an array or generic array type, or {@code null} if the type is not an array.
     */
    public static @Nullable Type componentType(@NotNull Type type) {
        if (type instanceof Class && ((Class<?>) type).isArray()) {
            return ((Class<?>) type).getComponentType();
        }

        if (type instanceof GenericArrayType) {
            return ((GenericArrayType) type).getGenericComponentType();
        }

        return null;
    }

    /**
     * Returns the type argument at {@code index}, replacing a bounded wildcard by its upper bound.
     * A raw type yields {@code null}.
     */
    public static @Nullable Type typeArgument(@NotNull Type type, int index) {
        if (!(type instanceof ParameterizedType)) {
            return null;
        }

        Type[] arguments = ((ParameterizedType) type).getActualTypeArguments();

        if (index >= arguments.length) {
            return null;
        }

        Type argument = arguments[index];

        if (argument instanceof WildcardType) {
            return upperBound((WildcardType) argument);
        }

        return argument;
    }

    public static boolean isFullySpecified(@NotNull Type type) {
        if (type instanceof Class) {
            return true;
        }

        if (type instanceof ParameterizedType) {
            ParameterizedType parameterized = (ParameterizedType) type;

            if (parameterized.getOwnerType() != null && !isFullySpecified(parameterized.getOwnerType())) {
                return false;
            }

            for (Type argument : parameterized.getActualTypeArguments()) {
                if (!isFullySpecified(argument)) {
                    return false;
                }
            }

            return true;
        }

        if (type instanceof GenericArrayType) {
            return isFullySpecified(((GenericArrayType) type).getGenericComponentType());
        }

        return false;
    }

    /**
     * Whether a value of type {@code from} can be handed out as {@code to}. Parameterized targets need the
     * matching supertype of {@code from} to carry the same type arguments; a raw {@code from} never matches
     * a parameterized target.
     */
    public static boolean isAssignable(@NotNull Type to, @NotNull Type from) {
        if (!wrap(rawType(to)).isAssignableFrom(wrap(rawType(from)))) {
            return false;
        }

        if (to instanceof Class) {
            return true;
        }

        if (to instanceof ParameterizedType) {
            Type supertype = supertype(from, rawType(to));
            return supertype != null && sameType(to, supertype);
        }

        if (to instanceof GenericArrayType) {
            Type component = componentType(from);
            return component != null && isAssignable(((GenericArrayType) to).getGenericComponentType(), component);
        }

        return false;
    }

    /**
     * Finds {@code target} among the supertypes of {@code type}, with type variables replaced by the
     * arguments {@code type} supplies.
     */
    private static @Nullable Type supertype(@NotNull Type type, @NotNull Class<?> target) {
        Class<?> raw = rawType(type);

        if (raw == target) {
            return type;
        }

        Map<TypeVariable<?>, Type> bindings = new HashMap<>();

        if (type instanceof ParameterizedType) {
            TypeVariable<?>[] variables = raw.getTypeParameters();
            Type[] arguments = ((ParameterizedType) type).getActualTypeArguments();

            for (int i = 0; i < variables.length && i < arguments.length; i++) {
                bindings.put(variables[i], arguments[i]);
            }
        }

        Type superclass = raw.getGenericSuperclass();

        if (superclass != null) {
            Type found = supertype(substitute(superclass, bindings), target);

            if (found != null) {
                return found;
            }
        }

        for (Type parent : raw.getGenericInterfaces()) {
            Type found = supertype(substitute(parent, bindings), target);

            if (found != null) {
                return found;
            }
        }

        return null;
    }

    private static @NotNull Type substitute(@NotNull Type type, @NotNull Map<TypeVariable<?>, Type> bindings) {
        if (type instanceof TypeVariable) {
            return bindings.getOrDefault(type, type);
        }

        if (type instanceof ParameterizedType) {
            ParameterizedType parameterized = (ParameterizedType) type;
            Type[] arguments = parameterized.getActualTypeArguments().clone();

            for (int i = 0; i < arguments.length; i++) {
                arguments[i] = substitute(arguments[i], bindings);
            }

            return new ResolvedParameterizedType((Class<?>) parameterized.getRawType(), parameterized.getOwnerType(), arguments);
        }

        return type;
    }

    private static boolean sameType(@NotNull Type a, @NotNull Type b) {
        if (a instanceof ParameterizedType && b instanceof ParameterizedType) {
            ParameterizedType left = (ParameterizedType) a;
            ParameterizedType right = (ParameterizedType) b;
            Type[] leftArguments = left.getActualTypeArguments();
            Type[] rightArguments = right.getActualTypeArguments();

            if (!left.getRawType().equals(right.getRawType()) || leftArguments.length != rightArguments.length) {
                return false;
            }

            for (int i = 0; i < leftArguments.length; i++) {
                if (!sameType(leftArguments[i], rightArguments[i])) {
                    return false;
                }
            }

            return true;
        }

        if (a instanceof GenericArrayType && b instanceof GenericArrayType) {
            return sameType(((GenericArrayType) a).getGenericComponentType(), ((GenericArrayType) b).getGenericComponentType());
        }

        return a.equals(b);
    }

    private static @NotNull Type upperBound(@NotNull WildcardType wildcard) {
        Type[] upper = wildcard.getUpperBounds();

        if (upper.length != 1 || wildcard.getLowerBounds().length != 0) {
            throw new ValidationException("Unsupported wildcard type: " + wildcard);
        }

        return upper[0];
    }

    private static final class ResolvedParameterizedType implements ParameterizedType {

        private final @NotNull Class<?> rawType;
        private final @Nullable Type ownerType;
        private final @NotNull Type[] arguments;

        private ResolvedParameterizedType(@NotNull Class<?> rawType, @Nullable Type ownerType, @NotNull Type[] arguments) {
            this.rawType = rawType;
            this.ownerType = ownerType;
            this.arguments = arguments;
        }

        @Override
        public Type[] getActualTypeArguments() {
            return arguments.clone();
        }

        @Override
        public Type getRawType() {
            return rawType;
        }

        @Override
        public Type getOwnerType() {
            return ownerType;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder(rawType.getName()).append('<');

            for (int i = 0; i < arguments.length; i++) {
                if (i > 0) {
                    builder.append(", ");
                }

                builder.append(arguments[i].getTypeName());
            }

            return builder.append('>').toString();
        }
    }
}
