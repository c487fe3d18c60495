package dev.fumaz.locus.type;

import dev.fumaz.locus.exception.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * The identity a registration is stored under.
 * <p>
 * Two keys are equal when their types have the same canonical name, so a {@code List<String>} captured
 * through a {@link TypeLiteral} matches a {@code List<String>} parameter read from a method signature.
 * Primitive types share their key with the wrapper type. No subtyping is considered: a registration
 * under an interface is only found by resolving that interface.
 */
public final class TypeKey {

    private final @NotNull Type type;
    private final @NotNull Class<?> rawType;
    private final @NotNull String name;

    private TypeKey(@NotNull Type type) {
        this.type = type;
        this.rawType = Types.rawType(type);
        this.name = type.getTypeName();
    }

    public static @NotNull TypeKey of(@NotNull Type type) {
        Objects.requireNonNull(type, "type");

        if (!Types.isFullySpecified(type)) {
            throw new ValidationException("Cannot use a type with wildcards or type variables as a key: "
                    + type.getTypeName());
        }

        return new TypeKey(Types.wrap(type));
    }

    public static @NotNull TypeKey of(@NotNull TypeLiteral<?> literal) {
        return of(literal.getType());
    }

    public @NotNull Type getType() {
        return type;
    }

    public @NotNull Class<?> getRawType() {
        return rawType;
    }

    public @NotNull String getName() {
        return name;
    }

    /**
     * Whether a value can be handed out under this key. {@code null} is accepted.
     * <p>
     * Type arguments are erased at runtime, so only the raw type is checked here. Constructor registrations
     * are checked against the full generic type when they are registered.
     */
    public boolean accepts(@Nullable Object value) {
        return value == null || rawType.isInstance(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof TypeKey)) {
            return false;
        }

        TypeKey that = (TypeKey) o;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
