package dev.fumaz.locus.type;

import dev.fumaz.locus.exception.ValidationException;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Captures a generic type at the call site:
 * <pre>{@code
 * container.registerInstance(new TypeLiteral<List<String>>() {}, List.of("a", "b"));
 * }</pre>
 *
 * @param <T> the captured type
 */
public class TypeLiteral<T> {

    private final @NotNull Type type;

    protected TypeLiteral() {
        Type superclass = getClass().getGenericSuperclass();

        if (!(superclass instanceof ParameterizedType)) {
            throw new ValidationException("TypeLiteral must be created with a type argument, e.g. new TypeLiteral<List<String>>() {}");
        }

        this.type = ((ParameterizedType) superclass).getActualTypeArguments()[0];
    }

    private TypeLiteral(@NotNull Type type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public static @NotNull TypeLiteral<?> get(@NotNull Type type) {
        return new TypeLiteral<>(type);
    }

    public static <T> @NotNull TypeLiteral<T> get(@NotNull Class<T> type) {
        return new TypeLiteral<>(type);
    }

    public final @NotNull Type getType() {
        return type;
    }

    @SuppressWarnings("unchecked")
    public final @NotNull Class<? super T> getRawType() {
        return (Class<? super T>) Types.rawType(type);
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof TypeLiteral)) {
            return false;
        }

        return type.getTypeName().equals(((TypeLiteral<?>) o).type.getTypeName());
    }

    @Override
    public final int hashCode() {
        return type.getTypeName().hashCode();
    }

    @Override
    public final String toString() {
        return type.getTypeName();
    }
}
