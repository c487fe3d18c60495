package dev.fumaz.locus.inject;

import dev.fumaz.locus.annotation.Inject;
import dev.fumaz.locus.annotation.Named;
import dev.fumaz.locus.container.Resolver;
import dev.fumaz.locus.exception.NameNotExistException;
import dev.fumaz.locus.exception.NotExistException;
import dev.fumaz.locus.exception.ValidationException;
import dev.fumaz.locus.type.TypeKey;
import dev.fumaz.locus.type.Types;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assigns resolved values to the {@link Inject}-annotated fields of an object.
 * <p>
 * Fields are visited class by class, starting with the object's own class, each in declaration order.
 * Static, final and inaccessible fields are skipped, and so are fields whose declared type contains type
 * variables. The first failure stops injection; fields assigned
 * before it keep their values.
 */
public final class FieldInjector {

    private static final Logger LOGGER = Logger.getLogger(FieldInjector.class.getName());
    private static final ClassValue<List<InjectionPoint>> INJECTION_POINTS = new ClassValue<>() {
        @Override
        protected List<InjectionPoint> computeValue(Class<?> type) {
            return findInjectionPoints(type);
        }
    };

    private FieldInjector() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static void inject(@NotNull Resolver resolver, @NotNull Object target) {
        Objects.requireNonNull(resolver, "resolver");
        Objects.requireNonNull(target, "target");

        for (InjectionPoint point : INJECTION_POINTS.get(target.getClass())) {
            point.inject(resolver, target);
        }
    }

    private static List<InjectionPoint> findInjectionPoints(Class<?> type) {
        List<InjectionPoint> points = new ArrayList<>();

        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                Inject inject = field.getAnnotation(Inject.class);

                if (inject == null) {
                    continue;
                }

                int modifiers = field.getModifiers();

                if (Modifier.isStatic(modifiers) || Modifier.isFinal(modifiers) || !field.trySetAccessible()) {
                    LOGGER.log(Level.FINE, "Skipping field {0} of {1}: not settable",
                            new Object[]{field.getName(), current.getName()});
                    continue;
                }

                if (!Types.isFullySpecified(field.getGenericType())) {
                    LOGGER.log(Level.FINE, "Skipping field {0} of {1}: type {2} has type variables",
                            new Object[]{field.getName(), current.getName(), field.getGenericType().getTypeName()});
                    continue;
                }

                points.add(new InjectionPoint(field, inject.optional(), field.getAnnotation(Named.class)));
            }
        }

        return Collections.unmodifiableList(points);
    }

    private static final class InjectionPoint {

        private final @NotNull Field field;
        private final @NotNull TypeKey key;
        private final boolean optional;
        private final @Nullable String name;

        private InjectionPoint(@NotNull Field field, boolean optional, @Nullable Named named) {
            this.field = field;
            this.key = TypeKey.of(field.getGenericType());
            this.optional = optional;
            this.name = named == null ? null : named.value();
        }

        private void inject(@NotNull Resolver resolver, @NotNull Object target) {
            Object value;

            try {
                value = name == null ? resolver.resolve(key) : resolver.resolveByName(key, name);
            } catch (NotExistException | NameNotExistException e) {
                if (optional) {
                    return;
                }

                throw e;
            }

            if (value == null ? field.getType().isPrimitive() : !Types.wrap(field.getType()).isInstance(value)) {
                throw new ValidationException("unable to assign " + (value == null ? "null" : value.getClass().getName())
                        + " to field '" + field.getName() + "' of " + field.getDeclaringClass().getName());
            }

            try {
                field.set(target, value);
            } catch (IllegalAccessException e) {
                throw new ValidationException("Exception whilst setting the value of the field " + field.getName(), e);
            }
        }
    }
}
