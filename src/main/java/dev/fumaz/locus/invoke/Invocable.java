package dev.fumaz.locus.invoke;

import dev.fumaz.locus.annotation.Inject;
import dev.fumaz.locus.exception.LocusException;
import dev.fumaz.locus.exception.ProvisionException;
import dev.fumaz.locus.exception.ValidationException;
import dev.fumaz.locus.type.TypeKey;
import dev.fumaz.locus.type.Types;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Something the invocation engine can call: a constructor, a static method, or an instance method bound to
 * its receiver.
 */
public final class Invocable {

    private final @NotNull Executable executable;
    private final @Nullable Object receiver;

    private Invocable(@NotNull Executable executable, @Nullable Object receiver) {
        this.executable = executable;
        this.receiver = receiver;
    }

    public static @NotNull Invocable of(@NotNull Constructor<?> constructor) {
        Objects.requireNonNull(constructor, "constructor");

        if (Modifier.isAbstract(constructor.getDeclaringClass().getModifiers())) {
            throw new ValidationException("Cannot invoke a constructor of abstract " + constructor.getDeclaringClass().getName());
        }

        return new Invocable(constructor, null);
    }

    public static @NotNull Invocable of(@NotNull Method method) {
        Objects.requireNonNull(method, "method");

        if (!Modifier.isStatic(method.getModifiers())) {
            throw new ValidationException("Instance method " + method.toGenericString() + " needs a receiver");
        }

        return new Invocable(method, null);
    }

    public static @NotNull Invocable of(@NotNull Object receiver, @NotNull Method method) {
        Objects.requireNonNull(receiver, "receiver");
        Objects.requireNonNull(method, "method");

        if (Modifier.isStatic(method.getModifiers())) {
            return new Invocable(method, null);
        }

        if (!method.getDeclaringClass().isInstance(receiver)) {
            throw new ValidationException(receiver.getClass().getName() + " does not declare " + method.toGenericString());
        }

        if (Modifier.isAbstract(method.getModifiers())) {
            throw new ValidationException("Cannot invoke abstract method " + method.toGenericString());
        }

        return new Invocable(method, receiver);
    }

    /**
     * Picks the constructor used to build {@code type}: the one annotated with {@link Inject}, else the only
     * declared constructor, else the no-argument constructor.
     */
    public static @NotNull Invocable constructorOf(@NotNull Class<?> type) {
        Objects.requireNonNull(type, "type");

        if (type.isInterface() || type.isPrimitive() || type.isArray() || Modifier.isAbstract(type.getModifiers())) {
            throw new ValidationException(type.getName() + " cannot be constructed");
        }

        Constructor<?>[] constructors = type.getDeclaredConstructors();
        List<Constructor<?>> annotated = new ArrayList<>();

        for (Constructor<?> constructor : constructors) {
            if (constructor.isAnnotationPresent(Inject.class)) {
                annotated.add(constructor);
            }
        }

        if (annotated.size() > 1) {
            throw new ValidationException(type.getName() + " has more than one @Inject constructor");
        }

        if (annotated.size() == 1) {
            return of(annotated.get(0));
        }

        if (constructors.length == 1) {
            return of(constructors[0]);
        }

        for (Constructor<?> constructor : constructors) {
            if (constructor.getParameterCount() == 0) {
                return of(constructor);
            }
        }

        throw new ValidationException(type.getName() + " has several constructors; mark one with @Inject");
    }

    /**
     * Adapts any supported callable: an {@link Invocable}, a static {@link Method}, a {@link Constructor},
     * a {@link Class} to construct, or an object whose class declares exactly one public method.
     * Lambdas are refused because their parameter types are erased.
     */
    public static @NotNull Invocable from(@NotNull Object callable) {
        Objects.requireNonNull(callable, "callable");

        if (callable instanceof Invocable) {
            return (Invocable) callable;
        }

        if (callable instanceof Method) {
            return of((Method) callable);
        }

        if (callable instanceof Constructor) {
            return of((Constructor<?>) callable);
        }

        if (callable instanceof Class) {
            return constructorOf((Class<?>) callable);
        }

        Class<?> type = callable.getClass();

        if (type.isSynthetic() || type.isHidden()) {
            throw new ValidationException(type.getName() + " is a lambda; its parameter types are not available, "
                    + "pass a Method or an object with a single public method instead");
        }

        Method candidate = null;

        for (Method method : type.getDeclaredMethods()) {
            int modifiers = method.getModifiers();

            if (!Modifier.isPublic(modifiers) || Modifier.isStatic(modifiers) || method.isSynthetic() || method.isBridge()) {
                continue;
            }

            if (candidate != null) {
                throw new ValidationException(type.getName() + " is not invocable: it declares more than one public method");
            }

            candidate = method;
        }

        if (candidate == null) {
            throw new ValidationException(type.getName() + " is not invocable: it declares no public method");
        }

        return of(callable, candidate);
    }

    public @NotNull Executable getExecutable() {
        return executable;
    }

    public @Nullable Object getReceiver() {
        return receiver;
    }

    public @NotNull Parameter[] getParameters() {
        return executable.getParameters();
    }

    public boolean isVarArgs() {
        return executable.isVarArgs();
    }

    public @NotNull Type getReturnType() {
        if (executable instanceof Method) {
            return ((Method) executable).getGenericReturnType();
        }

        return executable.getDeclaringClass();
    }

    public boolean returnsVoid() {
        Type returnType = getReturnType();
        return returnType == void.class || returnType == Void.class;
    }

    /**
     * The key a constructor registration of this callable is stored under.
     *
     * @throws ValidationException if the callable cannot back a registration
     */
    public @NotNull TypeKey getConstructedKey() {
        if (returnsVoid()) {
            throw new ValidationException(describe() + " must have a return value");
        }

        Type returnType = getReturnType();

        if (Throwable.class.isAssignableFrom(Types.rawType(returnType))) {
            throw new ValidationException(describe() + " must return a value, not only an error");
        }

        if (!Types.isFullySpecified(returnType)) {
            throw new ValidationException(describe() + " has a return type with type variables or wildcards");
        }

        return TypeKey.of(returnType);
    }

    /**
     * Calls the executable with already bound arguments. Failures of the callable itself are wrapped in a
     * {@link ProvisionException}; container failures raised from inside it are rethrown as they are.
     */
    public @Nullable Object call(@NotNull Object[] arguments) {
        try {
            if (!executable.trySetAccessible()) {
                throw new ValidationException(describe() + " is not accessible");
            }

            if (executable instanceof Constructor) {
                return ((Constructor<?>) executable).newInstance(arguments);
            }

            return ((Method) executable).invoke(receiver, arguments);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();

            if (cause instanceof LocusException) {
                throw (LocusException) cause;
            }

            if (cause instanceof Error) {
                throw (Error) cause;
            }

            throw new ProvisionException(describe() + " failed", cause);
        } catch (IllegalAccessException | InstantiationException | IllegalArgumentException e) {
            throw new ValidationException("Exception whilst invoking " + describe(), e);
        }
    }

    public @NotNull String describe() {
        return executable.toGenericString();
    }

    @Override
    public String toString() {
        return describe();
    }
}
