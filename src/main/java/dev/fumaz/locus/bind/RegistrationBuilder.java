package dev.fumaz.locus.bind;

import dev.fumaz.locus.container.Container;
import dev.fumaz.locus.invoke.Invocable;
import dev.fumaz.locus.provider.Factory;
import dev.fumaz.locus.type.TypeKey;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A {@link RegistrationBuilder} collects options for one registration and hands it to the {@link Container}.
 *
 * @param <T> the registered type
 */
public class RegistrationBuilder<T> {

    private final @NotNull Container container;
    private final @NotNull TypeKey key;
    private final @NotNull List<RegistrationOption> options = new ArrayList<>();
    private boolean replace = false;

    public RegistrationBuilder(@NotNull Container container, @NotNull TypeKey key) {
        this.container = Objects.requireNonNull(container, "container");
        this.key = Objects.requireNonNull(key, "key");
    }

    public RegistrationBuilder<T> named(@NotNull String name) {
        return with(RegistrationOption.named(name));
    }

    public RegistrationBuilder<T> lifetime(@NotNull Lifetime lifetime) {
        return with(RegistrationOption.lifetime(lifetime));
    }

    public RegistrationBuilder<T> asStatic() {
        return lifetime(Lifetime.STATIC);
    }

    public RegistrationBuilder<T> perRequest() {
        return lifetime(Lifetime.PER_REQUEST);
    }

    public RegistrationBuilder<T> with(@NotNull RegistrationOption option) {
        options.add(Objects.requireNonNull(option, "option"));
        return this;
    }

    /**
     * Replaces every existing registration of the type instead of adding to them.
     */
    public RegistrationBuilder<T> replacing() {
        this.replace = true;
        return this;
    }

    public void toInstance(@Nullable T instance) {
        if (replace) {
            container.replaceInstance(key, instance, options());
        } else {
            container.registerInstance(key, instance, options());
        }
    }

    public void toFactory(@NotNull Factory<? extends T> factory) {
        if (replace) {
            container.replaceDynamic(key, factory, options());
        } else {
            container.registerDynamic(key, factory, options());
        }
    }

    public void toConstructor(@NotNull Class<? extends T> implementation) {
        toConstructor(Invocable.constructorOf(implementation));
    }

    public void toConstructor(@NotNull Invocable invocable) {
        if (replace) {
            container.replaceConstructor(key, invocable, options());
        } else {
            container.registerConstructor(key, invocable, options());
        }
    }

    private RegistrationOption[] options() {
        return options.toArray(new RegistrationOption[0]);
    }
}
