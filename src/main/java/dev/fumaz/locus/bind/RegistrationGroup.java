package dev.fumaz.locus.bind;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The registrations of one type: anonymous ones in insertion order, and named ones by name.
 * <p>
 * Groups are immutable; {@link #with(Registration)} returns a new group. Registering a name that already
 * exists replaces that entry in place, keeping its position among the named entries.
 */
public final class RegistrationGroup {

    private static final RegistrationGroup EMPTY = new RegistrationGroup(Collections.emptyList(), Collections.emptyMap());

    private final @NotNull List<Registration> anonymous;
    private final @NotNull Map<String, Registration> named;

    private RegistrationGroup(@NotNull List<Registration> anonymous, @NotNull Map<String, Registration> named) {
        this.anonymous = anonymous;
        this.named = named;
    }

    public static @NotNull RegistrationGroup empty() {
        return EMPTY;
    }

    public static @NotNull RegistrationGroup of(@NotNull Registration registration) {
        return EMPTY.with(registration);
    }

    public @NotNull RegistrationGroup with(@NotNull Registration registration) {
        if (!registration.getOptions().isNamed()) {
            List<Registration> items = new ArrayList<>(anonymous.size() + 1);
            items.addAll(anonymous);
            items.add(registration);

            return new RegistrationGroup(Collections.unmodifiableList(items), named);
        }

        Map<String, Registration> items = new LinkedHashMap<>(named);
        items.put(registration.getName(), registration);

        return new RegistrationGroup(anonymous, Collections.unmodifiableMap(items));
    }

    public @NotNull List<Registration> getAnonymous() {
        return anonymous;
    }

    public @NotNull Map<String, Registration> getNamed() {
        return named;
    }

    public @Nullable Registration getNamed(@NotNull String name) {
        return named.get(name);
    }

    /**
     * The registration a single resolution uses: the last anonymous one, or when there is none, the most
     * recently inserted named one.
     */
    public @Nullable Registration primary() {
        if (!anonymous.isEmpty()) {
            return anonymous.get(anonymous.size() - 1);
        }

        Registration last = null;

        for (Registration registration : named.values()) {
            last = registration;
        }

        return last;
    }

    /**
     * Named registrations first, then anonymous ones, each in insertion order.
     */
    public @NotNull List<Registration> all() {
        List<Registration> all = new ArrayList<>(size());
        all.addAll(named.values());
        all.addAll(anonymous);

        return all;
    }

    public int size() {
        return anonymous.size() + named.size();
    }

    public boolean isEmpty() {
        return anonymous.isEmpty() && named.isEmpty();
    }
}
