package dev.fumaz.locus.bind;

import dev.fumaz.locus.type.TypeKey;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds one {@link RegistrationGroup} per {@link TypeKey}. Every mutation swaps the group of a key atomically,
 * so readers always see a consistent snapshot.
 */
public final class RegistrationRegistry {

    private final Map<TypeKey, RegistrationGroup> groups = new ConcurrentHashMap<>();

    public void add(@NotNull Registration registration) {
        groups.compute(registration.getKey(), (key, group) -> group == null
                ? RegistrationGroup.of(registration)
                : group.with(registration));
    }

    public void replace(@NotNull Registration registration) {
        groups.put(registration.getKey(), RegistrationGroup.of(registration));
    }

    public @Nullable RegistrationGroup remove(@NotNull TypeKey key) {
        return groups.remove(key);
    }

    public @Nullable RegistrationGroup find(@NotNull TypeKey key) {
        return groups.get(key);
    }

    public boolean contains(@NotNull TypeKey key) {
        return groups.containsKey(key);
    }

    public @NotNull List<TypeKey> keys() {
        return new ArrayList<>(groups.keySet());
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
