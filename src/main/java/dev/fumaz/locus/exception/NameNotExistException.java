package dev.fumaz.locus.exception;

import dev.fumaz.locus.type.TypeKey;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when the type is registered but none of its registrations carries the requested name.
 */
public class NameNotExistException extends LocusException {

    private final @NotNull TypeKey key;
    private final @NotNull String name;

    public NameNotExistException(@NotNull TypeKey key, @NotNull String name) {
        super("item with the name '" + name + "' does not exist in the container for '" + key + "'");
        this.key = key;
        this.name = name;
    }

    public @NotNull TypeKey getKey() {
        return key;
    }

    public @NotNull String getName() {
        return name;
    }
}
