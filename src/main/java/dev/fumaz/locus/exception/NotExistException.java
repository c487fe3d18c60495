package dev.fumaz.locus.exception;

import dev.fumaz.locus.type.TypeKey;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when nothing is registered for the requested type.
 */
public class NotExistException extends LocusException {

    private final @NotNull TypeKey key;

    public NotExistException(@NotNull TypeKey key) {
        super("item does not exist in the container: '" + key + "'");
        this.key = key;
    }

    public @NotNull TypeKey getKey() {
        return key;
    }
}
