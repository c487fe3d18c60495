package dev.fumaz.locus.module;

import dev.fumaz.locus.container.Container;
import org.jetbrains.annotations.NotNull;

/**
 * A {@link Module} is a reusable set of registrations.
 */
@FunctionalInterface
public interface Module {

    void configure(@NotNull Container container);

}
