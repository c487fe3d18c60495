package dev.fumaz.locus.bind;

/**
 * Controls whether a registration's value is memoized.
 */
public enum Lifetime {

    /**
     * The factory runs once; its value, or its failure, is reused for the life of the container.
     */
    STATIC,

    /**
     * The factory runs on every resolution.
     */
    PER_REQUEST

}
