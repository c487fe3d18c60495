package dev.fumaz.locus.annotation;

import java.lang.annotation.*;

/**
 * Marks a field to be assigned by the field injector, or the constructor to use when a class is registered
 * as a constructor.
 */
@Target({ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Inject {

    /**
     * An optional field is left untouched when nothing is registered for it.
     */
    boolean optional() default false;

}
