package dev.fumaz.locus.annotation;

import java.lang.annotation.*;

/**
 * Binds a field or parameter to the registration with the given name.
 */
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Named {

    String value();

}
