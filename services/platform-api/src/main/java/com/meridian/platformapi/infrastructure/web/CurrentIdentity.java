package com.meridian.platformapi.infrastructure.web;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Injects the caller's {@link com.meridian.security.identity.Identity} into a controller
 * method parameter.
 *
 * <p>With {@code required = true} (the default) a missing, invalid or disabled token ends the
 * request with 401. With {@code required = false} the parameter is {@code null} instead.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface CurrentIdentity {

    boolean required() default true;
}
