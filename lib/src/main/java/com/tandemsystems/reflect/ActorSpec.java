package com.tandemsystems.reflect;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a processor class to its message type explicitly, instead of the {@code <Processor>Msg} naming convention.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ActorSpec {

    /**
     * @return the sealed message interface the processor handles
     */
    Class<?> message();
}
