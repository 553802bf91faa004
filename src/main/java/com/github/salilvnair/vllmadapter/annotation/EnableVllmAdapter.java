package com.github.salilvnair.vllmadapter.annotation;

import com.github.salilvnair.vllmadapter.config.VllmAdapterAutoConfiguration;
import org.springframework.context.annotation.Import;
import java.lang.annotation.*;

/**
 * Imports the adapter configuration explicitly, for applications that do not rely on
 * auto-configuration.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(VllmAdapterAutoConfiguration.class)
public @interface EnableVllmAdapter {
}
