package com.example.signage.shared.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface Monitored {
    /**
     * Operation category used in the metric name, e.g. "service" gives
     * {@code signage.service.latency} and {@code signage.service.calls}.
     */
    String value();
}
