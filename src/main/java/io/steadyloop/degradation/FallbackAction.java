package io.steadyloop.degradation;

@FunctionalInterface
public interface FallbackAction {
    Object run(String component, Throwable cause) throws Exception;
}
