/**
 * Engine orchestration package.
 *
 * <p>{@link io.steadyloop.runtime.SteadyLoopEngine} owns the protected execution path for inline
 * actions and the worker-side processing of queued tasks. It is constructed explicitly; nothing in
 * this package is a process-wide singleton.
 */
package io.steadyloop.runtime;
