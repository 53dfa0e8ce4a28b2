package io.github.hongjungwan.actionlog.api;

/**
 * Unit of work run inside an action's context.
 *
 * @param <T> result type
 * @param <E> checked exception the body may throw
 */
@FunctionalInterface
public interface ActionBody<T, E extends Throwable> {

    T call() throws E;
}
