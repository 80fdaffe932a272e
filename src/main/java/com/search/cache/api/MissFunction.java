package com.search.cache.api;

/**
 * Computes a value on a cache miss, typically by calling the search backend.
 * Whatever it throws reaches the caller of
 * {@link CacheFacade#getOrCompute(java.util.Map, java.time.Duration, MissFunction)} unchanged.
 *
 * @param <E> the checked exception the computation may throw
 */
@FunctionalInterface
public interface MissFunction<E extends Exception> {

    byte[] compute() throws E;
}
