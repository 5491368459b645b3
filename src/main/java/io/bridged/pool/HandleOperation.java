package io.bridged.pool;

@FunctionalInterface
public interface HandleOperation<T> {
    T apply(Handle handle) throws Exception;
}
