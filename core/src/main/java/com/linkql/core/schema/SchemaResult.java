package com.linkql.core.schema;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a schema-construction step: either the built value or the {@link SchemaError} that
 * prevented it.
 */
public sealed interface SchemaResult<T> {

    static <T> SchemaResult<T> built(T value) {
        return new Built<>(value);
    }

    static <T> SchemaResult<T> failed(SchemaError error) {
        return new Failed<>(error);
    }

    static <T> SchemaResult<T> fromOptional(Optional<T> value, SchemaError ifEmpty) {
        return value.<SchemaResult<T>>map(SchemaResult::built).orElseGet(() -> failed(ifEmpty));
    }

    <R> R fold(Function<SchemaError, R> onError, Function<T, R> onValue);

    default <R> SchemaResult<R> map(Function<T, R> mapper) {
        return fold(SchemaResult::failed, value -> built(mapper.apply(value)));
    }

    default <R> SchemaResult<R> flatMap(Function<T, SchemaResult<R>> mapper) {
        return fold(SchemaResult::failed, mapper);
    }

    default boolean isBuilt() {
        return fold(error -> false, value -> true);
    }

    default Optional<T> toOptional() {
        return fold(error -> Optional.empty(), Optional::of);
    }

    default Optional<SchemaError> failure() {
        return fold(Optional::of, value -> Optional.empty());
    }

    default void accept(Consumer<SchemaError> onError, Consumer<T> onValue) {
        fold(error -> {
            onError.accept(error);
            return null;
        }, value -> {
            onValue.accept(value);
            return null;
        });
    }

    default T orElseThrow() {
        return fold(error -> {
            throw new SchemaGenerationException(error.message());
        }, value -> value);
    }

    record Built<T>(T value) implements SchemaResult<T> {
        @Override
        public <R> R fold(Function<SchemaError, R> onError, Function<T, R> onValue) {
            return onValue.apply(value);
        }
    }

    record Failed<T>(SchemaError error) implements SchemaResult<T> {
        @Override
        public <R> R fold(Function<SchemaError, R> onError, Function<T, R> onValue) {
            return onError.apply(error);
        }
    }
}
