package com.flashkit.hexbench.core.result;

import com.flashkit.hexbench.types.ErrorKind;

import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a fallible editor operation. Callers branch on the variant
 * instead of catching exceptions.
 */
public sealed interface Outcome<T> {

    record Ok<T>(T value) implements Outcome<T> {}

    record Failed<T>(EditorError error) implements Outcome<T> {}

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static Outcome<Void> done() {
        return new Ok<>(null);
    }

    static <T> Outcome<T> failed(EditorError error) {
        return new Failed<>(error);
    }

    static <T> Outcome<T> failed(ErrorKind kind, String message) {
        return new Failed<>(EditorError.of(kind, message));
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default Optional<EditorError> failure() {
        if (this instanceof Failed<T> failed) {
            return Optional.of(failed.error());
        }
        return Optional.empty();
    }

    /**
     * Returns the value, or throws {@link HexbenchException} carrying the error.
     */
    default T orElseThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        throw new HexbenchException(((Failed<T>) this).error());
    }

    default <R> Outcome<R> map(Function<? super T, ? extends R> fn) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(fn.apply(ok.value()));
        }
        return new Failed<>(((Failed<T>) this).error());
    }
}
