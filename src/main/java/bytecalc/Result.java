package bytecalc;

import java.util.function.Function;

/**
 * Outcome of an interpretation: either {@link Ok} with a value or {@link Err} with an error.
 */
public sealed interface Result<T, E> permits Result.Ok, Result.Err {

	record Ok<T, E>(T value) implements Result<T, E> {
	}

	record Err<T, E>(E error) implements Result<T, E> {
	}

	static <T, E> Result<T, E> ok(T value) {
		return new Ok<>(value);
	}

	static <T, E> Result<T, E> err(E error) {
		return new Err<>(error);
	}

	default boolean isOk() {
		return this instanceof Ok;
	}

	/**
	 * @throws IllegalStateException if this is an {@link Err}
	 */
	default T unwrap() {
		if (this instanceof Ok<T, E> ok) {
			return ok.value();
		}
		throw new IllegalStateException("called unwrap on " + this);
	}

	/**
	 * @throws IllegalStateException if this is an {@link Ok}
	 */
	default E unwrapErr() {
		if (this instanceof Err<T, E> err) {
			return err.error();
		}
		throw new IllegalStateException("called unwrapErr on " + this);
	}

	default <R> R fold(Function<? super T, ? extends R> onOk, Function<? super E, ? extends R> onErr) {
		if (this instanceof Ok<T, E> ok) {
			return onOk.apply(ok.value());
		}
		return onErr.apply(((Err<T, E>) this).error());
	}
}
