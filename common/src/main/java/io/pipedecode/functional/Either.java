/*
 * Copyright (C) 2015-2018 SoftIndex LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.pipedecode.functional;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

import static io.pipedecode.util.Preconditions.checkState;

/**
 * A two-variant value: either a {@code Left} (conventionally the failure)
 * or a {@code Right} (conventionally the success).
 * <p>
 * Both variants may hold {@code null}. Instances are immutable.
 */
public final class Either<L, R> {
	@Nullable
	private final L left;

	@Nullable
	private final R right;

	private final boolean isRight; // so that this either supports nulls

	private Either(@Nullable L left, @Nullable R right, boolean isRight) {
		this.left = left;
		this.right = right;
		this.isRight = isRight;
	}

	public static <L, R> Either<L, R> left(@Nullable L left) {
		return new Either<>(left, null, false);
	}

	public static <L, R> Either<L, R> right(@Nullable R right) {
		return new Either<>(null, right, true);
	}

	public boolean isLeft() {
		return !isRight;
	}

	public boolean isRight() {
		return isRight;
	}

	@Nullable
	public L getLeft() {
		checkState(isLeft(), "Trying to get Left value from Right instance!");
		return left;
	}

	@Nullable
	public R getRight() {
		checkState(isRight(), "Trying to get Right value from Left instance!");
		return right;
	}

	@Nullable
	public R getRightOr(@Nullable R defaultValue) {
		return isRight ? right : defaultValue;
	}

	@Nullable
	public R getRightOrSupply(Supplier<? extends R> defaultValueSupplier) {
		return isRight ? right : defaultValueSupplier.get();
	}

	public <U> U reduce(Function<? super L, ? extends U> leftFn, Function<? super R, ? extends U> rightFn) {
		return isRight ? rightFn.apply(right) : leftFn.apply(left);
	}

	@SuppressWarnings("unchecked")
	public <T> Either<T, R> mapLeft(Function<? super L, ? extends T> function) {
		return isRight ?
				(Either<T, R>) this :
				new Either<>(function.apply(left), null, false);
	}

	@SuppressWarnings("unchecked")
	public <T> Either<L, T> mapRight(Function<? super R, ? extends T> function) {
		return isRight ?
				new Either<>(null, function.apply(right), true) :
				(Either<L, T>) this;
	}

	/**
	 * Applies the function to a {@code Right} value, short-circuiting on {@code Left}.
	 * The function is never invoked for a {@code Left} instance.
	 */
	@SuppressWarnings("unchecked")
	public <T> Either<L, T> flatMapRight(Function<? super R, Either<L, T>> function) {
		return isRight ?
				function.apply(right) :
				(Either<L, T>) this;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Either<?, ?> other = (Either<?, ?>) o;
		return isRight == other.isRight &&
				Objects.equals(left, other.left) &&
				Objects.equals(right, other.right);
	}

	@Override
	public int hashCode() {
		int hash = isRight ? 1 : 0;
		hash = 31 * hash + (left != null ? left.hashCode() : 0);
		hash = 31 * hash + (right != null ? right.hashCode() : 0);
		return hash;
	}

	@Override
	public String toString() {
		return isRight ? "Right{" + right + "}" : "Left{" + left + "}";
	}
}
