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

import org.junit.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.*;

public class EitherTest {
	@Test
	public void testRight() {
		Either<String, Integer> either = Either.right(1);

		assertTrue(either.isRight());
		assertFalse(either.isLeft());
		assertEquals(Integer.valueOf(1), either.getRight());
		assertEquals(Integer.valueOf(1), either.getRightOr(2));
		assertEquals("Right{1}", either.toString());
	}

	@Test
	public void testLeft() {
		Either<String, Integer> either = Either.left("error");

		assertTrue(either.isLeft());
		assertEquals("error", either.getLeft());
		assertEquals(Integer.valueOf(2), either.getRightOr(2));
		assertEquals(Integer.valueOf(3), either.getRightOrSupply(() -> 3));
		assertEquals("Left{error}", either.toString());
	}

	@Test
	public void testNullValues() {
		Either<String, Integer> right = Either.right(null);
		Either<String, Integer> left = Either.left(null);

		assertTrue(right.isRight());
		assertNull(right.getRight());
		assertTrue(left.isLeft());
		assertNotEquals(left, right);
	}

	@Test(expected = IllegalStateException.class)
	public void testGetRightOfLeft() {
		Either.left("error").getRight();
	}

	@Test(expected = IllegalStateException.class)
	public void testGetLeftOfRight() {
		Either.right(1).getLeft();
	}

	@Test
	public void testMapLeftKeepsVariant() {
		Either<Integer, String> mapped = Either.<String, String>left("abc").mapLeft(String::length);

		assertTrue(mapped.isLeft());
		assertEquals(Integer.valueOf(3), mapped.getLeft());
		assertEquals(Either.right("x"), Either.<String, String>right("x").mapLeft(String::length));
	}

	@Test
	public void testMapRight() {
		assertEquals(Either.right(4), Either.<String, Integer>right(2).mapRight(n -> n * 2));
		assertEquals(Either.left("e"), Either.<String, Integer>left("e").mapRight(n -> n * 2));
	}

	@Test
	public void testFlatMapRightShortCircuits() {
		AtomicBoolean called = new AtomicBoolean();
		Either<String, Integer> result = Either.<String, Integer>left("first")
				.flatMapRight(n -> {
					called.set(true);
					return Either.right(n + 1);
				});

		assertEquals(Either.left("first"), result);
		assertFalse(called.get());

		assertEquals(Either.left("second"), Either.<String, Integer>right(1).flatMapRight(n -> Either.left("second")));
		assertEquals(Either.right(2), Either.<String, Integer>right(1).flatMapRight(n -> Either.right(n + 1)));
	}

	@Test
	public void testReduce() {
		assertEquals("L:e", Either.<String, Integer>left("e").reduce(l -> "L:" + l, r -> "R:" + r));
		assertEquals("R:1", Either.<String, Integer>right(1).reduce(l -> "L:" + l, r -> "R:" + r));
	}

	@Test
	public void testEquality() {
		assertEquals(Either.right("a"), Either.right("a"));
		assertEquals(Either.right("a").hashCode(), Either.right("a").hashCode());
		assertNotEquals(Either.right("a"), Either.left("a"));
		assertNotEquals(Either.left("a"), Either.left("b"));
	}
}
