package dev.vct.testunit.check;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Equality and ordering with the semantics of Java's operators.
 *
 * <p>When both operands are boxed primitive numbers (or characters) they are compared after
 * binary numeric promotion, as {@code ==} and {@code <} would compare the unboxed values:
 * {@code 1 == 1L}, {@code 0.0 == -0.0}, and NaN is unordered and unequal to everything.
 * Any other operands use {@link Objects#equals} and {@link Comparable#compareTo}.
 */
final class NaturalComparison {
	private NaturalComparison() {}

	static boolean equal(@Nullable Object a, @Nullable Object b) {
		if(isPrimitiveNumber(a) && isPrimitiveNumber(b)) {
			if(isFloating(a) || isFloating(b)) {
				return toDouble(a) == toDouble(b);
			}
			return toLong(a) == toLong(b);
		}

		return Objects.equals(a, b);
	}

	static <T extends Comparable<? super T>> boolean less(T a, T b) {
		if(isPrimitiveNumber(a) && isPrimitiveNumber(b)) {
			if(isFloating(a) || isFloating(b)) {
				return toDouble(a) < toDouble(b);
			}
			return toLong(a) < toLong(b);
		}

		return a.compareTo(b) < 0;
	}

	static <T extends Comparable<? super T>> boolean lessOrEqual(T a, T b) {
		if(isPrimitiveNumber(a) && isPrimitiveNumber(b)) {
			if(isFloating(a) || isFloating(b)) {
				return toDouble(a) <= toDouble(b);
			}
			return toLong(a) <= toLong(b);
		}

		return a.compareTo(b) <= 0;
	}

	private static boolean isPrimitiveNumber(@Nullable Object value) {
		return value instanceof Byte ||
			value instanceof Short ||
			value instanceof Integer ||
			value instanceof Long ||
			value instanceof Float ||
			value instanceof Double ||
			value instanceof Character;
	}

	private static boolean isFloating(Object value) {
		return value instanceof Float || value instanceof Double;
	}

	private static double toDouble(Object value) {
		if(value instanceof Character) {
			return (Character)value;
		}
		return ((Number)value).doubleValue();
	}

	private static long toLong(Object value) {
		if(value instanceof Character) {
			return (Character)value;
		}
		return ((Number)value).longValue();
	}
}
