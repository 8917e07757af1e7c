package dev.vct.testunit.check;

/**
 * Floating-point closeness tests.
 *
 * <p>The relative form treats two values as equal when they differ by at most four machine
 * epsilons of the larger magnitude. Identical values, including equal infinities, are always
 * equal; an infinity is never equal to any other value and NaN is never equal to anything.
 */
public final class Tolerance {
	private Tolerance() {}

	public static final float FLOAT_EPSILON = Math.ulp(1.0f);
	public static final double DOUBLE_EPSILON = Math.ulp(1.0);

	private static final int EPSILON_FACTOR = 4;

	public static boolean withinRelative(float a, float b) {
		if(a == b) {
			return true;
		}

		if(Float.isInfinite(a) || Float.isInfinite(b)) {
			return false;
		}

		float bound = EPSILON_FACTOR * FLOAT_EPSILON * Math.max(Math.abs(a), Math.abs(b));
		return Math.abs(a - b) <= bound;
	}

	public static boolean withinRelative(double a, double b) {
		if(a == b) {
			return true;
		}

		if(Double.isInfinite(a) || Double.isInfinite(b)) {
			return false;
		}

		double bound = EPSILON_FACTOR * DOUBLE_EPSILON * Math.max(Math.abs(a), Math.abs(b));
		return Math.abs(a - b) <= bound;
	}

	public static boolean withinAbsolute(double a, double b, double tolerance) {
		return Math.abs(a - b) <= tolerance;
	}

	public static boolean beyondAbsolute(double a, double b, double tolerance) {
		return Math.abs(a - b) > tolerance;
	}
}
