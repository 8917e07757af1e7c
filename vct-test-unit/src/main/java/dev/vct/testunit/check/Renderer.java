package dev.vct.testunit.check;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * Renders check operands for failure messages.
 */
final class Renderer {
	private Renderer() {}

	static String render(@Nullable Object value) {
		if(value == null) {
			return "null";
		}

		try {
			if(value instanceof CharSequence) {
				return "\"" + value + "\"";
			}

			if(value instanceof Character) {
				return "'" + value + "'";
			}

			if(value.getClass().isArray()) {
				String wrapped = Arrays.deepToString(new Object[] { value });
				return wrapped.substring(1, wrapped.length() - 1);
			}

			return value.toString();
		}
		catch(RuntimeException e) {
			return "<" + value.getClass().getName() + ">";
		}
	}

	/**
	 * String coercion used by the string checks; unlike {@link #render} it does not quote.
	 */
	static String text(@Nullable Object value) {
		try {
			return String.valueOf(value);
		}
		catch(RuntimeException e) {
			return "<" + value.getClass().getName() + ">";
		}
	}
}
