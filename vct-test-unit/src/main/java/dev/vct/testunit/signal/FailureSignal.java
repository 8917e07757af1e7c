package dev.vct.testunit.signal;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Raised when a check does not hold. Unwinds the current case immediately.
 */
public final class FailureSignal extends CaseSignal {
	public FailureSignal(@NotNull Severity severity, String message) {
		this(severity, message, null);
	}

	public FailureSignal(@NotNull Severity severity, String message, @Nullable Throwable cause) {
		super(message, cause, true);
		this.severity = Objects.requireNonNull(severity, "severity");
	}

	private final Severity severity;

	public Severity getSeverity() {
		return severity;
	}

	/**
	 * Renders a foreign error for use as a failure message.
	 */
	public static String describe(Throwable error) {
		return error.toString();
	}

	@Override
	public String toString() {
		return "FailureSignal[" + severity + "]: " + getMessage();
	}
}
