package dev.vct.testunit.signal;

import org.jetbrains.annotations.Nullable;

/**
 * Base of the signals raised by the harness itself.
 * Any throwable that is not a {@code CaseSignal} is a foreign error.
 */
public abstract sealed class CaseSignal extends RuntimeException permits FailureSignal, SuccessSignal {
	protected CaseSignal(String message, @Nullable Throwable cause, boolean writableStackTrace) {
		super(message, cause, false, writableStackTrace);
	}
}
