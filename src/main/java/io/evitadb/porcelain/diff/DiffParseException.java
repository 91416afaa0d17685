package io.evitadb.porcelain.diff;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Thrown when `git diff` output cannot be read as a unified diff.
 * Keeps the whole input and the 1-based number of the offending line.
 */
public final class DiffParseException extends Exception {

	@Nonnull
	private final String rawDiff;
	private final int lineNumber;

	public DiffParseException(@Nonnull String message, @Nonnull String rawDiff, int lineNumber) {
		this(message, rawDiff, lineNumber, null);
	}

	public DiffParseException(
		@Nonnull String message,
		@Nonnull String rawDiff,
		int lineNumber,
		@Nullable Throwable cause
	) {
		super(lineNumber > 0 ? message + " at line " + lineNumber : message, cause);
		this.rawDiff = Objects.requireNonNull(rawDiff, "rawDiff must not be null");
		this.lineNumber = lineNumber;
	}

	@Nonnull
	public String getRawDiff() {
		return this.rawDiff;
	}

	/**
	 * Returns the line number where parsing stopped.
	 *
	 * @return line number (1-based), or 0 if unknown
	 */
	public int getLineNumber() {
		return this.lineNumber;
	}

	/**
	 * Returns the text of the offending line.
	 *
	 * @return the line, or empty when the number is out of range
	 */
	@Nonnull
	public String getOffendingLine() {
		final String[] lines = this.rawDiff.split("\n", -1);
		return this.lineNumber > 0 && this.lineNumber <= lines.length ? lines[this.lineNumber - 1] : "";
	}
}
