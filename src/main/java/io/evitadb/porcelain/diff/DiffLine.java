package io.evitadb.porcelain.diff;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Represents a single line in a unified diff hunk.
 *
 * @param type              the type of diff line
 * @param content           the line content without the prefix character; the full header for hunk lines
 * @param noTrailingNewLine true if the line is the last line of a file without a terminating newline
 */
public record DiffLine(
	@Nonnull DiffLineType type,
	@Nonnull String content,
	boolean noTrailingNewLine
) {

	public static final String NO_NEWLINE_MARKER = "\\ No newline at end of file";

	public DiffLine {
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(content, "content must not be null");
	}

	@Nonnull
	public static DiffLine context(@Nonnull String content) {
		return new DiffLine(DiffLineType.CONTEXT, content, false);
	}

	@Nonnull
	public static DiffLine add(@Nonnull String content) {
		return new DiffLine(DiffLineType.ADD, content, false);
	}

	@Nonnull
	public static DiffLine delete(@Nonnull String content) {
		return new DiffLine(DiffLineType.DELETE, content, false);
	}

	@Nonnull
	public static DiffLine hunk(@Nonnull String header) {
		return new DiffLine(DiffLineType.HUNK, header, false);
	}

	/**
	 * Returns a copy of this line flagged as missing the trailing newline.
	 *
	 * @return flagged line
	 */
	@Nonnull
	public DiffLine withNoTrailingNewLine() {
		return new DiffLine(this.type, this.content, true);
	}

	/**
	 * Returns true for add and delete lines, the only lines a user can select.
	 *
	 * @return true if the line is a change
	 */
	public boolean isChange() {
		return this.type == DiffLineType.ADD || this.type == DiffLineType.DELETE;
	}

	/**
	 * Returns the line as it appears in a unified diff, prefix included.
	 *
	 * @return the raw diff line
	 */
	@Nonnull
	public String toUnifiedDiffLine() {
		return switch (this.type) {
			case CONTEXT -> " " + this.content;
			case ADD -> "+" + this.content;
			case DELETE -> "-" + this.content;
			case HUNK -> this.content;
		};
	}
}
