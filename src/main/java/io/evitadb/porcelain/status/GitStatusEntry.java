package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * State of one side (index or working tree) of a file as reported by git status.
 */
public enum GitStatusEntry {

	MODIFIED('M'),
	ADDED('A'),
	DELETED('D'),
	RENAMED('R'),
	COPIED('C'),
	UNCHANGED('.'),
	UNTRACKED('?'),
	IGNORED('!'),
	UPDATED_BUT_UNMERGED('U');

	private final char code;

	GitStatusEntry(char code) {
		this.code = code;
	}

	/**
	 * Returns the single character git uses for this state.
	 *
	 * @return status character
	 */
	public char getCode() {
		return this.code;
	}

	/**
	 * Looks up the state for a status character.
	 *
	 * @param code status character
	 * @return matching state, or empty for unknown characters
	 */
	@Nonnull
	public static Optional<GitStatusEntry> fromCode(char code) {
		for (final GitStatusEntry entry : values()) {
			if (entry.code == code) {
				return Optional.of(entry);
			}
		}
		return Optional.empty();
	}
}
