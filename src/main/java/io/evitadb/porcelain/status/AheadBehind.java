package io.evitadb.porcelain.status;

/**
 * Number of commits the local branch is ahead of and behind its upstream.
 *
 * @param ahead  commits present locally but not upstream
 * @param behind commits present upstream but not locally
 */
public record AheadBehind(
	int ahead,
	int behind
) {

	public AheadBehind {
		if (ahead < 0 || behind < 0) {
			throw new IllegalArgumentException("ahead and behind must not be negative");
		}
	}
}
