package io.evitadb.porcelain.progress;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * The identity and subject line of a commit taking part in a multi-commit operation.
 *
 * @param sha     commit hash
 * @param summary first line of the commit message
 */
public record CommitSummary(
	@Nonnull String sha,
	@Nonnull String summary
) {

	public CommitSummary {
		Objects.requireNonNull(sha, "sha must not be null");
		Objects.requireNonNull(summary, "summary must not be null");
	}
}
