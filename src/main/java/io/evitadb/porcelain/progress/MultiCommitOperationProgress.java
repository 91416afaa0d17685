package io.evitadb.porcelain.progress;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Progress of an operation replaying several commits, such as rebase or cherry-pick.
 *
 * @param currentCommitSummary summary of the commit being applied, empty when unknown
 * @param position             1-based position of that commit
 * @param totalCommitCount     number of commits in the operation
 * @param value                completed fraction between 0 and 1, rounded to two decimals
 */
public record MultiCommitOperationProgress(
	@Nonnull String currentCommitSummary,
	int position,
	int totalCommitCount,
	double value
) {

	public MultiCommitOperationProgress {
		Objects.requireNonNull(currentCommitSummary, "currentCommitSummary must not be null");
	}

	/**
	 * Clamps a fraction to [0, 1] and rounds it to two decimal places.
	 *
	 * @param value raw fraction
	 * @return normalized fraction
	 */
	public static double formatValue(double value) {
		if (Double.isNaN(value)) {
			return 0;
		}
		final double clamped = Math.max(0, Math.min(value, 1));
		return Math.round(clamped * 100) / 100.0;
	}
}
