package io.evitadb.porcelain.progress;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Counts the `[branch sha] summary` lines git prints for every commit it cherry-picks.
 * Stateful: one instance per cherry-pick run.
 */
public final class CherryPickProgressParser {

	private static final Pattern PICKED_COMMIT_PATTERN = Pattern.compile("^\\[(.*\\s.*)\\]");

	@Nonnull
	private final List<CommitSummary> commits;
	private int count;

	/**
	 * @param commits commits being cherry-picked, in the order they are applied
	 */
	public CherryPickProgressParser(@Nonnull List<CommitSummary> commits) {
		this.commits = List.copyOf(Objects.requireNonNull(commits, "commits must not be null"));
	}

	/**
	 * Parses one line of cherry-pick output.
	 *
	 * @param line the raw line
	 * @return progress advanced by one commit, or empty for other lines
	 */
	@Nonnull
	public Optional<MultiCommitOperationProgress> parse(@Nonnull String line) {
		if (!PICKED_COMMIT_PATTERN.matcher(line).find()) {
			return Optional.empty();
		}

		this.count++;
		final int index = this.count - 1;
		final String summary = index < this.commits.size() ? this.commits.get(index).summary() : "";
		final double value = this.commits.isEmpty()
			? 0 : MultiCommitOperationProgress.formatValue((double) this.count / this.commits.size());

		return Optional.of(new MultiCommitOperationProgress(summary, this.count, this.commits.size(), value));
	}
}
