package io.evitadb.porcelain.progress;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the `Rebasing (i/n)` lines of an interactive or plain rebase.
 */
public final class RebaseProgressParser {

	private static final Pattern REBASING_PATTERN = Pattern.compile("Rebasing \\((\\d+)/(\\d+)\\)");

	@Nonnull
	private final List<CommitSummary> commits;

	/**
	 * @param commits commits being rebased, in the order they are applied
	 */
	public RebaseProgressParser(@Nonnull List<CommitSummary> commits) {
		this.commits = List.copyOf(Objects.requireNonNull(commits, "commits must not be null"));
	}

	/**
	 * Parses one line of rebase output.
	 *
	 * @param line the raw line
	 * @return progress for `Rebasing` lines, empty otherwise
	 */
	@Nonnull
	public Optional<MultiCommitOperationProgress> parse(@Nonnull String line) {
		final Matcher matcher = REBASING_PATTERN.matcher(line);
		if (!matcher.find()) {
			return Optional.empty();
		}

		final int position;
		final int total;
		try {
			position = Integer.parseInt(matcher.group(1));
			total = Integer.parseInt(matcher.group(2));
		} catch (NumberFormatException e) {
			return Optional.empty();
		}

		final String summary = position >= 1 && position <= this.commits.size()
			? this.commits.get(position - 1).summary() : "";
		final double value = total > 0 ? MultiCommitOperationProgress.formatValue((double) position / total) : 0;

		return Optional.of(new MultiCommitOperationProgress(summary, position, total, value));
	}
}
