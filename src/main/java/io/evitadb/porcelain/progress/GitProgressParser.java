package io.evitadb.porcelain.progress;

import io.evitadb.porcelain.progress.GitParsingResult.GitOutput;
import io.evitadb.porcelain.progress.GitParsingResult.GitProgress;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the progress lines git writes to stderr into an estimate of overall completion of an
 * operation consisting of several weighted phases.
 *
 * Phases are expected in order but some may never appear (a server may skip compression). Once a line
 * of a phase is seen, all earlier phases count as complete. The reported percent never decreases.
 *
 * An instance tracks a single stream and must not be reused or shared between threads.
 */
public final class GitProgressParser {

	private static final String TITLE_SEPARATOR = ": ";
	private static final String DONE_MARKER = "done.";
	private static final Pattern PERCENT_PATTERN = Pattern.compile("^(\\d{1,3})% \\((\\d+)/(\\d+)\\)$");
	private static final Pattern VALUE_ONLY_PATTERN = Pattern.compile("^\\d+$");

	@Nonnull
	private final List<ProgressStep> steps;
	private int stepIndex = 0;
	private int lastPercent = 0;

	/**
	 * Creates a parser for the given phases.
	 *
	 * @param steps phases in the order git reports them
	 * @throws IllegalArgumentException if no step is given or the weights sum to zero
	 */
	public GitProgressParser(@Nonnull List<ProgressStep> steps) {
		Objects.requireNonNull(steps, "steps must not be null");
		if (steps.isEmpty()) {
			throw new IllegalArgumentException("Must specify at least one step");
		}

		double totalWeight = 0;
		for (final ProgressStep step : steps) {
			totalWeight += step.weight();
		}
		if (totalWeight <= 0) {
			throw new IllegalArgumentException("Total step weight must be positive");
		}

		final List<ProgressStep> scaled = new ArrayList<>(steps.size());
		for (final ProgressStep step : steps) {
			scaled.add(new ProgressStep(step.title(), step.weight() / totalWeight));
		}
		this.steps = List.copyOf(scaled);
	}

	/**
	 * Feeds one line of output.
	 *
	 * @param line a single line without the line terminator
	 * @return progress for lines of a known current or later phase, context otherwise
	 */
	@Nonnull
	public GitParsingResult parse(@Nonnull String line) {
		Objects.requireNonNull(line, "line must not be null");

		final GitProgressInfo progress = parseProgressLine(line);
		if (progress == null) {
			return new GitOutput(this.lastPercent, line);
		}

		double accumulated = 0;
		for (int i = 0; i < this.steps.size(); i++) {
			final ProgressStep step = this.steps.get(i);
			if (i >= this.stepIndex && progress.title().equals(step.title())) {
				final Long total = progress.total();
				if (total != null && total > 0) {
					accumulated += step.weight() * progress.value() / total;
				}

				this.stepIndex = i;
				this.lastPercent = Math.max(this.lastPercent, (int) Math.floor(accumulated * 100));
				return new GitProgress(this.lastPercent, progress);
			}
			accumulated += step.weight();
		}

		return new GitOutput(this.lastPercent, line);
	}

	/**
	 * Returns the last reported overall percent.
	 *
	 * @return percent between 0 and 100
	 */
	public int getLastPercent() {
		return this.lastPercent;
	}

	/**
	 * Decodes a single progress line without touching any parser state.
	 *
	 * @param line the raw line
	 * @return the decoded line, or null if it is not a progress line
	 */
	@Nullable
	public static GitProgressInfo parseProgressLine(@Nonnull String line) {
		final int separator = line.lastIndexOf(TITLE_SEPARATOR);
		if (separator <= 0) {
			return null;
		}

		final String title = line.substring(0, separator);
		final String progressText = line.substring(separator + TITLE_SEPARATOR.length()).trim();
		if (progressText.isEmpty()) {
			return null;
		}

		final List<String> parts = new ArrayList<>();
		for (final String part : progressText.split(",")) {
			final String trimmed = part.trim();
			if (!trimmed.isEmpty()) {
				parts.add(trimmed);
			}
		}
		if (parts.isEmpty()) {
			return null;
		}

		final String first = parts.get(0);
		final long value;
		Long total = null;
		Integer percent = null;
		try {
			if (VALUE_ONLY_PATTERN.matcher(first).matches()) {
				value = Long.parseLong(first);
			} else {
				final Matcher matcher = PERCENT_PATTERN.matcher(first);
				if (!matcher.matches()) {
					return null;
				}
				percent = Integer.parseInt(matcher.group(1));
				value = Long.parseLong(matcher.group(2));
				total = Long.parseLong(matcher.group(3));
			}
		} catch (NumberFormatException e) {
			// counters beyond long range are not progress we can scale
			return null;
		}

		boolean done = false;
		for (int i = 1; i < parts.size(); i++) {
			if (DONE_MARKER.equals(parts.get(i))) {
				done = true;
				break;
			}
		}

		return new GitProgressInfo(title, value, total, percent, done, line);
	}
}
