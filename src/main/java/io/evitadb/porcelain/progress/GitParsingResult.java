package io.evitadb.porcelain.progress;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Outcome of feeding one line to a progress parser: either a recognized progress line or plain
 * context output. Both carry the overall percent of the operation.
 */
public sealed interface GitParsingResult permits GitParsingResult.GitProgress, GitParsingResult.GitOutput {

	/**
	 * Returns the overall completion of the operation, 0 to 100.
	 *
	 * @return overall percent
	 */
	int percent();

	/**
	 * A line recognized as progress of one of the known phases.
	 *
	 * @param percent overall percent, scaled across all phases
	 * @param details the decoded line; its own percent is local to the phase
	 */
	record GitProgress(int percent, @Nonnull GitProgressInfo details) implements GitParsingResult {

		public GitProgress {
			Objects.requireNonNull(details, "details must not be null");
		}
	}

	/**
	 * Any other line.
	 *
	 * @param percent last reported overall percent
	 * @param text    the raw line
	 */
	record GitOutput(int percent, @Nonnull String text) implements GitParsingResult {

		public GitOutput {
			Objects.requireNonNull(text, "text must not be null");
		}
	}
}
