package io.evitadb.porcelain.progress;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One phase of a git operation that reports progress.
 *
 * The title is everything before the last `": "` of a progress line, so for
 * `remote: Compressing objects:  14% (159/1133)` it is `remote: Compressing objects`. Weights are
 * relative to the other steps of the same parser.
 *
 * @param title  exact title of the progress lines of this phase
 * @param weight relative weight of this phase
 */
public record ProgressStep(
	@Nonnull String title,
	double weight
) {

	public ProgressStep {
		Objects.requireNonNull(title, "title must not be null");
		if (weight < 0 || Double.isNaN(weight)) {
			throw new IllegalArgumentException("weight must not be negative: " + weight);
		}
	}
}
