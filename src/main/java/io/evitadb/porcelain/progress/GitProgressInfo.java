package io.evitadb.porcelain.progress;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A single decoded progress line.
 *
 * @param title   phase title, e.g. `Receiving objects`
 * @param value   processed units, 159 in `14% (159/1133)`
 * @param total   total units, null for value-only lines such as `Counting objects: 123`
 * @param percent percent printed by git, null for value-only lines
 * @param done    true when the line carries a trailing `done.`
 * @param text    the raw line
 */
public record GitProgressInfo(
	@Nonnull String title,
	long value,
	@Nullable Long total,
	@Nullable Integer percent,
	boolean done,
	@Nonnull String text
) {

	public GitProgressInfo {
		Objects.requireNonNull(title, "title must not be null");
		Objects.requireNonNull(text, "text must not be null");
	}
}
