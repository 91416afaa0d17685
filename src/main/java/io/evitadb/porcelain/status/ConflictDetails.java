package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Describes a conflicted entry: the overall action and the state on our and their side.
 *
 * @param action summary of both sides
 * @param us     state of the file on our side
 * @param them   state of the file on their side
 */
public record ConflictDetails(
	@Nonnull UnmergedEntrySummary action,
	@Nonnull GitStatusEntry us,
	@Nonnull GitStatusEntry them
) {

	public ConflictDetails {
		Objects.requireNonNull(action, "action must not be null");
		Objects.requireNonNull(us, "us must not be null");
		Objects.requireNonNull(them, "them must not be null");
	}

	/**
	 * Returns true when both sides changed the file content, so the file carries conflict markers
	 * that can be resolved by editing.
	 *
	 * @return true for both-added and both-modified conflicts
	 */
	public boolean isTextConflict() {
		return this.action == UnmergedEntrySummary.BOTH_ADDED || this.action == UnmergedEntrySummary.BOTH_MODIFIED;
	}
}
