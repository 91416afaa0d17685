package io.evitadb.porcelain.progress;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Phases reported by the network and checkout commands, with their relative weights.
 */
public final class ProgressSteps {

	public static final String REMOTE_COMPRESSING_OBJECTS = "remote: Compressing objects";
	public static final String RECEIVING_OBJECTS = "Receiving objects";
	public static final String RESOLVING_DELTAS = "Resolving deltas";
	public static final String CHECKING_OUT_FILES = "Checking out files";
	public static final String COMPRESSING_OBJECTS = "Compressing objects";
	public static final String WRITING_OBJECTS = "Writing objects";
	public static final String REMOTE_RESOLVING_DELTAS = "remote: Resolving deltas";

	public static final List<ProgressStep> CLONE = List.of(
		new ProgressStep(REMOTE_COMPRESSING_OBJECTS, 0.1),
		new ProgressStep(RECEIVING_OBJECTS, 0.6),
		new ProgressStep(RESOLVING_DELTAS, 0.1),
		new ProgressStep(CHECKING_OUT_FILES, 0.2)
	);

	public static final List<ProgressStep> FETCH = List.of(
		new ProgressStep(REMOTE_COMPRESSING_OBJECTS, 0.1),
		new ProgressStep(RECEIVING_OBJECTS, 0.7),
		new ProgressStep(RESOLVING_DELTAS, 0.2)
	);

	public static final List<ProgressStep> PULL = List.of(
		new ProgressStep(REMOTE_COMPRESSING_OBJECTS, 0.1),
		new ProgressStep(RECEIVING_OBJECTS, 0.7),
		new ProgressStep(RESOLVING_DELTAS, 0.15),
		new ProgressStep(CHECKING_OUT_FILES, 0.15)
	);

	public static final List<ProgressStep> PUSH = List.of(
		new ProgressStep(COMPRESSING_OBJECTS, 0.2),
		new ProgressStep(WRITING_OBJECTS, 0.7),
		new ProgressStep(REMOTE_RESOLVING_DELTAS, 0.1)
	);

	public static final List<ProgressStep> CHECKOUT = List.of(
		new ProgressStep(CHECKING_OUT_FILES, 1)
	);

	private ProgressSteps() {
	}

	/**
	 * Creates a fresh parser for one of the step sets of this class.
	 *
	 * @param steps the step set
	 * @return a new parser
	 */
	@Nonnull
	public static GitProgressParser parserFor(@Nonnull List<ProgressStep> steps) {
		return new GitProgressParser(steps);
	}
}
