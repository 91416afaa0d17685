package io.evitadb.porcelain.git;

import io.evitadb.porcelain.error.GitErrorKind;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Set;

/**
 * Tunes how a git invocation is judged.
 *
 * @param successExitCodes exit codes that count as success
 * @param expectedErrors   classified failures returned to the caller instead of thrown
 * @param stdin            text written to the standard input of the process, null for none
 */
public record GitExecutionOptions(
	@Nonnull Set<Integer> successExitCodes,
	@Nonnull Set<GitErrorKind> expectedErrors,
	@Nullable String stdin
) {

	private static final GitExecutionOptions DEFAULTS = new GitExecutionOptions(Set.of(0), Set.of(), null);

	public GitExecutionOptions {
		successExitCodes = Set.copyOf(Objects.requireNonNull(successExitCodes, "successExitCodes must not be null"));
		expectedErrors = Set.copyOf(Objects.requireNonNull(expectedErrors, "expectedErrors must not be null"));
		if (successExitCodes.isEmpty()) {
			throw new IllegalArgumentException("At least one success exit code is required");
		}
	}

	/**
	 * Returns options accepting only exit code 0.
	 *
	 * @return default options
	 */
	@Nonnull
	public static GitExecutionOptions defaults() {
		return DEFAULTS;
	}

	@Nonnull
	public GitExecutionOptions withSuccessExitCodes(@Nonnull Set<Integer> codes) {
		return new GitExecutionOptions(codes, this.expectedErrors, this.stdin);
	}

	@Nonnull
	public GitExecutionOptions withExpectedErrors(@Nonnull Set<GitErrorKind> errors) {
		return new GitExecutionOptions(this.successExitCodes, errors, this.stdin);
	}

	@Nonnull
	public GitExecutionOptions withStdin(@Nullable String input) {
		return new GitExecutionOptions(this.successExitCodes, this.expectedErrors, input);
	}
}
