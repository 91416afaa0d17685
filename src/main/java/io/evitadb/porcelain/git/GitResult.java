package io.evitadb.porcelain.git;

import io.evitadb.porcelain.error.GitErrorKind;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Outcome of a single git invocation.
 *
 * @param stdout           standard output decoded as UTF-8
 * @param stderr           standard error decoded as UTF-8
 * @param exitCode         process exit code
 * @param errorKind        classified failure, null when the command succeeded or the output was not recognized
 * @param errorDescription user-facing explanation of the failure, null when unknown
 */
public record GitResult(
	@Nonnull String stdout,
	@Nonnull String stderr,
	int exitCode,
	@Nullable GitErrorKind errorKind,
	@Nullable String errorDescription
) {

	public GitResult {
		Objects.requireNonNull(stdout, "stdout must not be null");
		Objects.requireNonNull(stderr, "stderr must not be null");
	}

	/**
	 * Returns stdout followed by stderr, separated by a newline when both are present.
	 *
	 * @return both outputs
	 */
	@Nonnull
	public String combinedOutput() {
		if (this.stdout.isEmpty()) {
			return this.stderr;
		}
		if (this.stderr.isEmpty()) {
			return this.stdout;
		}
		return this.stdout + "\n" + this.stderr;
	}
}
