package io.evitadb.porcelain.git;

import io.evitadb.porcelain.error.GitErrorKind;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Thrown when git exits with a code the caller did not accept.
 */
public final class GitCommandException extends IOException {

	@Nonnull
	private final List<String> args;
	@Nonnull
	private final GitResult result;

	public GitCommandException(@Nonnull List<String> args, @Nonnull GitResult result) {
		super(formatMessage(args, result));
		this.args = List.copyOf(Objects.requireNonNull(args, "args must not be null"));
		this.result = Objects.requireNonNull(result, "result must not be null");
	}

	@Nonnull
	private static String formatMessage(@Nonnull List<String> args, @Nonnull GitResult result) {
		final StringBuilder sb = new StringBuilder();
		sb.append("`git ").append(String.join(" ", args)).append("` exited with an unexpected code: ")
			.append(result.exitCode()).append('.');
		if (!result.stdout().isBlank()) {
			sb.append("\nstdout: ").append(result.stdout().strip());
		}
		if (!result.stderr().isBlank()) {
			sb.append("\nstderr: ").append(result.stderr().strip());
		}
		if (result.errorKind() != null) {
			sb.append("\n(The error was parsed as ").append(result.errorKind()).append(": ")
				.append(result.errorDescription() == null ? "no description" : result.errorDescription())
				.append(')');
		}
		return sb.toString();
	}

	@Nonnull
	public List<String> getArgs() {
		return this.args;
	}

	@Nonnull
	public GitResult getResult() {
		return this.result;
	}

	@Nullable
	public GitErrorKind getErrorKind() {
		return this.result.errorKind();
	}
}
