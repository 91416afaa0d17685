package io.evitadb.porcelain.git;

import io.evitadb.porcelain.error.GitErrorKind;
import io.evitadb.porcelain.error.GitErrorTaxonomy;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs the `git` executable in a repository and interprets its exit status.
 *
 * Commands run with `TERM=dumb` and `GIT_TERMINAL_PROMPT=0` so git neither colors output nor waits for
 * credentials on a terminal. Failures are classified with {@link GitErrorTaxonomy}; a failure listed as
 * expected is handed back in the {@link GitResult}, any other one raises {@link GitCommandException}.
 */
public final class GitProcess {

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

	@Nonnull
	private final Path repositoryRoot;
	@Nonnull
	private final Duration timeout;
	@Nonnull
	private final GitErrorTaxonomy taxonomy;
	@Nonnull
	private final Log log;

	public GitProcess(@Nonnull Path repositoryRoot) {
		this(repositoryRoot, DEFAULT_TIMEOUT, new GitErrorTaxonomy(), new SystemStreamLog());
	}

	/**
	 * Creates a runner for the specified repository root.
	 *
	 * @param repositoryRoot working directory of every command
	 * @param timeout        maximum run time of a single command
	 * @param taxonomy       classifier of failures
	 * @param log            the Maven log
	 */
	public GitProcess(
		@Nonnull Path repositoryRoot,
		@Nonnull Duration timeout,
		@Nonnull GitErrorTaxonomy taxonomy,
		@Nonnull Log log
	) {
		Objects.requireNonNull(repositoryRoot, "repositoryRoot must not be null");
		this.repositoryRoot = repositoryRoot.toAbsolutePath().normalize();
		this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
		this.taxonomy = Objects.requireNonNull(taxonomy, "taxonomy must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		if (timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeout must be positive: " + timeout);
		}
	}

	@Nonnull
	public Path getRepositoryRoot() {
		return this.repositoryRoot;
	}

	/**
	 * Runs git with default options.
	 *
	 * @param args arguments without the leading `git`
	 * @return the result
	 * @throws IOException if the process cannot run or exits with an unexpected code
	 */
	@Nonnull
	public GitResult execute(@Nonnull List<String> args) throws IOException {
		return execute(args, GitExecutionOptions.defaults());
	}

	/**
	 * Runs git and judges the outcome.
	 *
	 * @param args    arguments without the leading `git`
	 * @param options accepted exit codes, expected errors and standard input
	 * @return the result; carries the error kind when a failure was expected
	 * @throws GitCommandException if the exit code is not accepted and the failure is not expected
	 * @throws IOException         if the process cannot start, times out or is interrupted
	 */
	@Nonnull
	public GitResult execute(@Nonnull List<String> args, @Nonnull GitExecutionOptions options) throws IOException {
		Objects.requireNonNull(args, "args must not be null");
		Objects.requireNonNull(options, "options must not be null");

		final List<String> command = new ArrayList<>(args.size() + 1);
		command.add("git");
		command.addAll(args);

		final ProcessBuilder processBuilder = new ProcessBuilder(command);
		processBuilder.directory(this.repositoryRoot.toFile());
		processBuilder.redirectErrorStream(false);
		processBuilder.environment().put("TERM", "dumb");
		processBuilder.environment().put("GIT_TERMINAL_PROMPT", "0");

		if (this.log.isDebugEnabled()) {
			this.log.debug("Running git " + String.join(" ", args) + " in " + this.repositoryRoot);
		}

		final Process process = processBuilder.start();
		final CompletableFuture<String> stdoutFuture = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
		final CompletableFuture<String> stderrFuture = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));

		writeStdin(process, options.stdin());

		final int exitCode;
		final String stdout;
		final String stderr;
		try {
			final boolean completed = process.waitFor(this.timeout.toMillis(), TimeUnit.MILLISECONDS);
			if (!completed) {
				process.destroyForcibly();
				throw new IOException("Git command timed out after " + this.timeout.toSeconds() + " seconds: git " + String.join(" ", args));
			}
			exitCode = process.exitValue();
			stdout = stdoutFuture.get();
			stderr = stderrFuture.get();
		} catch (InterruptedException e) {
			process.destroyForcibly();
			Thread.currentThread().interrupt();
			throw new IOException("Git command interrupted", e);
		} catch (ExecutionException e) {
			throw new IOException("Failed to read git output", e.getCause());
		}

		return judge(args, options, stdout, stderr, exitCode);
	}

	/**
	 * Writes the optional input to the standard input of the process and closes it. The process is destroyed
	 * when the input cannot be written so that no orphaned git process keeps running.
	 *
	 * @param process started git process
	 * @param input   text to feed, or null for none
	 * @throws IOException if writing or closing the stream fails
	 */
	static void writeStdin(@Nonnull Process process, @Nullable String input) throws IOException {
		try (final OutputStream stdin = process.getOutputStream()) {
			if (input != null) {
				stdin.write(input.getBytes(StandardCharsets.UTF_8));
			}
		} catch (IOException e) {
			process.destroyForcibly();
			throw new IOException("Failed to write standard input of git", e);
		}
	}

	/**
	 * Classifies the outcome of a finished command.
	 *
	 * @param args     arguments the command ran with
	 * @param options  execution options
	 * @param stdout   captured standard output
	 * @param stderr   captured standard error
	 * @param exitCode exit code
	 * @return the result when the exit code or the failure kind is acceptable
	 * @throws GitCommandException otherwise
	 */
	@Nonnull
	GitResult judge(
		@Nonnull List<String> args,
		@Nonnull GitExecutionOptions options,
		@Nonnull String stdout,
		@Nonnull String stderr,
		int exitCode
	) throws GitCommandException {
		if (options.successExitCodes().contains(exitCode)) {
			return new GitResult(stdout, stderr, exitCode, null, null);
		}

		final GitErrorKind kind = this.taxonomy.classify(stderr, stdout).orElse(null);
		String description = kind == null ? null : this.taxonomy.describe(kind).orElse(null);

		if (kind == GitErrorKind.PUSH_WITH_FILE_SIZE_EXCEEDING_LIMIT) {
			final List<String> files = this.taxonomy.extractOversizedFiles(stderr + "\n" + stdout);
			if (!files.isEmpty()) {
				description = (description == null ? "" : description) + "\n\nFile causing error:\n\n" + String.join("\n", files);
			}
		}

		final GitResult result = new GitResult(stdout, stderr, exitCode, kind, description);
		if (kind != null && options.expectedErrors().contains(kind)) {
			return result;
		}

		final GitCommandException exception = new GitCommandException(args, result);
		this.log.debug(exception.getMessage());
		throw exception;
	}

	@Nonnull
	private static String readFully(@Nullable InputStream stream) {
		if (stream == null) {
			return "";
		}
		try (stream) {
			return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
