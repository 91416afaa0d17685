package io.evitadb.porcelain;

import io.evitadb.porcelain.error.GitErrorTaxonomy;
import io.evitadb.porcelain.git.GitCommandException;
import io.evitadb.porcelain.git.GitProcess;
import io.evitadb.porcelain.git.GitResult;
import io.evitadb.porcelain.git.GitService;
import io.evitadb.porcelain.git.StatusResult;
import io.evitadb.porcelain.status.AheadBehind;
import io.evitadb.porcelain.status.AppFileStatus;
import io.evitadb.porcelain.status.ConflictsWithMarkers;
import io.evitadb.porcelain.status.CopiedOrRenamedFileStatus;
import io.evitadb.porcelain.status.ManualConflict;
import io.evitadb.porcelain.status.StatusHeaders;
import io.evitadb.porcelain.status.WorkingDirectoryFileChange;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Main Mojo for Porcelain plugin providing actions:
 * - show-config: prints current configuration
 * - status: prints the interpreted working directory status of the repository
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class PorcelainMojo extends AbstractMojo {

	/** Which action to perform: "show-config" or "status". */
	@Parameter(property = "porcelain.action", defaultValue = "show-config")
	private String action;

	/** Repository directory (defaults to the current working directory). */
	@Parameter(property = "porcelain.repositoryDir")
	private String repositoryDir;

	/** Timeout of a single git command in seconds. */
	@Parameter(property = "porcelain.timeoutSeconds", defaultValue = "30")
	private int timeoutSeconds = 30;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "status":
				status(getLog());
				break;
			default:
				throw new MojoExecutionException("Unknown action: " + this.action + ". Supported actions: show-config, status");
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("Porcelain Plugin Configuration:");
		log.info(" - repositoryDir: " + (this.repositoryDir == null || this.repositoryDir.isBlank() ? "<not set>" : this.repositoryDir));
		if (this.repositoryDir == null || this.repositoryDir.isBlank()) {
			log.warn("Repository directory is not set, the current directory will be used");
		}
		log.info(" - timeoutSeconds: " + this.timeoutSeconds);
		if (this.timeoutSeconds <= 0) {
			log.warn("Timeout must be positive, default of " + GitProcess.DEFAULT_TIMEOUT.toSeconds() + " seconds will be used");
		}
		log.info(" - known error patterns: " + GitErrorTaxonomy.rules().size());
	}

	/**
	 * Reads and logs the status of the configured repository.
	 *
	 * @param log the Maven log
	 * @throws MojoExecutionException if the directory is invalid or git fails
	 */
	private void status(@Nonnull final Log log) throws MojoExecutionException {
		final Path root = resolveRepositoryDir();
		if (!Files.isDirectory(root)) {
			throw new MojoExecutionException("Invalid repository directory: " + root);
		}

		final Duration timeout = this.timeoutSeconds > 0 ? Duration.ofSeconds(this.timeoutSeconds) : GitProcess.DEFAULT_TIMEOUT;
		final GitService gitService = new GitService(new GitProcess(root, timeout, new GitErrorTaxonomy(), log), log);

		final Optional<StatusResult> statusOpt;
		try {
			statusOpt = gitService.getStatus();
		} catch (GitCommandException ex) {
			final GitResult result = ex.getResult();
			if (result.errorKind() != null) {
				log.error("Git failed with " + result.errorKind() +
					(result.errorDescription() == null ? "" : ": " + result.errorDescription()));
			}
			throw new MojoExecutionException("Status action failed: " + ex.getMessage(), ex);
		} catch (IOException ex) {
			throw new MojoExecutionException("Status action failed: " + ex.getMessage(), ex);
		}

		if (statusOpt.isEmpty()) {
			throw new MojoExecutionException("Not a git repository: " + root);
		}

		final StatusResult status = statusOpt.get();
		logHeaders(log, status.headers());

		if (status.files().isEmpty()) {
			log.info("Working directory clean");
		} else {
			log.info("Changed files: " + status.files().size());
			for (final WorkingDirectoryFileChange file : status.files()) {
				log.info(" - " + describe(file.status()) + ": " + file.path() + describeDetails(file.status()));
			}
		}
		if (status.conflictedFilesExist()) {
			log.warn("Repository has unresolved conflicts");
		}
	}

	private static void logHeaders(@Nonnull final Log log, @Nonnull final StatusHeaders headers) {
		log.info("Branch: " + (headers.currentBranch() == null ? "<detached>" : headers.currentBranch()));
		log.info("Tip: " + (headers.currentTip() == null ? "<none>" : headers.currentTip()));
		if (headers.currentUpstreamBranch() != null) {
			final AheadBehind aheadBehind = headers.aheadBehind();
			log.info("Upstream: " + headers.currentUpstreamBranch() +
				(aheadBehind == null ? "" : " (ahead " + aheadBehind.ahead() + ", behind " + aheadBehind.behind() + ")"));
		}
	}

	@Nonnull
	private static String describe(@Nonnull final AppFileStatus status) {
		return status.kind().name().toLowerCase(Locale.ROOT);
	}

	@Nonnull
	private static String describeDetails(@Nonnull final AppFileStatus status) {
		if (status instanceof CopiedOrRenamedFileStatus renamed) {
			return " (from " + renamed.oldPath() + ")";
		} else if (status instanceof ConflictsWithMarkers conflict) {
			return " (" + conflict.details().action().getLabel() + ", " + conflict.conflictMarkerCount() + " markers)";
		} else if (status instanceof ManualConflict conflict) {
			return " (" + conflict.details().action().getLabel() + ")";
		}
		return status.submoduleStatus() == null ? "" : " (submodule)";
	}

	@Nonnull
	private Path resolveRepositoryDir() {
		final String dir = this.repositoryDir == null || this.repositoryDir.isBlank() ? "." : this.repositoryDir;
		return Path.of(dir).toAbsolutePath().normalize();
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setRepositoryDir(@Nullable final String repositoryDir) { this.repositoryDir = repositoryDir; }
	void setTimeoutSeconds(final int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
}
