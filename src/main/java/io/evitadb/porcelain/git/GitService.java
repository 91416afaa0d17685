package io.evitadb.porcelain.git;

import io.evitadb.porcelain.status.ConflictFilesDetails;
import io.evitadb.porcelain.status.PorcelainStatusParser;
import io.evitadb.porcelain.status.StatusEntry;
import io.evitadb.porcelain.status.StatusHeaders;
import io.evitadb.porcelain.status.StatusItem;
import io.evitadb.porcelain.status.WorkingDirectoryFileChange;
import io.evitadb.porcelain.status.WorkingDirectoryStatusBuilder;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Repository queries built on top of {@link GitProcess} and the status decoders.
 */
public final class GitService {

	static final List<String> STATUS_ARGS = List.of(
		"--no-optional-locks", "status", "--untracked-files=all", "--branch", "--porcelain=2", "-z"
	);
	private static final int NOT_A_REPOSITORY_EXIT_CODE = 128;
	private static final Pattern CONFLICT_MARKER_PATTERN = Pattern.compile("^(.+):\\d+: leftover conflict marker");

	@Nonnull
	private final GitProcess process;
	@Nonnull
	private final Log log;
	@Nonnull
	private final PorcelainStatusParser statusParser;
	@Nonnull
	private final WorkingDirectoryStatusBuilder statusBuilder;

	public GitService(@Nonnull GitProcess process, @Nonnull Log log) {
		this.process = Objects.requireNonNull(process, "process must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.statusParser = new PorcelainStatusParser(log);
		this.statusBuilder = new WorkingDirectoryStatusBuilder();
	}

	/**
	 * Reads the status of the working directory.
	 * Uses: `git --no-optional-locks status --untracked-files=all --branch --porcelain=2 -z`
	 *
	 * @return the status, or empty if the directory is not a git repository
	 * @throws IOException if git fails for any other reason
	 */
	@Nonnull
	public Optional<StatusResult> getStatus() throws IOException {
		final GitResult result = this.process.execute(
			STATUS_ARGS,
			GitExecutionOptions.defaults().withSuccessExitCodes(Set.of(0, NOT_A_REPOSITORY_EXIT_CODE))
		);
		if (result.exitCode() == NOT_A_REPOSITORY_EXIT_CODE) {
			this.log.warn("[WARN] '" + this.process.getRepositoryRoot() + "' is not a git repository");
			return Optional.empty();
		}

		final List<StatusItem> items = this.statusParser.parse(result.stdout());
		final List<StatusEntry> entries = PorcelainStatusParser.entries(items);
		final boolean conflicted = WorkingDirectoryStatusBuilder.hasConflicts(entries);

		final ConflictFilesDetails conflictDetails = conflicted ? getConflictDetails() : ConflictFilesDetails.empty();
		final List<WorkingDirectoryFileChange> files = this.statusBuilder.build(entries, conflictDetails);
		final StatusHeaders headers = StatusHeaders.fromHeaders(PorcelainStatusParser.headers(items));

		return Optional.of(new StatusResult(headers, files, conflicted));
	}

	/**
	 * Counts leftover conflict markers per file.
	 * Uses: `git diff --check`, which exits with 2 when it finds problems.
	 *
	 * @return marker count per path
	 * @throws IOException if git fails
	 */
	@Nonnull
	public Map<String, Integer> getFilesWithConflictMarkers() throws IOException {
		final GitResult result = this.process.execute(
			List.of("diff", "--check"),
			GitExecutionOptions.defaults().withSuccessExitCodes(Set.of(0, 2))
		);
		final Map<String, Integer> counts = new HashMap<>();
		for (final String line : result.stdout().split("\n")) {
			final Matcher matcher = CONFLICT_MARKER_PATTERN.matcher(line);
			if (matcher.find()) {
				counts.merge(matcher.group(1), 1, Integer::sum);
			}
		}
		return counts;
	}

	/**
	 * Lists files git treats as binary when comparing the working directory with a revision.
	 * Uses: `git diff --numstat -z <ref>`; binary files report `-` for both counts.
	 *
	 * @param ref revision to compare with
	 * @return binary paths
	 * @throws IOException if git fails
	 */
	@Nonnull
	public Set<String> getBinaryPaths(@Nonnull String ref) throws IOException {
		Objects.requireNonNull(ref, "ref must not be null");
		final GitResult result = this.process.execute(List.of("diff", "--numstat", "-z", ref));
		final Set<String> paths = new HashSet<>();
		for (final String token : result.stdout().split("\0")) {
			final String[] parts = token.split("\t", 3);
			if (parts.length == 3 && "-".equals(parts[0]) && "-".equals(parts[1]) && !parts[2].isEmpty()) {
				paths.add(parts[2]);
			}
		}
		return paths;
	}

	@Nonnull
	private ConflictFilesDetails getConflictDetails() throws IOException {
		final Map<String, Integer> markers = getFilesWithConflictMarkers();
		Set<String> binaryPaths;
		try {
			binaryPaths = getBinaryPaths("HEAD");
		} catch (GitCommandException e) {
			// a repository without commits has no HEAD to compare with
			this.log.warn("[WARN] Unable to list binary files: " + e.getMessage());
			binaryPaths = Set.of();
		}
		return new ConflictFilesDetails(markers, binaryPaths);
	}
}
