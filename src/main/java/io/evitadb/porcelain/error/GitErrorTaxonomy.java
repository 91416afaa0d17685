package io.evitadb.porcelain.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.evitadb.porcelain.error.GitErrorKind.*;

/**
 * Classifies the output of a failed git command into a {@link GitErrorKind}.
 *
 * Rules are evaluated top to bottom and the first matching rule wins, so the order of {@link #RULES}
 * is significant: a more specific pattern must precede any more general pattern that could also match
 * the same text (e.g. HTTPS authentication before the generic authentication failure).
 */
public final class GitErrorTaxonomy {

	/**
	 * Ordered error table.
	 */
	private static final List<GitErrorRule> RULES = List.of(
		GitErrorRule.of(
			"ERROR: ([\\s\\S]+?)\\n+\\[EPOLICYKEYAGE\\]\\n+fatal: Could not read from remote repository.",
			SSH_KEY_AUDIT_UNVERIFIED
		),
		GitErrorRule.of(
			"fatal: Authentication failed for 'https://|The requested URL returned error: 403",
			HTTPS_AUTHENTICATION_FAILED
		),
		GitErrorRule.of("fatal: Authentication failed", SSH_AUTHENTICATION_FAILED),
		GitErrorRule.of("fatal: Could not read from remote repository.", SSH_PERMISSION_DENIED),
		GitErrorRule.of("fatal: [Tt]he remote end hung up unexpectedly", REMOTE_DISCONNECTION),
		GitErrorRule.of(
			"fatal: unable to access '(.+)': Failed to connect to (.+): Host is down"
				+ "|Cloning into '(.+)'...\nfatal: unable to access '(.+)': Could not resolve host: (.+)",
			HOST_DOWN
		),
		GitErrorRule.of("Resolve all conflicts manually, mark them as resolved with", REBASE_CONFLICTS),
		GitErrorRule.of(
			"(Merge conflict|Automatic merge failed; fix conflicts and then commit the result)",
			MERGE_CONFLICTS
		),
		GitErrorRule.of("fatal: repository '(.+)' not found", HTTPS_REPOSITORY_NOT_FOUND),
		GitErrorRule.of("ERROR: Repository not found", SSH_REPOSITORY_NOT_FOUND),
		GitErrorRule.of(
			"\\((non-fast-forward|fetch first)\\)\nerror: failed to push some refs to '.*'",
			PUSH_NOT_FAST_FORWARD
		),
		GitErrorRule.of("error: unable to delete '(.+)': remote ref does not exist", BRANCH_DELETION_FAILED),
		GitErrorRule.of(
			"\\[remote rejected\\] (.+) \\(deletion of the current branch prohibited\\)",
			DEFAULT_BRANCH_DELETION_FAILED
		),
		GitErrorRule.of(
			"error: could not revert .*\nhint: after resolving the conflicts, mark the corrected paths\n"
				+ "hint: with 'git add <paths>' or 'git rm <paths>'\nhint: and commit the result with 'git commit'",
			REVERT_CONFLICTS
		),
		GitErrorRule.of(
			"Applying: .*\nNo changes - did you forget to use 'git add'\\?\n"
				+ "If there is nothing left to stage, chances are that something else\n.*",
			EMPTY_REBASE_PATCH
		),
		GitErrorRule.of(
			"There are no candidates for (rebasing|merging) among the refs that you just fetched.\n"
				+ "Generally this means that you provided a wildcard refspec which had no\nmatches on the remote end.",
			NO_MATCHING_REMOTE_BRANCH
		),
		GitErrorRule.of(
			"Your configuration specifies to merge with the ref '(.+)'\nfrom the remote, but no such ref was fetched.",
			NO_EXISTING_REMOTE_BRANCH
		),
		GitErrorRule.of("nothing to commit", NOTHING_TO_COMMIT),
		GitErrorRule.of("[Nn]o submodule mapping found in .gitmodules for path '(.+)'", NO_SUBMODULE_MAPPING),
		GitErrorRule.of(
			"fatal: repository '(.+)' does not exist\nfatal: clone of '.+' into submodule path '(.+)' failed",
			SUBMODULE_REPOSITORY_DOES_NOT_EXIST
		),
		GitErrorRule.of(
			"Fetched in submodule path '(.+)', but it did not contain (.+). Direct fetching of that commit failed.",
			INVALID_SUBMODULE_SHA
		),
		GitErrorRule.of("fatal: could not create work tree dir '(.+)'.*: Permission denied", LOCAL_PERMISSION_DENIED),
		GitErrorRule.of("merge: (.+) - not something we can merge", INVALID_MERGE),
		GitErrorRule.of("invalid upstream (.+)", INVALID_REBASE),
		GitErrorRule.of(
			"fatal: Non-fast-forward commit does not make sense into an empty head",
			NON_FAST_FORWARD_MERGE_INTO_EMPTY_HEAD
		),
		GitErrorRule.of(
			"error: (.+): (patch does not apply|already exists in working directory)",
			PATCH_DOES_NOT_APPLY
		),
		GitErrorRule.of("fatal: [Aa] branch named '(.+)' already exists.?", BRANCH_ALREADY_EXISTS),
		GitErrorRule.of("fatal: bad revision '(.*)'", BAD_REVISION),
		GitErrorRule.of("fatal: [Nn]ot a git repository \\(or any of the parent directories\\): (.*)", NOT_A_GIT_REPOSITORY),
		GitErrorRule.of("fatal: refusing to merge unrelated histories", CANNOT_MERGE_UNRELATED_HISTORIES),
		GitErrorRule.of("The .+ attribute should be .+ but is .+", LFS_ATTRIBUTE_DOES_NOT_MATCH),
		GitErrorRule.of("fatal: Branch rename failed", BRANCH_RENAME_FAILED),
		GitErrorRule.of("fatal: path '(.+)' does not exist .+", PATH_DOES_NOT_EXIST),
		GitErrorRule.of("fatal: invalid object name '(.+)'.", INVALID_OBJECT_NAME),
		GitErrorRule.of("fatal: .+: '(.+)' is outside repository", OUTSIDE_REPOSITORY),
		GitErrorRule.of("Another git process seems to be running in this repository, e.g.", LOCK_FILE_ALREADY_EXISTS),
		GitErrorRule.of("fatal: There is no merge to abort", NO_MERGE_TO_ABORT),
		GitErrorRule.of(
			"error: (?:Your local changes to the following|The following untracked working tree) "
				+ "files would be overwritten by checkout:",
			LOCAL_CHANGES_OVERWRITTEN
		),
		GitErrorRule.of(
			"You must edit all merge conflicts and then\nmark them as resolved using git add"
				+ "|fatal: Exiting because of an unresolved conflict",
			UNRESOLVED_CONFLICTS
		),
		GitErrorRule.of("error: gpg failed to sign the data", GPG_FAILED_TO_SIGN_DATA),
		GitErrorRule.of(
			"CONFLICT \\(modify/delete\\): (.+) deleted in (.+) and modified in (.+)",
			CONFLICT_MODIFY_DELETED_IN_BRANCH
		),
		GitErrorRule.of("error: GH001: ", PUSH_WITH_FILE_SIZE_EXCEEDING_LIMIT),
		GitErrorRule.of("error: GH002: ", HEX_BRANCH_NAME_REJECTED),
		GitErrorRule.of("error: GH003: Sorry, force-pushing to (.+) is not allowed.", FORCE_PUSH_REJECTED),
		GitErrorRule.of("error: GH005: Sorry, refs longer than (.+) bytes are not allowed", INVALID_REF_LENGTH),
		GitErrorRule.of(
			"error: GH006: Protected branch update failed for (.+)\nremote: error: At least one approved review is required",
			PROTECTED_BRANCH_REQUIRES_REVIEW
		),
		GitErrorRule.of(
			"error: GH006: Protected branch update failed for (.+)\nremote: error: Cannot force-push to a protected branch",
			PROTECTED_BRANCH_FORCE_PUSH
		),
		GitErrorRule.of(
			"error: GH006: Protected branch update failed for (.+).\nremote: error: Cannot delete a protected branch",
			PROTECTED_BRANCH_DELETE_REJECTED
		),
		GitErrorRule.of(
			"error: GH006: Protected branch update failed for (.+).\nremote: error: Required status check \"(.+)\" is expected",
			PROTECTED_BRANCH_REQUIRED_STATUS
		),
		GitErrorRule.of("error: GH007: Your push would publish a private email address.", PUSH_WITH_PRIVATE_EMAIL),
		GitErrorRule.of("error: could not lock config file (.+): File exists", CONFIG_LOCK_FILE_ALREADY_EXISTS),
		GitErrorRule.of("error: remote (.+) already exists.", REMOTE_ALREADY_EXISTS),
		GitErrorRule.of("fatal: tag '(.+)' already exists", TAG_ALREADY_EXISTS),
		GitErrorRule.of(
			"error: Your local changes to the following files would be overwritten by merge:\n",
			MERGE_WITH_LOCAL_CHANGES
		),
		GitErrorRule.of(
			"error: cannot (pull with rebase|rebase): You have unstaged changes\\.\n\\s*error: [Pp]lease commit or stash them\\.",
			REBASE_WITH_LOCAL_CHANGES
		),
		GitErrorRule.of("error: commit (.+) is a merge but no -m option was given", MERGE_COMMIT_NO_MAINLINE_OPTION),
		GitErrorRule.of("fatal: detected dubious ownership in repository at (.+)", UNSAFE_DIRECTORY),
		GitErrorRule.of("fatal: path '(.+)' exists on disk, but not in '(.+)'", PATH_EXISTS_BUT_NOT_IN_REF)
	);

	/**
	 * Start of the remote line reporting a file over the size limit; one per offending file.
	 */
	private static final Pattern OVERSIZED_FILE_BEGIN = Pattern.compile("^remote:\\serror:\\sFile\\s", Pattern.MULTILINE);
	private static final Pattern OVERSIZED_FILE_END = Pattern.compile(
		";\\sthis\\sexceeds\\sGitHub's\\sfile\\ssize\\slimit\\sof\\s100.00\\sMB"
	);
	private static final String SIZE_SEPARATOR = " is ";

	@Nonnull
	private final GitErrorDescriptions descriptions;

	/**
	 * Creates a taxonomy using the bundled error descriptions.
	 */
	public GitErrorTaxonomy() {
		this(new GitErrorDescriptions());
	}

	/**
	 * Creates a taxonomy with a custom description source.
	 *
	 * @param descriptions the description source
	 */
	public GitErrorTaxonomy(@Nonnull GitErrorDescriptions descriptions) {
		this.descriptions = Objects.requireNonNull(descriptions, "descriptions must not be null");
	}

	/**
	 * Returns the ordered rule table.
	 *
	 * @return immutable list of rules in evaluation order
	 */
	@Nonnull
	public static List<GitErrorRule> rules() {
		return RULES;
	}

	/**
	 * Finds the first rule whose pattern occurs in the text.
	 *
	 * @param text output of the failed command (usually stderr)
	 * @return the error kind, or empty when no rule matches
	 */
	@Nonnull
	public Optional<GitErrorKind> classify(@Nullable String text) {
		if (text == null || text.isEmpty()) {
			return Optional.empty();
		}
		for (final GitErrorRule rule : RULES) {
			if (rule.matches(text)) {
				return Optional.of(rule.kind());
			}
		}
		return Optional.empty();
	}

	/**
	 * Classifies stderr first and falls back to stdout when stderr yields nothing.
	 *
	 * @param stderr the standard error output
	 * @param stdout the standard output
	 * @return the error kind, or empty when neither stream matches
	 */
	@Nonnull
	public Optional<GitErrorKind> classify(@Nullable String stderr, @Nullable String stdout) {
		final Optional<GitErrorKind> fromStderr = classify(stderr);
		if (fromStderr.isPresent()) {
			return fromStderr;
		}
		return classify(stdout);
	}

	/**
	 * Returns the user-facing explanation of an error kind.
	 * Some kinds are recognized but carry no message; callers supply their own copy for them.
	 *
	 * @param kind the error kind
	 * @return the description, or empty for undocumented kinds
	 */
	@Nonnull
	public Optional<String> describe(@Nonnull GitErrorKind kind) {
		Objects.requireNonNull(kind, "kind must not be null");
		return this.descriptions.describe(kind);
	}

	/**
	 * Extracts the files rejected by the remote for exceeding the file size limit.
	 * Each entry reads `name (size)`. When the begin and end markers cannot be paired one to one
	 * the result is empty.
	 *
	 * @param text output of the failed push
	 * @return offending file descriptions in order of appearance
	 */
	@Nonnull
	public List<String> extractOversizedFiles(@Nullable String text) {
		if (text == null || text.isEmpty()) {
			return List.of();
		}
		final List<Integer> begins = new ArrayList<>();
		final Matcher beginMatcher = OVERSIZED_FILE_BEGIN.matcher(text);
		while (beginMatcher.find()) {
			begins.add(beginMatcher.end());
		}
		final List<Integer> ends = new ArrayList<>();
		final Matcher endMatcher = OVERSIZED_FILE_END.matcher(text);
		while (endMatcher.find()) {
			ends.add(endMatcher.start());
		}
		if (begins.size() != ends.size()) {
			return List.of();
		}

		final List<String> files = new ArrayList<>(begins.size());
		for (int i = 0; i < begins.size(); i++) {
			final int from = begins.get(i);
			final int to = ends.get(i);
			if (to < from) {
				return List.of();
			}
			files.add(formatOversizedFile(text.substring(from, to)));
		}
		return files;
	}

	/**
	 * Turns `big.bin is 120.00 MB` into `big.bin (120.00 MB)`.
	 */
	@Nonnull
	private static String formatOversizedFile(@Nonnull String raw) {
		final int separator = raw.lastIndexOf(SIZE_SEPARATOR);
		if (separator < 0) {
			return raw;
		}
		return raw.substring(0, separator) + " (" + raw.substring(separator + SIZE_SEPARATOR.length()) + ")";
	}
}
