package io.evitadb.porcelain.error;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import static io.evitadb.porcelain.error.GitErrorKind.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.params.provider.Arguments.arguments;

@DisplayName("GitErrorTaxonomy should classify git failures")
public class GitErrorTaxonomyTest {

	private static final Set<GitErrorKind> UNDOCUMENTED = EnumSet.of(
		CONFIG_LOCK_FILE_ALREADY_EXISTS, REMOTE_ALREADY_EXISTS, TAG_ALREADY_EXISTS, MERGE_WITH_LOCAL_CHANGES,
		REBASE_WITH_LOCAL_CHANGES, GPG_FAILED_TO_SIGN_DATA, CONFLICT_MODIFY_DELETED_IN_BRANCH,
		MERGE_COMMIT_NO_MAINLINE_OPTION, UNSAFE_DIRECTORY, PATH_EXISTS_BUT_NOT_IN_REF
	);

	private GitErrorTaxonomy taxonomy;

	@BeforeEach
	void setUp() {
		this.taxonomy = new GitErrorTaxonomy();
	}

	static Stream<Arguments> exampleOutputs() {
		return Stream.of(
			arguments("ERROR: Your SSH key has expired.\n[EPOLICYKEYAGE]\nfatal: Could not read from remote repository.", SSH_KEY_AUDIT_UNVERIFIED),
			arguments("fatal: Authentication failed for 'https://github.com/owner/repo.git/'", HTTPS_AUTHENTICATION_FAILED),
			arguments("fatal: unable to access 'https://github.com/owner/repo.git/': The requested URL returned error: 403", HTTPS_AUTHENTICATION_FAILED),
			arguments("fatal: Authentication failed", SSH_AUTHENTICATION_FAILED),
			arguments("git@github.com: Permission denied (publickey).\nfatal: Could not read from remote repository.", SSH_PERMISSION_DENIED),
			arguments("fatal: the remote end hung up unexpectedly", REMOTE_DISCONNECTION),
			arguments("fatal: unable to access 'https://example.com/repo.git/': Failed to connect to example.com: Host is down", HOST_DOWN),
			arguments("Cloning into 'repo'...\nfatal: unable to access 'https://nowhere.invalid/repo.git/': Could not resolve host: nowhere.invalid", HOST_DOWN),
			arguments("Resolve all conflicts manually, mark them as resolved with\n\"git add/rm <conflicted_files>\"", REBASE_CONFLICTS),
			arguments("Automatic merge failed; fix conflicts and then commit the result.", MERGE_CONFLICTS),
			arguments("remote: Repository not found.\nfatal: repository 'https://github.com/owner/gone.git/' not found", HTTPS_REPOSITORY_NOT_FOUND),
			arguments("ERROR: Repository not found.", SSH_REPOSITORY_NOT_FOUND),
			arguments(" ! [rejected]        main -> main (non-fast-forward)\nerror: failed to push some refs to 'https://github.com/owner/repo.git'", PUSH_NOT_FAST_FORWARD),
			arguments("error: unable to delete 'feature': remote ref does not exist", BRANCH_DELETION_FAILED),
			arguments(" ! [remote rejected] main (deletion of the current branch prohibited)", DEFAULT_BRANCH_DELETION_FAILED),
			arguments("error: could not revert 1a2b3c4... Change\nhint: after resolving the conflicts, mark the corrected paths\nhint: with 'git add <paths>' or 'git rm <paths>'\nhint: and commit the result with 'git commit'", REVERT_CONFLICTS),
			arguments("Applying: Fix typo\nNo changes - did you forget to use 'git add'?\nIf there is nothing left to stage, chances are that something else\nalready introduced the same changes.", EMPTY_REBASE_PATCH),
			arguments("There are no candidates for merging among the refs that you just fetched.\nGenerally this means that you provided a wildcard refspec which had no\nmatches on the remote end.", NO_MATCHING_REMOTE_BRANCH),
			arguments("Your configuration specifies to merge with the ref 'refs/heads/gone'\nfrom the remote, but no such ref was fetched.", NO_EXISTING_REMOTE_BRANCH),
			arguments("On branch main\nnothing to commit, working tree clean", NOTHING_TO_COMMIT),
			arguments("fatal: No submodule mapping found in .gitmodules for path 'lib'", NO_SUBMODULE_MAPPING),
			arguments("fatal: repository '/tmp/missing' does not exist\nfatal: clone of '/tmp/missing' into submodule path 'lib' failed", SUBMODULE_REPOSITORY_DOES_NOT_EXIST),
			arguments("Fetched in submodule path 'lib', but it did not contain 1a2b3c4. Direct fetching of that commit failed.", INVALID_SUBMODULE_SHA),
			arguments("fatal: could not create work tree dir 'repo': Permission denied", LOCAL_PERMISSION_DENIED),
			arguments("merge: feature - not something we can merge", INVALID_MERGE),
			arguments("fatal: invalid upstream 'nope'", INVALID_REBASE),
			arguments("fatal: Non-fast-forward commit does not make sense into an empty head", NON_FAST_FORWARD_MERGE_INTO_EMPTY_HEAD),
			arguments("error: file.txt: patch does not apply", PATCH_DOES_NOT_APPLY),
			arguments("fatal: A branch named 'main' already exists.", BRANCH_ALREADY_EXISTS),
			arguments("fatal: bad revision 'nope'", BAD_REVISION),
			arguments("fatal: not a git repository (or any of the parent directories): .git", NOT_A_GIT_REPOSITORY),
			arguments("fatal: refusing to merge unrelated histories", CANNOT_MERGE_UNRELATED_HISTORIES),
			arguments("The filter.lfs.clean attribute should be \"git-lfs clean -- %f\" but is \"cat\"", LFS_ATTRIBUTE_DOES_NOT_MATCH),
			arguments("fatal: Branch rename failed", BRANCH_RENAME_FAILED),
			arguments("fatal: path 'missing.txt' does not exist in 'HEAD'", PATH_DOES_NOT_EXIST),
			arguments("fatal: invalid object name 'nope'.", INVALID_OBJECT_NAME),
			arguments("fatal: /tmp/elsewhere: '/tmp/elsewhere' is outside repository", OUTSIDE_REPOSITORY),
			arguments("fatal: Unable to create '/repo/.git/index.lock': File exists.\n\nAnother git process seems to be running in this repository, e.g.", LOCK_FILE_ALREADY_EXISTS),
			arguments("fatal: There is no merge to abort (MERGE_HEAD missing).", NO_MERGE_TO_ABORT),
			arguments("error: Your local changes to the following files would be overwritten by checkout:\n\tfile.txt", LOCAL_CHANGES_OVERWRITTEN),
			arguments("error: The following untracked working tree files would be overwritten by checkout:\n\tnew.txt", LOCAL_CHANGES_OVERWRITTEN),
			arguments("error: Pulling is not possible because you have unmerged files.\nfatal: Exiting because of an unresolved conflict.", UNRESOLVED_CONFLICTS),
			arguments("error: gpg failed to sign the data\nfatal: failed to write commit object", GPG_FAILED_TO_SIGN_DATA),
			arguments("CONFLICT (modify/delete): file.txt deleted in HEAD and modified in feature.", CONFLICT_MODIFY_DELETED_IN_BRANCH),
			arguments("remote: error: GH001: Large files detected. You may want to try Git Large File Storage.", PUSH_WITH_FILE_SIZE_EXCEEDING_LIMIT),
			arguments("remote: error: GH002: Sorry, branch or tag names consisting of 40 hex characters are not allowed.", HEX_BRANCH_NAME_REJECTED),
			arguments("remote: error: GH003: Sorry, force-pushing to main is not allowed.", FORCE_PUSH_REJECTED),
			arguments("remote: error: GH005: Sorry, refs longer than 255 bytes are not allowed.", INVALID_REF_LENGTH),
			arguments("remote: error: GH006: Protected branch update failed for refs/heads/main.\nremote: error: At least one approved review is required", PROTECTED_BRANCH_REQUIRES_REVIEW),
			arguments("remote: error: GH006: Protected branch update failed for refs/heads/main.\nremote: error: Cannot force-push to a protected branch", PROTECTED_BRANCH_FORCE_PUSH),
			arguments("remote: error: GH006: Protected branch update failed for refs/heads/main.\nremote: error: Cannot delete a protected branch", PROTECTED_BRANCH_DELETE_REJECTED),
			arguments("remote: error: GH006: Protected branch update failed for refs/heads/main.\nremote: error: Required status check \"build\" is expected", PROTECTED_BRANCH_REQUIRED_STATUS),
			arguments("remote: error: GH007: Your push would publish a private email address.", PUSH_WITH_PRIVATE_EMAIL),
			arguments("error: could not lock config file .git/config: File exists", CONFIG_LOCK_FILE_ALREADY_EXISTS),
			arguments("error: remote origin already exists.", REMOTE_ALREADY_EXISTS),
			arguments("fatal: tag 'v1.0' already exists", TAG_ALREADY_EXISTS),
			arguments("error: Your local changes to the following files would be overwritten by merge:\n\tfile.txt", MERGE_WITH_LOCAL_CHANGES),
			arguments("error: cannot pull with rebase: You have unstaged changes.\nerror: Please commit or stash them.", REBASE_WITH_LOCAL_CHANGES),
			arguments("error: commit 1a2b3c4 is a merge but no -m option was given.", MERGE_COMMIT_NO_MAINLINE_OPTION),
			arguments("fatal: detected dubious ownership in repository at '/repo'", UNSAFE_DIRECTORY),
			arguments("fatal: path 'file.txt' exists on disk, but not in 'HEAD'", PATH_EXISTS_BUT_NOT_IN_REF)
		);
	}

	@ParameterizedTest(name = "{1}")
	@MethodSource("exampleOutputs")
	@DisplayName("classifies example output of every rule")
	void shouldClassifyExampleOutput(String output, GitErrorKind expected) {
		assertEquals(Optional.of(expected), this.taxonomy.classify(output));
	}

	@Test
	@DisplayName("examples cover every error kind")
	void shouldCoverEveryKindWithExample() {
		final Set<GitErrorKind> covered = EnumSet.noneOf(GitErrorKind.class);
		exampleOutputs().forEach(args -> covered.add((GitErrorKind) args.get()[1]));
		assertEquals(EnumSet.allOf(GitErrorKind.class), covered);
	}

	@Test
	@DisplayName("has exactly one rule per error kind")
	void shouldHaveOneRulePerKind() {
		final List<GitErrorRule> rules = GitErrorTaxonomy.rules();
		assertEquals(GitErrorKind.values().length, rules.size());
		assertEquals(
			GitErrorKind.values().length,
			rules.stream().map(GitErrorRule::kind).distinct().count()
		);
		assertThrows(UnsupportedOperationException.class, () -> rules.add(rules.get(0)));
	}

	@Test
	@DisplayName("classifies generic authentication failure as SSH")
	void shouldClassifyGenericAuthenticationFailureAsSsh() {
		assertEquals(Optional.of(SSH_AUTHENTICATION_FAILED), this.taxonomy.classify("fatal: Authentication failed"));
	}

	@Test
	@DisplayName("classifies missing repository as HTTPS not found")
	void shouldClassifyMissingRepository() {
		assertEquals(Optional.of(HTTPS_REPOSITORY_NOT_FOUND), this.taxonomy.classify("fatal: repository 'x' not found"));
	}

	@Test
	@DisplayName("prefers the earlier rule when several match")
	void shouldPreferEarlierRule() {
		assertEquals(
			Optional.of(HTTPS_AUTHENTICATION_FAILED),
			this.taxonomy.classify("fatal: Authentication failed for 'https://github.com/owner/repo.git/'")
		);
		assertEquals(
			Optional.of(SSH_KEY_AUDIT_UNVERIFIED),
			this.taxonomy.classify("ERROR: audit\n[EPOLICYKEYAGE]\nfatal: Could not read from remote repository.")
		);
		assertEquals(
			Optional.of(SSH_PERMISSION_DENIED),
			this.taxonomy.classify("ERROR: Repository not found.\nfatal: Could not read from remote repository.")
		);
	}

	@Test
	@DisplayName("returns empty for unknown, empty or null output")
	void shouldReturnEmptyForUnknownOutput() {
		assertTrue(this.taxonomy.classify("everything is fine").isEmpty());
		assertTrue(this.taxonomy.classify("").isEmpty());
		assertTrue(this.taxonomy.classify((String) null).isEmpty());
	}

	@Test
	@DisplayName("falls back to stdout when stderr is not recognized")
	void shouldFallBackToStdout() {
		assertEquals(
			Optional.of(NOTHING_TO_COMMIT),
			this.taxonomy.classify("", "On branch main\nnothing to commit, working tree clean")
		);
		assertEquals(
			Optional.of(BAD_REVISION),
			this.taxonomy.classify("fatal: bad revision 'x'", "nothing to commit")
		);
		assertTrue(this.taxonomy.classify(null, null).isEmpty());
	}

	@Test
	@DisplayName("describes documented kinds and leaves undocumented ones empty")
	void shouldDescribeDocumentedKindsOnly() {
		for (final GitErrorKind kind : GitErrorKind.values()) {
			final Optional<String> description = this.taxonomy.describe(kind);
			if (UNDOCUMENTED.contains(kind)) {
				assertTrue(description.isEmpty(), kind + " should have no description");
			} else {
				assertTrue(description.isPresent(), kind + " should have a description");
				assertFalse(description.get().isBlank());
			}
		}
		assertEquals(
			Optional.of("The host is down. Check your Internet connection and try again."),
			this.taxonomy.describe(HOST_DOWN)
		);
	}

	@Test
	@DisplayName("extracts oversized files from push output")
	void shouldExtractOversizedFiles() {
		final String output = """
			remote: error: Trace: 8a1b2c
			remote: error: See https://gh.io/lfs for more information.
			remote: error: File assets/video.mp4 is 120.50 MB; this exceeds GitHub's file size limit of 100.00 MB
			remote: error: File data/dump.sql is 250.00 MB; this exceeds GitHub's file size limit of 100.00 MB
			remote: error: GH001: Large files detected. You may want to try Git Large File Storage.
			""";

		assertEquals(
			List.of("assets/video.mp4 (120.50 MB)", "data/dump.sql (250.00 MB)"),
			this.taxonomy.extractOversizedFiles(output)
		);
	}

	@Test
	@DisplayName("returns no oversized files when markers do not pair up")
	void shouldReturnEmptyWhenMarkersMismatch() {
		final String output = """
			remote: error: File assets/video.mp4 is 120.50 MB; this exceeds GitHub's file size limit of 100.00 MB
			remote: error: File data/dump.sql is 250.00 MB
			""";

		assertTrue(this.taxonomy.extractOversizedFiles(output).isEmpty());
		assertTrue(this.taxonomy.extractOversizedFiles("").isEmpty());
		assertTrue(this.taxonomy.extractOversizedFiles(null).isEmpty());
	}
}
