package io.evitadb.porcelain.error;

/**
 * Closed set of failure causes that can be recognized in the output of a failed git command.
 * The patterns identifying each kind are kept in {@link GitErrorTaxonomy}.
 */
public enum GitErrorKind {

	SSH_KEY_AUDIT_UNVERIFIED,
	SSH_AUTHENTICATION_FAILED,
	SSH_PERMISSION_DENIED,
	HTTPS_AUTHENTICATION_FAILED,
	REMOTE_DISCONNECTION,
	HOST_DOWN,
	REBASE_CONFLICTS,
	MERGE_CONFLICTS,
	HTTPS_REPOSITORY_NOT_FOUND,
	SSH_REPOSITORY_NOT_FOUND,
	PUSH_NOT_FAST_FORWARD,
	BRANCH_DELETION_FAILED,
	DEFAULT_BRANCH_DELETION_FAILED,
	REVERT_CONFLICTS,
	EMPTY_REBASE_PATCH,
	NO_MATCHING_REMOTE_BRANCH,
	NO_EXISTING_REMOTE_BRANCH,
	NOTHING_TO_COMMIT,
	NO_SUBMODULE_MAPPING,
	SUBMODULE_REPOSITORY_DOES_NOT_EXIST,
	INVALID_SUBMODULE_SHA,
	LOCAL_PERMISSION_DENIED,
	INVALID_MERGE,
	INVALID_REBASE,
	NON_FAST_FORWARD_MERGE_INTO_EMPTY_HEAD,
	PATCH_DOES_NOT_APPLY,
	BRANCH_ALREADY_EXISTS,
	BAD_REVISION,
	NOT_A_GIT_REPOSITORY,
	CANNOT_MERGE_UNRELATED_HISTORIES,
	LFS_ATTRIBUTE_DOES_NOT_MATCH,
	BRANCH_RENAME_FAILED,
	PATH_DOES_NOT_EXIST,
	INVALID_OBJECT_NAME,
	OUTSIDE_REPOSITORY,
	LOCK_FILE_ALREADY_EXISTS,
	NO_MERGE_TO_ABORT,
	LOCAL_CHANGES_OVERWRITTEN,
	UNRESOLVED_CONFLICTS,
	GPG_FAILED_TO_SIGN_DATA,
	CONFLICT_MODIFY_DELETED_IN_BRANCH,

	// GitHub-specific rejections reported through the remote

	PUSH_WITH_FILE_SIZE_EXCEEDING_LIMIT,
	HEX_BRANCH_NAME_REJECTED,
	FORCE_PUSH_REJECTED,
	INVALID_REF_LENGTH,
	PROTECTED_BRANCH_REQUIRES_REVIEW,
	PROTECTED_BRANCH_FORCE_PUSH,
	PROTECTED_BRANCH_DELETE_REJECTED,
	PROTECTED_BRANCH_REQUIRED_STATUS,
	PUSH_WITH_PRIVATE_EMAIL,

	CONFIG_LOCK_FILE_ALREADY_EXISTS,
	REMOTE_ALREADY_EXISTS,
	TAG_ALREADY_EXISTS,
	MERGE_WITH_LOCAL_CHANGES,
	REBASE_WITH_LOCAL_CHANGES,
	MERGE_COMMIT_NO_MAINLINE_OPTION,
	UNSAFE_DIRECTORY,
	PATH_EXISTS_BUT_NOT_IN_REF
}
