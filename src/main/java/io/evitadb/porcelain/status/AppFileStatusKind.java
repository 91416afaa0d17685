package io.evitadb.porcelain.status;

/**
 * Kind of change of a working directory file as presented to callers.
 */
public enum AppFileStatusKind {
	NEW,
	MODIFIED,
	DELETED,
	COPIED,
	RENAMED,
	CONFLICTED,
	UNTRACKED
}
