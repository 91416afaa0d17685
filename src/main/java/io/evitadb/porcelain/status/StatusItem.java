package io.evitadb.porcelain.status;

/**
 * One decoded record of a porcelain v2 status stream: a header line or a file entry.
 */
public sealed interface StatusItem permits StatusHeader, StatusEntry {
}
