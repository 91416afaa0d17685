package io.evitadb.porcelain.diff;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Thrown when a selection leaves no change to put into a patch.
 */
public final class EmptyPatchException extends Exception {

	@Nonnull
	private final String path;

	public EmptyPatchException(@Nonnull String path) {
		super("Could not generate a patch, no changes for file " + path);
		this.path = Objects.requireNonNull(path, "path must not be null");
	}

	@Nonnull
	public String getPath() {
		return this.path;
	}
}
