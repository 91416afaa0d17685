package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A `# ` header line of the status stream, e.g. `branch.head main`. The value is kept verbatim;
 * {@link StatusHeaders} interprets the branch headers.
 *
 * @param value header text without the leading `# `
 */
public record StatusHeader(
	@Nonnull String value
) implements StatusItem {

	public StatusHeader {
		Objects.requireNonNull(value, "value must not be null");
	}
}
