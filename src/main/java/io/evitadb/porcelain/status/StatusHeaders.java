package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Branch information carried by the `# branch.*` headers of a porcelain v2 status stream.
 *
 * @param currentBranch         checked out branch name, null when detached
 * @param currentUpstreamBranch configured upstream, null when none
 * @param currentTip            commit at HEAD, null for a repository without commits
 * @param aheadBehind           divergence from upstream, null when there is no upstream
 */
public record StatusHeaders(
	@Nullable String currentBranch,
	@Nullable String currentUpstreamBranch,
	@Nullable String currentTip,
	@Nullable AheadBehind aheadBehind
) {

	private static final Pattern BRANCH_OID = Pattern.compile("^branch\\.oid ([a-f0-9]+)$");
	private static final Pattern BRANCH_HEAD = Pattern.compile("^branch\\.head (.*)$");
	private static final Pattern BRANCH_UPSTREAM = Pattern.compile("^branch\\.upstream (.*)$");
	private static final Pattern BRANCH_AHEAD_BEHIND = Pattern.compile("^branch\\.ab \\+(\\d+) -(\\d+)$");
	private static final String DETACHED = "(detached)";

	/**
	 * Folds the headers in stream order. Unknown headers are ignored, later headers win.
	 *
	 * @param headers headers of one status stream
	 * @return the interpreted branch information
	 */
	@Nonnull
	public static StatusHeaders fromHeaders(@Nonnull List<StatusHeader> headers) {
		Objects.requireNonNull(headers, "headers must not be null");

		String branch = null;
		String upstream = null;
		String tip = null;
		AheadBehind aheadBehind = null;

		for (final StatusHeader header : headers) {
			final String value = header.value();
			Matcher matcher;
			if ((matcher = BRANCH_OID.matcher(value)).matches()) {
				// `(initial)` never matches the hex pattern
				tip = matcher.group(1);
			} else if ((matcher = BRANCH_HEAD.matcher(value)).matches()) {
				if (!DETACHED.equals(matcher.group(1))) {
					branch = matcher.group(1);
				}
			} else if ((matcher = BRANCH_UPSTREAM.matcher(value)).matches()) {
				upstream = matcher.group(1);
			} else if ((matcher = BRANCH_AHEAD_BEHIND.matcher(value)).matches()) {
				try {
					aheadBehind = new AheadBehind(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
				} catch (NumberFormatException e) {
					aheadBehind = null;
				}
			}
		}

		return new StatusHeaders(branch, upstream, tip, aheadBehind);
	}
}
