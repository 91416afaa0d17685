package io.evitadb.porcelain.status;

import io.evitadb.porcelain.status.StatusEntry.StatusEntryKind;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the output of `git status --porcelain=2 -z` into headers and file entries.
 *
 * Records are NUL separated. Renamed and copied records are followed by a separate NUL terminated
 * token holding the original path, so the tokenizer consumes two tokens for them. Ignored records are
 * dropped. Tokens that do not match their record layout are skipped with a warning; one bad record
 * never aborts the rest of the stream.
 */
public final class PorcelainStatusParser {

	private static final String HEADER_PREFIX = "# ";
	private static final char CHANGED_ENTRY = '1';
	private static final char RENAMED_OR_COPIED_ENTRY = '2';
	private static final char UNMERGED_ENTRY = 'u';
	private static final char UNTRACKED_ENTRY = '?';
	private static final char IGNORED_ENTRY = '!';
	private static final String UNTRACKED_SUBMODULE_CODE = "????";

	/**
	 * `1 <XY> <sub> <mH> <mI> <mW> <hH> <hI> <path>`
	 */
	private static final Pattern CHANGED_ENTRY_PATTERN = Pattern.compile(
		"^1 ([MADRCUTX?!.]{2}) (N\\.\\.\\.|S[C.][M.][U.]) (\\d+) (\\d+) (\\d+) ([a-f0-9]+) ([a-f0-9]+) (.+)$",
		Pattern.DOTALL
	);

	/**
	 * `2 <XY> <sub> <mH> <mI> <mW> <hH> <hI> <X><score> <path>`
	 */
	private static final Pattern RENAMED_OR_COPIED_ENTRY_PATTERN = Pattern.compile(
		"^2 ([MADRCUTX?!.]{2}) (N\\.\\.\\.|S[C.][M.][U.]) (\\d+) (\\d+) (\\d+) ([a-f0-9]+) ([a-f0-9]+) ([RC]\\d+) (.+)$",
		Pattern.DOTALL
	);

	/**
	 * `u <XY> <sub> <m1> <m2> <m3> <mW> <h1> <h2> <h3> <path>`
	 */
	private static final Pattern UNMERGED_ENTRY_PATTERN = Pattern.compile(
		"^u ([DAU]{2}) (N\\.\\.\\.|S[C.][M.][U.]) (\\d+) (\\d+) (\\d+) (\\d+) ([a-f0-9]+) ([a-f0-9]+) ([a-f0-9]+) (.+)$",
		Pattern.DOTALL
	);

	@Nonnull
	private final Log log;

	/**
	 * Creates a parser reporting skipped records to standard output.
	 */
	public PorcelainStatusParser() {
		this(new SystemStreamLog());
	}

	/**
	 * Creates a parser reporting skipped records to the given log.
	 *
	 * @param log the Maven log
	 */
	public PorcelainStatusParser(@Nonnull Log log) {
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Parses a complete porcelain v2 status stream.
	 *
	 * @param output raw stdout of the status command
	 * @return headers and entries in stream order
	 */
	@Nonnull
	public List<StatusItem> parse(@Nonnull String output) {
		Objects.requireNonNull(output, "output must not be null");

		final String[] tokens = output.split("\0");
		final List<StatusItem> items = new ArrayList<>();

		for (int i = 0; i < tokens.length; i++) {
			final String token = tokens[i];
			if (token.isEmpty()) {
				continue;
			}
			if (token.startsWith(HEADER_PREFIX)) {
				items.add(new StatusHeader(token.substring(HEADER_PREFIX.length())));
				continue;
			}

			final StatusEntry entry;
			switch (token.charAt(0)) {
				case CHANGED_ENTRY -> entry = parseChangedEntry(token);
				case RENAMED_OR_COPIED_ENTRY -> {
					// the original path follows as its own token
					final String oldPath = i + 1 < tokens.length ? tokens[++i] : null;
					entry = parseRenamedOrCopiedEntry(token, oldPath);
				}
				case UNMERGED_ENTRY -> entry = parseUnmergedEntry(token);
				case UNTRACKED_ENTRY -> entry = parseUntrackedEntry(token);
				case IGNORED_ENTRY -> entry = null;
				default -> {
					this.log.warn("[WARN] Unknown status record type: " + token);
					entry = null;
				}
			}

			if (entry != null) {
				items.add(entry);
			}
		}

		return items;
	}

	/**
	 * Returns only the file entries of a parsed stream.
	 *
	 * @param items parsed items
	 * @return entries in stream order
	 */
	@Nonnull
	public static List<StatusEntry> entries(@Nonnull List<StatusItem> items) {
		final List<StatusEntry> entries = new ArrayList<>();
		for (final StatusItem item : items) {
			if (item instanceof StatusEntry entry) {
				entries.add(entry);
			}
		}
		return entries;
	}

	/**
	 * Returns only the headers of a parsed stream.
	 *
	 * @param items parsed items
	 * @return headers in stream order
	 */
	@Nonnull
	public static List<StatusHeader> headers(@Nonnull List<StatusItem> items) {
		final List<StatusHeader> headers = new ArrayList<>();
		for (final StatusItem item : items) {
			if (item instanceof StatusHeader header) {
				headers.add(header);
			}
		}
		return headers;
	}

	@Nullable
	StatusEntry parseChangedEntry(@Nonnull String token) {
		final Matcher matcher = CHANGED_ENTRY_PATTERN.matcher(token);
		if (!matcher.matches()) {
			this.log.warn("[WARN] Skipping malformed changed entry: " + token);
			return null;
		}
		return new StatusEntry(StatusEntryKind.CHANGED, matcher.group(8), matcher.group(1), matcher.group(2), null);
	}

	@Nullable
	StatusEntry parseRenamedOrCopiedEntry(@Nonnull String token, @Nullable String oldPath) {
		final Matcher matcher = RENAMED_OR_COPIED_ENTRY_PATTERN.matcher(token);
		if (!matcher.matches()) {
			this.log.warn("[WARN] Skipping malformed renamed or copied entry: " + token);
			return null;
		}
		if (oldPath == null || oldPath.isEmpty()) {
			this.log.warn("[WARN] Skipping renamed or copied entry without original path: " + token);
			return null;
		}
		return new StatusEntry(
			StatusEntryKind.RENAMED_OR_COPIED, matcher.group(9), matcher.group(1), matcher.group(2), oldPath
		);
	}

	@Nullable
	StatusEntry parseUnmergedEntry(@Nonnull String token) {
		final Matcher matcher = UNMERGED_ENTRY_PATTERN.matcher(token);
		if (!matcher.matches()) {
			this.log.warn("[WARN] Skipping malformed unmerged entry: " + token);
			return null;
		}
		return new StatusEntry(StatusEntryKind.UNMERGED, matcher.group(10), matcher.group(1), matcher.group(2), null);
	}

	@Nullable
	StatusEntry parseUntrackedEntry(@Nonnull String token) {
		if (token.length() < 3 || token.charAt(1) != ' ') {
			this.log.warn("[WARN] Skipping malformed untracked entry: " + token);
			return null;
		}
		return new StatusEntry(
			StatusEntryKind.UNTRACKED, token.substring(2), GitStatusMapper.UNTRACKED_CODE, UNTRACKED_SUBMODULE_CODE, null
		);
	}
}
