package io.evitadb.porcelain.progress;

import io.evitadb.porcelain.progress.GitParsingResult.GitOutput;
import io.evitadb.porcelain.progress.GitParsingResult.GitProgress;

import javax.annotation.Nonnull;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Aggregates the per-file transfer lines Git LFS writes to its progress file
 * (`<direction> <done>/<estimated> <transferred>/<size> <name>`) into overall progress.
 *
 * Files are tracked by name for the lifetime of the parser, so one instance serves one operation.
 */
public final class LfsProgressParser {

	private static final Pattern LFS_PROGRESS_LINE = Pattern.compile("^(.+?)\\s(\\d+)/(\\d+)\\s(\\d+)/(\\d+)\\s(.+)$");

	private final Map<String, FileProgress> files = new HashMap<>();

	/**
	 * Parses one line of the LFS progress file.
	 *
	 * @param line the raw line
	 * @return aggregate progress, or context at 0 percent for unrecognized lines
	 */
	@Nonnull
	public GitParsingResult parse(@Nonnull String line) {
		Objects.requireNonNull(line, "line must not be null");

		final Matcher matcher = LFS_PROGRESS_LINE.matcher(line);
		if (!matcher.matches()) {
			return new GitOutput(0, line);
		}

		final String direction = matcher.group(1);
		final int estimatedFileCount;
		final long fileTransferred;
		final long fileSize;
		try {
			estimatedFileCount = Integer.parseInt(matcher.group(3));
			fileTransferred = Long.parseLong(matcher.group(4));
			fileSize = Long.parseLong(matcher.group(5));
		} catch (NumberFormatException e) {
			return new GitOutput(0, line);
		}
		final String fileName = matcher.group(6);

		this.files.put(fileName, new FileProgress(fileTransferred, fileSize, fileTransferred == fileSize));

		long totalTransferred = 0;
		long totalSize = 0;
		int finishedFiles = 0;
		for (final FileProgress file : this.files.values()) {
			totalTransferred += file.transferred();
			totalSize += file.size();
			if (file.done()) {
				finishedFiles++;
			}
		}
		final int fileCount = Math.max(estimatedFileCount, this.files.size());
		final Integer percent = totalSize > 0 ? (int) Math.floor(totalTransferred * 100.0 / totalSize) : null;

		final String verb = toVerb(direction);
		final GitProgressInfo info = new GitProgressInfo(
			verb + " \"" + fileName + "\"",
			totalTransferred,
			totalSize,
			percent,
			finishedFiles == fileCount,
			verb + " " + fileName + " (" + finishedFiles + " out of an estimated " + fileCount +
				" completed, " + totalTransferred + " / " + totalSize + ")"
		);
		return new GitProgress(percent == null ? 0 : percent, info);
	}

	@Nonnull
	static String toVerb(@Nonnull String direction) {
		return switch (direction) {
			case "upload" -> "Uploading";
			case "checkout" -> "Checking out";
			default -> "Downloading";
		};
	}

	private record FileProgress(long transferred, long size, boolean done) {
	}
}
