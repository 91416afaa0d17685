package io.evitadb.porcelain.error;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Single entry of the error table: a regular expression and the kind it identifies.
 *
 * @param pattern the compiled pattern searched for anywhere in the command output
 * @param kind    the error kind reported when the pattern matches
 */
public record GitErrorRule(
	@Nonnull Pattern pattern,
	@Nonnull GitErrorKind kind
) {

	public GitErrorRule {
		Objects.requireNonNull(pattern, "pattern must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
	}

	/**
	 * Creates a rule from a raw regular expression.
	 *
	 * @param regex the regular expression
	 * @param kind  the error kind
	 * @return the new rule
	 */
	@Nonnull
	public static GitErrorRule of(@Nonnull String regex, @Nonnull GitErrorKind kind) {
		return new GitErrorRule(Pattern.compile(regex), kind);
	}

	/**
	 * Returns true if the pattern occurs anywhere in the text.
	 *
	 * @param text the command output
	 * @return true on match
	 */
	public boolean matches(@Nonnull String text) {
		return this.pattern.matcher(text).find();
	}
}
