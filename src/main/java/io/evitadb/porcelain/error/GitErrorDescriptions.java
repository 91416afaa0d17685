package io.evitadb.porcelain.error;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads user-facing descriptions of {@link GitErrorKind} values from a classpath resource.
 * The resource is a UTF-8 properties file keyed by the enum constant name and is cached after the
 * first lookup. Kinds without a key are recognized but have no message.
 */
public final class GitErrorDescriptions {

	public static final String DEFAULT_RESOURCE = "META-INF/porcelain/git-error-descriptions.properties";

	@Nonnull
	private final String resourcePath;
	private final Map<String, Properties> cache = new ConcurrentHashMap<>();

	/**
	 * Creates a loader reading {@link #DEFAULT_RESOURCE}.
	 */
	public GitErrorDescriptions() {
		this(DEFAULT_RESOURCE);
	}

	/**
	 * Creates a loader reading a custom resource.
	 *
	 * @param resourcePath classpath location of the properties file
	 */
	public GitErrorDescriptions(@Nonnull String resourcePath) {
		this.resourcePath = Objects.requireNonNull(resourcePath, "resourcePath must not be null");
	}

	/**
	 * Returns the description of the given kind.
	 *
	 * @param kind the error kind
	 * @return the description, or empty if the kind is undocumented
	 * @throws IllegalArgumentException if the resource is missing or unreadable
	 */
	@Nonnull
	public Optional<String> describe(@Nonnull GitErrorKind kind) {
		Objects.requireNonNull(kind, "kind must not be null");
		final Properties properties = this.cache.computeIfAbsent(this.resourcePath, this::loadFromClasspath);
		final String description = properties.getProperty(kind.name());
		if (description == null || description.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(description);
	}

	/**
	 * Clears the cached resource. Useful for testing.
	 */
	public void clearCache() {
		this.cache.clear();
	}

	@Nonnull
	private Properties loadFromClasspath(@Nonnull String path) {
		final InputStream inputStream = getClass().getClassLoader().getResourceAsStream(path);
		if (inputStream == null) {
			throw new IllegalArgumentException("Error descriptions not found: " + path);
		}

		try (final Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
			final Properties properties = new Properties();
			properties.load(reader);
			return properties;
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read error descriptions: " + path, e);
		}
	}
}
