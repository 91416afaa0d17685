package io.evitadb.porcelain.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StatusHeaders should interpret branch headers")
public class StatusHeadersTest {

	@Test
	@DisplayName("reads branch, tip, upstream and divergence")
	void shouldReadAllHeaders() {
		final StatusHeaders headers = StatusHeaders.fromHeaders(List.of(
			new StatusHeader("branch.oid 0123456789abcdef0123456789abcdef01234567"),
			new StatusHeader("branch.head feature/x"),
			new StatusHeader("branch.upstream origin/feature/x"),
			new StatusHeader("branch.ab +3 -1")
		));

		assertEquals("feature/x", headers.currentBranch());
		assertEquals("origin/feature/x", headers.currentUpstreamBranch());
		assertEquals("0123456789abcdef0123456789abcdef01234567", headers.currentTip());
		assertEquals(new AheadBehind(3, 1), headers.aheadBehind());
	}

	@Test
	@DisplayName("ignores initial tip and detached head")
	void shouldIgnoreInitialAndDetached() {
		final StatusHeaders headers = StatusHeaders.fromHeaders(List.of(
			new StatusHeader("branch.oid (initial)"),
			new StatusHeader("branch.head (detached)")
		));

		assertNull(headers.currentTip());
		assertNull(headers.currentBranch());
		assertNull(headers.currentUpstreamBranch());
		assertNull(headers.aheadBehind());
	}

	@Test
	@DisplayName("ignores unknown headers")
	void shouldIgnoreUnknownHeaders() {
		final StatusHeaders headers = StatusHeaders.fromHeaders(List.of(new StatusHeader("stash 2")));

		assertEquals(new StatusHeaders(null, null, null, null), headers);
	}
}
