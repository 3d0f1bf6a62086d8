package dev.mars.backstop.test.categories;

/**
 * Test categories for organizing Backstop tests by execution time and importance.
 *
 * Usage:
 * - @Tag(TestCategories.CORE) - Fast unit tests, critical functionality
 * - @Tag(TestCategories.INTEGRATION) - Tests against a real local HTTP server
 * - @Tag(TestCategories.SLOW) - Tests that wait on real timers
 *
 * Maven execution examples:
 * - mvn test -Dgroups="core" (fast core tests only)
 * - mvn test -DexcludedGroups="slow" (skip real-time waits)
 */
public final class TestCategories {

    /**
     * CORE - Fast unit tests with simulated time. These cover:
     * - Backoff arithmetic
     * - Retry decisions and the retry loop
     * - Circuit breaker transitions
     * - Configuration loading and validation
     */
    public static final String CORE = "core";

    /**
     * INTEGRATION - Tests that start a local Vert.x HTTP server and exercise the clients end to end.
     */
    public static final String INTEGRATION = "integration";

    /**
     * SLOW - Tests that rely on real sleeps or timers.
     */
    public static final String SLOW = "slow";

    private TestCategories() {
        // Utility class
    }
}
