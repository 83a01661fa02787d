package io.steadyloop.degradation;

import java.util.LinkedHashMap;
import java.util.Map;

public final class BuiltinWorkarounds {
    private BuiltinWorkarounds() {
    }

    public static void install(DegradationRegistry registry) {
        registry.registerWorkaround("tests", "skip_tests", 0.3d,
                "Skip tests and continue with implementation",
                (c, e) -> marker("skipped", true, "reason", "tests failing"));
        registry.registerWorkaround("tests", "run_subset", 0.2d,
                "Run only the subset of tests that pass",
                (c, e) -> marker("subset", true));
        registry.registerWorkaround("database", "use_cache", 0.4d,
                "Use cached data instead of the live database",
                (c, e) -> marker("source", "cache", "stale", true));
        registry.registerWorkaround("database", "in_memory", 0.5d,
                "Use in-memory storage instead of the database",
                (c, e) -> marker("source", "memory", "persistent", false));
        registry.registerWorkaround("api", "use_mock", 0.6d,
                "Use mock data instead of the real API",
                (c, e) -> marker("source", "mock", "real", false));
        registry.registerWorkaround("api", "retry_later", 0.3d,
                "Defer API calls to later",
                (c, e) -> marker("deferred", true, "retry_after_s", 300));
        registry.registerWorkaround("linting", "skip_linting", 0.1d,
                "Skip linting and continue",
                (c, e) -> marker("skipped", true));
        registry.registerWorkaround("build", "partial_build", 0.4d,
                "Build only changed modules",
                (c, e) -> marker("partial", true));
        registry.registerWorkaround("import", "mock_import", 0.5d,
                "Create a mock for a missing import",
                (c, e) -> marker("mocked", true));
        registry.registerWorkaround("file_io", "use_temp", 0.2d,
                "Use a temporary file location",
                (c, e) -> marker("location", "temp", "temporary", true));
        registry.registerWorkaround("network", "offline_mode", 0.5d,
                "Continue in offline mode",
                (c, e) -> marker("offline", true, "limited", true));
        registry.registerWorkaround("compilation", "interpret_mode", 0.3d,
                "Use an interpreter instead of the compiler",
                (c, e) -> marker("interpreted", true, "slower", true));
    }

    private static Map<String, Object> marker(Object... kv) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            out.put(String.valueOf(kv[i]), kv[i + 1]);
        }
        return out;
    }
}
