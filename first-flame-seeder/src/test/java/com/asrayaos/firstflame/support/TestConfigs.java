package com.asrayaos.firstflame.support;

import com.asrayaos.firstflame.config.SeedingConfig;

/**
 * Configurations for tests that never reach a real project.
 */
public final class TestConfigs {

    public static final String USER_1 = "6f1c2e9a-3b4d-4c5e-8f70-112233445566";
    public static final String USER_2 = "0a9b8c7d-6e5f-4a3b-9c2d-aabbccddeeff";

    private TestConfigs() {
    }

    public static SeedingConfig.Builder builder() {
        return new SeedingConfig.Builder()
            .setSupabaseUrl("http://localhost:54321")
            .setServiceKey("service-role-test-key");
    }

    public static SeedingConfig defaults() {
        return builder().build();
    }
}
