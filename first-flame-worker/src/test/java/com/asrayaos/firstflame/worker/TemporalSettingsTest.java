package com.asrayaos.firstflame.worker;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemporalSettingsTest {

    @Test
    void testDefaults() {
        TemporalSettings settings = TemporalSettings.fromEnvironment(Collections.emptyMap());

        assertEquals("127.0.0.1:7233", settings.getAddress());
        assertEquals("default", settings.getNamespace());
        assertEquals("first-flame", settings.getTaskQueue());
    }

    @Test
    void testOverrides() {
        Map<String, String> env = new HashMap<>();
        env.put(TemporalSettings.ENV_ADDRESS, "temporal.internal:7233");
        env.put(TemporalSettings.ENV_NAMESPACE, " onboarding ");
        env.put(TemporalSettings.ENV_TASK_QUEUE, "");

        TemporalSettings settings = TemporalSettings.fromEnvironment(env);

        assertEquals("temporal.internal:7233", settings.getAddress());
        assertEquals("onboarding", settings.getNamespace());
        assertEquals("first-flame", settings.getTaskQueue(), "Blank values fall back to the default");
    }

    @Test
    void testWorkflowIdIsPerUser() {
        assertEquals("seed-first-flame-6f1c2e9a-3b4d-4c5e-8f70-112233445566",
            TemporalSettings.workflowIdFor("6f1c2e9a-3b4d-4c5e-8f70-112233445566"));
    }
}
