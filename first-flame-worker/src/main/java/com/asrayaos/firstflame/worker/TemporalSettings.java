package com.asrayaos.firstflame.worker;

import java.util.Map;

/**
 * Connection settings for the Temporal service, read from the environment.
 */
public class TemporalSettings {
    public static final String ENV_ADDRESS = "TEMPORAL_ADDRESS";
    public static final String ENV_NAMESPACE = "TEMPORAL_NAMESPACE";
    public static final String ENV_TASK_QUEUE = "TEMPORAL_TASK_QUEUE";

    public static final String DEFAULT_ADDRESS = "127.0.0.1:7233";
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_TASK_QUEUE = "first-flame";

    private final String address;
    private final String namespace;
    private final String taskQueue;

    public TemporalSettings(String address, String namespace, String taskQueue) {
        this.address = address;
        this.namespace = namespace;
        this.taskQueue = taskQueue;
    }

    public static TemporalSettings fromEnvironment(Map<String, String> env) {
        return new TemporalSettings(
            valueOrDefault(env.get(ENV_ADDRESS), DEFAULT_ADDRESS),
            valueOrDefault(env.get(ENV_NAMESPACE), DEFAULT_NAMESPACE),
            valueOrDefault(env.get(ENV_TASK_QUEUE), DEFAULT_TASK_QUEUE));
    }

    /**
     * Workflow id used for a user; one seeding workflow per user at a time.
     */
    public static String workflowIdFor(String userId) {
        return "seed-first-flame-" + userId;
    }

    public String getAddress() {
        return address;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getTaskQueue() {
        return taskQueue;
    }

    @Override
    public String toString() {
        return "TemporalSettings{" +
                "address='" + address + '\'' +
                ", namespace='" + namespace + '\'' +
                ", taskQueue='" + taskQueue + '\'' +
                '}';
    }

    private static String valueOrDefault(String value, String defaultValue) {
        return value == null || value.trim().isEmpty() ? defaultValue : value.trim();
    }
}
