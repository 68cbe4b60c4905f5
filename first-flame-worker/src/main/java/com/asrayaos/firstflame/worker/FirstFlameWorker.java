package com.asrayaos.firstflame.worker;

import com.asrayaos.firstflame.FirstFlameSeeding;
import com.asrayaos.firstflame.config.ConfigurationException;
import com.asrayaos.firstflame.worker.interceptors.ActivityLoggingWorkerInterceptor;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import io.temporal.worker.Worker;
import io.temporal.worker.WorkerFactory;
import io.temporal.worker.WorkerFactoryOptions;
import io.temporal.worker.WorkerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker process that registers the seeding workflow and activities and polls the task queue.
 * Missing store credentials stop the process before it starts polling.
 */
public class FirstFlameWorker {
    private static final Logger logger = LoggerFactory.getLogger(FirstFlameWorker.class);

    static final int MAX_CONCURRENT_ACTIVITIES = 50;
    static final int MAX_CONCURRENT_WORKFLOW_TASKS = 10;

    public static void main(String[] args) {
        TemporalSettings settings = TemporalSettings.fromEnvironment(System.getenv());

        FirstFlameSeeding seeding;
        try {
            seeding = FirstFlameSeeding.fromEnvironment();
        } catch (ConfigurationException e) {
            logger.error("Cannot start worker: {}", e.getMessage());
            System.exit(2);
            return;
        }

        try {
            WorkflowServiceStubs service = WorkflowServiceStubs.newServiceStubs(
                WorkflowServiceStubsOptions.newBuilder()
                    .setTarget(settings.getAddress())
                    .build());

            WorkflowClient client = WorkflowClient.newInstance(service,
                WorkflowClientOptions.newBuilder()
                    .setNamespace(settings.getNamespace())
                    .build());

            WorkerFactory factory = WorkerFactory.newInstance(client,
                WorkerFactoryOptions.newBuilder()
                    .setWorkerInterceptors(new ActivityLoggingWorkerInterceptor())
                    .build());

            registerWorker(factory, settings.getTaskQueue(), new SeedingActivitiesImpl(seeding));

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down worker");
                factory.shutdown();
                try {
                    seeding.close();
                } catch (Exception e) {
                    logger.warn("Error closing seeder: {}", e.getMessage());
                }
            }));

            factory.start();
            logger.info("Worker running: {}", settings);

            // Keep the worker running
            Thread.currentThread().join();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("Worker failed", e);
            System.exit(1);
        }
    }

    /**
     * Creates the First-Flame worker on a factory.
     *
     * @param factory    the worker factory
     * @param taskQueue  the task queue to poll
     * @param activities the activity implementation
     * @return the registered worker
     */
    static Worker registerWorker(WorkerFactory factory, String taskQueue, SeedingActivities activities) {
        WorkerOptions workerOptions = WorkerOptions.newBuilder()
            .setMaxConcurrentActivityExecutionSize(MAX_CONCURRENT_ACTIVITIES)
            .setMaxConcurrentWorkflowTaskExecutionSize(MAX_CONCURRENT_WORKFLOW_TASKS)
            .build();

        Worker worker = factory.newWorker(taskQueue, workerOptions);
        worker.registerWorkflowImplementationTypes(SeedFirstFlameWorkflowImpl.class);
        worker.registerActivitiesImplementations(activities);
        return worker;
    }
}
