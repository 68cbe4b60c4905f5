package com.asrayaos.firstflame.worker;

import io.temporal.api.enums.v1.WorkflowIdReusePolicy;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.client.WorkflowExecutionAlreadyStarted;
import io.temporal.client.WorkflowOptions;
import io.temporal.client.WorkflowStub;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Starts a seeding workflow for a user and waits for its report.
 * If a run for the same user is already in flight, waits for that one instead.
 */
public class SeedFirstFlameStarter {
    private static final Logger logger = LoggerFactory.getLogger(SeedFirstFlameStarter.class);

    static final Duration EXECUTION_TIMEOUT = Duration.ofMinutes(40);

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("Usage: SeedFirstFlameStarter <user-id>");
            System.exit(2);
        }
        String userId = args[0];
        TemporalSettings settings = TemporalSettings.fromEnvironment(System.getenv());

        try {
            WorkflowServiceStubs service = WorkflowServiceStubs.newServiceStubs(
                WorkflowServiceStubsOptions.newBuilder()
                    .setTarget(settings.getAddress())
                    .build());
            WorkflowClient client = WorkflowClient.newInstance(service,
                WorkflowClientOptions.newBuilder()
                    .setNamespace(settings.getNamespace())
                    .build());

            SeedingReport report = startAndWait(client, settings.getTaskQueue(), userId);
            logger.info("Seeding report: {}", report);
            System.exit(report.isSuccess() ? 0 : 1);

        } catch (Exception e) {
            logger.error("Error starting seeding workflow", e);
            System.exit(1);
        }
    }

    /**
     * Starts (or joins) the seeding workflow of a user and blocks until it completes.
     *
     * @param client    the workflow client
     * @param taskQueue the task queue the worker polls
     * @param userId    the user to seed
     * @return the workflow's report
     */
    static SeedingReport startAndWait(WorkflowClient client, String taskQueue, String userId) {
        String workflowId = TemporalSettings.workflowIdFor(userId);
        WorkflowOptions options = WorkflowOptions.newBuilder()
            .setTaskQueue(taskQueue)
            .setWorkflowId(workflowId)
            .setWorkflowIdReusePolicy(WorkflowIdReusePolicy.WORKFLOW_ID_REUSE_POLICY_ALLOW_DUPLICATE)
            .setWorkflowExecutionTimeout(EXECUTION_TIMEOUT)
            .build();

        SeedFirstFlameWorkflow workflow = client.newWorkflowStub(SeedFirstFlameWorkflow.class, options);
        try {
            WorkflowClient.start(workflow::seed, userId);
            logger.info("Started workflow {} on {}", workflowId, taskQueue);
        } catch (WorkflowExecutionAlreadyStarted e) {
            logger.info("Workflow {} already running, waiting for it", workflowId);
            return client.newUntypedWorkflowStub(workflowId).getResult(SeedingReport.class);
        }
        return WorkflowStub.fromTyped(workflow).getResult(SeedingReport.class);
    }
}
