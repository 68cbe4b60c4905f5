package com.asrayaos.firstflame.worker.interceptors;

import io.temporal.activity.ActivityExecutionContext;
import io.temporal.activity.ActivityInfo;
import io.temporal.common.interceptors.ActivityInboundCallsInterceptor;
import io.temporal.common.interceptors.ActivityInboundCallsInterceptorBase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Activity inbound interceptor that logs each attempt with its workflow id and duration.
 */
public class ActivityLoggingInterceptor extends ActivityInboundCallsInterceptorBase {

    private static final Logger logger = LoggerFactory.getLogger(ActivityLoggingInterceptor.class);

    static final String MDC_WORKFLOW_ID = "workflowId";

    private ActivityExecutionContext context;

    public ActivityLoggingInterceptor(ActivityInboundCallsInterceptor next) {
        super(next);
    }

    @Override
    public void init(ActivityExecutionContext context) {
        this.context = context;
        super.init(context);
    }

    @Override
    public ActivityOutput execute(ActivityInput input) {
        ActivityInfo info = context.getInfo();
        long startedAt = System.currentTimeMillis();
        MDC.put(MDC_WORKFLOW_ID, info.getWorkflowId());
        try {
            logger.info("Activity {} attempt {} started", info.getActivityType(), info.getAttempt());
            ActivityOutput output = super.execute(input);
            logger.info("Activity {} attempt {} completed in {} ms",
                info.getActivityType(), info.getAttempt(), System.currentTimeMillis() - startedAt);
            return output;
        } catch (RuntimeException e) {
            logger.warn("Activity {} attempt {} failed in {} ms: {}",
                info.getActivityType(), info.getAttempt(), System.currentTimeMillis() - startedAt, e.getMessage());
            throw e;
        } finally {
            MDC.remove(MDC_WORKFLOW_ID);
        }
    }
}
