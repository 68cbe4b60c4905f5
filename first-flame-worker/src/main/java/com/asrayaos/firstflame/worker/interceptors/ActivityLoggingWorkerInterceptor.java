package com.asrayaos.firstflame.worker.interceptors;

import io.temporal.common.interceptors.ActivityInboundCallsInterceptor;
import io.temporal.common.interceptors.WorkerInterceptorBase;

/**
 * Worker interceptor that wraps every activity in an {@link ActivityLoggingInterceptor}.
 */
public class ActivityLoggingWorkerInterceptor extends WorkerInterceptorBase {

    @Override
    public ActivityInboundCallsInterceptor interceptActivity(ActivityInboundCallsInterceptor next) {
        return new ActivityLoggingInterceptor(next);
    }
}
