package com.strata.scheduler.jobs;

import com.strata.history.OperationResult;
import com.strata.scheduler.JobContext;
import com.strata.scheduler.JobType;
import com.strata.scheduler.LifecycleJob;
import com.strata.view.MaterializedViewManager;
import org.springframework.stereotype.Component;

/**
 * Rebuilds every materialized view from the hot and warm tiers.
 */
@Component
public class ViewRefreshJob implements LifecycleJob {

    private final MaterializedViewManager views;

    public ViewRefreshJob(MaterializedViewManager views) {
        this.views = views;
    }

    @Override
    public JobType type() {
        return JobType.VIEW_REFRESH;
    }

    @Override
    public OperationResult run(JobContext context) {
        return views.refreshAll(context);
    }
}
