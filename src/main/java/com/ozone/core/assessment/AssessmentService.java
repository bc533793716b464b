package com.ozone.core.assessment;

import com.ozone.core.events.EventBus;
import com.ozone.core.events.OzoneEventType;
import com.ozone.core.logging.MdcContext;
import com.ozone.core.metrics.OzoneMetrics;
import com.ozone.core.model.AssessmentReport;
import com.ozone.core.model.OrchestrationException;
import com.ozone.core.model.Task;
import com.ozone.core.model.TaskState;
import com.ozone.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Produces assessment reports for completed tasks, optionally caching one report per task.
 * A cached report lives until its task is evicted from the registry.
 */
@Service
public class AssessmentService {

    private static final Logger log = LoggerFactory.getLogger(AssessmentService.class);

    private final TaskRegistry taskRegistry;
    private final AssessmentAggregator aggregator;
    private final AssessmentProperties properties;
    private final OzoneMetrics metrics;

    private final ConcurrentHashMap<UUID, AssessmentReport> cache = new ConcurrentHashMap<>();

    public AssessmentService(TaskRegistry taskRegistry,
                             AssessmentAggregator aggregator,
                             AssessmentProperties properties,
                             EventBus eventBus,
                             @Autowired(required = false) OzoneMetrics metrics) {
        this.taskRegistry = taskRegistry;
        this.aggregator = aggregator;
        this.properties = properties;
        this.metrics = metrics;
        eventBus.subscribe(EnumSet.of(OzoneEventType.TASK_EVICTED), event -> forget(event.taskId()));
    }

    /**
     * @throws OrchestrationException NOT_FOUND, INVALID_TRANSITION unless the task is
     *         COMPLETED, NO_ASSESSMENT_AVAILABLE when every assessor failed
     */
    public AssessmentReport getAssessment(UUID taskId) {
        Task task = taskRegistry.get(taskId);
        if (task.state() != TaskState.COMPLETED) {
            throw OrchestrationException.invalidTransition(taskId, task.state(), "assess");
        }
        if (properties.isCacheReports()) {
            AssessmentReport cached = cache.get(taskId);
            if (cached != null) {
                return cached;
            }
        }

        MdcContext.setTask(taskId);
        try {
            AssessmentReport report = aggregator.aggregate(task);
            log.info("Assessed task {}: overall {} over {} dimension(s), {} warning(s)", taskId,
                    String.format("%.3f", report.overallScore()), report.dimensionScores().size(),
                    report.warnings().size());
            if (metrics != null) {
                metrics.recordAssessmentScore(report.overallScore());
            }
            if (properties.isCacheReports()) {
                AssessmentReport existing = cache.putIfAbsent(taskId, report);
                return existing != null ? existing : report;
            }
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    /** Drops the cached report of a task, if any. */
    public void forget(UUID taskId) {
        if (cache.remove(taskId) != null) {
            log.debug("Dropped cached assessment of task {}", taskId);
        }
    }

    int cachedReportCount() {
        return cache.size();
    }
}
