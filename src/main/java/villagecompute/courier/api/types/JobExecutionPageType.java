package villagecompute.courier.api.types;

import java.util.List;

/**
 * One page of a job's execution history.
 */
public record JobExecutionPageType(List<JobExecutionType> executions, long total, int page, int size) {
}
