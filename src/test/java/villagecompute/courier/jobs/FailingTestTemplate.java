package villagecompute.courier.jobs;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;

/**
 * Test template whose body always throws.
 */
@ApplicationScoped
public class FailingTestTemplate implements JobTemplate {

    public static final String TEMPLATE_TYPE = "test_failing";

    public static final String ERROR = "simulated failure";

    @Override
    public String templateType() {
        return TEMPLATE_TYPE;
    }

    @Override
    public String description() {
        return "Always fails, for retry tests";
    }

    @Override
    public ParameterValidation validateParameters(Map<String, Object> parameters) {
        return ParameterValidation.ok();
    }

    @Override
    public JobResult execute(JobContext context) {
        throw new IllegalStateException(ERROR);
    }
}
