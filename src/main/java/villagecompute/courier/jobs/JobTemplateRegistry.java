package villagecompute.courier.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.courier.exceptions.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Maps template type keys to {@link JobTemplate} beans.
 *
 * <p>
 * Populated once at startup from every CDI-managed {@link JobTemplate}. Two beans claiming the same key fail the
 * application at boot rather than at tick time.
 */
@ApplicationScoped
public class JobTemplateRegistry {

    private static final Logger LOG = Logger.getLogger(JobTemplateRegistry.class);

    private final Map<String, JobTemplate> templates;

    @Inject
    public JobTemplateRegistry(Instance<JobTemplate> templates) {
        this.templates = buildRegistry(templates);
        LOG.infof("Initialized JobTemplateRegistry with %d templates: %s", this.templates.size(),
                this.templates.keySet());
    }

    private Map<String, JobTemplate> buildRegistry(Iterable<JobTemplate> beans) {
        Map<String, JobTemplate> registry = new TreeMap<>();
        for (JobTemplate template : beans) {
            String type = template.templateType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate job templates registered for type '" + type + "': "
                        + registry.get(type).getClass().getName() + " and " + template.getClass().getName());
            }
            registry.put(type, template);
            LOG.debugf("Registered template %s for type %s", template.getClass().getSimpleName(), type);
        }
        return Collections.unmodifiableMap(registry);
    }

    public Optional<JobTemplate> find(String templateType) {
        if (templateType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(templates.get(templateType));
    }

    /**
     * @throws ValidationException
     *             if no template is registered under the type
     */
    public JobTemplate get(String templateType) {
        return find(templateType)
                .orElseThrow(() -> new ValidationException("Unknown template type: " + templateType));
    }

    public List<JobTemplate> list() {
        return new ArrayList<>(templates.values());
    }

    /**
     * Resolves the template and validates parameters against it.
     *
     * @return the template
     * @throws ValidationException
     *             for an unknown type or rejected parameters
     */
    public JobTemplate validate(String templateType, Map<String, Object> parameters) {
        JobTemplate template = get(templateType);
        ParameterValidation validation = template
                .validateParameters(parameters == null ? Map.of() : parameters);
        if (!validation.valid()) {
            throw new ValidationException("Invalid parameters for template " + templateType + ": "
                    + validation.error());
        }
        return template;
    }

    /**
     * Job parameters laid over the template defaults.
     */
    public static Map<String, Object> effectiveParameters(JobTemplate template, Map<String, Object> parameters) {
        Map<String, Object> merged = new HashMap<>(template.defaultParameters());
        if (parameters != null) {
            merged.putAll(parameters);
        }
        return merged;
    }
}
