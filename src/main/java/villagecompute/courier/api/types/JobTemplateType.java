package villagecompute.courier.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * API response type describing a registered job template.
 */
public record JobTemplateType(@JsonProperty("template_type") String templateType, String description,
        @JsonProperty("default_parameters") Map<String, Object> defaultParameters) {
}
