package villagecompute.courier.jobs;

import java.util.Map;

/**
 * Parameter coercion shared by job templates. JSON round trips turn numbers into Integer, Long or Double, and admin
 * clients sometimes send numbers as strings, so every accessor accepts all of them.
 */
final class TemplateParameters {

    private TemplateParameters() {
        // Utility class, no instantiation
    }

    static int intValue(Map<String, Object> parameters, String name, int defaultValue) {
        Object value = parameters.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        return Integer.parseInt(value.toString().trim());
    }

    /**
     * Checks an optional integer parameter lies within {@code [min, max]}.
     *
     * @return null when absent or valid, otherwise an error message
     */
    static String checkRange(Map<String, Object> parameters, String name, int min, int max) {
        if (!parameters.containsKey(name) || parameters.get(name) == null) {
            return null;
        }
        int value;
        try {
            value = intValue(parameters, name, min);
        } catch (NumberFormatException e) {
            return name + " must be an integer";
        }
        if (value < min || value > max) {
            return name + " must be between " + min + " and " + max;
        }
        return null;
    }

    /**
     * Validates several integer ranges, each given as {@code {name, min, max}} triples flattened into the varargs.
     */
    static ParameterValidation checkRanges(Map<String, Object> parameters, Object... nameMinMax) {
        for (int i = 0; i + 2 < nameMinMax.length; i += 3) {
            String error = checkRange(parameters, (String) nameMinMax[i], (Integer) nameMinMax[i + 1],
                    (Integer) nameMinMax[i + 2]);
            if (error != null) {
                return ParameterValidation.invalid(error);
            }
        }
        return ParameterValidation.ok();
    }
}
