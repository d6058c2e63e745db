package villagecompute.courier.jobs;

/**
 * Outcome of {@link JobTemplate#validateParameters(java.util.Map)}.
 *
 * @param valid
 *            whether the parameters were accepted
 * @param error
 *            reason for rejection, null when valid
 */
public record ParameterValidation(boolean valid, String error) {

    private static final ParameterValidation OK = new ParameterValidation(true, null);

    public static ParameterValidation ok() {
        return OK;
    }

    public static ParameterValidation invalid(String error) {
        return new ParameterValidation(false, error);
    }
}
