package tribe.scheduler.worker;

import tribe.scheduler.model.ErrorKind;

/**
 * Outcome of a single executor call.
 *
 * @param success   whether the call returned normally
 * @param result    returned value on success
 * @param error     failure message otherwise
 * @param errorKind failure classification, null on success
 */
public record AttemptResult(boolean success, String result, String error, ErrorKind errorKind) {

    public static final String TIMEOUT_MESSAGE = "execution timed out";

    public static AttemptResult success(String result) {
        return new AttemptResult(true, result, null, null);
    }

    public static AttemptResult timedOut() {
        return new AttemptResult(false, null, TIMEOUT_MESSAGE, ErrorKind.EXECUTION_TIMEOUT);
    }

    public static AttemptResult failed(String error) {
        return new AttemptResult(false, null, error, ErrorKind.EXECUTOR_FAILURE);
    }
}
