package tribe.scheduler.model;

/**
 * Outcome of one entry of a batch submission.
 *
 * @param index           position of the entry in the submitted list
 * @param executionId     id of the scheduled execution, null if rejected
 * @param rejectionReason why the entry was rejected, null if accepted
 */
public record BatchEntryResult(int index, String executionId, String rejectionReason) {

    public static BatchEntryResult accepted(int index, String executionId) {
        return new BatchEntryResult(index, executionId, null);
    }

    public static BatchEntryResult rejected(int index, String reason) {
        return new BatchEntryResult(index, null, reason);
    }

    public boolean isAccepted() {
        return executionId != null;
    }
}
