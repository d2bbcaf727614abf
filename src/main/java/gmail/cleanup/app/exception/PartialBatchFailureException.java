package gmail.cleanup.app.exception;

import gmail.cleanup.app.model.MessageRecord;

import java.util.List;
import java.util.Map;

/**
 * Some ids of a batch call failed while the rest succeeded.
 * Carries the successful records so they are not lost.
 */
public class PartialBatchFailureException extends RuntimeException {
    private final List<MessageRecord> fetched;
    private final Map<String, String> failures;

    public PartialBatchFailureException(List<MessageRecord> fetched, Map<String, String> failures) {
        super(failures.size() + " of " + (fetched.size() + failures.size()) + " messages in batch failed");
        this.fetched = List.copyOf(fetched);
        this.failures = Map.copyOf(failures);
    }

    public List<MessageRecord> getFetched() {
        return fetched;
    }

    /**
     * @return failed message id mapped to the failure reason
     */
    public Map<String, String> getFailures() {
        return failures;
    }
}
