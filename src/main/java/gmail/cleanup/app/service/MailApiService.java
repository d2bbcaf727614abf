package gmail.cleanup.app.service;

import gmail.cleanup.app.model.AccountInfo;
import gmail.cleanup.app.model.MessageIdPage;
import gmail.cleanup.app.model.MessageRecord;
import gmail.cleanup.app.model.TrashOutcome;

import java.util.List;
import java.util.Map;

/**
 * Interface for the Gmail operations the cleanup engine needs.
 * Implementations are stateless transports: callers pass the access token and wrap every call
 * with the {@link RateLimiter}.
 *
 * <p>All methods throw {@link gmail.cleanup.app.exception.AuthException} when the token is rejected,
 * {@link gmail.cleanup.app.exception.RateLimitExceededException} when Gmail throttles the caller and
 * {@link gmail.cleanup.app.exception.TransportException} for any other remote failure.
 */
public interface MailApiService {
    /**
     * Maximum number of ids accepted by {@link #fetchHeaders} and {@link #trash} in one call.
     */
    int MAX_BATCH_SIZE = 100;

    /**
     * Maximum page size of {@link #listMessageIds}.
     */
    int MAX_PAGE_SIZE = 500;

    /**
     * List message ids in mailbox order, excluding spam and trash.
     * @param accessToken OAuth access token
     * @param cursor page token returned by the previous call, or null for the first page
     * @param pageSize number of ids to return, at most {@link #MAX_PAGE_SIZE}
     * @return the page of ids and the cursor of the next page
     */
    MessageIdPage listMessageIds(String accessToken, String cursor, int pageSize);

    /**
     * Fetch sender, date, labels and thread of each message.
     * @param accessToken OAuth access token
     * @param messageIds at most {@link #MAX_BATCH_SIZE} ids
     * @return one record per message id
     * @throws gmail.cleanup.app.exception.PartialBatchFailureException if only some ids could be fetched
     */
    List<MessageRecord> fetchHeaders(String accessToken, List<String> messageIds);

    /**
     * Move messages to Trash.
     * @param accessToken OAuth access token
     * @param messageIds at most {@link #MAX_BATCH_SIZE} ids
     * @return outcome per message id
     */
    Map<String, TrashOutcome> trash(String accessToken, List<String> messageIds);

    /**
     * Get the mailbox profile.
     * @param accessToken OAuth access token
     * @return address and message/thread totals
     */
    AccountInfo getAccountInfo(String accessToken);
}
