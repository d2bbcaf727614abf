package gmail.cleanup.app.service;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.batch.BatchRequest;
import com.google.api.client.googleapis.batch.json.JsonBatchCallback;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpHeaders;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePartHeader;
import com.google.api.services.gmail.model.Profile;
import gmail.cleanup.app.entity.MessageCategory;
import gmail.cleanup.app.exception.AuthException;
import gmail.cleanup.app.exception.PartialBatchFailureException;
import gmail.cleanup.app.exception.RateLimitExceededException;
import gmail.cleanup.app.exception.TransportException;
import gmail.cleanup.app.model.AccountInfo;
import gmail.cleanup.app.model.MessageIdPage;
import gmail.cleanup.app.model.MessageRecord;
import gmail.cleanup.app.model.TrashOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
public class GmailService implements MailApiService {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String APPLICATION_NAME = "Gmail Cleanup";
    private static final String ME = "me";
    private static final List<String> METADATA_HEADERS = List.of("From", "Date");
    private static final Pattern ANGLE_ADDRESS = Pattern.compile("<(.+?)>");
    private static final Set<String> RATE_LIMIT_REASONS = Set.of("rateLimitExceeded", "userRateLimitExceeded");
    static final String UNKNOWN_SENDER = "unknown";

    private final HttpTransport httpTransport;

    @Autowired
    public GmailService() throws GeneralSecurityException, IOException {
        this(GoogleNetHttpTransport.newTrustedTransport());
    }

    GmailService(HttpTransport httpTransport) {
        this.httpTransport = httpTransport;
    }

    Gmail getGmailService(String accessToken) {
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
            .setTransport(httpTransport)
            .setJsonFactory(JSON_FACTORY)
            .build();
        credential.setAccessToken(accessToken);

        return new Gmail.Builder(httpTransport, JSON_FACTORY, credential)
            .setApplicationName(APPLICATION_NAME)
            .build();
    }

    @Override
    public MessageIdPage listMessageIds(String accessToken, String cursor, int pageSize) {
        Gmail service = getGmailService(accessToken);
        try {
            Gmail.Users.Messages.List request = service.users().messages().list(ME)
                .setMaxResults((long) Math.min(pageSize, MAX_PAGE_SIZE))
                .setIncludeSpamTrash(false);
            if (cursor != null && !cursor.isEmpty()) {
                request.setPageToken(cursor);
            }
            ListMessagesResponse response = request.execute();

            List<String> ids = new ArrayList<>();
            if (response.getMessages() != null) {
                for (Message messageRef : response.getMessages()) {
                    ids.add(messageRef.getId());
                }
            }
            String nextPageToken = response.getNextPageToken();
            return new MessageIdPage(ids, nextPageToken, nextPageToken == null || nextPageToken.isEmpty());
        } catch (IOException e) {
            throw translate("list messages", e);
        }
    }

    /**
     * Fetches metadata for up to 100 messages in a single HTTP batch request.
     * Per-message failures are collected and reported together once the batch completes.
     */
    @Override
    public List<MessageRecord> fetchHeaders(String accessToken, List<String> messageIds) {
        if (messageIds.isEmpty()) {
            return List.of();
        }
        checkBatchSize(messageIds);
        Gmail service = getGmailService(accessToken);

        Map<String, MessageRecord> fetched = new LinkedHashMap<>();
        Map<String, GoogleJsonError> errors = new LinkedHashMap<>();
        try {
            BatchRequest batch = service.batch();
            for (String messageId : messageIds) {
                service.users().messages().get(ME, messageId)
                    .setFormat("metadata")
                    .setMetadataHeaders(METADATA_HEADERS)
                    .queue(batch, new JsonBatchCallback<Message>() {
                        @Override
                        public void onSuccess(Message message, HttpHeaders responseHeaders) {
                            fetched.put(messageId, toRecord(message));
                        }

                        @Override
                        public void onFailure(GoogleJsonError error, HttpHeaders responseHeaders) {
                            errors.put(messageId, error);
                        }
                    });
            }
            batch.execute();
        } catch (IOException e) {
            throw translate("fetch message headers", e);
        }

        if (errors.isEmpty()) {
            return new ArrayList<>(fetched.values());
        }
        log.debug("Header batch: {} fetched, {} failed", fetched.size(), errors.size());
        throwIfBatchFailed("fetch message headers", errors, fetched.isEmpty());

        Map<String, String> failures = new LinkedHashMap<>();
        errors.forEach((id, error) -> failures.put(id, describe(error)));
        throw new PartialBatchFailureException(new ArrayList<>(fetched.values()), failures);
    }

    @Override
    public Map<String, TrashOutcome> trash(String accessToken, List<String> messageIds) {
        if (messageIds.isEmpty()) {
            return Map.of();
        }
        checkBatchSize(messageIds);
        Gmail service = getGmailService(accessToken);

        Map<String, TrashOutcome> outcomes = new LinkedHashMap<>();
        Map<String, GoogleJsonError> errors = new LinkedHashMap<>();
        try {
            BatchRequest batch = service.batch();
            for (String messageId : messageIds) {
                service.users().messages().trash(ME, messageId)
                    .queue(batch, new JsonBatchCallback<Message>() {
                        @Override
                        public void onSuccess(Message message, HttpHeaders responseHeaders) {
                            outcomes.put(messageId, TrashOutcome.success());
                        }

                        @Override
                        public void onFailure(GoogleJsonError error, HttpHeaders responseHeaders) {
                            errors.put(messageId, error);
                            outcomes.put(messageId, TrashOutcome.failure(describe(error)));
                        }
                    });
            }
            batch.execute();
        } catch (IOException e) {
            throw translate("trash messages", e);
        }

        if (!errors.isEmpty()) {
            log.warn("Trash batch: {} of {} messages failed", errors.size(), messageIds.size());
            // Partial failures, a 401 included, are reported per id
            if (errors.size() == messageIds.size()) {
                throwIfBatchFailed("trash messages", errors, true);
            }
        }
        return outcomes;
    }

    @Override
    public AccountInfo getAccountInfo(String accessToken) {
        Gmail service = getGmailService(accessToken);
        try {
            Profile profile = service.users().getProfile(ME).execute();
            return new AccountInfo(
                profile.getEmailAddress(),
                profile.getMessagesTotal() != null ? profile.getMessagesTotal().longValue() : null,
                profile.getThreadsTotal() != null ? profile.getThreadsTotal().longValue() : null,
                profile.getHistoryId() != null ? profile.getHistoryId().toString() : null);
        } catch (IOException e) {
            throw translate("get profile", e);
        }
    }

    /**
     * Converts a metadata-format message into a cache record.
     */
    static MessageRecord toRecord(Message message) {
        String from = null;
        if (message.getPayload() != null && message.getPayload().getHeaders() != null) {
            for (MessagePartHeader header : message.getPayload().getHeaders()) {
                if ("from".equalsIgnoreCase(header.getName())) {
                    from = header.getValue();
                    break;
                }
            }
        }
        String senderEmail = parseSenderEmail(from);
        Instant receivedAt = message.getInternalDate() != null
            ? Instant.ofEpochMilli(message.getInternalDate())
            : Instant.EPOCH;

        return MessageRecord.builder()
            .id(message.getId())
            .senderEmail(senderEmail)
            .senderName(parseSenderName(from, senderEmail))
            .receivedAt(receivedAt)
            .category(MessageCategory.fromLabelIds(message.getLabelIds()))
            .threadId(message.getThreadId())
            .build();
    }

    /**
     * "Google &lt;no-reply@accounts.google.com&gt;" becomes "no-reply@accounts.google.com".
     * A header without angle brackets is taken as the address itself.
     */
    static String parseSenderEmail(String fromHeader) {
        if (fromHeader == null || fromHeader.isBlank()) {
            return UNKNOWN_SENDER;
        }
        Matcher matcher = ANGLE_ADDRESS.matcher(fromHeader);
        String address = matcher.find() ? matcher.group(1) : fromHeader;
        return address.trim().toLowerCase(Locale.ROOT);
    }

    static String parseSenderName(String fromHeader, String senderEmail) {
        if (fromHeader == null || !fromHeader.contains("<")) {
            return senderEmail;
        }
        String name = fromHeader.substring(0, fromHeader.indexOf('<')).trim();
        if (name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"")) {
            name = name.substring(1, name.length() - 1).trim();
        }
        return name.isEmpty() ? senderEmail : name;
    }

    /**
     * Maps a failed HTTP call to the engine's exception types.
     */
    static RuntimeException translate(String action, IOException e) {
        if (e instanceof HttpResponseException) {
            HttpResponseException httpError = (HttpResponseException) e;
            String reason = null;
            if (e instanceof GoogleJsonResponseException) {
                reason = firstReason(((GoogleJsonResponseException) e).getDetails());
            }
            String message = "Failed to " + action + ": HTTP " + httpError.getStatusCode() + " " + httpError.getStatusMessage();
            if (isAuthFailure(httpError.getStatusCode())) {
                return new AuthException(message, e);
            }
            if (isRateLimited(httpError.getStatusCode(), reason)) {
                return new RateLimitExceededException(message, e);
            }
            return new TransportException(message, e);
        }
        return new TransportException("Failed to " + action + ": " + e.getMessage(), e);
    }

    /**
     * Raises a call-level exception when the per-message errors of a batch amount to a failed call:
     * any rejected credential, or every message failing.
     */
    private static void throwIfBatchFailed(String action, Map<String, GoogleJsonError> errors, boolean allFailed) {
        boolean rateLimited = false;
        for (GoogleJsonError error : errors.values()) {
            if (isAuthFailure(error.getCode())) {
                throw new AuthException("Failed to " + action + ": " + describe(error));
            }
            rateLimited |= isRateLimited(error.getCode(), firstReason(error));
        }
        if (allFailed) {
            String message = "Failed to " + action + ": all " + errors.size() + " messages failed, first error: "
                + describe(errors.values().iterator().next());
            if (rateLimited) {
                throw new RateLimitExceededException(message, null);
            }
            throw new TransportException(message);
        }
    }

    private static boolean isAuthFailure(int statusCode) {
        return statusCode == 401;
    }

    private static boolean isRateLimited(int statusCode, String reason) {
        return statusCode == 429 || (statusCode == 403 && reason != null && RATE_LIMIT_REASONS.contains(reason));
    }

    private static String firstReason(GoogleJsonError error) {
        if (error == null || error.getErrors() == null || error.getErrors().isEmpty()) {
            return null;
        }
        return error.getErrors().get(0).getReason();
    }

    private static String describe(GoogleJsonError error) {
        return error.getCode() + " " + error.getMessage();
    }

    private static void checkBatchSize(List<String> messageIds) {
        if (messageIds.size() > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("At most " + MAX_BATCH_SIZE + " ids per call, got " + messageIds.size());
        }
    }
}
