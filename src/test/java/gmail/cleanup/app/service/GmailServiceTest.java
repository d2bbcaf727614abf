package gmail.cleanup.app.service;

import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpHeaders;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.json.Json;
import com.google.api.client.testing.http.MockHttpTransport;
import com.google.api.client.testing.http.MockLowLevelHttpResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import gmail.cleanup.app.entity.MessageCategory;
import gmail.cleanup.app.exception.AuthException;
import gmail.cleanup.app.exception.RateLimitExceededException;
import gmail.cleanup.app.exception.TransportException;
import gmail.cleanup.app.model.AccountInfo;
import gmail.cleanup.app.model.MessageIdPage;
import gmail.cleanup.app.model.MessageRecord;
import gmail.cleanup.app.model.TrashOutcome;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GmailServiceTest {
    private static final String BOUNDARY = "batch_cleanup_test";
    private static final String UNAUTHORIZED_JSON =
            "{\"error\":{\"code\":401,\"message\":\"Invalid Credentials\",\"errors\":[{\"reason\":\"authError\"}]}}";

    @Test
    void parseSenderEmail_ShouldExtractLowercasedAddress() {
        assertEquals("no-reply@accounts.google.com",
                GmailService.parseSenderEmail("Google <No-Reply@Accounts.Google.com>"));
        assertEquals("plain@example.com", GmailService.parseSenderEmail(" plain@example.com "));
        assertEquals(GmailService.UNKNOWN_SENDER, GmailService.parseSenderEmail(null));
        assertEquals(GmailService.UNKNOWN_SENDER, GmailService.parseSenderEmail("  "));
    }

    @Test
    void parseSenderName_ShouldStripQuotesAndFallBackToEmail() {
        assertEquals("Jane Doe", GmailService.parseSenderName("\"Jane Doe\" <jane@example.com>", "jane@example.com"));
        assertEquals("Shop", GmailService.parseSenderName("Shop <deals@shop.com>", "deals@shop.com"));
        assertEquals("deals@shop.com", GmailService.parseSenderName("<deals@shop.com>", "deals@shop.com"));
        assertEquals("plain@example.com", GmailService.parseSenderName("plain@example.com", "plain@example.com"));
    }

    @Test
    void toRecord_ShouldMapHeadersLabelsAndInternalDate() {
        // Given
        Message message = new Message()
                .setId("m1")
                .setThreadId("t1")
                .setInternalDate(1672531200000L)
                .setLabelIds(List.of("INBOX", "UNREAD", "CATEGORY_PROMOTIONS"))
                .setPayload(new MessagePart().setHeaders(List.of(
                        new MessagePartHeader().setName("Date").setValue("Sun, 1 Jan 2023 00:00:00 +0000"),
                        new MessagePartHeader().setName("From").setValue("Big Shop <Deals@Shop.com>"))));

        // When
        MessageRecord record = GmailService.toRecord(message);

        // Then
        assertEquals("m1", record.getId());
        assertEquals("t1", record.getThreadId());
        assertEquals("deals@shop.com", record.getSenderEmail());
        assertEquals("Big Shop", record.getSenderName());
        assertEquals(Instant.parse("2023-01-01T00:00:00Z"), record.getReceivedAt());
        assertEquals(MessageCategory.PROMOTIONS, record.getCategory());
    }

    @Test
    void toRecord_WithoutFromHeaderOrCategory_ShouldUseUnknown() {
        // Given
        Message message = new Message().setId("m2").setInternalDate(0L).setLabelIds(List.of("INBOX"));

        // When
        MessageRecord record = GmailService.toRecord(message);

        // Then
        assertEquals(GmailService.UNKNOWN_SENDER, record.getSenderEmail());
        assertEquals(MessageCategory.UNKNOWN, record.getCategory());
    }

    @Test
    void translate_ShouldMapStatusCodesToExceptionTypes() {
        assertTrue(GmailService.translate("list messages", httpError(401)) instanceof AuthException);
        assertTrue(GmailService.translate("list messages", httpError(429)) instanceof RateLimitExceededException);
        assertTrue(GmailService.translate("list messages", googleError(403, "userRateLimitExceeded")) instanceof RateLimitExceededException);

        RuntimeException forbidden = GmailService.translate("list messages", googleError(403, "insufficientPermissions"));
        assertEquals(TransportException.class, forbidden.getClass());

        RuntimeException serverError = GmailService.translate("list messages", httpError(500));
        assertEquals(TransportException.class, serverError.getClass());
        assertTrue(serverError.getMessage().contains("500"));

        RuntimeException network = GmailService.translate("list messages", new IOException("connection reset"));
        assertEquals(TransportException.class, network.getClass());
        assertTrue(network.getMessage().contains("connection reset"));
    }

    @Test
    void listMessageIds_ShouldReturnIdsAndNextCursor() {
        // Given
        GmailService gmailService = new GmailService(transportReturning(200,
                "{\"messages\":[{\"id\":\"m1\",\"threadId\":\"t1\"},{\"id\":\"m2\",\"threadId\":\"t2\"}],"
                        + "\"nextPageToken\":\"page-2\",\"resultSizeEstimate\":2}"));

        // When
        MessageIdPage page = gmailService.listMessageIds("token", null, 500);

        // Then
        assertEquals(List.of("m1", "m2"), page.getIds());
        assertEquals("page-2", page.getNextCursor());
        assertFalse(page.isDone());
    }

    @Test
    void listMessageIds_OnLastPage_ShouldBeDone() {
        // Given
        GmailService gmailService = new GmailService(transportReturning(200, "{\"resultSizeEstimate\":0}"));

        // When
        MessageIdPage page = gmailService.listMessageIds("token", "page-9", 500);

        // Then
        assertTrue(page.getIds().isEmpty());
        assertTrue(page.isDone());
    }

    @Test
    void listMessageIds_WithRejectedToken_ShouldThrowAuthException() {
        // Given
        GmailService gmailService = new GmailService(transportReturning(401,
                "{\"error\":{\"code\":401,\"message\":\"Invalid Credentials\",\"errors\":[{\"reason\":\"authError\"}]}}"));

        // When & Then
        assertThrows(AuthException.class, () -> gmailService.listMessageIds("expired", null, 100));
    }

    @Test
    void getAccountInfo_ShouldMapProfile() {
        // Given
        GmailService gmailService = new GmailService(transportReturning(200,
                "{\"emailAddress\":\"me@example.com\",\"messagesTotal\":1234,\"threadsTotal\":1000,\"historyId\":\"987\"}"));

        // When
        AccountInfo info = gmailService.getAccountInfo("token");

        // Then
        assertEquals("me@example.com", info.getEmailAddress());
        assertEquals(1234L, info.getTotalMessages());
        assertEquals(1000L, info.getThreadsTotal());
        assertEquals("987", info.getHistoryId());
    }

    @Test
    void fetchHeaders_WithMoreThanBatchLimit_ShouldRejectCall() {
        // Given
        GmailService gmailService = new GmailService(transportReturning(200, "{}"));
        List<String> ids = Collections.nCopies(MailApiService.MAX_BATCH_SIZE + 1, "m");

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> gmailService.fetchHeaders("token", ids));
    }

    @Test
    void trash_WithOneRejectedId_ShouldReturnPerIdOutcomes() {
        // Given
        GmailService gmailService = new GmailService(batchTransportReturning(
                batchPart(200, "{\"id\":\"m1\",\"labelIds\":[\"TRASH\"]}"),
                batchPart(401, UNAUTHORIZED_JSON)));

        // When
        Map<String, TrashOutcome> outcomes = gmailService.trash("token", List.of("m1", "m2"));

        // Then
        assertTrue(outcomes.get("m1").isSuccess());
        assertFalse(outcomes.get("m2").isSuccess());
        assertTrue(outcomes.get("m2").getReason().contains("401"));
    }

    @Test
    void trash_WithEveryIdRejected_ShouldThrowAuthException() {
        // Given
        GmailService gmailService = new GmailService(batchTransportReturning(
                batchPart(401, UNAUTHORIZED_JSON),
                batchPart(401, UNAUTHORIZED_JSON)));

        // When & Then
        assertThrows(AuthException.class, () -> gmailService.trash("token", List.of("m1", "m2")));
    }

    private static MockHttpTransport batchTransportReturning(String... parts) {
        StringBuilder body = new StringBuilder();
        for (String part : parts) {
            body.append("--").append(BOUNDARY).append("\r\n").append(part);
        }
        body.append("--").append(BOUNDARY).append("--\r\n");
        return new MockHttpTransport.Builder()
                .setLowLevelHttpResponse(new MockLowLevelHttpResponse()
                        .setStatusCode(200)
                        .setContentType("multipart/mixed; boundary=" + BOUNDARY)
                        .setContent(body.toString()))
                .build();
    }

    private static String batchPart(int status, String json) {
        return "Content-Type: application/http\r\n"
                + "Content-Transfer-Encoding: binary\r\n"
                + "\r\n"
                + "HTTP/1.1 " + status + " " + (status == 200 ? "OK" : "Unauthorized") + "\r\n"
                + "Content-Type: application/json; charset=UTF-8\r\n"
                + "\r\n"
                + json + "\r\n";
    }

    private static MockHttpTransport transportReturning(int status, String json) {
        return new MockHttpTransport.Builder()
                .setLowLevelHttpResponse(new MockLowLevelHttpResponse()
                        .setStatusCode(status)
                        .setContentType(Json.MEDIA_TYPE)
                        .setContent(json))
                .build();
    }

    private static HttpResponseException httpError(int status) {
        return new HttpResponseException.Builder(status, "status " + status, new HttpHeaders()).build();
    }

    private static GoogleJsonResponseException googleError(int status, String reason) {
        GoogleJsonError.ErrorInfo info = new GoogleJsonError.ErrorInfo();
        info.setReason(reason);
        GoogleJsonError details = new GoogleJsonError();
        details.setCode(status);
        details.setMessage(reason);
        details.setErrors(List.of(info));
        return new GoogleJsonResponseException(
                new HttpResponseException.Builder(status, "status " + status, new HttpHeaders()), details);
    }
}
