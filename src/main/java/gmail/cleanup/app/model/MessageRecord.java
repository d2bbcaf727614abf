package gmail.cleanup.app.model;

import gmail.cleanup.app.entity.MessageCategory;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Header metadata of one Gmail message as fetched from the API.
 */
@Value
@Builder(toBuilder = true)
public class MessageRecord {
    String id;
    String senderEmail;
    String senderName;
    Instant receivedAt;
    MessageCategory category;
    String threadId;
}
