package gmail.cleanup.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "cached_messages", indexes = {
        @Index(name = "idx_cached_messages_sender", columnList = "senderEmail"),
        @Index(name = "idx_cached_messages_received", columnList = "receivedAt")
})
@Data
public class CachedMessage {
    public static final int SENDER_EMAIL_LENGTH = 512;
    public static final int SENDER_NAME_LENGTH = 1000;

    @Id
    private String id; // Gmail message id

    @Column(nullable = false, length = SENDER_EMAIL_LENGTH)
    private String senderEmail;

    @Column(length = SENDER_NAME_LENGTH)
    private String senderName;

    @Column(nullable = false)
    private Instant receivedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MessageCategory category;

    private String threadId;

    @Column(nullable = false)
    private Instant fetchedAt;
}
