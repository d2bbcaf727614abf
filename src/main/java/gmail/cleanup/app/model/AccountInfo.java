package gmail.cleanup.app.model;

import lombok.Value;

@Value
public class AccountInfo {
    String emailAddress;
    Long totalMessages;
    Long threadsTotal;
    String historyId;
}
