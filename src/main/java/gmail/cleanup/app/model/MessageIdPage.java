package gmail.cleanup.app.model;

import lombok.Value;

import java.util.List;

/**
 * One page of message ids from the Gmail listing.
 */
@Value
public class MessageIdPage {
    List<String> ids;
    String nextCursor;
    boolean done;
}
