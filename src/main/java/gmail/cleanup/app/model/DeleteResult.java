package gmail.cleanup.app.model;

import lombok.Value;

import java.util.List;

@Value
public class DeleteResult {
    int deleted;
    List<String> failed;
}
