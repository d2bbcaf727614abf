package gmail.cleanup.app.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DeleteRequest {
    private List<String> ids = new ArrayList<>();
}
