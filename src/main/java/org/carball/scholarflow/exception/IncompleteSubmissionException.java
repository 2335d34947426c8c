package org.carball.scholarflow.exception;

import lombok.Getter;
import org.carball.scholarflow.model.schema.MissingItem;

import java.util.List;
import java.util.stream.Collectors;

@Getter
public class IncompleteSubmissionException extends WorkflowException {

    private final String applicationId;
    private final List<MissingItem> missingItems;

    public IncompleteSubmissionException(String applicationId, List<MissingItem> missingItems) {
        super("INCOMPLETE_SUBMISSION", String.format("Application %s is missing %d required item(s): %s",
                applicationId, missingItems.size(),
                missingItems.stream().map(MissingItem::describe).collect(Collectors.joining(", "))));
        this.applicationId = applicationId;
        this.missingItems = List.copyOf(missingItems);
    }
}
