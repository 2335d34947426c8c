package org.carball.scholarflow.model.schema;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-field validation bounds. Which bounds apply depends on the field's {@link FieldType}.
 */
@Data
@Builder(toBuilder = true)
public class FieldConstraints {
    private BigDecimal minValue;
    private BigDecimal maxValue;
    private Integer maxLength;

    @Builder.Default
    private List<String> options = new ArrayList<>();

    public static FieldConstraints none() {
        return FieldConstraints.builder().build();
    }
}
