package org.carball.scholarflow.model.scholarship;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder(toBuilder = true)
public class SubScholarship {
    private String code;
    private String nameZh;
    private String nameEn;
    private BigDecimal amount;
}
