package com.nosota.wagerbook.api.dto;

import com.nosota.wagerbook.api.model.Selection;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class LineDTO {
    private Long id;
    private Long marketId;
    private Selection selection;
    private BigDecimal point;
    private Integer price;
    private String source;
    private Instant capturedAt;
}
