package com.nosota.wagerbook.api.dto;

import com.nosota.wagerbook.api.model.LedgerEntryType;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class LedgerEntryDTO {
    private Long id;
    private Long userId;
    private Long wagerId;
    private LedgerEntryType type;
    private Long amount;
    private String description;
    private Instant createdAt;
}
