package com.nosota.wagerbook.error;

import com.nosota.wagerbook.api.model.WagerStatus;
import lombok.Getter;

/**
 * Thrown when settlement is requested for a wager that has already left PENDING.
 * The stored state is untouched; {@link #getExistingStatus()} reports what it is.
 */
@Getter
public class AlreadySettledException extends Exception {
    private final Long wagerId;
    private final WagerStatus existingStatus;

    public AlreadySettledException(Long wagerId, WagerStatus existingStatus) {
        super("Wager already settled: wagerId=" + wagerId + ", status=" + existingStatus);
        this.wagerId = wagerId;
        this.existingStatus = existingStatus;
    }
}
