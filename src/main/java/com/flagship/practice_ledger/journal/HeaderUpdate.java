package com.flagship.practice_ledger.journal;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Optional header changes applied together with a line replacement. Null means unchanged.
 */
@Value
@Builder
public class HeaderUpdate {
    LocalDate entryDate;
    String reference;
    String description;
    Boolean posted;
    Long userId;

    public static HeaderUpdate none() {
        return HeaderUpdate.builder().build();
    }
}
