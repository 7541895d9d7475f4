package com.flagship.practice_ledger.chartimport;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One spreadsheet row of a chart-of-accounts import. Group names are free text and are
 * matched against predefined kinds or existing custom groups.
 */
@Value
@Builder
public class ChartImportRow {

    @NotBlank(message = "Account name is required")
    @Size(max = 255)
    String accountName;

    @NotBlank(message = "Main group name is required")
    String mainGroupName;

    @NotBlank(message = "Element group name is required")
    String elementGroupName;

    @NotBlank(message = "Sub-element group name is required")
    @Size(max = 255)
    String subElementGroupName;

    @NotBlank(message = "Detailed group name is required")
    @Size(max = 255)
    String detailedGroupName;

    String description;

    @Digits(integer = 15, fraction = 4, message = "Opening balance has too many digits")
    BigDecimal openingBalance;
}
