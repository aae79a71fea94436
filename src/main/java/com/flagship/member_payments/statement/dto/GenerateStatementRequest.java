package com.flagship.member_payments.statement.dto;

import com.flagship.member_payments.statement.StatementFormat;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenerateStatementRequest {

    @NotNull(message = "dateFrom is required")
    private LocalDate dateFrom;

    @NotNull(message = "dateTo is required")
    private LocalDate dateTo;

    @NotNull(message = "format is required")
    private StatementFormat format;

    /**
     * Defaults to INR.
     */
    private String currency;
}
