package com.fintracker.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request to start a recurring transaction.
 *
 * {@code date} is the first occurrence; instances are generated for the periods after it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewRecurringTransaction {

    private Long walletId;
    private TransactionType type;
    private BigDecimal amount;
    private String category;
    private String notes;
    private LocalDate date;
    private RecurrenceFrequency frequency;
    private LocalDate endDate;

    public enum TransactionType {
        INCOME,
        EXPENSE
    }
}
