package com.fintracker.infrastructure.persistence.entity;

import com.fintracker.domain.model.RecurrenceFrequency;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Row of the {@code transactions} table.
 *
 * The same table holds plain transactions, recurring templates ({@code recurring = true})
 * and the instances generated from a template ({@code parentTransactionId} set).
 * At most one instance exists per (parentTransactionId, date).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TransactionEntity {

    private Long id;

    private Long walletId;

    private TransactionType type;

    private BigDecimal amount;

    private String category;

    private String notes;

    private LocalDate date;

    private boolean recurring;

    private RecurrenceFrequency recurrenceFrequency;

    private LocalDate recurrenceEndDate;

    private Long parentTransactionId;

    private Instant createdAt;

    public boolean isGeneratedInstance() {
        return parentTransactionId != null;
    }

    public enum TransactionType {
        INCOME("income"),
        EXPENSE("expense");

        private final String code;

        TransactionType(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }

        public static TransactionType fromCode(String code) {
            for (TransactionType type : values()) {
                if (type.code.equalsIgnoreCase(code)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown transaction type: " + code);
        }
    }
}
