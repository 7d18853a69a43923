package com.fintracker.infrastructure.persistence.repository;

import com.fintracker.domain.model.RecurrenceFrequency;
import com.fintracker.infrastructure.persistence.entity.TransactionEntity;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class JdbcTransactionRepository implements TransactionRepository {

    private static final String SELECT_COLUMNS = """
            SELECT id, wallet_id, type, amount, category, notes, date, is_recurring,
                   recurrence_frequency, recurrence_end_date, parent_transaction_id, created_at
            FROM transactions
            """;

    private static final RowMapper<TransactionEntity> ROW_MAPPER = (rs, rowNum) -> {
        long parentId = rs.getLong("parent_transaction_id");
        Long parentTransactionId = rs.wasNull() ? null : parentId;
        String frequency = rs.getString("recurrence_frequency");
        String endDate = rs.getString("recurrence_end_date");
        String createdAt = rs.getString("created_at");

        return TransactionEntity.builder()
                .id(rs.getLong("id"))
                .walletId(rs.getLong("wallet_id"))
                .type(TransactionEntity.TransactionType.fromCode(rs.getString("type")))
                .amount(new BigDecimal(rs.getString("amount")))
                .category(rs.getString("category"))
                .notes(rs.getString("notes"))
                .date(LocalDate.parse(rs.getString("date")))
                .recurring(rs.getInt("is_recurring") == 1)
                .recurrenceFrequency(frequency != null ? RecurrenceFrequency.fromCode(frequency) : null)
                .recurrenceEndDate(endDate != null ? LocalDate.parse(endDate) : null)
                .parentTransactionId(parentTransactionId)
                .createdAt(createdAt != null ? Instant.parse(createdAt) : null)
                .build();
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcTransactionRepository(NamedParameterJdbcTemplate jdbcTemplate,
                                     PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public List<TransactionEntity> findActiveRecurringTemplates(LocalDate today) {
        return jdbcTemplate.query(SELECT_COLUMNS + """
                WHERE is_recurring = 1
                  AND (recurrence_end_date IS NULL OR recurrence_end_date >= :today)
                ORDER BY id
                """,
            Map.of("today", today.toString()),
            ROW_MAPPER
        );
    }

    @Override
    public List<TransactionEntity> findRecurringTemplates() {
        return jdbcTemplate.query(SELECT_COLUMNS + """
                WHERE is_recurring = 1
                ORDER BY date DESC, id DESC
                """,
            Map.of(),
            ROW_MAPPER
        );
    }

    @Override
    public Optional<TransactionEntity> findById(long id) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = :id",
                Map.of("id", id),
                ROW_MAPPER
            )
            .stream()
            .findFirst();
    }

    @Override
    public Optional<LocalDate> findLatestInstanceDate(long templateId) {
        String latest = jdbcTemplate.queryForObject("""
                SELECT MAX(date) FROM transactions
                WHERE parent_transaction_id = :templateId
                """,
            Map.of("templateId", templateId),
            String.class
        );
        return Optional.ofNullable(latest).map(LocalDate::parse);
    }

    @Override
    public List<TransactionEntity> findInstances(long templateId) {
        return jdbcTemplate.query(SELECT_COLUMNS + """
                WHERE parent_transaction_id = :templateId
                ORDER BY date
                """,
            Map.of("templateId", templateId),
            ROW_MAPPER
        );
    }

    @Override
    public long insertTemplate(TransactionEntity template) {
        Long id = transactionTemplate.execute(status -> {
            jdbcTemplate.update("""
                    INSERT INTO transactions
                    (wallet_id, type, amount, category, date, notes, is_recurring,
                     recurrence_frequency, recurrence_end_date, created_at)
                    VALUES (:walletId, :type, :amount, :category, :date, :notes, 1,
                            :frequency, :endDate, :createdAt)
                    """,
                new MapSqlParameterSource()
                    .addValue("walletId", template.getWalletId())
                    .addValue("type", template.getType().getCode())
                    .addValue("amount", template.getAmount().toPlainString())
                    .addValue("category", template.getCategory())
                    .addValue("date", template.getDate().toString())
                    .addValue("notes", template.getNotes())
                    .addValue("frequency", template.getRecurrenceFrequency().getCode())
                    .addValue("endDate", template.getRecurrenceEndDate() != null ?
                        template.getRecurrenceEndDate().toString() : null)
                    .addValue("createdAt", template.getCreatedAt().toString())
            );
            // same connection as the insert while the transaction is open
            return jdbcTemplate.queryForObject("SELECT last_insert_rowid()", Map.of(), Long.class);
        });

        if (id == null) {
            throw new IllegalStateException("Failed to read id of inserted recurring template");
        }
        return id;
    }

    @Override
    public int insertInstancesIfAbsent(TransactionEntity template, List<LocalDate> dates, Instant createdAt) {
        if (dates.isEmpty()) {
            return 0;
        }

        SqlParameterSource[] batch = dates.stream()
            .map(date -> new MapSqlParameterSource()
                .addValue("walletId", template.getWalletId())
                .addValue("type", template.getType().getCode())
                .addValue("amount", template.getAmount().toPlainString())
                .addValue("category", template.getCategory())
                .addValue("date", date.toString())
                .addValue("notes", template.getNotes())
                .addValue("parentId", template.getId())
                .addValue("createdAt", createdAt.toString()))
            .toArray(SqlParameterSource[]::new);

        Integer inserted = transactionTemplate.execute(status -> {
            int[] counts = jdbcTemplate.batchUpdate("""
                    INSERT INTO transactions
                    (wallet_id, type, amount, category, date, notes, parent_transaction_id, created_at)
                    VALUES (:walletId, :type, :amount, :category, :date, :notes, :parentId, :createdAt)
                    ON CONFLICT (parent_transaction_id, date) DO NOTHING
                    """,
                batch
            );
            int total = 0;
            for (int count : counts) {
                total += Math.max(count, 0);
            }
            return total;
        });
        return inserted != null ? inserted : 0;
    }

    @Override
    public int cancelRecurrence(long templateId, LocalDate endDate) {
        return jdbcTemplate.update("""
                UPDATE transactions
                SET is_recurring = 0, recurrence_end_date = :endDate
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("endDate", endDate.toString())
                .addValue("id", templateId)
        );
    }

    @Override
    public int updateRecurrence(long templateId, RecurrenceFrequency frequency, LocalDate endDate) {
        return jdbcTemplate.update("""
                UPDATE transactions
                SET recurrence_frequency = :frequency, recurrence_end_date = :endDate
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("frequency", frequency.getCode())
                .addValue("endDate", endDate != null ? endDate.toString() : null)
                .addValue("id", templateId)
        );
    }
}
