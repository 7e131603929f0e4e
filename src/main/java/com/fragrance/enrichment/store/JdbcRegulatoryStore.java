package com.fragrance.enrichment.store;

import com.fragrance.enrichment.model.CategoryLimit;
import com.fragrance.enrichment.model.RegulatoryCategory;
import com.fragrance.enrichment.model.RegulatoryRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * JDBC-backed regulatory standards table.
 */
@Repository
@RequiredArgsConstructor
public class JdbcRegulatoryStore implements RegulatoryStore {

    private static final String CATEGORY_COLUMNS = Stream.of(RegulatoryCategory.values())
            .map(RegulatoryCategory::column)
            .collect(Collectors.joining(", "));

    private final NamedParameterJdbcTemplate jdbc;

    private final Clock clock;

    @Override
    public Optional<RegulatoryRecord> findByRegistry(final String casNumber, final String owner) {
        List<RegulatoryRecord> rows = jdbc.query("""
                        SELECT * FROM ifra_library WHERE cas_number = :cas AND owner_id = :owner
                        """,
                new MapSqlParameterSource().addValue("cas", casNumber.trim()).addValue("owner", owner),
                ROW_MAPPER);
        return rows.stream().findFirst();
    }

    @Override
    @Transactional
    public boolean upsert(final RegulatoryRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("cas", record.getCasNumber())
                .addValue("owner", record.getOwner())
                .addValue("name", record.getName())
                .addValue("amendment", record.getAmendment())
                .addValue("type", record.getRestrictionType())
                .addValue("risk", record.getRiskClass())
                .addValue("now", Timestamp.from(clock.instant()));
        for (RegulatoryCategory category : RegulatoryCategory.values()) {
            params.addValue(category.column(), record.limit(category).toColumnValue());
        }

        String assignments = Stream.of(RegulatoryCategory.values())
                .map(c -> c.column() + " = :" + c.column())
                .collect(Collectors.joining(", "));
        int updated = jdbc.update("UPDATE ifra_library SET name = :name, amendment = :amendment, "
                + "restriction_type = :type, risk_class = :risk, updated_at = :now, " + assignments
                + " WHERE cas_number = :cas AND owner_id = :owner", params);
        if (updated > 0) {
            return false;
        }

        String placeholders = Stream.of(RegulatoryCategory.values())
                .map(c -> ":" + c.column())
                .collect(Collectors.joining(", "));
        jdbc.update("INSERT INTO ifra_library (name, cas_number, owner_id, amendment, restriction_type, risk_class, "
                + "updated_at, " + CATEGORY_COLUMNS + ") VALUES (:name, :cas, :owner, :amendment, :type, :risk, :now, "
                + placeholders + ")", params);
        return true;
    }

    @Override
    public long countByOwner(final String owner) {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM ifra_library WHERE owner_id = :owner",
                new MapSqlParameterSource("owner", owner), Long.class);
        return count == null ? 0L : count;
    }

    private static final RowMapper<RegulatoryRecord> ROW_MAPPER = (rs, rowNum) -> {
        Map<RegulatoryCategory, CategoryLimit> limits = new EnumMap<>(RegulatoryCategory.class);
        for (RegulatoryCategory category : RegulatoryCategory.values()) {
            limits.put(category, CategoryLimit.fromColumnValue(rs.getDouble(category.column())));
        }
        return RegulatoryRecord.builder()
                .id(rs.getLong("id"))
                .casNumber(rs.getString("cas_number"))
                .owner(rs.getString("owner_id"))
                .name(rs.getString("name"))
                .amendment(rs.getString("amendment"))
                .restrictionType(rs.getString("restriction_type"))
                .riskClass(rs.getString("risk_class"))
                .limits(RegulatoryCategory.complete(limits))
                .build();
    };
}
