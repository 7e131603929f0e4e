package com.fragrance.enrichment.store;

import com.fragrance.enrichment.model.CategoryLimit;
import com.fragrance.enrichment.model.IngredientField;
import com.fragrance.enrichment.model.IngredientRecord;
import com.fragrance.enrichment.model.IngredientStats;
import com.fragrance.enrichment.model.RegulatoryCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link IngredientStore} over plain JDBC. Every value goes through a named
 * parameter; column names only ever come from {@link IngredientField} and
 * {@link RegulatoryCategory}. Text longer than its column is abbreviated
 * rather than rejected.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcIngredientStore implements IngredientStore {

    private static final String SELECT_ALL = "SELECT * FROM ingredients ";

    private static final int NOTES_WIDTH = 2000;

    private static final int SYNONYM_WIDTH = 255;

    private final NamedParameterJdbcTemplate jdbc;

    private final Clock clock;

    @Override
    public Optional<IngredientRecord> findByNameOwner(final String name, final String owner) {
        List<IngredientRecord> rows = jdbc.query(
                SELECT_ALL + "WHERE name_key = :nameKey AND owner_id = :owner",
                new MapSqlParameterSource()
                        .addValue("nameKey", IngredientStore.nameKey(name))
                        .addValue("owner", owner),
                ROW_MAPPER);
        return rows.stream().findFirst();
    }

    @Override
    public Optional<IngredientRecord> findById(final long id) {
        List<IngredientRecord> rows = jdbc.query(SELECT_ALL + "WHERE id = :id",
                new MapSqlParameterSource("id", id), ROW_MAPPER);
        return rows.stream().findFirst();
    }

    @Override
    public List<IngredientRecord> findWithRegistryNumber(final String owner) {
        return jdbc.query(SELECT_ALL + "WHERE owner_id = :owner AND cas IS NOT NULL AND cas <> '' ORDER BY id",
                new MapSqlParameterSource("owner", owner), ROW_MAPPER);
    }

    @Override
    public List<String> findNamesMissingEnrichment(final String owner, final int limit) {
        String sql = """
                SELECT name FROM ingredients
                WHERE owner_id = :owner
                  AND (cas IS NULL OR cas = ''
                       OR formula IS NULL OR formula = ''
                       OR odor_description IS NULL OR odor_description = '')
                ORDER BY id
                LIMIT :limit
                """;
        return jdbc.queryForList(sql,
                new MapSqlParameterSource().addValue("owner", owner).addValue("limit", limit),
                String.class);
    }

    @Override
    public IngredientStats statistics(final String owner) {
        String sql = """
                SELECT COUNT(*) AS total,
                       COALESCE(SUM(CASE WHEN cas IS NOT NULL AND cas <> '' THEN 1 ELSE 0 END), 0) AS with_cas,
                       COALESCE(SUM(CASE WHEN odor_description IS NOT NULL AND odor_description <> ''
                                         THEN 1 ELSE 0 END), 0) AS with_odor,
                       COALESCE(SUM(CASE WHEN allergen THEN 1 ELSE 0 END), 0) AS allergens,
                       COALESCE(SUM(CASE WHEN cas IS NULL OR cas = ''
                                              OR formula IS NULL OR formula = ''
                                              OR odor_description IS NULL OR odor_description = ''
                                         THEN 1 ELSE 0 END), 0) AS missing
                FROM ingredients
                WHERE owner_id = :owner
                """;
        return jdbc.queryForObject(sql, new MapSqlParameterSource("owner", owner),
                (rs, rowNum) -> new IngredientStats(owner,
                        rs.getInt("total"),
                        rs.getInt("with_cas"),
                        rs.getInt("with_odor"),
                        rs.getInt("allergens"),
                        rs.getInt("missing")));
    }

    @Override
    @Transactional
    public long insert(final IngredientRecord record) {
        Timestamp now = Timestamp.from(clock.instant());
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("name", record.getName())
                .addValue("nameKey", IngredientStore.nameKey(record.getName()))
                .addValue("owner", record.getOwner())
                .addValue("allergen", record.isAllergen())
                .addValue("notes", StringUtils.abbreviate(record.getNotes(), NOTES_WIDTH))
                .addValue("now", now);

        StringBuilder columns = new StringBuilder("name, name_key, owner_id, allergen, notes, created_at, updated_at");
        StringBuilder values = new StringBuilder(":name, :nameKey, :owner, :allergen, :notes, :now, :now");
        for (IngredientField field : IngredientField.values()) {
            Object value = record.value(field);
            if (!IngredientField.isEmptyValue(value)) {
                columns.append(", ").append(field.column());
                values.append(", :").append(field.column());
                params.addValue(field.column(), field.fit(value));
            }
        }
        for (RegulatoryCategory category : RegulatoryCategory.values()) {
            columns.append(", ").append(category.column());
            values.append(", :").append(category.column());
            params.addValue(category.column(), record.limit(category).toColumnValue());
        }

        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update("INSERT INTO ingredients (" + columns + ") VALUES (" + values + ")",
                params, keys, new String[] {"id"});
        long id = keys.getKey().longValue();
        log.debug("Inserted ingredient #{} '{}' for owner {}", id, record.getName(), record.getOwner());
        return id;
    }

    @Override
    @Transactional
    public void updateFields(final long id, final Map<IngredientField, Object> fields) {
        if (fields.isEmpty()) {
            return;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("now", Timestamp.from(clock.instant()));
        StringBuilder assignments = new StringBuilder();
        for (Map.Entry<IngredientField, Object> e : fields.entrySet()) {
            String column = e.getKey().column();
            assignments.append(column).append(" = :").append(column).append(", ");
            params.addValue(column, e.getKey().fit(e.getValue()));
        }
        int rows = jdbc.update("UPDATE ingredients SET " + assignments + "updated_at = :now WHERE id = :id", params);
        if (rows != 1) {
            throw new EmptyResultDataAccessException("No ingredient #" + id, 1);
        }
    }

    @Override
    @Transactional
    public void updateLimits(final long id,
                             final Map<RegulatoryCategory, CategoryLimit> limits,
                             final boolean allergen) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("allergen", allergen)
                .addValue("now", Timestamp.from(clock.instant()));
        StringBuilder sql = new StringBuilder("UPDATE ingredients SET allergen = :allergen, updated_at = :now");
        for (RegulatoryCategory category : RegulatoryCategory.values()) {
            CategoryLimit limit = limits.getOrDefault(category, CategoryLimit.UNRESTRICTED);
            sql.append(", ").append(category.column()).append(" = :").append(category.column());
            params.addValue(category.column(), limit.toColumnValue());
        }
        sql.append(" WHERE id = :id");
        if (jdbc.update(sql.toString(), params) != 1) {
            throw new EmptyResultDataAccessException("No ingredient #" + id, 1);
        }
    }

    @Override
    @Transactional
    public int addSynonyms(final long id, final Collection<String> synonyms, final String source) {
        Set<String> known = new HashSet<>();
        findSynonyms(id).forEach(s -> known.add(IngredientStore.nameKey(s)));

        int added = 0;
        for (String synonym : synonyms) {
            if (StringUtils.isBlank(synonym)) {
                continue;
            }
            String trimmed = StringUtils.abbreviate(synonym.trim(), SYNONYM_WIDTH);
            String key = IngredientStore.nameKey(trimmed);
            if (!known.add(key)) {
                continue;
            }
            jdbc.update("""
                    INSERT INTO ingredient_synonym (ingredient_id, synonym, synonym_key, source)
                    VALUES (:id, :synonym, :key, :source)
                    """, new MapSqlParameterSource()
                    .addValue("id", id)
                    .addValue("synonym", trimmed)
                    .addValue("key", key)
                    .addValue("source", source));
            added++;
        }
        return added;
    }

    @Override
    public List<String> findSynonyms(final long id) {
        return jdbc.queryForList("SELECT synonym FROM ingredient_synonym WHERE ingredient_id = :id ORDER BY synonym",
                new MapSqlParameterSource("id", id), String.class);
    }

    private static final RowMapper<IngredientRecord> ROW_MAPPER = (rs, rowNum) -> {
        Map<IngredientField, Object> fields = new EnumMap<>(IngredientField.class);
        for (IngredientField field : IngredientField.values()) {
            Object value = field == IngredientField.COMPOUND_ID
                    ? readLong(rs, field.column())
                    : rs.getString(field.column());
            if (!IngredientField.isEmptyValue(value)) {
                fields.put(field, value);
            }
        }
        Map<RegulatoryCategory, CategoryLimit> limits = new EnumMap<>(RegulatoryCategory.class);
        for (RegulatoryCategory category : RegulatoryCategory.values()) {
            limits.put(category, CategoryLimit.fromColumnValue(rs.getDouble(category.column())));
        }
        return IngredientRecord.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .owner(rs.getString("owner_id"))
                .fields(fields)
                .limits(limits)
                .allergen(rs.getBoolean("allergen"))
                .notes(rs.getString("notes"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    };

    private static Long readLong(final ResultSet rs, final String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    private static Instant toInstant(final Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
