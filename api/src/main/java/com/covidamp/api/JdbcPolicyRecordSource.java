package com.covidamp.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads policies and places from the relational store.
 *
 * Tables: {@code policy}, {@code place} and the join table {@code place_to_policy}. A
 * policy's effective range runs from {@code date_start_effective} to the actual end date,
 * else the anticipated end date, else today.
 */
@Repository
public class JdbcPolicyRecordSource implements PolicyRecordSource {
    private static final Logger logger = LoggerFactory.getLogger(JdbcPolicyRecordSource.class);

    private static final Map<String, String> POLICY_COLUMNS = Map.of(
        "id", "p.id",
        "group_number", "p.group_number",
        PolicyFilters.PRIMARY_PH_MEASURE, "p.primary_ph_measure",
        PolicyFilters.PH_MEASURE_DETAILS, "p.ph_measure_details",
        "policy_type", "p.policy_type",
        "authority_name", "p.authority_name"
    );

    private static final Map<String, String> PLACE_COLUMNS = Map.of(
        PolicyFilters.LEVEL, "pl.level",
        PolicyFilters.ISO3, "pl.iso3",
        PolicyFilters.AREA1, "pl.area1",
        PolicyFilters.AREA2, "pl.area2",
        PolicyFilters.ANSI_FIPS, "pl.ansi_fips"
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcPolicyRecordSource(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    record PolicyPlaceRow(long policyId, Integer groupNumber, LocalDate startDate, LocalDate endDate, Place place) {}

    @Override
    public List<PolicyRecord> findPolicies(Map<String, List<String>> filters) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder();
        sql.append("SELECT p.id, p.group_number, ");
        sql.append("  p.date_start_effective AS start_date, ");
        sql.append("  COALESCE(p.date_end_actual, p.date_end_anticipated) AS end_date, ");
        sql.append("  pl.id AS place_id, pl.level, pl.iso3, pl.area1, pl.area2, pl.ansi_fips ");
        sql.append("FROM policy p ");
        sql.append("LEFT JOIN place_to_policy p2p ON p2p.policy = p.id ");
        sql.append("LEFT JOIN place pl ON pl.id = p2p.place ");
        sql.append("WHERE TRUE ");
        appendPolicyConditions(sql, params, filters);

        // place filters select the policy; all of its places are still returned
        StringBuilder placeConditions = new StringBuilder();
        appendPlaceConditions(placeConditions, params, filters);
        if (placeConditions.length() > 0) {
            sql.append("AND EXISTS ( ");
            sql.append("  SELECT 1 FROM place_to_policy p2p_f ");
            sql.append("  JOIN place pl ON pl.id = p2p_f.place ");
            sql.append("  WHERE p2p_f.policy = p.id ");
            sql.append(placeConditions);
            sql.append(") ");
        }
        sql.append("ORDER BY p.id, pl.id");

        logger.debug("[DEBUG] findPolicies SQL: {} params={}", sql, params);
        List<PolicyPlaceRow> rows = jdbcTemplate.query(
            sql.toString(),
            (rs, rowNum) -> {
                Long placeId = rs.getObject("place_id", Long.class);
                Place place = placeId == null ? null : new Place(
                    placeId,
                    rs.getString("level"),
                    rs.getString("iso3"),
                    rs.getString("area1"),
                    rs.getString("area2"),
                    rs.getString("ansi_fips")
                );
                return new PolicyPlaceRow(
                    rs.getLong("id"),
                    rs.getObject("group_number", Integer.class),
                    rs.getObject("start_date", LocalDate.class),
                    rs.getObject("end_date", LocalDate.class),
                    place
                );
            },
            params.toArray()
        );
        return groupRows(rows);
    }

    @Override
    public List<GroupRepresentative> findGroupRepresentatives() {
        return jdbcTemplate.query(
            """
            SELECT MIN(id) AS min_id, group_number
            FROM policy
            WHERE group_number IS NOT NULL
            GROUP BY group_number
            ORDER BY group_number
            """,
            (rs, rowNum) -> new GroupRepresentative(rs.getLong("min_id"), rs.getInt("group_number"))
        );
    }

    @Override
    public List<PlaceLocation> findPlacesWithPolicies(Map<String, List<String>> filters) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder();
        sql.append("SELECT DISTINCT pl.iso3, pl.area1, pl.ansi_fips, pl.level ");
        sql.append("FROM policy p ");
        sql.append("JOIN place_to_policy p2p ON p2p.policy = p.id ");
        sql.append("JOIN place pl ON pl.id = p2p.place ");
        sql.append("WHERE TRUE ");
        appendPolicyConditions(sql, params, filters);
        appendPlaceConditions(sql, params, filters);

        logger.debug("[DEBUG] findPlacesWithPolicies SQL: {} params={}", sql, params);
        return jdbcTemplate.query(
            sql.toString(),
            (rs, rowNum) -> new PlaceLocation(
                rs.getString("iso3"),
                rs.getString("area1"),
                rs.getString("ansi_fips"),
                rs.getString("level")
            ),
            params.toArray()
        );
    }

    /** Collapses the policy x place outer join into one record per policy, in row order. */
    static List<PolicyRecord> groupRows(List<PolicyPlaceRow> rows) {
        Map<Long, List<PolicyPlaceRow>> byPolicy = new LinkedHashMap<>();
        for (PolicyPlaceRow row : rows) {
            byPolicy.computeIfAbsent(row.policyId(), k -> new ArrayList<>()).add(row);
        }
        List<PolicyRecord> policies = new ArrayList<>(byPolicy.size());
        byPolicy.forEach((policyId, policyRows) -> {
            PolicyPlaceRow first = policyRows.get(0);
            List<Place> places = policyRows.stream()
                .map(PolicyPlaceRow::place)
                .filter(p -> p != null)
                .toList();
            policies.add(new PolicyRecord(policyId, first.groupNumber(), first.startDate(), first.endDate(), places));
        });
        return Collections.unmodifiableList(policies);
    }

    private static void appendPolicyConditions(StringBuilder sql, List<Object> params, Map<String, List<String>> filters) {
        for (Map.Entry<String, List<String>> filter : filters.entrySet()) {
            String field = filter.getKey();
            List<String> values = filter.getValue();
            if (PLACE_COLUMNS.containsKey(field)) continue;
            if (values == null || values.isEmpty()) continue;

            if (PolicyFilters.DATES_IN_EFFECT.equals(field)) {
                LocalDate[] range = parseDateRange(values);
                sql.append("AND p.date_start_effective <= ? ");
                sql.append("AND COALESCE(p.date_end_actual, p.date_end_anticipated, CURRENT_DATE) >= ? ");
                params.add(range[1]);
                params.add(range[0]);
            } else if (PolicyFilters.SUBTARGET.equals(field)) {
                sql.append("AND EXISTS (SELECT 1 FROM unnest(p.subtarget) st WHERE st IN (");
                appendPlaceholders(sql, params, values);
                sql.append(")) ");
            } else if (POLICY_COLUMNS.containsKey(field)) {
                sql.append("AND ").append(POLICY_COLUMNS.get(field)).append(" IN (");
                if ("id".equals(field) || "group_number".equals(field)) {
                    appendPlaceholders(sql, params, parseLongs(field, values));
                } else {
                    appendPlaceholders(sql, params, values);
                }
                sql.append(") ");
            } else {
                throw new IllegalArgumentException("Unknown policy filter field: " + field);
            }
        }
    }

    private static void appendPlaceConditions(StringBuilder sql, List<Object> params, Map<String, List<String>> filters) {
        for (Map.Entry<String, List<String>> filter : filters.entrySet()) {
            String column = PLACE_COLUMNS.get(filter.getKey());
            List<String> values = filter.getValue();
            if (column == null || values == null || values.isEmpty()) continue;
            sql.append("AND ").append(column).append(" IN (");
            appendPlaceholders(sql, params, values);
            sql.append(") ");
        }
    }

    private static void appendPlaceholders(StringBuilder sql, List<Object> params, List<?> values) {
        for (int i = 0; i < values.size(); i++) {
            sql.append(i == 0 ? "?" : ", ?");
            params.add(values.get(i));
        }
    }

    private static List<Long> parseLongs(String field, List<String> values) {
        List<Long> parsed = new ArrayList<>(values.size());
        for (String value : values) {
            try {
                parsed.add(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Filter " + field + " expects integers, got: " + value, e);
            }
        }
        return parsed;
    }

    /** {@code dates_in_effect} is a [start, end] pair of ISO dates. */
    static LocalDate[] parseDateRange(List<String> values) {
        if (values.size() != 2) {
            throw new IllegalArgumentException("dates_in_effect expects [start, end], got: " + values);
        }
        try {
            LocalDate start = LocalDate.parse(values.get(0));
            LocalDate end = LocalDate.parse(values.get(1));
            if (end.isBefore(start)) {
                throw new IllegalArgumentException("dates_in_effect end is before start: " + values);
            }
            return new LocalDate[] { start, end };
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("dates_in_effect expects YYYY-MM-DD dates, got: " + values, e);
        }
    }
}
