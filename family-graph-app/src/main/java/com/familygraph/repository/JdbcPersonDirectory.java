package com.familygraph.repository;

import com.familygraph.model.Gender;
import com.familygraph.model.Person;
import com.familygraph.model.PersonAddress;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class JdbcPersonDirectory implements PersonDirectory {

    private static final int IN_CLAUSE_CHUNK = 500;

    private final JdbcTemplate jdbc;
    private final NamedParameterJdbcTemplate namedJdbc;

    private static final RowMapper<Person> PERSON_MAPPER = (rs, rowNum) -> new Person(
        rs.getLong("id"),
        rs.getString("first_name"),
        rs.getString("middle_name"),
        rs.getString("last_name"),
        Gender.fromCode(rs.getString("gender")),
        toLocalDate(rs.getDate("date_of_birth")),
        toLocalDate(rs.getDate("date_of_death"))
    );

    private static final RowMapper<PersonAddress> ADDRESS_MAPPER = (rs, rowNum) -> new PersonAddress(
        rs.getLong("person_id"),
        nullableLong(rs, "country_id"),
        nullableLong(rs, "state_id"),
        nullableLong(rs, "district_id"),
        nullableLong(rs, "sub_district_id"),
        nullableLong(rs, "locality_id"),
        rs.getString("country_name"),
        rs.getString("state_name"),
        rs.getString("district_name"),
        rs.getString("sub_district_name"),
        rs.getString("locality_name")
    );

    private static final String CURRENT_ADDRESS_SQL = """
        SELECT pa.person_id, pa.country_id, pa.state_id, pa.district_id, pa.sub_district_id, pa.locality_id,
               c.name AS country_name, s.name AS state_name, d.name AS district_name,
               sd.name AS sub_district_name, l.name AS locality_name
        FROM person_address pa
        LEFT JOIN address_country c ON c.id = pa.country_id
        LEFT JOIN address_state s ON s.id = pa.state_id
        LEFT JOIN address_district d ON d.id = pa.district_id
        LEFT JOIN address_sub_district sd ON sd.id = pa.sub_district_id
        LEFT JOIN address_locality l ON l.id = pa.locality_id
        """;

    public JdbcPersonDirectory(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.namedJdbc = new NamedParameterJdbcTemplate(jdbc);
    }

    @Override
    public Optional<Person> lookupPerson(Long personId) {
        List<Person> results = jdbc.query(
            "SELECT * FROM person WHERE id = ?",
            PERSON_MAPPER,
            personId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Map<Long, Person> lookupPersons(Collection<Long> personIds) {
        Map<Long, Person> persons = new HashMap<>();
        List<Long> ids = new ArrayList<>(personIds);
        for (int from = 0; from < ids.size(); from += IN_CLAUSE_CHUNK) {
            List<Long> chunk = ids.subList(from, Math.min(from + IN_CLAUSE_CHUNK, ids.size()));
            for (Person person : namedJdbc.query(
                "SELECT * FROM person WHERE id IN (:ids)",
                new MapSqlParameterSource("ids", chunk),
                PERSON_MAPPER
            )) {
                persons.put(person.id(), person);
            }
        }
        return persons;
    }

    @Override
    public Map<Long, Gender> lookupGenders(Collection<Long> personIds) {
        Map<Long, Gender> genders = new HashMap<>();
        List<Long> ids = new ArrayList<>(personIds);
        for (int from = 0; from < ids.size(); from += IN_CLAUSE_CHUNK) {
            List<Long> chunk = ids.subList(from, Math.min(from + IN_CLAUSE_CHUNK, ids.size()));
            namedJdbc.query(
                "SELECT id, gender FROM person WHERE id IN (:ids)",
                new MapSqlParameterSource("ids", chunk),
                rs -> {
                    genders.put(rs.getLong("id"), Gender.fromCode(rs.getString("gender")));
                }
            );
        }
        return genders;
    }

    @Override
    public Optional<PersonAddress> lookupCurrentAddress(Long personId) {
        List<PersonAddress> results = jdbc.query(
            CURRENT_ADDRESS_SQL + "WHERE pa.person_id = ? AND pa.is_current = TRUE ORDER BY pa.id",
            ADDRESS_MAPPER,
            personId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Map<Long, PersonAddress> lookupCurrentAddresses(Collection<Long> personIds) {
        Map<Long, PersonAddress> addresses = new HashMap<>();
        List<Long> ids = new ArrayList<>(personIds);
        for (int from = 0; from < ids.size(); from += IN_CLAUSE_CHUNK) {
            List<Long> chunk = ids.subList(from, Math.min(from + IN_CLAUSE_CHUNK, ids.size()));
            // ordered by row id so the first current row wins, as in the single lookup
            for (PersonAddress address : namedJdbc.query(
                CURRENT_ADDRESS_SQL + "WHERE pa.person_id IN (:ids) AND pa.is_current = TRUE ORDER BY pa.id",
                new MapSqlParameterSource("ids", chunk),
                ADDRESS_MAPPER
            )) {
                addresses.putIfAbsent(address.personId(), address);
            }
        }
        return addresses;
    }

    @Override
    public Optional<String> lookupReligionSummary(Long personId) {
        String sql = """
            SELECT r.name AS religion_name, rc.name AS category_name, rsc.name AS sub_category_name
            FROM person_religion pr
            LEFT JOIN religion r ON r.id = pr.religion_id
            LEFT JOIN religion_category rc ON rc.id = pr.religion_category_id
            LEFT JOIN religion_sub_category rsc ON rsc.id = pr.religion_sub_category_id
            WHERE pr.person_id = ?
            ORDER BY pr.id
            """;
        List<String> results = jdbc.query(sql, (rs, rowNum) -> {
            List<String> parts = new ArrayList<>();
            for (String column : new String[] {"religion_name", "category_name", "sub_category_name"}) {
                String name = rs.getString(column);
                if (name != null && !name.isBlank()) {
                    parts.add(name);
                }
            }
            return String.join(", ", parts);
        }, personId);
        return results.isEmpty() || results.get(0).isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private static LocalDate toLocalDate(Date date) {
        return date != null ? date.toLocalDate() : null;
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column) != null ? rs.getLong(column) : null;
    }
}
