package com.herzen.cat.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.cat.bank.ItemBankModels.ItemChoice;
import com.herzen.cat.bank.ItemBankModels.ItemFormat;
import com.herzen.cat.bank.ItemBankModels.ItemTemplate;
import com.herzen.cat.irt.IrtModels.ItemParameter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class ItemBankJdbcRepository {
    private static final String COLUMNS = "item_id, topic, subtopic, stem, item_format, choices, difficulty, discrimination, guessing, explanation, bloom_level, learning_objective";
    private static final TypeReference<List<ItemChoice>> CHOICES = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<ItemTemplate> rowMapper;

    public ItemBankJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, n) -> new ItemTemplate(
                rs.getString(1),
                rs.getString(4),
                readChoices(rs.getString(6)),
                ItemFormat.valueOf(rs.getString(5)),
                new ItemParameter(rs.getDouble(7), rs.getDouble(8), rs.getDouble(9)),
                rs.getString(2),
                rs.getString(3),
                rs.getString(10),
                rs.getString(11),
                rs.getString(12));
    }

    public void saveAll(List<ItemTemplate> items) {
        items.forEach(i -> jdbcTemplate.update(
                "INSERT INTO item_bank(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)",
                i.id(), i.topic(), i.subtopic(), i.stem(), i.format().name(), writeChoices(i.choices()),
                i.parameter().difficulty(), i.parameter().discrimination(), i.parameter().guessing(),
                i.explanation(), i.bloomLevel(), i.learningObjective()));
    }

    public List<ItemTemplate> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM item_bank ORDER BY item_id", rowMapper);
    }

    public List<ItemTemplate> findByTopic(String topic) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM item_bank WHERE LOWER(topic) = LOWER(?) ORDER BY item_id",
                rowMapper, topic.trim());
    }

    public Optional<ItemTemplate> findById(String itemId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM item_bank WHERE item_id = ?", rowMapper, itemId)
                .stream().findFirst();
    }

    public boolean exists(String itemId) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM item_bank WHERE item_id = ?", Integer.class, itemId);
        return count != null && count > 0;
    }

    public List<String> topics() {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT topic FROM item_bank WHERE topic IS NOT NULL AND topic <> '' ORDER BY topic", String.class);
    }

    private String writeChoices(List<ItemChoice> choices) {
        try {
            return objectMapper.writeValueAsString(choices);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize item choices", e);
        }
    }

    private List<ItemChoice> readChoices(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, CHOICES);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt item choices: " + json, e);
        }
    }
}
