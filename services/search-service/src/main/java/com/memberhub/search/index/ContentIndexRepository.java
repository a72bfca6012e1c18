package com.memberhub.search.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memberhub.search.common.JdbcUtils;
import com.memberhub.search.common.JsonUtils;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class ContentIndexRepository {
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public ContentIndexRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void upsert(IndexedContent content) {
        LexicalFields lexical = content.getLexical();
        float[] vector = content.vectorView();
        jdbcTemplate.update(
            "INSERT INTO content_index (content_type, content_id, embedding, embedding_dim, content_text, "
                + "lexical_indexed, title, description, body, tags_json, metadata_json, updated_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
                + "ON CONFLICT (content_type, content_id) DO UPDATE SET "
                + "embedding = EXCLUDED.embedding, embedding_dim = EXCLUDED.embedding_dim, "
                + "content_text = EXCLUDED.content_text, lexical_indexed = EXCLUDED.lexical_indexed, "
                + "title = EXCLUDED.title, description = EXCLUDED.description, body = EXCLUDED.body, "
                + "tags_json = EXCLUDED.tags_json, metadata_json = EXCLUDED.metadata_json, "
                + "updated_at = EXCLUDED.updated_at",
            content.getKey().contentType().getTag(),
            content.getKey().contentId(),
            VectorCodec.encode(vector),
            vector == null ? null : vector.length,
            content.getContentText(),
            lexical != null,
            lexical == null ? null : lexical.getTitle(),
            lexical == null ? null : lexical.getDescription(),
            lexical == null ? null : lexical.getBody(),
            lexical == null ? null : JsonUtils.toJson(objectMapper, lexical.getTags()),
            JsonUtils.toJson(objectMapper, content.getMetadata()),
            JdbcUtils.asTimestamp(content.getUpdatedAt())
        );
    }

    public boolean delete(ContentKey key) {
        int deleted = jdbcTemplate.update(
            "DELETE FROM content_index WHERE content_type = ? AND content_id = ?",
            key.contentType().getTag(),
            key.contentId()
        );
        return deleted > 0;
    }

    public List<StoredRow> findAll() {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT content_type, content_id, embedding, content_text, lexical_indexed, title, description, body, "
                + "tags_json, metadata_json, updated_at FROM content_index"
        );
        List<StoredRow> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            result.add(toStoredRow(row));
        }
        return result;
    }

    private StoredRow toStoredRow(Map<String, Object> row) {
        String typeTag = JdbcUtils.asString(row.get("content_type"));
        ContentType type = ContentType.fromTag(typeTag);
        if (type == null) {
            throw new IllegalStateException("unknown content_type in content_index: " + typeTag);
        }
        ContentKey key = ContentKey.of(type, JdbcUtils.asString(row.get("content_id")));
        LexicalFields lexical = null;
        if (JdbcUtils.asBoolean(row.get("lexical_indexed"))) {
            lexical = new LexicalFields(
                JdbcUtils.asString(row.get("title")),
                JdbcUtils.asString(row.get("description")),
                JdbcUtils.asString(row.get("body")),
                JsonUtils.readStringList(objectMapper, JdbcUtils.asString(row.get("tags_json")))
            );
        }
        return new StoredRow(
            key,
            VectorCodec.decode((byte[]) row.get("embedding")),
            JdbcUtils.asString(row.get("content_text")),
            lexical,
            JsonUtils.readMap(objectMapper, JdbcUtils.asString(row.get("metadata_json"))),
            JdbcUtils.asInstant(row.get("updated_at"))
        );
    }

    public record StoredRow(
        ContentKey key,
        float[] vector,
        String contentText,
        LexicalFields lexical,
        Map<String, Object> metadata,
        Instant updatedAt
    ) {
    }
}
