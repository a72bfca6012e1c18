package com.memberhub.search.api;

import com.memberhub.search.api.dto.IndexStatusResponse;
import com.memberhub.search.api.dto.UpsertContentRequest;
import com.memberhub.search.api.dto.UpsertContentResponse;
import com.memberhub.search.index.ContentKey;
import com.memberhub.search.index.ContentType;
import com.memberhub.search.index.InvalidContentException;
import com.memberhub.search.index.LexicalFields;
import com.memberhub.search.index.UpsertCommand;
import com.memberhub.search.index.UpsertResult;
import com.memberhub.search.retrieval.ann.AnnIndexStatus;
import com.memberhub.search.service.ContentIndexService;
import com.memberhub.search.service.IndexStatus;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class IndexController {
    private final ContentIndexService indexService;

    public IndexController(ContentIndexService indexService) {
        this.indexService = indexService;
    }

    @PutMapping("/index/{type}/{id}")
    public ResponseEntity<UpsertContentResponse> upsert(
        @PathVariable("type") String type,
        @PathVariable("id") String id,
        @RequestBody(required = false) UpsertContentRequest request
    ) {
        if (request == null) {
            throw new InvalidContentException("request body is required");
        }
        ContentKey key = key(type, id);
        LexicalFields lexical = request.hasLexicalFields()
            ? new LexicalFields(request.getTitle(), request.getDescription(), request.getBody(), request.getTags())
            : null;
        UpsertResult result = indexService.upsert(new UpsertCommand(
            key,
            request.getVector(),
            request.getContentText(),
            lexical,
            request.getMetadata()
        ));

        UpsertContentResponse response = new UpsertContentResponse();
        response.setContentType(key.contentType().getTag());
        response.setContentId(key.contentId());
        response.setResult(result.name().toLowerCase(Locale.ROOT));
        HttpStatus status = result == UpsertResult.CREATED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @DeleteMapping("/index/{type}/{id}")
    public Map<String, Object> remove(@PathVariable("type") String type, @PathVariable("id") String id) {
        ContentKey key = key(type, id);
        boolean removed = indexService.remove(key);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content_type", key.contentType().getTag());
        body.put("content_id", key.contentId());
        body.put("removed", removed);
        return body;
    }

    @GetMapping("/index/status")
    public IndexStatusResponse status() {
        IndexStatus status = indexService.status();
        IndexStatusResponse response = new IndexStatusResponse();
        response.setDimension(status.dimension());
        response.setItems(status.items());
        Map<String, Integer> byType = new LinkedHashMap<>();
        for (Map.Entry<ContentType, Integer> entry : status.itemsByType().entrySet()) {
            byType.put(entry.getKey().getTag(), entry.getValue());
        }
        response.setItemsByType(byType);
        response.setVectors(status.vectors());
        response.setLexicalDocuments(status.lexicalDocuments());

        AnnIndexStatus annStatus = status.ann();
        IndexStatusResponse.Ann ann = new IndexStatusResponse.Ann();
        ann.setEnabled(annStatus.enabled());
        ann.setRebuilding(annStatus.rebuilding());
        ann.setGeneration(annStatus.generation());
        ann.setSize(annStatus.size());
        ann.setPendingVectors(annStatus.pendingVectors());
        ann.setBuiltAt(annStatus.builtAt());
        ann.setLastBuildMs(annStatus.lastBuildMs());
        ann.setLastError(annStatus.lastError());
        response.setAnn(ann);
        return response;
    }

    @PostMapping("/index/rebuild")
    public ResponseEntity<Map<String, Object>> rebuild() {
        boolean triggered = indexService.rebuild();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("triggered", triggered));
    }

    private static ContentKey key(String type, String id) {
        ContentType contentType = ContentType.fromTag(type);
        if (contentType == null) {
            throw new InvalidContentException("unknown content type: " + type);
        }
        if (id == null || id.isBlank()) {
            throw new InvalidContentException("content id is required");
        }
        return ContentKey.of(contentType, id.trim());
    }
}
