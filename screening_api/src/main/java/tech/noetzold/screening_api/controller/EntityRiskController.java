package tech.noetzold.screening_api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.screening_api.service.EntityRiskBatchService;

import java.util.Map;

@RestController
@RequestMapping("/entity-risk")
@RequiredArgsConstructor
@Tag(name = "Entity risk")
public class EntityRiskController {

    private final EntityRiskBatchService batchService;

    @PostMapping("/resolve")
    public Map<String, Object> resolve() {
        int entities = batchService.runResolution();
        return Map.of("status", "resolved", "entities", entities);
    }

    @GetMapping("/{entityId}")
    public ResponseEntity<JsonNode> verdict(@PathVariable String entityId) {
        return batchService.findVerdict(entityId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
