package tech.noetzold.screening_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.screening_api.model.CheckDescriptor;
import tech.noetzold.screening_api.model.ScreeningLog;
import tech.noetzold.screening_api.model.ScreeningRequest;
import tech.noetzold.screening_api.model.ScreeningResponse;
import tech.noetzold.screening_api.service.ScreeningService;

import java.util.List;

@RestController
@RequestMapping("/screening")
@RequiredArgsConstructor
@Tag(name = "Screening")
public class ScreeningController {

    private final ScreeningService screeningService;

    @PostMapping
    public ScreeningResponse screen(@Valid @RequestBody ScreeningRequest request) {
        return screeningService.screen(request);
    }

    @GetMapping("/checks")
    public List<CheckDescriptor> checks() {
        return screeningService.listChecks();
    }

    @GetMapping("/log")
    public ResponseEntity<ScreeningLog> getLogByRequestId(@RequestParam("request_id") String requestId) {
        return screeningService.findLog(requestId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
