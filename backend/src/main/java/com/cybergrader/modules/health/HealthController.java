package com.cybergrader.modules.health;

import com.cybergrader.modules.store.GradingStore;
import com.cybergrader.modules.store.StoreHealth;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Tag(name = "Health")
public class HealthController {

    private final GradingStore store;

    @GetMapping
    @Operation(summary = "Liveness plus the store backend state")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("ok", store.health()));
    }

    public record HealthResponse(String status, StoreHealth store) {}
}
