package com.cybergrader.modules.dashboard;

import com.cybergrader.modules.store.DashboardSummary;
import com.cybergrader.modules.store.GradingStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
@Tag(name = "Dashboard", description = "Per-user progress")
public class DashboardController {

    private final GradingStore store;

    @GetMapping("/{userId}")
    @Operation(summary = "Lab status plus full quiz and exam history for a user")
    public ResponseEntity<DashboardSummary> getDashboard(@PathVariable String userId) {
        return ResponseEntity.ok(store.dashboardForUser(userId));
    }
}
