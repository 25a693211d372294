package com.cybergrader.modules.lab;

import com.cybergrader.modules.lab.dto.FlagSubmissionRequest;
import com.cybergrader.modules.store.FlagSubmissionResult;
import com.cybergrader.modules.store.LabStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/labs")
@RequiredArgsConstructor
@Tag(name = "Labs", description = "Lab status and flag submission")
public class LabController {

    private final LabService labService;

    @GetMapping
    @Operation(summary = "Every lab with the user's captured-flag count")
    public ResponseEntity<List<LabStatus>> getLabs(@RequestParam("user_id") String userId) {
        return ResponseEntity.ok(labService.labsForUser(userId));
    }

    @PostMapping("/{labId}/flags/{flagName}")
    @Operation(summary = "Submit a flag")
    public ResponseEntity<FlagSubmissionResult> submitFlag(@PathVariable String labId,
            @PathVariable String flagName,
            @Valid @RequestBody FlagSubmissionRequest request) {
        return ResponseEntity.ok(labService.submitFlag(labId, flagName, request));
    }
}
