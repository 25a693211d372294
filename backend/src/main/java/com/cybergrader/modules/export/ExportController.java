package com.cybergrader.modules.export;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Tag(name = "Export", description = "Score export for instructors")
public class ExportController {

    private final ExportService exportService;

    @GetMapping("/export-scores")
    @Operation(summary = "Every attempt of every user, plus the spreadsheet sync status")
    public ResponseEntity<ScoreExport> exportScores() {
        return ResponseEntity.ok(exportService.exportScores());
    }

    @GetMapping("/export-scores.csv")
    @Operation(summary = "Download every attempt as CSV")
    public ResponseEntity<byte[]> exportScoresCsv() {
        byte[] bytes = exportService.exportScoresCsv().getBytes(StandardCharsets.UTF_8);

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"scores.csv\"")
                .contentType(MediaType.valueOf("text/csv; charset=UTF-8"))
                .contentLength(bytes.length)
                .body(bytes);
    }
}
