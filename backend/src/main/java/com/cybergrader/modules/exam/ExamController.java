package com.cybergrader.modules.exam;

import com.cybergrader.modules.content.ExamDefinition;
import com.cybergrader.modules.exam.dto.ExamSubmissionRequest;
import com.cybergrader.modules.store.ExamSubmissionResult;
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
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/exams")
@RequiredArgsConstructor
@Tag(name = "Exams", description = "Exam listing and stage submission")
public class ExamController {

    private final ExamService examService;

    @GetMapping
    @Operation(summary = "List exams")
    public ResponseEntity<List<ExamDefinition>> getExams() {
        return ResponseEntity.ok(examService.getExams());
    }

    @PostMapping("/{examId}/submit")
    @Operation(summary = "Submit answers for one exam stage")
    public ResponseEntity<ExamSubmissionResult> submitStage(@PathVariable String examId,
            @Valid @RequestBody ExamSubmissionRequest request) {
        return ResponseEntity.ok(examService.submitStage(examId, request));
    }
}
