package com.cybergrader.modules.quiz;

import com.cybergrader.modules.content.QuizDefinition;
import com.cybergrader.modules.quiz.dto.QuizSubmissionRequest;
import com.cybergrader.modules.store.QuizSubmissionResult;
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
@RequestMapping("/api/quizzes")
@RequiredArgsConstructor
@Tag(name = "Quizzes", description = "Quiz listing and submission")
public class QuizController {

    private final QuizService quizService;

    @GetMapping
    @Operation(summary = "List quizzes")
    public ResponseEntity<List<QuizDefinition>> getQuizzes() {
        return ResponseEntity.ok(quizService.getQuizzes());
    }

    @PostMapping("/{quizId}/submit")
    @Operation(summary = "Submit quiz answers and get the score")
    public ResponseEntity<QuizSubmissionResult> submit(@PathVariable String quizId,
            @Valid @RequestBody QuizSubmissionRequest request) {
        return ResponseEntity.ok(quizService.submit(quizId, request));
    }
}
