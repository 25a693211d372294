package com.cybergrader.modules.quiz;

import com.cybergrader.exception.ResourceNotFoundException;
import com.cybergrader.modules.content.QuizDefinition;
import com.cybergrader.modules.quiz.dto.QuizSubmissionRequest;
import com.cybergrader.modules.store.GradingStore;
import com.cybergrader.modules.store.QuizSubmissionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuizService {

    private final GradingStore store;

    public List<QuizDefinition> getQuizzes() {
        return store.quizzes();
    }

    public QuizSubmissionResult submit(String quizId, QuizSubmissionRequest request) {
        QuizDefinition quiz = store.findQuiz(quizId)
                .orElseThrow(() -> new ResourceNotFoundException("Quiz", quizId));

        // A question answered twice keeps the later answer.
        Map<String, String> answers = new HashMap<>();
        request.getAnswers().forEach(a -> answers.put(a.getQuestionId(), a.getAnswer()));

        QuizSubmissionResult result = store.recordQuizSubmission(quiz, request.getUserId(), answers);
        log.info("Quiz {} submitted by {}: {}/{}", quizId, request.getUserId(), result.score(), result.maxScore());
        return result;
    }
}
