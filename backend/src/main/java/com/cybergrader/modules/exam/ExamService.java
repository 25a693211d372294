package com.cybergrader.modules.exam;

import com.cybergrader.exception.ResourceNotFoundException;
import com.cybergrader.modules.content.ExamDefinition;
import com.cybergrader.modules.exam.dto.ExamSubmissionRequest;
import com.cybergrader.modules.store.ExamSubmissionResult;
import com.cybergrader.modules.store.GradingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExamService {

    private final GradingStore store;

    public List<ExamDefinition> getExams() {
        return store.exams();
    }

    public ExamSubmissionResult submitStage(String examId, ExamSubmissionRequest request) {
        ExamDefinition exam = store.findExam(examId)
                .orElseThrow(() -> new ResourceNotFoundException("Exam", examId));

        ExamSubmissionResult result = store.recordExamSubmission(exam, request.getUserId(), request.getStageId(),
                request.getAnswers());
        log.info("Exam {} stage {} submitted by {}: {}/{}", examId, request.getStageId(), request.getUserId(),
                result.score(), result.maxScore());
        return result;
    }
}
