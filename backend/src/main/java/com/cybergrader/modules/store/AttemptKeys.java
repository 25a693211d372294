package com.cybergrader.modules.store;

public final class AttemptKeys {

    private AttemptKeys() {
    }

    public record Flag(String userId, String labId, String flagName) {}

    public record Quiz(String userId, String quizId) {}

    public record ExamStage(String userId, String examId, String stageId) {}
}
