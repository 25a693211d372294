package com.cybergrader.modules.export;

import com.cybergrader.modules.store.ExamSubmissionResult;
import com.cybergrader.modules.store.ExportResponse;
import com.cybergrader.modules.store.FlagSubmissionResult;
import com.cybergrader.modules.store.QuizSubmissionResult;

import java.util.List;

/** The admin export: every attempt plus what happened when pushing it to a spreadsheet. */
public record ScoreExport(List<FlagSubmissionResult> labs,
                          List<QuizSubmissionResult> quizzes,
                          List<ExamSubmissionResult> exams,
                          SheetSyncResult sheetSync) {

    static ScoreExport of(ExportResponse export, SheetSyncResult sheetSync) {
        return new ScoreExport(export.labs(), export.quizzes(), export.exams(), sheetSync);
    }
}
