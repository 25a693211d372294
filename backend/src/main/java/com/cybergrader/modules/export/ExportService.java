package com.cybergrader.modules.export;

import com.cybergrader.modules.store.ExamSubmissionResult;
import com.cybergrader.modules.store.ExportResponse;
import com.cybergrader.modules.store.FlagSubmissionResult;
import com.cybergrader.modules.store.GradingStore;
import com.cybergrader.modules.store.QuizSubmissionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExportService {

    private final GradingStore store;
    private final SheetSync sheetSync;

    public ScoreExport exportScores() {
        ExportResponse export = store.exportAll();
        SheetSyncResult result;
        try {
            result = sheetSync.push(export);
        } catch (RuntimeException e) {
            log.error("Spreadsheet sync failed: {}", e.getMessage(), e);
            result = new SheetSyncResult("error", null, List.of(), 0, e.getMessage());
        }
        log.info("Exported {} lab, {} quiz and {} exam attempt(s); sheet sync {}",
                export.labs().size(), export.quizzes().size(), export.exams().size(), result.status());
        return ScoreExport.of(export, result);
    }

    /**
     * One row per attempt, in export order. Lab rows leave the score columns
     * empty and quiz and exam rows leave {@code correct} empty.
     */
    public String exportScoresCsv() {
        ExportResponse export = store.exportAll();

        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        pw.println("Kind,User Id,Item Id,Part,Correct,Score,Max Score,Submitted At");

        for (FlagSubmissionResult r : export.labs()) {
            pw.printf("\"lab\",\"%s\",\"%s\",\"%s\",\"%s\",\"\",\"\",\"%s\"%n",
                    escape(r.userId()), escape(r.labId()), escape(r.flagName()),
                    r.correct() ? "Yes" : "No", r.submittedAt());
        }
        for (QuizSubmissionResult r : export.quizzes()) {
            pw.printf("\"quiz\",\"%s\",\"%s\",\"\",\"\",\"%d\",\"%d\",\"%s\"%n",
                    escape(r.userId()), escape(r.quizId()), r.score(), r.maxScore(), r.submittedAt());
        }
        for (ExamSubmissionResult r : export.exams()) {
            pw.printf("\"exam\",\"%s\",\"%s\",\"%s\",\"\",\"%d\",\"%d\",\"%s\"%n",
                    escape(r.userId()), escape(r.examId()), escape(r.stageId()), r.score(), r.maxScore(),
                    r.submittedAt());
        }
        pw.flush();
        return sw.toString();
    }

    private String escape(String s) {
        return s == null ? "" : s.replace("\"", "\"\"");
    }
}
