package com.cybergrader.modules.store;

import com.cybergrader.modules.content.ExamDefinition;
import com.cybergrader.modules.content.ExamStageDefinition;
import com.cybergrader.modules.content.FlagDefinition;
import com.cybergrader.modules.content.LabDefinition;
import com.cybergrader.modules.content.QuizDefinition;
import com.cybergrader.modules.content.QuizQuestion;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.CollectionType;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between store types and table rows. Rows are plain maps keyed by
 * column name; nested definition lists are JSON, either already parsed or as
 * text. Both durable backends go through here so their rows cannot differ.
 * Unknown enum values read back as {@code null}, which every validator treats
 * as incorrect.
 */
public class StoreRowMapper {

    private static final ObjectMapper JSON = JsonMapper.builder()
            .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    // ---- definitions ----

    public Map<String, Object> labRow(LabDefinition lab) {
        Map<String, Object> row = definitionRow(lab.getId(), lab.getTitle(), lab.getVersion());
        row.put("instructions_path", lab.getInstructionsPath());
        row.put("flags", tree(lab.getFlags()));
        return row;
    }

    public Map<String, Object> quizRow(QuizDefinition quiz) {
        Map<String, Object> row = definitionRow(quiz.getId(), quiz.getTitle(), quiz.getVersion());
        row.put("questions", tree(quiz.getQuestions()));
        return row;
    }

    public Map<String, Object> examRow(ExamDefinition exam) {
        Map<String, Object> row = definitionRow(exam.getId(), exam.getTitle(), exam.getVersion());
        row.put("stages", tree(exam.getStages()));
        return row;
    }

    public LabDefinition lab(Map<String, ?> row) {
        Object instructions = row.get("instructions_path");
        return LabDefinition.builder()
                .id(text(row, "id"))
                .title(text(row, "title"))
                .version(text(row, "version"))
                .instructionsPath(instructions == null ? "" : instructions.toString())
                .flags(list(row.get("flags"), FlagDefinition.class))
                .build();
    }

    public QuizDefinition quiz(Map<String, ?> row) {
        return QuizDefinition.builder()
                .id(text(row, "id"))
                .title(text(row, "title"))
                .version(text(row, "version"))
                .questions(list(row.get("questions"), QuizQuestion.class))
                .build();
    }

    public ExamDefinition exam(Map<String, ?> row) {
        return ExamDefinition.builder()
                .id(text(row, "id"))
                .title(text(row, "title"))
                .version(text(row, "version"))
                .stages(list(row.get("stages"), ExamStageDefinition.class))
                .build();
    }

    // ---- attempts ----

    public Map<String, Object> flagResultRow(FlagSubmissionResult result) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("user_id", result.userId());
        row.put("lab_id", result.labId());
        row.put("flag_name", result.flagName());
        row.put("correct", result.correct());
        row.put("submitted_at", result.submittedAt().toString());
        return row;
    }

    public Map<String, Object> quizResultRow(QuizSubmissionResult result) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("user_id", result.userId());
        row.put("quiz_id", result.quizId());
        row.put("score", result.score());
        row.put("max_score", result.maxScore());
        row.put("submitted_at", result.submittedAt().toString());
        return row;
    }

    public Map<String, Object> examResultRow(ExamSubmissionResult result) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("user_id", result.userId());
        row.put("exam_id", result.examId());
        row.put("stage_id", result.stageId());
        row.put("score", result.score());
        row.put("max_score", result.maxScore());
        row.put("submitted_at", result.submittedAt().toString());
        return row;
    }

    public FlagSubmissionResult flagResult(Map<String, ?> row) {
        return new FlagSubmissionResult(
                text(row, "user_id"),
                text(row, "lab_id"),
                text(row, "flag_name"),
                Boolean.TRUE.equals(row.get("correct")),
                instant(row.get("submitted_at")));
    }

    public QuizSubmissionResult quizResult(Map<String, ?> row) {
        return new QuizSubmissionResult(
                text(row, "user_id"),
                text(row, "quiz_id"),
                number(row, "score"),
                number(row, "max_score"),
                instant(row.get("submitted_at")));
    }

    public ExamSubmissionResult examResult(Map<String, ?> row) {
        return new ExamSubmissionResult(
                text(row, "user_id"),
                text(row, "exam_id"),
                text(row, "stage_id"),
                number(row, "score"),
                number(row, "max_score"),
                instant(row.get("submitted_at")));
    }

    /** Serialises a nested column for backends that store JSON as text. */
    public String json(Object nested) {
        try {
            return JSON.writeValueAsString(nested);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise column value", e);
        }
    }

    public static Instant instant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        if (value instanceof String text) {
            return OffsetDateTime.parse(text).toInstant();
        }
        throw new IllegalArgumentException("Unsupported timestamp value: " + value);
    }

    private static Map<String, Object> definitionRow(String id, String title, String version) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("title", title);
        row.put("version", version);
        return row;
    }

    private static Object tree(List<?> nested) {
        return JSON.convertValue(nested, List.class);
    }

    private static <T> List<T> list(Object value, Class<T> elementType) {
        if (value == null) {
            return List.of();
        }
        CollectionType type = JSON.getTypeFactory().constructCollectionType(List.class, elementType);
        try {
            if (value instanceof String text) {
                return List.copyOf(JSON.<List<T>>readValue(text, type));
            }
            return List.copyOf(JSON.<List<T>>convertValue(value, type));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalStateException("Cannot read " + elementType.getSimpleName() + " list from row", e);
        }
    }

    private static String text(Map<String, ?> row, String column) {
        Object value = row.get(column);
        return value == null ? null : value.toString();
    }

    private static int number(Map<String, ?> row, String column) {
        Object value = row.get(column);
        return value == null ? 0 : ((Number) value).intValue();
    }
}
