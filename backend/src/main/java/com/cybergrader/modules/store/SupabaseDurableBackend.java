package com.cybergrader.modules.store;

import com.cybergrader.exception.PersistenceDegradedException;
import com.cybergrader.modules.content.ExamDefinition;
import com.cybergrader.modules.content.LabDefinition;
import com.cybergrader.modules.content.QuizDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Remote-table backend speaking the PostgREST API that Supabase exposes under
 * {@code /rest/v1}. The tables are the same six the relational backend creates;
 * they are expected to exist already.
 */
@Slf4j
public class SupabaseDurableBackend implements DurableBackend {

    private static final ParameterizedTypeReference<List<Map<String, Object>>> ROWS =
            new ParameterizedTypeReference<>() {};

    static final int DEFAULT_PAGE_SIZE = 1000;
    private static final String BY_ID = "id.asc";
    private static final String CHRONOLOGICAL = "submitted_at.asc,id.asc";

    private final String url;
    private final String key;
    private final RestTemplate restTemplate;
    private final StoreRowMapper rows;
    private final int pageSize;

    private URI base;

    public SupabaseDurableBackend(String url, String key, RestTemplate restTemplate, StoreRowMapper rows) {
        this(url, key, restTemplate, rows, DEFAULT_PAGE_SIZE);
    }

    SupabaseDurableBackend(String url, String key, RestTemplate restTemplate, StoreRowMapper rows, int pageSize) {
        this.url = url;
        this.key = key;
        this.restTemplate = restTemplate;
        this.rows = rows;
        this.pageSize = pageSize;
    }

    @Override
    public String name() {
        return "supabase";
    }

    @Override
    public void initialize() {
        if (url == null || url.isBlank() || key == null || key.isBlank()) {
            throw new PersistenceDegradedException("Supabase url and key must both be configured");
        }
        try {
            URI parsed = URI.create(url.trim());
            boolean web = "https".equals(parsed.getScheme()) || "http".equals(parsed.getScheme());
            if (!web || parsed.getHost() == null) {
                throw new PersistenceDegradedException("Supabase url must be an http(s) url: " + url);
            }
            base = parsed;
        } catch (IllegalArgumentException e) {
            throw new PersistenceDegradedException("Malformed Supabase url: " + url, e);
        }
        log.info("Using Supabase tables at {}", base.getHost());
    }

    @Override
    public HydratedState hydrate() {
        return new HydratedState(
                fetch("labs", BY_ID, rows::lab),
                fetch("quizzes", BY_ID, rows::quiz),
                fetch("exams", BY_ID, rows::exam),
                fetch("lab_submissions", CHRONOLOGICAL, rows::flagResult),
                fetch("quiz_submissions", CHRONOLOGICAL, rows::quizResult),
                fetch("exam_submissions", CHRONOLOGICAL, rows::examResult));
    }

    /**
     * Reads a whole table in {@code limit}/{@code offset} pages. PostgREST caps
     * each response at its {@code max-rows} setting, so paging continues until
     * the {@code Content-Range} total is reached or an empty page comes back.
     */
    private <T> List<T> fetch(String table, String order, Function<Map<String, Object>, T> mapper) {
        List<T> result = new ArrayList<>();
        long offset = 0;
        try {
            while (true) {
                URI uri = endpoint(table)
                        .queryParam("select", "*")
                        .queryParam("order", order)
                        .queryParam("limit", pageSize)
                        .queryParam("offset", offset)
                        .build().encode().toUri();
                ResponseEntity<List<Map<String, Object>>> response = restTemplate.exchange(
                        uri, HttpMethod.GET, new HttpEntity<>(headers("count=exact")), ROWS);
                List<Map<String, Object>> page = response.getBody() == null ? List.of() : response.getBody();
                page.stream().map(mapper).forEach(result::add);
                offset += page.size();

                OptionalLong total = total(response.getHeaders().getFirst("Content-Range"));
                if (page.isEmpty() || (total.isPresent() && offset >= total.getAsLong())) {
                    break;
                }
            }
        } catch (RuntimeException e) {
            throw new PersistenceDegradedException("Cannot read " + table + " from Supabase: " + e.getMessage(), e);
        }
        log.debug("Read {} row(s) from Supabase table {}", result.size(), table);
        return result;
    }

    // "0-999/3000", "*/0" or "0-999/*"
    static OptionalLong total(String contentRange) {
        if (contentRange == null) {
            return OptionalLong.empty();
        }
        int slash = contentRange.lastIndexOf('/');
        if (slash < 0) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(contentRange.substring(slash + 1).trim()));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    @Override
    public void replaceLabs(List<LabDefinition> labs) {
        replace("labs", labs.stream().map(rows::labRow).toList());
    }

    @Override
    public void replaceQuizzes(List<QuizDefinition> quizzes) {
        replace("quizzes", quizzes.stream().map(rows::quizRow).toList());
    }

    @Override
    public void replaceExams(List<ExamDefinition> exams) {
        replace("exams", exams.stream().map(rows::examRow).toList());
    }

    // Upsert by id, then delete whatever the new set no longer names.
    private void replace(String table, List<Map<String, Object>> definitionRows) {
        try {
            if (!definitionRows.isEmpty()) {
                restTemplate.exchange(endpoint(table).queryParam("on_conflict", "id").build().encode().toUri(),
                        HttpMethod.POST,
                        new HttpEntity<>(definitionRows, headers("resolution=merge-duplicates,return=minimal")),
                        Void.class);
            }
            String filter = definitionRows.isEmpty()
                    ? "not.is.null"
                    : definitionRows.stream()
                            .map(row -> quote(String.valueOf(row.get("id"))))
                            .collect(Collectors.joining(",", "not.in.(", ")"));
            restTemplate.exchange(endpoint(table).queryParam("id", filter).build().encode().toUri(),
                    HttpMethod.DELETE, new HttpEntity<>(headers("return=minimal")), Void.class);
            log.debug("Replaced {} row(s) in Supabase table {}", definitionRows.size(), table);
        } catch (RestClientException e) {
            throw new PersistenceDegradedException("Cannot replace " + table + " in Supabase: " + e.getMessage(), e);
        }
    }

    @Override
    public void insertFlagResult(FlagSubmissionResult result) {
        insert("lab_submissions", rows.flagResultRow(result));
    }

    @Override
    public void insertQuizResult(QuizSubmissionResult result) {
        insert("quiz_submissions", rows.quizResultRow(result));
    }

    @Override
    public void insertExamResult(ExamSubmissionResult result) {
        insert("exam_submissions", rows.examResultRow(result));
    }

    private void insert(String table, Map<String, Object> row) {
        try {
            restTemplate.exchange(endpoint(table).build().encode().toUri(), HttpMethod.POST,
                    new HttpEntity<>(row, headers("return=minimal")), Void.class);
        } catch (RestClientException e) {
            throw new PersistenceDegradedException("Cannot insert into " + table + " in Supabase: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        // RestTemplate holds no resources of its own
    }

    private UriComponentsBuilder endpoint(String table) {
        if (base == null) {
            throw new PersistenceDegradedException("Supabase backend is not initialised");
        }
        return UriComponentsBuilder.fromUri(base).pathSegment("rest", "v1", table);
    }

    private HttpHeaders headers(String prefer) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("apikey", key);
        headers.setBearerAuth(key);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (prefer != null) {
            headers.set("Prefer", prefer);
        }
        return headers;
    }

    // PostgREST list values are double-quoted so ids may contain commas or dots.
    private static String quote(String id) {
        return "\"" + id.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
