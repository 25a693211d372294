package com.cybergrader;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "grader.content.root=content",
        "grader.store.backend=memory"
})
@AutoConfigureMockMvc
class CyberGraderApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void labsNeedAUserId() throws Exception {
        mockMvc.perform(get("/api/labs"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("user_id is required"));
        mockMvc.perform(get("/api/labs").param("user_id", " "))
                .andExpect(status().isBadRequest());
    }

    @Test
    void bundledContentIsSyncedAtStartup() throws Exception {
        mockMvc.perform(get("/api/labs").param("user_id", "reader"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].id").value("recon-101"))
                .andExpect(jsonPath("$[0].total_flags").value(3))
                .andExpect(jsonPath("$[0].score").value(0))
                .andExpect(jsonPath("$[0].instructions").value(containsString("Network Reconnaissance")))
                .andExpect(jsonPath("$[0].flags[1].validator").value("regex"));
        mockMvc.perform(get("/api/quizzes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("fundamentals"));
        mockMvc.perform(get("/api/exams"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].stages[1].max_score").value(20));
    }

    @Test
    void capturedFlagsShowUpInLabStatus() throws Exception {
        mockMvc.perform(post("/api/labs/recon-101/flags/open-port")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": \"flagger\", \"submission\": \"80\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.correct").value(false));
        mockMvc.perform(post("/api/labs/recon-101/flags/open-port")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": \"flagger\", \"submission\": \" 8443 \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.correct").value(true))
                .andExpect(jsonPath("$.lab_id").value("recon-101"))
                .andExpect(jsonPath("$.submitted_at").exists());
        mockMvc.perform(post("/api/labs/recon-101/flags/loot-file")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": \"flagger\", \"submission\": \"loot/passwd.txt\"}"))
                .andExpect(jsonPath("$.correct").value(true));

        mockMvc.perform(get("/api/labs").param("user_id", "flagger"))
                .andExpect(jsonPath("$[0].score").value(2));
    }

    @Test
    void unknownLabOrFlagIsNotFound() throws Exception {
        mockMvc.perform(post("/api/labs/nope/flags/open-port")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": \"u\", \"submission\": \"x\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Unknown lab: nope"));
        mockMvc.perform(post("/api/labs/recon-101/flags/nope")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": \"u\", \"submission\": \"x\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void flagSubmissionRequiresUserId() throws Exception {
        mockMvc.perform(post("/api/labs/recon-101/flags/open-port")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"submission\": \"8443\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void quizAndExamSubmissionsReachTheDashboard() throws Exception {
        mockMvc.perform(post("/api/quizzes/fundamentals/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"user_id": "student", "answers": [
                                  {"question_id": "cia", "answer": "b"},
                                  {"question_id": "hash", "answer": " sha-2 "}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(5))
                .andExpect(jsonPath("$.max_score").value(5));
        mockMvc.perform(post("/api/exams/midterm/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": \"student\", \"stage_id\": \"exploit\", \"answers\": {\"a\": \"done\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(20));

        mockMvc.perform(get("/api/dashboard/student"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.labs", hasSize(2)))
                .andExpect(jsonPath("$.quizzes", hasSize(1)))
                .andExpect(jsonPath("$.exams[0].stage_id").value("exploit"));
    }

    @Test
    void unknownQuizExamOrStageIsNotFound() throws Exception {
        mockMvc.perform(post("/api/quizzes/nope/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": \"u\", \"answers\": []}"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/exams/midterm/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": \"u\", \"stage_id\": \"nope\", \"answers\": {}}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Unknown exam stage: nope"));
    }

    @Test
    void adminSyncReportsCounts() throws Exception {
        mockMvc.perform(post("/api/admin/sync"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.labs").value(2))
                .andExpect(jsonPath("$.quizzes").value(1))
                .andExpect(jsonPath("$.exams").value(1))
                .andExpect(jsonPath("$.refresh_status").value("local"))
                .andExpect(jsonPath("$.version").exists());
    }

    @Test
    void exportIncludesSheetSyncAndCsv() throws Exception {
        mockMvc.perform(post("/api/quizzes/fundamentals/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": \"exporter\", \"answers\": []}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/admin/export-scores"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sheet_sync.status").value("skipped"))
                .andExpect(jsonPath("$.quizzes[?(@.user_id == 'exporter')]").exists());
        mockMvc.perform(get("/api/admin/export-scores.csv"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("scores.csv")))
                .andExpect(content().string(containsString("\"quiz\",\"exporter\",\"fundamentals\"")));
    }

    @Test
    void notesAreServedAndGuarded() throws Exception {
        mockMvc.perform(get("/api/notes/getting-started"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("getting-started"))
                .andExpect(jsonPath("$.body").value(containsString("Getting started")));
        mockMvc.perform(get("/api/notes/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void healthReportsTheStore() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.store.backend").value("memory"))
                .andExpect(jsonPath("$.store.persistent").value(false));
    }
}
