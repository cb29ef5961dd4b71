package io.b2mash.yahrzeit.schedule;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.yahrzeit.FixedClockConfiguration;
import io.b2mash.yahrzeit.TestcontainersConfiguration;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import({TestcontainersConfiguration.class, FixedClockConfiguration.class})
@ActiveProfiles("test")
class ScheduleControllerTest {

  private static final String API_KEY = "test-api-key";

  @Autowired private MockMvc mockMvc;
  @Autowired private AnniversarySweepService sweepService;

  private UUID subjectId;

  @BeforeEach
  void createSubjectWithRecipients() throws Exception {
    subjectId = UUID.randomUUID();
    mockMvc
        .perform(
            post("/internal/subjects")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"id": "%s", "displayName": "Miriam Levy", "deathDate": "2023-01-15"}
                    """
                        .formatted(subjectId)))
        .andExpect(status().isCreated());
    addRecipient("EMAIL", subjectId + "@example.com");
    addRecipient("GROUP_MESSAGE", "levy-family-" + subjectId);
  }

  @Test
  void sweep_createsOneEntryPerRecipientForUpcomingYahrzeit() throws Exception {
    mockMvc
        .perform(
            post("/internal/schedule/sweep")
                .header("X-API-KEY", API_KEY)
                .param("date", "2023-12-19"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.sweepDate").value("2023-12-19"))
        .andExpect(jsonPath("$.entriesCreated", greaterThanOrEqualTo(2)));

    mockMvc
        .perform(get("/internal/subjects/" + subjectId + "/ledger").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(2)))
        .andExpect(jsonPath("$[*].status", containsInAnyOrder("PENDING", "PENDING")))
        .andExpect(jsonPath("$[*].cycleYear", containsInAnyOrder(5784, 5784)))
        .andExpect(
            jsonPath(
                "$[*].scheduledFor",
                containsInAnyOrder("2023-12-20T09:00:00Z", "2023-12-20T09:00:00Z")))
        .andExpect(jsonPath("$[0].occurrenceDate").value("2024-01-03"))
        .andExpect(jsonPath("$[0].payload.subjectName").value("Miriam Levy"))
        .andExpect(jsonPath("$[0].payload.hebrewDate").value("22 Tevet 5784"));
  }

  @Test
  void sweep_repeatedSameDayCreatesNoDuplicates() throws Exception {
    for (int i = 0; i < 3; i++) {
      mockMvc
          .perform(
              post("/internal/schedule/sweep")
                  .header("X-API-KEY", API_KEY)
                  .param("date", "2023-12-19"))
          .andExpect(status().isOk());
    }

    mockMvc
        .perform(get("/internal/subjects/" + subjectId + "/ledger").header("X-API-KEY", API_KEY))
        .andExpect(jsonPath("$", hasSize(2)));
  }

  @Test
  void sweep_beforeWindowCreatesNothing() throws Exception {
    mockMvc
        .perform(
            post("/internal/schedule/sweep")
                .header("X-API-KEY", API_KEY)
                .param("date", "2023-12-10"))
        .andExpect(status().isOk());

    mockMvc
        .perform(get("/internal/subjects/" + subjectId + "/ledger").header("X-API-KEY", API_KEY))
        .andExpect(jsonPath("$", hasSize(0)));
  }

  @Test
  void sweep_afterOccurrenceRollsOverToNextYear() throws Exception {
    mockMvc
        .perform(
            post("/internal/schedule/sweep")
                .header("X-API-KEY", API_KEY)
                .param("date", "2024-01-04"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.rolledOver", greaterThanOrEqualTo(1)));

    mockMvc
        .perform(get("/internal/subjects/" + subjectId).header("X-API-KEY", API_KEY))
        .andExpect(jsonPath("$.nextOccurrence").value("2025-01-22"));

    // Within the grace period the missed cycle still gets its reminders
    mockMvc
        .perform(get("/internal/subjects/" + subjectId + "/ledger").header("X-API-KEY", API_KEY))
        .andExpect(jsonPath("$", hasSize(2)))
        .andExpect(jsonPath("$[*].cycleYear", containsInAnyOrder(5784, 5784)));

    mockMvc
        .perform(
            get("/internal/audit-events")
                .header("X-API-KEY", API_KEY)
                .param("entityId", subjectId.toString())
                .param("eventType", "subject."))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content", hasSize(1)))
        .andExpect(jsonPath("$.content[0].eventType").value("subject.occurrence_rolled_over"))
        .andExpect(jsonPath("$.content[0].source").value("SCHEDULED"))
        .andExpect(jsonPath("$.content[0].details.next_occurrence").value("2025-01-22"));
  }

  @Test
  void sweep_staleSubjectKeepsItsStoredOccurrence() throws Exception {
    sweepService.markStale(subjectId, "Hebrew year out of range");

    mockMvc
        .perform(
            post("/internal/schedule/sweep")
                .header("X-API-KEY", API_KEY)
                .param("date", "2023-12-19"))
        .andExpect(status().isOk());

    mockMvc
        .perform(get("/internal/subjects/" + subjectId + "/ledger").header("X-API-KEY", API_KEY))
        .andExpect(jsonPath("$", hasSize(2)))
        .andExpect(jsonPath("$[*].occurrenceDate", containsInAnyOrder("2024-01-03", "2024-01-03")));

    mockMvc
        .perform(
            post("/internal/schedule/sweep")
                .header("X-API-KEY", API_KEY)
                .param("date", "2024-01-04"))
        .andExpect(status().isOk());

    mockMvc
        .perform(get("/internal/subjects/" + subjectId).header("X-API-KEY", API_KEY))
        .andExpect(jsonPath("$.stale").value(true))
        .andExpect(jsonPath("$.nextOccurrence").value("2024-01-03"));
  }

  private void addRecipient(String kind, String address) throws Exception {
    mockMvc
        .perform(
            post("/internal/subjects/" + subjectId + "/recipients")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"id": "%s", "channelKind": "%s", "address": "%s"}
                    """
                        .formatted(UUID.randomUUID(), kind, address)))
        .andExpect(status().isCreated());
  }
}
