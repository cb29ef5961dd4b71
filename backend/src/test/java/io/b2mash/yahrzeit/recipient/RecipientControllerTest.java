package io.b2mash.yahrzeit.recipient;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
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
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
@Import({TestcontainersConfiguration.class, FixedClockConfiguration.class})
@ActiveProfiles("test")
class RecipientControllerTest {

  private static final String API_KEY = "test-api-key";

  @Autowired private MockMvc mockMvc;

  private UUID subjectId;

  @BeforeEach
  void createSubject() throws Exception {
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
  }

  @Test
  void registerRecipient_normalizesEmailAddress() throws Exception {
    var id = UUID.randomUUID();

    register(id, "EMAIL", "  Ruth.Levy@Example.COM ", 21)
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.address").value("ruth.levy@example.com"))
        .andExpect(jsonPath("$.leadDays").value(21))
        .andExpect(jsonPath("$.active").value(true))
        .andExpect(jsonPath("$.optedOut").value(false));
  }

  @Test
  void registerRecipient_keepsGroupHandleCase() throws Exception {
    register(UUID.randomUUID(), "GROUP_MESSAGE", "LevyFamily", null)
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.address").value("LevyFamily"))
        .andExpect(jsonPath("$.leadDays").doesNotExist());
  }

  @Test
  void registerRecipient_duplicateAddressReturns409() throws Exception {
    register(UUID.randomUUID(), "EMAIL", "ruth@example.com", null).andExpect(status().isCreated());

    register(UUID.randomUUID(), "EMAIL", "RUTH@example.com", null)
        .andExpect(status().isConflict());
  }

  @Test
  void registerRecipient_rejectsInvalidInput() throws Exception {
    register(UUID.randomUUID(), "EMAIL", "not-an-address", null)
        .andExpect(status().isBadRequest());
    register(UUID.randomUUID(), "EMAIL", "ruth@example.com", 31).andExpect(status().isBadRequest());
  }

  @Test
  void registerRecipient_unknownSubjectReturns404() throws Exception {
    mockMvc
        .perform(
            post("/internal/subjects/" + UUID.randomUUID() + "/recipients")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(recipientJson(UUID.randomUUID(), "EMAIL", "ruth@example.com", null)))
        .andExpect(status().isNotFound());
  }

  @Test
  void registerRecipient_deletedSubjectReturns400() throws Exception {
    mockMvc
        .perform(delete("/internal/subjects/" + subjectId).header("X-API-KEY", API_KEY))
        .andExpect(status().isNoContent());

    register(UUID.randomUUID(), "EMAIL", "ruth@example.com", null)
        .andExpect(status().isBadRequest());
  }

  @Test
  void optOutAndReactivate_toggleEligibility() throws Exception {
    var id = UUID.randomUUID();
    register(id, "EMAIL", "ruth@example.com", null).andExpect(status().isCreated());

    mockMvc
        .perform(post("/internal/recipients/" + id + "/opt-out").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.optedOut").value(true));

    mockMvc
        .perform(post("/internal/recipients/" + id + "/reactivate").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.optedOut").value(false))
        .andExpect(jsonPath("$.active").value(true));
  }

  @Test
  void deactivate_cancelsPendingReminders() throws Exception {
    var id = UUID.randomUUID();
    register(id, "EMAIL", "ruth@example.com", null).andExpect(status().isCreated());
    mockMvc
        .perform(
            post("/internal/schedule/sweep")
                .header("X-API-KEY", API_KEY)
                .param("date", "2023-12-19"))
        .andExpect(status().isOk());

    mockMvc
        .perform(
            post("/internal/recipients/" + id + "/deactivate")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\": \"Moved away\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active").value(false))
        .andExpect(jsonPath("$.deactivationReason").value("Moved away"));

    mockMvc
        .perform(get("/internal/subjects/" + subjectId + "/ledger").header("X-API-KEY", API_KEY))
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].status").value("CANCELLED"));
  }

  @Test
  void listRecipients_returnsSubjectRecipients() throws Exception {
    register(UUID.randomUUID(), "EMAIL", "ruth@example.com", null).andExpect(status().isCreated());
    register(UUID.randomUUID(), "GROUP_MESSAGE", "levy-family", 7)
        .andExpect(status().isCreated());

    mockMvc
        .perform(
            get("/internal/subjects/" + subjectId + "/recipients").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(2)));
  }

  private ResultActions register(UUID id, String kind, String address, Integer leadDays)
      throws Exception {
    return mockMvc.perform(
        post("/internal/subjects/" + subjectId + "/recipients")
            .header("X-API-KEY", API_KEY)
            .contentType(MediaType.APPLICATION_JSON)
            .content(recipientJson(id, kind, address, leadDays)));
  }

  private static String recipientJson(UUID id, String kind, String address, Integer leadDays) {
    return """
        {
          "id": "%s",
          "channelKind": "%s",
          "address": "%s",
          "displayName": "Ruth",
          "leadDays": %s
        }
        """
        .formatted(id, kind, address, leadDays);
  }
}
