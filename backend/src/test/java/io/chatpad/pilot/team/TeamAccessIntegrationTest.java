package io.chatpad.pilot.team;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.chatpad.pilot.TestcontainersConfiguration;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TeamAccessIntegrationTest {

  private static final String API_KEY = "test-api-key";

  private final UUID owner = UUID.randomUUID();
  private final UUID member = UUID.randomUUID();
  private final UUID stranger = UUID.randomUUID();

  @Autowired private MockMvc mockMvc;

  private String agentId;

  @BeforeAll
  void setUp() throws Exception {
    mockMvc
        .perform(
            post("/internal/subscriptions")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"userId": "%s", "planId": "pro", "status": "active"}
                    """
                        .formatted(owner)))
        .andExpect(status().isOk());

    var result =
        mockMvc
            .perform(
                post("/api/agents")
                    .with(as(owner))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"name\": \"Front desk\"}"))
            .andExpect(status().isCreated())
            .andReturn();
    agentId = JsonPath.read(result.getResponse().getContentAsString(), "$.id");

    mockMvc
        .perform(
            post("/api/team/members")
                .with(as(owner))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"memberId\": \"%s\", \"role\": \"member\"}".formatted(member)))
        .andExpect(status().isCreated());
  }

  @Test
  void memberResolvesToOwnersAccount() throws Exception {
    mockMvc
        .perform(get("/api/me").with(as(member)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.accountId").value(owner.toString()))
        .andExpect(jsonPath("$.source").value("TEAM_MEMBERSHIP"))
        .andExpect(jsonPath("$.teamRole").value("member"));
  }

  @Test
  void memberSeesOwnersAgents() throws Exception {
    mockMvc
        .perform(get("/api/agents").with(as(member)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].id").value(agentId));
  }

  @Test
  void strangerGetsNotFoundAndEmptyList() throws Exception {
    mockMvc
        .perform(get("/api/agents/" + agentId).with(as(stranger)))
        .andExpect(status().isNotFound());
    mockMvc
        .perform(get("/api/agents").with(as(stranger)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(0)));
  }

  @Test
  void removedMemberLosesAccessImmediately() throws Exception {
    var temp = UUID.randomUUID();
    mockMvc
        .perform(
            post("/api/team/members")
                .with(as(owner))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"memberId\": \"%s\", \"role\": \"member\"}".formatted(temp)))
        .andExpect(status().isCreated());
    mockMvc.perform(get("/api/agents/" + agentId).with(as(temp))).andExpect(status().isOk());

    mockMvc
        .perform(delete("/api/team/members/" + temp).with(as(owner)))
        .andExpect(status().isNoContent());

    mockMvc.perform(get("/api/agents/" + agentId).with(as(temp))).andExpect(status().isNotFound());
  }

  @Test
  void plainMemberCannotAddMembers() throws Exception {
    mockMvc
        .perform(
            post("/api/team/members")
                .with(as(member))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"memberId\": \"%s\", \"role\": \"member\"}".formatted(UUID.randomUUID())))
        .andExpect(status().isForbidden());
  }

  @Test
  void unauthenticatedApiCallIsRejected() throws Exception {
    mockMvc.perform(get("/api/me")).andExpect(status().isUnauthorized());
  }

  @Test
  void internalCallWithoutKeyIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/internal/subscriptions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void publicHelpCenterNeedsNoToken() throws Exception {
    mockMvc
        .perform(get("/api/public/help-center/categories"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].slug").value("getting-started"));
  }

  private static JwtRequestPostProcessor as(UUID principalId) {
    return jwt().jwt(j -> j.subject(principalId.toString()));
  }
}
