package com.vimbiso.backend.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vimbiso.backend.ledger.LedgerApiClient;
import com.vimbiso.backend.ledger.LoginResult;
import com.vimbiso.backend.state.ChannelIdentity;
import com.vimbiso.backend.state.FlowState;
import com.vimbiso.backend.state.StateManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class BotEventControllerIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;
  @Autowired private StateManager stateManager;

  @MockBean private LedgerApiClient ledgerApiClient;

  @Test
  void unknownMemberIsAskedForMissingName() throws Exception {
    ChannelIdentity channel = ChannelIdentity.whatsapp("263770000001");
    when(ledgerApiClient.login(channel)).thenReturn(LoginResult.newMember());

    mockMvc
        .perform(
            post("/api/bot/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"channelType": "whatsapp", "identifier": "263770000001",
                     "rawValue": "hi", "profileName": "Ada"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.type").value("TEXT"))
        .andExpect(jsonPath("$.body").value("Thanks! What is your last name?"));

    FlowState flow = stateManager.load(channel).flow();
    assertThat(flow.flowType()).isEqualTo("registration");

    MvcResult result =
        mockMvc
            .perform(get("/api/bot/audit/{flowId}", flow.flowId()))
            .andExpect(status().isOk())
            .andReturn();
    JsonNode events = objectMapper.readTree(result.getResponse().getContentAsString());
    assertThat(events.get(0).path("event_type").asText()).isEqualTo("flow_started");
    assertThat(events.toString()).doesNotContain("auth_token");
  }

  @Test
  void invalidEventIsRejectedWithProblemDetail() throws Exception {
    mockMvc
        .perform(
            post("/api/bot/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"channelType\": \"whatsapp\", \"rawValue\": \"hi\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid event"));
  }

  @Test
  void unknownFlowHasNoAuditHistory() throws Exception {
    mockMvc
        .perform(get("/api/bot/audit/{flowId}", "offer_missing"))
        .andExpect(status().isNotFound());
  }
}
