package com.easycashflows.controller;

import com.easycashflows.service.dispatch.UnknownProviderException;
import com.easycashflows.service.rules.BusinessEventService;
import com.easycashflows.service.rules.BusinessEventService.RuleEvaluation;
import com.easycashflows.service.rules.RuleDispatchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(NotificationEventController.class)
@DisplayName("NotificationEventController")
class NotificationEventControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BusinessEventService businessEventService;

    @Test
    @DisplayName("Publishes the event and lists one result per rule")
    void publishesEvent() throws Exception {
        UUID ruleId = UUID.randomUUID();
        when(businessEventService.publish(eq("invoice_due"), anyMap(), isNull()))
                .thenReturn(List.of(new RuleEvaluation(ruleId, "invoice reminder",
                        RuleDispatchResult.skipped(RuleDispatchResult.Status.NOT_SUPPORTED,
                                "Delayed notifications are not yet supported"))));

        mockMvc.perform(post("/api/notifications/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event\":\"invoice_due\",\"data\":{\"amount\":120}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.event").value("invoice_due"))
                .andExpect(jsonPath("$.results[0].ruleId").value(ruleId.toString()))
                .andExpect(jsonPath("$.results[0].status").value("NOT_SUPPORTED"))
                .andExpect(jsonPath("$.results[0].success").value(false));
    }

    @Test
    @DisplayName("Missing event name is a 400")
    void missingEventRejected() throws Exception {
        mockMvc.perform(post("/api/notifications/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("event is required"));

        verifyNoInteractions(businessEventService);
    }

    @Test
    @DisplayName("Unknown provider id is a 400")
    void unknownProviderRejected() throws Exception {
        when(businessEventService.publish(any(), any(), eq("pigeon")))
                .thenThrow(new UnknownProviderException("pigeon"));

        mockMvc.perform(post("/api/notifications/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event\":\"invoice_due\",\"providerId\":\"pigeon\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown provider: pigeon"));
    }
}
