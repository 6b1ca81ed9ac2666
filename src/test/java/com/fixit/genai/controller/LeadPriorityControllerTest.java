package com.fixit.genai.controller;

import com.fixit.genai.config.LeadWeights;
import com.fixit.genai.exception.ValidationException;
import com.fixit.genai.lead.LeadBatch;
import com.fixit.genai.lead.LeadPriorityResult;
import com.fixit.genai.lead.LeadPriorityService;
import com.fixit.genai.lead.LeadStatus;
import com.fixit.genai.lead.ScoringMetadata;
import com.fixit.genai.llm.ModelClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class LeadPriorityControllerTest {

    private static final String BODY = """
            {
              "leads": [{
                "lead_id": "TEST001",
                "source": "referral",
                "budget": 15000000,
                "city": "Mumbai",
                "property_type": "3BHK",
                "last_activity_minutes_ago": 30,
                "past_interactions": 5,
                "notes": "Very interested",
                "status": "contacted"
              }],
              "max_results": 5
            }
            """;

    @Mock
    private LeadPriorityService service;

    @Mock
    private ModelClient modelClient;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new LeadPriorityController(service, modelClient))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("should map the snake_case body to a batch and honour use_llm")
    void prioritize() throws Exception {
        when(service.prioritize(any(LeadBatch.class), anyBoolean())).thenReturn(new LeadPriorityResult(List.of(), 1,
                new ScoringMetadata("deterministic", false, LeadWeights.defaults(), 0.7, 0.4)));

        mockMvc.perform(post("/api/v1/lead-priority").param("use_llm", "false")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_processed").value(1))
                .andExpect(jsonPath("$.model_metadata.model_used").value("deterministic"))
                .andExpect(jsonPath("$.model_metadata.scoring_weights.recency").value(0.25));

        ArgumentCaptor<LeadBatch> captor = ArgumentCaptor.forClass(LeadBatch.class);
        verify(service).prioritize(captor.capture(), eq(false));
        assertThat(captor.getValue().maxResults()).isEqualTo(5);
        assertThat(captor.getValue().leads().get(0).status()).isEqualTo(LeadStatus.CONTACTED);
        assertThat(captor.getValue().leads().get(0).minutesSinceActivity()).isEqualTo(30);
    }

    @Test
    @DisplayName("should answer 400 with error and detail on validation failures")
    void validationError() throws Exception {
        when(service.prioritize(any(LeadBatch.class), anyBoolean()))
                .thenThrow(new ValidationException("max_results must be at least 1 but was 0"));

        mockMvc.perform(post("/api/v1/lead-priority")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"))
                .andExpect(jsonPath("$.detail").value("max_results must be at least 1 but was 0"));
    }

    @Test
    @DisplayName("should reject an unknown status with 400 before scoring")
    void unknownStatus() throws Exception {
        mockMvc.perform(post("/api/v1/lead-priority")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY.replace("contacted", "archived")))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(service);
    }

    @Test
    @DisplayName("health should report model availability")
    void health() throws Exception {
        when(modelClient.isAvailable()).thenReturn(false);
        when(modelClient.modelName()).thenReturn("llama3.2:3b");

        mockMvc.perform(get("/api/v1/lead-priority/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.model_available").value(false))
                .andExpect(jsonPath("$.mode").value("heuristic"));
    }
}
