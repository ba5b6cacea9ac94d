package com.trusty.decisionservice.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.trusty.accesscontrol.StoreUnavailableException;
import com.trusty.directory.DirectoryRepository;
import com.trusty.observability.DecisionMetrics;
import com.trusty.observability.DecisionOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/** A directory that cannot be read turns into 503 problems and a DOWN health check, never a deny. */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Store unavailable, end to end")
class StoreUnavailableEndToEndTest {

    private static final String REQUEST =
            """
            {"external_user_id":"u1","namespace":"billing","action":"read","resource":"invoices/1"}
            """;

    @Autowired private MockMvc mockMvc;
    @Autowired private DecisionMetrics decisionMetrics;

    @MockBean private DirectoryRepository directory;

    @BeforeEach
    void storeIsDown() {
        when(directory.getRoleIdsForUser(anyString()))
                .thenThrow(new StoreUnavailableException("directory store failed to load roles"));
        doThrow(new StoreUnavailableException("directory store failed to verify connectivity"))
                .when(directory)
                .verifyConnectivity();
    }

    @Test
    @DisplayName("POST /v1/isallowed answers 503 without leaking store details")
    void decisionIs503() throws Exception {
        double before = decisionMetrics.count(DecisionOutcome.STORE_UNAVAILABLE);

        mockMvc.perform(post("/v1/isallowed").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value(503))
                .andExpect(jsonPath("$.result").doesNotExist())
                .andExpect(content().string(not(containsString("load roles"))));

        assertThat(decisionMetrics.count(DecisionOutcome.STORE_UNAVAILABLE)).isEqualTo(before + 1);
    }

    @Test
    @DisplayName("invalid requests are still 400 while the store is down")
    void validationComesFirst() throws Exception {
        mockMvc.perform(
                        post("/v1/isallowed")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"namespace\":\"billing\",\"action\":\"read\",\"resource\":\"x\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("actuator health reports the directory store DOWN")
    void healthIsDown() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.components.directoryStore.status").value("DOWN"));
    }
}
