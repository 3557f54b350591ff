package com.di.loannova.controller;

import com.di.loannova.contract.Violation;
import com.di.loannova.exception.CircuitOpenException;
import com.di.loannova.exception.ContractViolationException;
import com.di.loannova.exception.GlobalExceptionHandler;
import com.di.loannova.orchestrator.PipelineOrchestrator;
import com.di.loannova.orchestrator.RunRequest;
import com.di.loannova.orchestrator.RunStatus;
import com.di.loannova.orchestrator.RunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("PipelineRunController Tests")
class PipelineRunControllerTest {

    private PipelineOrchestrator orchestrator;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(PipelineOrchestrator.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new PipelineRunController(orchestrator))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private void respondWith(RunStatus status) {
        when(orchestrator.run(any())).thenReturn(RunSummary.builder()
                .runId("run_1").status(status).build());
    }

    @Test
    @DisplayName("Should return the summary with 200 for a successful run")
    void testRun_Success() throws Exception {
        respondWith(RunStatus.SUCCESS);

        mockMvc.perform(post("/api/pipeline/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"force\": true, \"user\": \"analyst\", \"action\": \"rerun\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.run_id").value("run_1"))
                .andExpect(jsonPath("$.status").value("success"));

        ArgumentCaptor<RunRequest> captor = ArgumentCaptor.forClass(RunRequest.class);
        verify(orchestrator).run(captor.capture());
        assertEquals(new RunRequest(true, "analyst", "rerun"), captor.getValue());
    }

    @Test
    @DisplayName("Should use default settings when no body is sent")
    void testRun_NoBody() throws Exception {
        respondWith(RunStatus.SKIPPED);

        mockMvc.perform(post("/api/pipeline/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("skipped"));

        verify(orchestrator).run(RunRequest.defaults());
    }

    @ParameterizedTest
    @EnumSource(value = RunStatus.class, names = {"FAILED", "SCHEMA_DRIFT", "QUALITY_GATE_FAILED"})
    @DisplayName("Should return 422 for runs that did not publish")
    void testRun_Unprocessable(RunStatus runStatus) throws Exception {
        respondWith(runStatus);

        mockMvc.perform(post("/api/pipeline/run"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value(runStatus.code()));
    }

    @Test
    @DisplayName("Should reject a malformed body with 400")
    void testRun_MalformedBody() throws Exception {
        mockMvc.perform(post("/api/pipeline/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"force\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("SERIALIZATION_ERROR"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("Should map escaped pipeline exceptions to their HTTP codes")
    void testRun_EscapedExceptions() throws Exception {
        when(orchestrator.run(any()))
                .thenThrow(new ContractViolationException("bad tape",
                        List.of(Violation.column("loan_id", "required_column", "missing")), true))
                .thenThrow(new CircuitOpenException("bi-export"))
                .thenThrow(new IllegalStateException("no source configured"))
                .thenThrow(new NullPointerException("boom"));

        mockMvc.perform(post("/api/pipeline/run"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.violations[0].rule").value("required_column"));
        mockMvc.perform(post("/api/pipeline/run"))
                .andExpect(status().isServiceUnavailable());
        mockMvc.perform(post("/api/pipeline/run"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("VALIDATION_ERROR"));
        mockMvc.perform(post("/api/pipeline/run"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.path").value("/api/pipeline/run"))
                .andExpect(jsonPath("$.message").value("boom"));
    }
}
