package com.superintendent.orchestrator.api;

import com.superintendent.orchestrator.model.InvalidPlanException;
import com.superintendent.orchestrator.model.Mode;
import com.superintendent.orchestrator.model.Target;
import com.superintendent.orchestrator.plan.Planner;
import com.superintendent.orchestrator.plan.PlannerInput;
import com.superintendent.orchestrator.service.InvalidRunRequestException;
import com.superintendent.orchestrator.service.Run;
import com.superintendent.orchestrator.service.RunService;
import com.superintendent.orchestrator.strategy.ExecutionDecision;
import com.superintendent.orchestrator.strategy.StrategyOverrides;
import com.superintendent.orchestrator.strategy.TaskInfo;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Slice test for RunController.
 *
 * Only the web layer starts; RunService is a mock.
 */
@WebMvcTest(RunController.class)
class RunControllerTest {

    @Autowired MockMvc      mockMvc;
    @MockitoBean RunService runService;

    // ------------------------------------------------------------------
    // POST /plans
    // ------------------------------------------------------------------

    @Test
    void plan_validRequest_returnsStepsInWireFormat() throws Exception {
        when(runService.preview(any())).thenReturn(new Planner().createPlan(
                new PlannerInput("/src/app", "Fix the login bug", Mode.AUTONOMOUS, Target.SANDBOX, null)));

        mockMvc.perform(post("/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repo":"/src/app","task":"Fix the login bug","target":"sandbox"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.steps.length()").value(6))
                .andExpect(jsonPath("$.steps[0].id").value("validate_repo"))
                .andExpect(jsonPath("$.steps[1].depends_on[0]").value("validate_repo"))
                .andExpect(jsonPath("$.metadata.sandbox_name").value("claude-app"));
    }

    @Test
    void plan_passesWireValuesThroughToPlannerInput() throws Exception {
        when(runService.preview(any())).thenReturn(new Planner().createPlan(
                new PlannerInput("/src/app", "t", Mode.INTERACTIVE, Target.CONTAINER, null)));

        mockMvc.perform(post("/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repo":"/src/app","task":"t","mode":"interactive","target":"container",
                                 "branch":"feature/x","force":true}
                                """))
                .andExpect(status().isOk());

        ArgumentCaptor<PlannerInput> captor = ArgumentCaptor.forClass(PlannerInput.class);
        verify(runService).preview(captor.capture());
        assertThat(captor.getValue().mode()).isEqualTo(Mode.INTERACTIVE);
        assertThat(captor.getValue().target()).isEqualTo(Target.CONTAINER);
        assertThat(captor.getValue().branch()).isEqualTo("feature/x");
        assertThat(captor.getValue().force()).isTrue();
    }

    @Test
    void plan_missingRepo_returns400() throws Exception {
        mockMvc.perform(post("/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"task":"Fix the login bug"}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void plan_invalidPlan_returns400() throws Exception {
        when(runService.preview(any())).thenThrow(new InvalidPlanException(List.of("Duplicate step ID: x")));

        mockMvc.perform(post("/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repo":"/src/app","task":"t"}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // POST /runs
    // ------------------------------------------------------------------

    @Test
    void submitRun_validRequest_returns201WithDecision() throws Exception {
        Run run = fakeRun();
        when(runService.submit(anyString(), anyString(), anyString(), any(), anyBoolean())).thenReturn(run);

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repo":"/src/app","task":"Fix the login bug","targetOverride":"sandbox"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(run.getId().toString()))
                .andExpect(jsonPath("$.state").value("QUEUED"))
                .andExpect(jsonPath("$.decision.mode").value("autonomous"))
                .andExpect(jsonPath("$.decision.target").value("sandbox"))
                .andExpect(jsonPath("$.decision.taskGroups[0][0].name").value("fix-login"));

        ArgumentCaptor<StrategyOverrides> overrides = ArgumentCaptor.forClass(StrategyOverrides.class);
        verify(runService).submit(eq("/src/app"), eq("Fix the login bug"), eq("auto"),
                overrides.capture(), eq(false));
        assertThat(overrides.getValue()).isEqualTo(new StrategyOverrides(null, Target.SANDBOX, null));
    }

    @Test
    void submitRun_rejectedByService_returns400() throws Exception {
        when(runService.submit(any(), any(), any(), any(), anyBoolean()))
                .thenThrow(new InvalidRunRequestException("autonomous + local requires dangerouslySkipIsolation=true"));

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repo":"/src/app","task":"Refactor parser"}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void submitRun_unknownTargetValue_returns400() throws Exception {
        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repo":"/src/app","task":"t","targetOverride":"mainframe"}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /runs/{id}
    // ------------------------------------------------------------------

    @Test
    void getRun_existingId_returns200() throws Exception {
        Run run = fakeRun();
        when(runService.findById(run.getId())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/runs/{id}", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.repo").value("/src/app"))
                .andExpect(jsonPath("$.source").value("single"));
    }

    @Test
    void getRun_unknownId_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(runService.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/runs/{id}", unknown))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Run fakeRun() {
        ExecutionDecision decision = new ExecutionDecision(Mode.AUTONOMOUS, Target.SANDBOX, 1,
                List.of(List.of(TaskInfo.named("fix-login"))), "Target overridden to sandbox");
        return new Run(UUID.randomUUID(), "/src/app", "single", decision);
    }
}
