package io.github.drompincen.scenarioagent.gateway.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.scenarioagent.protocol.frame.FrameCodec;
import io.github.drompincen.scenarioagent.runtime.dispatch.RequestDispatcher;
import io.github.drompincen.scenarioagent.runtime.scenario.DirectExecutionScenario;
import io.github.drompincen.scenarioagent.runtime.scenario.ErrorMidExecutionScenario;
import io.github.drompincen.scenarioagent.runtime.scenario.FullPlanModeScenario;
import io.github.drompincen.scenarioagent.runtime.scenario.MultiClarificationScenario;
import io.github.drompincen.scenarioagent.runtime.scenario.PlanModeFlow;
import io.github.drompincen.scenarioagent.runtime.scenario.ScenarioCatalog;
import io.github.drompincen.scenarioagent.runtime.scenario.ScenarioProperties;
import io.github.drompincen.scenarioagent.runtime.scenario.ScriptFactory;
import io.github.drompincen.scenarioagent.runtime.scenario.TimeoutScenario;
import io.github.drompincen.scenarioagent.runtime.session.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class A2aControllerMvcTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private SessionStore sessionStore;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        ScenarioProperties properties =
                new ScenarioProperties("full_plan_mode", "test-workflow-agent", Duration.ZERO, Duration.ofMinutes(10));
        ScriptFactory scripts = new ScriptFactory(properties);
        PlanModeFlow flow = new PlanModeFlow(scripts);
        DirectExecutionScenario direct = new DirectExecutionScenario(scripts, flow);
        ScenarioCatalog catalog = new ScenarioCatalog(List.of(
                new FullPlanModeScenario(flow, direct),
                direct,
                new ErrorMidExecutionScenario(scripts, flow),
                new MultiClarificationScenario(scripts, flow, direct),
                new TimeoutScenario(scripts, flow)), properties);
        sessionStore = new SessionStore();
        RequestDispatcher dispatcher = new RequestDispatcher(sessionStore, catalog, new FrameCodec(mapper));
        mvc = MockMvcBuilders.standaloneSetup(new A2aController(dispatcher, catalog)).build();
    }

    @Test
    void messageStreamsSseFramesEndingWithDone() throws Exception {
        MvcResult started = mvc.perform(post("/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"jsonrpc":"2.0","method":"message/send","id":"req-1",
                                 "params":{"sessionId":"s1","workflowId":"w1",
                                   "message":{"parts":[{"text":"Analyze"}],"metadata":{"plan_mode_enabled":true}}}}
                                """))
                .andExpect(request().asyncStarted())
                .andReturn();

        MvcResult result = mvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM))
                .andExpect(header().string("Cache-Control", "no-cache"))
                .andExpect(header().stringValues("Connection", hasItem("keep-alive")))
                .andExpect(header().string("X-Accel-Buffering", "no"))
                .andReturn();

        List<String> frames = frames(result.getResponse().getContentAsString());
        assertThat(frames).hasSize(3);
        assertThat(frames.get(0)).startsWith("data: {").contains("\"jsonrpc\":\"2.0\"").contains("\"id\":\"req-1\"");
        assertThat(frames.get(1)).contains("\"state\":\"input-required\"").contains("clarification_needed");
        assertThat(frames).last().isEqualTo(FrameCodec.DONE_FRAME);
    }

    @Test
    void respondStreamsRejectionThenDone() throws Exception {
        MvcResult started = mvc.perform(post("/a2a/respond")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s1\",\"planId\":\"p1\",\"approved\":false}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        MvcResult result = mvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM))
                .andReturn();

        List<String> frames = frames(result.getResponse().getContentAsString());
        assertThat(frames).hasSize(2);
        assertThat(frames.get(0)).contains("\"kind\":\"message\"").contains("Analysis cancelled.");
        assertThat(frames.get(1)).isEqualTo(FrameCodec.DONE_FRAME);
    }

    @Test
    void respondWithoutRecognisedAnswerStillStreams() throws Exception {
        MvcResult started = mvc.perform(post("/a2a/respond")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"selectionId\":\"sel-1\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        MvcResult result = mvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andReturn();

        List<String> frames = frames(result.getResponse().getContentAsString());
        assertThat(frames).hasSize(2);
        assertThat(frames.get(0)).contains("\"state\":\"failed\"").contains("Unknown response type");
        assertThat(frames.get(1)).isEqualTo(FrameCodec.DONE_FRAME);
        assertThat(sessionStore.list()).isEmpty();
    }

    @Test
    void unknownScenarioOverrideIsBadRequest() throws Exception {
        mvc.perform(post("/")
                        .param("scenario", "nope")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"jsonrpc\":\"2.0\",\"method\":\"message/send\",\"params\":{}}"))
                .andExpect(request().asyncNotStarted())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown scenario"))
                .andExpect(jsonPath("$.availableScenarios[0]").value("full_plan_mode"));

        assertThat(sessionStore.list()).isEmpty();
    }

    private static List<String> frames(String body) {
        assertThat(body).endsWith("\n\n");
        return Arrays.stream(body.split("(?<=\n\n)")).toList();
    }
}
