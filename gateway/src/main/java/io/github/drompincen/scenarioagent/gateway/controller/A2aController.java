package io.github.drompincen.scenarioagent.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.scenarioagent.protocol.api.MessageSendRequest;
import io.github.drompincen.scenarioagent.protocol.api.RespondRequest;
import io.github.drompincen.scenarioagent.runtime.dispatch.RequestDispatcher;
import io.github.drompincen.scenarioagent.runtime.scenario.ScenarioCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.Stream;

/**
 * The two streaming endpoints. Frames are written and flushed one at a time; closing the frame
 * stream on disconnect cancels whatever the scenario was still going to produce.
 */
@RestController
public class A2aController {

    private static final Logger log = LoggerFactory.getLogger(A2aController.class);

    private final RequestDispatcher dispatcher;
    private final ScenarioCatalog catalog;

    public A2aController(RequestDispatcher dispatcher, ScenarioCatalog catalog) {
        this.dispatcher = dispatcher;
        this.catalog = catalog;
    }

    @PostMapping("/")
    public ResponseEntity<StreamingResponseBody> message(@RequestBody MessageSendRequest request,
                                                         @RequestParam(required = false) String scenario) {
        requireKnown(scenario);
        return stream(dispatcher.dispatchMessage(request, scenario));
    }

    @PostMapping("/a2a/respond")
    public ResponseEntity<StreamingResponseBody> respond(@RequestBody JsonNode body,
                                                         @RequestParam(required = false) String scenario) {
        requireKnown(scenario);
        return stream(dispatcher.dispatchAnswer(RespondRequest.parse(body), scenario));
    }

    private void requireKnown(String scenario) {
        if (scenario != null && catalog.find(scenario).isEmpty()) {
            throw new UnknownScenarioException(scenario);
        }
    }

    private ResponseEntity<StreamingResponseBody> stream(Flux<String> frames) {
        StreamingResponseBody body = out -> {
            try (Stream<String> stream = frames.toStream(1)) {
                Iterator<String> it = stream.iterator();
                while (it.hasNext()) {
                    out.write(it.next().getBytes(StandardCharsets.UTF_8));
                    out.flush();
                }
            } catch (IOException e) {
                log.debug("[Agent] Client went away mid-stream: {}", e.getMessage());
            }
        };
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                .header(HttpHeaders.CONNECTION, "keep-alive")
                .header("X-Accel-Buffering", "no")
                .body(body);
    }

    @ExceptionHandler(UnknownScenarioException.class)
    public ResponseEntity<Map<String, Object>> unknownScenario(UnknownScenarioException e) {
        log.warn("[Agent] Rejected request for unknown scenario '{}'", e.getScenario());
        return ResponseEntity.badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of(
                        "error", "Unknown scenario",
                        "availableScenarios", catalog.names()));
    }
}
