package io.github.drompincen.scenarioagent.runtime.scenario;

import io.github.drompincen.scenarioagent.protocol.event.StreamResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Ordered, lazily evaluated list of frames. Suppliers run only when the stream reaches them, so
 * session mutations inside a supplier happen right before their frame is emitted.
 */
public final class FrameScript {

    private final Duration pacing;
    private final List<Flux<StreamResult>> segments = new ArrayList<>();

    FrameScript(Duration pacing) {
        this.pacing = pacing;
    }

    /** Emits a frame followed by the configured pacing delay. */
    public FrameScript emit(Supplier<? extends StreamResult> frame) {
        emitNow(frame);
        return pause(pacing);
    }

    /** Emits a frame with no delay after it. */
    public FrameScript emitNow(Supplier<? extends StreamResult> frame) {
        segments.add(Flux.defer(() -> Flux.just(frame.get())));
        return this;
    }

    public FrameScript run(Runnable sideEffect) {
        segments.add(Flux.defer(() -> {
            sideEffect.run();
            return Flux.empty();
        }));
        return this;
    }

    /** Holds the stream open for {@code duration} without emitting anything. */
    public FrameScript pause(Duration duration) {
        if (!duration.isZero()) {
            segments.add(Mono.delay(duration).thenMany(Flux.empty()));
        }
        return this;
    }

    public Flux<StreamResult> toFlux() {
        return Flux.concat(segments);
    }
}
