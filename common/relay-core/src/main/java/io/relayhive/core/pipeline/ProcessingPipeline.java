package io.relayhive.core.pipeline;

import io.relayhive.core.message.InboundMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of {@link ProcessingStage}s, outermost first. The last stage is the terminal one
 * and must not call its chain.
 */
public final class ProcessingPipeline {

    private final List<ProcessingStage> stages;

    private ProcessingPipeline(List<ProcessingStage> stages) {
        this.stages = List.copyOf(stages);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ProcessingStage> stages() {
        return stages;
    }

    public boolean process(InboundMessage message) {
        Objects.requireNonNull(message, "message");
        return proceed(0, message);
    }

    private boolean proceed(int index, InboundMessage message) {
        if (index >= stages.size()) {
            throw new IllegalStateException("Stage " + stages.get(index - 1).getClass().getSimpleName()
                + " is the last stage and cannot proceed");
        }
        return stages.get(index).process(message, next -> proceed(index + 1, next));
    }

    public static final class Builder {
        private final List<ProcessingStage> stages = new ArrayList<>();

        private Builder() {
        }

        /**
         * Appends a stage inside the ones added so far.
         */
        public Builder stage(ProcessingStage stage) {
            stages.add(Objects.requireNonNull(stage, "stage"));
            return this;
        }

        public ProcessingPipeline build() {
            if (stages.isEmpty()) {
                throw new IllegalStateException("A pipeline needs at least one stage");
            }
            return new ProcessingPipeline(stages);
        }
    }
}
