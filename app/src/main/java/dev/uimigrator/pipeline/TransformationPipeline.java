package dev.uimigrator.pipeline;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.diagnostics.Severity;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.logging.MdcKeys;
import dev.uimigrator.model.UnifiedDocument;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs stages in order, threading the document from one to the next and checking tree integrity
 * after each. A failing stage aborts the run with a {@link PipelineException} carrying the document
 * as it was before that stage started.
 */
public final class TransformationPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransformationPipeline.class);

    private final List<DocumentTransformer> stages;
    private final TreeIntegrityValidator validator;

    private TransformationPipeline(List<DocumentTransformer> stages, TreeIntegrityValidator validator) {
        this.stages = List.copyOf(stages);
        this.validator = validator;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> stageNames() {
        return stages.stream().map(DocumentTransformer::name).collect(Collectors.toUnmodifiableList());
    }

    public PipelineResult run(UnifiedDocument document, TransformationContext context) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(context, "context");
        long started = System.nanoTime();
        MDC.put(MdcKeys.DOCUMENT, document.sourceId());
        try {
            if (stages.isEmpty()) {
                context.report(Severity.WARNING, DiagnosticCodes.PIPELINE_EMPTY, "Pipeline has no stages; document left unchanged");
                return new PipelineResult(document, List.of(), List.of(), Duration.ofNanos(System.nanoTime() - started));
            }
            context.report(Severity.INFO, DiagnosticCodes.PIPELINE_START,
                    "Running " + stages.size() + " stage(s): " + String.join(", ", stageNames()));

            UnifiedDocument current = document;
            List<String> completed = new ArrayList<>();
            List<IntegrityReport> reports = new ArrayList<>();
            for (DocumentTransformer stage : stages) {
                MDC.put(MdcKeys.STAGE, stage.name());
                context.report(Severity.INFO, DiagnosticCodes.PIPELINE_STAGE, "Running stage " + stage.name());
                LOGGER.debug("Running stage {}", stage.name());
                UnifiedDocument checkpoint = current.snapshot();
                UnifiedDocument next;
                try {
                    next = stage.transform(current, context);
                } catch (RuntimeException ex) {
                    throw failure(stage, completed, checkpoint, ex, context);
                }
                if (next == null) {
                    throw failure(stage, completed, checkpoint, new IllegalStateException("Stage returned no document"), context);
                }
                current = next;
                completed.add(stage.name());
                reports.add(validator.validate(current, stage.name(), context));
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            context.report(Severity.INFO, DiagnosticCodes.PIPELINE_COMPLETE,
                    "Completed " + completed.size() + " stage(s) in " + elapsed.toMillis() + " ms");
            LOGGER.info("Pipeline completed {} stage(s) for {} in {} ms", completed.size(), document.sourceId(), elapsed.toMillis());
            return new PipelineResult(current, completed, reports, elapsed);
        } finally {
            MDC.remove(MdcKeys.STAGE);
            MDC.remove(MdcKeys.DOCUMENT);
        }
    }

    private static PipelineException failure(DocumentTransformer stage, List<String> completed, UnifiedDocument lastDocument,
                                             RuntimeException cause, TransformationContext context) {
        context.report(Severity.ERROR, DiagnosticCodes.PIPELINE_STAGE_FAILED,
                "Stage " + stage.name() + " failed: " + cause.getMessage());
        LOGGER.error("Stage {} failed after {}", stage.name(), completed, cause);
        return new PipelineException(stage.name(), completed, lastDocument, cause);
    }

    public static final class Builder {

        private final List<DocumentTransformer> stages = new ArrayList<>();
        private TreeIntegrityValidator validator = new TreeIntegrityValidator();

        private Builder() {
        }

        public Builder add(DocumentTransformer stage) {
            stages.add(Objects.requireNonNull(stage, "stage"));
            return this;
        }

        public Builder addIf(boolean condition, DocumentTransformer stage) {
            return condition ? add(stage) : this;
        }

        public Builder validator(TreeIntegrityValidator validator) {
            this.validator = Objects.requireNonNull(validator, "validator");
            return this;
        }

        public TransformationPipeline build() {
            return new TransformationPipeline(stages, validator);
        }
    }
}
