package dev.uimigrator.migrate;

import dev.uimigrator.diagnostics.Diagnostic;
import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.diagnostics.DiagnosticCollector;
import dev.uimigrator.diagnostics.Severity;
import dev.uimigrator.diagnostics.SourceLocation;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.engine.TransformationOptions;
import dev.uimigrator.hybrid.TransformationStrategy;
import dev.uimigrator.mapping.MappingSource;
import dev.uimigrator.model.NamespaceTypeResolver;
import dev.uimigrator.model.TypeResolver;
import dev.uimigrator.model.UnifiedDocument;
import dev.uimigrator.pipeline.PipelineException;
import dev.uimigrator.pipeline.PipelineResult;
import dev.uimigrator.pipeline.TransformationPipeline;
import dev.uimigrator.xml.MarkupParseException;
import dev.uimigrator.xml.XamlDocumentReader;
import dev.uimigrator.xml.XamlDocumentWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads, transforms and writes one document at a time. Failures of a document are reported in its
 * outcome and never thrown, so a batch continues with the next file.
 */
public class MigrationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(MigrationService.class);

    private final MappingSource mappings;
    private final TransformationStrategy strategy;
    private final TransformationOptions options;
    private final MigrationPipelineFactory pipelineFactory;
    private final XamlDocumentReader reader;
    private final XamlDocumentWriter writer;
    private final TypeResolver typeResolver;

    public MigrationService(MappingSource mappings, TransformationStrategy strategy, TransformationOptions options) {
        this(mappings, strategy, options, new MigrationPipelineFactory(), new XamlDocumentReader(), new XamlDocumentWriter(),
                NamespaceTypeResolver.wpfDefaults());
    }

    public MigrationService(MappingSource mappings, TransformationStrategy strategy, TransformationOptions options,
                            MigrationPipelineFactory pipelineFactory, XamlDocumentReader reader, XamlDocumentWriter writer,
                            TypeResolver typeResolver) {
        this.mappings = Objects.requireNonNull(mappings, "mappings");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.options = Objects.requireNonNull(options, "options");
        this.pipelineFactory = Objects.requireNonNull(pipelineFactory, "pipelineFactory");
        this.reader = Objects.requireNonNull(reader, "reader");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.typeResolver = Objects.requireNonNull(typeResolver, "typeResolver");
    }

    /**
     * Migrates a file. In dry-run mode the target is not written.
     */
    public MigrationOutcome migrate(MigrationTask task, boolean dryRun) {
        String sourceId = task.source().toString();
        String content;
        try {
            content = Files.readString(task.source(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            LOGGER.error("Failed to read {}: {}", sourceId, ex.getMessage());
            DiagnosticCollector diagnostics = new DiagnosticCollector();
            diagnostics.report(Diagnostic.of(DiagnosticCodes.PARSE_FAILED, Severity.ERROR,
                    "Failed to read file: " + ex.getMessage(), SourceLocation.fileOnly(sourceId)));
            return failed(sourceId, List.of(), diagnostics, Duration.ZERO);
        }
        MigrationOutcome outcome = migrate(content, sourceId);
        if (outcome.failed()) {
            return outcome;
        }
        if (dryRun) {
            return withStatus(outcome, MigrationOutcome.Status.DRY_RUN, outcome.diagnostics());
        }
        try {
            Path parent = task.target().toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(task.target(), outcome.output().orElse(""), StandardCharsets.UTF_8);
            LOGGER.info("Wrote {}", task.target());
            return outcome;
        } catch (IOException ex) {
            LOGGER.error("Failed to write {}: {}", task.target(), ex.getMessage());
            List<Diagnostic> diagnostics = new ArrayList<>(outcome.diagnostics());
            diagnostics.add(Diagnostic.of(DiagnosticCodes.WRITE_FAILED, Severity.ERROR,
                    "Failed to write " + task.target() + ": " + ex.getMessage(), SourceLocation.fileOnly(sourceId)));
            return withStatus(outcome, MigrationOutcome.Status.FAILED, diagnostics);
        }
    }

    /**
     * Migrates markup held in memory; the outcome carries the rendered result.
     */
    public MigrationOutcome migrate(String content, String sourceId) {
        long started = System.nanoTime();
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        TransformationContext context = new TransformationContext(sourceId, options, mappings, diagnostics);
        UnifiedDocument document;
        try {
            document = reader.read(content, sourceId);
        } catch (MarkupParseException ex) {
            LOGGER.error("Failed to parse {}: {}", sourceId, ex.getMessage());
            SourceLocation location = ex.line() > 0 ? SourceLocation.of(sourceId, ex.line(), Math.max(ex.column(), 0))
                    : SourceLocation.fileOnly(sourceId);
            diagnostics.report(Diagnostic.of(DiagnosticCodes.PARSE_FAILED, Severity.ERROR, ex.getMessage(), location));
            return failed(sourceId, List.of(), diagnostics, elapsedSince(started));
        }
        if (strategy != TransformationStrategy.STRUCTURAL_ONLY) {
            int resolved = document.attachTypedLayer(typeResolver);
            LOGGER.debug("Resolved {} element type(s) in {}", resolved, sourceId);
        }

        TransformationPipeline pipeline = pipelineFactory.create(strategy, mappings);
        PipelineResult result;
        try {
            result = pipeline.run(document, context);
        } catch (PipelineException ex) {
            LOGGER.error("Migration of {} failed at stage {}", sourceId, ex.stageName());
            return failed(sourceId, ex.completedStages(), diagnostics, elapsedSince(started));
        }

        String output = writer.write(result.document());
        LOGGER.info("Migrated {} with {} transformation(s), {} warning(s), {} error(s)", sourceId,
                context.statistics().total(), diagnostics.warningCount(), diagnostics.errorCount());
        return new MigrationOutcome(sourceId, MigrationOutcome.Status.MIGRATED, Optional.of(output), result.completedStages(),
                diagnostics.diagnostics(), context.statistics().total(), elapsedSince(started));
    }

    private static MigrationOutcome failed(String sourceId, List<String> completedStages, DiagnosticCollector diagnostics, Duration elapsed) {
        return new MigrationOutcome(sourceId, MigrationOutcome.Status.FAILED, Optional.empty(), completedStages,
                diagnostics.diagnostics(), 0, elapsed);
    }

    private static MigrationOutcome withStatus(MigrationOutcome outcome, MigrationOutcome.Status status, List<Diagnostic> diagnostics) {
        return new MigrationOutcome(outcome.sourceId(), status, outcome.output(), outcome.completedStages(), diagnostics,
                outcome.transformations(), outcome.elapsed());
    }

    private static Duration elapsedSince(long started) {
        return Duration.ofNanos(System.nanoTime() - started);
    }
}
