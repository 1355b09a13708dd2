package com.example.canonical.ingestion.config;

import com.example.canonical.ingestion.schema.DefaultSchemas;
import com.example.canonical.ingestion.schema.ReferenceData;
import com.example.canonical.ingestion.schema.SchemaRegistry;
import com.example.canonical.ingestion.service.AuditAggregator;
import com.example.canonical.ingestion.service.CommandIntegrityGate;
import com.example.canonical.ingestion.service.CsvFileLoader;
import com.example.canonical.ingestion.service.DuplicateDetector;
import com.example.canonical.ingestion.service.HashIntegrityGate;
import com.example.canonical.ingestion.service.IntegrityGate;
import com.example.canonical.ingestion.service.IntegrityGateRunner;
import com.example.canonical.ingestion.service.PipelineOrchestrator;
import com.example.canonical.ingestion.service.PipelineRunService;
import com.example.canonical.ingestion.service.RecordSinkWriter;
import com.example.canonical.ingestion.service.RecordTransformer;
import com.example.canonical.ingestion.service.ReportWriter;
import com.example.canonical.ingestion.service.ValueCoercer;
import com.example.canonical.ingestion.support.CamelCsvParserFactory;
import com.example.canonical.ingestion.support.CompressionSupport;
import com.example.canonical.ingestion.support.ContentHasher;
import com.example.canonical.ingestion.support.FormatDetector;
import com.example.canonical.ingestion.support.NameNormalizer;
import com.example.canonical.ingestion.support.OutputLayout;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class IngestionConfiguration {

    @Bean
    public ReferenceData referenceData() {
        return ReferenceData.defaults();
    }

    @Bean
    public SchemaRegistry schemaRegistry(ReferenceData referenceData) {
        return DefaultSchemas.registry(referenceData);
    }

    @Bean
    public ValueCoercer valueCoercer(ReferenceData referenceData, NameNormalizer nameNormalizer) {
        return new ValueCoercer(referenceData, nameNormalizer);
    }

    @Bean
    public OutputLayout outputLayout(PipelineProperties properties) {
        OutputLayout layout = new OutputLayout(properties.getInputRoot(), properties.getOutputRoot());
        log.info("Canonical input={} output={}", layout.inputRoot(), layout.outputRoot());
        return layout;
    }

    @Bean
    public RecordSinkWriter recordSinkWriter(OutputLayout layout, ObjectMapper objectMapper) {
        return new RecordSinkWriter(layout, objectMapper);
    }

    @Bean
    public ReportWriter reportWriter(OutputLayout layout, ObjectMapper objectMapper) {
        return new ReportWriter(layout, objectMapper);
    }

    @Bean
    public CsvFileLoader csvFileLoader(SchemaRegistry schemaRegistry,
            ValueCoercer valueCoercer,
            DuplicateDetector duplicateDetector,
            FormatDetector formatDetector,
            CamelCsvParserFactory parserFactory,
            CompressionSupport compressionSupport,
            ContentHasher contentHasher,
            RecordSinkWriter recordSinkWriter,
            PipelineProperties properties) {
        return new CsvFileLoader(schemaRegistry, valueCoercer, duplicateDetector, formatDetector, parserFactory,
                compressionSupport, contentHasher, recordSinkWriter, Math.max(1, properties.getProgressUpdateInterval()));
    }

    @Bean
    public IntegrityGate integrityGate(PipelineProperties properties, ContentHasher contentHasher,
            ObjectMapper objectMapper) {
        PipelineProperties.Integrity integrity = properties.getIntegrity();
        log.info("Integrity gate mode={}", integrity.getMode());
        return switch (integrity.getMode()) {
            case SNAPSHOT -> HashIntegrityGate.snapshot(properties.getInputRoot(), contentHasher);
            case BASELINE -> {
                if (integrity.getBaselineFile() == null) {
                    throw new IllegalStateException("app.pipeline.integrity.baseline-file is required in BASELINE mode");
                }
                yield HashIntegrityGate.baseline(properties.getInputRoot(), integrity.getBaselineFile(),
                        contentHasher, objectMapper);
            }
            case COMMAND -> new CommandIntegrityGate(integrity.getCommand(), properties.getInputRoot(),
                    integrity.getTimeout());
            case NONE -> IntegrityGate.NONE;
        };
    }

    @Bean
    public IntegrityGateRunner integrityGateRunner(IntegrityGate integrityGate,
            @Qualifier("integrityGateExecutor") ExecutorService executor,
            PipelineProperties properties) {
        return new IntegrityGateRunner(integrityGate, executor, properties.getIntegrity().getTimeout());
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(OutputLayout layout,
            PipelineProperties properties,
            CsvFileLoader csvFileLoader,
            AuditAggregator auditAggregator,
            ReportWriter reportWriter,
            IntegrityGateRunner integrityGateRunner,
            ObjectProvider<RecordTransformer> transformers,
            CompressionSupport compressionSupport) {
        return new PipelineOrchestrator(layout, properties.toPolicy(), csvFileLoader, auditAggregator, reportWriter,
                integrityGateRunner, transformers.orderedStream().toList(), compressionSupport, Clock.systemUTC());
    }

    @Bean
    public PipelineRunService pipelineRunService(PipelineOrchestrator orchestrator, ReportWriter reportWriter,
            @Qualifier("pipelineExecutor") ExecutorService executor, PipelineProperties properties) {
        return new PipelineRunService(orchestrator, reportWriter, executor, properties.getRetainedRuns());
    }
}
