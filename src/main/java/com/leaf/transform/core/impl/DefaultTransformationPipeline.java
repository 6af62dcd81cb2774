package com.leaf.transform.core.impl;

import com.leaf.transform.core.ArtifactNaming;
import com.leaf.transform.core.ArtifactWriter;
import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TableSource;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.core.Transformation;
import com.leaf.transform.core.TransformationPipeline;
import com.leaf.transform.core.TransformationRegistry;
import com.leaf.transform.model.Batch;
import com.leaf.transform.model.PipelineResult;
import com.leaf.transform.model.StepConfig;
import com.leaf.transform.model.TransformRequest;
import com.leaf.transform.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 变换管道默认实现。
 * 单次运行在调用线程内同步完成，步骤之间只传递不可变批次。
 */
public class DefaultTransformationPipeline implements TransformationPipeline {

    private static final Logger log = LoggerFactory.getLogger(DefaultTransformationPipeline.class);

    private final TransformationRegistry registry;
    private final TableSource tableSource;
    private final ArtifactWriter artifactWriter;
    private final ArtifactNaming naming;

    /** 执行统计 */
    private final AtomicInteger totalSucceeded = new AtomicInteger(0);
    private final AtomicInteger totalFailed = new AtomicInteger(0);

    public DefaultTransformationPipeline(TransformationRegistry registry,
                                         TableSource tableSource,
                                         ArtifactWriter artifactWriter,
                                         ArtifactNaming naming) {
        this.registry = registry;
        this.tableSource = tableSource;
        this.artifactWriter = artifactWriter;
        this.naming = naming;
    }

    @Override
    public PipelineResult run(TransformRequest request) {
        String sourceTable = request.getSourceTable();
        long startTime = System.currentTimeMillis();
        log.info("Running {} step(s) on table '{}'", request.getSteps().size(), sourceTable);

        try {
            if (request.getSteps().isEmpty()) {
                throw new TransformException(ErrorKind.INVALID_CONFIGURATION, "No transformation steps configured");
            }

            Batch batch = tableSource.loadTable(sourceTable);
            log.debug("Loaded table '{}': {}", sourceTable, batch);

            List<StepConfig> steps = request.getSteps();
            for (int i = 0; i < steps.size(); i++) {
                batch = applyStep(batch, steps.get(i), i + 1);
            }

            String artifactName = artifactWriter.write(batch, naming.resolve(request));
            totalSucceeded.incrementAndGet();
            log.info("Table '{}' transformed into '{}' in {}ms", sourceTable, artifactName,
                    System.currentTimeMillis() - startTime);
            return PipelineResult.success(artifactName);

        } catch (TransformException e) {
            totalFailed.incrementAndGet();
            log.error("Transformation of table '{}' failed ({}): {}", sourceTable, e.getKind(), e.getMessage(), e);
            return PipelineResult.failure(sourceTable, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            totalFailed.incrementAndGet();
            log.error("Transformation of table '{}' failed unexpectedly", sourceTable, e);
            return PipelineResult.failure(sourceTable, ErrorKind.INTERNAL_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Batch applyStep(Batch batch, StepConfig step, int stepNo) throws TransformException {
        Transformation transformation = registry.get(step.getTransformationId());
        if (transformation == null) {
            throw new TransformException(ErrorKind.INVALID_CONFIGURATION,
                    "No transformation registered for '" + step.getTransformationId() + "'");
        }

        ValidationResult validation = transformation.validate(step, batch);
        for (String warning : validation.getWarnings()) {
            log.warn("Step {} ({}): {}", stepNo, step.getTransformationId(), warning);
        }
        if (!validation.isValid()) {
            throw new TransformException(validation.getErrorKind(),
                    "Step " + stepNo + " validation failed: " + String.join("; ", validation.getErrors()));
        }

        long stepStart = System.currentTimeMillis();
        Batch next = transformation.apply(batch, step);
        log.debug("Step {} {} completed in {}ms", stepNo, step, System.currentTimeMillis() - stepStart);
        return next;
    }

    public int getTotalSucceeded() { return totalSucceeded.get(); }
    public int getTotalFailed() { return totalFailed.get(); }
}
