package com.leaf.transform.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次管道运行的请求：源表 + 有序步骤列表 + 可选产物名称
 */
public class TransformRequest implements Serializable {

    private final String sourceTable;
    private final List<StepConfig> steps;
    private final String outputArtifactName;

    public TransformRequest(String sourceTable, List<? extends StepConfig> steps, String outputArtifactName) {
        this.sourceTable = sourceTable;
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.outputArtifactName = outputArtifactName;
    }

    public static TransformRequest forTimeBin(TimeBinConfig config) {
        return new TransformRequest(config.getSourceTable(), List.of(config), config.getOutputArtifactName());
    }

    public static TransformRequest forGrouping(String tableName, List<GroupingConfig> configs, String outputArtifactName) {
        return new TransformRequest(tableName, configs, outputArtifactName);
    }

    public static TransformRequest forComputedColumns(String tableName, List<ComputedColumnConfig> configs,
                                                      String outputArtifactName) {
        return new TransformRequest(tableName, configs, outputArtifactName);
    }

    public String getSourceTable() { return sourceTable; }
    public List<StepConfig> getSteps() { return steps; }
    public String getOutputArtifactName() { return outputArtifactName; }

    @Override
    public String toString() {
        return "TransformRequest{table='" + sourceTable + "', steps=" + steps.size()
                + (outputArtifactName != null ? ", output='" + outputArtifactName + "'" : "") + "}";
    }
}
