package com.leaf.transform.core;

import com.leaf.transform.model.StepConfig;
import com.leaf.transform.model.TimeBinConfig;
import com.leaf.transform.model.TransformRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * 产物命名规则。
 *
 * 用户显式给出的名称优先（去掉末尾的 ".arrow"）；
 * 否则为 {@code <源表基名>_<标记1>_<标记2>_<标记3>}，步骤超过上限时追加 {@code _and_<k>_more}。
 */
public class ArtifactNaming {

    public static final String ARTIFACT_EXTENSION = ".arrow";

    private static final String[] SOURCE_EXTENSIONS = {".arrow", ".csv", ".parquet"};

    private final int maxTokens;

    public ArtifactNaming(int maxTokens) {
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be at least 1, got " + maxTokens);
        }
        this.maxTokens = maxTokens;
    }

    public ArtifactNaming() {
        this(3);
    }

    /**
     * 为请求确定产物名称（不含扩展名）
     */
    public String resolve(TransformRequest request) {
        String explicit = explicitName(request);
        if (explicit != null) {
            return stripArtifactExtension(explicit.trim());
        }
        return generate(request.getSourceTable(), request.getSteps());
    }

    public String generate(String sourceTable, List<StepConfig> steps) {
        String base = baseName(sourceTable);
        List<String> tokens = new ArrayList<>(steps.size());
        for (StepConfig step : steps) {
            tokens.add(step.artifactToken());
        }
        if (tokens.isEmpty()) {
            return base;
        }
        if (tokens.size() > maxTokens) {
            return base + "_" + String.join("_", tokens.subList(0, maxTokens))
                    + "_and_" + (tokens.size() - maxTokens) + "_more";
        }
        return base + "_" + String.join("_", tokens);
    }

    /**
     * 去掉源表名末尾的 .arrow / .csv / .parquet
     */
    public static String baseName(String tableName) {
        String base = tableName;
        for (String ext : SOURCE_EXTENSIONS) {
            if (base.endsWith(ext)) {
                base = base.substring(0, base.length() - ext.length());
            }
        }
        return base;
    }

    public static String stripArtifactExtension(String name) {
        return name.endsWith(ARTIFACT_EXTENSION)
                ? name.substring(0, name.length() - ARTIFACT_EXTENSION.length())
                : name;
    }

    private String explicitName(TransformRequest request) {
        if (notBlank(request.getOutputArtifactName())) {
            return request.getOutputArtifactName();
        }
        for (StepConfig step : request.getSteps()) {
            if (step instanceof TimeBinConfig && notBlank(((TimeBinConfig) step).getOutputArtifactName())) {
                return ((TimeBinConfig) step).getOutputArtifactName();
            }
        }
        return null;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
