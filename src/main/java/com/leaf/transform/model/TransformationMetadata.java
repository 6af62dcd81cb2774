package com.leaf.transform.model;

import java.io.Serializable;
import java.util.List;

/**
 * 变换算子元数据，描述算子的身份、版本和适用的列类型
 */
public class TransformationMetadata implements Serializable {
    private final String transformationId;
    private final String name;
    private final String version;
    private final String description;
    /** 源列允许的物理类型 */
    private final List<PhysicalType> applicableTypes;

    public TransformationMetadata(String transformationId, String name, String version, String description,
                                  List<PhysicalType> applicableTypes) {
        this.transformationId = transformationId;
        this.name = name;
        this.version = version;
        this.description = description;
        this.applicableTypes = applicableTypes;
    }

    public String getTransformationId() { return transformationId; }
    public String getName() { return name; }
    public String getVersion() { return version; }
    public String getDescription() { return description; }
    public List<PhysicalType> getApplicableTypes() { return applicableTypes; }

    public boolean isApplicableTo(PhysicalType type) {
        return applicableTypes == null || applicableTypes.contains(type);
    }

    @Override
    public String toString() {
        return "TransformationMetadata{" + transformationId + " v" + version + "}";
    }
}
