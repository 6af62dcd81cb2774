package com.leaf.transform.model;

import java.util.Objects;

/**
 * schema中的一项：列名 + 物理类型
 */
public class SchemaField {
    private final String name;
    private final PhysicalType type;

    public SchemaField(String name, PhysicalType type) {
        this.name = name;
        this.type = type;
    }

    public String getName() { return name; }
    public PhysicalType getType() { return type; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SchemaField)) return false;
        SchemaField that = (SchemaField) o;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + ":" + type;
    }
}
