package com.matrixlang.compiler.analysis.types;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 结构体类型（名义类型：按名称比较）
 *
 * <p>字段在声明解析完成后填入，因此结构体可以引用自身。</p>
 */
public final class StructType extends MxType {

    private final String name;
    private final Map<String, MxType> fields = new LinkedHashMap<String, MxType>();
    private final Set<String> defaultedFields = new HashSet<String>();

    public StructType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void addField(String field, MxType type, boolean hasDefault) {
        fields.put(field, type);
        if (hasDefault) defaultedFields.add(field);
    }

    /** 按声明顺序排列的字段 */
    public Map<String, MxType> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public MxType getFieldType(String field) {
        return fields.get(field);
    }

    public boolean hasDefault(String field) {
        return defaultedFields.contains(field);
    }

    @Override
    public String getHeadName() {
        return name;
    }

    @Override
    public <R> R accept(MxTypeVisitor<R> visitor) {
        return visitor.visitStruct(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructType)) return false;
        return name.equals(((StructType) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
