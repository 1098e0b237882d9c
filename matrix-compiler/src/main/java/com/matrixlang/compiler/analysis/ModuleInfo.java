package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.analysis.types.TypeScheme;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模块的导出成员及其类型方案
 */
public final class ModuleInfo {

    private final String name;
    private final Map<String, TypeScheme> members;

    public ModuleInfo(String name, Map<String, TypeScheme> members) {
        this.name = name;
        this.members = Collections.unmodifiableMap(new LinkedHashMap<String, TypeScheme>(members));
    }

    public String getName() {
        return name;
    }

    public Map<String, TypeScheme> getMembers() {
        return members;
    }

    public TypeScheme getMember(String member) {
        return members.get(member);
    }
}
