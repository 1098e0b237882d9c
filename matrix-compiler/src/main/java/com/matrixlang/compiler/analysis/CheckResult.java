package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.analysis.types.MxType;
import com.matrixlang.compiler.analysis.types.TypeScheme;
import com.matrixlang.compiler.ast.Program;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次检查的结果：程序、最后一条语句的类型、新增的顶层绑定和注解
 *
 * <p>结果在 {@link TypeChecker#commit} 之前处于待定状态，新增绑定对后续检查不可见。</p>
 */
public final class CheckResult {

    private final Program program;
    private final TypeEnvironment layer;
    private final TypeUnifier.Snapshot before;
    private final MxType type;
    private final Map<String, TypeScheme> bindings;
    private final TypeAnnotations annotations;

    CheckResult(Program program, TypeEnvironment layer, TypeUnifier.Snapshot before,
                MxType type, Map<String, TypeScheme> bindings, TypeAnnotations annotations) {
        this.program = program;
        this.layer = layer;
        this.before = before;
        this.type = type;
        this.bindings = bindings;
        this.annotations = annotations;
    }

    public Program getProgram() {
        return program;
    }

    /** 程序值的类型（最后一条语句的类型；空程序为 Unit） */
    public MxType getType() {
        return type;
    }

    public TypeAnnotations getAnnotations() {
        return annotations;
    }

    /** 本次新增的顶层绑定，按定义顺序 */
    public Map<String, TypeScheme> getBindings() {
        return bindings;
    }

    /** 绑定名 → 显示类型 */
    public Map<String, String> getBindingTypes() {
        Map<String, String> result = new LinkedHashMap<String, String>();
        for (Map.Entry<String, TypeScheme> e : bindings.entrySet()) {
            result.put(e.getKey(), e.getValue().toDisplayString());
        }
        return result;
    }

    TypeEnvironment getLayer() {
        return layer;
    }

    TypeUnifier.Snapshot getSnapshotBefore() {
        return before;
    }
}
