package matrix.runtime.interpreter;

import com.matrixlang.compiler.ast.decl.StructDecl;
import com.matrixlang.compiler.ast.decl.StructField;

/**
 * 运行时结构体定义：声明 + 求值字段默认值的作用域
 */
public final class StructDefinition {

    private final StructDecl decl;
    private final Environment scope;

    StructDefinition(StructDecl decl, Environment scope) {
        this.decl = decl;
        this.scope = scope;
    }

    public String getName() {
        return decl.getName();
    }

    public StructDecl getDecl() {
        return decl;
    }

    Environment getScope() {
        return scope;
    }

    StructField getField(String name) {
        for (StructField field : decl.getFields()) {
            if (field.getName().equals(name)) return field;
        }
        return null;
    }
}
