package matrix.runtime.interpreter.builtin;

import com.matrixlang.compiler.analysis.SchemeParser;
import com.matrixlang.compiler.analysis.SignatureTable;
import com.matrixlang.compiler.analysis.types.TypeScheme;
import matrix.runtime.MxValue;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 内置函数注册表：名字 → (类型方案, 实现)
 *
 * <p>{@link #register} 是唯一的插入点，签名表与实现表总是一起更新：校验全部通过后才写入，
 * 所以不会出现"能通过检查却无法调用"或"能调用却未经检查"的名字。</p>
 *
 * <p>类型检查器通过 {@link SignatureTable} 视图查签名，解释器通过 {@link #lookupValue} 取实现。</p>
 */
public final class BuiltinRegistry implements SignatureTable {

    private static final Logger LOG = Logger.getLogger(BuiltinRegistry.class.getName());

    private final Map<String, TypeScheme> signatures = new LinkedHashMap<String, TypeScheme>();
    private final Map<String, MxValue> implementations = new LinkedHashMap<String, MxValue>();

    /**
     * 带完整标准库的注册表
     */
    public static BuiltinRegistry withStandardLibrary() {
        BuiltinRegistry registry = new BuiltinRegistry();
        StdlibIO.register(registry);
        StdlibMath.register(registry);
        StdlibVector.register(registry);
        StdlibArray.register(registry);
        StdlibMatrix.register(registry);
        StdlibPhysics.register(registry);
        StdlibQuantum.register(registry);
        return registry;
    }

    /**
     * 以签名文本注册，如 {@code "Num a => (a) -> a"}
     */
    public BuiltinFunction register(String name, String signature, NativeFunction function) {
        return register(name, SchemeParser.parse(signature), function);
    }

    /**
     * 注册内置函数
     *
     * @throws IllegalArgumentException 名字重复，或实现的参数个数与方案不符
     */
    public BuiltinFunction register(String name, TypeScheme scheme, NativeFunction function) {
        validateName(name);
        if (scheme.getArity() != function.getArity()) {
            throw new IllegalArgumentException("builtin '" + name + "' has signature "
                    + scheme.toDisplayString() + " but its implementation takes "
                    + function.getArity() + " argument(s)");
        }
        BuiltinFunction builtin = new BuiltinFunction(name, scheme, function);
        signatures.put(name, scheme);
        implementations.put(name, builtin);
        return builtin;
    }

    /**
     * 注册常量（pi、e、tau）
     */
    public void registerConstant(String name, String signature, MxValue value) {
        registerConstant(name, SchemeParser.parse(signature), value);
    }

    public void registerConstant(String name, TypeScheme scheme, MxValue value) {
        validateName(name);
        if (scheme.getArity() >= 0) {
            throw new IllegalArgumentException("constant '" + name + "' cannot have a function type "
                    + scheme.toDisplayString());
        }
        signatures.put(name, scheme);
        implementations.put(name, value);
    }

    private void validateName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("builtin name must not be empty");
        }
        if (signatures.containsKey(name) || implementations.containsKey(name)) {
            LOG.warning("duplicate builtin registration rejected: " + name);
            throw new IllegalArgumentException("builtin '" + name + "' is already registered");
        }
    }

    /** 运行时取实现；未注册返回 null */
    public MxValue lookupValue(String name) {
        return implementations.get(name);
    }

    public boolean contains(String name) {
        return signatures.containsKey(name);
    }

    public int size() {
        return signatures.size();
    }

    @Override
    public TypeScheme lookupSignature(String name) {
        return signatures.get(name);
    }

    @Override
    public Collection<String> signatureNames() {
        return Collections.unmodifiableCollection(signatures.keySet());
    }
}
