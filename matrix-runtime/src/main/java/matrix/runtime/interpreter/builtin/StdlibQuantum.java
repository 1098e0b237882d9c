package matrix.runtime.interpreter.builtin;

import com.matrixlang.compiler.analysis.types.OpaqueType;
import matrix.runtime.ExecutionContext;
import matrix.runtime.MxArray;
import matrix.runtime.MxHandle;
import matrix.runtime.MxInt;
import matrix.runtime.MxUnit;
import matrix.runtime.MxValue;
import matrix.runtime.collab.QuantumCircuit;

/**
 * 量子线路：通过 QuantumCircuit 句柄转交给外部协作者
 */
public final class StdlibQuantum {

    private StdlibQuantum() {}

    public static void register(BuiltinRegistry registry) {
        registry.register("quantum_circuit", "(Int) -> QuantumCircuit", NativeFunction.withContext(1, (ctx, args) ->
                ctx.getHandles().register(OpaqueType.QUANTUM_CIRCUIT, new QuantumCircuit((int) args.get(0).asInt()))));

        registry.register("hadamard", "(QuantumCircuit, Int) -> Unit", NativeFunction.withContext(2, (ctx, args) -> {
            circuit(ctx, args.get(0)).hadamard((int) args.get(1).asInt());
            return MxUnit.UNIT;
        }));

        registry.register("pauli_x", "(QuantumCircuit, Int) -> Unit", NativeFunction.withContext(2, (ctx, args) -> {
            circuit(ctx, args.get(0)).pauliX((int) args.get(1).asInt());
            return MxUnit.UNIT;
        }));

        registry.register("pauli_z", "(QuantumCircuit, Int) -> Unit", NativeFunction.withContext(2, (ctx, args) -> {
            circuit(ctx, args.get(0)).pauliZ((int) args.get(1).asInt());
            return MxUnit.UNIT;
        }));

        registry.register("cnot", "(QuantumCircuit, Int, Int) -> Unit", NativeFunction.withContext(3, (ctx, args) -> {
            circuit(ctx, args.get(0)).cnot((int) args.get(1).asInt(), (int) args.get(2).asInt());
            return MxUnit.UNIT;
        }));

        registry.register("probabilities", "(QuantumCircuit) -> [Float]", NativeFunction.withContext(1, (ctx, args) ->
                MxArray.ofDoubles(circuit(ctx, args.get(0)).probabilities())));

        registry.register("measure", "(QuantumCircuit, Int) -> Int", NativeFunction.withContext(2, (ctx, args) ->
                MxInt.of(circuit(ctx, args.get(0)).measure(args.get(1).asInt()))));
    }

    private static QuantumCircuit circuit(ExecutionContext ctx, MxValue handle) {
        return ctx.getHandles().resolve((MxHandle) handle, OpaqueType.QUANTUM_CIRCUIT, QuantumCircuit.class);
    }
}
