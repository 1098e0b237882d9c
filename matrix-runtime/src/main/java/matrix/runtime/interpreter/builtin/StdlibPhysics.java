package matrix.runtime.interpreter.builtin;

import com.matrixlang.compiler.analysis.types.OpaqueType;
import matrix.runtime.ExecutionContext;
import matrix.runtime.MxArray;
import matrix.runtime.MxFloat;
import matrix.runtime.MxHandle;
import matrix.runtime.MxInt;
import matrix.runtime.MxRuntimeException;
import matrix.runtime.MxUnit;
import matrix.runtime.MxValue;
import matrix.runtime.collab.PhysicsWorld;

/**
 * 物理：通过 PhysicsWorld 句柄转交给外部协作者，以及几个纯计算函数
 */
public final class StdlibPhysics {

    /** 万有引力常数 */
    static final double G = 6.674e-11;

    private StdlibPhysics() {}

    public static void register(BuiltinRegistry registry) {
        registry.register("create_physics_world", "() -> PhysicsWorld", NativeFunction.withContext(0, (ctx, args) ->
                ctx.getHandles().register(OpaqueType.PHYSICS_WORLD, new PhysicsWorld())));

        registry.register("add_rigid_body", "(PhysicsWorld, Float, [Float]) -> Int",
                NativeFunction.withContext(3, (ctx, args) -> {
                    PhysicsWorld world = world(ctx, args.get(0));
                    return MxInt.of(world.addBody(args.get(1).asFloat(), StdlibVector.vec3(args.get(2))));
                }));

        registry.register("set_velocity", "(PhysicsWorld, Int, [Float]) -> Unit",
                NativeFunction.withContext(3, (ctx, args) -> {
                    body(ctx, args.get(0), args.get(1)).setVelocity(StdlibVector.vec3(args.get(2)));
                    return MxUnit.UNIT;
                }));

        registry.register("physics_step", "(PhysicsWorld, Float) -> Unit", NativeFunction.withContext(2, (ctx, args) -> {
            world(ctx, args.get(0)).step(args.get(1).asFloat());
            return MxUnit.UNIT;
        }));

        registry.register("get_position", "(PhysicsWorld, Int) -> [Float]", NativeFunction.withContext(2, (ctx, args) ->
                MxArray.ofDoubles(body(ctx, args.get(0), args.get(1)).getPosition())));

        registry.register("body_count", "(PhysicsWorld) -> Int", NativeFunction.withContext(1, (ctx, args) ->
                MxInt.of(world(ctx, args.get(0)).getBodyCount())));

        // E = m v² / 2
        registry.register("kinetic_energy", "(Float, [Float]) -> Float", NativeFunction.create((mass, velocity) -> {
            double speed = StdlibVector.magnitude(velocity.asArray().toDoubles());
            return MxFloat.of(0.5 * mass.asFloat() * speed * speed);
        }));

        registry.register("momentum", "(Float, [Float]) -> [Float]", NativeFunction.create((mass, velocity) -> {
            double[] v = velocity.asArray().toDoubles();
            for (int i = 0; i < v.length; i++) v[i] *= mass.asFloat();
            return MxArray.ofDoubles(v);
        }));

        // F = G m1 m2 / r²
        registry.register("gravitational_force", "(Float, Float, Float) -> Float", NativeFunction.create((m1, m2, r) -> {
            double distance = r.asFloat();
            if (distance == 0.0) {
                throw MxRuntimeException.divisionByZero("gravitational_force", null);
            }
            return MxFloat.of(G * m1.asFloat() * m2.asFloat() / (distance * distance));
        }));
    }

    private static PhysicsWorld world(ExecutionContext ctx, MxValue handle) {
        return ctx.getHandles().resolve((MxHandle) handle, OpaqueType.PHYSICS_WORLD, PhysicsWorld.class);
    }

    private static PhysicsWorld.RigidBody body(ExecutionContext ctx, MxValue handle, MxValue index) {
        return world(ctx, handle).getBody((int) index.asInt());
    }
}
