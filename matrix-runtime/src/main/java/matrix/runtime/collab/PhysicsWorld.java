package matrix.runtime.collab;

import java.util.ArrayList;
import java.util.List;

/**
 * 最小刚体世界：重力下的显式积分，不处理碰撞
 */
public final class PhysicsWorld {

    public static final double[] DEFAULT_GRAVITY = {0.0, -9.81, 0.0};

    private final double[] gravity;
    private final List<RigidBody> bodies = new ArrayList<RigidBody>();
    private double time;

    public PhysicsWorld() {
        this(DEFAULT_GRAVITY);
    }

    public PhysicsWorld(double[] gravity) {
        this.gravity = gravity.clone();
    }

    /** 添加刚体，返回其编号 */
    public int addBody(double mass, double[] position) {
        if (mass <= 0) {
            throw new IllegalArgumentException("mass must be positive, got " + mass);
        }
        bodies.add(new RigidBody(mass, position));
        return bodies.size() - 1;
    }

    public RigidBody getBody(int index) {
        if (index < 0 || index >= bodies.size()) {
            throw new IndexOutOfBoundsException("no body " + index + " in world of " + bodies.size());
        }
        return bodies.get(index);
    }

    public int getBodyCount() {
        return bodies.size();
    }

    public double getTime() {
        return time;
    }

    /**
     * 推进 dt 秒：先更新速度，再用新速度更新位置（半隐式欧拉）
     */
    public void step(double dt) {
        if (dt < 0) {
            throw new IllegalArgumentException("time step must be non-negative, got " + dt);
        }
        for (RigidBody body : bodies) {
            for (int i = 0; i < 3; i++) {
                body.velocity[i] += gravity[i] * dt;
                body.position[i] += body.velocity[i] * dt;
            }
        }
        time += dt;
    }

    /**
     * 刚体状态
     */
    public static final class RigidBody {
        private final double mass;
        private final double[] position;
        private final double[] velocity = new double[3];

        RigidBody(double mass, double[] position) {
            this.mass = mass;
            this.position = position.clone();
        }

        public double getMass() {
            return mass;
        }

        public double[] getPosition() {
            return position.clone();
        }

        public double[] getVelocity() {
            return velocity.clone();
        }

        public void setVelocity(double[] v) {
            System.arraycopy(v, 0, velocity, 0, 3);
        }
    }
}
