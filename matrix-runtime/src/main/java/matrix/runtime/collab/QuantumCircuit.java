package matrix.runtime.collab;

import java.util.Random;

/**
 * 态矢量量子线路模拟器，门立即作用在振幅上
 *
 * <p>量子比特 0 是基态下标的最低位。</p>
 */
public final class QuantumCircuit {

    /** 态矢量长度 2^n 的上限 */
    public static final int MAX_QUBITS = 16;

    private static final double SQRT_HALF = Math.sqrt(0.5);

    private final int qubits;
    private final double[] re;
    private final double[] im;

    public QuantumCircuit(int qubits) {
        if (qubits < 1 || qubits > MAX_QUBITS) {
            throw new IllegalArgumentException("qubit count must be between 1 and " + MAX_QUBITS
                    + ", got " + qubits);
        }
        this.qubits = qubits;
        this.re = new double[1 << qubits];
        this.im = new double[1 << qubits];
        re[0] = 1.0;
    }

    public int getQubitCount() {
        return qubits;
    }

    public void hadamard(int target) {
        int bit = mask(target);
        for (int i = 0; i < re.length; i++) {
            if ((i & bit) != 0) continue;
            int j = i | bit;
            double ar = re[i], ai = im[i], br = re[j], bi = im[j];
            re[i] = (ar + br) * SQRT_HALF;
            im[i] = (ai + bi) * SQRT_HALF;
            re[j] = (ar - br) * SQRT_HALF;
            im[j] = (ai - bi) * SQRT_HALF;
        }
    }

    public void pauliX(int target) {
        int bit = mask(target);
        for (int i = 0; i < re.length; i++) {
            if ((i & bit) != 0) continue;
            swap(i, i | bit);
        }
    }

    public void pauliZ(int target) {
        int bit = mask(target);
        for (int i = 0; i < re.length; i++) {
            if ((i & bit) != 0) {
                re[i] = -re[i];
                im[i] = -im[i];
            }
        }
    }

    public void cnot(int control, int target) {
        if (control == target) {
            throw new IllegalArgumentException("control and target must differ");
        }
        int c = mask(control);
        int t = mask(target);
        for (int i = 0; i < re.length; i++) {
            if ((i & c) != 0 && (i & t) == 0) {
                swap(i, i | t);
            }
        }
    }

    /** 每个基态的测量概率 */
    public double[] probabilities() {
        double[] p = new double[re.length];
        for (int i = 0; i < p.length; i++) {
            p[i] = re[i] * re[i] + im[i] * im[i];
        }
        return p;
    }

    /**
     * 按概率抽样一个基态，不坍缩线路（同一种子得到同一结果）
     */
    public int measure(long seed) {
        double r = new Random(seed).nextDouble();
        double[] p = probabilities();
        double acc = 0;
        for (int i = 0; i < p.length; i++) {
            acc += p[i];
            if (r < acc) return i;
        }
        return p.length - 1;
    }

    private int mask(int qubit) {
        if (qubit < 0 || qubit >= qubits) {
            throw new IndexOutOfBoundsException("qubit " + qubit + " out of range for " + qubits + " qubit(s)");
        }
        return 1 << qubit;
    }

    private void swap(int i, int j) {
        double tr = re[i], ti = im[i];
        re[i] = re[j];
        im[i] = im[j];
        re[j] = tr;
        im[j] = ti;
    }
}
