package matrix.runtime.collab;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QuantumCircuit 单元测试
 */
class QuantumCircuitTest {

    private static final double DELTA = 1e-12;

    @Test
    @DisplayName("初态为 |0...0>")
    void testInitialState() {
        assertArrayEquals(new double[]{1.0, 0.0, 0.0, 0.0}, new QuantumCircuit(2).probabilities(), DELTA);
    }

    @Test
    @DisplayName("Hadamard 产生等概率叠加")
    void testHadamard() {
        QuantumCircuit circuit = new QuantumCircuit(1);
        circuit.hadamard(0);
        assertArrayEquals(new double[]{0.5, 0.5}, circuit.probabilities(), DELTA);
        circuit.hadamard(0);
        assertArrayEquals(new double[]{1.0, 0.0}, circuit.probabilities(), DELTA);
    }

    @Test
    @DisplayName("量子比特 0 是最低位")
    void testBitOrder() {
        QuantumCircuit circuit = new QuantumCircuit(2);
        circuit.pauliX(0);
        assertArrayEquals(new double[]{0.0, 1.0, 0.0, 0.0}, circuit.probabilities(), DELTA);
        assertEquals(1, circuit.measure(7L));
    }

    @Test
    @DisplayName("Bell 态只出现 00 与 11")
    void testBellState() {
        QuantumCircuit circuit = new QuantumCircuit(2);
        circuit.hadamard(0);
        circuit.cnot(0, 1);
        assertArrayEquals(new double[]{0.5, 0.0, 0.0, 0.5}, circuit.probabilities(), DELTA);
        for (long seed = 0; seed < 20; seed++) {
            int outcome = circuit.measure(seed);
            assertTrue(outcome == 0 || outcome == 3, "outcome " + outcome);
        }
        // 测量不坍缩，同一种子结果相同
        assertEquals(circuit.measure(42L), circuit.measure(42L));
    }

    @Test
    @DisplayName("Pauli-Z 不改变概率")
    void testPauliZ() {
        QuantumCircuit circuit = new QuantumCircuit(1);
        circuit.hadamard(0);
        circuit.pauliZ(0);
        circuit.hadamard(0);
        // HZH = X
        assertArrayEquals(new double[]{0.0, 1.0}, circuit.probabilities(), DELTA);
    }

    @Test
    @DisplayName("非法参数")
    void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> new QuantumCircuit(0));
        assertThrows(IllegalArgumentException.class, () -> new QuantumCircuit(QuantumCircuit.MAX_QUBITS + 1));
        QuantumCircuit circuit = new QuantumCircuit(2);
        assertThrows(IndexOutOfBoundsException.class, () -> circuit.hadamard(2));
        assertThrows(IllegalArgumentException.class, () -> circuit.cnot(1, 1));
    }
}
