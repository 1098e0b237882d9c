package matrix.runtime.interpreter;

import matrix.runtime.MxValue;

import java.util.ArrayList;
import java.util.List;

/**
 * 一条 REPL 输入期间的赋值记录，失败时按相反顺序恢复旧值
 */
final class AssignmentJournal {

    private final List<Environment> frames = new ArrayList<Environment>();
    private final List<Integer> slots = new ArrayList<Integer>();
    private final List<MxValue> previous = new ArrayList<MxValue>();

    void record(Environment frame, int slot, MxValue old) {
        frames.add(frame);
        slots.add(slot);
        previous.add(old);
    }

    void undo() {
        for (int i = frames.size() - 1; i >= 0; i--) {
            frames.get(i).restore(slots.get(i), previous.get(i));
        }
        clear();
    }

    void clear() {
        frames.clear();
        slots.clear();
        previous.clear();
    }

    boolean isEmpty() {
        return frames.isEmpty();
    }
}
