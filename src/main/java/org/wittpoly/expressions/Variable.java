package org.wittpoly.expressions;

import lombok.Getter;

import java.util.Objects;

/**
 * 形式变量，由 (slot, index) 唯一确定。
 * slot 0 / 1 是见证公式的两个参数槽 (X_i, Y_i)，GHOST_SLOT 是基变换公式中的 ghost 变量 W_i，
 * 其余正的 slot 由 {@link VariableSupply} 分配给探针变量。
 * 此类是不可变的。
 */
@Getter
public final class Variable implements Comparable<Variable> {

    public static final int FIRST_SLOT = 0;
    public static final int SECOND_SLOT = 1;
    public static final int GHOST_SLOT = -1;

    private final int slot;
    private final int index;
    private final int hashCode;

    private Variable(int slot, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Variable-构造函数: index 不能为负: " + index);
        }
        this.slot = slot;
        this.index = index;
        this.hashCode = Objects.hash(slot, index);
    }

    public static Variable of(int slot, int index) {
        return new Variable(slot, index);
    }

    /**
     * 第一个参数的第 index 个坐标 X_index。
     */
    public static Variable x(int index) {
        return new Variable(FIRST_SLOT, index);
    }

    /**
     * 第二个参数的第 index 个坐标 Y_index。
     */
    public static Variable y(int index) {
        return new Variable(SECOND_SLOT, index);
    }

    /**
     * ghost 变量 W_index。
     */
    public static Variable ghost(int index) {
        return new Variable(GHOST_SLOT, index);
    }

    /**
     * 保持下标，换到另一个槽。
     */
    public Variable withSlot(int newSlot) {
        return newSlot == slot ? this : new Variable(newSlot, index);
    }

    public String getName() {
        return switch (slot) {
            case FIRST_SLOT -> "X" + index;
            case SECOND_SLOT -> "Y" + index;
            case GHOST_SLOT -> "W" + index;
            default -> "T" + slot + "_" + index;
        };
    }

    @Override
    public int compareTo(Variable o) {
        int cmp = Integer.compare(this.slot, o.slot);
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(this.index, o.index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Variable variable = (Variable) o;
        return slot == variable.slot && index == variable.index;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return getName();
    }
}
