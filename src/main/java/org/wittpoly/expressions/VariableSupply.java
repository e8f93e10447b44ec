package org.wittpoly.expressions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 探针变量的来源：每次调用分配一个从未用过的 slot，
 * 因此不同探针的变量两两不同，也不会与 X / Y / W 冲突。
 */
public final class VariableSupply {

    private static final Logger logger = LoggerFactory.getLogger(VariableSupply.class);

    // 0, 1 为参数槽，负数为 ghost，从 16 开始留出余量
    private static final AtomicInteger NEXT_SLOT = new AtomicInteger(16);

    private VariableSupply() {
    }

    public static int freshSlot() {
        int slot = NEXT_SLOT.getAndIncrement();
        logger.debug("分配了新的探针 slot: {}", slot);
        return slot;
    }
}
