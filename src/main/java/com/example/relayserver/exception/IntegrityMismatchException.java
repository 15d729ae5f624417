package com.example.relayserver.exception;

/**
 * 写入后校验失败：文档产出行数与设备实际行数不一致
 *
 * 非受检异常，从事务回调中抛出以触发整个文档事务回滚。
 */
public class IntegrityMismatchException extends RuntimeException {

    private final int expected;
    private final int actual;

    public IntegrityMismatchException(String equipmentTag, int expected, int actual) {
        super(String.format("设备 %s 写入校验失败: 期望 %d 行, 实际 %d 行", equipmentTag, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
