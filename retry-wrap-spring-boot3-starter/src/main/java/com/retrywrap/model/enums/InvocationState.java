package com.retrywrap.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 单次调用的状态
 */
@AllArgsConstructor
@Getter
public enum InvocationState {
    ATTEMPTING(0, "尝试中（含两次尝试之间的等待）"),
    SUCCEEDED(1, "执行成功，终态"),
    FAILED(2, "不可重试或次数耗尽，终态")
    ;

    public final int code;
    public final String desc;

    public boolean isTerminal() {
        return this != ATTEMPTING;
    }
}
