package common.consts;

import common.exception.BusinessException;

import java.util.Locale;

/**
 * 事件详细程度等级
 * 声明顺序即全序：MILESTONE < DECISION < ACTION < STATE < DETAIL，高等级包含所有低等级
 */
public enum VerbosityLevel {
    MILESTONE, // 只记录回合边界
    DECISION,  // + 决策
    ACTION,    // + 动作
    STATE,     // + 状态变化
    DETAIL;    // + 计算细节与系统事件

    /**
     * 是否不低于指定等级
     */
    public boolean isAtLeast(VerbosityLevel other) {
        return this.compareTo(other) >= 0;
    }

    /**
     * 解析配置或请求参数中的等级名称（忽略大小写）
     */
    public static VerbosityLevel parse(String text) {
        if (text == null || text.isBlank()) {
            throw new BusinessException(ErrorCodes.INVALID_VERBOSITY + ": 空值");
        }
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCodes.INVALID_VERBOSITY + ": " + text);
        }
    }
}
