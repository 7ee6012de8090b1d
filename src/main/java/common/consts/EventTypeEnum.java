package common.consts;

/**
 * 仿真事件流中的所有事件类型
 * 持久化时按名称写入 event_type 字段
 */
public enum EventTypeEnum {
    MILESTONE,  // 回合边界、阶段切换
    DECISION,   // 智能体策略决策
    ACTION,     // 智能体动作与交易
    STATE,      // 状态变量变化
    DETAIL,     // 中间计算过程
    SYSTEM      // 仿真系统生命周期 / 重试 / 告警
}
