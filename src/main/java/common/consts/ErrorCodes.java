package common.consts;

/**
 * 全局错误信息常量池
 */
public class ErrorCodes {
    // 基础错误
    public static final String SYSTEM_ERROR = "系统内部错误";

    // 查询未命中
    public static final String EVENT_NOT_FOUND = "指定的事件不存在";

    // 参数错误
    public static final String INVALID_VERBOSITY = "非法的详细程度等级，仅支持 MILESTONE/DECISION/ACTION/STATE/DETAIL";
    public static final String INVALID_EVENT_TYPE = "非法的事件类型";
    public static final String INVALID_TIMESTAMP = "非法的时间戳，需为 ISO-8601 格式";
    public static final String INVALID_FILTER = "非法的查询条件";
    public static final String INVALID_DEPTH = "非法的因果链深度";
    public static final String INVALID_SIMULATION_ID = "非法的仿真ID";

    // 事件构造
    public static final String MISSING_FIELD = "事件缺少必填字段";
    public static final String DESCRIPTION_TOO_LONG = "事件描述超过 500 字符";
    public static final String DETAILS_NOT_SERIALIZABLE = "事件 details 无法序列化为 JSON";
}
