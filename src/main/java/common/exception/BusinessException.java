package common.exception;

/**
 * 业务异常：调用方违反约定（非法参数、缺失字段等）
 * 日志数据本身的质量问题不应以此异常抛出
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
