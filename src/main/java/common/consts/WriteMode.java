package common.consts;

/**
 * 事件写入模式
 */
public enum WriteMode {
    /**
     * 有界队列 + 单个后台消费线程，emit 永不阻塞，队列满时丢弃
     */
    CONCURRENT,

    /**
     * 调用线程同步写盘并 fsync，emit 返回时事件已落盘
     */
    DIRECT
}
