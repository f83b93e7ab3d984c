package com.lhcz.txn2db.core;

/**
 * 阶段之间传递的消息：数据 / 结束 / 上游失败
 */
final class ChannelItem<T> {

    private final T value;
    private final boolean end;
    private final Throwable error;

    private ChannelItem(T value, boolean end, Throwable error) {
        this.value = value;
        this.end = end;
        this.error = error;
    }

    static <T> ChannelItem<T> of(T value) {
        return new ChannelItem<>(value, false, null);
    }

    static <T> ChannelItem<T> end() {
        return new ChannelItem<>(null, true, null);
    }

    static <T> ChannelItem<T> failed(Throwable error) {
        return new ChannelItem<>(null, false, error);
    }

    T value() {
        return value;
    }

    boolean isEnd() {
        return end;
    }

    boolean isFailed() {
        return error != null;
    }

    /** 结束或失败 */
    boolean isTerminal() {
        return end || error != null;
    }

    Throwable error() {
        return error;
    }
}
