package com.baykanat.ephemeral.domain.store;

import lombok.Getter;

import java.util.List;

/** Tekli veya toplu silme çağrısı başarısız oldu. */
@Getter
public class MessageDeleteException extends RuntimeException {

    private final long channelId;
    private final List<Long> messageIds;

    public MessageDeleteException(long channelId, List<Long> messageIds, String message, Throwable cause) {
        super(message, cause);
        this.channelId = channelId;
        this.messageIds = List.copyOf(messageIds);
    }
}
