package com.baykanat.ephemeral.domain.store;

import lombok.Getter;

/** Kanal geçmişi veya sabitlenmiş mesajlar okunamadı. */
@Getter
public class MessageFetchException extends RuntimeException {

    private final long channelId;

    public MessageFetchException(long channelId, String message, Throwable cause) {
        super(message, cause);
        this.channelId = channelId;
    }
}
