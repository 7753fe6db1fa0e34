package com.baykanat.ephemeral.domain.store;

import com.baykanat.ephemeral.domain.model.MessageSnapshot;

import java.util.List;
import java.util.stream.Stream;

/**
 * Harici mesaj deposu (sohbet platformu). Okuma hataları {@link MessageFetchException},
 * silme hataları {@link MessageDeleteException} olarak yükselir.
 */
public interface MessageStore {

    /** Kanal geçmişi, en yeniden eskiye; tembel ve her çağrıda baştan başlar. Stream kapatılmalı. */
    Stream<MessageSnapshot> listMessages(long channelId);

    /** Kanalın şu an sabitlenmiş mesajları. */
    List<MessageSnapshot> listPinned(long channelId);

    /** Tek mesaj siler; mesaj zaten yoksa başarılı sayılır. */
    void deleteMessage(long channelId, long messageId);

    /** 2..100 mesajı tek çağrıda siler. */
    void deleteMessages(long channelId, List<Long> messageIds);
}
