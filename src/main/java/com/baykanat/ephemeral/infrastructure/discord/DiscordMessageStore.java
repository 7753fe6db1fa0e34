package com.baykanat.ephemeral.infrastructure.discord;

import com.baykanat.ephemeral.config.AppProperties;
import com.baykanat.ephemeral.domain.mapper.DiscordMessageMapper;
import com.baykanat.ephemeral.domain.model.MessageSnapshot;
import com.baykanat.ephemeral.domain.store.MessageDeleteException;
import com.baykanat.ephemeral.domain.store.MessageFetchException;
import com.baykanat.ephemeral.domain.store.MessageStore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Discord REST API üzerinden MessageStore. Silmelerde hata retry'ı yok; yalnızca 429 yanıtlarında
 * Discord'un bildirdiği süre beklenip istek tekrarlanır. Circuit breaker açıkken domain hatası.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiscordMessageStore implements MessageStore {

    private static final ParameterizedTypeReference<List<DiscordMessagePayload>> MESSAGE_LIST =
            new ParameterizedTypeReference<>() {};

    /** 2015-01-01T00:00:00Z, snowflake zaman damgalarının başlangıcı. */
    static final long DISCORD_EPOCH_MILLI = 1420070400000L;

    /** Discord bulk-delete sınırı 14 gün; saat kaymasına karşı birkaç dakika erken kesilir. */
    static final Duration BULK_DELETE_MAX_AGE = Duration.ofDays(14).minusMinutes(5);

    private final RestClient discordRestClient;
    private final DiscordMessageMapper messageMapper;
    private final AppProperties appProperties;
    private final Retry discordRateLimitRetry;
    private final Clock clock;

    /** GET /channels/{id}/messages?limit=N&before=...; sayfalar stream tüketildikçe çekilir. */
    @Override
    public Stream<MessageSnapshot> listMessages(long channelId) {
        int pageSize = Math.max(1, Math.min(appProperties.getDiscord().getPageSize(), 100));
        DiscordMessagePager pager = new DiscordMessagePager(before -> fetchPage(channelId, before, pageSize), pageSize);
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(pager, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .map(messageMapper::toSnapshot);
    }

    /** GET /channels/{id}/pins. */
    @Override
    @io.github.resilience4j.retry.annotation.Retry(name = "discordFetch")
    @CircuitBreaker(name = "discordApi", fallbackMethod = "listPinnedCircuitOpen")
    public List<MessageSnapshot> listPinned(long channelId) {
        try {
            List<DiscordMessagePayload> pinned = discordRateLimitRetry.executeSupplier(() -> discordRestClient.get()
                    .uri("/channels/{channelId}/pins", channelId)
                    .retrieve()
                    .body(MESSAGE_LIST));
            return pinned == null ? List.of() : messageMapper.toSnapshots(pinned);
        } catch (RestClientException e) {
            throw new MessageFetchException(channelId,
                    "Failed to fetch pinned messages for channel " + channelId + ": " + e.getMessage(), e);
        }
    }

    /** DELETE /channels/{id}/messages/{messageId}; 404 zaten silinmiş demektir. */
    @Override
    @CircuitBreaker(name = "discordApi", fallbackMethod = "deleteMessageCircuitOpen")
    public void deleteMessage(long channelId, long messageId) {
        try {
            deleteOne(channelId, messageId);
        } catch (RestClientException e) {
            throw new MessageDeleteException(channelId, List.of(messageId),
                    "Failed to delete message " + messageId + " in channel " + channelId + ": " + e.getMessage(), e);
        }
    }

    /**
     * POST /channels/{id}/messages/bulk-delete {"messages": [...]}. Discord 14 günden eski mesajları
     * toplu silmez; bunlar tek tek silinir. Başarısız id'ler tek bir MessageDeleteException'da toplanır.
     */
    @Override
    @CircuitBreaker(name = "discordApi", fallbackMethod = "deleteMessagesCircuitOpen")
    public void deleteMessages(long channelId, List<Long> messageIds) {
        Instant bulkCutoff = clock.instant().minus(BULK_DELETE_MAX_AGE);
        List<Long> recent = new ArrayList<>();
        List<Long> tooOld = new ArrayList<>();
        for (Long messageId : messageIds) {
            (createdAt(messageId).isBefore(bulkCutoff) ? tooOld : recent).add(messageId);
        }
        if (!tooOld.isEmpty()) {
            log.debug("{} message(s) in channel {} are too old for bulk delete, deleting one by one",
                    tooOld.size(), channelId);
        }

        List<Long> failed = new ArrayList<>();
        RestClientException lastFailure = null;
        for (Long messageId : tooOld) {
            try {
                deleteOne(channelId, messageId);
            } catch (RestClientException e) {
                failed.add(messageId);
                lastFailure = e;
            }
        }
        if (!recent.isEmpty()) {
            try {
                if (recent.size() == 1) {
                    deleteOne(channelId, recent.get(0));
                } else {
                    bulkDelete(channelId, recent);
                }
            } catch (RestClientException e) {
                failed.addAll(recent);
                lastFailure = e;
            }
        }

        if (lastFailure != null) {
            throw new MessageDeleteException(channelId, failed,
                    "Failed to delete " + failed.size() + " of " + messageIds.size() + " messages in channel "
                            + channelId + ": " + lastFailure.getMessage(), lastFailure);
        }
    }

    /** Snowflake'in üst 42 biti Discord epoch'undan bu yana geçen milisaniyedir. */
    static Instant createdAt(long snowflake) {
        return Instant.ofEpochMilli((snowflake >> 22) + DISCORD_EPOCH_MILLI);
    }

    private void deleteOne(long channelId, long messageId) {
        try {
            discordRateLimitRetry.executeRunnable(() -> discordRestClient.delete()
                    .uri("/channels/{channelId}/messages/{messageId}", channelId, messageId)
                    .retrieve()
                    .toBodilessEntity());
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Message {} in channel {} already deleted", messageId, channelId);
        }
    }

    private void bulkDelete(long channelId, List<Long> messageIds) {
        List<String> ids = messageIds.stream().map(String::valueOf).toList();
        discordRateLimitRetry.executeRunnable(() -> discordRestClient.post()
                .uri("/channels/{channelId}/messages/bulk-delete", channelId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("messages", ids))
                .retrieve()
                .toBodilessEntity());
    }

    /** Tek geçmiş sayfası; before null ise en yeni mesajlardan başlar. 429'da bekleyip aynı sayfayı ister. */
    private List<DiscordMessagePayload> fetchPage(long channelId, String before, int limit) {
        try {
            return discordRateLimitRetry.executeSupplier(() -> discordRestClient.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path("/channels/{channelId}/messages").queryParam("limit", limit);
                        if (before != null) {
                            uriBuilder.queryParam("before", before);
                        }
                        return uriBuilder.build(channelId);
                    })
                    .retrieve()
                    .body(MESSAGE_LIST));
        } catch (RestClientException e) {
            throw new MessageFetchException(channelId,
                    "Failed to fetch message history for channel " + channelId + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unused")
    private List<MessageSnapshot> listPinnedCircuitOpen(long channelId, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for Discord API. Skipping pin fetch for channel {}", channelId);
        throw new MessageFetchException(channelId, "Discord API circuit breaker is open", ex);
    }

    @SuppressWarnings("unused")
    private void deleteMessageCircuitOpen(long channelId, long messageId, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for Discord API. Rejecting delete of message {} in channel {}",
                messageId, channelId);
        throw new MessageDeleteException(channelId, List.of(messageId), "Discord API circuit breaker is open", ex);
    }

    @SuppressWarnings("unused")
    private void deleteMessagesCircuitOpen(long channelId, List<Long> messageIds, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for Discord API. Rejecting bulk delete of {} messages in channel {}",
                messageIds.size(), channelId);
        throw new MessageDeleteException(channelId, messageIds, "Discord API circuit breaker is open", ex);
    }
}
