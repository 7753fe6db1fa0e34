package com.baykanat.ephemeral.domain.service;

import com.baykanat.ephemeral.config.AppProperties;
import com.baykanat.ephemeral.domain.store.MessageDeleteException;
import com.baykanat.ephemeral.domain.store.MessageStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BatchDeletionExecutor chunking.
 */
@ExtendWith(MockitoExtension.class)
class BatchDeletionExecutorTest {

    private static final long CHANNEL_ID = 900L;

    @Mock
    private MessageStore messageStore;

    private AppProperties appProperties;
    private BatchDeletionExecutor executor;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        executor = new BatchDeletionExecutor(messageStore, appProperties);
    }

    private static List<Long> ids(int count) {
        return LongStream.rangeClosed(1, count).boxed().toList();
    }

    @Test
    @DisplayName("Empty list should not touch the store")
    void emptyListIsNoOp() {
        assertThat(executor.deleteExpired(CHANNEL_ID, List.of())).isZero();
        verifyNoInteractions(messageStore);
    }

    @Test
    @DisplayName("Single expired message should use single delete")
    void singleMessageUsesSingleDelete() {
        assertThat(executor.deleteExpired(CHANNEL_ID, List.of(5L))).isEqualTo(1);

        verify(messageStore).deleteMessage(CHANNEL_ID, 5L);
        verify(messageStore, never()).deleteMessages(anyLong(), anyList());
    }

    @Test
    @DisplayName("Two expired messages should use one bulk delete")
    void twoMessagesUseBulkDelete() {
        assertThat(executor.deleteExpired(CHANNEL_ID, List.of(5L, 6L))).isEqualTo(2);

        verify(messageStore).deleteMessages(CHANNEL_ID, List.of(5L, 6L));
        verify(messageStore, never()).deleteMessage(anyLong(), anyLong());
    }

    @Test
    @DisplayName("150 expired messages should be split into chunks of 100 and 50")
    @SuppressWarnings("unchecked")
    void splitsIntoChunksOfHundred() {
        executor.deleteExpired(CHANNEL_ID, ids(150));

        ArgumentCaptor<List<Long>> chunks = ArgumentCaptor.forClass(List.class);
        verify(messageStore, times(2)).deleteMessages(eq(CHANNEL_ID), chunks.capture());
        assertThat(chunks.getAllValues()).extracting(List::size).containsExactly(100, 50);
        assertThat(chunks.getAllValues().get(1).get(0)).isEqualTo(101L);
    }

    @Test
    @DisplayName("201 expired messages should end with a single delete for the remainder")
    void trailingChunkOfOneUsesSingleDelete() {
        int deleted = executor.deleteExpired(CHANNEL_ID, ids(201));

        assertThat(deleted).isEqualTo(201);
        verify(messageStore, times(2)).deleteMessages(eq(CHANNEL_ID), argThat(chunk -> chunk.size() == 100));
        verify(messageStore).deleteMessage(CHANNEL_ID, 201L);
    }

    @Test
    @DisplayName("Failed chunk should be skipped and later chunks still attempted")
    void failedChunkDoesNotStopOthers() {
        doThrow(new MessageDeleteException(CHANNEL_ID, List.of(), "rate limited", null))
                .doNothing()
                .when(messageStore).deleteMessages(eq(CHANNEL_ID), anyList());

        int deleted = executor.deleteExpired(CHANNEL_ID, ids(150));

        assertThat(deleted).isEqualTo(50);
        verify(messageStore, times(2)).deleteMessages(eq(CHANNEL_ID), anyList());
    }

    @Test
    @DisplayName("Partially failed chunk should still count the ids the store did delete")
    void partiallyFailedChunkCountsSucceededIds() {
        doThrow(new MessageDeleteException(CHANNEL_ID, List.of(2L, 4L), "too old", null))
                .when(messageStore).deleteMessages(eq(CHANNEL_ID), anyList());

        int deleted = executor.deleteExpired(CHANNEL_ID, ids(10));

        assertThat(deleted).isEqualTo(8);
    }

    @Test
    @DisplayName("Configured batch size above the store limit should be capped at 100")
    void batchSizeCappedAtStoreLimit() {
        appProperties.getEphemeral().setMaxBatchSize(500);

        executor.deleteExpired(CHANNEL_ID, ids(250));

        verify(messageStore, times(3)).deleteMessages(eq(CHANNEL_ID), anyList());
    }

    @Test
    @DisplayName("Smaller configured batch size should be honoured")
    void smallerBatchSizeHonoured() {
        appProperties.getEphemeral().setMaxBatchSize(10);

        executor.deleteExpired(CHANNEL_ID, ids(25));

        verify(messageStore, times(2)).deleteMessages(eq(CHANNEL_ID), argThat(chunk -> chunk.size() == 10));
        verify(messageStore).deleteMessages(eq(CHANNEL_ID), argThat(chunk -> chunk.size() == 5));
    }
}
