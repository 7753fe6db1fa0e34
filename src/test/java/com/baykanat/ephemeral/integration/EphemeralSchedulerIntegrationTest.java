package com.baykanat.ephemeral.integration;

import com.baykanat.ephemeral.api.dto.GatewayEventRequest;
import com.baykanat.ephemeral.domain.model.GatewayEventType;
import com.baykanat.ephemeral.domain.model.MessageSnapshot;
import com.baykanat.ephemeral.domain.service.ChannelTtlDirectory;
import com.baykanat.ephemeral.domain.service.DeletionRegistry;
import com.baykanat.ephemeral.domain.service.EphemeralMessageHandler;
import com.baykanat.ephemeral.domain.store.MessageStore;
import com.baykanat.ephemeral.infrastructure.kafka.GatewayEventKafkaProducer;
import com.baykanat.ephemeral.infrastructure.persistence.ChannelTtlJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Integration test for the full scheduling pipeline with a real PostgreSQL database
 * (via Testcontainers) and embedded Kafka.
 *
 * <p>This test validates:
 * <ul>
 *   <li>Configured channels are synced into ephemeral_channels on startup</li>
 *   <li>Channels outside the configuration can be removed from ephemeral_channels</li>
 *   <li>A message event sent through Kafka is deleted once its TTL passes</li>
 *   <li>Pinning a message before its TTL cancels the deletion</li>
 *   <li>Reconnect reconciliation deletes messages that expired while disconnected</li>
 * </ul>
 *
 * <p>The chat platform is replaced by a mocked MessageStore. Channel 100000000000000001 has a
 * 2 second TTL in the test profile; channel 100000000000000002 has one hour.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@EmbeddedKafka(partitions = 1, topics = {"gateway-events", "gateway-events.DLT"})
@ActiveProfiles("test")
class EphemeralSchedulerIntegrationTest {

    private static final long SHORT_TTL_CHANNEL = 100000000000000001L;
    private static final long LONG_TTL_CHANNEL = 100000000000000002L;

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("ephemeral_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @MockitoBean
    private MessageStore messageStore;

    @Autowired
    private GatewayEventKafkaProducer kafkaProducer;

    @Autowired
    private EphemeralMessageHandler messageHandler;

    @Autowired
    private DeletionRegistry deletionRegistry;

    @Autowired
    private ChannelTtlDirectory channelTtlDirectory;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ChannelTtlJdbcRepository channelTtlRepository;

    @BeforeEach
    void emptyHistoryByDefault() {
        when(messageStore.listMessages(anyLong())).thenAnswer(invocation -> Stream.empty());
        when(messageStore.listPinned(anyLong())).thenReturn(List.of());
    }

    @Test
    @DisplayName("Configured channels should be synced to the database and visible in the directory")
    void channelsSyncedOnStartup() {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
                "SELECT channel_id, ttl_seconds FROM ephemeral_channels ORDER BY channel_id");

        assertThat(rows).hasSize(2);
        assertThat(((Number) rows.get(0).get("ttl_seconds")).longValue()).isEqualTo(2L);
        assertThat(((Number) rows.get(1).get("ttl_seconds")).longValue()).isEqualTo(3600L);
        assertThat(channelTtlDirectory.getTtl(SHORT_TTL_CHANNEL)).contains(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("Rows for channels outside the kept set should be deleted")
    void deleteAllExceptRemovesStrayChannels() {
        long strayChannel = 100000000000000099L;
        jdbcTemplate.update("INSERT INTO ephemeral_channels (channel_id, ttl_seconds, updated_at) VALUES (?, 60, NOW())",
                strayChannel);

        int removed = channelTtlRepository.deleteAllExcept(Set.of(SHORT_TTL_CHANNEL, LONG_TTL_CHANNEL));

        assertThat(removed).isEqualTo(1);
        assertThat(channelTtlRepository.findAll()).containsOnlyKeys(SHORT_TTL_CHANNEL, LONG_TTL_CHANNEL);
    }

    @Test
    @DisplayName("Message event sent through Kafka should be deleted after its channel TTL")
    void messageDeletedAfterTtl() throws Exception {
        long messageId = 900000000000000001L;
        kafkaProducer.send(GatewayEventRequest.builder()
                .type(GatewayEventType.MESSAGE_CREATED)
                .channelId(String.valueOf(SHORT_TTL_CHANNEL))
                .messageId(String.valueOf(messageId))
                .createdAt(Instant.now().toEpochMilli())
                .build());

        verify(messageStore, timeout(TimeUnit.SECONDS.toMillis(20))).deleteMessage(SHORT_TTL_CHANNEL, messageId);
        awaitUntracked(messageId);
    }

    @Test
    @DisplayName("Pinning a message before its TTL should cancel the pending deletion")
    void pinCancelsDeletion() {
        long messageId = 900000000000000002L;
        messageHandler.onMessageCreated(messageId, LONG_TTL_CHANNEL, Instant.now(), false);
        assertThat(deletionRegistry.contains(messageId)).isTrue();

        when(messageStore.listPinned(LONG_TTL_CHANNEL)).thenReturn(List.of(MessageSnapshot.builder()
                .messageId(messageId)
                .channelId(LONG_TTL_CHANNEL)
                .createdAt(Instant.now())
                .pinned(true)
                .build()));

        messageHandler.onPinsUpdated(LONG_TTL_CHANNEL, Instant.now()).join();

        assertThat(deletionRegistry.contains(messageId)).isFalse();
        verify(messageStore, never()).deleteMessage(LONG_TTL_CHANNEL, messageId);
    }

    @Test
    @DisplayName("Reconnect should delete messages that expired while disconnected and schedule the rest")
    void reconnectReconcilesHistory() {
        long expiredId = 900000000000000003L;
        long freshId = 900000000000000004L;
        Instant now = Instant.now();
        when(messageStore.listMessages(LONG_TTL_CHANNEL)).thenAnswer(invocation -> Stream.of(
                MessageSnapshot.builder().messageId(expiredId).channelId(LONG_TTL_CHANNEL)
                        .createdAt(now.minus(Duration.ofHours(2))).build(),
                MessageSnapshot.builder().messageId(freshId).channelId(LONG_TTL_CHANNEL)
                        .createdAt(now.minus(Duration.ofMinutes(10))).build()));

        messageHandler.onConnectionResumed().join();

        verify(messageStore).deleteMessage(LONG_TTL_CHANNEL, expiredId);
        assertThat(deletionRegistry.contains(freshId)).isTrue();
        assertThat(deletionRegistry.contains(expiredId)).isFalse();

        deletionRegistry.cancel(freshId);
    }

    private void awaitUntracked(long messageId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (deletionRegistry.contains(messageId) && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertThat(deletionRegistry.contains(messageId)).isFalse();
    }
}
