package com.baykanat.ephemeral.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/** app.* için tip güvenli configuration (Kafka topic, Discord API, ephemeral kanallar, scheduler aralıkları). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private KafkaTopicProperties kafka = new KafkaTopicProperties();
    private DiscordProperties discord = new DiscordProperties();
    private EphemeralProperties ephemeral = new EphemeralProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();

    @Getter
    @Setter
    public static class KafkaTopicProperties {
        private TopicNames topic = new TopicNames();

        @Getter
        @Setter
        public static class TopicNames {
            private String gatewayEvents = "gateway-events";
        }
    }

    @Getter
    @Setter
    public static class DiscordProperties {
        private String apiBaseUrl = "https://discord.com/api/v10";
        private String token = "";
        /** Geçmiş okunurken sayfa başına mesaj (Discord üst sınırı 100). */
        private int pageSize = 100;
        /** 429 yanıtında aynı istek için en fazla deneme (ilk istek dahil). */
        private int rateLimitMaxAttempts = 5;
        /** 429 başına en uzun bekleme; Discord daha uzun bildirse de bu süre sonra tekrar denenir. */
        private Duration rateLimitMaxWait = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class EphemeralProperties {
        /** Kanal id → TTL; açılışta ephemeral_channels tablosuna yazılır. */
        private Map<Long, Duration> channels = new LinkedHashMap<>();
        /** Toplu silme çağrısı başına en fazla mesaj (Discord üst sınırı 100). */
        private int maxBatchSize = 100;
        /** true ise açılışta yaml'da olmayan kanallar tablodan silinir; false ise tablo kaynak kabul edilir. */
        private boolean pruneUnconfigured = false;
    }

    @Getter
    @Setter
    public static class SchedulerProperties {
        private int deletionPoolSize = 4;
        private int reconciliationPoolSize = 2;
        /** ephemeral_channels tablosundan TTL snapshot yenileme aralığı (ms). */
        private long channelTtlRefreshRate = 30000;
        /** Tamamlanmış silme kayıtlarının registry'den temizlenme aralığı (ms). */
        private long registryPruneRate = 300000;
    }
}
