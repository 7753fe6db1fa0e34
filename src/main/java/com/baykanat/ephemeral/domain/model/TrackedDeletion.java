package com.baykanat.ephemeral.domain.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/** Tek bir mesaj için planlanmış, iptal edilebilir silme. Registry dışında oluşturulmaz. */
@Getter
@ToString(exclude = "future")
@RequiredArgsConstructor
public class TrackedDeletion {

    private final long messageId;
    private final long channelId;
    private final Instant fireAt;

    private volatile ScheduledFuture<?> future;

    /** Zamanlayıcı handle'ını bağlar; registry'ye eklenmeden önce çağrılır. */
    public void attach(ScheduledFuture<?> future) {
        this.future = future;
    }

    /** Zamanlayıcı tamamlandıysa (çalıştı, iptal edildi veya hata verdi) true. */
    public boolean isFinished() {
        ScheduledFuture<?> f = future;
        return f != null && f.isDone();
    }

    /** Zamanlayıcıyı durdurur; silme çağrısı başlamışsa kesilmez. */
    public boolean cancel() {
        ScheduledFuture<?> f = future;
        return f != null && f.cancel(false);
    }
}
