package com.baykanat.ephemeral.infrastructure.discord;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Kanal geçmişini en yeniden eskiye sayfa sayfa gezer. Bir sonraki sayfa, önceki sayfanın son
 * mesajından öncesi (before) olarak istenir; kısa veya boş sayfada durur.
 */
class DiscordMessagePager implements Iterator<DiscordMessagePayload> {

    private final Function<String, List<DiscordMessagePayload>> pageFetcher;
    private final int pageSize;

    private Iterator<DiscordMessagePayload> page = Collections.emptyIterator();
    private String before;
    private boolean exhausted;

    DiscordMessagePager(Function<String, List<DiscordMessagePayload>> pageFetcher, int pageSize) {
        this.pageFetcher = pageFetcher;
        this.pageSize = pageSize;
    }

    @Override
    public boolean hasNext() {
        while (!page.hasNext() && !exhausted) {
            List<DiscordMessagePayload> next = pageFetcher.apply(before);
            if (next == null || next.size() < pageSize) {
                exhausted = true;
            }
            if (next == null || next.isEmpty()) {
                return false;
            }
            before = next.get(next.size() - 1).getId();
            page = next.iterator();
        }
        return page.hasNext();
    }

    @Override
    public DiscordMessagePayload next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return page.next();
    }
}
