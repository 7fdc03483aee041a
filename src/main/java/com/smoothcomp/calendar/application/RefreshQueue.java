package com.smoothcomp.calendar.application;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Two-phase work queue for one refresh cycle: previously unseen events first, then
 * events already in the store. Relative listing order is kept inside each phase, so a
 * cycle that dies halfway has still picked up everything new.
 */
public final class RefreshQueue implements Iterable<RefreshQueue.Entry> {

    public record Entry(String url, boolean isNew) {}

    private final List<String> newUrls;
    private final List<String> existingUrls;

    private RefreshQueue(List<String> newUrls, List<String> existingUrls) {
        this.newUrls = Collections.unmodifiableList(newUrls);
        this.existingUrls = Collections.unmodifiableList(existingUrls);
    }

    /**
     * Split listing URLs by whether their id is already stored. URLs without a
     * parsable id count as new.
     */
    public static RefreshQueue partition(List<String> urls,
                                         Set<String> existingIds,
                                         Function<String, Optional<String>> idOf) {
        List<String> newUrls = new ArrayList<>();
        List<String> existingUrls = new ArrayList<>();

        for (String url : urls) {
            Optional<String> id = idOf.apply(url);
            if (id.isPresent() && existingIds.contains(id.get())) {
                existingUrls.add(url);
            } else {
                newUrls.add(url);
            }
        }

        return new RefreshQueue(newUrls, existingUrls);
    }

    public List<String> newUrls() {
        return newUrls;
    }

    public List<String> existingUrls() {
        return existingUrls;
    }

    public int size() {
        return newUrls.size() + existingUrls.size();
    }

    public List<Entry> entries() {
        List<Entry> entries = new ArrayList<>(size());
        newUrls.forEach(url -> entries.add(new Entry(url, true)));
        existingUrls.forEach(url -> entries.add(new Entry(url, false)));
        return entries;
    }

    @Override
    public Iterator<Entry> iterator() {
        return entries().iterator();
    }
}
