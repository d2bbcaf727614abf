package gmail.cleanup.app.service;

import gmail.cleanup.app.model.CacheMetadata;
import gmail.cleanup.app.model.MessageRecord;
import gmail.cleanup.app.model.SenderAggregate;
import gmail.cleanup.app.model.StatsFilter;
import gmail.cleanup.app.model.StatsResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Ranks senders by how many cached messages they have, under optional date and category filters.
 * Works purely from the local cache; results are recomputed on every call.
 */
@Slf4j
@Service
public class SenderStatsService {
    private static final Comparator<MessageRecord> NEWEST_FIRST = Comparator
            .comparing(MessageRecord::getReceivedAt, Comparator.reverseOrder())
            .thenComparing(MessageRecord::getId);

    static final Comparator<SenderAggregate> RANKING = Comparator
            .comparingInt(SenderAggregate::getCount).reversed()
            .thenComparing(SenderAggregate::getLastDate, Comparator.reverseOrder())
            .thenComparing(SenderAggregate::getEmail);

    private final MessageCacheStore cacheStore;
    private final ZoneId zone;

    public SenderStatsService(MessageCacheStore cacheStore, @Value("${cleanup.stats.zone:}") String zone) {
        this.cacheStore = cacheStore;
        this.zone = zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
    }

    /**
     * @param filter messages must be received before {@code filter.before} (start of that day) and
     *               belong to {@code filter.category}; null fields do not filter
     * @param limit  maximum number of senders returned, must be positive
     * @return ranked senders plus metadata of the whole, unfiltered cache
     */
    public StatsResult compute(StatsFilter filter, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("max_results must be positive, got " + limit);
        }
        StatsFilter effective = filter != null ? filter : StatsFilter.NONE;
        Instant beforeInstant = effective.getBefore() != null
                ? effective.getBefore().atStartOfDay(zone).toInstant()
                : null;

        Map<String, List<MessageRecord>> bySender = new HashMap<>();
        int matched = 0;
        for (MessageRecord record : cacheStore.all()) {
            if (beforeInstant != null && !record.getReceivedAt().isBefore(beforeInstant)) {
                continue;
            }
            if (effective.getCategory() != null && record.getCategory() != effective.getCategory()) {
                continue;
            }
            bySender.computeIfAbsent(record.getSenderEmail(), k -> new ArrayList<>()).add(record);
            matched++;
        }

        List<SenderAggregate> ranked = bySender.entrySet().stream()
                .map(entry -> aggregate(entry.getKey(), entry.getValue()))
                .sorted(RANKING)
                .limit(limit)
                .collect(Collectors.toList());

        CacheMetadata meta = cacheStore.metadata(zone);
        log.debug("Stats computed: {} messages from {} senders matched filter, returning {}",
                matched, bySender.size(), ranked.size());
        return new StatsResult(ranked, meta);
    }

    private static SenderAggregate aggregate(String email, List<MessageRecord> messages) {
        messages.sort(NEWEST_FIRST);
        MessageRecord newest = messages.get(0);
        List<String> ids = messages.stream().map(MessageRecord::getId).collect(Collectors.toList());
        String displayName = newest.getSenderName() != null ? newest.getSenderName() : email;
        return new SenderAggregate(email, displayName, messages.size(), newest.getReceivedAt(), ids);
    }
}
