package gmail.cleanup.app.service;

import gmail.cleanup.app.entity.CachedMessage;
import gmail.cleanup.app.exception.StorageException;
import gmail.cleanup.app.model.CacheMetadata;
import gmail.cleanup.app.model.MessageRecord;
import gmail.cleanup.app.repository.CachedMessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Durable local cache of message metadata keyed by Gmail message id.
 * Every mutating call runs in its own transaction and is committed before it returns,
 * so concurrent readers only ever see whole batches.
 */
@Slf4j
@Service
public class MessageCacheStore {
    private static final int PAGE_SIZE = 1000;
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final CachedMessageRepository repository;
    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;
    private final Clock clock;

    @Autowired
    public MessageCacheStore(CachedMessageRepository repository, PlatformTransactionManager transactionManager) {
        this(repository, transactionManager, Clock.systemUTC());
    }

    MessageCacheStore(CachedMessageRepository repository, PlatformTransactionManager transactionManager, Clock clock) {
        this.repository = repository;
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.clock = clock;
    }

    /**
     * Inserts or replaces records by id. Repeating the call with the same records is harmless.
     * Duplicate ids within one call resolve to the last occurrence.
     */
    public void upsert(List<MessageRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        Instant fetchedAt = clock.instant();
        Map<String, CachedMessage> byId = new LinkedHashMap<>();
        for (MessageRecord record : records) {
            byId.put(record.getId(), toEntity(record, fetchedAt));
        }
        inWriteTransaction("upsert " + byId.size() + " messages", () -> repository.saveAll(byId.values()));
        log.debug("Upserted {} messages into cache", byId.size());
    }

    /**
     * Lazily pages through the whole cache in id order. Each call to {@code iterator()} starts over
     * and sees the store as it is when each page is read.
     */
    public Iterable<MessageRecord> all() {
        return () -> new PagingIterator();
    }

    public void remove(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        Set<String> unique = new LinkedHashSet<>(ids);
        inWriteTransaction("remove " + unique.size() + " messages", () -> {
            repository.deleteAllByIdInBatch(unique);
            return null;
        });
        log.debug("Removed {} messages from cache", unique.size());
    }

    public void clear() {
        inWriteTransaction("clear cache", () -> {
            repository.deleteAllInBatch();
            return null;
        });
        log.info("Message cache cleared");
    }

    /**
     * Returns which of the given ids are cached and were fetched at or after {@code staleBefore}.
     * A null cutoff means cached records never go stale.
     */
    public Set<String> findCachedIds(Collection<String> ids, Instant staleBefore) {
        if (ids == null || ids.isEmpty()) {
            return Set.of();
        }
        List<String> found = inReadTransaction("look up cached ids", () -> staleBefore == null
                ? repository.findExistingIds(ids)
                : repository.findFreshIds(ids, staleBefore));
        return new HashSet<>(found);
    }

    public long count() {
        return inReadTransaction("count messages", repository::count);
    }

    /**
     * Size and oldest message date of the whole cache; the date is rendered in {@code zone}.
     */
    public CacheMetadata metadata(ZoneId zone) {
        return inReadTransaction("read cache metadata", () -> {
            long total = repository.count();
            Instant oldest = total > 0 ? repository.findOldestReceivedAt() : null;
            return new CacheMetadata(total, oldest != null ? DAY_FORMAT.withZone(zone).format(oldest) : CacheMetadata.NO_DATE);
        });
    }

    private <T> T inWriteTransaction(String action, Supplier<T> work) {
        try {
            return writeTemplate.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            log.error("Cache store failed to {}: {}", action, e.getMessage(), e);
            throw new StorageException("Failed to " + action + ": " + e.getMessage(), e);
        }
    }

    private <T> T inReadTransaction(String action, Supplier<T> work) {
        try {
            return readTemplate.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            log.error("Cache store failed to {}: {}", action, e.getMessage(), e);
            throw new StorageException("Failed to " + action + ": " + e.getMessage(), e);
        }
    }

    private static CachedMessage toEntity(MessageRecord record, Instant fetchedAt) {
        CachedMessage entity = new CachedMessage();
        entity.setId(record.getId());
        entity.setSenderEmail(truncate(record.getSenderEmail(), CachedMessage.SENDER_EMAIL_LENGTH));
        entity.setSenderName(truncate(record.getSenderName(), CachedMessage.SENDER_NAME_LENGTH));
        entity.setReceivedAt(record.getReceivedAt());
        entity.setCategory(record.getCategory());
        entity.setThreadId(record.getThreadId());
        entity.setFetchedAt(fetchedAt);
        return entity;
    }

    // A From header without angle brackets is taken whole, so it can be arbitrarily long
    private static String truncate(String value, int maxLength) {
        return value != null && value.length() > maxLength ? value.substring(0, maxLength) : value;
    }

    private static MessageRecord toRecord(CachedMessage entity) {
        return MessageRecord.builder()
                .id(entity.getId())
                .senderEmail(entity.getSenderEmail())
                .senderName(entity.getSenderName())
                .receivedAt(entity.getReceivedAt())
                .category(entity.getCategory())
                .threadId(entity.getThreadId())
                .build();
    }

    /**
     * Keyset pagination over ids so pages stay cheap regardless of cache size.
     */
    private class PagingIterator implements Iterator<MessageRecord> {
        private Iterator<MessageRecord> page = Collections.emptyIterator();
        private String lastId;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (!page.hasNext() && !exhausted) {
                loadNextPage();
            }
            return page.hasNext();
        }

        @Override
        public MessageRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            MessageRecord record = page.next();
            lastId = record.getId();
            return record;
        }

        private void loadNextPage() {
            PageRequest pageRequest = PageRequest.of(0, PAGE_SIZE);
            List<MessageRecord> records = inReadTransaction("read messages", () -> {
                List<CachedMessage> entities = lastId == null
                        ? repository.findAllByOrderByIdAsc(pageRequest)
                        : repository.findByIdGreaterThanOrderByIdAsc(lastId, pageRequest);
                return entities.stream().map(MessageCacheStore::toRecord).collect(Collectors.toList());
            });
            if (records.size() < PAGE_SIZE) {
                exhausted = true;
            }
            page = records.iterator();
        }
    }
}
