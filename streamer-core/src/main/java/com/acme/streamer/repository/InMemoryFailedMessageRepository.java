package com.acme.streamer.repository;

import com.acme.streamer.domain.FailedMessage;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Process-local repository for tests and single-node deployments without Redis. */
public class InMemoryFailedMessageRepository implements FailedMessageRepository {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryFailedMessageRepository.class);

    private final Map<String, FailedMessage> messages = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryFailedMessageRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryFailedMessageRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public FailedMessage add(FailedMessage message) {
        FailedMessage stored = message.withRecordedAt(clock.instant());
        messages.put(stored.id(), stored);
        LOG.debug("Stored failed message id={} receiver={}", stored.id(), stored.receiver());
        return stored;
    }

    @Override
    public boolean remove(FailedMessage message) {
        FailedMessage stored = messages.get(message.id());
        if (stored == null || !stored.matches(message)) {
            return false;
        }
        return messages.remove(stored.id(), stored);
    }

    @Override
    public List<FailedMessage> all() {
        List<FailedMessage> snapshot = new ArrayList<>(messages.values());
        snapshot.sort(SNAPSHOT_ORDER);
        return snapshot;
    }

    @Override
    public Optional<FailedMessage> find(String id) {
        return Optional.ofNullable(messages.get(id));
    }

    @Override
    public int count() {
        return messages.size();
    }

    @Override
    public int flush() {
        int removed = 0;
        for (FailedMessage message : all()) {
            if (messages.remove(message.id(), message)) {
                removed++;
            }
        }
        return removed;
    }
}
