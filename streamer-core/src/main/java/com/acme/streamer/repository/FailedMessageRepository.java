package com.acme.streamer.repository;

import com.acme.streamer.domain.FailedMessage;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of failed messages, keyed by message id. At most one failure is outstanding per
 * message id; a message that fails again is replaced rather than updated in place.
 */
public interface FailedMessageRepository {

    /** Order of {@link #all()} snapshots: oldest failure first, ties broken by id. */
    Comparator<FailedMessage> SNAPSHOT_ORDER =
            Comparator.comparing(
                            FailedMessage::recordedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(FailedMessage::id);

    /**
     * Store a failure, replacing any record with the same id. The record is stamped with the
     * repository's clock and is persisted before this method returns.
     *
     * @return the stored record
     */
    FailedMessage add(FailedMessage message);

    /**
     * Delete the record stored under the message's id, provided the stored record still
     * {@link FailedMessage#matches matches} the given one. Removing an absent or already replaced
     * record is a no-op.
     *
     * @return true if a record was deleted
     */
    boolean remove(FailedMessage message);

    /** Snapshot of the stored records at call time. */
    List<FailedMessage> all();

    Optional<FailedMessage> find(String id);

    default boolean exists(String id) {
        return find(id).isPresent();
    }

    int count();

    /**
     * Delete every stored record.
     *
     * @return number of records deleted
     */
    int flush();
}
