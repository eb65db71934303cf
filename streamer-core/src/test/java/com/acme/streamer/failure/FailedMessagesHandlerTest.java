package com.acme.streamer.failure;

import com.acme.streamer.core.InvalidReceiverException;
import com.acme.streamer.core.MessageNotFoundException;
import com.acme.streamer.core.MessageRetryFailedException;
import com.acme.streamer.core.UnknownReceiverException;
import com.acme.streamer.domain.FailedMessage;
import com.acme.streamer.domain.ReceivedMessage;
import com.acme.streamer.receiver.ReceiverRegistry;
import com.acme.streamer.receiver.RegistryReceiverResolver;
import com.acme.streamer.repository.FailedMessageRepository;
import com.acme.streamer.repository.InMemoryFailedMessageRepository;
import com.acme.streamer.spi.MessageReceiver;
import com.acme.streamer.stream.InMemoryStreamReader;
import com.acme.streamer.test.LocalListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class FailedMessagesHandlerTest {

    private static final Instant NOW = Instant.parse("2021-12-12T12:12:12Z");
    private static final String STREAM = "foo.bar";
    private static final String LISTENER = LocalListener.class.getName();

    private FailedMessageRepository repository;
    private ReceiverRegistry registry;
    private InMemoryStreamReader stream;
    private LocalListener listener;
    private FailedMessagesHandler handler;

    @BeforeEach
    void setUp() {
        repository = spy(new InMemoryFailedMessageRepository(Clock.fixed(NOW, ZoneOffset.UTC)));
        registry = new ReceiverRegistry();
        stream = new InMemoryStreamReader();
        listener = new LocalListener();
        registry.register(LocalListener.class, () -> listener);
        handler = new FailedMessagesHandler(repository, new RegistryReceiverResolver(registry), stream);
    }

    private static ReceivedMessage message(String id) {
        return new ReceivedMessage(id, Map.of("name", STREAM, "data", "{\"amount\":10}"));
    }

    private void publish(String id) {
        stream.append(STREAM, id, Map.of("name", STREAM, "data", "{\"amount\":10}"));
    }

    private FailedMessage storeFailure(String id, String error) {
        handler.store(message(id), listener, new RuntimeException(error));
        return repository.find(id).orElseThrow();
    }

    @Nested
    @DisplayName("store")
    class StoreTests {

        @Test
        @DisplayName("store - should record id, stream, receiver, error and timestamp")
        void testStoreRecordsFailure() {
            handler.store(message("123"), listener, new RuntimeException("error"));

            assertThat(repository.all())
                    .containsExactly(new FailedMessage("123", STREAM, LISTENER, "error", NOW));
        }

        @Test
        @DisplayName("store - should use empty stream name when content has no name")
        void testStoreWithoutEventName() {
            handler.store(new ReceivedMessage("7", Map.of("data", "{}")), listener, new RuntimeException("x"));

            assertThat(repository.find("7")).get()
                    .extracting(FailedMessage::streamName)
                    .isEqualTo("");
        }

        @Test
        @DisplayName("store - should not decode malformed data")
        void testStoreWithMalformedData() {
            ReceivedMessage malformed = new ReceivedMessage("8", Map.of("name", STREAM, "data", "{not json"));

            handler.store(malformed, listener, new RuntimeException("bad"));

            assertThat(repository.exists("8")).isTrue();
        }

        @Test
        @DisplayName("store - should fall back to exception class name when message is null")
        void testStoreWithNullErrorMessage() {
            handler.store(message("9"), listener, new NullPointerException());

            assertThat(repository.find("9")).get()
                    .extracting(FailedMessage::error)
                    .isEqualTo(NullPointerException.class.getName());
        }

        @Test
        @DisplayName("store - should keep one record per id, last failure wins")
        void testStoreReplacesById() {
            storeFailure("123", "first");
            storeFailure("123", "second");

            assertThat(repository.count()).isEqualTo(1);
            assertThat(repository.find("123")).get()
                    .extracting(FailedMessage::error)
                    .isEqualTo("second");
        }
    }

    @Nested
    @DisplayName("retry")
    class RetryTests {

        @Test
        @DisplayName("retry - successful handling should clear the record")
        void testSuccessfulRetryClears() {
            publish("123");
            FailedMessage stored = storeFailure("123", "error");

            handler.retry(stored);

            assertThat(repository.exists("123")).isFalse();
            assertThat(listener.received()).hasSize(1);
            assertThat(listener.received().get(0).id()).isEqualTo("123");
            assertThat(listener.received().get(0).getData()).containsEntry("amount", 10);
        }

        @Test
        @DisplayName("retry - renewed failure should replace the record with the new error")
        void testFailedRetryReplaces() {
            publish("123");
            FailedMessage stored = storeFailure("123", "error");
            listener.failWith(new IllegalStateException("still broken"));

            assertThatThrownBy(() -> handler.retry(stored))
                    .isInstanceOf(MessageRetryFailedException.class)
                    .hasMessage("Failed to retry [123] on foo.bar stream by [" + LISTENER
                            + "] listener. Error: still broken")
                    .hasCauseInstanceOf(IllegalStateException.class);

            assertThat(repository.count()).isEqualTo(1);
            assertThat(repository.find("123")).get()
                    .extracting(FailedMessage::error, FailedMessage::receiver, FailedMessage::streamName)
                    .containsExactly("still broken", LISTENER, STREAM);
        }

        @Test
        @DisplayName("retry - replacement should be written before the original is removed")
        void testReplacementAddedBeforeRemoval() {
            publish("123");
            FailedMessage stored = storeFailure("123", "error");
            listener.failWith(new IllegalStateException("still broken"));

            assertThatThrownBy(() -> handler.retry(stored)).isInstanceOf(MessageRetryFailedException.class);

            InOrder order = inOrder(repository);
            order.verify(repository, times(2)).add(any(FailedMessage.class));
            order.verify(repository).remove(stored);
        }

        @Test
        @DisplayName("retry - same error again should keep the failure stored")
        void testSameErrorKeepsRecord() {
            publish("123");
            FailedMessage reference = new FailedMessage("123", STREAM, LISTENER, "error");
            repository.add(reference);
            listener.failWith(new RuntimeException("error"));

            assertThatThrownBy(() -> handler.retry(reference)).isInstanceOf(MessageRetryFailedException.class);

            assertThat(repository.exists("123")).isTrue();
        }

        @Test
        @DisplayName("retry - checked exception from receiver should be wrapped")
        void testCheckedExceptionWrapped() {
            publish("123");
            registry.register("checked", () -> (MessageReceiver) m -> {
                throw new IOException("disk full");
            });
            FailedMessage stored = repository.add(new FailedMessage("123", STREAM, "checked", "error"));

            assertThatThrownBy(() -> handler.retry(stored))
                    .isInstanceOf(MessageRetryFailedException.class)
                    .hasCauseInstanceOf(IOException.class)
                    .extracting(e -> ((MessageRetryFailedException) e).getReason())
                    .isEqualTo("disk full");

            assertThat(repository.find("123")).get()
                    .extracting(FailedMessage::receiver, FailedMessage::error)
                    .containsExactly("checked", "disk full");
        }

        @Test
        @DisplayName("retry - unresolvable receiver should leave the record untouched")
        void testUnknownReceiverPreserves() {
            publish("123");
            FailedMessage stored = repository.add(new FailedMessage("123", STREAM, "not a class", "error"));

            assertThatThrownBy(() -> handler.retry(stored))
                    .isInstanceOf(MessageRetryFailedException.class)
                    .hasCauseInstanceOf(UnknownReceiverException.class)
                    .hasMessageContaining("Receiver class does not exist");

            assertThat(repository.find("123")).contains(stored);
            verify(repository, never()).remove(any());
        }

        @Test
        @DisplayName("retry - receiver that is not a MessageReceiver should leave the record untouched")
        void testInvalidReceiverPreserves() {
            publish("123");
            registry.register("plain", Object::new);
            FailedMessage stored = repository.add(new FailedMessage("123", STREAM, "plain", "error"));

            assertThatThrownBy(() -> handler.retry(stored))
                    .isInstanceOf(MessageRetryFailedException.class)
                    .hasCauseInstanceOf(InvalidReceiverException.class)
                    .hasMessageContaining("not an instance of MessageReceiver contract");

            assertThat(repository.find("123")).contains(stored);
        }

        @Test
        @DisplayName("retry - message missing from the stream should leave the record untouched")
        void testMissingMessagePreserves() {
            FailedMessage stored = storeFailure("123", "error");

            assertThatThrownBy(() -> handler.retry(stored))
                    .isInstanceOf(MessageRetryFailedException.class)
                    .hasCauseInstanceOf(MessageNotFoundException.class)
                    .extracting(e -> ((MessageRetryFailedException) e).getReason())
                    .isEqualTo(FailedMessagesHandler.NO_MATCHING_MESSAGES);

            assertThat(repository.find("123")).contains(stored);
            assertThat(listener.received()).isEmpty();
        }

        @Test
        @DisplayName("retry - message trimmed from the stream should leave the record untouched")
        void testTrimmedMessagePreserves() {
            publish("123");
            FailedMessage stored = storeFailure("123", "error");
            stream.trim(STREAM, "123");

            assertThatThrownBy(() -> handler.retry(stored)).isInstanceOf(MessageRetryFailedException.class);

            assertThat(repository.exists("123")).isTrue();
        }

        @Test
        @DisplayName("retry - should not delete a newer failure stored meanwhile")
        void testNewerFailureSurvives() {
            publish("123");
            FailedMessage stale = new FailedMessage("123", STREAM, LISTENER, "old", NOW.minusSeconds(60));
            storeFailure("123", "newer");

            handler.retry(stale);

            assertThat(repository.find("123")).get()
                    .extracting(FailedMessage::error)
                    .isEqualTo("newer");
        }

        @Test
        @DisplayName("retry - Error from receiver should keep the original record")
        void testErrorKeepsRecord() {
            publish("1-0");
            registry.register("fatal", () -> (MessageReceiver) m -> {
                throw new AssertionError("boom");
            });
            FailedMessage stored = repository.add(new FailedMessage("1-0", STREAM, "fatal", "error"));

            assertThatThrownBy(() -> handler.retry(stored))
                    .isInstanceOf(AssertionError.class)
                    .hasMessage("boom");

            assertThat(repository.find("1-0")).contains(stored);
            verify(repository, never()).remove(any());
        }

        @Test
        @DisplayName("retry - receiver factory failure should be wrapped and keep the record")
        void testFactoryFailureWrapped() {
            publish("1-0");
            registry.register("broken", () -> {
                throw new IllegalStateException("cannot construct receiver");
            });
            FailedMessage stored = repository.add(new FailedMessage("1-0", STREAM, "broken", "error"));

            assertThatThrownBy(() -> handler.retry(stored))
                    .isInstanceOf(MessageRetryFailedException.class)
                    .hasCauseInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("cannot construct receiver");

            assertThat(repository.find("1-0")).contains(stored);
        }

        @Test
        @DisplayName("retry - replacement write failure should keep the original record")
        void testReplacementWriteFailureKeepsRecord() {
            publish("123");
            FailedMessage stored = storeFailure("123", "error");
            listener.failWith(new IllegalStateException("still broken"));
            doThrow(new IllegalStateException("connection lost")).when(repository).add(any(FailedMessage.class));

            assertThatThrownBy(() -> handler.retry(stored))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("connection lost");

            assertThat(repository.find("123")).contains(stored);
        }

        @Test
        @DisplayName("retry(id) - null id should be rejected")
        void testRetryNullId() {
            assertThatThrownBy(() -> handler.retry((String) null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("id");
        }

        @Test
        @DisplayName("retry(id) - should look the record up and retry it")
        void testRetryById() {
            publish("123");
            storeFailure("123", "error");

            handler.retry("123");

            assertThat(repository.exists("123")).isFalse();
        }

        @Test
        @DisplayName("retry(id) - unknown id should raise not found")
        void testRetryUnknownId() {
            assertThatThrownBy(() -> handler.retry("404"))
                    .isInstanceOf(MessageRetryFailedException.class)
                    .hasCauseInstanceOf(MessageNotFoundException.class)
                    .hasMessageContaining("[404]");
        }

        @Test
        @DisplayName("retry - storage failure should propagate unwrapped")
        void testStorageFailurePropagates() {
            publish("123");
            FailedMessage stored = storeFailure("123", "error");
            doThrow(new IllegalStateException("connection lost")).when(repository).remove(stored);

            assertThatThrownBy(() -> handler.retry(stored))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("connection lost");
        }
    }

    @Nested
    @DisplayName("retryAll / retryBy")
    class BulkRetryTests {

        @Test
        @DisplayName("retryAll - should drain the repository when every receiver succeeds")
        void testRetryAllDrains() {
            publish("123");
            publish("345");
            storeFailure("123", "error");
            storeFailure("345", "error");
            assertThat(repository.count()).isEqualTo(2);

            RetryReport report = handler.retryAll();

            assertThat(repository.count()).isZero();
            assertThat(report.isSuccessful()).isTrue();
            assertThat(report.retried()).extracting(FailedMessage::id).containsExactly("123", "345");
        }

        @Test
        @DisplayName("retryAll - should continue past failures and remove only retried ids")
        void testRetryAllContinuesAndReports() {
            publish("123");
            publish("345");
            storeFailure("123", "error");
            storeFailure("345", "error");
            repository.add(new FailedMessage("200", STREAM, "not a class", "error"));

            RetryReport report = handler.retryAll();

            assertThat(report.attempted()).isEqualTo(3);
            assertThat(report.retried()).extracting(FailedMessage::id).containsExactly("123", "345");
            assertThat(report.failedIds()).containsExactly("200");
            assertThat(report.failed().get(0).reason()).contains("not a class");
            assertThat(repository.all()).extracting(FailedMessage::id).containsExactly("200");
        }

        @Test
        @DisplayName("retryAll - renewed failures should stay stored with the new error")
        void testRetryAllKeepsRenewedFailures() {
            publish("123");
            storeFailure("123", "error");
            listener.failWith(new RuntimeException("again"));

            RetryReport report = handler.retryAll();

            assertThat(report.failed()).extracting(RetryReport.Failure::reason).containsExactly("again");
            assertThat(repository.find("123")).get()
                    .extracting(FailedMessage::error)
                    .isEqualTo("again");
        }

        @Test
        @DisplayName("retryAll - receiver that cannot be created should not stop the batch")
        void testRetryAllContinuesPastFactoryFailure() {
            publish("1-0");
            publish("2-0");
            registry.register("broken", () -> {
                throw new IllegalStateException("cannot construct receiver");
            });
            registry.register("ok", LocalListener::new);
            repository.add(new FailedMessage("1-0", STREAM, "broken", "error"));
            repository.add(new FailedMessage("2-0", STREAM, "ok", "error"));

            RetryReport report = handler.retryAll();

            assertThat(report.retried()).extracting(FailedMessage::id).containsExactly("2-0");
            assertThat(report.failedIds()).containsExactly("1-0");
            assertThat(report.failed().get(0).reason()).isEqualTo("cannot construct receiver");
            assertThat(repository.all()).extracting(FailedMessage::id).containsExactly("1-0");
        }

        @Test
        @DisplayName("retryAll - empty repository should yield an empty report")
        void testRetryAllEmpty() {
            RetryReport report = handler.retryAll();

            assertThat(report.attempted()).isZero();
            assertThat(report.isSuccessful()).isTrue();
        }

        @Test
        @DisplayName("retryBy - should retry only matching records")
        void testRetryByReceiver() {
            publish("123");
            stream.append("other", "345", Map.of("name", "other"));
            storeFailure("123", "error");
            repository.add(new FailedMessage("345", "other", LISTENER, "error"));

            RetryReport report = handler.retryBy(FailureFilter.byStream("other"));

            assertThat(report.retried()).extracting(FailedMessage::id).containsExactly("345");
            assertThat(repository.all()).extracting(FailedMessage::id).containsExactly("123");
        }

        @Test
        @DisplayName("failed - should list records matching the filter")
        void testFailedListing() {
            storeFailure("123", "error");
            repository.add(new FailedMessage("345", STREAM, "other", "error"));

            assertThat(handler.failed(FailureFilter.byReceiver(LISTENER)))
                    .extracting(FailedMessage::id)
                    .containsExactly("123");
            assertThat(handler.failed(FailureFilter.all())).hasSize(2);
        }
    }
}
