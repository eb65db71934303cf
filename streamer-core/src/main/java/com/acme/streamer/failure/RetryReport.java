package com.acme.streamer.failure;

import com.acme.streamer.domain.FailedMessage;
import java.util.ArrayList;
import java.util.List;

/** Outcome of a bulk retry: every attempted record, split into retried and still failing. */
public record RetryReport(List<FailedMessage> retried, List<Failure> failed) {

    public RetryReport {
        retried = List.copyOf(retried);
        failed = List.copyOf(failed);
    }

    public static RetryReport empty() {
        return new RetryReport(List.of(), List.of());
    }

    public int attempted() {
        return retried.size() + failed.size();
    }

    public boolean isSuccessful() {
        return failed.isEmpty();
    }

    public List<String> failedIds() {
        return failed.stream().map(f -> f.message().id()).toList();
    }

    /** A record whose retry raised, with the reason reported to the operator. */
    public record Failure(FailedMessage message, String reason) {}

    static final class Builder {
        private final List<FailedMessage> retried = new ArrayList<>();
        private final List<Failure> failed = new ArrayList<>();

        Builder retried(FailedMessage message) {
            retried.add(message);
            return this;
        }

        Builder failed(FailedMessage message, String reason) {
            failed.add(new Failure(message, reason));
            return this;
        }

        RetryReport build() {
            return new RetryReport(retried, failed);
        }
    }
}
