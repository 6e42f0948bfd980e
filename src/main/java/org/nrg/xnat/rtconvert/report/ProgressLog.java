package org.nrg.xnat.rtconvert.report;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Append-only progress collector shared by conversion workers.
 */
public class ProgressLog {

    private final ConcurrentLinkedQueue<Entry> entries = new ConcurrentLinkedQueue<>();

    public void append(String requestId, String message) {
        entries.add(new Entry(System.currentTimeMillis(), Thread.currentThread().getName(), requestId, message));
    }

    /**
     * Snapshot of all entries appended so far, in append order.
     */
    public List<Entry> snapshot() {
        return new ArrayList<>(entries);
    }

    public List<Entry> entriesFor(String requestId) {
        List<Entry> result = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.getRequestId().equals(requestId)) {
                result.add(entry);
            }
        }
        return result;
    }

    public int size() {
        return entries.size();
    }

    public static final class Entry {
        private final long timestamp;
        private final String worker;
        private final String requestId;
        private final String message;

        Entry(long timestamp, String worker, String requestId, String message) {
            this.timestamp = timestamp;
            this.worker = worker;
            this.requestId = requestId;
            this.message = message;
        }

        public long getTimestamp() {
            return timestamp;
        }

        public String getWorker() {
            return worker;
        }

        public String getRequestId() {
            return requestId;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return "[" + worker + "] " + requestId + ": " + message;
        }
    }
}
