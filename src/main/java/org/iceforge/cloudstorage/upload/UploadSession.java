package org.iceforge.cloudstorage.upload;

import org.iceforge.cloudstorage.aws.s3.ObjectStoreModels;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One in-flight multipart upload.
 * <p>
 * State and part bookkeeping are mutated only by {@link MultipartUploadCoordinator}; all
 * mutators synchronize on the session so parts of one session can be uploaded concurrently.
 * The session owns its {@link UploadSource} and releases it once a terminal outcome is reached.
 */
public final class UploadSession {

    private final String targetPath;
    private final UploadSource source;
    private final long totalSize;
    private final long chunkSize;
    private final CancellationSignal cancellation;
    private final TreeMap<Integer, PartState> parts = new TreeMap<>();

    private ObjectStoreModels.MultipartSession handle;
    private UploadState state = UploadState.INITIALIZING;
    private boolean storeAborted;

    UploadSession(String targetPath, UploadSource source, long chunkSize, List<PartRange> plan, CancellationSignal cancellation) {
        this.targetPath = Objects.requireNonNull(targetPath);
        this.source = Objects.requireNonNull(source);
        this.totalSize = source.size();
        this.chunkSize = chunkSize;
        this.cancellation = cancellation == null ? CancellationSignal.none() : cancellation;
        for (PartRange range : plan) {
            parts.put(range.sequenceNumber(), PartState.pending(range));
        }
    }

    public String targetPath() { return targetPath; }
    public long totalSize() { return totalSize; }
    public long chunkSize() { return chunkSize; }
    public int partCount() { return parts.size(); }
    public CancellationSignal cancellation() { return cancellation; }
    UploadSource source() { return source; }

    public synchronized ObjectStoreModels.MultipartSession sessionId() { return handle; }
    public synchronized UploadState state() { return state; }
    public synchronized boolean storeAborted() { return storeAborted; }

    public synchronized PartState part(int sequenceNumber) {
        PartState part = parts.get(sequenceNumber);
        if (part == null) {
            throw new IllegalArgumentException("No part " + sequenceNumber + " in upload of " + targetPath);
        }
        return part;
    }

    /** Snapshot of all parts ordered by sequence number. */
    public synchronized SortedMap<Integer, PartState> parts() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(parts));
    }

    public List<PartRange> plan() {
        synchronized (this) {
            return parts.values().stream().map(PartState::range).toList();
        }
    }

    synchronized void begin(ObjectStoreModels.MultipartSession handle) {
        requireState(UploadState.INITIALIZING);
        this.handle = Objects.requireNonNull(handle);
        this.state = UploadState.UPLOADING;
    }

    synchronized PartState markInFlight(int sequenceNumber) {
        requireState(UploadState.UPLOADING);
        PartState next = part(sequenceNumber).inFlight();
        parts.put(sequenceNumber, next);
        return next;
    }

    synchronized void markCommitted(int sequenceNumber, String eTag) {
        parts.put(sequenceNumber, part(sequenceNumber).committed(eTag));
    }

    synchronized void markPartFailed(int sequenceNumber) {
        parts.put(sequenceNumber, part(sequenceNumber).failed());
        fail();
    }

    synchronized void fail() {
        if (state != UploadState.COMPLETED && state != UploadState.ABORTED) {
            state = UploadState.FAILED;
        }
    }

    /**
     * Moves to COMPLETING if, and only if, every part is committed. A FAILED session still
     * reports its uncommitted parts.
     *
     * @return the ordered sequence-number to ETag mapping to hand to the store
     * @throws IncompletePartsException if any part is not committed
     * @throws IllegalStateException if the upload is completing, completed, aborting or aborted
     */
    synchronized List<ObjectStoreModels.CompletedPart> beginCompletion() {
        if (state != UploadState.UPLOADING && state != UploadState.FAILED) {
            throw new IllegalStateException("Upload of " + targetPath + " is " + state + ", cannot complete");
        }
        List<Integer> incomplete = new ArrayList<>();
        List<ObjectStoreModels.CompletedPart> completed = new ArrayList<>(parts.size());
        for (PartState part : parts.values()) {
            if (part.status() == PartStatus.COMMITTED) {
                completed.add(new ObjectStoreModels.CompletedPart(part.range().sequenceNumber(), part.eTag()));
            } else {
                incomplete.add(part.range().sequenceNumber());
            }
        }
        if (!incomplete.isEmpty()) {
            throw new IncompletePartsException(targetPath, incomplete);
        }
        requireState(UploadState.UPLOADING);
        state = UploadState.COMPLETING;
        return completed;
    }

    synchronized void completed() {
        requireState(UploadState.COMPLETING);
        state = UploadState.COMPLETED;
    }

    /**
     * @return true if the caller must tell the store to discard the upload, false if there is
     *         nothing left to do (already aborted, aborting, or never initiated)
     */
    synchronized boolean beginAbort() {
        switch (state) {
            case COMPLETED, COMPLETING ->
                    throw new IllegalStateException("Cannot abort " + targetPath + " in state " + state);
            case ABORTED, ABORTING -> {
                return false;
            }
            case INITIALIZING -> {
                state = UploadState.ABORTED;
                return false;
            }
            case UPLOADING -> {
                state = UploadState.ABORTING;
                return true;
            }
            case FAILED -> {
                return handle != null && !storeAborted;
            }
            default -> throw new IllegalStateException("Unknown state " + state);
        }
    }

    synchronized void aborted() {
        storeAborted = true;
        if (state == UploadState.ABORTING) {
            state = UploadState.ABORTED;
        }
    }

    synchronized void abortFailed() {
        state = UploadState.FAILED;
    }

    private void requireState(UploadState expected) {
        if (state != expected) {
            throw new IllegalStateException("Upload of " + targetPath + " is " + state + ", expected " + expected);
        }
    }

    @Override
    public synchronized String toString() {
        return "UploadSession{" + targetPath + ", state=" + state + ", parts=" + parts.size() + "}";
    }
}
