package org.iceforge.cloudstorage.upload;

public record PartState(PartRange range, PartStatus status, String eTag, int attempts) {

    static PartState pending(PartRange range) {
        return new PartState(range, PartStatus.PENDING, null, 0);
    }

    PartState inFlight() {
        return new PartState(range, PartStatus.IN_FLIGHT, eTag, attempts + 1);
    }

    PartState committed(String eTag) {
        return new PartState(range, PartStatus.COMMITTED, eTag, attempts);
    }

    PartState failed() {
        return new PartState(range, PartStatus.FAILED, eTag, attempts);
    }
}
