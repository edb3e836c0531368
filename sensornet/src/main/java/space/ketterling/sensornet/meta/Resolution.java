package space.ketterling.sensornet.meta;

import space.ketterling.sensornet.model.MetaRecord;

import java.util.List;

/**
 * Outcome of one resolution step: either the resolved records or the
 * empty-resolution error explaining why there are none.
 */
public final class Resolution<T extends MetaRecord> {
    private final List<T> records;
    private final EmptyResolutionException error;

    private Resolution(List<T> records, EmptyResolutionException error) {
        this.records = records;
        this.error = error;
    }

    public static <T extends MetaRecord> Resolution<T> resolved(List<T> records) {
        if (records == null || records.isEmpty())
            throw new IllegalArgumentException("resolved records must not be empty");
        return new Resolution<>(List.copyOf(records), null);
    }

    public static <T extends MetaRecord> Resolution<T> empty(EmptyResolutionException error) {
        return new Resolution<>(List.of(), error);
    }

    public boolean isResolved() {
        return error == null;
    }

    /**
     * Resolved records; empty when this resolution failed.
     */
    public List<T> records() {
        return records;
    }

    public EmptyResolutionException error() {
        return error;
    }

    /**
     * Returns the records or throws the empty-resolution error.
     */
    public List<T> orElseThrow() {
        if (error != null)
            throw error;
        return records;
    }
}
