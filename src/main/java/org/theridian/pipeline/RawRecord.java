package org.theridian.pipeline;

/**
 * Row produced by the extract stage. Fields are nullable so the clean stage has something to drop.
 */
public record RawRecord(Long id, String name, Long value, String status) {

    public boolean isComplete() {
        return id != null && name != null && value != null && status != null;
    }
}
