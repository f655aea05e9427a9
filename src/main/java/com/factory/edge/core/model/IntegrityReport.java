package com.factory.edge.core.model;

import java.util.List;

/**
 * Outcome of walking the hash chain.
 *
 * <p>Violations are reported, never repaired: the journal must not rewrite
 * history on its own.</p>
 */
public record IntegrityReport(boolean valid, long checked, List<IntegrityViolation> violations) {

    public IntegrityReport {
        violations = List.copyOf(violations);
    }

    public static IntegrityReport of(long checked, List<IntegrityViolation> violations) {
        return new IntegrityReport(violations.isEmpty(), checked, violations);
    }

    /** Distinct local ids with at least one violation, ascending. */
    public List<Long> invalidIds() {
        return violations.stream().map(IntegrityViolation::localId).distinct().sorted().toList();
    }

    /**
     * A single chain defect.
     *
     * @param localId the offending row
     * @param eventId its producer id, for cross-referencing with the remote side
     * @param kind    what failed
     */
    public record IntegrityViolation(long localId, String eventId, Kind kind) {

        public String describe() {
            return switch (kind) {
                case SIGNATURE_MISMATCH -> "Event " + localId + " has invalid signature";
                case CHAIN_BROKEN -> "Event " + localId + " has broken chain";
            };
        }
    }

    public enum Kind {
        /** Recomputed signature differs from the stored one: signed fields were altered. */
        SIGNATURE_MISMATCH,
        /** Stored previous signature differs from the preceding row: insertion, deletion or reordering. */
        CHAIN_BROKEN
    }
}
