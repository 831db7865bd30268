package com.profileplatform.common.inference;

import com.profileplatform.common.config.GatingPolicy;
import com.profileplatform.common.model.ScoredLabel;

import java.util.Locale;

/**
 * Decides whether a dimension's top-ranked label may be emitted.
 *
 * <p>Evaluated in order:
 * <ol>
 *   <li>non-membership evidence count &lt; {@code minNonMembershipEvidence} → gated</li>
 *   <li>probability &lt; {@code minClaimConfidence} → gated</li>
 *   <li>otherwise → accepted</li>
 * </ol>
 * Stricter thresholds can only gate more, never less.
 */
public final class EvidenceGate {

    private EvidenceGate() {}

    public enum Reason {
        INSUFFICIENT_EVIDENCE("insufficient_evidence"),
        LOW_CONFIDENCE("low_confidence");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    /**
     * @param accepted true when the label may be claimed
     * @param reason   why it was refused; null when accepted
     * @param note     human-readable gating note; null when accepted
     */
    public record Decision(boolean accepted, Reason reason, String note) {

        static Decision accept() {
            return new Decision(true, null, null);
        }
    }

    /**
     * @param dimension {@code "role"} or {@code "intent"}, used as the note prefix
     * @param top       top-ranked label of the dimension
     * @param label     wire label of {@code top}
     */
    public static Decision evaluate(String dimension, ScoredLabel<?> top, String label, GatingPolicy policy) {
        long nonMembership = top.nonMembershipEvidenceCount();
        if (nonMembership < policy.minNonMembershipEvidence()) {
            return new Decision(false, Reason.INSUFFICIENT_EVIDENCE, String.format(Locale.ROOT,
                "%s:%s GATED — only %d non-membership evidence (need ≥%d)",
                dimension, label, nonMembership, policy.minNonMembershipEvidence()));
        }
        if (top.probability() < policy.minClaimConfidence()) {
            return new Decision(false, Reason.LOW_CONFIDENCE, String.format(Locale.ROOT,
                "%s:%s GATED — confidence %.3f < threshold %s",
                dimension, label, top.probability(), policy.minClaimConfidence()));
        }
        return Decision.accept();
    }

    /**
     * Recovers the reason from a gating note produced by {@link #evaluate}.
     * Unrecognized notes map to {@link Reason#INSUFFICIENT_EVIDENCE}.
     */
    public static Reason reasonOf(String note) {
        if (note != null && note.contains("GATED — confidence")) {
            return Reason.LOW_CONFIDENCE;
        }
        return Reason.INSUFFICIENT_EVIDENCE;
    }
}
