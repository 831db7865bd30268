package com.profileplatform.common.inference;

import com.profileplatform.common.affiliation.AffiliationCollector;
import com.profileplatform.common.affiliation.OrgCandidateValidator;
import com.profileplatform.common.config.InferenceConfig;
import com.profileplatform.common.model.EvidenceRow;
import com.profileplatform.common.model.EvidenceType;
import com.profileplatform.common.model.GroupKind;
import com.profileplatform.common.model.Intent;
import com.profileplatform.common.model.OrgTypeResult;
import com.profileplatform.common.model.Role;
import com.profileplatform.common.model.ScoredLabel;
import com.profileplatform.common.model.UserInferenceInput;
import com.profileplatform.common.model.UserInferenceResult;
import com.profileplatform.common.signal.AffiliationSignal;
import com.profileplatform.common.signal.KeywordSignal;
import com.profileplatform.common.signal.OrgTypeSignal;
import com.profileplatform.common.signal.SignalDictionaries;
import com.profileplatform.common.signal.SignalMatcher;
import com.profileplatform.common.signal.SignalTags;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic, explainable role / intent scorer.
 *
 * <h3>Pipeline per user</h3>
 * <ol>
 *   <li><strong>Priors</strong>: one membership evidence row per prior entry
 *       of every group kind the user belongs to.</li>
 *   <li><strong>Bio</strong>: keyword rules, then affiliation capture.</li>
 *   <li><strong>Display name</strong>: keyword rules, business-developer and
 *       selling-language overrides, affiliation capture, org-type detection.</li>
 *   <li><strong>Messages</strong>: first {@value #MESSAGE_SAMPLE_CAP} texts,
 *       hit counts per rule, log-scaled evidence; affiliation self-declarations
 *       in the first {@value #AFFILIATION_SCAN_CAP}.</li>
 *   <li><strong>Cross-signal overrides</strong>: vendor affiliation boost,
 *       directory / marketplace override.</li>
 *   <li><strong>Features</strong>: reply ratio, mention count, groups active.</li>
 *   <li><strong>Softmax and ranking</strong> per dimension.</li>
 *   <li><strong>Gating</strong>: see {@link EvidenceGate}.</li>
 * </ol>
 *
 * <p>Every score change is recorded as exactly one {@link EvidenceRow}, so a
 * label's score always equals the sum of its evidence weights.
 *
 * <p>No Spring dependencies. No I/O. Instances are immutable and safe to share
 * across threads.
 */
public final class InferenceEngine {

    /** Messages beyond this index are ignored entirely. */
    public static final int MESSAGE_SAMPLE_CAP = 200;

    /** Only the earliest messages are scanned for self-declared affiliations. */
    public static final int AFFILIATION_SCAN_CAP = 50;

    static final double BUSINESS_DEVELOPER_BOOST   = 4.0;
    static final double BUSINESS_DEVELOPER_PENALTY = -3.0;
    static final double SELLING_LANGUAGE_BOOST     = 3.5;
    static final double VENDOR_AFFILIATION_BOOST   = 4.0;
    static final double DIRECTORY_OVERRIDE_BOOST   = 6.0;

    static final int    REPLY_RATIO_MIN_MESSAGES = 8;
    static final double REPLY_RATIO_THRESHOLD    = 0.4;
    static final double REPLY_RATIO_WEIGHT       = 0.7;
    static final int    MENTION_COUNT_THRESHOLD  = 3;
    static final int    GROUPS_ACTIVE_THRESHOLD  = 3;
    static final double NETWORKING_FEATURE_WEIGHT = 1.0;

    private static final EvidenceRow DIRECTORY_OVERRIDE =
        EvidenceRow.of(EvidenceType.MESSAGE, SignalTags.MSG_DIRECTORY_OVERRIDE, DIRECTORY_OVERRIDE_BOOST);

    private final SignalDictionaries dictionaries;
    private final OrgCandidateValidator validator;

    public InferenceEngine(SignalDictionaries dictionaries) {
        this.dictionaries = Objects.requireNonNull(dictionaries, "dictionaries");
        this.validator    = new OrgCandidateValidator(dictionaries.orgCandidateRules());
    }

    public static InferenceEngine defaults() {
        return new InferenceEngine(SignalDictionaries.defaults());
    }

    public SignalDictionaries dictionaries() {
        return dictionaries;
    }

    /**
     * Scores one user against one config.
     *
     * @return never null; claims are null where gating refused to emit
     * @throws NullPointerException if {@code input} or {@code config} is null
     */
    public UserInferenceResult scoreUser(UserInferenceInput input, InferenceConfig config) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(config, "config");

        LabelScoreboard<Role> roles     = new LabelScoreboard<>(Role.class, Role.UNKNOWN);
        LabelScoreboard<Intent> intents = new LabelScoreboard<>(Intent.class, Intent.UNKNOWN);
        AffiliationCollector affiliations = new AffiliationCollector();
        List<OrgTypeResult> orgTypes = new ArrayList<>();

        applyPriors(input, config, roles, intents);
        if (input.hasBio()) {
            applyBio(input.bio(), roles, intents, affiliations);
        }
        if (input.hasDisplayName()) {
            applyDisplayName(input.displayName(), roles, affiliations, orgTypes);
        }
        applyMessages(input.messageTexts(), roles, intents, affiliations);
        applyFeatures(input, intents);

        List<ScoredLabel<Role>> rankedRoles     = roles.rank();
        List<ScoredLabel<Intent>> rankedIntents = intents.rank();

        List<String> gatingNotes = new ArrayList<>();
        ScoredLabel<Role> roleClaim = gate("role", rankedRoles, config, gatingNotes);
        ScoredLabel<Intent> intentClaim = gate("intent", rankedIntents, config, gatingNotes);

        return new UserInferenceResult(input.userId(), roleClaim, intentClaim,
            affiliations.results(), orgTypes, gatingNotes, rankedRoles, rankedIntents);
    }

    // ── 1. priors ──────────────────────────────────────────────────────────

    private static void applyPriors(UserInferenceInput input, InferenceConfig config,
                                    LabelScoreboard<Role> roles, LabelScoreboard<Intent> intents) {
        for (GroupKind kind : input.memberGroupKinds()) {
            String ref = "membership:group_kind:" + kind.label();
            for (Map.Entry<Role, Double> prior : config.rolePriorsFor(kind).entrySet()) {
                roles.add(prior.getKey(), EvidenceRow.of(EvidenceType.MEMBERSHIP, ref, prior.getValue()));
            }
            for (Map.Entry<Intent, Double> prior : config.intentPriorsFor(kind).entrySet()) {
                intents.add(prior.getKey(), EvidenceRow.of(EvidenceType.MEMBERSHIP, ref, prior.getValue()));
            }
        }
    }

    // ── 2. bio ─────────────────────────────────────────────────────────────

    private void applyBio(String bio, LabelScoreboard<Role> roles, LabelScoreboard<Intent> intents,
                          AffiliationCollector affiliations) {
        for (KeywordSignal<Role> kw : SignalMatcher.matching(dictionaries.bioRoleSignals(), bio)) {
            roles.add(kw.label(), EvidenceRow.of(EvidenceType.BIO, "bio:" + kw.tag(), kw.weight()));
        }
        for (KeywordSignal<Intent> kw : SignalMatcher.matching(dictionaries.bioIntentSignals(), bio)) {
            intents.add(kw.label(), EvidenceRow.of(EvidenceType.BIO, "bio:" + kw.tag(), kw.weight()));
        }

        for (AffiliationSignal aff : dictionaries.bioAffiliationPatterns()) {
            AffiliationSignal.Capture capture = aff.capture(bio);
            if (capture == null) continue;
            String company = validator.validate(capture.raw());
            if (company != null) {
                affiliations.offer(company, EvidenceType.BIO, aff.tag());
            }
        }
    }

    // ── 3. display name ────────────────────────────────────────────────────

    private void applyDisplayName(String dn, LabelScoreboard<Role> roles,
                                  AffiliationCollector affiliations, List<OrgTypeResult> orgTypes) {
        for (KeywordSignal<Role> kw : SignalMatcher.matching(dictionaries.displayNameRoleSignals(), dn)) {
            roles.add(kw.label(), EvidenceRow.of(EvidenceType.DISPLAY_NAME, "display_name:" + kw.tag(), kw.weight()));
        }

        SignalDictionaries.DisplayNameOverrides overrides = dictionaries.displayNameOverrides();

        // "Business Developer" is bd; cancel the builder weight its "Developer" word attracts
        if (overrides.businessDeveloper().matcher(dn).find()) {
            roles.add(Role.BD, EvidenceRow.of(EvidenceType.DISPLAY_NAME,
                SignalTags.DN_BUSINESS_DEVELOPER_OVERRIDE, BUSINESS_DEVELOPER_BOOST));
            roles.add(Role.BUILDER, EvidenceRow.of(EvidenceType.DISPLAY_NAME,
                SignalTags.DN_BUSINESS_DEVELOPER_BLOCK, BUSINESS_DEVELOPER_PENALTY));
        }

        if (overrides.sellingLanguage().matcher(dn).find()) {
            roles.add(Role.VENDOR_AGENCY, EvidenceRow.of(EvidenceType.DISPLAY_NAME,
                SignalTags.DN_SELLING_LANGUAGE, SELLING_LANGUAGE_BOOST));
        }

        for (AffiliationSignal aff : dictionaries.displayNameAffiliationPatterns()) {
            AffiliationSignal.Capture capture = aff.capture(dn);
            if (capture == null) continue;

            if (SignalTags.DN_AFFILIATION_PIPE.equals(aff.tag())) {
                // handled by the "@" pattern, or a title segment rather than a company
                if (capture.fullMatch().contains("@")) continue;
                if (overrides.pipeTitleSegment().matcher(capture.fullMatch()).find()) continue;
            }

            String raw = overrides.titlePrefix().matcher(capture.raw().trim()).replaceFirst("").trim();
            String company = validator.validate(raw);
            if (company != null) {
                affiliations.offer(company, EvidenceType.DISPLAY_NAME, aff.tag());
            }
        }

        for (OrgTypeSignal ots : dictionaries.orgTypeSignals()) {
            if (!ots.matches(dn)) continue;
            boolean seen = orgTypes.stream().anyMatch(o -> o.orgType() == ots.orgType());
            if (!seen) {
                orgTypes.add(new OrgTypeResult(ots.orgType(), EvidenceType.DISPLAY_NAME, ots.tag()));
            }
        }
    }

    // ── 4-5. messages and cross-signal overrides ───────────────────────────

    private void applyMessages(List<String> texts, LabelScoreboard<Role> roles,
                               LabelScoreboard<Intent> intents, AffiliationCollector affiliations) {
        List<String> sample = texts.subList(0, Math.min(texts.size(), MESSAGE_SAMPLE_CAP));
        if (sample.isEmpty()) return;

        int scanned = Math.min(sample.size(), AFFILIATION_SCAN_CAP);
        for (int i = 0; i < scanned; i++) {
            scanMessageAffiliation(sample.get(i), affiliations);
        }

        List<KeywordSignal<Role>> roleRules = dictionaries.messageRoleSignals();
        int[] roleHits = SignalMatcher.tally(roleRules, sample);
        boolean vendorHit = false;
        boolean directoryHit = false;
        for (int r = 0; r < roleRules.size(); r++) {
            int count = roleHits[r];
            if (count == 0) continue;
            KeywordSignal<Role> kw = roleRules.get(r);
            roles.add(kw.label(), messageEvidence(kw, count));
            if (kw.label() == Role.VENDOR_AGENCY) {
                vendorHit = true;
            }
            if (SignalTags.VENDOR_DIRECTORY.equals(kw.tag()) || SignalTags.VENDOR_MARKETPLACE.equals(kw.tag())) {
                directoryHit = true;
            }
        }

        // self-declared company plus selling language: representing that company as a vendor
        if (vendorHit && affiliations.hasSource(EvidenceType.MESSAGE)) {
            roles.add(Role.VENDOR_AGENCY, EvidenceRow.of(EvidenceType.MESSAGE,
                SignalTags.MSG_VENDOR_AFFILIATION_BOOST, VENDOR_AFFILIATION_BOOST));
        }

        // directory / marketplace operators are not doing bd
        if (directoryHit) {
            roles.clear(Role.BD);
            roles.add(Role.VENDOR_AGENCY, DIRECTORY_OVERRIDE);
        }

        List<KeywordSignal<Intent>> intentRules = dictionaries.messageIntentSignals();
        int[] intentHits = SignalMatcher.tally(intentRules, sample);
        for (int r = 0; r < intentRules.size(); r++) {
            if (intentHits[r] == 0) continue;
            KeywordSignal<Intent> kw = intentRules.get(r);
            intents.add(kw.label(), messageEvidence(kw, intentHits[r]));
        }
    }

    private void scanMessageAffiliation(String text, AffiliationCollector affiliations) {
        for (Pattern reject : dictionaries.messageAffiliationRejectPatterns()) {
            if (reject.matcher(text).find()) return;
        }
        for (AffiliationSignal aff : dictionaries.messageAffiliationPatterns()) {
            AffiliationSignal.Capture capture = aff.capture(text);
            if (capture == null) continue;
            // "@someone ... from X" introduces a third party
            if (text.substring(0, capture.matchStart()).contains("@")) continue;
            String company = validator.validate(capture.raw());
            if (company != null) {
                affiliations.offer(company, EvidenceType.MESSAGE, aff.tag());
            }
        }
    }

    /** {@code weight × log2(1 + count)}, kept unrounded. */
    private static EvidenceRow messageEvidence(KeywordSignal<?> kw, int count) {
        double scaled = kw.weight() * (Math.log1p(count) / Math.log(2));
        return EvidenceRow.of(EvidenceType.MESSAGE, "msg:" + kw.tag() + ":count=" + count, scaled);
    }

    // ── 6. features ────────────────────────────────────────────────────────

    private static void applyFeatures(UserInferenceInput input, LabelScoreboard<Intent> intents) {
        if (input.totalMsgCount() >= REPLY_RATIO_MIN_MESSAGES) {
            double replyRatio = (double) input.totalReplyCount() / input.totalMsgCount();
            if (replyRatio > REPLY_RATIO_THRESHOLD) {
                intents.add(Intent.SUPPORT_GIVING, EvidenceRow.of(EvidenceType.FEATURE,
                    String.format(Locale.ROOT, "feature:reply_ratio=%.2f", replyRatio), REPLY_RATIO_WEIGHT));
            }
        }
        if (input.totalMentionCount() >= MENTION_COUNT_THRESHOLD) {
            intents.add(Intent.NETWORKING, EvidenceRow.of(EvidenceType.FEATURE,
                "feature:mention_count=" + input.totalMentionCount(), NETWORKING_FEATURE_WEIGHT));
        }
        if (input.groupsActiveCount() >= GROUPS_ACTIVE_THRESHOLD) {
            intents.add(Intent.NETWORKING, EvidenceRow.of(EvidenceType.FEATURE,
                "feature:groups_active=" + input.groupsActiveCount(), NETWORKING_FEATURE_WEIGHT));
        }
    }

    // ── 8. gating ──────────────────────────────────────────────────────────

    private static <L extends Enum<L>> ScoredLabel<L> gate(String dimension, List<ScoredLabel<L>> ranked,
                                                           InferenceConfig config, List<String> notes) {
        if (ranked.isEmpty()) return null;
        ScoredLabel<L> top = ranked.get(0);
        EvidenceGate.Decision decision = EvidenceGate.evaluate(dimension, top, labelOf(top.label()), config.gating());
        if (decision.accepted()) return top;
        notes.add(decision.note());
        return null;
    }

    private static String labelOf(Enum<?> label) {
        if (label instanceof Role role) return role.label();
        if (label instanceof Intent intent) return intent.label();
        return label.name().toLowerCase(Locale.ROOT);
    }
}
