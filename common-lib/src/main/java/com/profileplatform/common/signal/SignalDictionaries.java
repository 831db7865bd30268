package com.profileplatform.common.signal;

import com.profileplatform.common.model.Intent;
import com.profileplatform.common.model.OrgType;
import com.profileplatform.common.model.Role;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import static com.profileplatform.common.signal.KeywordSignal.caseSensitive;
import static com.profileplatform.common.signal.KeywordSignal.of;

/**
 * Immutable, versioned rule set for every text source the engine reads.
 *
 * <h3>Dictionaries</h3>
 * <ul>
 *   <li>bio → role, bio → intent</li>
 *   <li>display name → role</li>
 *   <li>message → role, message → intent (tallied across the message sample)</li>
 *   <li>affiliation capture for bio, display name and message</li>
 *   <li>org-type patterns (display name)</li>
 *   <li>message-affiliation reject patterns (third-person intros, questions)</li>
 *   <li>org-candidate cleaning rules and reject lists ({@link OrgCandidateRules})</li>
 * </ul>
 *
 * <p>Rules are conservative: a missed signal is preferred over a hallucinated one.
 * Weights are additive on top of priors. Rule order never changes a score, but
 * it does fix the order of evidence rows in the output.
 *
 * <p>Built once and shared by reference; safe for concurrent use.
 */
public final class SignalDictionaries {

    public static final String DEFAULT_VERSION = "v0.5.1";

    private static final SignalDictionaries DEFAULT = buildDefault();

    private final String version;
    private final List<KeywordSignal<Role>> bioRoleSignals;
    private final List<KeywordSignal<Intent>> bioIntentSignals;
    private final List<KeywordSignal<Role>> displayNameRoleSignals;
    private final List<KeywordSignal<Role>> messageRoleSignals;
    private final List<KeywordSignal<Intent>> messageIntentSignals;
    private final List<AffiliationSignal> bioAffiliationPatterns;
    private final List<AffiliationSignal> displayNameAffiliationPatterns;
    private final List<AffiliationSignal> messageAffiliationPatterns;
    private final List<Pattern> messageAffiliationRejectPatterns;
    private final List<OrgTypeSignal> orgTypeSignals;
    private final DisplayNameOverrides displayNameOverrides;
    private final OrgCandidateRules orgCandidateRules;

    public SignalDictionaries(String version,
                              List<KeywordSignal<Role>> bioRoleSignals,
                              List<KeywordSignal<Intent>> bioIntentSignals,
                              List<KeywordSignal<Role>> displayNameRoleSignals,
                              List<KeywordSignal<Role>> messageRoleSignals,
                              List<KeywordSignal<Intent>> messageIntentSignals,
                              List<AffiliationSignal> bioAffiliationPatterns,
                              List<AffiliationSignal> displayNameAffiliationPatterns,
                              List<AffiliationSignal> messageAffiliationPatterns,
                              List<Pattern> messageAffiliationRejectPatterns,
                              List<OrgTypeSignal> orgTypeSignals,
                              DisplayNameOverrides displayNameOverrides,
                              OrgCandidateRules orgCandidateRules) {
        this.version                          = Objects.requireNonNull(version, "version");
        this.bioRoleSignals                   = List.copyOf(bioRoleSignals);
        this.bioIntentSignals                 = List.copyOf(bioIntentSignals);
        this.displayNameRoleSignals           = List.copyOf(displayNameRoleSignals);
        this.messageRoleSignals               = List.copyOf(messageRoleSignals);
        this.messageIntentSignals             = List.copyOf(messageIntentSignals);
        this.bioAffiliationPatterns           = List.copyOf(bioAffiliationPatterns);
        this.displayNameAffiliationPatterns   = List.copyOf(displayNameAffiliationPatterns);
        this.messageAffiliationPatterns       = List.copyOf(messageAffiliationPatterns);
        this.messageAffiliationRejectPatterns = List.copyOf(messageAffiliationRejectPatterns);
        this.orgTypeSignals                   = List.copyOf(orgTypeSignals);
        this.displayNameOverrides             = Objects.requireNonNull(displayNameOverrides, "displayNameOverrides");
        this.orgCandidateRules                = Objects.requireNonNull(orgCandidateRules, "orgCandidateRules");
    }

    public static SignalDictionaries defaults() {
        return DEFAULT;
    }

    public String version()                                   { return version; }
    public List<KeywordSignal<Role>> bioRoleSignals()         { return bioRoleSignals; }
    public List<KeywordSignal<Intent>> bioIntentSignals()     { return bioIntentSignals; }
    public List<KeywordSignal<Role>> displayNameRoleSignals() { return displayNameRoleSignals; }
    public List<KeywordSignal<Role>> messageRoleSignals()     { return messageRoleSignals; }
    public List<KeywordSignal<Intent>> messageIntentSignals() { return messageIntentSignals; }
    public List<AffiliationSignal> bioAffiliationPatterns()   { return bioAffiliationPatterns; }
    public List<AffiliationSignal> displayNameAffiliationPatterns() { return displayNameAffiliationPatterns; }
    public List<AffiliationSignal> messageAffiliationPatterns()     { return messageAffiliationPatterns; }
    public List<Pattern> messageAffiliationRejectPatterns()   { return messageAffiliationRejectPatterns; }
    public List<OrgTypeSignal> orgTypeSignals()               { return orgTypeSignals; }
    public DisplayNameOverrides displayNameOverrides()        { return displayNameOverrides; }
    public OrgCandidateRules orgCandidateRules()              { return orgCandidateRules; }

    /**
     * Fixed-pattern rules applied to the display name ahead of generic scoring,
     * plus the title handling used during display-name affiliation capture.
     *
     * @param businessDeveloper compound "business developer / BizDev" phrase
     * @param sellingLanguage   commercial wording: discounts, % off, packages, services
     * @param pipeTitleSegment  a pipe segment that is a title ("| Head of ..."), not a company
     * @param titlePrefix       leading title stripped from a captured company ("CEO Acme")
     */
    public record DisplayNameOverrides(Pattern businessDeveloper,
                                       Pattern sellingLanguage,
                                       Pattern pipeTitleSegment,
                                       Pattern titlePrefix) {}

    // ── default rule set ───────────────────────────────────────────────────

    private static final String ORG =
        "([A-Z][A-Za-z0-9.]*[A-Za-z0-9](?:\\s+[A-Z][A-Za-z0-9.]*[A-Za-z0-9]){0,3})";

    private static SignalDictionaries buildDefault() {
        int ci = Pattern.CASE_INSENSITIVE;
        return new SignalDictionaries(
            DEFAULT_VERSION,
            bioRoles(),
            bioIntents(),
            displayNameRoles(),
            messageRoles(),
            messageIntents(),
            List.of(
                AffiliationSignal.of("\\b(?:at|@)\\s+([A-Z][A-Za-z0-9]+(?:\\s+[A-Z][A-Za-z0-9]+)*)\\b",
                    "affiliation_at"),
                AffiliationSignal.of("\\b([A-Z][A-Za-z0-9]+(?:\\s+[A-Z][A-Za-z0-9]+)*)\\s+"
                    + "(?i:CEO|CTO|COO|CFO|co-?founder|founder)\\b", "affiliation_title")),
            List.of(
                // "Alice | Acme Labs" or "Alice | Acme Labs BD Lead"
                AffiliationSignal.ignoringCase("\\|\\s*([A-Z][A-Za-z0-9.]+(?:\\s+[A-Z][A-Za-z0-9.]+){0,4}?)"
                    + "(?:\\s+(?:CEO|CTO|COO|CFO|CMO|co-?founder|founder|BD|head|director|VP|lead|manager"
                    + "|engineer|dev|developer|builder|investor|vc|recruiter|growth|sales|marketing|KOL"
                    + "|ambassador|MM|community|mod|admin|research|analyst|operations|ops)\\b|$)",
                    "dn_affiliation_pipe"),
                // "Role @ Company" or "Role at Company"
                AffiliationSignal.ignoringCase("(?:@|\\bat\\b)\\s+([A-Z][A-Za-z0-9.]+(?:\\s+[A-Z][A-Za-z0-9.]+){0,3})",
                    "dn_affiliation_at")),
            List.of(
                AffiliationSignal.of("(?i:\\b(?:i|we)\\s+(?:currently\\s+)?work\\s+(?:at|for|with)\\s+)" + ORG,
                    "msg_affiliation_work"),
                AffiliationSignal.of("(?i:\\b(?:i['\u2019]?m|i\\s+am)\\s+(?:currently\\s+)?"
                    + "(?:working\\s+(?:at|for|with)|with|at|from|part\\s+of)\\s+)" + ORG,
                    "msg_affiliation_self"),
                AffiliationSignal.of("(?i:\\b(?:my\\s+role\\s+at|(?:co-?founder|founder|ceo|cto|coo|cmo|bd"
                    + "|head\\s+of\\s+[a-z]+)\\s+(?:at|of|@))\\s+)" + ORG,
                    "msg_affiliation_title"),
                AffiliationSignal.of("(?i:\\b(?:here\\s+from|we\\s+at|here\\s+at|our\\s+team\\s+at|representing)\\s+)" + ORG,
                    "msg_affiliation_team")),
            List.of(
                // introducing someone else: "welcome @bob", "meet Alice"; "nice to meet you" is not
                Pattern.compile("(?i:\\b(?:adding|added|welcome|welcoming|introducing|meet|please\\s+welcome"
                    + "|say\\s+hi\\s+to|shout\\s*out\\s+to))\\s+(?:@\\w|[A-Z])"),
                Pattern.compile("\\b(?:anyone|anybody|someone|somebody|who['\u2019]s|who\\s+is)\\b"
                    + "[^.!?\\n]*\\b(?:from|at|with|here)\\b", ci),
                Pattern.compile("\\b(?:he|she|they|his|her)\\s+(?:is|are|works?|was)\\s+(?:at|from|with|for)\\b", ci),
                Pattern.compile("\\b(?:are\\s+you|do\\s+you|does\\s+(?:anyone|he|she))\\b[^.!?\\n]*\\?", ci)),
            orgTypes(),
            new DisplayNameOverrides(
                Pattern.compile("\\b(?:business\\s+developer|business\\s+development|bizdev)\\b", ci),
                Pattern.compile("\\b(?:discount|%\\s*off|\\d+%|pricing|packages?|services?|solutions?|agency)\\b", ci),
                Pattern.compile("^\\|\\s*(?:Head|CEO|CTO|COO|CFO|CMO|VP|Director|Lead|Manager|BD)\\s+(?:of|at|for)\\b", ci),
                Pattern.compile("^(?:CEO|CTO|COO|CFO|CMO|VP|Director|Head|Lead|Manager)\\s+", ci)),
            OrgCandidateRules.defaults());
    }

    private static List<KeywordSignal<Role>> bioRoles() {
        return List.of(
            // founder / executive
            of("\\b(ceo|cto|coo|cfo|co-?founder|founder)\\b", Role.FOUNDER_EXEC, 3.0, "founder_title"),
            of("\\b(chief\\s+(executive|technology|operating|financial))\\b", Role.FOUNDER_EXEC, 3.0, "chief_title"),
            of("\\bhead\\s+of\\b", Role.FOUNDER_EXEC, 1.5, "head_of"),

            // builder
            of("\\b(developer|engineer|dev|full[- ]?stack|backend|frontend|solidity)\\b", Role.BUILDER, 2.5, "dev_title"),
            of("\\b(building|shipped|hacking|coding)\\b", Role.BUILDER, 1.5, "builder_verb"),
            of("\\b(rust|typescript|python|golang|smart\\s*contract)\\b", Role.BUILDER, 1.5, "tech_skill"),

            // business development
            of("\\b(bd|biz\\s*dev|business\\s*development|partnerships?)\\b", Role.BD, 2.5, "bd_title"),
            of("\\b(growth|sales\\s*lead|account\\s*exec)\\b", Role.BD, 1.5, "bd_role"),

            // investor / analyst
            of("\\b(investor|vc|venture|fund|analyst|portfolio|lp|gp)\\b", Role.INVESTOR_ANALYST, 2.5, "investor_title"),
            of("\\b(due\\s*diligence|deal\\s*flow|thesis)\\b", Role.INVESTOR_ANALYST, 2.0, "investor_activity"),

            // recruiter
            of("\\b(recruiter|recruiting|talent|headhunter|staffing)\\b", Role.RECRUITER, 2.5, "recruiter_title"),
            of("\\b(hiring\\s*manager|we.re\\s*hiring|open\\s*roles?)\\b", Role.RECRUITER, 1.5, "hiring_signal"),

            // vendor / agency
            of("\\b(agency|consultancy|consulting|vendor|service\\s*provider)\\b", Role.VENDOR_AGENCY, 2.5, "agency_title"),
            of("\\b(white[- ]?label|managed\\s*service|outsourc)", Role.VENDOR_AGENCY, 1.5, "vendor_signal"),

            // media / KOL
            of("\\b(KOL|influencer|ambassador|content\\s*creator)\\b", Role.MEDIA_KOL, 2.5, "kol_title"),
            of("\\b(media|journalist|editor|press|PR\\s*manager)\\b", Role.MEDIA_KOL, 2.0, "media_title"),
            of("\\b(promotion|campaign|social\\s*media)\\b", Role.MEDIA_KOL, 1.5, "media_activity"),

            // market maker
            of("\\b(market\\s*mak|MM\\b|liquidity\\s*provid|trading\\s*desk)", Role.MARKET_MAKER, 2.5, "mm_title"),
            of("\\b(orderbook|spread|depth|OTC)\\b", Role.MARKET_MAKER, 1.5, "mm_signal"),

            // community
            of("\\b(community\\s*(manager|lead)|moderator|admin)\\b", Role.COMMUNITY, 2.5, "community_title"));
    }

    private static List<KeywordSignal<Intent>> bioIntents() {
        return List.of(
            of("\\b(connect|network|meet|intro)\\b", Intent.NETWORKING, 1.5, "networking_bio"),
            of("\\b(evaluat|assess|review|analyz)", Intent.EVALUATING, 1.5, "evaluating_bio"),
            of("\\b(sell|offer|demo|pitch)\\b", Intent.SELLING, 1.5, "selling_bio"),
            of("\\b(hir|recruit|talent)", Intent.HIRING, 1.5, "hiring_bio"),
            of("\\b(help|support|assist|mentor)\\b", Intent.SUPPORT_GIVING, 1.5, "support_giving_bio"));
    }

    // Display names like "Alice | Acme Labs BD Lead" carry strong self-declared role evidence.
    private static List<KeywordSignal<Role>> displayNameRoles() {
        return List.of(
            of("\\b(CEO|CTO|COO|CFO|CMO|co-?founder|founder)\\b", Role.FOUNDER_EXEC, 3.5, "dn_founder_title"),
            of("\\b(head\\s+of|director|VP|managing\\s+partner)\\b", Role.FOUNDER_EXEC, 2.5, "dn_exec_title"),

            of("\\bBD\\b", Role.BD, 3.0, "dn_bd"),
            of("\\b(biz\\s*dev|business\\s*develop|partnerships?\\s*(?:manager|lead|director)?)", Role.BD, 3.0, "dn_bd_title"),
            of("\\b(growth|sales)\\b", Role.BD, 2.0, "dn_bd_role"),

            of("\\b(developer|engineer|dev\\b|full[- ]?stack|backend|frontend|solidity)", Role.BUILDER, 3.0, "dn_dev_title"),
            of("\\b(builder|building|hacker)\\b", Role.BUILDER, 2.0, "dn_builder"),

            of("\\b(investor|vc\\b|venture|capital|fund|analyst|portfolio)", Role.INVESTOR_ANALYST, 3.0, "dn_investor_title"),

            of("\\b(recruiter|recruiting|talent|headhunter|staffing|hiring)\\b", Role.RECRUITER, 3.0, "dn_recruiter_title"),

            of("\\b(agency|consulting|consultant)\\b", Role.VENDOR_AGENCY, 2.5, "dn_agency"),

            of("\\bKOL\\b", Role.MEDIA_KOL, 3.0, "dn_kol"),
            of("\\b(influencer|ambassador|content\\s*creat)", Role.MEDIA_KOL, 3.0, "dn_media_title"),
            of("\\b(marketing|PR\\b|press)", Role.MEDIA_KOL, 2.0, "dn_marketing"),

            // "MM" only in capitals; "mm" is an interjection
            caseSensitive("\\bMM\\b", Role.MARKET_MAKER, 3.0, "dn_mm"),
            of("\\b(market\\s*mak|liquidity)", Role.MARKET_MAKER, 3.0, "dn_mm_title"),

            of("\\b(community|moderator|mod\\b|admin)", Role.COMMUNITY, 2.5, "dn_community"),

            // no dedicated security role: audit work maps to builder
            of("\\b(security|audit|auditor)\\b", Role.BUILDER, 2.0, "dn_security"),
            // research maps to investor_analyst
            of("\\b(research|researcher)\\b", Role.INVESTOR_ANALYST, 2.0, "dn_researcher"));
    }

    private static List<KeywordSignal<Role>> messageRoles() {
        return List.of(
            of("\\b(shipped|deployed|launched|built|refactored|merged)\\b", Role.BUILDER, 1.0, "builder_action"),
            of("\\b(tvl|protocol|smart\\s*contract|mainnet|testnet|defi)\\b", Role.BUILDER, 0.8, "builder_topic"),
            of("\\b(partnership|collab|intro\\s+to|warm\\s+intro|deal)\\b", Role.BD, 1.0, "bd_action"),
            of("\\b(series\\s*[a-d]|raise|fundrais|invest|portfolio)", Role.INVESTOR_ANALYST, 1.0, "investor_topic"),
            of("\\b(evaluating|due\\s*diligence|thesis)\\b", Role.INVESTOR_ANALYST, 1.0, "investor_action"),
            of("\\b(hiring|recruit|talent|open\\s*role|job\\s*posting)", Role.RECRUITER, 1.0, "recruiter_action"),

            of("\\b(KOL|influencer|ambassador|campaign|promotion)\\b", Role.MEDIA_KOL, 1.0, "kol_action"),
            of("\\b(content|thread|tweet|post|article|PR\\b|press)", Role.MEDIA_KOL, 0.6, "media_topic"),

            of("\\b(market\\s*mak|liquidity|spread|orderbook|depth)", Role.MARKET_MAKER, 1.0, "mm_action"),
            of("\\b(CEX|DEX\\s*listing|OTC|trading\\s*pair)\\b", Role.MARKET_MAKER, 0.8, "mm_topic"),

            // vendor / agency selling language
            of("\\b(our\\s+services|we\\s+offer|we\\s+provide|white[- ]?label|audit\\s+report"
                + "|book\\s+a\\s+(?:call|demo)|packages?)\\b", Role.VENDOR_AGENCY, 1.0, "vendor_service_msg"),
            of("\\b(discount|special\\s+(?:offer|price)|limited\\s+slots?)\\b|\\d+%\\s*off\\b",
                Role.VENDOR_AGENCY, 0.8, "vendor_promo_msg"),
            // directory / marketplace operators: these trigger the bd suppression override
            of("\\b(our\\s+directory|the\\s+directory|directory\\s+listing|get\\s+listed"
                + "|list\\s+your\\s+(?:project|company|startup|service))\\b",
                Role.VENDOR_AGENCY, 1.0, SignalTags.VENDOR_DIRECTORY),
            of("\\b(marketplace|vetted\\s+(?:vendors|providers|agencies)"
                + "|match(?:ing)?\\s+(?:projects|buyers)\\s+with)\\b",
                Role.VENDOR_AGENCY, 1.0, SignalTags.VENDOR_MARKETPLACE),

            // moderation activity
            of("\\b(welcome\\s+to\\s+the|read\\s+the\\s+rules|pinned\\s+message|no\\s+spam"
                + "|(?:muted|banned|removed)\\s+for)\\b", Role.COMMUNITY, 1.0, "community_mod_msg"));
    }

    private static List<KeywordSignal<Intent>> messageIntents() {
        return List.of(
            of("\\b(connect|intro|meet\\s*up|let'?s\\s*chat|dm\\s*me)\\b", Intent.NETWORKING, 0.8, "networking_msg"),
            of("\\b(evaluat|assess|compare|review|look\\s*into)", Intent.EVALUATING, 0.8, "evaluating_msg"),
            of("\\b(sell|pitch|demo|offer|pricing|buy)\\b", Intent.SELLING, 0.8, "selling_msg"),
            of("\\b(hiring|recruit|job|open\\s*role|we.re\\s*looking)", Intent.HIRING, 0.8, "hiring_msg"),
            of("\\b(help|stuck|issue|bug|problem|how\\s*do\\s*i)\\b", Intent.SUPPORT_SEEKING, 0.8, "support_seeking_msg"),
            of("\\b(try\\s*this|here.s\\s*how|you\\s*can|solution|fix)\\b", Intent.SUPPORT_GIVING, 0.8, "support_giving_msg"),
            of("\\b(announce|update|ship|launch|release|congrat)", Intent.BROADCASTING, 0.8, "broadcasting_msg"),
            of("\\b(schedule|calendar|call|meeting|calendly)\\b", Intent.EVALUATING, 0.6, "evaluating_schedule"),
            of("\\b(investment|fund|back|series)\\b", Intent.EVALUATING, 0.6, "evaluating_investment"));
    }

    private static List<OrgTypeSignal> orgTypes() {
        return List.of(
            OrgTypeSignal.of("\\b(exchange|CEX|DEX|binance|okx|bybit|kucoin|gate\\.io|mexc|bitget|htx"
                + "|coinbase|kraken)\\b", OrgType.EXCHANGE, "org_exchange"),
            OrgTypeSignal.of("\\b(market\\s*mak\\w*|liquidity\\s*provid\\w*)", OrgType.MARKET_MAKER, "org_market_maker"),
            OrgTypeSignal.caseSensitive("\\bMM\\b", OrgType.MARKET_MAKER, "org_mm"),
            OrgTypeSignal.of("\\b(ventures?|capital|VC|fund)\\b", OrgType.VC_FUND, "org_vc_fund"),
            OrgTypeSignal.of("\\b(agency|studio|consult(?:ing|ancy))\\b", OrgType.AGENCY, "org_agency"),
            OrgTypeSignal.of("\\b(launchpad|IDO|incubator|accelerator)\\b", OrgType.LAUNCHPAD, "org_launchpad"),
            OrgTypeSignal.of("\\b(audits?|auditor|auditing|security)\\b", OrgType.SECURITY_AUDIT, "org_security_audit"),
            OrgTypeSignal.of("\\b(media|news|magazine|podcast|press)\\b", OrgType.MEDIA, "org_media"),
            OrgTypeSignal.of("\\b(rpc|node\\s+provider|oracle|infra(?:structure)?|bridge|validator)\\b",
                OrgType.INFRASTRUCTURE, "org_infrastructure"));
    }
}
