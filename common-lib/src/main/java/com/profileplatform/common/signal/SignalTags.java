package com.profileplatform.common.signal;

/**
 * Rule tags the engine refers to by name, and the evidence references of the
 * fixed override rules.
 */
public final class SignalTags {

    private SignalTags() {}

    // ── message rule tags that trigger overrides ────────────────────────────
    public static final String VENDOR_DIRECTORY   = "vendor_directory_msg";
    public static final String VENDOR_MARKETPLACE = "vendor_marketplace_msg";

    // ── override evidence references ────────────────────────────────────────
    public static final String DN_BUSINESS_DEVELOPER_OVERRIDE = "display_name:dn_business_developer_override";
    public static final String DN_BUSINESS_DEVELOPER_BLOCK    = "display_name:dn_business_developer_builder_block";
    public static final String DN_SELLING_LANGUAGE            = "display_name:dn_selling_language";
    public static final String MSG_VENDOR_AFFILIATION_BOOST   =
        "msg:vendor_affiliation_boost:message_self_declare+vendor_evidence";
    public static final String MSG_DIRECTORY_OVERRIDE         =
        "msg:directory_override:vendor_directory+marketplace";

    // ── display-name affiliation tags ───────────────────────────────────────
    public static final String DN_AFFILIATION_PIPE = "dn_affiliation_pipe";
}
