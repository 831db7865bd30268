package com.profileplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Read-only per-user snapshot assembled by the caller from the message,
 * membership and feature stores. The engine only reads it.
 *
 * <p>Null lists become empty lists and null list elements are dropped, so a
 * sparsely populated input is always safe to score.
 */
public record UserInferenceInput(
    @JsonProperty("userId")            long userId,
    @JsonProperty("displayName")       String displayName,
    @JsonProperty("bio")               String bio,
    @JsonProperty("memberGroupKinds")  List<GroupKind> memberGroupKinds,
    @JsonProperty("messageTexts")      List<String> messageTexts,

    // ── aggregate counters ───────────────────────────────────────────────────
    @JsonProperty("totalMsgCount")     int totalMsgCount,
    @JsonProperty("totalReplyCount")   int totalReplyCount,
    @JsonProperty("totalMentionCount") int totalMentionCount,
    @JsonProperty("avgMsgLen")         double avgMsgLen,
    @JsonProperty("bdGroupMsgShare")   double bdGroupMsgShare,
    @JsonProperty("groupsActiveCount") int groupsActiveCount
) {
    public UserInferenceInput {
        memberGroupKinds = memberGroupKinds == null ? List.of()
            : memberGroupKinds.stream().filter(Objects::nonNull).toList();
        messageTexts = messageTexts == null ? List.of()
            : messageTexts.stream().filter(Objects::nonNull).toList();
    }

    /** Text-only input with zeroed counters. */
    public static UserInferenceInput of(long userId, String displayName, String bio,
                                        List<GroupKind> memberGroupKinds,
                                        List<String> messageTexts) {
        return new UserInferenceInput(userId, displayName, bio, memberGroupKinds, messageTexts,
            messageTexts == null ? 0 : messageTexts.size(), 0, 0, 0.0, 0.0, 0);
    }

    public boolean hasBio() {
        return bio != null && !bio.isBlank();
    }

    public boolean hasDisplayName() {
        return displayName != null && !displayName.isBlank();
    }
}
