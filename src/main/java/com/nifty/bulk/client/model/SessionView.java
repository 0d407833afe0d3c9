package com.nifty.bulk.client.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nifty.bulk.client.enums.SessionEndReason;
import com.nifty.bulk.client.enums.SessionRole;
import com.nifty.bulk.client.enums.SessionState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * What the view layer sees of the session. Never carries the bearer token.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionView {
    SessionState state;
    String principalId;
    String displayName;
    SessionRole role;
    Instant tokenExpiresAt;
    SessionEndReason endReason;
    String notice;

    public static SessionView of(Session s, SessionState state) {
        return SessionView.builder()
                .state(state)
                .principalId(s.getPrincipalId())
                .displayName(s.getDisplayName())
                .role(s.getRole())
                .tokenExpiresAt(s.getTokenExpiryInstant())
                .build();
    }

    public static SessionView ended(SessionState state, SessionEndReason reason) {
        return SessionView.builder()
                .state(state)
                .endReason(reason)
                .notice(reason == null ? null : reason.getNotice())
                .build();
    }
}
