package com.vtb.triage.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Короткое объяснение находки в формате What / Why / How
 */
@Value
@Builder
@Jacksonized
public class Explanation {
    String what;
    String whyItMatters;
    /** Только для TRUE_POSITIVE */
    String howToExploit;
    String howToFix;
}
