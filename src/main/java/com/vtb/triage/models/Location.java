package com.vtb.triage.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Место находки в исходном коде
 */
@Value
@Builder
@Jacksonized
public class Location {
    String file;
    int lineStart;
    int lineEnd;
    Integer column;
    String snippet;
}
