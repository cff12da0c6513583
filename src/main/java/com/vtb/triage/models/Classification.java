package com.vtb.triage.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Результат классификации находки
 */
@Value
@Builder
@Jacksonized
public class Classification {
    Verdict verdict;
    /** Уверенность классификатора, 0..1 */
    double confidence;
    /** Идентификатор классификатора, вынесшего вердикт */
    String classifierId;
    String reasoning;
}
