package com.vtb.triage.engine;

import com.vtb.triage.models.Classification;
import com.vtb.triage.models.UnifiedFinding;

/**
 * Классификатор находок (TP / FP / требует проверки)
 */
public interface FindingClassifier {
    
    /**
     * Идентификатор, который попадает в {@link Classification#getClassifierId()}
     */
    String id();
    
    boolean supports(UnifiedFinding finding);
    
    Classification classify(UnifiedFinding finding);
}
