package com.vtb.triage.core;

import com.vtb.triage.config.EngineConfig;
import com.vtb.triage.models.RawFinding;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CategoryMapperTest {
    
    private final CategoryMapper mapper = new CategoryMapper(EngineConfig.defaults().getCategoryMapping());
    
    @Test
    void toolHintWins() {
        assertEquals("CWE-89", mapper.categorize(finding("xss-rule", "msg", "CWE-89: Improper Neutralization")));
        assertEquals("CWE-78", mapper.categorize(finding("r", "m", "78")));
        assertEquals("CWE-22", mapper.categorize(finding("r", "m", "cwe_22")));
    }
    
    @Test
    void keywordsFromRuleAndMessage() {
        assertEquals("CWE-79", mapper.categorize(finding("python.django.xss-template", "", null)));
        assertEquals("CWE-327", mapper.categorize(finding("B303", "Use of insecure MD5 hash", null)));
        assertEquals("CWE-502", mapper.categorize(finding("B301", "Pickle can be unsafe", null)));
    }
    
    @Test
    void unknownIsUncategorized() {
        assertEquals(CategoryMapper.UNCATEGORIZED, mapper.categorize(finding("B101", "assert used", "not-a-cwe")));
    }
    
    @Test
    void normalizeCwe() {
        assertEquals("CWE-798", CategoryMapper.normalizeCwe("CWE-798"));
        assertNull(CategoryMapper.normalizeCwe("CWE-0"));
        assertNull(CategoryMapper.normalizeCwe(" "));
    }
    
    private static RawFinding finding(String rule, String message, String hint) {
        return RawFinding.builder().tool("t").ruleId(rule).message(message).categoryHint(hint).build();
    }
}
