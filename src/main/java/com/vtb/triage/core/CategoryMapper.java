package com.vtb.triage.core;

import com.vtb.triage.models.RawFinding;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Определение категории (CWE) находки.
 * 
 * Порядок: CWE из подсказки инструмента, затем таблица ключевых слов
 * по rule id и сообщению, иначе {@link #UNCATEGORIZED}.
 */
public class CategoryMapper {
    
    public static final String UNCATEGORIZED = "UNCATEGORIZED";
    
    // "CWE-89: Improper...", "89", "cwe_89"
    private static final Pattern CWE_PATTERN = Pattern.compile("(?i)(?:cwe[-_ ]?)?(\\d{1,5})");
    
    private final Map<String, String> keywords;
    
    public CategoryMapper(Map<String, String> keywords) {
        this.keywords = new LinkedHashMap<>();
        if (keywords != null) {
            keywords.forEach((k, v) -> this.keywords.put(k.toLowerCase(Locale.ROOT), v));
        }
    }
    
    public String categorize(RawFinding finding) {
        String fromHint = normalizeCwe(finding.getCategoryHint());
        if (fromHint != null) {
            return fromHint;
        }
        
        String haystack = ((finding.getRuleId() != null ? finding.getRuleId() : "") + " "
            + (finding.getMessage() != null ? finding.getMessage() : "")).toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : keywords.entrySet()) {
            if (haystack.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return UNCATEGORIZED;
    }
    
    /**
     * Привести CWE к виду "CWE-n". Null, если номер не найден.
     */
    public static String normalizeCwe(String hint) {
        if (hint == null || hint.isBlank()) {
            return null;
        }
        Matcher matcher = CWE_PATTERN.matcher(hint);
        if (!matcher.find()) {
            return null;
        }
        int id = Integer.parseInt(matcher.group(1));
        return id > 0 ? "CWE-" + id : null;
    }
}
