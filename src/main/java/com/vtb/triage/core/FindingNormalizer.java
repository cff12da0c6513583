package com.vtb.triage.core;

import com.vtb.triage.models.Confidence;
import com.vtb.triage.models.FindingSource;
import com.vtb.triage.models.Location;
import com.vtb.triage.models.RawFinding;
import com.vtb.triage.models.Severity;
import com.vtb.triage.models.UnifiedFinding;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.TreeSet;

/**
 * RawFinding -> UnifiedFinding
 */
public class FindingNormalizer {
    
    private final CategoryMapper categoryMapper;
    private final FingerprintCalculator fingerprints;
    private final Path root;
    
    public FindingNormalizer(CategoryMapper categoryMapper, FingerprintCalculator fingerprints, Path target) {
        this.categoryMapper = categoryMapper;
        this.fingerprints = fingerprints;
        Path absolute = target.toAbsolutePath().normalize();
        // Для одиночного файла корнем считается его каталог
        this.root = Files.isRegularFile(absolute) && absolute.getParent() != null ? absolute.getParent() : absolute;
    }
    
    public UnifiedFinding normalize(RawFinding raw) {
        String path = FingerprintCalculator.normalizePath(raw.getFilePath(), root);
        String category = categoryMapper.categorize(raw);
        int line = Math.max(raw.getLine(), 0);
        Severity severity = Severity.fromRaw(raw.getRawSeverity());
        
        Location location = Location.builder()
            .file(path)
            .lineStart(line)
            .lineEnd(raw.getEndLine() != null && raw.getEndLine() >= line ? raw.getEndLine() : line)
            .column(raw.getColumn())
            .snippet(raw.getSnippet())
            .build();
        
        TreeSet<FindingSource> sources = new TreeSet<>();
        sources.add(new FindingSource(raw.getTool(), raw.getRuleId()));
        TreeSet<String> references = new TreeSet<>();
        if (raw.getReferences() != null) {
            references.addAll(raw.getReferences());
        }
        
        return UnifiedFinding.builder()
            .fingerprint(fingerprints.fingerprint(path, category, raw.getSnippet(), line, root))
            .category(category)
            .sources(sources)
            .references(references)
            .location(location)
            .severity(severity)
            .rawMessage(raw.getMessage())
            .locationConfidence(Confidence.fromRaw(raw.getRawConfidence()))
            .locationSeverity(severity)
            .build();
    }
}
