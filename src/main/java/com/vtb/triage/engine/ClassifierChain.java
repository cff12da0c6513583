package com.vtb.triage.engine;

import com.vtb.triage.engine.classifiers.CommandInjectionClassifier;
import com.vtb.triage.engine.classifiers.DefaultClassifier;
import com.vtb.triage.engine.classifiers.HardcodedSecretsClassifier;
import com.vtb.triage.engine.classifiers.PathTraversalClassifier;
import com.vtb.triage.engine.classifiers.SqlInjectionClassifier;
import com.vtb.triage.engine.classifiers.WeakCryptoClassifier;
import com.vtb.triage.engine.classifiers.XssClassifier;
import com.vtb.triage.models.Classification;
import com.vtb.triage.models.UnifiedFinding;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

/**
 * Упорядоченный список (предикат, классификатор): первый подходящий выигрывает,
 * базовый классификатор всегда последний.
 * 
 * Исключение в специализированном классификаторе не прерывает триаж:
 * для этой находки используется вердикт базового классификатора.
 */
@Slf4j
public class ClassifierChain {
    
    /**
     * Звено цепочки
     */
    public record Entry(Predicate<UnifiedFinding> predicate, FindingClassifier classifier) {
    }
    
    private final List<Entry> entries;
    private final FindingClassifier fallback;
    
    public ClassifierChain(List<Entry> entries, FindingClassifier fallback) {
        this.entries = List.copyOf(entries);
        this.fallback = fallback;
    }
    
    /**
     * Встроенные классификаторы без отключённых в конфигурации
     */
    public static ClassifierChain defaults(Collection<String> disabled) {
        List<FindingClassifier> specialized = List.of(
            new SqlInjectionClassifier(),
            new CommandInjectionClassifier(),
            new XssClassifier(),
            new PathTraversalClassifier(),
            new HardcodedSecretsClassifier(),
            new WeakCryptoClassifier()
        );
        List<Entry> entries = new ArrayList<>();
        for (FindingClassifier classifier : specialized) {
            if (disabled != null && disabled.contains(classifier.id())) {
                log.info("Классификатор {} отключён конфигурацией", classifier.id());
                continue;
            }
            entries.add(new Entry(classifier::supports, classifier));
        }
        return new ClassifierChain(entries, new DefaultClassifier());
    }
    
    public Classification classify(UnifiedFinding finding) {
        for (Entry entry : entries) {
            if (!matches(entry, finding)) {
                continue;
            }
            try {
                Classification result = entry.classifier().classify(finding);
                if (result != null) {
                    return result;
                }
                log.warn("{} вернул null для {}, используется базовый классификатор",
                    entry.classifier().id(), finding.getFingerprint());
            } catch (RuntimeException e) {
                log.warn("Ошибка классификатора {} на {}: {}. Используется базовый классификатор",
                    entry.classifier().id(), finding.getFingerprint(), e.getMessage(), e);
            }
            break;
        }
        return fallback.classify(finding);
    }
    
    public List<String> classifierIds() {
        List<String> ids = new ArrayList<>();
        entries.forEach(e -> ids.add(e.classifier().id()));
        ids.add(fallback.id());
        return ids;
    }
    
    private static boolean matches(Entry entry, UnifiedFinding finding) {
        try {
            return entry.predicate().test(finding);
        } catch (RuntimeException e) {
            log.warn("Предикат {} упал: {}", entry.classifier().id(), e.getMessage());
            return false;
        }
    }
}
