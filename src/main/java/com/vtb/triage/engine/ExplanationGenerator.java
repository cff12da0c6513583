package com.vtb.triage.engine;

import com.vtb.triage.models.Classification;
import com.vtb.triage.models.Explanation;
import com.vtb.triage.models.UnifiedFinding;
import com.vtb.triage.models.Verdict;

import java.util.Map;

/**
 * Шаблонные объяснения: что найдено, почему это важно, как эксплуатировать, как исправить
 */
public class ExplanationGenerator {
    
    private static final String ELLIPSIS = "...";
    
    // Родственные CWE объясняются текстом "старшего" CWE
    private static final Map<String, String> FAMILY = Map.ofEntries(
        Map.entry("CWE-564", "CWE-89"),
        Map.entry("CWE-80", "CWE-79"),
        Map.entry("CWE-23", "CWE-22"),
        Map.entry("CWE-36", "CWE-22"),
        Map.entry("CWE-73", "CWE-22"),
        Map.entry("CWE-259", "CWE-798"),
        Map.entry("CWE-321", "CWE-798"),
        Map.entry("CWE-522", "CWE-798"),
        Map.entry("CWE-328", "CWE-327"),
        Map.entry("CWE-326", "CWE-327"),
        Map.entry("CWE-916", "CWE-327"),
        Map.entry("CWE-77", "CWE-78")
    );
    
    private static final Map<String, String> NAMES = Map.of(
        "CWE-89", "SQL-инъекция",
        "CWE-79", "Межсайтовый скриптинг (XSS)",
        "CWE-22", "Обход пути (path traversal)",
        "CWE-798", "Секрет в исходном коде",
        "CWE-327", "Слабый криптоалгоритм",
        "CWE-78", "Инъекция команд ОС",
        "CWE-502", "Небезопасная десериализация",
        "CWE-918", "SSRF"
    );
    
    private static final Map<String, String> IMPACT = Map.of(
        "CWE-89", "SQL-инъекция позволяет читать, изменять и удалять данные в БД.",
        "CWE-79", "XSS позволяет украсть сессионные cookie или действовать от имени пользователя.",
        "CWE-22", "Обход пути открывает доступ к чувствительным файлам сервера.",
        "CWE-798", "Секрет из кода можно извлечь и использовать против системы.",
        "CWE-327", "Слабую криптографию можно взломать и получить защищённые данные.",
        "CWE-78", "Инъекция команд даёт выполнение произвольного кода на сервере.",
        "CWE-502", "Десериализация недоверенных данных ведёт к удалённому выполнению кода.",
        "CWE-918", "SSRF открывает доступ к внутренним сервисам от имени сервера."
    );
    
    private static final Map<String, String> EXPLOIT = Map.of(
        "CWE-89", "Атакующий передаёт ' OR 1=1 -- и обходит аутентификацию.",
        "CWE-79", "Атакующий внедряет <script>...</script> и крадёт cookie.",
        "CWE-22", "Атакующий передаёт ../../etc/passwd и читает системные файлы.",
        "CWE-798", "Атакующий находит учётные данные в репозитории или сборке.",
        "CWE-327", "Атакующий подбирает пароли по радужным таблицам.",
        "CWE-78", "Атакующий добавляет ; rm -rf / или $(curl ...) в аргумент.",
        "CWE-502", "Атакующий подсовывает сериализованный объект с gadget-цепочкой.",
        "CWE-918", "Атакующий запрашивает http://169.254.169.254/ через сервер."
    );
    
    private static final Map<String, String> FIX = Map.of(
        "CWE-89", "Используйте параметризованные запросы или prepared statements.",
        "CWE-79", "Экранируйте вывод и включите Content Security Policy.",
        "CWE-22", "Нормализуйте путь и проверяйте, что он внутри разрешённого каталога.",
        "CWE-798", "Вынесите секрет в переменные окружения или хранилище секретов и отзовите старый.",
        "CWE-327", "Перейдите на современные алгоритмы (AES-256, bcrypt, Argon2).",
        "CWE-78", "Передавайте аргументы списком без оболочки и валидируйте входные данные.",
        "CWE-502", "Не десериализуйте недоверенные данные, используйте JSON и allow-list типов.",
        "CWE-918", "Проверяйте целевые адреса по allow-list и блокируйте внутренние сети."
    );
    
    private final int maxLength;
    
    public ExplanationGenerator(int maxLength) {
        this.maxLength = Math.max(maxLength, ELLIPSIS.length() + 1);
    }
    
    public Explanation explain(UnifiedFinding finding, Classification classification) {
        String category = finding.getCategory();
        String key = FAMILY.getOrDefault(category, category);
        String name = NAMES.getOrDefault(key, category);
        
        StringBuilder what = new StringBuilder(name);
        if (finding.getLocation() != null) {
            what.append(" в ").append(finding.getLocation().getFile());
            if (finding.getLocation().getLineStart() > 0) {
                what.append(':').append(finding.getLocation().getLineStart());
            }
        }
        if (finding.getRawMessage() != null && !finding.getRawMessage().isBlank()) {
            what.append(". ").append(finding.getRawMessage().strip());
        }
        
        String why = IMPACT.getOrDefault(key,
            "Находка критичности " + finding.getSeverity() + " может быть использована для атаки на приложение.");
        if (classification != null && classification.getVerdict() == Verdict.FALSE_POSITIVE) {
            why = "Вероятно ложное срабатывание: " + classification.getReasoning();
        } else if (classification != null && classification.getVerdict() == Verdict.NEEDS_REVIEW) {
            why = why + " Требуется ручная проверка: " + classification.getReasoning();
        }
        
        String exploit = null;
        if (classification != null && classification.getVerdict() == Verdict.TRUE_POSITIVE) {
            exploit = EXPLOIT.getOrDefault(key, "Зависит от контекста, см. описание правила.");
        }
        
        return Explanation.builder()
            .what(truncate(what.toString()))
            .whyItMatters(truncate(why))
            .howToExploit(exploit != null ? truncate(exploit) : null)
            .howToFix(truncate(FIX.getOrDefault(key, "Изучите рекомендации правила " + finding.getTitle() + ".")))
            .build();
    }
    
    String truncate(String text) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }
}
