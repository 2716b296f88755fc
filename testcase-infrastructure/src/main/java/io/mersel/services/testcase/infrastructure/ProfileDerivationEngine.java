package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.enums.QuestionType;
import io.mersel.services.testcase.application.interfaces.IProfileDerivationService;
import io.mersel.services.testcase.application.models.Answer;
import io.mersel.services.testcase.application.models.ChecklistQuestion;
import io.mersel.services.testcase.application.models.ChecklistSection;
import io.mersel.services.testcase.application.models.ProfileConfiguration;
import io.mersel.services.testcase.application.models.ProfileMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Checklist cevaplarından aktif profil kümesini türetir.
 * <p>
 * Kurallar:
 * <ul>
 *   <li>Yalnızca {@code answered=true} olan sorular değerlendirilir</li>
 *   <li>boolean: ilk cevap değeri (büyük/küçük harf duyarsız) "true" ise {@code condition="true"},
 *       değilse {@code condition="false"} eşlemeleri sağlanır</li>
 *   <li>choice / multi-choice: {@code condition} cevap değerleri arasında geçiyorsa sağlanır</li>
 *   <li>tanınmayan tip: hiçbir eşleme sağlanmaz</li>
 * </ul>
 * Eski biçimdeki doğrudan profil listeleri codec tarafından her zaman sağlanan
 * ({@code condition="true"}) eşlemelere normalize edildiği için burada ayrıca ele alınmaz.
 * {@code DependsOn} değerlendirilmez.
 */
@Service
public class ProfileDerivationEngine implements IProfileDerivationService {

    private static final Logger log = LoggerFactory.getLogger(ProfileDerivationEngine.class);

    @Override
    public List<String> deriveActiveProfiles(ProfileConfiguration configuration) {
        if (configuration == null) {
            return List.of();
        }

        var active = new TreeSet<String>();
        for (ChecklistSection section : configuration.sections()) {
            for (ChecklistQuestion question : section.questions()) {
                if (!question.answer().answered()) {
                    continue;
                }
                for (ProfileMapping mapping : question.profileMappings()) {
                    if (isSatisfied(question.type(), question.answer(), mapping.condition())) {
                        active.addAll(mapping.profiles());
                    }
                }
            }
        }

        log.debug("Aktif profiller türetildi: {}", active);
        return List.copyOf(active);
    }

    static boolean isSatisfied(QuestionType type, Answer answer, String condition) {
        return switch (type) {
            case BOOLEAN -> {
                String first = answer.firstValue();
                boolean value = first != null && "true".equals(first.toLowerCase(Locale.ROOT));
                yield ("true".equals(condition) && value) || ("false".equals(condition) && !value);
            }
            case CHOICE, MULTI_CHOICE -> answer.values().contains(condition);
            case UNKNOWN -> false;
        };
    }
}
