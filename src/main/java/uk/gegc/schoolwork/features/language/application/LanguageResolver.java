package uk.gegc.schoolwork.features.language.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.schoolwork.features.language.domain.model.Language;
import uk.gegc.schoolwork.features.language.domain.repository.LanguageRepository;
import uk.gegc.schoolwork.shared.exception.ValidationException;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the language an assignment is written in. A missing id falls back to the
 * default English language ({@code en}, then {@code en-US}).
 */
@Component
@RequiredArgsConstructor
public class LanguageResolver {

    static final List<String> DEFAULT_CODES = List.of("en", "en-US");

    private final LanguageRepository languageRepository;

    public Language requireById(UUID languageId) {
        return languageRepository.findById(languageId)
                .orElseThrow(() -> new ValidationException("Language not found"));
    }

    public Optional<Language> findDefault() {
        return languageRepository.findByCodeIn(DEFAULT_CODES).stream()
                .min(Comparator.comparingInt(language -> DEFAULT_CODES.indexOf(language.getCode())));
    }

    public Optional<Language> resolve(UUID languageId) {
        if (languageId != null) {
            return Optional.of(requireById(languageId));
        }
        return findDefault();
    }

    public Language resolveRequired(UUID languageId) {
        return resolve(languageId)
                .orElseThrow(() -> new ValidationException("Default English language not found"));
    }
}
