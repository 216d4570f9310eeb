package uk.gegc.schoolwork.features.language.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.schoolwork.features.language.domain.model.Language;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface LanguageRepository extends JpaRepository<Language, UUID> {

    List<Language> findByCodeIn(Collection<String> codes);
}
