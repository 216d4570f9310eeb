package uk.gegc.schoolwork.features.studenthelp.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.schoolwork.features.studenthelp.api.dto.HelpSummaryDto;
import uk.gegc.schoolwork.features.studenthelp.api.dto.StudentNeedingHelpDto;
import uk.gegc.schoolwork.features.studenthelp.domain.model.HelpReason;
import uk.gegc.schoolwork.features.studenthelp.domain.model.HelpSeverity;
import uk.gegc.schoolwork.features.studenthelp.domain.model.StudentNeedingHelp;

import java.util.Collection;
import java.util.List;
import java.util.Set;

@Component
public class StudentHelpMapper {

    public StudentNeedingHelpDto toDto(StudentNeedingHelp record) {
        List<HelpReason> reasons = record.getReasons().stream().sorted().toList();
        return new StudentNeedingHelpDto(
                record.getId(),
                record.getStudent().getId(),
                record.getStudent().getUsername(),
                reasons,
                reasons.stream().map(HelpReason::getDescription).toList(),
                record.getNeedsHelpSince(),
                record.getDaysNeedingHelp(),
                record.getOverdueAssignments(),
                record.getAverageScore(),
                record.getCompletionRate(),
                record.getSeverity(),
                Set.copyOf(record.getClassIds()),
                Set.copyOf(record.getTeacherIds()),
                record.isResolved(),
                record.getResolvedAt(),
                record.getResolvedBy(),
                record.getTeacherNotes(),
                record.getCreatedAt(),
                record.getUpdatedAt()
        );
    }

    public HelpSummaryDto toSummary(Collection<StudentNeedingHelp> records) {
        int critical = 0;
        int warning = 0;
        int recent = 0;
        for (StudentNeedingHelp record : records) {
            if (record.getSeverity() == HelpSeverity.CRITICAL) {
                critical++;
            } else if (record.getSeverity() == HelpSeverity.WARNING) {
                warning++;
            } else {
                recent++;
            }
        }
        return new HelpSummaryDto(records.size(), critical, warning, recent);
    }
}
