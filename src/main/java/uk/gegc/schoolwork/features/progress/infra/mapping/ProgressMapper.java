package uk.gegc.schoolwork.features.progress.infra.mapping;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.schoolwork.features.assignment.infra.mapping.AssignmentMapper;
import uk.gegc.schoolwork.features.progress.api.dto.ProgressDto;
import uk.gegc.schoolwork.features.progress.domain.model.StudentAssignmentProgress;

import java.util.List;

@Component
@RequiredArgsConstructor
public class ProgressMapper {

    private final AssignmentMapper assignmentMapper;

    public ProgressDto toDto(StudentAssignmentProgress progress) {
        return new ProgressDto(
                progress.getId(),
                progress.getStudent().getId(),
                progress.getAssignment().getId(),
                progress.getQuestion().getId(),
                progress.isComplete(),
                progress.isCorrect(),
                assignmentMapper.readJson(progress.getAnalysisResult()),
                assignmentMapper.readJson(progress.getGrammarCorrected()),
                progress.getSubmissionType(),
                progress.getCreatedAt(),
                progress.getUpdatedAt()
        );
    }

    public List<ProgressDto> toDtoList(List<StudentAssignmentProgress> rows) {
        return rows.stream()
                .map(this::toDto)
                .toList();
    }
}
