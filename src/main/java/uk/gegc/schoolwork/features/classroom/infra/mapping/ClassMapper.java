package uk.gegc.schoolwork.features.classroom.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.schoolwork.features.classroom.api.dto.ClassDto;
import uk.gegc.schoolwork.features.classroom.api.dto.ClassMemberDto;
import uk.gegc.schoolwork.features.classroom.domain.model.SchoolClass;
import uk.gegc.schoolwork.features.user.domain.model.User;

import java.util.Comparator;
import java.util.List;

@Component
public class ClassMapper {

    public ClassDto toDto(SchoolClass schoolClass) {
        List<ClassMemberDto> members = schoolClass.getMembers().stream()
                .sorted(Comparator.comparing(User::getUsername, Comparator.nullsLast(String::compareTo)))
                .map(this::toMember)
                .toList();
        int students = (int) schoolClass.getMembers().stream().filter(User::isStudent).count();
        return new ClassDto(
                schoolClass.getId(),
                schoolClass.getName(),
                students,
                members,
                schoolClass.getCreatedAt(),
                schoolClass.getUpdatedAt()
        );
    }

    public List<ClassDto> toDtoList(List<SchoolClass> classes) {
        return classes.stream()
                .map(this::toDto)
                .toList();
    }

    private ClassMemberDto toMember(User user) {
        return new ClassMemberDto(user.getId(), user.getUsername(), user.getEmail(), user.getRole());
    }
}
