package uk.gegc.schoolwork.features.user.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.schoolwork.features.user.api.dto.UserDto;
import uk.gegc.schoolwork.features.user.domain.model.User;

@Component
public class UserMapper {

    public UserDto toDto(User user) {
        return new UserDto(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getRole(),
                user.isConfirmed(),
                user.isBlocked(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
