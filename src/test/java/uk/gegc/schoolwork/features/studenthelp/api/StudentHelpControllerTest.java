package uk.gegc.schoolwork.features.studenthelp.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.schoolwork.features.studenthelp.api.dto.HelpSummaryDto;
import uk.gegc.schoolwork.features.studenthelp.api.dto.StudentNeedingHelpDto;
import uk.gegc.schoolwork.features.studenthelp.api.dto.StudentsNeedingHelpDto;
import uk.gegc.schoolwork.features.studenthelp.application.StudentHelpService;
import uk.gegc.schoolwork.features.studenthelp.domain.model.HelpReason;
import uk.gegc.schoolwork.features.studenthelp.domain.model.HelpSeverity;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;
import uk.gegc.schoolwork.features.user.domain.repository.UserRepository;
import uk.gegc.schoolwork.shared.exception.ValidationException;
import uk.gegc.schoolwork.testsupport.TestUsers;
import uk.gegc.schoolwork.testsupport.WebMvcSecurityTestConfig;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(StudentHelpController.class)
@Import(WebMvcSecurityTestConfig.class)
@DisplayName("StudentHelpController")
class StudentHelpControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StudentHelpService studentHelpService;

    @MockitoBean
    private UserRepository userRepository;

    private User teacher;

    @BeforeEach
    void setUp() {
        teacher = TestUsers.register(userRepository, TestUsers.user("ms.green", UserRole.TEACHER));
        TestUsers.register(userRepository, TestUsers.user("alice", UserRole.STUDENT));
    }

    @Test
    @DisplayName("GET: teachers see open records and the summary")
    @WithMockUser(username = "ms.green", roles = "TEACHER")
    void list_teacher_returns200() throws Exception {
        StudentNeedingHelpDto record = record(UUID.randomUUID(), false, null);
        when(studentHelpService.listOpen(teacher, HelpSeverity.CRITICAL, null))
                .thenReturn(new StudentsNeedingHelpDto(List.of(record), new HelpSummaryDto(1, 1, 0, 0)));

        mockMvc.perform(get("/api/students-needing-help").param("severity", "CRITICAL"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.students[0].studentUsername").value("bob"))
                .andExpect(jsonPath("$.data.students[0].reasons[0]").value("LOW_AVERAGE_SCORE"))
                .andExpect(jsonPath("$.data.summary.critical").value(1));
    }

    @Test
    @DisplayName("GET: students get 403")
    @WithMockUser(username = "alice", roles = "STUDENT")
    void list_student_returns403() throws Exception {
        mockMvc.perform(get("/api/students-needing-help"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(studentHelpService);
    }

    @Test
    @DisplayName("POST /{id}/resolve: passes the notes along")
    @WithMockUser(username = "ms.green", roles = "TEACHER")
    void resolve_withNotes_returns200() throws Exception {
        UUID recordId = UUID.randomUUID();
        when(studentHelpService.resolve(teacher, recordId, "Extra session on Friday"))
                .thenReturn(record(recordId, true, "Extra session on Friday"));

        mockMvc.perform(post("/api/students-needing-help/{id}/resolve", recordId)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"teacherNotes\":\"Extra session on Friday\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.resolved").value(true))
                .andExpect(jsonPath("$.message").value("Help record resolved"));
    }

    @Test
    @DisplayName("POST /{id}/resolve: the body is optional")
    @WithMockUser(username = "ms.green", roles = "TEACHER")
    void resolve_noBody_passesNullNotes() throws Exception {
        UUID recordId = UUID.randomUUID();
        when(studentHelpService.resolve(teacher, recordId, null)).thenReturn(record(recordId, true, null));

        mockMvc.perform(post("/api/students-needing-help/{id}/resolve", recordId).with(csrf()))
                .andExpect(status().isOk());

        verify(studentHelpService).resolve(eq(teacher), eq(recordId), isNull());
    }

    @Test
    @DisplayName("POST /{id}/resolve: an already resolved record returns 400")
    @WithMockUser(username = "ms.green", roles = "TEACHER")
    void resolve_alreadyResolved_returns400() throws Exception {
        UUID recordId = UUID.randomUUID();
        when(studentHelpService.resolve(teacher, recordId, null))
                .thenThrow(new ValidationException("Help record is already resolved"));

        mockMvc.perform(post("/api/students-needing-help/{id}/resolve", recordId).with(csrf()))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("PATCH /{id}/notes: over-long notes return 400")
    @WithMockUser(username = "ms.green", roles = "TEACHER")
    void notes_tooLong_returns400() throws Exception {
        String notes = "x".repeat(2001);

        mockMvc.perform(patch("/api/students-needing-help/{id}/notes", UUID.randomUUID())
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"teacherNotes\":\"" + notes + "\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(studentHelpService);
    }

    private static StudentNeedingHelpDto record(UUID id, boolean resolved, String notes) {
        return new StudentNeedingHelpDto(id, UUID.randomUUID(), "bob",
                List.of(HelpReason.LOW_AVERAGE_SCORE), List.of(HelpReason.LOW_AVERAGE_SCORE.getDescription()),
                NOW.minusSeconds(86_400 * 16), 16, 0, 30.0, 80.0, HelpSeverity.CRITICAL,
                Set.of(), Set.of(), resolved, resolved ? NOW : null, null, notes, NOW, NOW);
    }
}
