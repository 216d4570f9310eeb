package uk.gegc.schoolwork.features.assignment.api;

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
import uk.gegc.schoolwork.features.assignment.application.AssignmentVariantService;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;
import uk.gegc.schoolwork.features.user.domain.repository.UserRepository;
import uk.gegc.schoolwork.testsupport.TestUsers;
import uk.gegc.schoolwork.testsupport.WebMvcSecurityTestConfig;

import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(IeltsAssignmentController.class)
@Import(WebMvcSecurityTestConfig.class)
@DisplayName("IeltsAssignmentController")
class IeltsAssignmentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AssignmentVariantService variantService;

    @MockitoBean
    private UserRepository userRepository;

    private User teacher;

    @BeforeEach
    void setUp() {
        teacher = TestUsers.register(userRepository, TestUsers.user("ms.green", UserRole.TEACHER));
        TestUsers.register(userRepository, TestUsers.user("alice", UserRole.STUDENT));
    }

    @Test
    @DisplayName("POST /api/ielts/question-and-answer: accent and level defaults are applied")
    @WithMockUser(username = "ms.green", roles = "TEACHER")
    void questionAndAnswer_defaults() throws Exception {
        mockMvc.perform(post("/api/ielts/question-and-answer")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"topic":"Hometown","assignToEntireClass":true,
                                 "questions":[{"text":"Describe your hometown."}]}
                                """))
                .andExpect(status().isCreated());

        verify(variantService).createIeltsQuestionAndAnswer(eq(teacher), argThat(r ->
                r.accent().equals("us") && r.questions().get(0).expectedLevel().equals("intermediate")));
    }

    @Test
    @DisplayName("POST /api/ielts/question-and-answer: unknown accent returns 400")
    @WithMockUser(username = "ms.green", roles = "TEACHER")
    void questionAndAnswer_badAccent_returns400() throws Exception {
        mockMvc.perform(post("/api/ielts/question-and-answer")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"topic":"Hometown","accent":"au","assignToEntireClass":true,
                                 "questions":[{"text":"Describe your hometown."}]}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(variantService);
    }

    @Test
    @DisplayName("POST /api/ielts/question-and-answer: no questions returns 400")
    @WithMockUser(username = "ms.green", roles = "TEACHER")
    void questionAndAnswer_noQuestions_returns400() throws Exception {
        mockMvc.perform(post("/api/ielts/question-and-answer")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topic\":\"Hometown\",\"assignToEntireClass\":true,\"questions\":[]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /api/ielts/reading: students get 403")
    @WithMockUser(username = "alice", roles = "STUDENT")
    void reading_student_returns403() throws Exception {
        mockMvc.perform(post("/api/ielts/reading")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topic\":\"Bees\",\"assignToEntireClass\":true,\"passages\":[{\"text\":\"Bees live in hives.\"}]}"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(variantService);
    }
}
