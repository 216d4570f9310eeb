package uk.gegc.schoolwork.features.studenthelp.application;

import uk.gegc.schoolwork.features.studenthelp.api.dto.StudentNeedingHelpDto;
import uk.gegc.schoolwork.features.studenthelp.api.dto.StudentsNeedingHelpDto;
import uk.gegc.schoolwork.features.studenthelp.domain.model.HelpSeverity;
import uk.gegc.schoolwork.features.user.domain.model.User;

import java.util.UUID;

/**
 * Tracks students who are falling behind on their assignments.
 */
public interface StudentHelpService {

    /**
     * Judges one student and opens, updates or resolves their help record accordingly.
     */
    RefreshOutcome refreshStudent(UUID studentId);

    /**
     * Open records, most days first, with a per-severity summary of the returned rows.
     * Both filters are optional. Staff only.
     */
    StudentsNeedingHelpDto listOpen(User currentUser, HelpSeverity severity, UUID classId);

    StudentNeedingHelpDto resolve(User currentUser, UUID recordId, String teacherNotes);

    StudentNeedingHelpDto updateNotes(User currentUser, UUID recordId, String teacherNotes);

    enum RefreshOutcome {
        /** An open record was created or updated. */
        FLAGGED,
        /** Open records were closed because the student recovered. */
        CLEARED,
        /** Nothing to record. */
        UNCHANGED
    }
}
