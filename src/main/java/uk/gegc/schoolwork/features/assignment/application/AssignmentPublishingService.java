package uk.gegc.schoolwork.features.assignment.application;

/**
 * Activates assignments whose scheduled publish time has passed.
 */
public interface AssignmentPublishingService {

    /**
     * @return number of assignments activated in this run
     */
    int publishDueAssignments();
}
