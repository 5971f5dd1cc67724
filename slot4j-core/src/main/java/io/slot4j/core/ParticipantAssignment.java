package io.slot4j.core;

public record ParticipantAssignment(
        String participantId,
        String name,
        String email,
        boolean trainee
) {

    public static ParticipantAssignment of(Participant participant) {
        return new ParticipantAssignment(participant.id(), participant.name(), participant.email(), participant.trainee());
    }
}
