package io.slot4j.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonCodesTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void conflictKindsShouldSerializeAsSnakeCase() throws Exception {
        assertThat(objectMapper.writeValueAsString(ConflictKind.RECRUITING_BLOCK)).isEqualTo("\"recruiting_block\"");
        assertThat(objectMapper.writeValueAsString(ConflictKind.NO_PARTICIPANTS_AVAILABLE)).isEqualTo("\"no_participants_available\"");
        assertThat(objectMapper.writeValueAsString(LoadCategory.OVER_LIMIT)).isEqualTo("\"over_limit\"");
        assertThat(objectMapper.writeValueAsString(OverlapType.ENCLOSES)).isEqualTo("\"encloses\"");
    }

    @Test
    void verificationResultShouldCarryConflictTags() throws Exception {
        BusyInterval meeting = new BusyInterval("evt-1", "1:1",
                Instant.parse("2024-01-01T09:00:00Z"), Instant.parse("2024-01-01T09:30:00Z"));
        VerificationResult result = new VerificationResult(false,
                List.of(new Conflict(ConflictKind.CALENDAR_EVENT, "alice", meeting, "Conflicts with 1:1")),
                Map.of("alice", new LoadInfo(PeriodLoad.of(2, 4), PeriodLoad.of(2, 20))));

        String json = objectMapper.writeValueAsString(result);

        assertThat(json)
                .contains("\"kind\":\"calendar_event\"")
                .contains("\"participantId\":\"alice\"")
                .contains("\"density\":0.5");
    }

    @Test
    void conflictKindsShouldReadBack() throws Exception {
        assertThat(objectMapper.readValue("\"work_hours\"", ConflictKind.class)).isEqualTo(ConflictKind.WORK_HOURS);
    }
}
