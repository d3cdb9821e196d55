package com.example.signage.shared.util;

import com.example.signage.shared.dto.ErrorLogEntry;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonUtilsTest {

    @Test
    void parseIdListKeepsStoredOrder() {
        assertThat(JsonUtils.parseIdList("[3,1,2]")).containsExactly(3L, 1L, 2L);
    }

    @Test
    void parseIdListIsLenient() {
        assertThat(JsonUtils.parseIdList(null)).isEmpty();
        assertThat(JsonUtils.parseIdList("  ")).isEmpty();
        assertThat(JsonUtils.parseIdList("not json")).isEmpty();
    }

    @Test
    void toJsonArrayReturnsNullForEmptyList() {
        assertThat(JsonUtils.toJsonArray(List.of())).isNull();
        assertThat(JsonUtils.toJsonArray(List.of(5L, 9L))).isEqualTo("[5,9]");
    }

    @Test
    void parseObjectIgnoresAnythingButObjects() {
        assertThat(JsonUtils.parseObject("[1,2]")).isNull();
        assertThat(JsonUtils.parseObject("42")).isNull();
        assertThat(JsonUtils.parseObject("{broken")).isNull();

        Map<String, Object> metrics = JsonUtils.parseObject("{\"cpuUsage\": 85, \"vendor\": {\"model\": \"X1\"}}");
        assertThat(metrics).containsEntry("cpuUsage", 85).containsKey("vendor");
    }

    @Test
    void errorLogSurvivesSerialization() {
        OffsetDateTime at = OffsetDateTime.of(2026, 10, 19, 8, 30, 0, 0, ZoneOffset.UTC);
        String json = JsonUtils.toJson(List.of(new ErrorLogEntry("HIGH", "panel fault", at)));

        List<ErrorLogEntry> parsed = JsonUtils.parseErrorLog(json);

        assertThat(parsed).hasSize(1);
        assertThat(parsed.get(0).getSeverity()).isEqualTo("HIGH");
        assertThat(parsed.get(0).getTimestamp().toInstant()).isEqualTo(at.toInstant());
    }
}
