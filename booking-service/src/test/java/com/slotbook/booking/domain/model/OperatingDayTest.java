package com.slotbook.booking.domain.model;

import com.slotbook.common.exception.BusinessException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperatingDayTest {

    private static List<SlotLabel> labels(String... values) {
        return Arrays.stream(values).map(SlotLabel::parse).toList();
    }

    @Test
    @DisplayName("slots run from opening hour up to, not including, closing hour")
    void slots_dayVenue() {
        OperatingDay day = OperatingDay.between(LocalTime.of(9, 0), LocalTime.of(22, 0));

        assertThat(day.slots()).hasSize(13);
        assertThat(day.slots().get(0).label()).isEqualTo("09:00");
        assertThat(day.slots().get(12).label()).isEqualTo("21:00");
    }

    @Test
    @DisplayName("closing at or before opening wraps past midnight")
    void slots_wrapPastMidnight() {
        OperatingDay day = OperatingDay.between(LocalTime.of(18, 0), LocalTime.of(2, 0));

        assertThat(day.slots()).extracting(SlotLabel::label)
                .containsExactly("18:00", "19:00", "20:00", "21:00", "22:00", "23:00", "00:00", "01:00");
    }

    @Test
    @DisplayName("equal opening and closing time means open around the clock")
    void slots_roundTheClock() {
        OperatingDay day = OperatingDay.between(LocalTime.of(6, 0), LocalTime.of(6, 0));

        assertThat(day.slots()).hasSize(24);
        assertThat(day.slots().get(23).label()).isEqualTo("05:00");
    }

    @Test
    @DisplayName("a venue opening or closing off the hour only offers whole hours inside its opening time")
    void slots_partialHoursExcluded() {
        OperatingDay day = OperatingDay.between(LocalTime.of(9, 30), LocalTime.of(13, 45));

        assertThat(day.slots()).extracting(SlotLabel::label).containsExactly("10:00", "11:00", "12:00");
        assertThat(day.contains(SlotLabel.parse("09:00"))).isFalse();
        assertThat(day.contains(SlotLabel.parse("13:00"))).isFalse();
    }

    @Test
    @DisplayName("less than one whole hour open yields no slots")
    void slots_noWholeHour() {
        assertThat(OperatingDay.between(LocalTime.of(9, 30), LocalTime.of(10, 15)).slots()).isEmpty();
    }

    @Test
    @DisplayName("23:00 and 00:00 are adjacent for a venue open across midnight")
    void contiguity_acrossMidnight() {
        OperatingDay day = OperatingDay.between(LocalTime.of(18, 0), LocalTime.of(2, 0));

        assertThat(day.isContiguous(labels("00:00", "23:00", "01:00"))).isTrue();
        assertThat(day.requireContiguousRun(labels("00:00", "23:00")))
                .extracting(SlotLabel::label).containsExactly("23:00", "00:00");
    }

    @Test
    @DisplayName("requireContiguousRun returns the run sorted by start time")
    void requireContiguousRun_sorts() {
        OperatingDay day = OperatingDay.between(LocalTime.of(9, 0), LocalTime.of(22, 0));

        assertThat(day.requireContiguousRun(labels("12:00", "10:00", "11:00")))
                .extracting(SlotLabel::label).containsExactly("10:00", "11:00", "12:00");
    }

    @Test
    @DisplayName("requireContiguousRun rejects gaps, repeats, empty sets and slots outside hours")
    void requireContiguousRun_rejectsInvalidSets() {
        OperatingDay day = OperatingDay.between(LocalTime.of(9, 0), LocalTime.of(22, 0));

        assertThatThrownBy(() -> day.requireContiguousRun(labels("10:00", "12:00")))
                .isInstanceOf(BusinessException.class).hasMessageContaining("consecutive");
        assertThatThrownBy(() -> day.requireContiguousRun(labels("10:00", "10:00")))
                .isInstanceOf(BusinessException.class).hasMessageContaining("repeat");
        assertThatThrownBy(() -> day.requireContiguousRun(List.of()))
                .isInstanceOf(BusinessException.class).hasMessageContaining("At least one");
        assertThatThrownBy(() -> day.requireContiguousRun(labels("21:00", "22:00")))
                .isInstanceOf(BusinessException.class).hasMessageContaining("outside");
    }

    @Test
    @DisplayName("slot labels must be whole hours written HH:00")
    void slotLabel_parse() {
        assertThat(SlotLabel.parse("07:00").hour()).isEqualTo(7);
        assertThatThrownBy(() -> SlotLabel.parse("7:00")).isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> SlotLabel.parse("10:30")).isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> SlotLabel.parse("24:00")).isInstanceOf(BusinessException.class);
    }
}
