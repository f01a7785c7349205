package com.adlanda.resumetailor.model;

import com.adlanda.resumetailor.exception.ErrorCode;
import com.adlanda.resumetailor.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalendarDateTest {

    @Test
    void parse_isoDate_roundTripsToString() {
        CalendarDate date = CalendarDate.parse("2021-03-09");

        assertThat(date.toString()).isEqualTo("2021-03-09");
        assertThat(date).isEqualTo(CalendarDate.of(2021, 3, 9));
        assertThat(date.isZero()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "2021-3-9", "09/03/2021", "2021-13-01", "2021-02-30", "2021-03-09T10:00"})
    void parse_otherShapes_failWithInvalidDateFormat(String text) {
        assertThatThrownBy(() -> CalendarDate.parse(text))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getCode())
                .isEqualTo(ErrorCode.INVALID_DATE_FORMAT);
    }

    @Test
    void beforeAndAfter_compareCalendarDays() {
        CalendarDate earlier = CalendarDate.of(2020, 1, 1);
        CalendarDate later = CalendarDate.of(2020, 1, 2);

        assertThat(earlier.isBefore(later)).isTrue();
        assertThat(later.isAfter(earlier)).isTrue();
        assertThat(earlier.isBefore(earlier)).isFalse();
    }

    @Test
    void zero_sortsFirstAndPrintsEmpty() {
        assertThat(CalendarDate.ZERO.isZero()).isTrue();
        assertThat(CalendarDate.ZERO.toString()).isEmpty();
        assertThat(CalendarDate.ZERO.isBefore(CalendarDate.of(1900, 1, 1))).isTrue();
        assertThat(CalendarDate.of(null)).isSameAs(CalendarDate.ZERO);
    }
}
