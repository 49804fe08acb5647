package com.wangbin.hoststats.common.utils;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import static org.junit.jupiter.api.Assertions.*;

class DateUtilTest {

    @Test
    void reformatsSourceTimestampIntoCanonicalFormat() {
        assertEquals("2021-01-01T00:00:00Z",
                DateUtil.reformat("2021-01-01 00:00:00", DateUtil.DEFAULT_DATETIME_FORMAT,
                        DateUtil.CANONICAL_DATETIME_FORMAT));
    }

    @Test
    void rejectsTimestampInAnotherFormat() {
        assertThrows(DateTimeParseException.class,
                () -> DateUtil.reformat("2021/01/01", DateUtil.DEFAULT_DATETIME_FORMAT,
                        DateUtil.CANONICAL_DATETIME_FORMAT));
    }

    @Test
    void monthAndDayFollowTotalsLogNaming() {
        LocalDate date = LocalDate.of(2022, 12, 5);

        assertEquals("Dec", DateUtil.monthAbbreviation(date));
        assertEquals("05", DateUtil.dayOfMonth(date));
    }
}
