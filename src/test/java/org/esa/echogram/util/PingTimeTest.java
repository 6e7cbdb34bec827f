package org.esa.echogram.util;

import org.junit.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.Assert.*;

public class PingTimeTest {

    @Test
    public void testConversion() throws Exception {
        final LocalDateTime dateTime = LocalDateTime.of(2015, 6, 21, 18, 30, 15);
        final double days = PingTime.toDays(dateTime);

        assertEquals(dateTime, PingTime.toDateTime(days));
        assertEquals(LocalDate.of(2015, 6, 21), PingTime.toDate(days));
        assertEquals(18.504166, PingTime.hourOfDay(days), 1.0e-5);
        assertEquals("21-Jun-2015", PingTime.formatDate(days));
        assertEquals(0.0, PingTime.toDays(LocalDate.of(1970, 1, 1)), 0.0);
    }
}
