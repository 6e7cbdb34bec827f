package org.esa.echogram.io;

import org.junit.Test;

import java.io.File;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class EchoviewBottomReaderTest {

    private static final String HEADER = "Ping_date,Ping_time,Ping_milliseconds,Latitude,Longitude,Position_status,"
                                         + "Depth,Line_status,Ping_status,Altitude,GPS_UTC_time\n";

    @Test
    public void testOnlyGoodPointsAreKept() throws Exception {
        final BottomLine bottomLine;
        try (Reader reader = new InputStreamReader(
                getClass().getResourceAsStream("/echoview/Bottom/" + EchoviewCsvReaderTest.EXPORT_NAME + ".csv"),
                StandardCharsets.UTF_8)) {
            bottomLine = new EchoviewBottomReader().read(reader, "bottom");
        }

        assertNotNull(bottomLine);
        assertEquals(4, bottomLine.getPointCount());
        assertArrayEquals(new double[]{27.40, 27.55, 27.80, 27.95}, bottomLine.getDepths(), 0.0);
        assertEquals(41.5003, bottomLine.getLatitudes()[2], 0.0);
        assertEquals(-70.7003, bottomLine.getLongitudes()[2], 0.0);
        assertTrue(bottomLine.getTimes()[3] > bottomLine.getTimes()[2]);
    }

    @Test
    public void testTooFewGoodPointsMeansNoBottomLine() throws Exception {
        final String csv = HEADER
                           + "2015-06-21,18:00:00,0,41.5,-70.7,1,27.4,1,0,0,\n"
                           + "2015-06-21,18:00:01,0,41.5,-70.7,1,27.5,1,0,0,\n"
                           + "2015-06-21,18:00:02,0,41.5,-70.7,1,27.6,3,0,0,\n"
                           + "2015-06-21,18:00:03,0,41.5,-70.7,1,27.7,1,0,0,\n";

        assertNull(new EchoviewBottomReader().read(new StringReader(csv), "bottom"));
    }

    @Test
    public void testBottomFileLocation() throws Exception {
        final File file = EchoviewBottomReader.getBottomFile(new File("exports"), "leg1");

        assertEquals(new File(new File("exports", "Bottom"), "leg1.csv"), file);
    }
}
