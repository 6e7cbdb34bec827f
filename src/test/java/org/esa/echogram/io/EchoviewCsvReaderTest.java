package org.esa.echogram.io;

import org.esa.echogram.EchogramException;
import org.esa.echogram.PingRecord;
import org.esa.echogram.util.PingTime;
import org.junit.Test;

import java.io.File;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.Assert.*;

public class EchoviewCsvReaderTest {

    static final String EXPORT_NAME = "D20150621-T180000_to_D20150621-T180040";
    private static final String HEADER = "Ping_index,Distance_gps,Distance_vl,Ping_date,Ping_time,Ping_milliseconds,"
                                         + "Latitude,Longitude,Depth_start,Depth_stop,Range_start,Range_stop,"
                                         + "Sample_count,Sv_values\n";

    @Test
    public void testReadExport() throws Exception {
        final EchoviewExport export;
        try (Reader reader = new InputStreamReader(
                getClass().getResourceAsStream("/echoview/" + EXPORT_NAME + ".csv"), StandardCharsets.UTF_8)) {
            export = new EchoviewCsvReader().read(reader, EXPORT_NAME);
        }

        assertEquals(EXPORT_NAME, export.getName());
        assertEquals(6, export.getSampleCountMax());
        final List<PingRecord> pings = export.getPings();
        assertEquals(5, pings.size());

        final PingRecord first = pings.get(0);
        assertEquals(PingTime.toDays(LocalDateTime.of(2015, 6, 21, 18, 0, 0)), first.getTimestamp(), 1.0e-9);
        assertEquals(41.5, first.getLatitude(), 0.0);
        assertEquals(-70.7, first.getLongitude(), 0.0);
        assertEquals(30.0, first.getRangeStop(), 0.0);
        assertEquals(-45.1, first.getSamples()[0], 0.0);

        // milliseconds are not part of the ping time
        assertEquals(pings.get(1).getTimestamp(), pings.get(2).getTimestamp(), 0.0);

        final double[] second = pings.get(1).getSamples();
        assertTrue(Double.isNaN(second[1]));
        assertTrue(Double.isNaN(second[3]));

        final PingRecord fourth = pings.get(3);
        assertEquals(5, fourth.getSampleCount());
        assertEquals(6, fourth.getSamples().length);
        assertTrue(Double.isNaN(fourth.getSamples()[5]));

        assertTrue(Double.isNaN(pings.get(4).getSamples()[5]));
    }

    @Test
    public void testSingleRowExportIsEmpty() throws Exception {
        final String csv = HEADER + "1,0,0,2015-06-21,18:00:00,0,41.5,-70.7,0,30,0,30,2,-50,-60\n";

        final EchoviewExport export = new EchoviewCsvReader().read(new StringReader(csv), "single");

        assertTrue(export.isEmpty());
    }

    @Test
    public void testFractionalSecondsAreDropped() throws Exception {
        final String csv = HEADER
                           + "1,0,0,2015-06-21,18:00:00.750,0,41.5,-70.7,0,30,0,30,2,-50,-60\n"
                           + "2,0,0,2015-06-21,18:00:01,0,41.5,-70.7,0,30,0,30,2,-50,-60\n";

        final EchoviewExport export = new EchoviewCsvReader().read(new StringReader(csv), "fraction");

        assertEquals(PingTime.toDays(LocalDateTime.of(2015, 6, 21, 18, 0, 0)),
                     export.getPings().get(0).getTimestamp(), 1.0e-9);
    }

    @Test
    public void testMalformedRowReportsLine() throws Exception {
        final String csv = HEADER
                           + "1,0,0,2015-06-21,18:00:00,0,41.5,-70.7,0,30,0,30,2,-50,-60\n"
                           + "2,0,0,2015-06-21,18:00:01,0,north,-70.7,0,30,0,30,2,-50,-60\n";
        try {
            new EchoviewCsvReader().read(new StringReader(csv), "broken");
            fail("EchogramException expected");
        } catch (EchogramException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("line 3"));
            assertTrue(e.getMessage(), e.getMessage().contains("Latitude"));
        }
    }

    @Test(expected = EchogramException.class)
    public void testInvalidDateIsRejected() throws Exception {
        final String csv = HEADER
                           + "1,0,0,21/06/2015,18:00:00,0,41.5,-70.7,0,30,0,30,2,-50,-60\n"
                           + "2,0,0,21/06/2015,18:00:01,0,41.5,-70.7,0,30,0,30,2,-50,-60\n";
        new EchoviewCsvReader().read(new StringReader(csv), "dates");
    }

    @Test
    public void testBaseName() throws Exception {
        assertEquals("leg1", EchoviewCsvReader.baseName(new File("exports", "leg1.csv")));
        assertEquals("leg1.sv", EchoviewCsvReader.baseName(new File("leg1.sv.csv")));
    }
}
