package org.esa.echogram.io;

import org.esa.echogram.PingRecord;

import java.util.List;

/**
 * The pings of one Echoview Sv export file.
 */
public class EchoviewExport {

    private final String name;
    private final List<PingRecord> pings;
    private final int sampleCountMax;

    public EchoviewExport(String name, List<PingRecord> pings, int sampleCountMax) {
        this.name = name;
        this.pings = pings;
        this.sampleCountMax = sampleCountMax;
    }

    /**
     * @return the file name without extension
     */
    public String getName() {
        return name;
    }

    public List<PingRecord> getPings() {
        return pings;
    }

    public int getSampleCountMax() {
        return sampleCountMax;
    }

    public boolean isEmpty() {
        return pings.isEmpty();
    }
}
