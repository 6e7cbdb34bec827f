package org.esa.echogram.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import org.esa.echogram.sun.SolarEphemeris;
import org.esa.echogram.sun.SunCycle;

import java.io.PrintStream;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

@Parameters(commandDescription = "Print sunrise and sunset (GMT) for a position and day")
public class SunCycleCommand implements CliCommand {

    @Parameter(names = "--lat", required = true, description = "Latitude in degrees")
    private double lat;

    @Parameter(names = "--lon", required = true, description = "Longitude in degrees, east positive")
    private double lon;

    @Parameter(names = "--date", required = true, description = "Day as yyyy-MM-dd")
    private String date;

    @Parameter(names = "--steps", description = "Number of steps used to sample the day")
    private int steps = SolarEphemeris.DEFAULT_STEP_COUNT;

    private final PrintStream out;

    public SunCycleCommand() {
        this(System.out);
    }

    SunCycleCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public int run() {
        final LocalDate day;
        try {
            day = LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            System.err.println("Invalid date: " + date);
            return 2;
        }
        if (steps < 1) {
            System.err.println("Invalid number of steps: " + steps);
            return 2;
        }
        final SunCycle cycle = new SolarEphemeris().computeSunCycle(lat, lon, day, steps);
        out.println(String.format(Locale.ROOT, "sunrise %s, sunset %s (GMT)",
                                  formatHour(cycle.getSunrise()), formatHour(cycle.getSunset())));
        if (cycle.isPolarDay()) {
            out.println("polar day");
        } else if (cycle.isPolarNight()) {
            out.println("polar night");
        }
        return 0;
    }

    /**
     * @return the decimal hour as {@code HH:mm}
     */
    static String formatHour(double hour) {
        long minutes = Math.round(hour * 60.0);
        return String.format(Locale.ROOT, "%02d:%02d", minutes / 60, minutes % 60);
    }
}
