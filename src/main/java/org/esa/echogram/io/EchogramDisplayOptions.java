package org.esa.echogram.io;

import org.esa.echogram.util.PingTime;

import java.util.Arrays;

/**
 * Presentation settings handed to the renderer together with an echogram. They do not take part
 * in any computation.
 */
public class EchogramDisplayOptions {

    public static final double[] DEFAULT_THRESHOLD = {-72.0, -34.0};
    public static final String DEFAULT_COLORMAP = "echoview";
    public static final String DEFAULT_Y_LABEL = "Depth (m)";
    static final String X_LABEL_PREFIX = "Time in UTC (hour:min)";
    static final String RANGE_SEPARATOR = "_to_";

    private double[] threshold;     /* dB, [low, high] */
    private String colormap;
    private String[] title;         /* one or two lines */
    private String xLabel;
    private String yLabel;
    private String figureTarget;    /* image file name without extension */

    public EchogramDisplayOptions() {
        threshold = DEFAULT_THRESHOLD.clone();
        colormap = DEFAULT_COLORMAP;
        title = new String[0];
        xLabel = X_LABEL_PREFIX;
        yLabel = DEFAULT_Y_LABEL;
    }

    /**
     * Derives title, x label and figure target for an export.
     * <p>
     * A name like {@code A_to_B} gets the two title lines {@code "A to"} and {@code "B"}. The
     * x label carries the date of the pings, or the date range if they span several days.
     *
     * @param exportName the export's file name without extension
     * @param firstTime  the first ping time
     * @param lastTime   the last ping time
     */
    public static EchogramDisplayOptions forExport(String exportName, double firstTime, double lastTime) {
        final EchogramDisplayOptions options = new EchogramDisplayOptions();
        final int split = exportName.indexOf(RANGE_SEPARATOR);
        if (split >= 0) {
            options.setTitle(exportName.substring(0, split) + " to",
                             exportName.substring(split + RANGE_SEPARATOR.length()));
        } else {
            options.setTitle(exportName);
        }
        final String firstDate = PingTime.formatDate(firstTime);
        final String lastDate = PingTime.formatDate(lastTime);
        if (firstDate.equals(lastDate)) {
            options.setXLabel(X_LABEL_PREFIX + " " + firstDate);
        } else {
            options.setXLabel(X_LABEL_PREFIX + " " + firstDate + " to " + lastDate);
        }
        options.setFigureTarget(exportName);
        return options;
    }

    public double[] getThreshold() {
        return threshold.clone();
    }

    public void setThreshold(double low, double high) {
        if (!(low < high)) {
            throw new IllegalArgumentException("threshold: low >= high");
        }
        threshold = new double[]{low, high};
    }

    public String getColormap() {
        return colormap;
    }

    public void setColormap(String colormap) {
        this.colormap = colormap;
    }

    public String[] getTitle() {
        return title.clone();
    }

    public void setTitle(String... title) {
        this.title = title.clone();
    }

    public String getXLabel() {
        return xLabel;
    }

    public void setXLabel(String xLabel) {
        this.xLabel = xLabel;
    }

    public String getYLabel() {
        return yLabel;
    }

    public void setYLabel(String yLabel) {
        this.yLabel = yLabel;
    }

    public String getFigureTarget() {
        return figureTarget;
    }

    public void setFigureTarget(String figureTarget) {
        this.figureTarget = figureTarget;
    }

    @Override
    public String toString() {
        return "EchogramDisplayOptions{threshold=" + Arrays.toString(threshold) + ", colormap=" + colormap
               + ", title=" + Arrays.toString(title) + ", xLabel=" + xLabel + ", yLabel=" + yLabel
               + ", figureTarget=" + figureTarget + "}";
    }
}
