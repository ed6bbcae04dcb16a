package com.astrometry.main;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;

import java.util.ArrayList;
import java.util.List;

/**
 * Command line parameters for {@link AstrometryTool}.
 */
@Parameters
public class AstrometryToolParameters {

    @Parameter(names = "--help", description = "Display this note", help = true)
    public boolean help;

    @Parameter(names = "--image", description = "FITS image to measure (repeat for several images)", required = true)
    public List<String> images = new ArrayList<>();

    @Parameter(names = "--x", description = "Initial region center x (0-based pixel)", required = true)
    public Double x;

    @Parameter(names = "--y", description = "Initial region center y (0-based pixel)", required = true)
    public Double y;

    @Parameter(names = "--method", description = "Centering method: none, peak or '2D Gaussian' (default is the best available)")
    public String method;

    @Parameter(names = "--width", description = "Region width in pixels")
    public double width = 7;

    @Parameter(names = "--height", description = "Region height in pixels")
    public double height = 7;

    @Parameter(names = "--target", description = "Target name for the report")
    public String target = "";

    @Parameter(names = "--date", description = "Observation date for the report")
    public String date = "";

    @Parameter(names = "--location", description = "Observer location for the report")
    public String location = "";

    @Parameter(names = "--out", description = "Report file (ECSV)", required = true)
    public String out;

    private transient JCommander jCommander;

    /**
     * @return false when usage was printed instead (help requested or bad arguments)
     */
    public boolean parse(String[] args) {
        jCommander = new JCommander(this);
        jCommander.setProgramName("java -jar astrometry-suite.jar");

        boolean parseFailed = true;
        try {
            jCommander.parse(args);
            parseFailed = false;
        } catch (ParameterException pe) {
            jCommander.getConsole().println("\nERROR: failed to parse command line arguments\n\n" + pe.getMessage());
        }

        if (help || parseFailed) {
            jCommander.getConsole().println("");
            jCommander.usage();
            return false;
        }
        return true;
    }
}
