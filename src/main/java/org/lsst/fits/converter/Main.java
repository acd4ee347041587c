package org.lsst.fits.converter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.lsst.fits.converter.adjust.AdjustmentSettings;
import org.lsst.fits.converter.encode.OutputFormat;

/**
 * Command line converter. Example:
 * <pre>
 * java -jar fits-converter.jar --format tiff --brightness 1.2 --rotate 90 image1.fits image2.fits
 * </pre> The default output format can also be set with
 * <code>-Dorg.lsst.fits.converter.defaultFormat=tiff</code>.
 *
 * @author tonyj
 */
public class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static class Arguments {

        @Parameter(description = "FITS files to convert")
        private List<String> files = new ArrayList<>();

        @Parameter(names = {"-f", "--format"}, description = "Output format: png, tiff, jpg or bmp")
        private String format = System.getProperty("org.lsst.fits.converter.defaultFormat", "png");

        @Parameter(names = "--no-normalise", description = "Cast the data to 8 bits instead of stretching its range")
        private boolean noNormalise = false;

        @Parameter(names = "--brightness", description = "Brightness factor, 1.0 leaves the image unchanged")
        private double brightness = 1.0;

        @Parameter(names = "--contrast", description = "Contrast factor, 1.0 leaves the image unchanged")
        private double contrast = 1.0;

        @Parameter(names = "--rotate", description = "Counter-clockwise rotation in degrees")
        private double rotate = 0.0;

        @Parameter(names = {"-h", "--help"}, help = true, description = "Show help")
        private boolean help = false;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] argv, PrintStream out, PrintStream err) {
        Arguments args = new Arguments();
        JCommander jc = JCommander.newBuilder().programName("fits-convert").addObject(args).build();
        List<ConversionRequest> requests = new ArrayList<>();
        try {
            jc.parse(argv);
            if (args.help) {
                jc.usage();
                return EXIT_OK;
            }
            if (args.files.isEmpty()) {
                throw new ParameterException("No input files given");
            }
            OutputFormat format = OutputFormat.parse(args.format);
            AdjustmentSettings settings = new AdjustmentSettings(args.brightness, args.contrast, args.rotate);
            for (String file : args.files) {
                requests.add(new ConversionRequest(new File(file), format, !args.noNormalise, settings));
            }
        } catch (ParameterException | IllegalArgumentException x) {
            err.println(x.getMessage());
            jc.usage();
            return EXIT_USAGE;
        }

        List<ConversionResult> results = new FitsConverter().convert(requests, new ConversionListener() {
            @Override
            public void converted(ConversionResult result, int index, int total) {
                out.printf("[%d/%d] %s%n", index + 1, total, result);
            }

            @Override
            public void batchComplete(List<ConversionResult> batch) {
                long failed = batch.stream().filter(r -> !r.isSuccess()).count();
                out.printf("Converted %d of %d files%n", batch.size() - failed, batch.size());
            }
        });
        return results.stream().allMatch(ConversionResult::isSuccess) ? EXIT_OK : EXIT_FAILED;
    }
}
