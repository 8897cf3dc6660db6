package ou.capstone.sunseat;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.sunseat.airport.AeroDataBoxClient;
import ou.capstone.sunseat.airport.Airport;
import ou.capstone.sunseat.airport.AirportDirectory;
import ou.capstone.sunseat.airport.AirportResolver;
import ou.capstone.sunseat.airport.CachingAirportResolver;
import ou.capstone.sunseat.print.ResultJsonWriter;
import ou.capstone.sunseat.route.GeoPoint;
import ou.capstone.sunseat.scoring.SeatScorer;
import ou.capstone.sunseat.sun.SubSolarPointCalculator;

/**
 * Command line driver for SunSeat.
 *
 * Modes:
 * - seat recommendation (--from, --to, --date, --time, --duration, optional --preference)
 * - sub-solar point (--subsolar with --date and --time)
 * - airport lookup (--airport CODE) and search (--search QUERY)
 *
 * Results are printed as JSON on stdout.
 */
public final class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static ExitHandler exitHandler = new ExitHandler();

    public static void setExitHandler( final ExitHandler exitHandler )
    {
        App.exitHandler = exitHandler;
    }

    private App() {
        // Prevent instantiation
    }

    public static void main(final String[] args) throws ParseException {
        // Required options are checked by hand after the help case, otherwise
        // `--help` alone would be rejected for missing --from/--to.
        final Option fromOption = Option.builder("f")
                .longOpt("from").hasArg()
                .desc("Origin airport IATA code").get();
        final Option toOption = Option.builder("t")
                .longOpt("to").hasArg()
                .desc("Destination airport IATA code").get();
        final Option dateOption = Option.builder()
                .longOpt("date").hasArg()
                .desc("Departure date in UTC, yyyy-MM-dd").get();
        final Option timeOption = Option.builder()
                .longOpt("time").hasArg()
                .desc("Departure time in UTC, HH:mm").get();
        final Option durationOption = Option.builder()
                .longOpt("duration").hasArg()
                .desc("Flight duration in minutes").get();
        final Option preferenceOption = Option.builder("p")
                .longOpt("preference").hasArg()
                .desc("What you want to see: 'sunrise', 'sunset' or 'none' (default: sunrise)").get();
        final Option subsolarOption = Option.builder()
                .longOpt("subsolar")
                .desc("Print the sub-solar point for --date and --time").get();
        final Option airportOption = Option.builder()
                .longOpt("airport").hasArg()
                .desc("Print details for one airport code").get();
        final Option searchOption = Option.builder()
                .longOpt("search").hasArg()
                .desc("List airports whose IATA code contains the query").get();
        final Option helpOption = Option.builder("h").longOpt("help")
                .desc("Display help").get();

        final Options options = new Options();
        options.addOption( fromOption );
        options.addOption( toOption );
        options.addOption( dateOption );
        options.addOption( timeOption );
        options.addOption( durationOption );
        options.addOption( preferenceOption );
        options.addOption( subsolarOption );
        options.addOption( airportOption );
        options.addOption( searchOption );
        options.addOption( helpOption );

        final CommandLineParser cliParser = new DefaultParser();
        final CommandLine line;
        try {
            line = cliParser.parse(options, args);
        } catch (final ParseException e) {
            logger.error("Parsing args failed for reason: {}", e.getMessage());
            throw e;
        }

        if (line.hasOption(helpOption) || line.getOptions().length == 0) {
            HelpFormatter helpFormatter = HelpFormatter.builder().get();
            helpFormatter.printHelp("sunseat",
                    "Window seat recommendation for sunrise and sunset views", options,
                    "Dates and times are UTC.",
                    true);
            exitHandler.exit(0);
            return;
        }

        // Check the chosen mode's options before reading any configuration
        final boolean lookupMode = line.hasOption(airportOption) || line.hasOption(searchOption);
        final boolean subsolarMode = !lookupMode && line.hasOption(subsolarOption);
        SeatQuery query = null;
        if (subsolarMode) {
            requireOptions(line, dateOption, timeOption);
        } else if (!lookupMode) {
            requireOptions(line, fromOption, toOption, dateOption, timeOption, durationOption);
            query = new SeatQuery(
                    line.getOptionValue(fromOption),
                    line.getOptionValue(toOption),
                    line.getOptionValue(dateOption),
                    line.getOptionValue(timeOption),
                    parseDuration(line.getOptionValue(durationOption)),
                    line.getOptionValue(preferenceOption));
        }

        final AirportResolver resolver;
        final SeatRecommendationService service;
        try {
            final SunSeatConfig config = SunSeatConfig.fromEnvironment();
            resolver = buildResolver(config);
            service = buildService(resolver);
        } catch (final IllegalStateException e) {
            logger.error("Configuration error: {}", e.getMessage());
            System.err.println("\nConfiguration Error: " + e.getMessage());
            exitHandler.exit(1);
            return;
        }

        final ResultJsonWriter writer = new ResultJsonWriter();

        if (lookupMode) {
            if (line.hasOption(airportOption)) {
                final String code = line.getOptionValue(airportOption);
                final Optional<Airport> airport = resolver.lookup(code);
                if (airport.isEmpty()) {
                    System.out.println(writer.error("not found"));
                    exitHandler.exit(1);
                    return;
                }
                System.out.println(writer.airport(airport.get()));
            } else {
                final List<Airport> found = resolver.search(line.getOptionValue(searchOption));
                System.out.println(writer.airports(found));
            }
            return;
        }

        if (subsolarMode) {
            final Optional<GeoPoint> point = service.subsolar(
                    line.getOptionValue(dateOption), line.getOptionValue(timeOption));
            if (point.isEmpty()) {
                System.out.println(writer.error("invalid datetime"));
                exitHandler.exit(1);
                return;
            }
            System.out.println(writer.subsolar(point.get()));
            return;
        }

        final SeatResponse response = service.respond(query);
        System.out.println(writer.recommendation(response));
        if (!response.result().isOk()) {
            logger.error("No recommendation: {}", response.result().message());
            exitHandler.exit(1);
        }
    }

    static AirportResolver buildResolver(final SunSeatConfig config) {
        logger.debug("Using {}", config);
        final AirportDirectory directory = AirportDirectory.fromClasspath(config.airportResource());
        final AeroDataBoxClient remote = config.remoteLookupEnabled() ? new AeroDataBoxClient(config) : null;
        return new CachingAirportResolver(directory, remote);
    }

    static SeatRecommendationService buildService(final AirportResolver resolver) {
        final SubSolarPointCalculator sun = new SubSolarPointCalculator();
        return new SeatRecommendationService(resolver, new SeatScorer(sun), sun);
    }

    private static void requireOptions(final CommandLine line, final Option... required) throws ParseException {
        final List<String> missing = new ArrayList<>();
        for (Option o : required) {
            if (!line.hasOption(o)) {
                missing.add("--" + o.getLongOpt());
            }
        }
        if (!missing.isEmpty()) {
            throw new ParseException("Invalid options: missing " + String.join(", ", missing));
        }
    }

    private static int parseDuration(final String raw) throws ParseException {
        try {
            return Integer.parseInt(raw.trim());
        } catch (final NumberFormatException e) {
            throw new ParseException("Invalid options: --duration must be a whole number of minutes, got '" + raw + "'");
        }
    }

    public static class ExitHandler
    {
        public void exit( final int code )
        {
            System.exit( code );
        }
    }
}
