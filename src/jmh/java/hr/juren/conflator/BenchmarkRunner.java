package hr.juren.conflator;

import org.openjdk.jmh.results.format.ResultFormatType;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.ChainedOptionsBuilder;
import org.openjdk.jmh.runner.options.CommandLineOptionException;
import org.openjdk.jmh.runner.options.CommandLineOptions;
import org.openjdk.jmh.runner.options.OptionsBuilder;

/**
 * Runs the conflator benchmarks. Accepts the usual JMH command line, e.g.
 * {@code ".*Write" -p keys=1024}; without a benchmark pattern every benchmark
 * in this package runs.
 */
public class BenchmarkRunner {

    private static final String DEFAULT_INCLUDE = "hr\\.juren\\.conflator\\..*Benchmark.*";

    public static void main(String[] args) throws RunnerException, CommandLineOptionException {
        var cli = new CommandLineOptions(args);
        ChainedOptionsBuilder options = new OptionsBuilder()
                .parent(cli)
                .resultFormat(cli.getResultFormat().orElse(ResultFormatType.JSON))
                .result(cli.getResult().orElse("jmh-result.json"));
        if (cli.getIncludes().isEmpty()) {
            options.include(DEFAULT_INCLUDE);
        }

        new Runner(options.build()).run();
    }
}
