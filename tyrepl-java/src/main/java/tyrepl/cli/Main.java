package tyrepl.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Main {

    // held strongly so the level set by --verbose is not lost to GC
    private static final Logger PIPELINE_LOGGER = Logger.getLogger("tyrepl");

    private Main() {}

    public static void main(String[] args) throws IOException {
        ReplOptions options = new ReplOptions();
        JCommander jc = JCommander.newBuilder()
                .programName("tyrepl")
                .addObject(options)
                .build();
        try {
            jc.parse(args);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            jc.usage();
            System.exit(2);
        }
        if (options.help()) {
            jc.usage();
            return;
        }
        if (options.verbose()) {
            enableFineLogging();
        }

        Repl repl = new Repl(options, System.out, System.err);

        if (options.expression() != null) {
            System.exit(repl.evaluate(options.expression()) ? 0 : 1);
        }

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        repl.run(in);
    }

    private static void enableFineLogging() {
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        PIPELINE_LOGGER.addHandler(handler);
        PIPELINE_LOGGER.setLevel(Level.FINE);
    }
}
