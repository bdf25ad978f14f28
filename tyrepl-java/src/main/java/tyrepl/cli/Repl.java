package tyrepl.cli;

import com.google.common.flogger.FluentLogger;
import tyrepl.TyReplException;
import tyrepl.infer.ReportOrder;
import tyrepl.infer.TypeInference;
import tyrepl.print.AstPrinter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Reads expressions line by line and prints the inferred variable types. A failing line
 * prints one diagnostic to {@code err} and the loop goes on.
 */
public final class Repl {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    static final String QUIT = ":quit";

    private final TypeInference inference = new TypeInference();
    private final AstPrinter printer = new AstPrinter();
    private final ReplOptions options;
    private final PrintStream out;
    private final PrintStream err;

    public Repl(ReplOptions options, PrintStream out, PrintStream err) {
        this.options = options;
        this.out = out;
        this.err = err;
    }

    /** Runs until end of input or {@value #QUIT}. Returns the number of lines that failed. */
    public int run(BufferedReader in) throws IOException {
        int failures = 0;
        while (true) {
            out.print(options.prompt());
            out.flush();
            String line = in.readLine();
            if (line == null || line.strip().equals(QUIT)) break;
            if (line.isBlank()) continue;
            if (!evaluate(line)) failures++;
        }
        return failures;
    }

    /** Infers one line; returns false if it failed. */
    public boolean evaluate(String line) {
        try {
            var analysis = inference.analyze(line);
            if (options.showAst()) {
                out.println(printer.print(analysis.ast()));
            }
            ReportOrder order = options.order();
            for (String entry : analysis.report().lines(order)) {
                out.println(entry);
            }
            return true;
        } catch (TyReplException e) {
            logger.atFine().withCause(e).log("rejected line: %s", line);
            err.println(e.diagnostic());
            return false;
        }
    }
}
