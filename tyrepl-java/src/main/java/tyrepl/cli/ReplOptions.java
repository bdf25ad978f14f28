package tyrepl.cli;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import tyrepl.infer.ReportOrder;

import java.util.Locale;

/** Command-line configuration of the shell. */
public class ReplOptions {

    @Parameter(
            names = {"-e", "--expr"},
            description = "Infer a single expression and exit instead of starting the loop")
    private String expression;

    @Parameter(
            names = "--order",
            description = "Report ordering: sorted (by name) or appearance (first occurrence)",
            converter = OrderConverter.class)
    private ReportOrder order = ReportOrder.SORTED;

    @Parameter(names = "--show-ast", description = "Print the parsed expression before its types")
    private boolean showAst = false;

    @Parameter(names = "--prompt", description = "Prompt printed before each line")
    private String prompt = "> ";

    @Parameter(names = "--no-prompt", description = "Do not print a prompt")
    private boolean noPrompt = false;

    @Parameter(names = {"-v", "--verbose"}, description = "Log every pipeline stage")
    private boolean verbose = false;

    @Parameter(names = {"-h", "--help"}, description = "Print usage", help = true)
    private boolean help = false;

    public String expression() {
        return expression;
    }

    public ReportOrder order() {
        return order;
    }

    public boolean showAst() {
        return showAst;
    }

    public String prompt() {
        return noPrompt ? "" : prompt;
    }

    public boolean verbose() {
        return verbose;
    }

    public boolean help() {
        return help;
    }

    public static class OrderConverter implements IStringConverter<ReportOrder> {
        @Override
        public ReportOrder convert(String value) {
            try {
                return ReportOrder.valueOf(value.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ParameterException("--order must be 'sorted' or 'appearance', got '" + value + "'");
            }
        }
    }
}
