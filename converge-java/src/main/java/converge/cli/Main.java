package converge.cli;

import converge.ast.AstPrinter;
import converge.config.ConvergeConfig;
import converge.diag.Diagnostic;
import converge.diag.DiagnosticFormatter;
import converge.io.CvirWriter;
import converge.pipeline.CompileResult;
import converge.pipeline.Compiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@code converge <command> <file>}. Exit status: 0 success, 1 diagnostics
 * reported, 2 usage or I/O error.
 */
public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_DIAGNOSTICS = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;

    Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new Main(System.out, System.err).run(args));
    }

    int run(String[] args) {
        String cmd = args.length == 0 ? "help" : args[0];
        switch (cmd) {
            case "check", "ast", "cvir" -> { }
            case "help", "-h", "--help" -> {
                usage(out);
                return EXIT_OK;
            }
            default -> {
                err.println("error: unknown command '" + cmd + "'");
                usage(err);
                return EXIT_USAGE;
            }
        }
        if (args.length < 2 || (args.length > 2 && !cmd.equals("cvir")) || args.length > 3) {
            err.println("error: expected a file path");
            usage(err);
            return EXIT_USAGE;
        }

        Path input = Path.of(args[1]);
        String source;
        try {
            source = Files.readString(input);
        } catch (IOException e) {
            err.println("error: failed to read '" + input + "': " + e.getMessage());
            return EXIT_USAGE;
        }
        log.info("Read {} ({} chars)", input, source.length());

        ConvergeConfig config;
        try {
            config = ConvergeConfig.load();
        } catch (IllegalArgumentException e) {
            err.println("error: bad configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
        Compiler compiler = new Compiler(config);

        CompileResult result = switch (cmd) {
            case "cvir" -> compiler.compile(source);
            default -> compiler.check(source);
        };
        if (!result.isSuccess()) {
            for (Diagnostic d : result.diagnostics()) err.print(DiagnosticFormatter.format(source, d));
            err.println(result.diagnostics().size() + " error(s) in " + input);
            return EXIT_DIAGNOSTICS;
        }
        log.info("{}: {} items, no diagnostics", input, result.program().items().size());

        switch (cmd) {
            case "ast" -> out.print(AstPrinter.print(result.program()));
            case "cvir" -> {
                if (args.length == 3) {
                    Path output = Path.of(args[2]);
                    try {
                        CvirWriter.write(output, result.document(), config.prettyPrint());
                    } catch (IOException e) {
                        err.println("error: failed to write '" + output + "': " + e.getMessage());
                        return EXIT_USAGE;
                    }
                    log.info("Wrote {}", output);
                } else {
                    out.print(CvirWriter.toJson(result.document(), config.prettyPrint()));
                }
            }
            default -> out.println("ok: " + input);
        }
        return EXIT_OK;
    }

    private static void usage(PrintStream ps) {
        ps.println("""
                converge - network description language front-end

                USAGE:
                  converge <command> <file>

                COMMANDS:
                  check <file>              Parse and validate a source file
                  ast   <file>              Print the parsed program in canonical form
                  cvir  <file> [out.json]   Emit the CVIR document (stdout by default)
                  help                      Show this help

                Settings come from converge.properties; override with -Dconverge.cvir.pretty=false,
                -Dconverge.run.default-step="1 ms", -Dconverge.run.default-seed=0.
                """);
    }
}
