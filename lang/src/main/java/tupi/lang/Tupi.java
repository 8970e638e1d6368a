package tupi.lang;

import static lombok.AccessLevel.PRIVATE;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor(access = PRIVATE)
public class Tupi {

    private static final Logger log = LoggerFactory.getLogger(Tupi.class);

    private static final String QUIT = ":q";

    public static void main(String[] args) throws IOException {
        int exitCode;
        Options options;
        try {
            options = Options.fromProperties(System.getProperties());
        } catch (IllegalArgumentException ex) {
            System.err.println("tupi: " + ex.getMessage());
            System.exit(64);
            return;
        }

        // sources and console input are UTF-8 whatever the platform default
        var stdout = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        var stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        var interpreter = new Interpreter(new ConsoleBuiltins(stdout, stdin).asTable(), options);

        if (args.length > 1) {
            stdout.println("Usage: tupi [script]");
            exitCode = 64;
        } else if (args.length == 1) {
            exitCode = runFile(args[0], interpreter, options, stdout);
        } else {
            exitCode = runPrompt(stdin, interpreter, options, stdout);
        }
        System.exit(exitCode);
    }

    /**
     * Runs a UTF-8 script. {@code -} reads the script from standard input.
     */
    static int runFile(String path, Interpreter interpreter, Options options, PrintStream out) throws IOException {
        byte[] bytes;
        if ("-".equals(path)) {
            bytes = System.in.readAllBytes();
        } else {
            bytes = Files.readAllBytes(Paths.get(path));
        }

        log.debug("running {} ({} bytes)", path, bytes.length);
        return run(new String(bytes, StandardCharsets.UTF_8), interpreter, options, new Flags(), out, false);
    }

    /**
     * Reads lines until {@value #QUIT} or end of input. Lines starting with {@code :} are commands, anything
     * else is buffered until its parentheses balance and then run against the shared interpreter.
     */
    static int runPrompt(BufferedReader in, Interpreter interpreter, Options options, PrintStream out)
            throws IOException {
        var buffer = new LineBuffer();
        var flags = new Flags();
        for (;;) {
            out.print(String.format(":%02d> ", buffer.size()));
            out.flush();
            var line = in.readLine();

            if (line == null || QUIT.equals(line.trim())) {
                return 0;
            }
            if (line.startsWith(":")) {
                command(line, buffer, flags, out);
            } else if (!line.isBlank()) {
                buffer.add(line).ifPresent(source -> run(source, interpreter, options, flags, out, true));
            }
        }
    }

    private static void command(String line, LineBuffer buffer, Flags flags, PrintStream out) {
        var parts = line.trim().split("\\s+", 2);
        var arg = parts.length > 1 ? parts[1] : "";
        switch (parts[0]) {
        case ":b":
            var n = 0;
            for (var l : buffer.lines()) {
                out.println(String.format("%02d  %s", ++n, l));
            }
            break;
        case ":tok":
            if (!arg.isEmpty()) {
                flags.printTokens = Boolean.parseBoolean(arg);
            }
            out.println("print tokens: " + flags.printTokens);
            break;
        case ":ast":
            if (!arg.isEmpty()) {
                flags.printAst = Boolean.parseBoolean(arg);
            }
            out.println("print ast: " + flags.printAst);
            break;
        default:
            out.println("unknown command: " + parts[0]);
        }
    }

    /**
     * Runs one chunk of source through the whole pipeline. In REPL mode a result other than {@code Vazio} is
     * echoed to {@code out}.
     *
     * @return the process exit code for this chunk
     */
    static int run(String source, Interpreter interpreter, Options options, Flags flags, PrintStream out,
            boolean isRepl) {
        List<Token> tokens;
        try {
            tokens = new Scanner(source).getTokens();
        } catch (ScanErrorException ex) {
            report(ex);
            return 1;
        }

        if (flags.printTokens) {
            tokens.forEach(out::println);
        }

        Program program;
        try {
            program = new Parser(new TokenStream(tokens), options).parse();
        } catch (ParseErrorException ex) {
            report(ex);
            return 1;
        }

        if (flags.printAst) {
            program.statements().forEach(out::println);
        }

        try {
            var result = interpreter.interpret(program);
            if (isRepl && result != Value.none()) {
                out.println(result.render());
            }
        } catch (RuntimeErrorException ex) {
            report(ex);
            return 1;
        }

        return 0;
    }

    private static void report(ScanErrorException error) {
        System.err.println("scanner: " + error.getMessage() + " [line " + error.getLine() + ", col " + error.getColumn() + "]");
    }

    private static void report(ParseErrorException error) {
        var token = error.getToken();
        System.err.println("parser: " + error.getMessage() + " [line " + token.line() + ", col " + token.column() + "]");
    }

    private static void report(RuntimeErrorException error) {
        System.err.println("interpreter: " + error.getMessage());
    }

    private static int countUnmatchedParens(String line) {
        List<Token> tokens;
        try {
            tokens = new Scanner(line).getTokens();
        } catch (ScanErrorException ex) {
            // run() reports it once the buffer is flushed
            return 0;
        }

        int count = 0;
        for (var token : tokens) {
            if (token.type() == Token.Type.PAREN_LEFT) {
                count++;
            } else if (token.type() == Token.Type.PAREN_RIGHT) {
                count--;
            }
        }
        return count;
    }

    static class Flags {
        boolean printTokens = false;
        boolean printAst = false;
    }

    /**
     * Prompt lines held back while a parenthesis is still open.
     */
    static final class LineBuffer {

        private final List<String> lines = new ArrayList<>();
        private int openParens = 0;

        /**
         * Adds a line. Once every parenthesis is closed, returns the buffered source and empties the buffer.
         */
        Optional<String> add(String line) {
            lines.add(line);
            openParens += countUnmatchedParens(line);
            if (openParens > 0) {
                return Optional.empty();
            }

            var source = String.join("\n", lines);
            lines.clear();
            openParens = 0;
            return Optional.of(source);
        }

        int size() {
            return lines.size();
        }

        List<String> lines() {
            return Collections.unmodifiableList(lines);
        }
    }
}
