package ai.callflow;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import ai.callflow.graph.CallGraph;
import ai.callflow.io.GraphWriter;
import ai.callflow.render.DiagramResult;
import ai.callflow.render.RenderOptions;
import ai.callflow.scan.SourceParseException;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream stdout, PrintStream stderr) {
        Path sourceFile = null;
        Path outFile = null;
        Path ignoreFile = null;
        String method = null;
        String format = "mermaid";
        boolean collapse = false;
        boolean sourceRef = false;
        final Set<String> ignoredServices = new LinkedHashSet<>(RenderOptions.DEFAULT_IGNORED_SERVICES);
        final Set<String> ignoredVariables = new LinkedHashSet<>();

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage(stdout);
                    return 0;
                }
                if (arg.startsWith("--method=")) {
                    final String m = arg.substring("--method=".length()).trim();
                    method = m.isEmpty() ? null : m;
                    continue;
                }
                if (arg.startsWith("--ignoreServices=")) {
                    addList(arg.substring("--ignoreServices=".length()), ignoredServices);
                    continue;
                }
                if (arg.startsWith("--ignoreVariables=")) {
                    addList(arg.substring("--ignoreVariables=".length()), ignoredVariables);
                    continue;
                }
                if (arg.startsWith("--ignoreFile=")) {
                    ignoreFile = Paths.get(arg.substring("--ignoreFile=".length()));
                    continue;
                }
                if (arg.startsWith("--collapse=")) {
                    collapse = Boolean.parseBoolean(arg.substring("--collapse=".length()));
                    continue;
                }
                if (arg.startsWith("--sourceRef=")) {
                    sourceRef = Boolean.parseBoolean(arg.substring("--sourceRef=".length()));
                    continue;
                }
                if (arg.startsWith("--format=")) {
                    format = arg.substring("--format=".length()).trim().toLowerCase(Locale.ROOT);
                    continue;
                }
                if (arg.startsWith("--out=")) {
                    outFile = Paths.get(arg.substring("--out=".length()));
                    continue;
                }
                if (arg.startsWith("--")) {
                    stderr.println("ERROR: unknown argument: " + arg);
                    printUsage(stderr);
                    return 2;
                }
                if (sourceFile == null) {
                    sourceFile = Paths.get(arg);
                    continue;
                }
                stderr.println("ERROR: unexpected argument: " + arg);
                printUsage(stderr);
                return 2;
            }

            if (sourceFile == null) {
                stderr.println("ERROR: no source file given");
                printUsage(stderr);
                return 2;
            }
            if (!"mermaid".equals(format) && !"json".equals(format) && !"tree".equals(format)) {
                stderr.println("ERROR: unknown format: " + format);
                return 2;
            }
            if (!Files.isRegularFile(sourceFile)) {
                throw new IOException("Source file not found: " + sourceFile);
            }
            if (ignoreFile != null) {
                loadIgnoreFile(ignoreFile, ignoredServices);
            }

            final String source = Files.readString(sourceFile, StandardCharsets.UTF_8);
            final RenderOptions options = RenderOptions.none()
                    .withIgnoredServices(ignoredServices)
                    .withIgnoredVariables(ignoredVariables)
                    .withCollapseDetails(collapse)
                    .withSourceReference(sourceRef);

            final CallFlowAnalyzer analyzer = new CallFlowAnalyzer();
            final CallGraph graph = analyzer.parse(source);
            final DiagramResult diagram = analyzer.render(graph, method, options);

            if (method != null && !graph.nodes().containsKey(method)) {
                stderr.println("WARN: method not found: " + method + ", rendering public and protected methods");
            }

            final String output = switch (format) {
                case "json" -> new GraphWriter().toJson(graph, diagram);
                case "tree" -> analyzer.callTree(graph, method);
                default -> diagram.diagramText();
            };

            if (outFile == null) {
                stdout.print(output);
                stdout.flush();
            } else {
                final Path parent = outFile.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(outFile, output, StandardCharsets.UTF_8);
                stdout.println("Output written to: " + outFile);
                stdout.println("Methods: " + graph.nodes().size()
                        + ", external services: " + String.join(", ", diagram.externalServices()));
            }
            return 0;
        } catch (IOException ex) {
            stderr.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (SourceParseException ex) {
            stderr.println("ERROR: " + safeMsg(ex.getMessage()));
            return 1;
        } catch (Exception ex) {
            stderr.println("ERROR: failed to analyze source: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static void addList(String list, Set<String> target) {
        final String trimmed = list.trim();
        if (!trimmed.isEmpty()) {
            Arrays.stream(trimmed.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(target::add);
        }
    }

    private static void loadIgnoreFile(Path file, Set<String> ignoredServices) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Ignore file not found: " + file);
        }
        try (var br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                String trimmed = line.trim();
                final int hash = trimmed.indexOf('#');
                if (hash >= 0) {
                    trimmed = trimmed.substring(0, hash).trim();
                }
                if (trimmed.isEmpty()) {
                    continue;
                }
                for (String token : trimmed.split("[,\\s]+")) {
                    final String t = token.trim();
                    if (!t.isEmpty()) {
                        ignoredServices.add(t);
                    }
                }
            }
        }
    }

    private static void printUsage(PrintStream ps) {
        ps.println("Usage: callflow <File.java> [options]");
        ps.println("Options:");
        ps.println("  --method=<name>             Render a single method (default: public and protected methods)");
        ps.println("  --ignoreServices=<a,b>      External receivers to hide (System.out, System.err always hidden)");
        ps.println("  --ignoreVariables=<a,b>     Variables whose calls are hidden");
        ps.println("  --ignoreFile=<path>         File with service names to hide (one per line or comma-separated)");
        ps.println("  --collapse=<bool>           One node per method instead of full flows (default: false)");
        ps.println("  --sourceRef=<bool>          Append (L<line>) to node labels (default: false)");
        ps.println("  --format=<mermaid|json|tree> Output format (default: mermaid)");
        ps.println("  --out=<path>                Output file (default: stdout)");
        ps.println("  --help, -h                  Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
